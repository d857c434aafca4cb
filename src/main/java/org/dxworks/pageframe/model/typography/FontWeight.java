package org.dxworks.pageframe.model.typography;

public class FontWeight {
    public final String weight;
    public final String style;
    public final double usage; // percentage within the family

    public FontWeight(String weight, String style, double usage) {
        this.weight = weight;
        this.style = style;
        this.usage = usage;
    }
}
