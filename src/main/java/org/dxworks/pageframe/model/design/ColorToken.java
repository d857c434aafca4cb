package org.dxworks.pageframe.model.design;

public class ColorToken {
    public final String value; // normalized #rrggbb
    public final int usage;

    public ColorToken(String value, int usage) {
        this.value = value;
        this.usage = usage;
    }
}
