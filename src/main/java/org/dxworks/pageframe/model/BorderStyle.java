package org.dxworks.pageframe.model;

public class BorderStyle {
    public final String width;
    public final String style;
    public final String color;

    public BorderStyle(String width, String style, String color) {
        this.width = width;
        this.style = style;
        this.color = color;
    }
}
