package org.dxworks.pageframe.model;

public class ElementPosition {
    public static final ElementPosition ZERO = new ElementPosition(0, 0, 0, 0);

    public final double x;
    public final double y;
    public final double width;
    public final double height;

    public ElementPosition(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }
}
