package org.dxworks.pageframe.dom;

public class DomRect {
    public double x;
    public double y;
    public double width;
    public double height;

    public DomRect() {
    }

    public DomRect(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }
}
