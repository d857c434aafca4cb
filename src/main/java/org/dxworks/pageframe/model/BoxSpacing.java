package org.dxworks.pageframe.model;

public class BoxSpacing {
    public final String top;
    public final String right;
    public final String bottom;
    public final String left;

    public BoxSpacing(String top, String right, String bottom, String left) {
        this.top = top;
        this.right = right;
        this.bottom = bottom;
        this.left = left;
    }

    public boolean isUniform() {
        return top.equals(right) && top.equals(bottom) && top.equals(left);
    }

    @Override
    public String toString() {
        return top + " " + right + " " + bottom + " " + left;
    }
}
