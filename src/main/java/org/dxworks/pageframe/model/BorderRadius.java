package org.dxworks.pageframe.model;

public class BorderRadius {
    public final String topLeft;
    public final String topRight;
    public final String bottomRight;
    public final String bottomLeft;

    public BorderRadius(String topLeft, String topRight, String bottomRight, String bottomLeft) {
        this.topLeft = topLeft;
        this.topRight = topRight;
        this.bottomRight = bottomRight;
        this.bottomLeft = bottomLeft;
    }

    public boolean isUniform() {
        return topLeft.equals(topRight) && topLeft.equals(bottomRight) && topLeft.equals(bottomLeft);
    }
}
