package org.dxworks.pageframe.model.typography;

public class GlobalTypographySettings {
    public final int baseFontSize; // px
    public final String baseFontFamily;
    public final double baseLineHeight;
    public final String baseColor;
    public final String headingFontFamily;
    public final int headingFontWeight;
    public final String headingColor;
    public final double headingLineHeight;

    public GlobalTypographySettings(int baseFontSize, String baseFontFamily, double baseLineHeight,
                                    String baseColor, String headingFontFamily, int headingFontWeight,
                                    String headingColor, double headingLineHeight) {
        this.baseFontSize = baseFontSize;
        this.baseFontFamily = baseFontFamily;
        this.baseLineHeight = baseLineHeight;
        this.baseColor = baseColor;
        this.headingFontFamily = headingFontFamily;
        this.headingFontWeight = headingFontWeight;
        this.headingColor = headingColor;
        this.headingLineHeight = headingLineHeight;
    }
}
