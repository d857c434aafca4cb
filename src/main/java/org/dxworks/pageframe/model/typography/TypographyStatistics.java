package org.dxworks.pageframe.model.typography;

public class TypographyStatistics {
    public final int totalFontFamilies;
    public final int totalFontSizes;
    public final int averageFontSize;
    public final String mostUsedFont;
    public final String mostUsedSize;
    public final boolean hasConsistentTypeScale;
    public final String typeScaleQuality; // excellent, good, fair, poor

    public TypographyStatistics(int totalFontFamilies, int totalFontSizes, int averageFontSize,
                                String mostUsedFont, String mostUsedSize, boolean hasConsistentTypeScale,
                                String typeScaleQuality) {
        this.totalFontFamilies = totalFontFamilies;
        this.totalFontSizes = totalFontSizes;
        this.averageFontSize = averageFontSize;
        this.mostUsedFont = mostUsedFont;
        this.mostUsedSize = mostUsedSize;
        this.hasConsistentTypeScale = hasConsistentTypeScale;
        this.typeScaleQuality = typeScaleQuality;
    }
}
