package org.dxworks.pageframe.model.validation;

public class VisualComparisonResult {
    public String viewport;
    public double similarityScore; // 0-100
    public long pixelDifference;
    public long totalPixels;
    public double diffPercentage;
    public ComparisonMetrics comparisonMetrics = new ComparisonMetrics();
    public int originalWidth;
    public int originalHeight;
    public int convertedWidth;
    public int convertedHeight;
    public boolean dimensionsMatch;
}
