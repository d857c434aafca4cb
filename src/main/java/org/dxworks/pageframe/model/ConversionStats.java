package org.dxworks.pageframe.model;

public class ConversionStats {
    public int totalElements;
    public int recognizedComponents;
    public int nativeWidgets;  // converted to native builder widgets
    public int htmlFallbacks;  // fell back to an HTML widget
    public int manualReview;   // need manual review
    public int confidenceAverage;
    public long conversionTime; // ms
}
