package org.dxworks.pageframe.model;

public class ConversionOptions {
    public static final int DEFAULT_MIN_CONFIDENCE = 60;

    public final PageBuilder targetBuilder;
    public final boolean preserveCustomCSS;
    public final boolean includeResponsive;
    public final boolean includeAnimations;
    public final boolean optimizeAssets;
    public final int minConfidence; // 0-100
    public final boolean fallbackToHTML;

    public ConversionOptions(PageBuilder targetBuilder,
                             boolean preserveCustomCSS,
                             boolean includeResponsive,
                             boolean includeAnimations,
                             boolean optimizeAssets,
                             int minConfidence,
                             boolean fallbackToHTML) {
        if (targetBuilder == null) {
            throw new IllegalArgumentException("targetBuilder must not be null");
        }
        this.targetBuilder = targetBuilder;
        this.preserveCustomCSS = preserveCustomCSS;
        this.includeResponsive = includeResponsive;
        this.includeAnimations = includeAnimations;
        this.optimizeAssets = optimizeAssets;
        this.minConfidence = Math.max(0, Math.min(100, minConfidence));
        this.fallbackToHTML = fallbackToHTML;
    }

    public static ConversionOptions defaults(PageBuilder targetBuilder) {
        return new ConversionOptions(targetBuilder, true, true, false, true, DEFAULT_MIN_CONFIDENCE, true);
    }

    public ConversionOptions withTarget(PageBuilder builder) {
        return new ConversionOptions(builder, preserveCustomCSS, includeResponsive, includeAnimations,
                optimizeAssets, minConfidence, fallbackToHTML);
    }

    public ConversionOptions withMinConfidence(int confidence) {
        return new ConversionOptions(targetBuilder, preserveCustomCSS, includeResponsive, includeAnimations,
                optimizeAssets, confidence, fallbackToHTML);
    }

    public ConversionOptions withFallbackToHtml(boolean fallback) {
        return new ConversionOptions(targetBuilder, preserveCustomCSS, includeResponsive, includeAnimations,
                optimizeAssets, minConfidence, fallback);
    }

    public ConversionOptions withOptimizeAssets(boolean optimize) {
        return new ConversionOptions(targetBuilder, preserveCustomCSS, includeResponsive, includeAnimations,
                optimize, minConfidence, fallbackToHTML);
    }
}
