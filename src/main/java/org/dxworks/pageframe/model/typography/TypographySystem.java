package org.dxworks.pageframe.model.typography;

import java.util.List;

public class TypographySystem {
    public final List<FontFamily> fontFamilies;
    public final TypeScale typeScale;
    public final TextStyles textStyles;
    public final GlobalTypographySettings globalSettings;
    public final TypographyStatistics statistics;
    public final List<ElementorGlobalFont> elementorGlobalFonts;

    public TypographySystem(List<FontFamily> fontFamilies, TypeScale typeScale, TextStyles textStyles,
                            GlobalTypographySettings globalSettings, TypographyStatistics statistics,
                            List<ElementorGlobalFont> elementorGlobalFonts) {
        this.fontFamilies = List.copyOf(fontFamilies);
        this.typeScale = typeScale;
        this.textStyles = textStyles;
        this.globalSettings = globalSettings;
        this.statistics = statistics;
        this.elementorGlobalFonts = List.copyOf(elementorGlobalFonts);
    }
}
