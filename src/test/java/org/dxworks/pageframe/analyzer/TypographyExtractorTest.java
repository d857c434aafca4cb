package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.ConversionPipeline;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.typography.TypographySystem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.pageframe.dom.DomNode.element;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypographyExtractorTest {

    private static TypographySystem typographyOf(DomNode root) {
        return new ConversionPipeline().analyze(root, 60).typography;
    }

    @Test
    void typeScale_baseAndRatioFromDistinctSizes() {
        TypographySystem typography = typographyOf(element("div").child(
                element("p").text("Body").style("font-size", "16px").style("font-family", "'Inter', sans-serif"),
                element("h2").text("Sub").style("font-size", "20px").style("font-family", "Poppins"),
                element("h1").text("Title").style("font-size", "25px").style("font-family", "Poppins")));

        assertEquals(16, typography.typeScale.base);
        assertEquals(1.25, typography.typeScale.ratio);
        assertEquals(25, typography.typeScale.headingSizes.get("h1"));
        assertEquals(List.of("Poppins", "Inter"),
                typography.fontFamilies.stream().map(f -> f.name).toList());
        assertTrue(typography.fontFamilies.get(0).googleFont);
        assertEquals("Inter", typography.globalSettings.baseFontFamily);
        assertEquals("Poppins", typography.globalSettings.headingFontFamily);
    }

    @Test
    void headingStyle_isFirstInstanceOfTheTag() {
        TypographySystem typography = typographyOf(element("div").child(
                element("h1").text("First").style("font-size", "40px").style("color", "#111111"),
                element("h1").text("Second").style("font-size", "32px").style("color", "#222222"),
                element("h1").text("Third").style("font-size", "32px").style("color", "#222222")));

        assertEquals("40px", typography.textStyles.h1.fontSize);
        assertEquals("#111111", typography.textStyles.h1.color);
    }

    @Test
    void noFontDeclarations_fallsBackToDefaults() {
        TypographySystem typography = typographyOf(element("div").child(element("p").text("Plain")));

        assertEquals(16, typography.typeScale.base);
        assertEquals(1.25, typography.typeScale.ratio);
        assertTrue(typography.fontFamilies.isEmpty());
        assertEquals("16px", typography.textStyles.h2.fontSize);
    }

    @Test
    void scaleRatio_snapsToCanonicalRatio() {
        assertEquals(1.5, TypographyExtractor.scaleRatio(List.of(16, 24), 16));
        assertEquals(1.333, TypographyExtractor.scaleRatio(List.of(16, 21, 28), 16));
        assertEquals(1.25, TypographyExtractor.scaleRatio(List.of(12, 14), 16));
    }
}
