package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.BoxSpacing;
import org.dxworks.pageframe.model.ExtractedStyles;
import org.dxworks.pageframe.model.design.ColorPalette;
import org.dxworks.pageframe.model.design.ColorToken;
import org.dxworks.pageframe.model.design.DesignTokens;
import org.dxworks.pageframe.model.design.SpacingToken;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Collects the page color palette and spacing scale.
 */
public class DesignTokenExtractor {

    private static final String DEFAULT_TEXT = "#000000";
    private static final String DEFAULT_BACKGROUND = "#ffffff";
    private static final String[] SPACING_NAMES = {"xs", "sm", "md", "lg", "xl", "2xl", "3xl", "4xl"};

    public DesignTokens extract(List<AnalyzedElement> elements) {
        Map<String, Integer> textColors = new LinkedHashMap<>();
        Map<String, Integer> backgroundColors = new LinkedHashMap<>();
        Map<String, Integer> allColors = new LinkedHashMap<>();
        Map<Integer, Integer> spacing = new TreeMap<>();

        for (AnalyzedElement element : elements) {
            ExtractedStyles styles = element.styles;
            count(styles.color(), textColors, allColors);
            count(styles.backgroundColor(), backgroundColors, allColors);
            count(styles.get("borderColor"), null, allColors);

            countSpacing(styles.margin, spacing);
            countSpacing(styles.padding, spacing);
            countSpacingValue(styles.get("gap"), spacing);
        }

        String text = mostUsed(textColors, DEFAULT_TEXT);
        String background = mostUsed(backgroundColors, DEFAULT_BACKGROUND);
        List<ColorToken> ranked = rank(allColors);
        List<String> brand = new ArrayList<>();
        for (ColorToken token : ranked) {
            if (!token.value.equals(text) && !token.value.equals(background) && Colors.isHex(token.value)) {
                brand.add(token.value);
            }
        }
        String primary = brand.size() > 0 ? brand.get(0) : text;
        String secondary = brand.size() > 1 ? brand.get(1) : background;
        String accent = brand.size() > 2 ? brand.get(2) : primary;

        List<SpacingToken> spacingTokens = new ArrayList<>();
        int index = 0;
        for (Map.Entry<Integer, Integer> entry : spacing.entrySet()) {
            String name = index < SPACING_NAMES.length ? SPACING_NAMES[index] : "space-" + (index + 1);
            spacingTokens.add(new SpacingToken(name, entry.getKey(), entry.getValue()));
            index++;
        }
        return new DesignTokens(new ColorPalette(primary, secondary, accent, text, background, ranked), spacingTokens);
    }

    private static void count(String color, Map<String, Integer> bucket, Map<String, Integer> all) {
        String normalized = Colors.normalize(color);
        if (normalized == null) {
            return;
        }
        if (bucket != null) {
            bucket.merge(normalized, 1, Integer::sum);
        }
        all.merge(normalized, 1, Integer::sum);
    }

    private static void countSpacing(BoxSpacing box, Map<Integer, Integer> spacing) {
        if (box == null) {
            return;
        }
        countSpacingValue(box.top, spacing);
        countSpacingValue(box.right, spacing);
        countSpacingValue(box.bottom, spacing);
        countSpacingValue(box.left, spacing);
    }

    private static void countSpacingValue(String value, Map<Integer, Integer> spacing) {
        OptionalDouble px = DimensionParser.toPixels(value);
        if (px.isPresent() && px.getAsDouble() > 0) {
            spacing.merge((int) Math.round(px.getAsDouble()), 1, Integer::sum);
        }
    }

    private static String mostUsed(Map<String, Integer> counts, String fallback) {
        return counts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(fallback);
    }

    private static List<ColorToken> rank(Map<String, Integer> counts) {
        List<ColorToken> tokens = new ArrayList<>();
        counts.forEach((value, usage) -> tokens.add(new ColorToken(value, usage)));
        tokens.sort(Comparator.comparingInt((ColorToken t) -> t.usage).reversed());
        return tokens;
    }
}
