package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.model.RecognizedComponent;
import org.dxworks.pageframe.model.typography.ElementorGlobalFont;
import org.dxworks.pageframe.model.typography.FontContext;
import org.dxworks.pageframe.model.typography.FontFamily;
import org.dxworks.pageframe.model.typography.FontRole;
import org.dxworks.pageframe.model.typography.FontWeight;
import org.dxworks.pageframe.model.typography.GlobalTypographySettings;
import org.dxworks.pageframe.model.typography.TextStyle;
import org.dxworks.pageframe.model.typography.TextStyles;
import org.dxworks.pageframe.model.typography.TypeScale;
import org.dxworks.pageframe.model.typography.TypeSize;
import org.dxworks.pageframe.model.typography.TypographyStatistics;
import org.dxworks.pageframe.model.typography.TypographySystem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the page type system from the font declarations of all recognized
 * elements.
 */
public class TypographyExtractor {

    static final double[] CANONICAL_RATIOS = {1.125, 1.2, 1.25, 1.333, 1.414, 1.5, 1.618};
    static final double DEFAULT_RATIO = 1.25;
    static final int DEFAULT_BASE = 16;

    private static final Set<String> GOOGLE_FONTS = Set.of(
            "Roboto", "Open Sans", "Lato", "Montserrat", "Roboto Condensed",
            "Source Sans Pro", "Oswald", "Raleway", "PT Sans", "Merriweather",
            "Nunito", "Playfair Display", "Poppins", "Ubuntu", "Roboto Slab", "Inter");

    /**
     * @param components every recognized element of the page, in pre-order
     */
    public TypographySystem extract(List<RecognizedComponent> components) {
        return extract(components.stream().map(TypographyUsage.Sample::of).collect(TypographyUsage.collector()));
    }

    public TypographySystem extract(TypographyUsage usage) {
        List<FontFamily> fontFamilies = fontFamilies(usage);
        TypeScale typeScale = typeScale(usage);
        TextStyles textStyles = textStyles(usage);
        GlobalTypographySettings globalSettings = globalSettings(usage, fontFamilies, typeScale);
        TypographyStatistics statistics = statistics(usage);
        List<ElementorGlobalFont> globalFonts = elementorGlobalFonts(textStyles, globalSettings);
        return new TypographySystem(fontFamilies, typeScale, textStyles, globalSettings, statistics, globalFonts);
    }

    private List<FontFamily> fontFamilies(TypographyUsage usage) {
        int total = usage.totalFontDeclarations();
        List<FontFamily> families = new ArrayList<>();
        usage.fonts.forEach((name, font) -> {
            List<FontWeight> weights = new ArrayList<>();
            font.weights.forEach((weight, count) -> weights.add(new FontWeight(weight, "normal",
                    percent(count, font.count))));
            List<FontContext> contexts = new ArrayList<>();
            font.roles.forEach((role, roleUsage) ->
                    contexts.add(new FontContext(role, new ArrayList<>(roleUsage.components), roleUsage.count)));
            families.add(new FontFamily(name, weights, percent(font.count, total), contexts, isGoogleFont(name)));
        });
        // stable: equal usage keeps first-seen order
        families.sort(Comparator.comparingDouble((FontFamily f) -> f.usage).reversed());
        return families;
    }

    static boolean isGoogleFont(String name) {
        return GOOGLE_FONTS.stream().anyMatch(name::contains);
    }

    private TypeScale typeScale(TypographyUsage usage) {
        Map<String, Integer> headingSizes = new LinkedHashMap<>();
        usage.headingSizes.forEach((tag, sizes) ->
                headingSizes.put(tag, (int) Math.round(sizes.stream().mapToDouble(Double::doubleValue).average().orElse(DEFAULT_BASE))));

        if (usage.sizes.isEmpty()) {
            return new TypeScale(DEFAULT_BASE, DEFAULT_RATIO, List.of(), headingSizes);
        }

        int base = baseSize(usage);
        double ratio = scaleRatio(new ArrayList<>(usage.sizes.keySet()), base);
        int total = usage.totalSizeDeclarations();

        List<TypeSize> sizes = new ArrayList<>();
        usage.sizes.forEach((px, size) -> sizes.add(new TypeSize(
                sizeName(px, base),
                px,
                Math.round(px * 100.0 / base) / 100.0,
                percent(size.count, total),
                new ArrayList<>(size.contexts))));
        return new TypeScale(base, ratio, sizes, headingSizes);
    }

    /**
     * Most used size within 14..18px; the smaller size wins a tie.
     */
    static int baseSize(TypographyUsage usage) {
        Integer best = null;
        int bestCount = 0;
        for (Map.Entry<Integer, TypographyUsage.SizeUsage> entry : usage.sizes.entrySet()) {
            int px = entry.getKey();
            if (px >= 14 && px <= 18 && entry.getValue().count > bestCount) {
                best = px;
                bestCount = entry.getValue().count;
            }
        }
        return best != null ? best : DEFAULT_BASE;
    }

    /**
     * Averages the ratios between consecutive distinct sizes above the base and
     * snaps the average to the nearest canonical ratio. A single size above the
     * base is measured against the base itself.
     */
    static double scaleRatio(List<Integer> sortedSizes, int base) {
        List<Integer> aboveBase = new ArrayList<>();
        for (Integer size : sortedSizes) {
            if (size > base) {
                aboveBase.add(size);
            }
        }
        if (aboveBase.isEmpty()) {
            return DEFAULT_RATIO;
        }
        if (aboveBase.size() == 1) {
            return snapRatio(aboveBase.get(0) / (double) base);
        }

        double sum = 0;
        for (int i = 1; i < aboveBase.size(); i++) {
            sum += aboveBase.get(i) / (double) aboveBase.get(i - 1);
        }
        return snapRatio(sum / (aboveBase.size() - 1));
    }

    static double snapRatio(double ratio) {
        double closest = CANONICAL_RATIOS[0];
        for (double candidate : CANONICAL_RATIOS) {
            if (Math.abs(candidate - ratio) < Math.abs(closest - ratio)) {
                closest = candidate;
            }
        }
        return closest;
    }

    static String sizeName(int px, int base) {
        double ratio = px / (double) base;
        if (ratio <= 0.75) return "xs";
        if (ratio <= 0.875) return "sm";
        if (ratio <= 1.125) return "base";
        if (ratio <= 1.25) return "lg";
        if (ratio <= 1.5) return "xl";
        if (ratio <= 1.875) return "2xl";
        if (ratio <= 2.25) return "3xl";
        if (ratio <= 3) return "4xl";
        if (ratio <= 4) return "5xl";
        return "6xl";
    }

    /**
     * Each role style is the first element observed with the role's tag, not a
     * statistical average over all of them.
     */
    private TextStyles textStyles(TypographyUsage usage) {
        int total = usage.tagCounts.values().stream().mapToInt(Integer::intValue).sum();
        TextStyle body = styleFor(usage, total, "p");
        return new TextStyles(
                styleFor(usage, total, "h1"),
                styleFor(usage, total, "h2"),
                styleFor(usage, total, "h3"),
                styleFor(usage, total, "h4"),
                styleFor(usage, total, "h5"),
                styleFor(usage, total, "h6"),
                body,
                body,
                body,
                styleFor(usage, total, "button"),
                styleFor(usage, total, "small", "figcaption", "caption"),
                styleFor(usage, total, "a"));
    }

    private TextStyle styleFor(TypographyUsage usage, int total, String... tags) {
        for (String tag : tags) {
            TextStyle first = usage.firstStyles.get(tag);
            if (first != null) {
                return new TextStyle(first.fontFamily, first.fontSize, first.fontWeight, first.lineHeight,
                        first.letterSpacing, first.textTransform, first.color,
                        percent(usage.tagCounts.getOrDefault(tag, 0), total));
            }
        }
        return TextStyle.placeholder();
    }

    private GlobalTypographySettings globalSettings(TypographyUsage usage, List<FontFamily> families,
                                                    TypeScale typeScale) {
        Optional<FontFamily> bodyFont = families.stream().filter(f -> f.usedAs(FontRole.BODY)).findFirst()
                .or(() -> families.stream().findFirst());
        String baseFamily = bodyFont.map(f -> f.name).orElse("sans-serif");
        String headingFamily = families.stream().filter(f -> f.usedAs(FontRole.HEADING)).findFirst()
                .map(f -> f.name).orElse(baseFamily);
        String baseColor = mostUsed(usage.colorsByRole.get(FontRole.BODY)).orElse("#000000");
        String headingColor = mostUsed(usage.colorsByRole.get(FontRole.HEADING)).orElse("#000000");

        return new GlobalTypographySettings(typeScale.base, baseFamily, 1.5, baseColor,
                headingFamily, 700, headingColor, 1.2);
    }

    private TypographyStatistics statistics(TypographyUsage usage) {
        int totalSizes = usage.sizes.size();
        int totalFamilies = usage.fonts.size();
        int averageSize = (int) Math.round(usage.sizes.keySet().stream().mapToInt(Integer::intValue)
                .average().orElse(DEFAULT_BASE));
        String mostUsedFont = usage.fonts.entrySet().stream()
                .max(Comparator.comparingInt(e -> e.getValue().count))
                .map(Map.Entry::getKey).orElse("Unknown");
        int mostUsedSize = usage.sizes.entrySet().stream()
                .max(Comparator.comparingInt(e -> e.getValue().count))
                .map(Map.Entry::getKey).orElse(DEFAULT_BASE);

        boolean consistent = totalSizes >= 5 && totalSizes <= 10;
        String quality;
        if (totalSizes <= 8 && totalFamilies <= 2) {
            quality = "excellent";
        } else if (totalSizes <= 12 && totalFamilies <= 3) {
            quality = "good";
        } else if (totalSizes <= 16 && totalFamilies <= 4) {
            quality = "fair";
        } else {
            quality = "poor";
        }
        return new TypographyStatistics(totalFamilies, totalSizes, averageSize, mostUsedFont,
                mostUsedSize + "px", consistent, quality);
    }

    private List<ElementorGlobalFont> elementorGlobalFonts(TextStyles textStyles, GlobalTypographySettings settings) {
        List<ElementorGlobalFont> fonts = new ArrayList<>();
        fonts.add(new ElementorGlobalFont("primary", "Primary", settings.baseFontFamily, "400",
                settings.baseFontSize, settings.baseLineHeight));
        if (settings.headingFontFamily != null) {
            fonts.add(new ElementorGlobalFont("secondary", "Secondary", settings.headingFontFamily,
                    String.valueOf(settings.headingFontWeight), 24, settings.headingLineHeight));
        }
        for (int level = 1; level <= 3; level++) {
            TextStyle style = textStyles.heading(level);
            double size = DimensionParser.toPixels(style.fontSize).orElse(24);
            double lineHeight = parseDouble(style.lineHeight, 1.2);
            fonts.add(new ElementorGlobalFont("h" + level, "H" + level, style.fontFamily, style.fontWeight,
                    size, lineHeight));
        }
        return fonts;
    }

    private static Optional<String> mostUsed(Map<String, Integer> counts) {
        if (counts == null) {
            return Optional.empty();
        }
        return counts.entrySet().stream().max(Map.Entry.comparingByValue()).map(Map.Entry::getKey);
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double percent(int part, int total) {
        if (total == 0) {
            return 0;
        }
        return Math.round(part * 10000.0 / total) / 100.0;
    }
}
