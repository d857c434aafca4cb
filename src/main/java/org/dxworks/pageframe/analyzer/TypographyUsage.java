package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.ExtractedStyles;
import org.dxworks.pageframe.model.RecognizedComponent;
import org.dxworks.pageframe.model.typography.FontRole;
import org.dxworks.pageframe.model.typography.TextStyle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collector;

/**
 * Immutable summary of the font declarations observed on a page. Built by
 * folding {@link Sample}s through {@link #collector()}; partial summaries of
 * disjoint element sets merge in encounter order.
 */
public final class TypographyUsage {

    public static final TypographyUsage EMPTY = new Accumulator().freeze();

    /** Family name → usage, in first-seen order. */
    public final Map<String, FontUsage> fonts;
    /** Rounded px size → usage, ascending. */
    public final Map<Integer, SizeUsage> sizes;
    /** Tag → style of the first element seen with that tag. */
    public final Map<String, TextStyle> firstStyles;
    /** Tag → number of elements seen with that tag. */
    public final Map<String, Integer> tagCounts;
    /** Heading tag → px of every heading seen (16 when it declared none). */
    public final Map<String, List<Double>> headingSizes;
    public final Map<FontRole, Map<String, Integer>> colorsByRole;

    private TypographyUsage(Map<String, FontUsage> fonts, Map<Integer, SizeUsage> sizes,
                            Map<String, TextStyle> firstStyles, Map<String, Integer> tagCounts,
                            Map<String, List<Double>> headingSizes,
                            Map<FontRole, Map<String, Integer>> colorsByRole) {
        this.fonts = fonts;
        this.sizes = sizes;
        this.firstStyles = firstStyles;
        this.tagCounts = tagCounts;
        this.headingSizes = headingSizes;
        this.colorsByRole = colorsByRole;
    }

    public static TypographyUsage of(List<Sample> samples) {
        return samples.stream().collect(collector());
    }

    public static Collector<Sample, ?, TypographyUsage> collector() {
        return Collector.of(Accumulator::new, Accumulator::add, Accumulator::merge, Accumulator::freeze);
    }

    public int totalFontDeclarations() {
        return fonts.values().stream().mapToInt(f -> f.count).sum();
    }

    public int totalSizeDeclarations() {
        return sizes.values().stream().mapToInt(s -> s.count).sum();
    }

    public static final class FontUsage {
        public final int count;
        public final Map<String, Integer> weights;
        public final Map<FontRole, RoleUsage> roles;

        FontUsage(int count, Map<String, Integer> weights, Map<FontRole, RoleUsage> roles) {
            this.count = count;
            this.weights = Collections.unmodifiableMap(weights);
            this.roles = Collections.unmodifiableMap(roles);
        }
    }

    public static final class RoleUsage {
        public final int count;
        public final Set<String> components;

        RoleUsage(int count, Set<String> components) {
            this.count = count;
            this.components = Collections.unmodifiableSet(components);
        }
    }

    public static final class SizeUsage {
        public final int count;
        public final Set<String> contexts;

        SizeUsage(int count, Set<String> contexts) {
            this.count = count;
            this.contexts = Collections.unmodifiableSet(contexts);
        }
    }

    /**
     * Font facts of one recognized element.
     */
    public static final class Sample {
        public final String tag;
        public final String component;
        public final FontRole role;
        public final String fontFamily; // normalized, nullable
        public final Double sizePx;     // nullable
        public final String fontWeight;
        public final String lineHeight;
        public final String letterSpacing;
        public final String textTransform;
        public final String color;

        public Sample(String tag, String component, FontRole role, String fontFamily, Double sizePx,
                      String fontWeight, String lineHeight, String letterSpacing, String textTransform,
                      String color) {
            this.tag = tag;
            this.component = component;
            this.role = role;
            this.fontFamily = fontFamily;
            this.sizePx = sizePx;
            this.fontWeight = fontWeight;
            this.lineHeight = lineHeight;
            this.letterSpacing = letterSpacing;
            this.textTransform = textTransform;
            this.color = color;
        }

        public static Sample of(RecognizedComponent component) {
            ExtractedStyles styles = component.element.styles;
            OptionalDouble px = DimensionParser.toPixels(styles.fontSize());
            return new Sample(
                    component.tagName,
                    component.componentType.getId(),
                    roleOf(component.componentType, component.tagName),
                    normalizeFontFamily(styles.fontFamily()),
                    px.isPresent() ? px.getAsDouble() : null,
                    styles.fontWeight() != null ? styles.fontWeight() : "400",
                    styles.lineHeight(),
                    styles.letterSpacing(),
                    styles.textTransform(),
                    styles.color());
        }

        boolean isHeading() {
            return tag.matches("h[1-6]");
        }
    }

    /**
     * Strips quotes and keeps the first family of a comma list.
     */
    public static String normalizeFontFamily(String fontFamily) {
        if (fontFamily == null) {
            return null;
        }
        String first = fontFamily.replace("\"", "").replace("'", "").split(",")[0].trim();
        return first.isEmpty() ? null : first;
    }

    static FontRole roleOf(ComponentType type, String tag) {
        FontRole byType = switch (type) {
            case HEADING -> FontRole.HEADING;
            case BUTTON, SUBMIT_BUTTON -> FontRole.BUTTON;
            case LINK -> FontRole.LINK;
            case PARAGRAPH, TEXT -> FontRole.BODY;
            default -> null;
        };
        if (byType != null) {
            return byType;
        }
        String lower = tag.toLowerCase(Locale.ROOT);
        if (lower.matches("h[1-6]")) return FontRole.HEADING;
        if (lower.equals("button")) return FontRole.BUTTON;
        if (lower.equals("a")) return FontRole.LINK;
        if (lower.equals("small") || lower.equals("figcaption") || lower.equals("caption")) return FontRole.CAPTION;
        if (lower.equals("p") || lower.equals("span") || lower.equals("li") || lower.equals("div")) return FontRole.BODY;
        return FontRole.OTHER;
    }

    private static final class Accumulator {
        final Map<String, MutableFont> fonts = new LinkedHashMap<>();
        final Map<Integer, MutableSize> sizes = new TreeMap<>();
        final Map<String, TextStyle> firstStyles = new LinkedHashMap<>();
        final Map<String, Integer> tagCounts = new LinkedHashMap<>();
        final Map<String, List<Double>> headingSizes = new TreeMap<>();
        final Map<FontRole, Map<String, Integer>> colors = new LinkedHashMap<>();

        void add(Sample sample) {
            if (sample.fontFamily != null) {
                MutableFont font = fonts.computeIfAbsent(sample.fontFamily, k -> new MutableFont());
                font.count++;
                font.weights.merge(sample.fontWeight, 1, Integer::sum);
                MutableRole role = font.roles.computeIfAbsent(sample.role, k -> new MutableRole());
                role.count++;
                role.components.add(sample.component);
            }
            if (sample.sizePx != null) {
                MutableSize size = sizes.computeIfAbsent((int) Math.round(sample.sizePx), k -> new MutableSize());
                size.count++;
                size.contexts.add(sample.component);
            }
            if (sample.color != null) {
                colors.computeIfAbsent(sample.role, k -> new LinkedHashMap<>()).merge(sample.color, 1, Integer::sum);
            }
            tagCounts.merge(sample.tag, 1, Integer::sum);
            firstStyles.putIfAbsent(sample.tag, styleOf(sample));
            if (sample.isHeading()) {
                headingSizes.computeIfAbsent(sample.tag, k -> new ArrayList<>())
                        .add(sample.sizePx != null ? sample.sizePx : DimensionParser.ROOT_FONT_SIZE);
            }
        }

        Accumulator merge(Accumulator other) {
            other.fonts.forEach((name, font) -> {
                MutableFont mine = fonts.computeIfAbsent(name, k -> new MutableFont());
                mine.count += font.count;
                font.weights.forEach((w, c) -> mine.weights.merge(w, c, Integer::sum));
                font.roles.forEach((r, usage) -> {
                    MutableRole role = mine.roles.computeIfAbsent(r, k -> new MutableRole());
                    role.count += usage.count;
                    role.components.addAll(usage.components);
                });
            });
            other.sizes.forEach((px, size) -> {
                MutableSize mine = sizes.computeIfAbsent(px, k -> new MutableSize());
                mine.count += size.count;
                mine.contexts.addAll(size.contexts);
            });
            other.firstStyles.forEach(firstStyles::putIfAbsent);
            other.tagCounts.forEach((tag, count) -> tagCounts.merge(tag, count, Integer::sum));
            other.headingSizes.forEach((tag, list) ->
                    headingSizes.computeIfAbsent(tag, k -> new ArrayList<>()).addAll(list));
            other.colors.forEach((role, counts) -> {
                Map<String, Integer> mine = colors.computeIfAbsent(role, k -> new LinkedHashMap<>());
                counts.forEach((color, count) -> mine.merge(color, count, Integer::sum));
            });
            return this;
        }

        TypographyUsage freeze() {
            Map<String, FontUsage> frozenFonts = new LinkedHashMap<>();
            fonts.forEach((name, font) -> {
                Map<FontRole, RoleUsage> roles = new LinkedHashMap<>();
                font.roles.forEach((r, usage) -> roles.put(r, new RoleUsage(usage.count, usage.components)));
                frozenFonts.put(name, new FontUsage(font.count, new LinkedHashMap<>(font.weights), roles));
            });
            Map<Integer, SizeUsage> frozenSizes = new TreeMap<>();
            sizes.forEach((px, size) -> frozenSizes.put(px, new SizeUsage(size.count, size.contexts)));
            Map<String, List<Double>> frozenHeadings = new TreeMap<>();
            headingSizes.forEach((tag, list) -> frozenHeadings.put(tag, List.copyOf(list)));
            Map<FontRole, Map<String, Integer>> frozenColors = new LinkedHashMap<>();
            colors.forEach((role, counts) ->
                    frozenColors.put(role, Collections.unmodifiableMap(new LinkedHashMap<>(counts))));

            return new TypographyUsage(
                    Collections.unmodifiableMap(frozenFonts),
                    Collections.unmodifiableMap(frozenSizes),
                    Collections.unmodifiableMap(new LinkedHashMap<>(firstStyles)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(tagCounts)),
                    Collections.unmodifiableMap(frozenHeadings),
                    Collections.unmodifiableMap(frozenColors));
        }

        private static TextStyle styleOf(Sample sample) {
            return new TextStyle(
                    sample.fontFamily != null ? sample.fontFamily : "inherit",
                    sample.sizePx != null ? DimensionParser.formatPixels(Math.round(sample.sizePx)) : "inherit",
                    sample.fontWeight,
                    sample.lineHeight != null ? sample.lineHeight : (sample.isHeading() ? "1.2" : "1.5"),
                    sample.letterSpacing,
                    sample.textTransform,
                    sample.color,
                    0);
        }
    }

    private static final class MutableFont {
        int count;
        final Map<String, Integer> weights = new LinkedHashMap<>();
        final Map<FontRole, MutableRole> roles = new LinkedHashMap<>();
    }

    private static final class MutableRole {
        int count;
        final Set<String> components = new LinkedHashSet<>();
    }

    private static final class MutableSize {
        int count;
        final Set<String> contexts = new LinkedHashSet<>();
    }
}
