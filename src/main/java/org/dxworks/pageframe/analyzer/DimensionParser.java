package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.model.BoxSpacing;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses CSS lengths. Relative units resolve against a 16px root font size
 * and a 1920x1080 desktop viewport.
 */
public final class DimensionParser {

    public static final double ROOT_FONT_SIZE = 16.0;
    public static final double VIEWPORT_WIDTH = 1920.0;
    public static final double VIEWPORT_HEIGHT = 1080.0;

    private static final Pattern DIMENSION = Pattern.compile(
            "^(-?\\d*\\.?\\d+)(px|em|rem|%|vh|vw|vmin|vmax|pt)?$", Pattern.CASE_INSENSITIVE);

    private DimensionParser() {
    }

    public static class Dimension {
        public final double value;
        public final String unit;

        Dimension(double value, String unit) {
            this.value = value;
            this.unit = unit;
        }

        public boolean isPercent() {
            return "%".equals(unit);
        }
    }

    /**
     * Returns null for keywords ({@code auto}, {@code inherit}) and anything
     * that is not a single length. A bare number is read as pixels.
     */
    public static Dimension parse(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = DIMENSION.matcher(value.trim());
        if (!matcher.matches()) {
            return null;
        }
        String unit = matcher.group(2) != null ? matcher.group(2).toLowerCase(Locale.ROOT) : "px";
        return new Dimension(Double.parseDouble(matcher.group(1)), unit);
    }

    /**
     * Absolute pixel value, or empty for percentages and unparsable input.
     */
    public static OptionalDouble toPixels(String value) {
        Dimension dimension = parse(value);
        if (dimension == null) {
            return OptionalDouble.empty();
        }
        return switch (dimension.unit) {
            case "px" -> OptionalDouble.of(dimension.value);
            case "rem", "em" -> OptionalDouble.of(dimension.value * ROOT_FONT_SIZE);
            case "pt" -> OptionalDouble.of(dimension.value * 4.0 / 3.0);
            case "vw" -> OptionalDouble.of(dimension.value * VIEWPORT_WIDTH / 100.0);
            case "vh" -> OptionalDouble.of(dimension.value * VIEWPORT_HEIGHT / 100.0);
            case "vmin" -> OptionalDouble.of(dimension.value * VIEWPORT_HEIGHT / 100.0);
            case "vmax" -> OptionalDouble.of(dimension.value * VIEWPORT_WIDTH / 100.0);
            default -> OptionalDouble.empty();
        };
    }

    public static OptionalDouble percent(String value) {
        Dimension dimension = parse(value);
        if (dimension == null || !dimension.isPercent()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(dimension.value);
    }

    /**
     * Expands a 1-4 value box shorthand in CSS order (top, right, bottom, left).
     * Returns null when the value has no parts or more than four.
     */
    public static BoxSpacing parseBox(String shorthand) {
        if (shorthand == null || shorthand.isBlank()) {
            return null;
        }
        String[] parts = shorthand.trim().split("\\s+");
        return switch (parts.length) {
            case 1 -> new BoxSpacing(parts[0], parts[0], parts[0], parts[0]);
            case 2 -> new BoxSpacing(parts[0], parts[1], parts[0], parts[1]);
            case 3 -> new BoxSpacing(parts[0], parts[1], parts[2], parts[1]);
            case 4 -> new BoxSpacing(parts[0], parts[1], parts[2], parts[3]);
            default -> null;
        };
    }

    /**
     * Formats a pixel amount without a trailing {@code .0}.
     */
    public static String formatPixels(double px) {
        if (px == Math.rint(px)) {
            return (long) px + "px";
        }
        return Math.round(px * 100.0) / 100.0 + "px";
    }
}
