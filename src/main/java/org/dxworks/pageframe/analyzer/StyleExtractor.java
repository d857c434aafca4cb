package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.model.BorderRadius;
import org.dxworks.pageframe.model.BorderStyle;
import org.dxworks.pageframe.model.BoxSpacing;
import org.dxworks.pageframe.model.ExtractedStyles;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes a raw style map (kebab-case or camelCase keys) into an
 * {@link ExtractedStyles} record.
 */
public final class StyleExtractor {

    private static final Set<String> BORDER_STYLES = Set.of(
            "none", "hidden", "dotted", "dashed", "solid", "double", "groove", "ridge", "inset", "outset");
    private static final Set<String> COLOR_PROPERTIES = Set.of("color", "backgroundColor", "borderColor");
    private static final Map<String, String> NEUTRAL_VALUES = Map.of(
            "boxShadow", "none",
            "textShadow", "none",
            "transform", "none",
            "filter", "none",
            "opacity", "1",
            "zIndex", "auto",
            "overflow", "visible",
            "transition", "none 0s ease 0s",
            "backgroundImage", "none");

    private StyleExtractor() {
    }

    public static ExtractedStyles extract(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return ExtractedStyles.EMPTY;
        }

        Map<String, String> camel = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key != null && value != null && !value.isBlank()) {
                camel.put(toCamelCase(key.trim()), value.trim());
            }
        });

        BoxSpacing margin = extractBox(camel, "margin");
        BoxSpacing padding = extractBox(camel, "padding");
        BorderStyle border = extractBorder(camel);
        BorderRadius radius = extractRadius(camel);

        Map<String, String> properties = new LinkedHashMap<>();
        camel.forEach((key, value) -> {
            if (isExpanded(key)) {
                return;
            }
            String normalized = normalizeValue(key, value);
            if (normalized != null && !normalized.equals(NEUTRAL_VALUES.get(key))) {
                properties.put(key, normalized);
            }
        });
        if (border != null && border.color != null && !properties.containsKey("borderColor")) {
            properties.put("borderColor", border.color);
        }
        return new ExtractedStyles(properties, margin, padding, border, radius);
    }

    /**
     * {@code font-size} → {@code fontSize}; custom properties ({@code --x}) are kept.
     */
    public static String toCamelCase(String property) {
        if (property.startsWith("--") || property.indexOf('-') < 0) {
            return property;
        }
        StringBuilder sb = new StringBuilder(property.length());
        boolean upper = false;
        for (char c : property.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '-') {
                upper = sb.length() > 0;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }

    private static boolean isExpanded(String key) {
        if (key.equals("borderColor")) {
            return false;
        }
        return key.startsWith("margin") || key.startsWith("padding") || key.startsWith("border");
    }

    private static String normalizeValue(String key, String value) {
        if (COLOR_PROPERTIES.contains(key)) {
            return Colors.normalize(value);
        }
        if (key.equals("fontWeight")) {
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "normal" -> "400";
                case "bold" -> "700";
                default -> value;
            };
        }
        return value;
    }

    private static BoxSpacing extractBox(Map<String, String> styles, String property) {
        BoxSpacing shorthand = DimensionParser.parseBox(styles.get(property));
        String top = styles.get(property + "Top");
        String right = styles.get(property + "Right");
        String bottom = styles.get(property + "Bottom");
        String left = styles.get(property + "Left");
        if (shorthand == null && top == null && right == null && bottom == null && left == null) {
            return null;
        }
        BoxSpacing base = shorthand != null ? shorthand : new BoxSpacing("0", "0", "0", "0");
        return new BoxSpacing(
                top != null ? top : base.top,
                right != null ? right : base.right,
                bottom != null ? bottom : base.bottom,
                left != null ? left : base.left);
    }

    private static BorderStyle extractBorder(Map<String, String> styles) {
        String width = styles.get("borderWidth");
        String style = styles.get("borderStyle");
        String color = styles.get("borderColor");

        String shorthand = styles.get("border");
        if (shorthand != null) {
            for (String token : splitOutsideParens(shorthand)) {
                String lower = token.toLowerCase(Locale.ROOT);
                if (BORDER_STYLES.contains(lower)) {
                    style = style != null ? style : lower;
                } else if (DimensionParser.parse(token) != null
                        || lower.equals("thin") || lower.equals("medium") || lower.equals("thick")) {
                    width = width != null ? width : token;
                } else {
                    color = color != null ? color : token;
                }
            }
        }

        if (width == null && style == null) {
            return null;
        }
        if ("none".equalsIgnoreCase(style) || "0".equals(width) || "0px".equals(width)) {
            return null;
        }
        return new BorderStyle(width != null ? width : "medium", style != null ? style : "solid",
                color != null ? Colors.normalize(color) : null);
    }

    private static BorderRadius extractRadius(Map<String, String> styles) {
        String shorthand = styles.get("borderRadius");
        BoxSpacing corners = null;
        if (shorthand != null) {
            int slash = shorthand.indexOf('/');
            corners = DimensionParser.parseBox(slash >= 0 ? shorthand.substring(0, slash) : shorthand);
        }
        String topLeft = styles.get("borderTopLeftRadius");
        String topRight = styles.get("borderTopRightRadius");
        String bottomRight = styles.get("borderBottomRightRadius");
        String bottomLeft = styles.get("borderBottomLeftRadius");
        if (corners == null && topLeft == null && topRight == null && bottomRight == null && bottomLeft == null) {
            return null;
        }

        // parseBox yields top/right/bottom/left, which for radii read as the four corners clockwise
        BoxSpacing base = corners != null ? corners : new BoxSpacing("0", "0", "0", "0");
        BorderRadius radius = new BorderRadius(
                topLeft != null ? topLeft : base.top,
                topRight != null ? topRight : base.right,
                bottomRight != null ? bottomRight : base.bottom,
                bottomLeft != null ? bottomLeft : base.left);
        if (isZero(radius.topLeft) && isZero(radius.topRight) && isZero(radius.bottomRight)
                && isZero(radius.bottomLeft)) {
            return null;
        }
        return radius;
    }

    private static boolean isZero(String value) {
        return value.equals("0") || value.equals("0px");
    }

    private static List<String> splitOutsideParens(String value) {
        StringBuilder current = new StringBuilder();
        List<String> tokens = new ArrayList<>();
        int depth = 0;
        for (char c : value.trim().toCharArray()) {
            if (c == '(') depth++;
            if (c == ')') depth--;
            if (Character.isWhitespace(c) && depth == 0) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
