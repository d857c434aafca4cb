package org.dxworks.pageframe.analyzer;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Colors {

    private static final Pattern RGB = Pattern.compile(
            "rgba?\\(\\s*(\\d{1,3})\\s*[, ]\\s*(\\d{1,3})\\s*[, ]\\s*(\\d{1,3})\\s*(?:[,/]\\s*([\\d.]+%?)\\s*)?\\)");
    private static final Pattern SHORT_HEX = Pattern.compile("#([0-9a-f])([0-9a-f])([0-9a-f])");

    private Colors() {
    }

    /**
     * Lower-case hex for opaque colors ({@code #fff} and {@code rgb(...)} become
     * {@code #rrggbb}). Translucent and named colors are only lower-cased;
     * {@code transparent} yields null.
     */
    public static String normalize(String color) {
        if (color == null || color.isBlank()) {
            return null;
        }
        String value = color.trim().toLowerCase(Locale.ROOT);
        if (value.equals("transparent") || value.equals("rgba(0, 0, 0, 0)") || value.equals("rgba(0,0,0,0)")) {
            return null;
        }

        Matcher shortHex = SHORT_HEX.matcher(value);
        if (shortHex.matches()) {
            return "#" + shortHex.group(1) + shortHex.group(1) + shortHex.group(2) + shortHex.group(2)
                    + shortHex.group(3) + shortHex.group(3);
        }

        Matcher rgb = RGB.matcher(value);
        if (rgb.matches()) {
            String alpha = rgb.group(4);
            if (alpha != null && !isOpaque(alpha)) {
                return value;
            }
            return String.format("#%02x%02x%02x", clamp(rgb.group(1)), clamp(rgb.group(2)), clamp(rgb.group(3)));
        }
        return value;
    }

    public static boolean isHex(String color) {
        return color != null && color.matches("#[0-9a-f]{6}");
    }

    private static boolean isOpaque(String alpha) {
        if (alpha.endsWith("%")) {
            return Double.parseDouble(alpha.substring(0, alpha.length() - 1)) >= 100.0;
        }
        return Double.parseDouble(alpha) >= 1.0;
    }

    private static int clamp(String channel) {
        return Math.min(255, Integer.parseInt(channel));
    }
}
