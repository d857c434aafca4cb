package org.dxworks.pageframe.dom;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for inline {@code style} attribute declarations.
 */
public final class CssDeclarations {

    private CssDeclarations() {
    }

    /**
     * Splits {@code prop: value; prop: value} into an ordered map. Semicolons
     * inside parentheses or quotes (data URLs, font names) do not end a
     * declaration. {@code !important} is dropped; later declarations win.
     */
    public static Map<String, String> parse(String style) {
        Map<String, String> declarations = new LinkedHashMap<>();
        if (style == null || style.isBlank()) {
            return declarations;
        }

        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i <= style.length(); i++) {
            char c = i < style.length() ? style.charAt(i) : ';';
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ';' && depth == 0) {
                addDeclaration(style.substring(start, Math.min(i, style.length())), declarations);
                start = i + 1;
            }
        }
        return declarations;
    }

    private static void addDeclaration(String declaration, Map<String, String> declarations) {
        int colon = declaration.indexOf(':');
        if (colon <= 0) {
            return;
        }
        String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String value = declaration.substring(colon + 1).trim();
        if (value.toLowerCase(Locale.ROOT).endsWith("!important")) {
            value = value.substring(0, value.length() - "!important".length()).trim();
        }
        if (!property.isEmpty() && !value.isEmpty()) {
            declarations.put(property, value);
        }
    }
}
