package org.dxworks.pageframe.converter.divi;

import java.util.List;
import java.util.Map;

/**
 * Serializes Divi elements to the shortcode post content stored by WordPress.
 * Attribute values have quotes and square brackets percent-encoded the way
 * the Divi builder saves them.
 */
public final class ShortcodeWriter {

    private ShortcodeWriter() {
    }

    public static String write(List<DiviElement> elements) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            write(elements.get(i), out);
        }
        return out.toString();
    }

    private static void write(DiviElement element, StringBuilder out) {
        out.append('[').append(element.type);
        for (Map.Entry<String, Object> attr : element.attrs.entrySet()) {
            String value = attr.getValue() != null ? String.valueOf(attr.getValue()) : "";
            if (!value.isEmpty()) {
                out.append(' ').append(attr.getKey()).append("=\"").append(encode(value)).append('"');
            }
        }
        out.append(']');
        if (!element.children.isEmpty()) {
            out.append('\n');
            for (DiviElement child : element.children) {
                write(child, out);
                out.append('\n');
            }
        } else if (element.content != null) {
            out.append(element.content);
        }
        out.append("[/").append(element.type).append(']');
    }

    static String encode(String value) {
        return value.replace("\"", "%22").replace("[", "%91").replace("]", "%93");
    }
}
