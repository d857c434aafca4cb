package org.dxworks.pageframe.converter.divi;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * One shortcode of a Divi layout: a section, row, column or module with its
 * attributes, nested shortcodes and, for modules, enclosed content.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class DiviElement {
    public final String type;
    public final Map<String, Object> attrs;
    public final List<DiviElement> children;
    public final String content;

    public DiviElement(String type, Map<String, Object> attrs, List<DiviElement> children, String content) {
        this.type = type;
        this.attrs = attrs;
        this.children = List.copyOf(children);
        this.content = content;
    }

    public static DiviElement module(String type, Map<String, Object> attrs, String content) {
        return new DiviElement(type, attrs, List.of(), content);
    }
}
