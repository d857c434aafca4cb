package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalized style record of one element. Simple properties are kept under
 * their camelCase CSS name; box and border shorthands are expanded into
 * their own typed values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractedStyles {
    public static final ExtractedStyles EMPTY = new ExtractedStyles(Map.of(), null, null, null, null);

    private final Map<String, String> properties;
    public final BoxSpacing margin;
    public final BoxSpacing padding;
    public final BorderStyle border;
    public final BorderRadius borderRadius;

    public ExtractedStyles(Map<String, String> properties,
                           BoxSpacing margin,
                           BoxSpacing padding,
                           BorderStyle border,
                           BorderRadius borderRadius) {
        this.properties = Collections.unmodifiableMap(new TreeMap<>(properties));
        this.margin = margin;
        this.padding = padding;
        this.border = border;
        this.borderRadius = borderRadius;
    }

    @JsonAnyGetter
    public Map<String, String> getProperties() {
        return properties;
    }

    public String get(String property) {
        return properties.get(property);
    }

    public boolean has(String property) {
        String value = properties.get(property);
        return value != null && !value.isBlank();
    }

    public boolean is(String property, String expected) {
        String value = properties.get(property);
        return value != null && value.trim().equalsIgnoreCase(expected);
    }

    public boolean isEmpty() {
        return properties.isEmpty() && margin == null && padding == null && border == null && borderRadius == null;
    }

    public String display() {
        return get("display");
    }

    public String width() {
        return get("width");
    }

    public String height() {
        return get("height");
    }

    public String color() {
        return get("color");
    }

    public String backgroundColor() {
        return get("backgroundColor");
    }

    public String backgroundImage() {
        return get("backgroundImage");
    }

    public String fontFamily() {
        return get("fontFamily");
    }

    public String fontSize() {
        return get("fontSize");
    }

    public String fontWeight() {
        return get("fontWeight");
    }

    public String lineHeight() {
        return get("lineHeight");
    }

    public String letterSpacing() {
        return get("letterSpacing");
    }

    public String textAlign() {
        return get("textAlign");
    }

    public String textTransform() {
        return get("textTransform");
    }
}
