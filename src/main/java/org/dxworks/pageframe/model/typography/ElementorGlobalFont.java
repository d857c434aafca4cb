package org.dxworks.pageframe.model.typography;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public class ElementorGlobalFont {
    @JsonProperty("_id")
    public final String id;
    public final String title;
    @JsonProperty("typography_font_family")
    public final String fontFamily;
    @JsonProperty("typography_font_weight")
    public final String fontWeight;
    @JsonProperty("typography_font_size")
    public final Map<String, Object> fontSize;
    @JsonProperty("typography_line_height")
    public final Map<String, Object> lineHeight;

    public ElementorGlobalFont(String id, String title, String fontFamily, String fontWeight,
                               double fontSizePx, double lineHeightEm) {
        this.id = id;
        this.title = title;
        this.fontFamily = fontFamily;
        this.fontWeight = fontWeight;
        this.fontSize = Map.of("unit", "px", "size", fontSizePx);
        this.lineHeight = Map.of("unit", "em", "size", lineHeightEm);
    }
}
