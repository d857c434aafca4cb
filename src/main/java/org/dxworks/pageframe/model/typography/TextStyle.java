package org.dxworks.pageframe.model.typography;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextStyle {
    public final String fontFamily;
    public final String fontSize;
    public final String fontWeight;
    public final String lineHeight;
    public final String letterSpacing;
    public final String textTransform;
    public final String color;
    public final double usage;

    public TextStyle(String fontFamily, String fontSize, String fontWeight, String lineHeight,
                     String letterSpacing, String textTransform, String color, double usage) {
        this.fontFamily = fontFamily;
        this.fontSize = fontSize;
        this.fontWeight = fontWeight;
        this.lineHeight = lineHeight;
        this.letterSpacing = letterSpacing;
        this.textTransform = textTransform;
        this.color = color;
        this.usage = usage;
    }

    public static TextStyle placeholder() {
        return new TextStyle("inherit", "16px", "400", "1.5", null, null, null, 0);
    }
}
