package org.dxworks.pageframe.model.typography;

public class TextStyles {
    public final TextStyle h1;
    public final TextStyle h2;
    public final TextStyle h3;
    public final TextStyle h4;
    public final TextStyle h5;
    public final TextStyle h6;
    public final TextStyle body;
    public final TextStyle bodyLarge;
    public final TextStyle bodySmall;
    public final TextStyle button;
    public final TextStyle caption;
    public final TextStyle link;

    public TextStyles(TextStyle h1, TextStyle h2, TextStyle h3, TextStyle h4, TextStyle h5, TextStyle h6,
                      TextStyle body, TextStyle bodyLarge, TextStyle bodySmall,
                      TextStyle button, TextStyle caption, TextStyle link) {
        this.h1 = h1;
        this.h2 = h2;
        this.h3 = h3;
        this.h4 = h4;
        this.h5 = h5;
        this.h6 = h6;
        this.body = body;
        this.bodyLarge = bodyLarge;
        this.bodySmall = bodySmall;
        this.button = button;
        this.caption = caption;
        this.link = link;
    }

    public TextStyle heading(int level) {
        return switch (level) {
            case 1 -> h1;
            case 2 -> h2;
            case 3 -> h3;
            case 4 -> h4;
            case 5 -> h5;
            default -> h6;
        };
    }
}
