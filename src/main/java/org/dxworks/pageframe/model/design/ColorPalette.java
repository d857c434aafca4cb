package org.dxworks.pageframe.model.design;

import java.util.List;

public class ColorPalette {
    public final String primary;
    public final String secondary;
    public final String accent;
    public final String text;
    public final String background;
    public final List<ColorToken> all; // ranked by usage

    public ColorPalette(String primary, String secondary, String accent, String text, String background,
                        List<ColorToken> all) {
        this.primary = primary;
        this.secondary = secondary;
        this.accent = accent;
        this.text = text;
        this.background = background;
        this.all = List.copyOf(all);
    }

    /**
     * Name of the global slot holding the given normalized color, or null.
     */
    public String slotOf(String color) {
        if (color == null) {
            return null;
        }
        if (color.equals(primary)) return "primary";
        if (color.equals(secondary)) return "secondary";
        if (color.equals(text)) return "text";
        if (color.equals(accent)) return "accent";
        return null;
    }
}
