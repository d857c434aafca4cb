package org.dxworks.pageframe.model.typography;

import java.util.List;

public class FontFamily {
    public final String name;
    public final List<FontWeight> weights;
    public final double usage; // percentage of all font declarations
    public final List<FontContext> contexts;
    public final boolean googleFont;

    public FontFamily(String name, List<FontWeight> weights, double usage, List<FontContext> contexts,
                      boolean googleFont) {
        this.name = name;
        this.weights = List.copyOf(weights);
        this.usage = usage;
        this.contexts = List.copyOf(contexts);
        this.googleFont = googleFont;
    }

    public boolean usedAs(FontRole role) {
        return contexts.stream().anyMatch(c -> c.type == role);
    }
}
