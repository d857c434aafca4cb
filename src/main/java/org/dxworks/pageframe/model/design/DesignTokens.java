package org.dxworks.pageframe.model.design;

import java.util.List;

public class DesignTokens {
    public final ColorPalette colors;
    public final List<SpacingToken> spacing;

    public DesignTokens(ColorPalette colors, List<SpacingToken> spacing) {
        this.colors = colors;
        this.spacing = List.copyOf(spacing);
    }
}
