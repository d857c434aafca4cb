package org.dxworks.pageframe.model.design;

public class SpacingToken {
    public final String name;
    public final int px;
    public final int usage;

    public SpacingToken(String name, int px, int usage) {
        this.name = name;
        this.px = px;
        this.usage = usage;
    }
}
