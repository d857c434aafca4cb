package org.dxworks.pageframe.model.typography;

import java.util.List;

public class TypeSize {
    public final String name; // xs, sm, base, lg, xl, 2xl ... 6xl
    public final int px;
    public final double rem;
    public final double usage;
    public final List<String> contexts;

    public TypeSize(String name, int px, double rem, double usage, List<String> contexts) {
        this.name = name;
        this.px = px;
        this.rem = rem;
        this.usage = usage;
        this.contexts = List.copyOf(contexts);
    }
}
