package org.dxworks.pageframe.model.typography;

import java.util.List;

public class FontContext {
    public final FontRole type;
    public final List<String> components;
    public final int count;

    public FontContext(FontRole type, List<String> components, int count) {
        this.type = type;
        this.components = List.copyOf(components);
        this.count = count;
    }
}
