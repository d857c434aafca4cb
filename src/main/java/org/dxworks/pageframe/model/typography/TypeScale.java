package org.dxworks.pageframe.model.typography;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class TypeScale {
    public final int base; // px
    public final double ratio;
    public final List<TypeSize> sizes;
    public final Map<String, Integer> headingSizes; // h1-h6 -> px

    public TypeScale(int base, double ratio, List<TypeSize> sizes, Map<String, Integer> headingSizes) {
        this.base = base;
        this.ratio = ratio;
        this.sizes = List.copyOf(sizes);
        this.headingSizes = Collections.unmodifiableMap(new TreeMap<>(headingSizes));
    }
}
