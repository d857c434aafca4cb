package org.dxworks.pageframe.converter.oxygen;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OxygenExport {
    public final OxygenComponent tree;
    public final Map<String, Object> globalColors;
    public final Map<String, Object> typography;

    public OxygenExport(OxygenComponent tree, Map<String, Object> globalColors, Map<String, Object> typography) {
        this.tree = tree;
        this.globalColors = globalColors;
        this.typography = typography;
    }

    public List<OxygenComponent> components() {
        return tree.children;
    }
}
