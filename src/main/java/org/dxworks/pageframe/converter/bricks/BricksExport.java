package org.dxworks.pageframe.converter.bricks;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BricksExport {
    public final List<BricksElement> elements;
    public final List<Map<String, Object>> globalColors;
    public final Map<String, Object> typography;

    public BricksExport(List<BricksElement> elements, List<Map<String, Object>> globalColors,
                        Map<String, Object> typography) {
        this.elements = List.copyOf(elements);
        this.globalColors = List.copyOf(globalColors);
        this.typography = typography;
    }

    /**
     * Elements in document order whose parent is the given id.
     */
    public List<BricksElement> childrenOf(String parent) {
        return elements.stream().filter(element -> parent.equals(element.parent)).toList();
    }
}
