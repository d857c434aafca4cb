package org.dxworks.pageframe.converter.oxygen;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Node of the Oxygen component tree. The synthetic {@code root} has id 0;
 * every other component repeats its id and parent id in its options.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OxygenComponent {
    public final int id;
    public final String name;
    public final int depth;
    public final Map<String, Object> options;
    public final List<OxygenComponent> children = new ArrayList<>();

    public OxygenComponent(int id, String name, int depth, Map<String, Object> options) {
        this.id = id;
        this.name = name;
        this.depth = depth;
        this.options = options;
    }

    public static OxygenComponent root() {
        return new OxygenComponent(0, "root", 0, Map.of());
    }
}
