package org.dxworks.pageframe.converter.bricks;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Row of the flat Bricks element list. Nesting is expressed by {@code parent}
 * and the ordered {@code children} ids only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BricksElement {
    public static final String ROOT_PARENT = "0";

    public final String id;
    public final String name;
    public final String parent;
    public final String label;
    public final List<String> children = new ArrayList<>();
    public final Map<String, Object> settings;

    public BricksElement(String id, String name, String parent, String label, Map<String, Object> settings) {
        this.id = id;
        this.name = name;
        this.parent = parent;
        this.label = label;
        this.settings = settings;
    }
}
