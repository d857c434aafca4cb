package org.dxworks.pageframe.converter.beaver;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class BeaverNode {
    public enum Type {
        ROW("row"),
        COLUMN_GROUP("column-group"),
        COLUMN("column"),
        MODULE("module");

        private final String id;

        Type(String id) {
            this.id = id;
        }

        @JsonValue
        public String getId() {
            return id;
        }
    }

    public final String node;
    public final Type type;
    public final String parent; // null for rows
    public final int position;
    public final Map<String, Object> settings;

    public BeaverNode(String node, Type type, String parent, int position, Map<String, Object> settings) {
        this.node = node;
        this.type = type;
        this.parent = parent;
        this.position = position;
        this.settings = settings;
    }
}
