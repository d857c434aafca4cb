package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeKind {
    SECTION, CONTAINER, ROW, COLUMN, WIDGET;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
