package org.dxworks.pageframe.model.typography;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FontRole {
    HEADING, BODY, BUTTON, CAPTION, LINK, OTHER;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
