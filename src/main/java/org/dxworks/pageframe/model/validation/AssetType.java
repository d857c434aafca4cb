package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AssetType {
    IMAGE, FONT, VIDEO, STYLESHEET, SCRIPT;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
