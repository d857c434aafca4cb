package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConversionState {
    PENDING, CONVERTING, VALIDATING, DONE, FAILED;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
