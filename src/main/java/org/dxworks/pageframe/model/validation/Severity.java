package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL, HIGH, MEDIUM, LOW, WARNING, INFO;

    @JsonValue
    public String getId() {
        return name().toLowerCase();
    }
}
