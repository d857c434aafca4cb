package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonValue;

public class StyleDiscrepancy {
    public enum Level {
        MINOR, MODERATE, MAJOR;

        @JsonValue
        public String getId() {
            return name().toLowerCase();
        }
    }

    public final String selector;
    public final String property;
    public final String originalValue;
    public final String convertedValue;
    public final Level severity;

    public StyleDiscrepancy(String selector, String property, String originalValue, String convertedValue,
                            Level severity) {
        this.selector = selector;
        this.property = property;
        this.originalValue = originalValue;
        this.convertedValue = convertedValue;
        this.severity = severity;
    }
}
