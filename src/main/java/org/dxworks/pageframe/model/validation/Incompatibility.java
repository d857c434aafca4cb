package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Incompatibility {
    public enum Impact {
        BLOCKING, DEGRADED, MINIMAL;

        @JsonValue
        public String getId() {
            return name().toLowerCase();
        }
    }

    public final String type; // javascript, css, html, library
    public final String name;
    public final String reason;
    public final Impact impact;
    public final String workaround;

    public Incompatibility(String type, String name, String reason, Impact impact, String workaround) {
        this.type = type;
        this.name = name;
        this.reason = reason;
        this.impact = impact;
        this.workaround = workaround;
    }
}
