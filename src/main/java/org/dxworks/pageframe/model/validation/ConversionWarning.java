package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionWarning {
    public final String type; // javascript, css, html
    public final Severity severity; // critical, warning, info
    public final String message;
    public final String suggestion;

    public ConversionWarning(String type, Severity severity, String message, String suggestion) {
        this.type = type;
        this.severity = severity;
        this.message = message;
        this.suggestion = suggestion;
    }
}
