package org.dxworks.pageframe.model.validation;

public class ValidationIssue {
    public String type;
    public String message;
    public String component;
    public Severity severity;

    public ValidationIssue() {
    }

    public ValidationIssue(String type, String message, String component, Severity severity) {
        this.type = type;
        this.message = message;
        this.component = component;
        this.severity = severity;
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
