package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {
    public boolean isValid;
    public boolean canExport;
    public boolean requiresOverride;
    public List<ValidationIssue> errors = new ArrayList<>();
    public List<ValidationIssue> warnings = new ArrayList<>();
    public List<String> suggestions = new ArrayList<>();
    public List<VisualComparisonResult> visualComparisons; // one per viewport
    public AssetVerificationResult assetVerification;
    public CustomCodeDetection customCodeDetection;
    public Integer overallScore; // 0-100

    public long criticalViolations() {
        return errors.stream().filter(ValidationIssue::isCritical).count();
    }
}
