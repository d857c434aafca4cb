package org.dxworks.pageframe.model;

import org.dxworks.pageframe.model.design.DesignTokens;
import org.dxworks.pageframe.model.typography.TypographySystem;
import org.dxworks.pageframe.model.validation.ValidationResult;

import java.util.List;

public class ConversionResult {
    public final String kind = "conversion";
    public final PageBuilder builder;
    public final ConversionState state;
    public final Object exportData;
    public final List<RecognizedComponent> components;
    public final List<ComponentHierarchy> hierarchy;
    public final TypographySystem typography;
    public final DesignTokens designTokens;
    public final List<FallbackStrategy> fallbacks;
    public final ValidationResult validation;
    public final ConversionStats stats;

    public ConversionResult(PageBuilder builder,
                            ConversionState state,
                            Object exportData,
                            List<RecognizedComponent> components,
                            List<ComponentHierarchy> hierarchy,
                            TypographySystem typography,
                            DesignTokens designTokens,
                            List<FallbackStrategy> fallbacks,
                            ValidationResult validation,
                            ConversionStats stats) {
        this.builder = builder;
        this.state = state;
        this.exportData = exportData;
        this.components = List.copyOf(components);
        this.hierarchy = List.copyOf(hierarchy);
        this.typography = typography;
        this.designTokens = designTokens;
        this.fallbacks = List.copyOf(fallbacks);
        this.validation = validation;
        this.stats = stats;
    }

    public boolean isSuccess() {
        return state != ConversionState.FAILED;
    }

    public ConversionResult withValidation(ValidationResult validation, ConversionState state) {
        return new ConversionResult(builder, state, exportData, components, hierarchy, typography,
                designTokens, fallbacks, validation, stats);
    }
}
