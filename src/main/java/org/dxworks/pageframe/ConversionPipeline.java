package org.dxworks.pageframe;

import org.dxworks.pageframe.analyzer.DesignTokenExtractor;
import org.dxworks.pageframe.analyzer.ElementAnalyzer;
import org.dxworks.pageframe.analyzer.TypographyExtractor;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.dxworks.pageframe.converter.TargetConverter;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.hierarchy.HierarchyBuilder;
import org.dxworks.pageframe.hierarchy.HierarchyPruner;
import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.ConversionResult;
import org.dxworks.pageframe.model.ConversionState;
import org.dxworks.pageframe.model.ConversionStats;
import org.dxworks.pageframe.model.FallbackStrategy;
import org.dxworks.pageframe.model.PageBuilder;
import org.dxworks.pageframe.model.RecognizedComponent;
import org.dxworks.pageframe.model.design.DesignTokens;
import org.dxworks.pageframe.model.typography.TypographySystem;
import org.dxworks.pageframe.model.validation.Severity;
import org.dxworks.pageframe.model.validation.ValidationIssue;
import org.dxworks.pageframe.model.validation.ValidationResult;
import org.dxworks.pageframe.recognizer.ComponentRecognizer;
import org.dxworks.pageframe.validator.ConversionStateMachine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a page through analysis, recognition, design extraction, hierarchy
 * building and conversion. The analyzed page is immutable, so one page can be
 * converted for several builders concurrently.
 */
public class ConversionPipeline {

    private final ElementAnalyzer elementAnalyzer;
    private final ComponentRecognizer recognizer;
    private final TypographyExtractor typographyExtractor;
    private final DesignTokenExtractor designTokenExtractor;
    private final HierarchyBuilder hierarchyBuilder;
    private final HierarchyPruner hierarchyPruner = new HierarchyPruner();

    public ConversionPipeline() {
        this(new ComponentRecognizer(), new HierarchyBuilder());
    }

    public ConversionPipeline(ComponentRecognizer recognizer, HierarchyBuilder hierarchyBuilder) {
        this.elementAnalyzer = new ElementAnalyzer();
        this.recognizer = recognizer;
        this.typographyExtractor = new TypographyExtractor();
        this.designTokenExtractor = new DesignTokenExtractor();
        this.hierarchyBuilder = hierarchyBuilder;
    }

    /**
     * Builder-independent result of the analysis stages.
     */
    public static class AnalyzedPage {
        public final RecognizedComponent root;
        public final List<RecognizedComponent> components; // pre-order
        public final List<ComponentHierarchy> hierarchy;
        public final TypographySystem typography;
        public final DesignTokens designTokens;
        public final int minConfidence;

        AnalyzedPage(RecognizedComponent root, List<RecognizedComponent> components,
                     List<ComponentHierarchy> hierarchy, TypographySystem typography,
                     DesignTokens designTokens, int minConfidence) {
            this.root = root;
            this.components = List.copyOf(components);
            this.hierarchy = List.copyOf(hierarchy);
            this.typography = typography;
            this.designTokens = designTokens;
            this.minConfidence = minConfidence;
        }
    }

    public AnalyzedPage analyze(DomNode root, int minConfidence) {
        AnalyzedElement page = elementAnalyzer.analyze(root);
        RecognizedComponent recognized = recognizer.recognizeTree(page, minConfidence);
        List<RecognizedComponent> components = ComponentRecognizer.flatten(recognized);
        TypographySystem typography = typographyExtractor.extract(components);
        DesignTokens designTokens = designTokenExtractor.extract(ElementAnalyzer.preOrder(page));
        List<ComponentHierarchy> hierarchy = hierarchyBuilder.build(recognized);
        return new AnalyzedPage(recognized, components, hierarchy, typography, designTokens, minConfidence);
    }

    public ConversionResult convert(DomNode root, ConversionOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Conversion options must not be null");
        }
        return convert(analyze(root, options.minConfidence), options);
    }

    /**
     * Converts an analyzed page for {@code options.targetBuilder}. Converter
     * failures move the conversion to {@code failed} and are rethrown. The
     * options must ask for the minimum confidence the page was analyzed with.
     * With {@code optimizeAssets} set, layout without widgets is left out of
     * the export and of the result's hierarchy.
     */
    public ConversionResult convert(AnalyzedPage page, ConversionOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Conversion options must not be null");
        }
        if (options.minConfidence != page.minConfidence) {
            throw new IllegalArgumentException("Options require minConfidence " + options.minConfidence
                    + " but the page was analyzed with " + page.minConfidence);
        }
        long start = System.nanoTime();
        ConversionStateMachine lifecycle = new ConversionStateMachine();
        lifecycle.transition(ConversionState.CONVERTING);

        List<ComponentHierarchy> hierarchy = options.optimizeAssets
                ? hierarchyPruner.prune(page.hierarchy)
                : page.hierarchy;
        ConverterOutput output;
        try {
            TargetConverter converter = BuilderRegistry.createConverter(options.targetBuilder);
            output = converter.convert(hierarchy, page.typography, page.designTokens, options);
        } catch (RuntimeException e) {
            lifecycle.fail();
            throw e;
        }

        lifecycle.transition(ConversionState.VALIDATING);
        ValidationResult validation = validateStructure(hierarchy, output);
        if (validation.errors.isEmpty()) {
            lifecycle.transition(ConversionState.DONE);
        } else {
            lifecycle.fail();
        }

        ConversionStats stats = stats(page, output);
        stats.conversionTime = (System.nanoTime() - start) / 1_000_000;
        return new ConversionResult(options.targetBuilder, lifecycle.state(), output.exportData,
                List.of(page.root), hierarchy, page.typography, page.designTokens,
                output.fallbacks, validation, stats);
    }

    /**
     * Converts the page once per builder, in parallel over the same analysis.
     * Results keep the order of {@code builders}.
     */
    public Map<PageBuilder, ConversionResult> convertAll(DomNode root, ConversionOptions options,
                                                         List<PageBuilder> builders) {
        if (options == null) {
            throw new IllegalArgumentException("Conversion options must not be null");
        }
        AnalyzedPage page = analyze(root, options.minConfidence);
        Map<PageBuilder, ConversionResult> converted = new ConcurrentHashMap<>();
        builders.parallelStream().forEach(builder -> converted.put(builder, convert(page, options.withTarget(builder))));

        Map<PageBuilder, ConversionResult> ordered = new LinkedHashMap<>();
        for (PageBuilder builder : builders) {
            ordered.put(builder, converted.get(builder));
        }
        return ordered;
    }

    /**
     * Checks the export against the hierarchy it was built from: something was
     * emitted, native ids are unique and every node is represented.
     */
    static ValidationResult validateStructure(List<ComponentHierarchy> hierarchy, ConverterOutput output) {
        ValidationResult result = new ValidationResult();

        if (output.exportData == null) {
            result.errors.add(new ValidationIssue("empty-export", "Converter produced no export data", null,
                    Severity.CRITICAL));
        } else if (output.nativeIds.isEmpty() && !hierarchy.isEmpty()) {
            result.errors.add(new ValidationIssue("empty-export", "Export contains no elements", null,
                    Severity.CRITICAL));
        } else if (hierarchy.isEmpty()) {
            result.warnings.add(new ValidationIssue("empty-page", "Page has no convertible content", null,
                    Severity.WARNING));
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String id : output.nativeIds) {
            if (!seen.add(id)) {
                duplicates.add(id);
            }
        }
        for (String id : duplicates) {
            result.errors.add(new ValidationIssue("duplicate-id", "Native id " + id + " is used more than once",
                    id, Severity.CRITICAL));
        }

        for (ComponentHierarchy root : hierarchy) {
            checkMapped(root, output.nodeMapping, result);
        }

        for (FallbackStrategy fallback : output.fallbacks) {
            Severity severity = fallback.strategy == FallbackStrategy.Strategy.HTML_WIDGET
                    ? Severity.WARNING : Severity.INFO;
            result.warnings.add(new ValidationIssue(fallback.strategy.getId(), fallback.reason, fallback.nodeId,
                    severity));
            result.suggestions.addAll(fallback.suggestions);
        }
        result.suggestions = new ArrayList<>(new LinkedHashSet<>(result.suggestions));

        result.isValid = result.errors.isEmpty();
        result.canExport = result.criticalViolations() == 0;
        result.requiresOverride = false;
        return result;
    }

    private static void checkMapped(ComponentHierarchy node, Map<String, String> nodeMapping,
                                    ValidationResult result) {
        if (!nodeMapping.containsKey(node.id)) {
            result.errors.add(new ValidationIssue("unmapped-node",
                    "Node " + node.id + " (" + node.type.getId() + ") has no element in the export",
                    node.id, Severity.HIGH));
        }
        if (node.isWidget()) {
            return;
        }
        for (ComponentHierarchy child : node.children) {
            checkMapped(child, nodeMapping, result);
        }
    }

    /**
     * Manual review counts the distinct nodes whose fallback asks for a
     * person to check the result; HTML fallbacks are counted separately.
     */
    static ConversionStats stats(AnalyzedPage page, ConverterOutput output) {
        ConversionStats stats = new ConversionStats();
        stats.totalElements = page.components.size();
        stats.recognizedComponents = (int) page.components.stream()
                .filter(component -> component.componentType != ComponentType.UNKNOWN)
                .count();
        stats.nativeWidgets = output.nativeWidgets;
        stats.htmlFallbacks = output.htmlFallbacks;
        stats.manualReview = (int) output.fallbacks.stream()
                .filter(fallback -> fallback.strategy != FallbackStrategy.Strategy.HTML_WIDGET)
                .map(fallback -> fallback.nodeId)
                .distinct()
                .count();
        stats.confidenceAverage = (int) Math.round(page.components.stream()
                .mapToInt(component -> component.recognition.confidence)
                .average()
                .orElse(0));
        return stats;
    }
}
