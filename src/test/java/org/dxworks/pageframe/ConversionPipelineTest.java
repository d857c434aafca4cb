package org.dxworks.pageframe;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.dxworks.pageframe.converter.elementor.ElementorExport;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.ConversionResult;
import org.dxworks.pageframe.model.ConversionState;
import org.dxworks.pageframe.model.FallbackStrategy;
import org.dxworks.pageframe.model.PageBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.dxworks.pageframe.dom.DomNode.element;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversionPipelineTest {

    private final ConversionPipeline pipeline = new ConversionPipeline();

    private static String htmlWidgetOf(PageBuilder builder) {
        return switch (builder) {
            case ELEMENTOR, BEAVER -> "html";
            case GUTENBERG -> "core/html";
            case DIVI -> "et_pb_code";
            case BRICKS -> "code";
            case OXYGEN -> "ct_code_block";
        };
    }

    @ParameterizedTest
    @EnumSource(PageBuilder.class)
    void landingPage_convertsForEveryBuilder(PageBuilder builder) throws JsonProcessingException {
        ConversionResult result = pipeline.convert(TestUtils.landingPage(), ConversionOptions.defaults(builder));

        assertEquals(ConversionState.DONE, result.state);
        assertEquals(builder, result.builder);
        assertNotNull(result.exportData);
        assertTrue(result.validation.errors.isEmpty(), () -> "unexpected errors for " + builder);
        assertEquals(16, result.stats.totalElements);
        assertEquals(15, result.stats.recognizedComponents);

        FallbackStrategy marquee = result.fallbacks.stream()
                .filter(fallback -> fallback.strategy == FallbackStrategy.Strategy.HTML_WIDGET)
                .filter(fallback -> fallback.originalHTML.contains("<marquee>"))
                .findFirst()
                .orElseThrow();
        assertEquals("Unrecognized <marquee> element", marquee.reason);
        assertTrue(result.stats.htmlFallbacks >= 1);
        assertTrue(App.MAPPER.writeValueAsString(result.exportData).contains("\"" + htmlWidgetOf(builder) + "\""));
    }

    @ParameterizedTest
    @EnumSource(PageBuilder.class)
    void everyHierarchyNode_isMapped(PageBuilder builder) {
        ConversionPipeline.AnalyzedPage page = pipeline.analyze(TestUtils.landingPage(), 60);
        ConverterOutput output = BuilderRegistry.createConverter(builder)
                .convert(page.hierarchy, page.typography, page.designTokens, ConversionOptions.defaults(builder));

        List<String> ids = new ArrayList<>();
        page.hierarchy.forEach(root -> collectIds(root, ids));
        for (String id : ids) {
            assertTrue(output.nodeMapping.containsKey(id), () -> builder + " left " + id + " unmapped");
        }
        assertEquals(output.nativeIds.size(), output.nativeIds.stream().distinct().count());
    }

    private static void collectIds(ComponentHierarchy node, List<String> ids) {
        ids.add(node.id);
        if (!node.isWidget()) {
            node.children.forEach(child -> collectIds(child, ids));
        }
    }

    @ParameterizedTest
    @EnumSource(PageBuilder.class)
    void sameInput_producesSameExport(PageBuilder builder) throws JsonProcessingException {
        ConversionOptions options = ConversionOptions.defaults(builder);

        String first = App.MAPPER.writeValueAsString(pipeline.convert(TestUtils.landingPage(), options).exportData);
        String second = App.MAPPER.writeValueAsString(
                new ConversionPipeline().convert(TestUtils.landingPage(), options).exportData);

        assertEquals(first, second);
    }

    @ParameterizedTest
    @EnumSource(PageBuilder.class)
    void raisingMinConfidence_neverReducesHtmlFallbacks(PageBuilder builder) {
        int previous = -1;
        for (int confidence = 0; confidence <= 100; confidence += 10) {
            ConversionOptions options = ConversionOptions.defaults(builder).withMinConfidence(confidence);
            int fallbacks = pipeline.convert(TestUtils.landingPage(), options).stats.htmlFallbacks;

            assertTrue(fallbacks >= previous, "html fallbacks dropped at " + confidence + "% for " + builder);
            previous = fallbacks;
        }
    }

    @Test
    void lowConfidenceWithoutHtmlFallback_isKeptForReview() {
        DomNode root = element("div").child(element("div").text("Plain words"));
        ConversionOptions options = ConversionOptions.defaults(PageBuilder.ELEMENTOR)
                .withMinConfidence(70)
                .withFallbackToHtml(false);

        ConversionResult result = pipeline.convert(root, options);

        assertEquals(0, result.stats.htmlFallbacks);
        assertEquals(1, result.stats.manualReview);
        assertTrue(result.fallbacks.stream()
                .allMatch(fallback -> fallback.strategy == FallbackStrategy.Strategy.MANUAL_REVIEW));
    }

    @ParameterizedTest
    @EnumSource(PageBuilder.class)
    void lowConfidenceWrapper_recordsHtmlFallback(PageBuilder builder) {
        DomNode root = element("body").child(element("div").child(
                element("h1").text("Welcome"),
                element("p").text("Hello there")));
        ConversionOptions options = ConversionOptions.defaults(builder).withMinConfidence(70);

        ConversionResult result = pipeline.convert(root, options);

        FallbackStrategy wrapper = result.fallbacks.stream()
                .filter(fallback -> fallback.nodeId.equals("node-0"))
                .findFirst()
                .orElseThrow();
        assertEquals(FallbackStrategy.Strategy.HTML_WIDGET, wrapper.strategy);
        assertEquals("Recognized as container with 65% confidence, below the 70% minimum", wrapper.reason);
        assertEquals(1, result.stats.htmlFallbacks);
        assertEquals(0, result.stats.manualReview);
        assertTrue(result.validation.errors.isEmpty());
    }

    private static DomNode pageWithEmptyLayout() {
        return element("body").child(
                element("div").attr("class", "row").child(
                        element("div").attr("class", "col-md-6").child(element("h2").text("Kept")),
                        element("div").attr("class", "col-md-6")),
                element("section").attr("class", "band"));
    }

    @Test
    void optimizeAssets_dropsLayoutWithoutWidgets() {
        ConversionOptions options = ConversionOptions.defaults(PageBuilder.ELEMENTOR);

        ConversionResult result = pipeline.convert(pageWithEmptyLayout(), options);

        assertEquals(1, result.hierarchy.size());
        ComponentHierarchy row = result.hierarchy.get(0).children.get(0);
        assertEquals(1, row.children.size());
        assertEquals(100.0, row.children.get(0).columnSize);
        assertEquals(1, ((ElementorExport) result.exportData).content.size());
        assertTrue(result.validation.errors.isEmpty());
    }

    @Test
    void withoutOptimizeAssets_emptyLayoutIsKept() {
        ConversionOptions options = ConversionOptions.defaults(PageBuilder.ELEMENTOR).withOptimizeAssets(false);

        ConversionResult result = pipeline.convert(pageWithEmptyLayout(), options);

        assertEquals(2, result.hierarchy.size());
        ComponentHierarchy row = result.hierarchy.get(0).children.get(0);
        assertEquals(List.of(50.0, 50.0), row.children.stream().map(column -> column.columnSize).toList());
        assertEquals(2, ((ElementorExport) result.exportData).content.size());
        assertTrue(result.validation.errors.isEmpty());
    }

    @Test
    void analyzedPage_rejectsOptionsWithAnotherMinConfidence() {
        ConversionPipeline.AnalyzedPage page = pipeline.analyze(TestUtils.landingPage(), 60);
        ConversionOptions options = ConversionOptions.defaults(PageBuilder.DIVI).withMinConfidence(80);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> pipeline.convert(page, options));

        assertEquals("Options require minConfidence 80 but the page was analyzed with 60", error.getMessage());
    }

    @Test
    void emptyPage_isConvertedWithAWarning() {
        ConversionResult result = pipeline.convert(element("body"), ConversionOptions.defaults(PageBuilder.BRICKS));

        assertEquals(ConversionState.DONE, result.state);
        assertTrue(result.hierarchy.isEmpty());
        assertEquals("empty-page", result.validation.warnings.get(0).type);
    }

    @Test
    void convertAll_keepsRequestedOrder() {
        List<PageBuilder> builders = List.of(PageBuilder.OXYGEN, PageBuilder.GUTENBERG, PageBuilder.ELEMENTOR);

        Map<PageBuilder, ConversionResult> results = pipeline.convertAll(TestUtils.landingPage(),
                ConversionOptions.defaults(PageBuilder.ELEMENTOR), builders);

        assertEquals(builders, new ArrayList<>(results.keySet()));
        results.forEach((builder, result) -> assertEquals(builder, result.builder));
    }

    @Test
    void missingOptions_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> pipeline.convert(TestUtils.landingPage(), null));
        assertThrows(IllegalArgumentException.class,
                () -> pipeline.convertAll(TestUtils.landingPage(), null, List.of(PageBuilder.DIVI)));
    }
}
