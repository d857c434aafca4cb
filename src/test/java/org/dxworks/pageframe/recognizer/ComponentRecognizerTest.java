package org.dxworks.pageframe.recognizer;

import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.analyzer.ElementAnalyzer;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.RecognitionResult;
import org.dxworks.pageframe.model.RecognizedComponent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.pageframe.dom.DomNode.element;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentRecognizerTest {

    private final ElementAnalyzer analyzer = new ElementAnalyzer();
    private final ComponentRecognizer recognizer = new ComponentRecognizer();

    private RecognitionResult recognize(DomNode node, int minConfidence) {
        return recognizer.recognize(analyzer.analyze(node), minConfidence);
    }

    @Test
    void recognizeTree_landingPage_typesInPreOrder() {
        RecognizedComponent root = recognizer.recognizeTree(analyzer.analyze(TestUtils.landingPage()), 60);
        List<RecognizedComponent> all = ComponentRecognizer.flatten(root);

        assertEquals(16, all.size());
        assertEquals("el-0", all.get(0).id);
        assertEquals("el-15", all.get(15).id);
        assertEquals(List.of(
                ComponentType.CONTAINER, ComponentType.HERO, ComponentType.HEADING, ComponentType.PARAGRAPH,
                ComponentType.BUTTON, ComponentType.ROW, ComponentType.COLUMN, ComponentType.HEADING,
                ComponentType.PARAGRAPH, ComponentType.COLUMN, ComponentType.HEADING, ComponentType.IMAGE,
                ComponentType.UNKNOWN, ComponentType.FORM, ComponentType.INPUT, ComponentType.SUBMIT_BUTTON),
                all.stream().map(c -> c.componentType).collect(Collectors.toList()));
    }

    @Test
    void recognize_marquee_isUnknownAndFlaggedForReview() {
        RecognitionResult result = recognize(element("marquee").text("Sale!"), 60);

        assertEquals(ComponentType.UNKNOWN, result.componentType);
        assertEquals(0, result.confidence);
        assertTrue(result.manualReviewNeeded);
        assertTrue(result.matchedPatterns.isEmpty());
    }

    @Test
    void recognize_headingTag() {
        RecognitionResult result = recognize(element("h2").text("Features"), 60);

        assertEquals(ComponentType.HEADING, result.componentType);
        assertEquals(95, result.confidence);
        assertEquals(List.of("heading-tag"), result.matchedPatterns);
        assertFalse(result.manualReviewNeeded);
        assertNull(result.fallbackType);
    }

    @Test
    void recognize_classBeatsTag() {
        RecognitionResult result = recognize(element("a").attr("class", "button").attr("href", "#").text("Go"), 60);

        assertEquals(ComponentType.BUTTON, result.componentType);
    }

    @Test
    void recognize_belowMinimumConfidence_requestsReview() {
        DomNode textBlock = element("div").text("Plain text");

        RecognitionResult accepted = recognize(textBlock, 60);
        RecognitionResult doubtful = recognize(textBlock, 70);

        assertEquals(ComponentType.TEXT, accepted.componentType);
        assertFalse(accepted.manualReviewNeeded);
        assertEquals(65, doubtful.confidence);
        assertTrue(doubtful.manualReviewNeeded);
        assertEquals(ComponentType.UNKNOWN, doubtful.fallbackType);
    }

    @Test
    void recognize_formContextDecidesButtonType() {
        AnalyzedElement form = analyzer.analyze(element("form").child(element("button").text("Send")));

        RecognitionResult button = recognizer.recognize(form.children.get(0), 60);

        assertEquals(ComponentType.SUBMIT_BUTTON, button.componentType);
    }

    @Test
    void recognize_imageHeadingAndText_isCard() {
        RecognitionResult result = recognize(element("div").child(
                element("img").attr("src", "https://cdn.example.com/card.png"),
                element("h3").text("Card title"),
                element("p").text("Card text")), 60);

        assertEquals(ComponentType.CARD, result.componentType);
        assertEquals(List.of("card-structure"), result.matchedPatterns);
    }

    @Test
    void recognize_wrapperAroundColumns_staysLayout() {
        DomNode wrapper = element("div").attr("class", "container").child(
                element("div").attr("class", "row").child(
                        element("div").attr("class", "col-6").child(
                                element("h2").text("Fast"), element("p").text("Renders fast.")),
                        element("div").attr("class", "col-6").child(
                                element("img").attr("src", "https://cdn.example.com/fast.png"))));

        assertEquals(ComponentType.CONTAINER, recognize(wrapper, 60).componentType);
        assertEquals(ComponentType.ROW, recognize(wrapper.children.get(0), 60).componentType);
    }

    @Test
    void recognize_pricingSection_isSectionNotPricingTable() {
        DomNode section = element("section").attr("class", "pricing").child(
                element("div").attr("class", "row").child(
                        element("div").attr("class", "col-md-6").child(element("h3").text("Basic")),
                        element("div").attr("class", "col-md-6").child(element("h3").text("Pro"))));

        assertEquals(ComponentType.SECTION, recognize(section, 60).componentType);
    }

    @Test
    void analyze_nullRoot_failsFast() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(null));
    }
}
