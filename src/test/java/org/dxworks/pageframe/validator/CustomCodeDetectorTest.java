package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.validation.CustomCodeDetection;
import org.dxworks.pageframe.model.validation.DetectedFeature;
import org.dxworks.pageframe.model.validation.Incompatibility;
import org.dxworks.pageframe.model.validation.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CustomCodeDetectorTest {

    private final CustomCodeDetector detector = new CustomCodeDetector();

    private static List<String> features(CustomCodeDetection detection) {
        return detection.detectedFeatures.stream().map(feature -> feature.feature).toList();
    }

    @Test
    void plainMarkup_hasNoCustomCode() {
        CustomCodeDetection detection = detector.detect("<h1>Hello</h1>");

        assertFalse(detection.hasCustomJS);
        assertFalse(detection.hasCustomCSS);
        assertTrue(detection.canBeConverted);
        assertEquals(100, detection.conversionScore);
    }

    @Test
    void reactBundle_blocksConversion() {
        CustomCodeDetection detection = detector.detect(
                "<div id=\"app\"></div><script src=\"https://unpkg.com/react@18/umd/react.production.min.js\"></script>");

        assertTrue(detection.hasCustomJS);
        assertFalse(detection.canBeConverted);
        assertEquals(1, detection.blockingCount());
        assertEquals("React", detection.incompatibilities.get(0).name);
        assertEquals(68, detection.conversionScore);
    }

    @Test
    void jQuery_isSupported() {
        CustomCodeDetection detection = detector.detect(
                "<script src=\"/js/jquery-3.7.1.min.js\"></script><script>$('.menu').hide();</script>");

        assertTrue(detection.canBeConverted);
        DetectedFeature jquery = detection.detectedFeatures.get(0);
        assertEquals("jQuery", jquery.feature);
        assertTrue(jquery.isSupported);
        assertEquals(1, detection.detectedFeatures.stream().filter(feature -> feature.feature.equals("jQuery")).count());
        assertEquals(100, detection.conversionScore);
    }

    @Test
    void domChangesAndFetch_areWarned() {
        CustomCodeDetection detection = detector.detect(
                "<script>document.body.appendChild(x); fetch('/api');</script>");

        assertEquals(List.of("DOM Manipulation", "AJAX/Fetch"), features(detection));
        assertEquals(List.of(Severity.WARNING, Severity.CRITICAL),
                detection.conversionWarnings.stream().map(warning -> warning.severity).toList());
        assertEquals(96, detection.conversionScore);
        assertTrue(detection.canBeConverted);
    }

    @Test
    void eventHandlers_needAPropertyAssignment() {
        assertFalse(features(detector.detect("<script>var one = 1; if (one == 1) {}</script>"))
                .contains("Event Listeners"));
        assertTrue(features(detector.detect("<script>button.onclick = go;</script>"))
                .contains("Event Listeners"));
    }

    @Test
    void canvasAndSockets_areIncompatible() {
        CustomCodeDetection detection = detector.detect("<script>"
                + "var ctx = el.getContext('2d');"
                + "var ws = new WebSocket('wss://live.example.com');"
                + "</script>");

        assertEquals(List.of(Incompatibility.Impact.BLOCKING, Incompatibility.Impact.DEGRADED),
                detection.incompatibilities.stream().map(incompatibility -> incompatibility.impact).toList());
        assertFalse(detection.canBeConverted);
        assertEquals(55, detection.conversionScore);
    }

    @Test
    void modernCss_isGradedByImpact() {
        CustomCodeDetection detection = detector.detect("<style>"
                + "@media (max-width: 600px) { .grid { display: grid; } }"
                + "@supports (display: grid) { .a { color: red; } }"
                + ".card:has(img) { padding: 0; }"
                + "@property --angle { syntax: '<angle>'; inherits: false; initial-value: 0deg; }"
                + "</style>");

        assertTrue(detection.hasCustomCSS);
        assertFalse(detection.hasCustomJS);
        assertTrue(features(detection).containsAll(List.of("Media Queries", "CSS Grid")));
        assertEquals(List.of("@supports", ":has()", "@property"),
                detection.incompatibilities.stream().map(incompatibility -> incompatibility.name).toList());
        assertEquals(65, detection.conversionScore);
        assertTrue(detection.canBeConverted);
    }
}
