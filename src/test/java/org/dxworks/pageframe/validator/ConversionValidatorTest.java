package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.ConversionPipeline;
import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.ConversionResult;
import org.dxworks.pageframe.model.PageBuilder;
import org.dxworks.pageframe.model.validation.ValidationIssue;
import org.dxworks.pageframe.model.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversionValidatorTest {

    private static final AssetProbe ALL_REACHABLE = (url, timeout) -> AssetProbeResult.status(200);
    private static final ValidationOptions DESKTOP_ONLY = ValidationOptions.defaults()
            .withViewports(List.of(Viewport.DESKTOP));

    private static List<String> types(List<ValidationIssue> issues) {
        return issues.stream().map(issue -> issue.type).toList();
    }

    @Test
    void matchingPages_pass() {
        ValidationResult result = new ConversionValidator(Pages.blankRenderer(), ALL_REACHABLE)
                .validate("<h1>Hi</h1>", "<h1>Hi</h1>", DESKTOP_ONLY);

        assertTrue(result.isValid);
        assertTrue(result.canExport);
        assertFalse(result.requiresOverride);
        assertEquals(100, result.overallScore);
        assertEquals(1, result.visualComparisons.size());
        assertTrue(result.errors.isEmpty());
    }

    @Test
    void unsupportedFramework_blocksExport() {
        String converted = "<div id=\"root\"></div><script>ReactDOM.render(app, root);</script>";

        ValidationResult result = new ConversionValidator(Pages.blankRenderer(), ALL_REACHABLE)
                .validate("<div id=\"root\"></div>", converted, DESKTOP_ONLY);

        assertFalse(result.canExport);
        assertFalse(result.isValid);
        assertTrue(types(result.errors).contains("incompatibility"));
        assertEquals(68, result.overallScore);
    }

    @Test
    void renderTimeout_requiresOverride() {
        ValidationOptions options = DESKTOP_ONLY.withTimeout(Duration.ofMillis(100));

        ValidationResult result = new ConversionValidator(Pages.hangingRenderer(), ALL_REACHABLE)
                .validate("<p>a</p>", "<p>a</p>", options);

        assertTrue(result.requiresOverride);
        assertEquals(List.of("render-failed"), types(result.warnings));
        assertTrue(result.visualComparisons.isEmpty());
        assertTrue(result.canExport);
    }

    @Test
    void droppedAsset_isAnError() {
        String original = "<img src=\"https://cdn.example.com/team.jpg\"><p>Team</p>";

        ValidationResult result = new ConversionValidator(Pages.blankRenderer(), ALL_REACHABLE)
                .validate(original, "<p>Team</p>", DESKTOP_ONLY.withChecks(false, true, false));

        assertEquals(List.of("assets-removed"), types(result.errors));
        assertTrue(result.suggestions.contains("Check removed assets: https://cdn.example.com/team.jpg"));
        assertTrue(result.canExport);
        assertFalse(result.isValid);
    }

    @Test
    void missingImage_isCritical() {
        AssetProbe notFound = (url, timeout) -> AssetProbeResult.status(404);
        String html = "<img src=\"https://cdn.example.com/gone.png\">";

        ValidationResult result = new ConversionValidator(Pages.blankRenderer(), notFound)
                .validate(html, html, DESKTOP_ONLY.withChecks(false, true, false));

        assertEquals(List.of("missing-asset"), types(result.errors));
        assertFalse(result.canExport);
        assertEquals(0, result.overallScore);
    }

    @Test
    void relativeAssetWithoutBaseUrl_isAWarningNotAVerifiedAsset() {
        String html = "<img src=\"/img/team.jpg\"><p>Team</p>";

        ValidationResult result = new ConversionValidator(Pages.blankRenderer(), ALL_REACHABLE)
                .validate(html, html, DESKTOP_ONLY.withChecks(false, true, false));

        assertTrue(types(result.warnings).contains("asset-unverified"));
        assertEquals(0, result.assetVerification.verifiedAssets);
        assertTrue(result.suggestions.contains("Set a base url so relative assets can be verified"));
        assertTrue(result.errors.isEmpty());
    }

    @Test
    void nullPages_areRejected() {
        ConversionValidator validator = new ConversionValidator(Pages.blankRenderer(), ALL_REACHABLE);

        assertThrows(IllegalArgumentException.class, () -> validator.validate(null, "<p/>", DESKTOP_ONLY));
    }

    @Test
    void conversionResult_keepsStructuralFindingsFirst() {
        ConversionResult conversion = new ConversionPipeline().convert(TestUtils.landingPage(),
                ConversionOptions.defaults(PageBuilder.ELEMENTOR));

        ConversionResult validated = new ConversionValidator(Pages.blankRenderer(), ALL_REACHABLE)
                .validate(conversion, "<h1>Build faster</h1>", "<h1>Build faster</h1>", DESKTOP_ONLY);

        assertSame(conversion.state, validated.state);
        assertSame(conversion.exportData, validated.exportData);
        int structural = conversion.validation.warnings.size();
        assertEquals(conversion.validation.warnings, validated.validation.warnings.subList(0, structural));
        assertTrue(types(validated.validation.warnings).contains("html-widget"));
        assertEquals(1, validated.validation.visualComparisons.size());
        assertTrue(validated.validation.canExport);
    }
}
