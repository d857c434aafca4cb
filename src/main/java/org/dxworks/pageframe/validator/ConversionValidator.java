package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.ConversionResult;
import org.dxworks.pageframe.model.validation.AssetType;
import org.dxworks.pageframe.model.validation.AssetVerificationResult;
import org.dxworks.pageframe.model.validation.BrokenAsset;
import org.dxworks.pageframe.model.validation.ConversionWarning;
import org.dxworks.pageframe.model.validation.CustomCodeDetection;
import org.dxworks.pageframe.model.validation.DetectedFeature;
import org.dxworks.pageframe.model.validation.Incompatibility;
import org.dxworks.pageframe.model.validation.MissingAsset;
import org.dxworks.pageframe.model.validation.Severity;
import org.dxworks.pageframe.model.validation.StyleDiscrepancy;
import org.dxworks.pageframe.model.validation.UnverifiedAsset;
import org.dxworks.pageframe.model.validation.ValidationIssue;
import org.dxworks.pageframe.model.validation.ValidationResult;
import org.dxworks.pageframe.model.validation.VisualComparisonResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Post-conversion checks against the rendered original and converted pages.
 * Rendering and probe failures never fail the validation outright; they are
 * reported as warnings and the result asks for a manual override.
 */
public class ConversionValidator {

    static final int PASSING_SCORE = 80;
    static final int GOOD_SIMILARITY = 90;
    static final int GOOD_ASSET_SCORE = 90;
    static final int GOOD_CONVERSION_SCORE = 70;

    private final VisualComparator visualComparator;
    private final AssetVerifier assetVerifier;
    private final CustomCodeDetector customCodeDetector;

    /**
     * Validator that probes assets over HTTP.
     */
    public ConversionValidator(PageRenderer renderer) {
        this(renderer, new HttpAssetProbe());
    }

    public ConversionValidator(PageRenderer renderer, AssetProbe probe) {
        this(new VisualComparator(renderer), new AssetVerifier(probe), new CustomCodeDetector());
    }

    public ConversionValidator(VisualComparator visualComparator, AssetVerifier assetVerifier,
                               CustomCodeDetector customCodeDetector) {
        this.visualComparator = visualComparator;
        this.assetVerifier = assetVerifier;
        this.customCodeDetector = customCodeDetector;
    }

    public ValidationResult validate(String originalHtml, String convertedHtml, ValidationOptions options) {
        if (originalHtml == null || convertedHtml == null) {
            throw new IllegalArgumentException("Both the original and the converted page are required");
        }
        Objects.requireNonNull(options, "options");

        ValidationResult result = new ValidationResult();
        List<Integer> scores = new ArrayList<>();

        if (options.runVisualComparison) {
            compareVisually(originalHtml, convertedHtml, options, result, scores);
        }
        if (options.runAssetVerification) {
            verifyAssets(originalHtml, convertedHtml, options, result, scores);
        }
        if (options.runCustomCodeDetection) {
            detectCustomCode(convertedHtml, result, scores);
        }

        result.overallScore = scores.stream().mapToInt(Integer::intValue).min().orElse(100);
        result.suggestions = new ArrayList<>(new LinkedHashSet<>(result.suggestions));
        long blocking = result.customCodeDetection != null ? result.customCodeDetection.blockingCount() : 0;
        result.canExport = blocking == 0 && result.criticalViolations() == 0;
        result.isValid = result.errors.isEmpty() && result.overallScore >= PASSING_SCORE;
        return result;
    }

    /**
     * Validates the rendered pages of a finished conversion and merges the
     * findings with the structural checks already on the result. The
     * conversion state is left as it is.
     */
    public ConversionResult validate(ConversionResult conversion, String originalHtml, String convertedHtml,
                                     ValidationOptions options) {
        ValidationResult rendered = validate(originalHtml, convertedHtml, options);
        ValidationResult structural = conversion.validation;
        if (structural != null) {
            rendered.errors.addAll(0, structural.errors);
            rendered.warnings.addAll(0, structural.warnings);
            Set<String> suggestions = new LinkedHashSet<>(structural.suggestions);
            suggestions.addAll(rendered.suggestions);
            rendered.suggestions = new ArrayList<>(suggestions);
            rendered.canExport = rendered.canExport && structural.canExport;
            rendered.isValid = rendered.isValid && structural.isValid;
        }
        return conversion.withValidation(rendered, conversion.state);
    }

    private void compareVisually(String originalHtml, String convertedHtml, ValidationOptions options,
                                 ValidationResult result, List<Integer> scores) {
        VisualComparator.Comparisons comparisons = visualComparator.compare(originalHtml, convertedHtml, options);
        result.visualComparisons = comparisons.results;

        for (Map.Entry<Viewport, String> failure : comparisons.failures.entrySet()) {
            result.warnings.add(new ValidationIssue("render-failed", failure.getValue(), failure.getKey().getId(),
                    Severity.WARNING));
            result.requiresOverride = true;
        }

        for (VisualComparisonResult comparison : comparisons.results) {
            String viewport = comparison.viewport;
            if (comparison.similarityScore < PASSING_SCORE) {
                result.errors.add(new ValidationIssue("visual-similarity",
                        "Visual similarity is low at " + viewport + ": " + comparison.similarityScore + "%",
                        viewport, Severity.CRITICAL));
                result.suggestions.add("Review the visual differences to find what changed in the layout");
            } else if (comparison.similarityScore < GOOD_SIMILARITY) {
                result.warnings.add(new ValidationIssue("visual-similarity",
                        "Visual similarity could be improved at " + viewport + ": " + comparison.similarityScore + "%",
                        viewport, Severity.MEDIUM));
            }

            if (!comparison.dimensionsMatch) {
                result.warnings.add(new ValidationIssue("dimensions",
                        "Page dimensions differ at " + viewport + ": " + comparison.originalWidth + "x"
                                + comparison.originalHeight + " vs " + comparison.convertedWidth + "x"
                                + comparison.convertedHeight, viewport, Severity.MEDIUM));
                result.suggestions.add("Check for missing content or layout issues");
            }

            List<String> missing = comparison.comparisonMetrics.missingElements;
            if (!missing.isEmpty()) {
                result.errors.add(new ValidationIssue("missing-elements",
                        missing.size() + " elements missing at " + viewport, viewport, Severity.HIGH));
                result.suggestions.add("Missing elements: " + String.join(", ", missing.subList(0, Math.min(5, missing.size()))));
            }
            if (!comparison.comparisonMetrics.extraElements.isEmpty()) {
                result.warnings.add(new ValidationIssue("extra-elements",
                        comparison.comparisonMetrics.extraElements.size() + " extra elements at " + viewport,
                        viewport, Severity.LOW));
            }

            long major = comparison.comparisonMetrics.styleDiscrepancies.stream()
                    .filter(discrepancy -> discrepancy.severity == StyleDiscrepancy.Level.MAJOR)
                    .count();
            if (major > 0) {
                result.errors.add(new ValidationIssue("style-discrepancy",
                        major + " major style discrepancies at " + viewport, viewport, Severity.HIGH));
                result.suggestions.add("Review style differences in critical elements");
            }
            scores.add((int) Math.round(comparison.similarityScore));
        }
    }

    private void verifyAssets(String originalHtml, String convertedHtml, ValidationOptions options,
                              ValidationResult result, List<Integer> scores) {
        AssetVerificationResult verification = assetVerifier.verify(convertedHtml, options);
        result.assetVerification = verification;

        Set<String> convertedUrls = allUrls(AssetVerifier.extract(convertedHtml, options.baseUrl));
        List<String> removed = new ArrayList<>(allUrls(AssetVerifier.extract(originalHtml, options.baseUrl)));
        removed.removeAll(convertedUrls);
        if (!removed.isEmpty()) {
            result.errors.add(new ValidationIssue("assets-removed",
                    removed.size() + " assets removed during conversion", null, Severity.HIGH));
            result.suggestions.add("Check removed assets: " + String.join(", ", removed.subList(0, Math.min(3, removed.size()))));
        }

        for (MissingAsset missing : verification.missingAssets) {
            ValidationIssue issue = new ValidationIssue("missing-asset",
                    "Missing " + missing.type.getId() + ": " + missing.url, missing.url, missing.severity);
            if (missing.severity == Severity.CRITICAL) {
                result.errors.add(issue);
            } else {
                result.warnings.add(issue);
            }
            result.suggestions.add(missing.suggestion);
        }

        for (BrokenAsset broken : verification.brokenAssets) {
            if (broken.statusCode == null) {
                result.warnings.add(new ValidationIssue("asset-check-failed",
                        "Could not verify " + broken.type.getId() + " " + broken.url + ": " + broken.error,
                        broken.url, Severity.WARNING));
                result.requiresOverride = true;
            } else {
                result.errors.add(new ValidationIssue("broken-asset",
                        "Broken " + broken.type.getId() + " (" + broken.statusCode + "): " + broken.url,
                        broken.url, Severity.HIGH));
                result.suggestions.add("Fix broken " + broken.type.getId() + ": " + broken.url);
            }
        }

        for (UnverifiedAsset unverified : verification.unverifiedAssets) {
            result.warnings.add(new ValidationIssue("asset-unverified",
                    "Could not verify " + unverified.type.getId() + " " + unverified.url + ": " + unverified.reason,
                    unverified.url, Severity.WARNING));
        }
        if (!verification.unverifiedAssets.isEmpty()) {
            result.suggestions.add("Set a base url so relative assets can be verified");
        }

        if (verification.verificationScore < GOOD_ASSET_SCORE) {
            result.warnings.add(new ValidationIssue("asset-score",
                    "Asset verification score: " + verification.verificationScore + "%", null, Severity.MEDIUM));
            result.suggestions.add("Ensure all assets are properly linked and accessible");
        }
        scores.add(verification.verificationScore);
    }

    private void detectCustomCode(String convertedHtml, ValidationResult result, List<Integer> scores) {
        CustomCodeDetection detection = customCodeDetector.detect(convertedHtml);
        result.customCodeDetection = detection;

        if (!detection.canBeConverted) {
            result.suggestions.add("Use custom HTML widgets for functionality the builder cannot express");
        }
        if (detection.conversionScore < GOOD_CONVERSION_SCORE) {
            result.warnings.add(new ValidationIssue("conversion-score",
                    "Conversion score is low: " + detection.conversionScore + "%", null, Severity.MEDIUM));
        }

        for (Incompatibility incompatibility : detection.incompatibilities) {
            if (incompatibility.impact == Incompatibility.Impact.BLOCKING) {
                result.errors.add(new ValidationIssue("incompatibility",
                        "Blocking incompatibility: " + incompatibility.name + " - " + incompatibility.reason,
                        incompatibility.name, Severity.HIGH));
            } else {
                result.warnings.add(new ValidationIssue("incompatibility",
                        incompatibility.name + " - " + incompatibility.reason, incompatibility.name,
                        incompatibility.impact == Incompatibility.Impact.DEGRADED ? Severity.MEDIUM : Severity.LOW));
            }
            if (incompatibility.workaround != null) {
                result.suggestions.add("Workaround: " + incompatibility.workaround);
            }
        }

        for (ConversionWarning warning : detection.conversionWarnings) {
            ValidationIssue issue = new ValidationIssue(warning.type, warning.message, null, warning.severity);
            if (warning.severity == Severity.CRITICAL) {
                result.errors.add(issue);
                if (warning.suggestion != null) {
                    result.suggestions.add(warning.suggestion);
                }
            } else {
                result.warnings.add(issue);
            }
        }

        for (DetectedFeature feature : detection.detectedFeatures) {
            if (!feature.isSupported && feature.alternative != null) {
                result.suggestions.add(feature.feature + ": " + feature.alternative);
            }
        }
        scores.add(detection.conversionScore);
    }

    private static Set<String> allUrls(Map<AssetType, Map<String, List<String>>> assets) {
        Set<String> urls = new LinkedHashSet<>();
        assets.values().forEach(byUrl -> urls.addAll(byUrl.keySet()));
        return urls;
    }
}
