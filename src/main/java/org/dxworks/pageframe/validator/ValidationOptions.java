package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.PageframeConfig;

import java.time.Duration;
import java.util.List;

public class ValidationOptions {
    public static final double DEFAULT_PIXEL_THRESHOLD = 0.1;

    public final List<Viewport> viewports;
    public final Duration timeout;
    public final int maxConcurrency;
    public final double pixelThreshold; // per channel, 0-1
    public final String baseUrl; // resolves relative asset urls, may be null
    public final boolean runVisualComparison;
    public final boolean runAssetVerification;
    public final boolean runCustomCodeDetection;

    public ValidationOptions(List<Viewport> viewports, Duration timeout, int maxConcurrency, double pixelThreshold,
                             String baseUrl, boolean runVisualComparison, boolean runAssetVerification,
                             boolean runCustomCodeDetection) {
        if (viewports == null || viewports.isEmpty()) {
            throw new IllegalArgumentException("At least one viewport is required");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Validation timeout must be positive");
        }
        this.viewports = List.copyOf(viewports);
        this.timeout = timeout;
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.pixelThreshold = Math.max(0, Math.min(1, pixelThreshold));
        this.baseUrl = baseUrl;
        this.runVisualComparison = runVisualComparison;
        this.runAssetVerification = runAssetVerification;
        this.runCustomCodeDetection = runCustomCodeDetection;
    }

    public static ValidationOptions defaults() {
        return from(PageframeConfig.defaults());
    }

    public static ValidationOptions from(PageframeConfig config) {
        return new ValidationOptions(List.of(Viewport.values()), Duration.ofMillis(config.getValidationTimeoutMillis()),
                config.getMaxConcurrentRenders(), DEFAULT_PIXEL_THRESHOLD, null, true, true, true);
    }

    public ValidationOptions withViewports(List<Viewport> viewports) {
        return new ValidationOptions(viewports, timeout, maxConcurrency, pixelThreshold, baseUrl,
                runVisualComparison, runAssetVerification, runCustomCodeDetection);
    }

    public ValidationOptions withTimeout(Duration timeout) {
        return new ValidationOptions(viewports, timeout, maxConcurrency, pixelThreshold, baseUrl,
                runVisualComparison, runAssetVerification, runCustomCodeDetection);
    }

    public ValidationOptions withBaseUrl(String baseUrl) {
        return new ValidationOptions(viewports, timeout, maxConcurrency, pixelThreshold, baseUrl,
                runVisualComparison, runAssetVerification, runCustomCodeDetection);
    }

    public ValidationOptions withChecks(boolean visual, boolean assets, boolean customCode) {
        return new ValidationOptions(viewports, timeout, maxConcurrency, pixelThreshold, baseUrl,
                visual, assets, customCode);
    }
}
