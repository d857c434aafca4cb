package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.validation.ComparisonMetrics;
import org.dxworks.pageframe.model.validation.StyleDiscrepancy;
import org.dxworks.pageframe.model.validation.VisualComparisonResult;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders the original and converted page at each viewport and compares
 * screenshots pixel by pixel and computed styles selector by selector.
 * Viewports are compared concurrently on a bounded pool; the call returns
 * only after every viewport has finished, failed or timed out.
 */
public class VisualComparator {

    static final int MAX_STYLE_DISCREPANCIES = 50;

    private static final Set<String> MAJOR_PROPERTIES =
            Set.of("color", "background-color", "display", "font-size", "width", "height");
    private static final Set<String> MODERATE_PROPERTIES =
            Set.of("font-family", "font-weight", "margin", "padding", "line-height");

    private final PageRenderer renderer;

    public VisualComparator(PageRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public static class Comparisons {
        public final List<VisualComparisonResult> results = new ArrayList<>();
        public final Map<Viewport, String> failures = new LinkedHashMap<>();
        public boolean timedOut;
    }

    public Comparisons compare(String originalHtml, String convertedHtml, ValidationOptions options) {
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(options.maxConcurrency, options.viewports.size()), VisualComparator::daemon);
        Map<Viewport, CompletableFuture<VisualComparisonResult>> pending = new LinkedHashMap<>();
        try {
            for (Viewport viewport : options.viewports) {
                pending.put(viewport, CompletableFuture.supplyAsync(
                        () -> compareAt(originalHtml, convertedHtml, viewport, options.pixelThreshold), executor));
            }

            Comparisons comparisons = new Comparisons();
            long deadline = System.nanoTime() + options.timeout.toNanos();
            for (Map.Entry<Viewport, CompletableFuture<VisualComparisonResult>> entry : pending.entrySet()) {
                Viewport viewport = entry.getKey();
                long remaining = Math.max(0, deadline - System.nanoTime());
                try {
                    comparisons.results.add(entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    entry.getValue().cancel(true);
                    comparisons.timedOut = true;
                    comparisons.failures.put(viewport, "Rendering at " + viewport.getId() + " timed out after "
                            + options.timeout.toMillis() + " ms");
                } catch (ExecutionException e) {
                    comparisons.failures.put(viewport, "Rendering at " + viewport.getId() + " failed: "
                            + rootMessage(e));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    comparisons.failures.put(viewport, "Rendering at " + viewport.getId() + " was interrupted");
                }
            }
            return comparisons;
        } finally {
            executor.shutdownNow();
        }
    }

    private VisualComparisonResult compareAt(String originalHtml, String convertedHtml, Viewport viewport,
                                             double threshold) {
        CompletableFuture<RenderedPage> original = renderer.render(originalHtml, viewport);
        CompletableFuture<RenderedPage> converted = renderer.render(convertedHtml, viewport);
        try {
            return compare(original.get(), converted.get(), viewport, threshold);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static VisualComparisonResult compare(RenderedPage original, RenderedPage converted, Viewport viewport,
                                          double threshold) throws IOException {
        VisualComparisonResult result = new VisualComparisonResult();
        result.viewport = viewport.getId();
        result.originalWidth = original.width;
        result.originalHeight = original.height;
        result.convertedWidth = converted.width;
        result.convertedHeight = converted.height;
        result.dimensionsMatch = original.width == converted.width && original.height == converted.height;

        diffPixels(original.image(), converted.image(), threshold, result);
        compareElements(original.styles, converted.styles, result.comparisonMetrics);
        return result;
    }

    /**
     * A pixel differs when any channel moves by more than {@code threshold}
     * of its range. Area covered by only one of the images always differs.
     */
    static void diffPixels(BufferedImage original, BufferedImage converted, double threshold,
                           VisualComparisonResult result) {
        int overlapWidth = Math.min(original.getWidth(), converted.getWidth());
        int overlapHeight = Math.min(original.getHeight(), converted.getHeight());
        long total = (long) Math.max(original.getWidth(), converted.getWidth())
                * Math.max(original.getHeight(), converted.getHeight());
        double limit = threshold * 255;

        long different = 0;
        long channelDelta = 0;
        for (int y = 0; y < overlapHeight; y++) {
            for (int x = 0; x < overlapWidth; x++) {
                int a = original.getRGB(x, y);
                int b = converted.getRGB(x, y);
                int dr = Math.abs(((a >> 16) & 0xff) - ((b >> 16) & 0xff));
                int dg = Math.abs(((a >> 8) & 0xff) - ((b >> 8) & 0xff));
                int db = Math.abs((a & 0xff) - (b & 0xff));
                int da = Math.abs(((a >>> 24) & 0xff) - ((b >>> 24) & 0xff));
                channelDelta += dr + dg + db;
                if (Math.max(Math.max(dr, dg), Math.max(db, da)) > limit) {
                    different++;
                }
            }
        }
        long overlap = (long) overlapWidth * overlapHeight;
        different += total - overlap;

        result.totalPixels = total;
        result.pixelDifference = different;
        result.diffPercentage = total == 0 ? 0 : round2(different * 100.0 / total);
        result.similarityScore = round2(100 - result.diffPercentage);
        result.comparisonMetrics.colorDifference = overlap == 0 ? 0 : round2(channelDelta / (overlap * 3.0));
    }

    static void compareElements(Map<String, Map<String, String>> original, Map<String, Map<String, String>> converted,
                                ComparisonMetrics metrics) {
        for (String selector : original.keySet()) {
            if (!converted.containsKey(selector)) {
                metrics.missingElements.add(selector);
            }
        }
        for (String selector : converted.keySet()) {
            if (!original.containsKey(selector)) {
                metrics.extraElements.add(selector);
            }
        }

        for (Map.Entry<String, Map<String, String>> entry : original.entrySet()) {
            Map<String, String> convertedStyle = converted.get(entry.getKey());
            if (convertedStyle == null) {
                continue;
            }
            for (Map.Entry<String, String> property : entry.getValue().entrySet()) {
                String convertedValue = convertedStyle.get(property.getKey());
                if (convertedValue == null || convertedValue.equals(property.getValue())) {
                    continue;
                }
                metrics.styleDiscrepancies.add(new StyleDiscrepancy(entry.getKey(), property.getKey(),
                        property.getValue(), convertedValue, level(property.getKey())));
                if (metrics.styleDiscrepancies.size() == MAX_STYLE_DISCREPANCIES) {
                    return;
                }
            }
        }
    }

    static StyleDiscrepancy.Level level(String property) {
        if (MAJOR_PROPERTIES.contains(property)) {
            return StyleDiscrepancy.Level.MAJOR;
        }
        if (MODERATE_PROPERTIES.contains(property)) {
            return StyleDiscrepancy.Level.MODERATE;
        }
        return StyleDiscrepancy.Level.MINOR;
    }

    static Thread daemon(Runnable task) {
        Thread thread = new Thread(task, "pageframe-validator");
        thread.setDaemon(true);
        return thread;
    }

    static String rootMessage(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException
                || cause instanceof UncheckedIOException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
