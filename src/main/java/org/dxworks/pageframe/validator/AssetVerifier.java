package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.validation.AssetStatus;
import org.dxworks.pageframe.model.validation.AssetType;
import org.dxworks.pageframe.model.validation.AssetVerificationResult;
import org.dxworks.pageframe.model.validation.BrokenAsset;
import org.dxworks.pageframe.model.validation.MissingAsset;
import org.dxworks.pageframe.model.validation.Severity;
import org.dxworks.pageframe.model.validation.UnverifiedAsset;
import org.jsoup.Jsoup;
import org.jsoup.internal.StringUtil;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the assets an HTML page references and probes each of them.
 * <p>
 * Only absolute http(s) urls are probed. Relative urls that cannot be
 * resolved against a base url are reported as unverified and lower the
 * score. All checks share one deadline: the timeout once per wave of
 * {@code maxConcurrency} concurrent checks.
 */
public class AssetVerifier {

    private static final Pattern CSS_URL = Pattern.compile("url\\(\\s*['\"]?([^'\")]+)['\"]?\\s*\\)");
    private static final Pattern FONT_FACE = Pattern.compile("@font-face\\s*\\{([^}]*)}");

    private final AssetProbe probe;

    public AssetVerifier(AssetProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    public AssetVerificationResult verify(String html, ValidationOptions options) {
        Map<AssetType, Map<String, List<String>>> assets = extract(html, options.baseUrl);

        ExecutorService executor = Executors.newFixedThreadPool(options.maxConcurrency, VisualComparator::daemon);
        try {
            Map<AssetType, Map<String, CompletableFuture<AssetProbeResult>>> probes = new EnumMap<>(AssetType.class);
            int pending = 0;
            for (Map.Entry<AssetType, Map<String, List<String>>> entry : assets.entrySet()) {
                Map<String, CompletableFuture<AssetProbeResult>> byUrl = new LinkedHashMap<>();
                for (String url : entry.getValue().keySet()) {
                    if (isProbeable(url)) {
                        byUrl.put(url, CompletableFuture.supplyAsync(() -> probe.probe(url, options.timeout), executor)
                                .exceptionally(e -> AssetProbeResult.failed(VisualComparator.rootMessage(e))));
                        pending++;
                    }
                }
                probes.put(entry.getKey(), byUrl);
            }
            int waves = (pending + options.maxConcurrency - 1) / options.maxConcurrency;
            long deadline = System.nanoTime() + options.timeout.toNanos() * Math.max(1, waves);

            AssetVerificationResult result = new AssetVerificationResult();
            for (AssetType type : AssetType.values()) {
                AssetStatus status = new AssetStatus();
                Map<String, CompletableFuture<AssetProbeResult>> byUrl = probes.getOrDefault(type, Map.of());
                for (Map.Entry<String, List<String>> asset : assets.getOrDefault(type, Map.of()).entrySet()) {
                    CompletableFuture<AssetProbeResult> check = byUrl.get(asset.getKey());
                    if (check == null) {
                        unverified(type, asset.getKey(), asset.getValue(), status, result);
                    } else {
                        classify(type, asset.getKey(), asset.getValue(), await(check, deadline, options.timeout),
                                status, result);
                    }
                }
                result.assetsByType.put(type, status);
                result.totalAssets += status.total;
                result.verifiedAssets += status.verified;
            }
            result.verificationScore = result.totalAssets == 0
                    ? 100
                    : (int) Math.round(result.verifiedAssets * 100.0 / result.totalAssets);
            return result;
        } finally {
            executor.shutdownNow();
        }
    }

    private static AssetProbeResult await(CompletableFuture<AssetProbeResult> check, long deadline,
                                          Duration timeout) {
        long remaining = Math.max(0, deadline - System.nanoTime());
        try {
            return check.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            check.cancel(true);
            return AssetProbeResult.timedOut("Timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            return AssetProbeResult.failed(VisualComparator.rootMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AssetProbeResult.failed("Asset check was interrupted");
        }
    }

    private static void unverified(AssetType type, String url, List<String> usedIn, AssetStatus status,
                                   AssetVerificationResult result) {
        status.total++;
        status.unverified++;
        status.urls.add(url);
        result.unverifiedAssets.add(new UnverifiedAsset(type, url, usedIn,
                "Relative url without a base url to resolve it"));
    }

    private static void classify(AssetType type, String url, List<String> usedIn, AssetProbeResult probed,
                                 AssetStatus status, AssetVerificationResult result) {
        status.total++;
        status.urls.add(url);
        if (probed.isReachable()) {
            status.verified++;
        } else if (probed.probeFailed || (probed.statusCode != null && probed.statusCode >= 500)) {
            status.broken++;
            String error = probed.error != null ? probed.error : "Server error " + probed.statusCode;
            result.brokenAssets.add(new BrokenAsset(type, url, error, probed.statusCode, usedIn));
        } else {
            status.missing++;
            Severity severity = type == AssetType.IMAGE ? Severity.CRITICAL : Severity.WARNING;
            result.missingAssets.add(new MissingAsset(type, url, usedIn, severity, suggestionFor(type, url)));
        }
    }

    /**
     * Asset urls by type, each with the places that reference it, in
     * document order.
     */
    static Map<AssetType, Map<String, List<String>>> extract(String html, String baseUrl) {
        Map<AssetType, Map<String, List<String>>> assets = new EnumMap<>(AssetType.class);
        Document document = baseUrl != null ? Jsoup.parse(html, baseUrl) : Jsoup.parse(html);

        for (Element img : document.select("img[src]")) {
            add(assets, AssetType.IMAGE, url(img, "src", baseUrl), "img");
        }
        for (Element element : document.select("img[srcset], picture source[srcset]")) {
            for (String candidate : element.attr("srcset").split(",")) {
                String trimmed = candidate.trim();
                if (!trimmed.isEmpty()) {
                    add(assets, AssetType.IMAGE, resolve(trimmed.split("\\s+")[0], baseUrl), "srcset");
                }
            }
        }
        for (Element video : document.select("video[poster]")) {
            add(assets, AssetType.IMAGE, url(video, "poster", baseUrl), "video poster");
        }
        for (Element video : document.select("video[src], video source[src]")) {
            add(assets, AssetType.VIDEO, url(video, "src", baseUrl), "video");
        }
        for (Element link : document.select("link[rel~=(?i)stylesheet][href]")) {
            add(assets, AssetType.STYLESHEET, url(link, "href", baseUrl), "link");
        }
        for (Element link : document.select("link[rel~=(?i)preload][as=font][href]")) {
            add(assets, AssetType.FONT, url(link, "href", baseUrl), "preload");
        }
        for (Element script : document.select("script[src]")) {
            add(assets, AssetType.SCRIPT, url(script, "src", baseUrl), "script");
        }
        for (Element styled : document.select("[style]")) {
            Matcher matcher = CSS_URL.matcher(styled.attr("style"));
            while (matcher.find()) {
                add(assets, AssetType.IMAGE, resolve(matcher.group(1).trim(), baseUrl), "background-image");
            }
        }
        for (Element style : document.select("style")) {
            Matcher fontFace = FONT_FACE.matcher(style.data());
            while (fontFace.find()) {
                Matcher matcher = CSS_URL.matcher(fontFace.group(1));
                while (matcher.find()) {
                    add(assets, AssetType.FONT, resolve(matcher.group(1).trim(), baseUrl), "@font-face");
                }
            }
        }
        return assets;
    }

    private static void add(Map<AssetType, Map<String, List<String>>> assets, AssetType type, String url,
                            String usedIn) {
        if (url == null || url.isBlank() || url.startsWith("data:") || url.startsWith("#")) {
            return;
        }
        List<String> places = assets.computeIfAbsent(type, t -> new LinkedHashMap<>())
                .computeIfAbsent(url, u -> new ArrayList<>());
        if (!places.contains(usedIn)) {
            places.add(usedIn);
        }
    }

    private static String url(Element element, String attribute, String baseUrl) {
        if (baseUrl != null) {
            String absolute = element.absUrl(attribute);
            if (!absolute.isEmpty()) {
                return absolute;
            }
        }
        return element.attr(attribute).trim();
    }

    private static String resolve(String url, String baseUrl) {
        if (baseUrl == null || url.startsWith("data:") || isProbeable(url)) {
            return url;
        }
        return StringUtil.resolve(baseUrl, url);
    }

    static boolean isProbeable(String url) {
        String lower = url.toLowerCase();
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    static String suggestionFor(AssetType type, String url) {
        if (url.contains("404") || url.contains("not-found")) {
            return "Asset not found. Check if the URL is correct: " + url;
        }
        return switch (type) {
            case IMAGE -> "Use a placeholder image or remove the broken image reference.";
            case FONT -> "Use a fallback font or include the font file in your assets.";
            case VIDEO -> "Check the video URL or use an alternative video source.";
            case STYLESHEET -> "Link the stylesheet correctly or include its styles inline.";
            case SCRIPT -> "Verify the script URL or include the script inline.";
        };
    }
}
