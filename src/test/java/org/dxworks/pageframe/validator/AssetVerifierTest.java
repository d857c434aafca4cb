package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.validation.AssetType;
import org.dxworks.pageframe.model.validation.AssetVerificationResult;
import org.dxworks.pageframe.model.validation.BrokenAsset;
import org.dxworks.pageframe.model.validation.MissingAsset;
import org.dxworks.pageframe.model.validation.Severity;
import org.dxworks.pageframe.model.validation.UnverifiedAsset;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssetVerifierTest {

    private final Set<String> probed = ConcurrentHashMap.newKeySet();

    private final AssetProbe probe = (url, timeout) -> {
        probed.add(url);
        if (url.endsWith("missing.png")) {
            return AssetProbeResult.status(404);
        }
        if (url.endsWith("app.js")) {
            return AssetProbeResult.status(503);
        }
        if (url.endsWith("bg.jpg")) {
            throw new IllegalStateException("boom");
        }
        if (url.endsWith("slow.woff2")) {
            return AssetProbeResult.timedOut("Timed out after 10000 ms");
        }
        return AssetProbeResult.status(200);
    };

    @Test
    void verify_classifiesEveryAsset() {
        String html = "<html><head>"
                + "<link rel=\"stylesheet\" href=\"/css/site.css\">"
                + "<script src=\"https://cdn.example.com/app.js\"></script>"
                + "</head><body>"
                + "<img src=\"https://cdn.example.com/ok.png\">"
                + "<img src=\"https://cdn.example.com/missing.png\">"
                + "<div style=\"background-image: url('https://cdn.example.com/bg.jpg')\"></div>"
                + "</body></html>";

        AssetVerificationResult result = new AssetVerifier(probe).verify(html, ValidationOptions.defaults());

        assertEquals(5, result.totalAssets);
        assertEquals(1, result.verifiedAssets);
        assertEquals(20, result.verificationScore);
        assertFalse(probed.contains("/css/site.css"));

        MissingAsset missing = result.missingAssets.get(0);
        assertEquals("https://cdn.example.com/missing.png", missing.url);
        assertEquals(Severity.CRITICAL, missing.severity);
        assertEquals(List.of("img"), missing.usedIn);

        Map<String, BrokenAsset> broken = new HashMap<>();
        result.brokenAssets.forEach(asset -> broken.put(asset.url, asset));
        assertEquals("Server error 503", broken.get("https://cdn.example.com/app.js").error);
        assertEquals(503, broken.get("https://cdn.example.com/app.js").statusCode);
        assertEquals("boom", broken.get("https://cdn.example.com/bg.jpg").error);
        assertNull(broken.get("https://cdn.example.com/bg.jpg").statusCode);

        assertEquals(3, result.assetsByType.get(AssetType.IMAGE).total);
        assertEquals(0, result.assetsByType.get(AssetType.STYLESHEET).verified);
        assertEquals(1, result.assetsByType.get(AssetType.STYLESHEET).unverified);
        UnverifiedAsset stylesheet = result.unverifiedAssets.get(0);
        assertEquals("/css/site.css", stylesheet.url);
        assertEquals(List.of("link"), stylesheet.usedIn);
        assertEquals(0, result.assetsByType.get(AssetType.VIDEO).total);
    }

    @Test
    void timedOutProbe_isBrokenWithoutStatus() {
        String html = "<style>@font-face { font-family: Slow; src: url(https://fonts.example.com/slow.woff2); }</style>";

        AssetVerificationResult result = new AssetVerifier(probe).verify(html, ValidationOptions.defaults());

        assertEquals(1, result.brokenAssets.size());
        assertEquals(AssetType.FONT, result.brokenAssets.get(0).type);
        assertEquals("Timed out after 10000 ms", result.brokenAssets.get(0).error);
        assertEquals(List.of("@font-face"), result.brokenAssets.get(0).usedIn);
    }

    @Test
    void relativeUrls_areCheckedOnceABaseUrlResolvesThem() {
        String html = "<link rel=\"stylesheet\" href=\"/css/site.css\"><img src=\"logo.png\">";

        AssetVerificationResult result = new AssetVerifier(probe)
                .verify(html, ValidationOptions.defaults().withBaseUrl("https://site.example.com/"));

        assertEquals(2, result.verifiedAssets);
        assertEquals(100, result.verificationScore);
        assertTrue(result.unverifiedAssets.isEmpty());
        assertEquals(Set.of("https://site.example.com/css/site.css", "https://site.example.com/logo.png"), probed);
    }

    @Test
    void checkIgnoringItsTimeout_isCutOffAtTheDeadline() {
        CountDownLatch never = new CountDownLatch(1);
        AssetProbe hanging = (url, timeout) -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AssetProbeResult.status(200);
        };
        ValidationOptions options = ValidationOptions.defaults().withTimeout(Duration.ofMillis(100));

        AssetVerificationResult result = new AssetVerifier(hanging)
                .verify("<img src=\"https://cdn.example.com/stuck.png\">", options);

        assertEquals(0, result.verifiedAssets);
        assertEquals(1, result.brokenAssets.size());
        assertEquals("Timed out after 100 ms", result.brokenAssets.get(0).error);
        assertNull(result.brokenAssets.get(0).statusCode);
    }

    @Test
    void pageWithoutAssets_scoresFull() {
        AssetVerificationResult result = new AssetVerifier(probe).verify("<p>Just text</p>", ValidationOptions.defaults());

        assertEquals(0, result.totalAssets);
        assertEquals(100, result.verificationScore);
        assertTrue(probed.isEmpty());
    }

    @Test
    void extract_resolvesAgainstTheBaseUrl() {
        String html = "<img src=\"/img/logo.png\" srcset=\"hero.png 1x, hero@2x.png 2x\">"
                + "<img src=\"data:image/png;base64,AAAA\">"
                + "<video poster=\"poster.jpg\"><source src=\"https://media.example.com/clip.mp4\"></video>"
                + "<div style=\"background: url(bg.webp) no-repeat\"></div>"
                + "<style>@font-face { font-family: X; src: url('/fonts/x.woff2'); }</style>";

        Map<AssetType, Map<String, List<String>>> assets = AssetVerifier.extract(html, "https://site.example.com/page/");

        assertEquals(List.of(
                        "https://site.example.com/img/logo.png",
                        "https://site.example.com/page/hero.png",
                        "https://site.example.com/page/hero@2x.png",
                        "https://site.example.com/page/poster.jpg",
                        "https://site.example.com/page/bg.webp"),
                List.copyOf(assets.get(AssetType.IMAGE).keySet()));
        assertEquals(List.of("video"), assets.get(AssetType.VIDEO).get("https://media.example.com/clip.mp4"));
        assertEquals(List.of("@font-face"), assets.get(AssetType.FONT).get("https://site.example.com/fonts/x.woff2"));
    }

    @Test
    void suggestions_dependOnAssetType() {
        assertEquals("Asset not found. Check if the URL is correct: https://x.example.com/404.png",
                AssetVerifier.suggestionFor(AssetType.IMAGE, "https://x.example.com/404.png"));
        assertEquals("Use a fallback font or include the font file in your assets.",
                AssetVerifier.suggestionFor(AssetType.FONT, "https://x.example.com/a.woff"));
    }
}
