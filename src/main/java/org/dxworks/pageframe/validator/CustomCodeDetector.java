package org.dxworks.pageframe.validator;

import org.dxworks.pageframe.model.validation.ConversionWarning;
import org.dxworks.pageframe.model.validation.CustomCodeDetection;
import org.dxworks.pageframe.model.validation.DetectedFeature;
import org.dxworks.pageframe.model.validation.Incompatibility;
import org.dxworks.pageframe.model.validation.Severity;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Scans the scripts and style sheets of a page for behavior that page
 * builders cannot express natively.
 */
public class CustomCodeDetector {

    private static final String JAVASCRIPT = "javascript";
    private static final String CSS = "css";
    private static final String LIBRARY = "library";

    private static class Library {
        final String name;
        final Pattern inline;
        final Pattern url;
        final boolean supported;

        Library(String name, Pattern inline, Pattern url, boolean supported) {
            this.name = name;
            this.inline = inline;
            this.url = url;
            this.supported = supported;
        }
    }

    private static class CssFeature {
        final String name;
        final Pattern pattern;
        final String description;

        CssFeature(String name, Pattern pattern, String description) {
            this.name = name;
            this.pattern = pattern;
            this.description = description;
        }
    }

    private static final List<Library> LIBRARIES = List.of(
            new Library("jQuery", Pattern.compile("\\$\\(|jQuery\\("), Pattern.compile("(?i)jquery"), true),
            new Library("GSAP", Pattern.compile("gsap\\.|TweenMax|TweenLite"), Pattern.compile("(?i)gsap|tweenmax"), true),
            new Library("React", Pattern.compile("React\\.|ReactDOM"), Pattern.compile("(?i)react"), false),
            new Library("Vue", Pattern.compile("new Vue\\(|Vue\\."), Pattern.compile("(?i)vue(\\.min)?\\.js|/vue@"), false),
            new Library("Angular", Pattern.compile("angular\\.|ng-app"), Pattern.compile("(?i)angular"), false),
            new Library("Three.js", Pattern.compile("THREE\\."), Pattern.compile("(?i)three(\\.min)?\\.js"), false),
            new Library("D3.js", Pattern.compile("\\bd3\\."), Pattern.compile("(?i)\\bd3(\\.v\\d+)?(\\.min)?\\.js"), false));

    private static final List<CssFeature> CSS_FEATURES = List.of(
            new CssFeature("Media Queries", Pattern.compile("@media"), "Responsive breakpoints"),
            new CssFeature("Pseudo-elements", Pattern.compile("::?(before|after|first-line|first-letter)"),
                    "Generated content"),
            new CssFeature("Transforms & Transitions", Pattern.compile("transform\\s*:|transition\\s*:"),
                    "Transforms and transitions"),
            new CssFeature("CSS Filters", Pattern.compile("(backdrop-)?filter\\s*:"), "Visual filters"),
            new CssFeature("CSS Animations", Pattern.compile("@keyframes"), "Keyframe animations"),
            new CssFeature("CSS Custom Properties", Pattern.compile("--[\\w-]+\\s*:"), "CSS variables"),
            new CssFeature("CSS Grid", Pattern.compile("display\\s*:\\s*grid"), "Grid layout"));

    private static final Pattern DOM_MANIPULATION = Pattern.compile(
            "\\.innerHTML|\\.outerHTML|\\.appendChild|\\.removeChild|\\.insertBefore|\\.createElement"
                    + "|\\.classList\\.|\\.setAttribute|\\.removeAttribute");
    private static final Pattern EVENT_LISTENERS = Pattern.compile("addEventListener|\\.on\\(|\\.on[a-z]+\\s*=(?!=)");
    private static final Pattern ASYNC_FETCH = Pattern.compile("fetch\\(|\\$\\.ajax|\\$\\.get|\\$\\.post"
            + "|axios\\.|XMLHttpRequest");
    private static final Pattern JS_ANIMATION = Pattern.compile("\\.animate\\(|requestAnimationFrame");
    private static final Pattern CANVAS = Pattern.compile("getContext\\(\\s*['\"](webgl2?|2d)");
    private static final Pattern WORKER = Pattern.compile("new (Shared)?Worker\\(");
    private static final Pattern WEB_SOCKET = Pattern.compile("new WebSocket\\(");

    public CustomCodeDetection detect(String html) {
        Document document = Jsoup.parse(html);
        CustomCodeDetection detection = new CustomCodeDetection();

        List<Element> scripts = document.select("script");
        List<Element> styles = document.select("style");
        detection.hasCustomJS = !scripts.isEmpty();
        detection.hasCustomCSS = !styles.isEmpty();

        for (Element script : scripts) {
            if (script.hasAttr("src")) {
                detectLibraryUrl(script.attr("src"), detection);
            } else {
                analyzeScript(script.data(), detection);
            }
        }
        for (Element style : styles) {
            analyzeStyles(style.data(), detection);
        }

        detection.conversionScore = score(detection);
        detection.canBeConverted = detection.blockingCount() == 0;
        return detection;
    }

    private static void analyzeScript(String code, CustomCodeDetection detection) {
        for (Library library : LIBRARIES) {
            if (library.inline.matcher(code).find()) {
                library(library, detection);
            }
        }

        if (DOM_MANIPULATION.matcher(code).find()) {
            feature(detection, JAVASCRIPT, "DOM Manipulation", "Script changes the document at runtime", false,
                    "Recreate the dynamic content with builder widgets");
            detection.conversionWarnings.add(new ConversionWarning(JAVASCRIPT, Severity.WARNING,
                    "Script manipulates the DOM and may conflict with the builder's markup",
                    "Move the behavior into a custom HTML widget"));
        }
        if (EVENT_LISTENERS.matcher(code).find()) {
            feature(detection, JAVASCRIPT, "Event Listeners", "Custom event handling", false,
                    "Use builder interactions or popups");
            detection.conversionWarnings.add(new ConversionWarning(JAVASCRIPT, Severity.WARNING,
                    "Custom event listeners will not be carried over", "Rebind events in a custom code widget"));
        }
        if (ASYNC_FETCH.matcher(code).find()) {
            feature(detection, JAVASCRIPT, "AJAX/Fetch", "Loads data asynchronously", false,
                    "Use a plugin or the builder's dynamic content features");
            detection.conversionWarnings.add(new ConversionWarning(JAVASCRIPT, Severity.CRITICAL,
                    "Page loads content asynchronously; that content will be missing after conversion",
                    "Replace remote content with static content or a dynamic data plugin"));
        }
        if (JS_ANIMATION.matcher(code).find()) {
            feature(detection, JAVASCRIPT, "JS Animations", "Script-driven animation", false,
                    "Use builder entrance or motion effects");
            detection.conversionWarnings.add(new ConversionWarning(JAVASCRIPT, Severity.WARNING,
                    "Script-driven animations will not be converted", "Use the builder's animation settings"));
        }

        if (CANVAS.matcher(code).find()) {
            detection.incompatibilities.add(new Incompatibility(JAVASCRIPT, "Canvas/WebGL",
                    "Canvas drawing has no page builder equivalent", Incompatibility.Impact.BLOCKING,
                    "Embed the canvas in a custom HTML widget"));
        }
        if (WORKER.matcher(code).find()) {
            detection.incompatibilities.add(new Incompatibility(JAVASCRIPT, "Web Workers",
                    "Background workers cannot be configured in a page builder", Incompatibility.Impact.BLOCKING,
                    "Host the worker script separately"));
        }
        if (WEB_SOCKET.matcher(code).find()) {
            detection.incompatibilities.add(new Incompatibility(JAVASCRIPT, "WebSockets",
                    "Live connections need custom code", Incompatibility.Impact.DEGRADED,
                    "Use a plugin that provides real-time updates"));
        }
    }

    private static void detectLibraryUrl(String url, CustomCodeDetection detection) {
        for (Library library : LIBRARIES) {
            if (library.url.matcher(url).find()) {
                library(library, detection);
            }
        }
    }

    private static void library(Library library, CustomCodeDetection detection) {
        boolean known = detection.detectedFeatures.stream()
                .anyMatch(feature -> LIBRARY.equals(feature.type) && feature.feature.equals(library.name));
        if (known) {
            return;
        }
        detection.detectedFeatures.add(new DetectedFeature(LIBRARY, library.name,
                library.name + " library", library.supported,
                library.supported ? null : "Rebuild the " + library.name + " components with builder widgets"));
        if (!library.supported) {
            detection.incompatibilities.add(new Incompatibility(LIBRARY, library.name,
                    library.name + " applications cannot run inside page builder content",
                    Incompatibility.Impact.BLOCKING, "Embed the application through an iframe or a plugin"));
        }
    }

    private static void analyzeStyles(String css, CustomCodeDetection detection) {
        for (CssFeature cssFeature : CSS_FEATURES) {
            if (cssFeature.pattern.matcher(css).find()) {
                feature(detection, CSS, cssFeature.name, cssFeature.description, true, null);
            }
        }
        if (css.contains("@supports")) {
            unsupportedCss(detection, "@supports", "Feature queries are dropped by most builders",
                    Incompatibility.Impact.DEGRADED);
        }
        if (css.contains("@container")) {
            unsupportedCss(detection, "@container", "Container queries are not supported",
                    Incompatibility.Impact.DEGRADED);
        }
        if (css.contains(":has(")) {
            unsupportedCss(detection, ":has()", "Relational selectors are not supported",
                    Incompatibility.Impact.DEGRADED);
        }
        if (css.contains("@property")) {
            unsupportedCss(detection, "@property", "Registered custom properties are ignored",
                    Incompatibility.Impact.MINIMAL);
        }
        if (Pattern.compile("clip-path\\s*:\\s*path\\(").matcher(css).find()) {
            unsupportedCss(detection, "clip-path: path()", "Path clipping is not supported",
                    Incompatibility.Impact.MINIMAL);
        }
    }

    private static void unsupportedCss(CustomCodeDetection detection, String name, String reason,
                                       Incompatibility.Impact impact) {
        boolean known = detection.incompatibilities.stream()
                .anyMatch(incompatibility -> incompatibility.name.equals(name));
        if (!known) {
            detection.incompatibilities.add(new Incompatibility(CSS, name, reason, impact,
                    "Keep the rule in the builder's custom CSS"));
        }
    }

    private static void feature(CustomCodeDetection detection, String type, String name, String description,
                                boolean supported, String alternative) {
        boolean known = detection.detectedFeatures.stream()
                .anyMatch(feature -> feature.type.equals(type) && feature.feature.equals(name));
        if (!known) {
            detection.detectedFeatures.add(new DetectedFeature(type, name, description, supported, alternative));
        }
    }

    static int score(CustomCodeDetection detection) {
        int score = 100;
        for (Incompatibility incompatibility : detection.incompatibilities) {
            score -= switch (incompatibility.impact) {
                case BLOCKING -> 30;
                case DEGRADED -> 15;
                case MINIMAL -> 5;
            };
        }
        score -= 2 * (int) detection.detectedFeatures.stream().filter(feature -> !feature.isSupported).count();
        return Math.max(0, Math.min(100, score));
    }
}
