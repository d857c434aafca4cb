package org.dxworks.pageframe.converter;

import org.dxworks.pageframe.analyzer.DimensionParser;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.ExtractedStyles;
import org.dxworks.pageframe.model.FallbackStrategy;
import org.dxworks.pageframe.model.design.DesignTokens;
import org.dxworks.pageframe.model.typography.TypographySystem;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared walker contract for all builders. Subclasses lay out the export and
 * map component types; the decision between a native widget, a default
 * widget and an HTML fallback is made here, identically for every target.
 */
public abstract class AbstractConverter implements TargetConverter {

    private static final Pattern CSS_URL = Pattern.compile("url\\((['\"]?)(.*?)\\1\\)");

    @Override
    public final ConverterOutput convert(List<ComponentHierarchy> roots,
                                         TypographySystem typography,
                                         DesignTokens designTokens,
                                         ConversionOptions options) {
        if (roots == null) {
            throw new IllegalArgumentException("Hierarchy must not be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("Conversion options must not be null");
        }
        ConversionContext context = new ConversionContext(options, typography, designTokens, newIdGenerator());
        Object exportData = export(roots, context);
        return context.toOutput(exportData);
    }

    protected abstract IdGenerator newIdGenerator();

    protected abstract Object export(List<ComponentHierarchy> roots, ConversionContext context);

    /**
     * Native mapping for a widget node; an exhaustive switch over the
     * component type whose unmapped arm returns {@link WidgetMapping#unmapped}.
     */
    protected abstract WidgetMapping mapWidget(ComponentHierarchy node, ConversionContext context);

    /**
     * The builder's raw HTML widget carrying the given markup.
     */
    protected abstract WidgetMapping htmlWidget(String html, ComponentHierarchy node);

    /**
     * Resolves a widget node and records any fallback it needs.
     */
    protected final WidgetMapping plan(ComponentHierarchy node, ConversionContext context) {
        ConversionOptions options = context.options;
        boolean unknown = node.componentType == ComponentType.UNKNOWN;
        boolean lowConfidence = node.confidence < options.minConfidence;

        if (unknown || (lowConfidence && options.fallbackToHTML)) {
            String reason = unknown
                    ? "Unrecognized <" + tagOf(node) + "> element"
                    : "Recognized as " + node.componentType.getId() + " with " + node.confidence
                        + "% confidence, below the " + options.minConfidence + "% minimum";
            context.addFallback(new FallbackStrategy(FallbackStrategy.Strategy.HTML_WIDGET, node.id, reason,
                    node.originalHtml,
                    List.of("Rebuild the element with native widgets after checking the preserved markup",
                            "Move inline scripts and styles to the site's custom code settings"),
                    unknown ? null : node.componentType));
            context.countHtmlFallback();
            return htmlWidget(originalHtml(node), node);
        }

        WidgetMapping mapping = mapWidget(node, context);
        if (!mapping.explicit && !mapping.htmlFallback) {
            boolean customCss = options.preserveCustomCSS && !node.styles.isEmpty();
            context.addFallback(new FallbackStrategy(
                    customCss ? FallbackStrategy.Strategy.CUSTOM_CSS : FallbackStrategy.Strategy.MANUAL_REVIEW,
                    node.id,
                    "No explicit " + builder().getName() + " mapping for " + node.componentType.getId()
                            + ", converted to " + mapping.name,
                    node.originalHtml,
                    customCss
                            ? List.of("Reapply the original styles through the widget's custom CSS")
                            : List.of("Check the generic widget against the original " + node.componentType.getId()),
                    node.componentType));
        } else if (lowConfidence) {
            context.addFallback(new FallbackStrategy(FallbackStrategy.Strategy.MANUAL_REVIEW, node.id,
                    "Kept as " + node.componentType.getId() + " with " + node.confidence
                            + "% confidence, below the " + options.minConfidence + "% minimum",
                    node.originalHtml,
                    List.of("Confirm the component type in the builder editor"),
                    node.componentType));
        }
        if (mapping.htmlFallback) {
            context.countHtmlFallback();
        } else {
            context.countNative();
        }
        return mapping;
    }

    /**
     * Records the fallbacks of a structural node. Element-backed layout below
     * the confidence minimum gets an HTML widget fallback while its layout is
     * still emitted natively; other flagged nodes get a manual review.
     */
    protected final void reviewStructure(ComponentHierarchy node, ConversionContext context) {
        ConversionOptions options = context.options;
        if (!node.synthetic && node.confidence < options.minConfidence && options.fallbackToHTML) {
            context.addFallback(new FallbackStrategy(FallbackStrategy.Strategy.HTML_WIDGET, node.id,
                    "Recognized as " + node.componentType.getId() + " with " + node.confidence
                            + "% confidence, below the " + options.minConfidence + "% minimum",
                    node.originalHtml,
                    List.of("Compare the native layout with the preserved markup",
                            "Replace the layout with an HTML widget if the structure does not match"),
                    node.componentType));
            context.countHtmlFallback();
            return;
        }
        if (!node.manualReviewNeeded) {
            return;
        }
        context.addFallback(new FallbackStrategy(FallbackStrategy.Strategy.MANUAL_REVIEW, node.id,
                node.reviewReason != null ? node.reviewReason : "Structure needs review",
                node.originalHtml,
                List.of("Check the column split in the builder editor"),
                null));
    }

    protected static String originalHtml(ComponentHierarchy node) {
        return node.originalHtml != null ? node.originalHtml : "";
    }

    protected static String tagOf(ComponentHierarchy node) {
        return node.tagName != null ? node.tagName : "div";
    }

    protected static String text(ComponentHierarchy node) {
        return node.props.textContent != null ? node.props.textContent : "";
    }

    protected static String innerHtml(ComponentHierarchy node) {
        if (node.props.innerHTML != null && !node.props.innerHTML.isBlank()) {
            return node.props.innerHTML;
        }
        return text(node);
    }

    protected static int headingLevel(ComponentHierarchy node) {
        Integer level = node.props.headingLevel;
        return level != null ? Math.max(1, Math.min(6, level)) : 2;
    }

    protected static Double pixels(String value) {
        OptionalDouble px = DimensionParser.toPixels(value);
        return px.isPresent() ? px.getAsDouble() : null;
    }

    protected static Map<String, Object> sizeUnit(Double size, String unit) {
        if (size == null) {
            return null;
        }
        return Settings.create().put("unit", unit).put("size", round(size)).build();
    }

    protected static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    protected static boolean isExternal(ComponentHierarchy node) {
        return "_blank".equals(node.props.target);
    }

    protected static ExtractedStyles tabletStyles(ComponentHierarchy node) {
        return node.responsiveStyles != null ? node.responsiveStyles.tablet : null;
    }

    protected static ExtractedStyles mobileStyles(ComponentHierarchy node) {
        return node.responsiveStyles != null ? node.responsiveStyles.mobile : null;
    }

    /**
     * First {@code url(...)} of a background-image value.
     */
    protected static String backgroundUrl(String backgroundImage) {
        if (backgroundImage == null) {
            return null;
        }
        Matcher matcher = CSS_URL.matcher(backgroundImage);
        return matcher.find() ? matcher.group(2) : null;
    }
}
