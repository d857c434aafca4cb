package org.dxworks.pageframe.converter.bricks;

import org.dxworks.pageframe.analyzer.TypographyUsage;
import org.dxworks.pageframe.converter.AbstractConverter;
import org.dxworks.pageframe.converter.ConversionContext;
import org.dxworks.pageframe.converter.IdGenerator;
import org.dxworks.pageframe.converter.Settings;
import org.dxworks.pageframe.converter.WidgetMapping;
import org.dxworks.pageframe.model.BoxSpacing;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ExtractedStyles;
import org.dxworks.pageframe.model.NodeKind;
import org.dxworks.pageframe.model.PageBuilder;
import org.dxworks.pageframe.model.design.ColorPalette;
import org.dxworks.pageframe.model.typography.GlobalTypographySettings;
import org.dxworks.pageframe.model.typography.TextStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class BricksConverter extends AbstractConverter {

    private static final String TABLET = ":tablet_portrait";
    private static final String MOBILE = ":mobile_portrait";

    @Override
    public PageBuilder builder() {
        return PageBuilder.BRICKS;
    }

    @Override
    protected IdGenerator newIdGenerator() {
        return IdGenerator.base36();
    }

    @Override
    protected Object export(List<ComponentHierarchy> roots, ConversionContext context) {
        List<BricksElement> elements = new ArrayList<>();
        for (ComponentHierarchy root : roots) {
            append(root, null, 0, elements, context);
        }
        return new BricksExport(elements, globalColors(context), typography(context));
    }

    /**
     * Appends the node and its subtree in pre-order, so every parent precedes
     * its children in the flat list.
     */
    private void append(ComponentHierarchy node, BricksElement parent, int depth, List<BricksElement> elements,
                        ConversionContext context) {
        String parentId = parent != null ? parent.id : BricksElement.ROOT_PARENT;
        BricksElement element;
        if (node.type == NodeKind.WIDGET) {
            WidgetMapping mapping = plan(node, context);
            Settings settings = Settings.create().putAll(mapping.settings);
            if (!mapping.htmlFallback) {
                common(settings, node, context);
            }
            element = new BricksElement(context.register(node), mapping.name, parentId, label(node),
                    settings.build());
        } else {
            String id = context.register(node);
            reviewStructure(node, context);
            element = new BricksElement(id, layoutName(node.type, depth), parentId, label(node),
                    layoutSettings(node, context));
        }
        if (parent != null) {
            parent.children.add(element.id);
        }
        elements.add(element);
        if (node.type != NodeKind.WIDGET) {
            for (ComponentHierarchy child : node.children) {
                append(child, element, depth + 1, elements, context);
            }
        }
    }

    private static String layoutName(NodeKind kind, int depth) {
        return switch (kind) {
            case SECTION -> depth == 0 ? "section" : "container";
            case CONTAINER -> "container";
            case ROW -> "block";
            case COLUMN -> "div";
            case WIDGET -> throw new IllegalArgumentException("Widgets have no layout element");
        };
    }

    private Map<String, Object> layoutSettings(ComponentHierarchy node, ConversionContext context) {
        Settings settings = Settings.create();
        switch (node.type) {
            case SECTION, CONTAINER -> settings.put("tag", node.synthetic ? null : tagOf(node));
            case ROW -> settings.put("_direction", "row").put("_columnGap", "20px");
            case COLUMN -> settings.put("_width", node.columnSize != null ? round(node.columnSize) + "%" : null);
            case WIDGET -> {
            }
        }
        if (!node.synthetic) {
            common(settings, node, context);
        }
        return settings.build();
    }

    private void common(Settings settings, ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        settings.put("_cssId", node.props.elementId);
        if (node.props.className != null) {
            settings.put("_cssClasses", node.props.className.trim());
        }

        Settings background = Settings.create()
                .put("color", color(styles.backgroundColor(), context));
        String image = backgroundUrl(styles.backgroundImage());
        if (image != null) {
            background.put("image", Map.of("url", image));
        }
        settings.put("_background", background.build());
        settings.put("_padding", spacing(styles.padding));
        settings.put("_margin", spacing(styles.margin));
        settings.put("_width", styles.width());
        if (styles.borderRadius != null) {
            settings.put("_border", Map.of("radius", Settings.create()
                    .put("top", styles.borderRadius.topLeft)
                    .put("right", styles.borderRadius.topRight)
                    .put("bottom", styles.borderRadius.bottomRight)
                    .put("left", styles.borderRadius.bottomLeft)
                    .build()));
        }
        settings.put("_typography", typography(styles, context));

        if (context.options.includeResponsive) {
            responsive(settings, TABLET, tabletStyles(node));
            responsive(settings, MOBILE, mobileStyles(node));
        }
        if (context.options.includeAnimations) {
            settings.put("_animation", animation(styles));
        }
    }

    private static void responsive(Settings settings, String breakpoint, ExtractedStyles styles) {
        if (styles == null) {
            return;
        }
        if (styles.is("display", "none")) {
            settings.put("_display" + breakpoint, "none");
        }
        settings.put("_typography" + breakpoint, Settings.create()
                .put("font-size", styles.fontSize())
                .put("text-align", styles.textAlign())
                .build());
        settings.put("_padding" + breakpoint, spacing(styles.padding));
    }

    @Override
    protected WidgetMapping htmlWidget(String html, ComponentHierarchy node) {
        return WidgetMapping.fallback("code", Settings.create()
                .put("code", html)
                .put("executeCode", false)
                .build());
    }

    @Override
    protected WidgetMapping mapWidget(ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        return switch (node.componentType) {
            case HEADING -> WidgetMapping.of("heading", Settings.create()
                    .put("tag", "h" + headingLevel(node))
                    .put("text", text(node))
                    .build());
            case TEXT, PARAGRAPH -> WidgetMapping.of("text-basic", Settings.create()
                    .put("tag", "p")
                    .put("text", innerHtml(node))
                    .build());
            case BLOCKQUOTE -> WidgetMapping.of("text-basic", Settings.create()
                    .put("tag", "blockquote")
                    .put("text", innerHtml(node))
                    .build());
            case LINK -> WidgetMapping.of("text-link", Settings.create()
                    .put("text", text(node))
                    .put("link", link(node))
                    .build());
            case BUTTON, SUBMIT_BUTTON -> WidgetMapping.of("button", Settings.create()
                    .put("text", text(node).isEmpty() ? node.props.value : text(node))
                    .put("link", link(node))
                    .put("style", "primary")
                    .put("size", "md")
                    .build());
            case IMAGE -> WidgetMapping.of("image", Settings.create()
                    .put("image", Settings.create().put("url", node.props.src).put("external", true).build())
                    .put("altText", node.props.alt)
                    .put("link", link(node))
                    .put("_objectFit", styles.get("objectFit"))
                    .build());
            case VIDEO -> {
                String url = node.props.src != null ? node.props.src : node.props.href;
                String videoType = videoType(url);
                Settings settings = Settings.create().put("videoType", videoType);
                switch (videoType) {
                    case "youtube" -> settings.put("youTubeId", videoId(url));
                    case "vimeo" -> settings.put("vimeoId", videoId(url));
                    default -> settings.put("fileUrl", url);
                }
                settings.put("previewImage", node.props.poster != null ? Map.of("url", node.props.poster) : null);
                yield WidgetMapping.of("video", settings.build());
            }
            case ICON -> WidgetMapping.of("icon", Settings.create()
                    .put("icon", Map.of("library", "fontawesomeSolid",
                            "icon", node.props.className != null ? node.props.className : "fas fa-star"))
                    .put("iconColor", color(styles.color(), context))
                    .put("iconSize", styles.fontSize())
                    .build());
            case DIVIDER -> WidgetMapping.of("divider", Settings.create()
                    .put("height", styles.border != null ? styles.border.width : null)
                    .put("style", styles.border != null ? styles.border.style : null)
                    .put("color", color(styles.border != null ? styles.border.color : null, context))
                    .build());
            case SPACER -> WidgetMapping.of("div", Settings.create()
                    .put("_height", styles.height() != null ? styles.height() : "40px")
                    .build());
            case LIST -> WidgetMapping.of("list", Settings.create()
                    .put("items", titled(node.props.items))
                    .put("tag", Boolean.TRUE.equals(node.props.ordered) ? "ol" : "ul")
                    .build());
            case CODE_BLOCK -> WidgetMapping.of("code", Settings.create()
                    .put("code", text(node))
                    .put("language", "html")
                    .put("executeCode", false)
                    .build());
            case GALLERY -> WidgetMapping.of("image-gallery", Settings.create()
                    .put("items", Map.of("images", urls(node)))
                    .put("columns", Math.max(1, Math.min(4, node.props.mediaUrls.size())))
                    .build());
            case CAROUSEL -> WidgetMapping.of("carousel", Settings.create()
                    .put("items", Map.of("images", urls(node)))
                    .put("autoplay", true)
                    .build());
            case SLIDER -> WidgetMapping.of("slider", Settings.create()
                    .put("items", slides(node))
                    .put("navigation", true)
                    .put("pagination", true)
                    .build());
            case ACCORDION -> WidgetMapping.of("accordion", Settings.create()
                    .put("items", items(node.props.items))
                    .put("openFirst", true)
                    .build());
            case TABS -> WidgetMapping.of("tabs", Settings.create()
                    .put("items", items(node.props.items))
                    .build());
            case FORM -> WidgetMapping.of("form", Settings.create()
                    .put("fields", fields(node))
                    .put("submitButtonText", "Submit")
                    .put("actions", List.of("email"))
                    .build());
            case SEARCH_BAR -> WidgetMapping.of("search", Settings.create()
                    .put("placeholder", node.props.placeholder)
                    .build());
            case GOOGLE_MAPS -> WidgetMapping.of("map", Settings.create()
                    .put("address", node.props.src != null ? node.props.src : text(node))
                    .put("zoom", 14)
                    .put("height", styles.height())
                    .build());
            case COUNTDOWN -> WidgetMapping.of("countdown", Settings.create()
                    .put("date", node.props.dataAttributes.get("data-date"))
                    .build());
            case PROGRESS_BAR -> WidgetMapping.of("progress-bar", Settings.create()
                    .put("bars", List.of(Settings.create()
                            .put("title", text(node))
                            .put("percentage", node.props.ariaAttributes.get("aria-valuenow"))
                            .build()))
                    .build());
            case SOCIAL_SHARE -> {
                List<Map<String, Object>> icons = new ArrayList<>();
                for (String item : node.props.items) {
                    String network = item.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
                    icons.add(Settings.create()
                            .put("icon", Map.of("library", "fontawesomeBrands", "icon", "fab fa-" + network))
                            .put("link", Map.of("type", "external", "url", "#"))
                            .build());
                }
                yield WidgetMapping.of("social-icons", Settings.create().put("icons", icons).build());
            }
            case TESTIMONIAL -> WidgetMapping.of("testimonials", Settings.create()
                    .put("items", List.of(Settings.create()
                            .put("content", text(node))
                            .put("image", node.props.src != null ? Map.of("url", node.props.src) : null)
                            .build()))
                    .build());
            case PRICING_TABLE -> WidgetMapping.of("pricing-tables", Settings.create()
                    .put("pricingTables", List.of(Settings.create()
                            .put("title", firstItemOrText(node))
                            .put("features", String.join("\n", node.props.items))
                            .build()))
                    .build());
            case MENU -> WidgetMapping.of("nav-menu", Settings.create()
                    .put("menu", "")
                    .put("mobileMenu", "mobile_landscape")
                    .build());
            case ICON_BOX, FEATURE_BOX -> WidgetMapping.of("icon-box", Settings.create()
                    .put("icon", Map.of("library", "fontawesomeSolid", "icon", "fas fa-star"))
                    .put("content", innerHtml(node))
                    .build());
            case TEAM_MEMBER -> WidgetMapping.of("team-members", Settings.create()
                    .put("items", List.of(Settings.create()
                            .put("title", firstItemOrText(node))
                            .put("image", node.props.src != null ? Map.of("url", node.props.src) : null)
                            .build()))
                    .build());
            case CARD, CTA, MODAL, INPUT, TEXTAREA, SELECT, CHECKBOX, RADIO, FILE_UPLOAD, BREADCRUMBS, PAGINATION,
                 TABLE, BLOG_CARD, PRODUCT_CARD, SOCIAL_FEED,
                 CONTAINER, SECTION, COLUMN, ROW, GRID, HERO, SIDEBAR, HEADER, FOOTER, UNKNOWN ->
                    WidgetMapping.unmapped("text", Settings.create().put("text", originalHtml(node)).build());
        };
    }

    /**
     * Bricks color object; palette colors also carry the global color id.
     */
    private static Map<String, Object> color(String color, ConversionContext context) {
        if (color == null) {
            return null;
        }
        String slot = context.colorSlot(color);
        return Settings.create()
                .put("hex", color)
                .put("id", slot != null ? "color-" + slot : null)
                .build();
    }

    private static Map<String, Object> typography(ExtractedStyles styles, ConversionContext context) {
        return Settings.create()
                .put("font-family", TypographyUsage.normalizeFontFamily(styles.fontFamily()))
                .put("font-size", styles.fontSize())
                .put("font-weight", styles.fontWeight())
                .put("line-height", styles.lineHeight())
                .put("letter-spacing", styles.letterSpacing())
                .put("text-transform", styles.textTransform())
                .put("text-align", styles.textAlign())
                .put("color", color(styles.color(), context))
                .build();
    }

    private static Map<String, Object> spacing(BoxSpacing box) {
        if (box == null) {
            return null;
        }
        return Settings.create()
                .put("top", box.top)
                .put("right", box.right)
                .put("bottom", box.bottom)
                .put("left", box.left)
                .build();
    }

    private static Map<String, Object> link(ComponentHierarchy node) {
        if (node.props.href == null) {
            return null;
        }
        return Settings.create()
                .put("type", "external")
                .put("url", node.props.href)
                .put("newTab", isExternal(node) ? true : null)
                .build();
    }

    private static String label(ComponentHierarchy node) {
        if (node.props.elementId != null) {
            return node.props.elementId;
        }
        if (node.props.className != null && !node.props.className.isBlank()) {
            return node.props.className.trim().split("\\s+")[0];
        }
        return null;
    }

    private static List<Map<String, Object>> urls(ComponentHierarchy node) {
        List<Map<String, Object>> images = new ArrayList<>();
        for (String url : node.props.mediaUrls) {
            images.add(Map.of("url", url));
        }
        return images;
    }

    private static List<Map<String, Object>> slides(ComponentHierarchy node) {
        List<Map<String, Object>> slides = new ArrayList<>();
        for (String url : node.props.mediaUrls) {
            slides.add(Map.of("background", Map.of("image", Map.of("url", url))));
        }
        return slides;
    }

    private static List<Map<String, Object>> items(List<String> titles) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (String title : titles) {
            items.add(Map.of("title", title, "content", title));
        }
        return items;
    }

    private static List<Map<String, Object>> titled(List<String> titles) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (String title : titles) {
            items.add(Map.of("title", title));
        }
        return items;
    }

    private static List<Map<String, Object>> fields(ComponentHierarchy node) {
        List<Map<String, Object>> fields = new ArrayList<>();
        for (String item : node.props.items) {
            fields.add(Map.of("type", "text", "label", item, "placeholder", item));
        }
        return fields;
    }

    private static String firstItemOrText(ComponentHierarchy node) {
        return node.props.items.isEmpty() ? text(node) : node.props.items.get(0);
    }

    static String videoType(String url) {
        if (url == null) {
            return "media";
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("youtube.com") || lower.contains("youtu.be")) {
            return "youtube";
        }
        if (lower.contains("vimeo.com")) {
            return "vimeo";
        }
        return "media";
    }

    /**
     * Last path segment of an embed or watch URL, without its query string.
     */
    static String videoId(String url) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            String watch = path.substring(query + 1);
            for (String param : watch.split("&")) {
                if (param.startsWith("v=")) {
                    return param.substring(2);
                }
            }
            path = path.substring(0, query);
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static Map<String, Object> animation(ExtractedStyles styles) {
        String name = styles.get("animationName");
        if (name == null || name.equalsIgnoreCase("none")) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        String bricksName;
        if (lower.contains("slide")) {
            bricksName = "slideInUp";
        } else if (lower.contains("zoom") || lower.contains("scale")) {
            bricksName = "zoomIn";
        } else {
            bricksName = "fadeIn";
        }
        return Settings.create()
                .put("name", bricksName)
                .put("duration", styles.get("animationDuration"))
                .put("delay", styles.get("animationDelay"))
                .build();
    }

    private static List<Map<String, Object>> globalColors(ConversionContext context) {
        List<Map<String, Object>> colors = new ArrayList<>();
        if (context.designTokens == null || context.designTokens.colors == null) {
            return colors;
        }
        ColorPalette palette = context.designTokens.colors;
        addColor(colors, "primary", "Primary", palette.primary);
        addColor(colors, "secondary", "Secondary", palette.secondary);
        addColor(colors, "accent", "Accent", palette.accent);
        addColor(colors, "text", "Text", palette.text);
        addColor(colors, "background", "Background", palette.background);
        return colors;
    }

    private static void addColor(List<Map<String, Object>> colors, String slot, String name, String color) {
        if (color != null) {
            colors.add(Settings.create().put("id", "color-" + slot).put("name", name).put("hex", color).build());
        }
    }

    private static Map<String, Object> typography(ConversionContext context) {
        if (context.typography == null) {
            return null;
        }
        GlobalTypographySettings global = context.typography.globalSettings;
        Settings typography = Settings.create()
                .put("base_font_family", global.baseFontFamily)
                .put("base_font_size", global.baseFontSize + "px")
                .put("base_line_height", String.valueOf(global.baseLineHeight))
                .put("heading_font_family", global.headingFontFamily)
                .put("heading_font_weight", String.valueOf(global.headingFontWeight));
        for (int level = 1; level <= 6; level++) {
            TextStyle style = context.typography.textStyles.heading(level);
            if (style != null) {
                typography.put("h" + level, Settings.create()
                        .put("font_size", style.fontSize)
                        .put("font_weight", style.fontWeight)
                        .put("line_height", style.lineHeight)
                        .put("letter_spacing", style.letterSpacing)
                        .build());
            }
        }
        return typography.build();
    }
}
