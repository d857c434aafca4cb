package org.dxworks.pageframe.converter.gutenberg;

import org.dxworks.pageframe.analyzer.TypographyUsage;
import org.dxworks.pageframe.converter.AbstractConverter;
import org.dxworks.pageframe.converter.ConversionContext;
import org.dxworks.pageframe.converter.IdGenerator;
import org.dxworks.pageframe.converter.Settings;
import org.dxworks.pageframe.converter.WidgetMapping;
import org.dxworks.pageframe.model.BoxSpacing;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.ExtractedStyles;
import org.dxworks.pageframe.model.NodeKind;
import org.dxworks.pageframe.model.PageBuilder;
import org.dxworks.pageframe.model.design.ColorPalette;
import org.dxworks.pageframe.model.typography.TextStyle;
import org.dxworks.pageframe.model.typography.TypeSize;
import org.dxworks.pageframe.model.typography.TypographySystem;
import org.jsoup.nodes.Entities;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts the hierarchy into core blocks. Sections and containers become
 * groups; rows of two or more columns become columns blocks. Synthetic
 * sections and synthetic single-column rows stand for no element, so their
 * content is spliced into the parent.
 */
public class GutenbergConverter extends AbstractConverter {

    static final String ROOT = "root";

    private static final Set<String> GROUP_TAGS = Set.of("section", "header", "footer", "main", "article", "aside");

    @Override
    public PageBuilder builder() {
        return PageBuilder.GUTENBERG;
    }

    @Override
    protected IdGenerator newIdGenerator() {
        return IdGenerator.prefixed("block");
    }

    @Override
    protected Object export(List<ComponentHierarchy> roots, ConversionContext context) {
        List<GutenbergBlock> blocks = new ArrayList<>();
        for (ComponentHierarchy root : roots) {
            blocks.addAll(convertNode(root, ROOT, context));
        }
        return new GutenbergExport(blocks, BlockSerializer.serialize(blocks), globalStyles(context));
    }

    private List<GutenbergBlock> convertNode(ComponentHierarchy node, String parentId, ConversionContext context) {
        return switch (node.type) {
            case SECTION, CONTAINER -> node.synthetic
                    ? splice(node, parentId, context)
                    : List.of(group(node, context));
            case ROW -> row(node, parentId, context);
            case COLUMN -> node.synthetic
                    ? splice(node, parentId, context)
                    : List.of(column(node, context));
            case WIDGET -> List.of(leaf(node, context));
        };
    }

    private List<GutenbergBlock> splice(ComponentHierarchy node, String parentId, ConversionContext context) {
        context.bind(node, parentId);
        reviewStructure(node, context);
        return children(node, parentId, context);
    }

    private List<GutenbergBlock> children(ComponentHierarchy node, String parentId, ConversionContext context) {
        List<GutenbergBlock> blocks = new ArrayList<>();
        for (ComponentHierarchy child : node.children) {
            blocks.addAll(convertNode(child, parentId, context));
        }
        return blocks;
    }

    private GutenbergBlock group(ComponentHierarchy node, ConversionContext context) {
        String id = context.register(node);
        reviewStructure(node, context);

        String tag = node.tagName != null && GROUP_TAGS.contains(node.tagName) ? node.tagName : null;
        Settings attrs = Settings.create()
                .put("tagName", tag)
                .put("anchor", node.props.elementId)
                .put("className", node.props.className)
                .put("layout", Map.of("type", "constrained"));
        colors(attrs, node.styles, context);
        addStyle(attrs, "spacing", spacing(node.styles));

        String element = tag != null ? tag : "div";
        return new GutenbergBlock("core/group", attrs.build(), children(node, id, context),
                "<" + element + " class=\"wp-block-group\"></" + element + ">");
    }

    private List<GutenbergBlock> row(ComponentHierarchy node, String parentId, ConversionContext context) {
        boolean splice = node.children.size() == 1
                && node.children.get(0).type == NodeKind.COLUMN
                && node.children.get(0).synthetic;
        if (splice) {
            return splice(node, parentId, context);
        }
        String id = context.register(node);
        reviewStructure(node, context);

        List<GutenbergBlock> columns = new ArrayList<>();
        for (ComponentHierarchy child : node.children) {
            if (child.type == NodeKind.COLUMN) {
                columns.add(column(child, context));
            } else {
                columns.add(new GutenbergBlock("core/column", Map.of(), convertNode(child, id, context),
                        "<div class=\"wp-block-column\"></div>"));
            }
        }
        return List.of(new GutenbergBlock("core/columns", Settings.create().put("isStackedOnMobile", true).build(),
                columns, "<div class=\"wp-block-columns\"></div>"));
    }

    private GutenbergBlock column(ComponentHierarchy node, ConversionContext context) {
        String id = context.register(node);
        reviewStructure(node, context);

        String width = node.columnSize != null ? formatPercent(node.columnSize) : null;
        Settings attrs = Settings.create().put("width", width);
        if (!node.synthetic) {
            colors(attrs, node.styles, context);
        }
        String style = width != null ? " style=\"flex-basis:" + width + "\"" : "";
        return new GutenbergBlock("core/column", attrs.build(), children(node, id, context),
                "<div class=\"wp-block-column\"" + style + "></div>");
    }

    private GutenbergBlock leaf(ComponentHierarchy node, ConversionContext context) {
        WidgetMapping mapping = plan(node, context);
        context.register(node);
        Map<String, Object> attrs = mapping.settings;
        return switch (mapping.name) {
            case "core/buttons" -> new GutenbergBlock("core/buttons", Map.of(),
                    List.of(GutenbergBlock.leaf("core/button", attrs, buttonHtml(node))),
                    "<div class=\"wp-block-buttons\"></div>");
            case "core/social-links" -> new GutenbergBlock("core/social-links", attrs, socialLinks(node),
                    "<ul class=\"wp-block-social-links\"></ul>");
            case "core/gallery" -> new GutenbergBlock("core/gallery", attrs, galleryImages(node),
                    "<figure class=\"wp-block-gallery has-nested-images columns-default\"></figure>");
            default -> GutenbergBlock.leaf(mapping.name, attrs, markup(mapping.name, node));
        };
    }

    @Override
    protected WidgetMapping htmlWidget(String html, ComponentHierarchy node) {
        return WidgetMapping.fallback("core/html", Map.of());
    }

    @Override
    protected WidgetMapping mapWidget(ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        return switch (node.componentType) {
            case HEADING -> {
                Settings attrs = Settings.create()
                        .put("level", headingLevel(node))
                        .put("textAlign", styles.textAlign());
                colors(attrs, styles, context);
                addStyle(attrs, "typography", typography(styles));
                yield WidgetMapping.of("core/heading", attrs.build());
            }
            case TEXT, PARAGRAPH, LINK -> {
                Settings attrs = Settings.create().put("align", styles.textAlign());
                colors(attrs, styles, context);
                addStyle(attrs, "typography", typography(styles));
                yield WidgetMapping.of("core/paragraph", attrs.build());
            }
            case IMAGE -> WidgetMapping.of("core/image", Settings.create()
                    .put("url", node.props.src)
                    .put("alt", node.props.alt)
                    .put("width", integer(node.props.width))
                    .put("height", integer(node.props.height))
                    .put("sizeSlug", "large")
                    .put("linkDestination", node.props.href != null ? "custom" : "none")
                    .put("href", node.props.href)
                    .build());
            case VIDEO, SOCIAL_FEED -> {
                String url = node.props.src != null ? node.props.src : node.props.href;
                String provider = provider(url);
                if (provider == null && node.componentType == ComponentType.VIDEO) {
                    yield WidgetMapping.of("core/video", Settings.create().put("src", url).build());
                }
                yield WidgetMapping.of("core/embed", Settings.create()
                        .put("url", url)
                        .put("type", node.componentType == ComponentType.VIDEO ? "video" : "rich")
                        .put("providerNameSlug", provider)
                        .build());
            }
            case BUTTON, SUBMIT_BUTTON -> {
                Settings attrs = Settings.create()
                        .put("text", text(node))
                        .put("url", node.props.href)
                        .put("linkTarget", node.props.target);
                colors(attrs, styles, context);
                if (styles.borderRadius != null) {
                    addStyle(attrs, "border", Settings.create().put("radius", styles.borderRadius.topLeft).build());
                }
                yield WidgetMapping.of("core/buttons", attrs.build());
            }
            case LIST -> WidgetMapping.of("core/list", Settings.create()
                    .put("ordered", Boolean.TRUE.equals(node.props.ordered) ? true : null)
                    .build());
            case BLOCKQUOTE, TESTIMONIAL -> WidgetMapping.of("core/quote", Map.of());
            case CODE_BLOCK -> WidgetMapping.of("core/code", Map.of());
            case TABLE -> WidgetMapping.of("core/table", Settings.create().put("hasFixedLayout", true).build());
            case DIVIDER -> WidgetMapping.of("core/separator", Settings.create()
                    .put("opacity", "alpha-channel").build());
            case SPACER -> WidgetMapping.of("core/spacer", Settings.create()
                    .put("height", styles.height() != null ? styles.height() : "100px").build());
            case GALLERY -> WidgetMapping.of("core/gallery", Settings.create()
                    .put("linkTo", "none")
                    .put("columns", Math.max(1, Math.min(4, node.props.mediaUrls.size())))
                    .build());
            case SEARCH_BAR -> WidgetMapping.of("core/search", Settings.create()
                    .put("label", "Search")
                    .put("buttonText", "Search")
                    .put("placeholder", node.props.placeholder)
                    .build());
            case SOCIAL_SHARE -> WidgetMapping.of("core/social-links", Settings.create()
                    .put("iconColorValue", styles.color())
                    .put("size", "has-normal-icon-size")
                    .build());
            case MENU -> WidgetMapping.of("core/navigation", Settings.create()
                    .put("orientation", "horizontal")
                    .put("overlayMenu", "mobile")
                    .build());
            case ICON, CAROUSEL, SLIDER, CARD, MODAL, TABS, ACCORDION, FORM, INPUT, TEXTAREA, SELECT, CHECKBOX,
                 RADIO, FILE_UPLOAD, PROGRESS_BAR, COUNTDOWN, BREADCRUMBS, PAGINATION, PRICING_TABLE, CTA,
                 FEATURE_BOX, ICON_BOX, TEAM_MEMBER, BLOG_CARD, PRODUCT_CARD, GOOGLE_MAPS,
                 CONTAINER, SECTION, COLUMN, ROW, GRID, HERO, SIDEBAR, HEADER, FOOTER, UNKNOWN ->
                    WidgetMapping.unmapped("core/freeform", Map.of());
        };
    }

    private String markup(String blockName, ComponentHierarchy node) {
        return switch (blockName) {
            case "core/heading" -> {
                int level = headingLevel(node);
                yield "<h" + level + " class=\"wp-block-heading\">" + innerHtml(node) + "</h" + level + ">";
            }
            case "core/paragraph" -> "<p>" + (node.componentType == ComponentType.LINK
                    ? originalHtml(node) : innerHtml(node)) + "</p>";
            case "core/image" -> "<figure class=\"wp-block-image size-large\"><img src=\""
                    + attr(node.props.src) + "\" alt=\"" + attr(node.props.alt) + "\"/></figure>";
            case "core/video" -> "<figure class=\"wp-block-video\"><video controls src=\""
                    + attr(node.props.src) + "\"></video></figure>";
            case "core/embed" -> "<figure class=\"wp-block-embed\"><div class=\"wp-block-embed__wrapper\">\n"
                    + (node.props.src != null ? node.props.src : node.props.href) + "\n</div></figure>";
            case "core/list" -> listHtml(node);
            case "core/quote" -> "<blockquote class=\"wp-block-quote\"><p>" + escape(text(node)) + "</p></blockquote>";
            case "core/code" -> "<pre class=\"wp-block-code\"><code>" + escape(text(node)) + "</code></pre>";
            case "core/table" -> tableHtml(node);
            case "core/separator" -> "<hr class=\"wp-block-separator has-alpha-channel-opacity\"/>";
            case "core/spacer" -> "<div style=\"height:" + attr(String.valueOf(node.styles.height() != null
                    ? node.styles.height() : "100px")) + "\" aria-hidden=\"true\" class=\"wp-block-spacer\"></div>";
            case "core/search", "core/navigation" -> "";
            default -> originalHtml(node);
        };
    }

    private static String buttonHtml(ComponentHierarchy node) {
        String href = node.props.href != null ? " href=\"" + attr(node.props.href) + "\"" : "";
        return "<div class=\"wp-block-button\"><a class=\"wp-block-button__link wp-element-button\"" + href + ">"
                + escape(text(node)) + "</a></div>";
    }

    private static String listHtml(ComponentHierarchy node) {
        String tag = Boolean.TRUE.equals(node.props.ordered) ? "ol" : "ul";
        StringBuilder html = new StringBuilder("<").append(tag).append(" class=\"wp-block-list\">");
        for (String item : node.props.items) {
            html.append("<li>").append(escape(item)).append("</li>");
        }
        return html.append("</").append(tag).append(">").toString();
    }

    private static String tableHtml(ComponentHierarchy node) {
        StringBuilder html = new StringBuilder("<figure class=\"wp-block-table\"><table class=\"has-fixed-layout\"><tbody>");
        for (List<String> row : node.props.tableRows) {
            html.append("<tr>");
            for (String cell : row) {
                html.append("<td>").append(escape(cell)).append("</td>");
            }
            html.append("</tr>");
        }
        return html.append("</tbody></table></figure>").toString();
    }

    private static List<GutenbergBlock> galleryImages(ComponentHierarchy node) {
        List<GutenbergBlock> images = new ArrayList<>();
        for (String url : node.props.mediaUrls) {
            images.add(GutenbergBlock.leaf("core/image", Settings.create().put("sizeSlug", "large")
                            .put("linkDestination", "none").build(),
                    "<figure class=\"wp-block-image size-large\"><img src=\"" + attr(url) + "\" alt=\"\"/></figure>"));
        }
        return images;
    }

    private static List<GutenbergBlock> socialLinks(ComponentHierarchy node) {
        List<GutenbergBlock> links = new ArrayList<>();
        for (String item : node.props.items) {
            String service = item.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "");
            links.add(GutenbergBlock.leaf("core/social-link",
                    Settings.create().put("service", service.isEmpty() ? "chain" : service).put("url", "#").build(),
                    ""));
        }
        return links;
    }

    private static void colors(Settings attrs, ExtractedStyles styles, ConversionContext context) {
        Map<String, Object> custom = new LinkedHashMap<>();
        String textSlot = context.colorSlot(styles.color());
        if (textSlot != null) {
            attrs.put("textColor", textSlot);
        } else if (styles.color() != null) {
            custom.put("text", styles.color());
        }
        String backgroundSlot = context.colorSlot(styles.backgroundColor());
        if (backgroundSlot != null) {
            attrs.put("backgroundColor", backgroundSlot);
        } else if (styles.backgroundColor() != null) {
            custom.put("background", styles.backgroundColor());
        }
        addStyle(attrs, "color", custom);
    }

    private static Map<String, Object> spacing(ExtractedStyles styles) {
        Settings spacing = Settings.create();
        if (styles.padding != null) {
            spacing.put("padding", box(styles.padding));
        }
        if (styles.margin != null) {
            spacing.put("margin", box(styles.margin));
        }
        return spacing.build();
    }

    @SuppressWarnings("unchecked")
    private static void addStyle(Settings attrs, String key, Map<String, Object> value) {
        if (value.isEmpty()) {
            return;
        }
        Map<String, Object> style = (Map<String, Object>) attrs.build()
                .computeIfAbsent("style", k -> new LinkedHashMap<String, Object>());
        style.put(key, value);
    }

    private static Map<String, Object> box(BoxSpacing box) {
        return Settings.create()
                .put("top", box.top)
                .put("right", box.right)
                .put("bottom", box.bottom)
                .put("left", box.left)
                .build();
    }

    private static Map<String, Object> typography(ExtractedStyles styles) {
        return Settings.create()
                .put("fontSize", styles.fontSize())
                .put("fontWeight", styles.fontWeight())
                .put("lineHeight", styles.lineHeight())
                .put("letterSpacing", styles.letterSpacing())
                .put("textTransform", styles.textTransform())
                .build();
    }

    private static Map<String, Object> globalStyles(ConversionContext context) {
        Settings settings = Settings.create();
        Settings styles = Settings.create();

        if (context.designTokens != null && context.designTokens.colors != null) {
            ColorPalette palette = context.designTokens.colors;
            List<Map<String, Object>> entries = new ArrayList<>();
            paletteEntry(entries, "primary", "Primary", palette.primary);
            paletteEntry(entries, "secondary", "Secondary", palette.secondary);
            paletteEntry(entries, "accent", "Accent", palette.accent);
            paletteEntry(entries, "text", "Text", palette.text);
            paletteEntry(entries, "background", "Background", palette.background);
            settings.put("color", Settings.create().put("palette", entries).build());
            styles.put("color", Settings.create()
                    .put("text", palette.text)
                    .put("background", palette.background)
                    .build());
        }

        TypographySystem typography = context.typography;
        if (typography != null) {
            List<Map<String, Object>> families = new ArrayList<>();
            typography.fontFamilies.forEach(family -> families.add(Settings.create()
                    .put("fontFamily", family.name)
                    .put("slug", slug(family.name))
                    .put("name", family.name)
                    .build()));
            List<Map<String, Object>> sizes = new ArrayList<>();
            for (TypeSize size : typography.typeScale.sizes) {
                sizes.add(Settings.create().put("slug", size.name).put("size", size.px + "px").put("name", size.name)
                        .build());
            }
            settings.put("typography", Settings.create()
                    .put("fontFamilies", families)
                    .put("fontSizes", sizes)
                    .build());

            styles.put("typography", Settings.create()
                    .put("fontFamily", typography.globalSettings.baseFontFamily)
                    .put("fontSize", typography.globalSettings.baseFontSize + "px")
                    .put("lineHeight", String.valueOf(typography.globalSettings.baseLineHeight))
                    .build());
            Settings elements = Settings.create();
            for (int level = 1; level <= 6; level++) {
                elements.put("h" + level, Map.of("typography", textStyle(typography.textStyles.heading(level))));
            }
            elements.put("link", Map.of("typography", textStyle(typography.textStyles.link)));
            elements.put("button", Map.of("typography", textStyle(typography.textStyles.button)));
            styles.put("elements", elements.build());
        }

        return Settings.create()
                .put("version", 2)
                .put("settings", settings.build())
                .put("styles", styles.build())
                .build();
    }

    private static Map<String, Object> textStyle(TextStyle style) {
        return Settings.create()
                .put("fontFamily", TypographyUsage.normalizeFontFamily(style.fontFamily))
                .put("fontSize", style.fontSize)
                .put("fontWeight", style.fontWeight)
                .put("lineHeight", style.lineHeight)
                .put("textTransform", style.textTransform)
                .build();
    }

    private static void paletteEntry(List<Map<String, Object>> entries, String slug, String name, String color) {
        if (color != null) {
            entries.add(Settings.create().put("slug", slug).put("color", color).put("name", name).build());
        }
    }

    private static String slug(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
    }

    static String provider(String url) {
        if (url == null) {
            return null;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("youtube.com") || lower.contains("youtu.be")) {
            return "youtube";
        }
        if (lower.contains("vimeo.com")) {
            return "vimeo";
        }
        if (lower.contains("twitter.com") || lower.contains("x.com/")) {
            return "twitter";
        }
        if (lower.contains("instagram.com")) {
            return "instagram";
        }
        return null;
    }

    private static String formatPercent(double size) {
        return (size == Math.rint(size) ? String.valueOf((long) size) : String.valueOf(round(size))) + "%";
    }

    private static Integer integer(String value) {
        Double px = pixels(value);
        return px != null ? (int) Math.round(px) : null;
    }

    private static String escape(String text) {
        return Entities.escape(text);
    }

    private static String attr(String value) {
        return value != null ? Entities.escape(value).replace("\"", "&quot;") : "";
    }
}
