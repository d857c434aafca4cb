package org.dxworks.pageframe.converter.elementor;

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
import org.dxworks.pageframe.model.typography.ElementorGlobalFont;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

public class ElementorConverter extends AbstractConverter {

    public static final String VERSION = "3.16.0";
    static final String TITLE = "Imported Page";

    private static final Pattern NUMBER = Pattern.compile("-?\\d*\\.?\\d+");

    @Override
    public PageBuilder builder() {
        return PageBuilder.ELEMENTOR;
    }

    @Override
    protected IdGenerator newIdGenerator() {
        return IdGenerator.hex8();
    }

    @Override
    protected Object export(List<ComponentHierarchy> roots, ConversionContext context) {
        List<ElementorElement> content = new ArrayList<>();
        for (ComponentHierarchy root : roots) {
            content.add(topLevel(root, context));
        }
        return new ElementorExport(VERSION, TITLE, content, pageSettings(context), globals(context));
    }

    private ElementorElement topLevel(ComponentHierarchy node, ConversionContext context) {
        return switch (node.type) {
            case SECTION, CONTAINER -> section(node, false, context);
            case ROW -> {
                String sectionId = context.emit();
                context.bind(node, sectionId);
                reviewStructure(node, context);
                yield ElementorElement.section(sectionId, false, Map.of(), columns(node, false, context));
            }
            case COLUMN -> ElementorElement.section(context.emit(), false, Map.of(),
                    List.of(column(node, false, context)));
            case WIDGET -> {
                String sectionId = context.emit();
                yield ElementorElement.section(sectionId, false, Map.of(),
                        List.of(fullWidthColumn(List.of(widget(node, context)), false, context)));
            }
        };
    }

    private ElementorElement section(ComponentHierarchy node, boolean inner, ConversionContext context) {
        String id = context.register(node);
        reviewStructure(node, context);

        // several rows stack as inner sections of one full-width column
        boolean stackedRows = node.children.stream().filter(child -> child.type == NodeKind.ROW).count() > 1;
        List<ElementorElement> columns = new ArrayList<>();
        List<ElementorElement> loose = new ArrayList<>();
        for (ComponentHierarchy child : node.children) {
            switch (child.type) {
                case ROW -> {
                    if (stackedRows) {
                        loose.add(innerRow(child, context));
                    } else {
                        context.bind(child, id);
                        reviewStructure(child, context);
                        columns.addAll(columns(child, inner, context));
                    }
                }
                case COLUMN -> columns.add(column(child, inner, context));
                case SECTION, CONTAINER -> loose.add(section(child, true, context));
                case WIDGET -> loose.add(widget(child, context));
            }
        }
        if (!loose.isEmpty()) {
            columns.add(fullWidthColumn(loose, inner, context));
        }

        Settings settings = Settings.create()
                .put("layout", "boxed")
                .put("gap", "default")
                .put("structure", columns.size() > 1 ? columns.size() + "0" : null);
        if (!node.synthetic) {
            boxSettings(settings, node, context);
            settings.put("_element_id", node.props.elementId);
            settings.put("css_classes", node.props.className);
        }
        return ElementorElement.section(id, inner, settings.build(), columns);
    }

    private ElementorElement innerRow(ComponentHierarchy row, ConversionContext context) {
        String id = context.register(row);
        reviewStructure(row, context);
        List<ElementorElement> columns = columns(row, true, context);
        Map<String, Object> settings = Settings.create()
                .put("structure", columns.size() > 1 ? columns.size() + "0" : null)
                .build();
        return ElementorElement.section(id, true, settings, columns);
    }

    private List<ElementorElement> columns(ComponentHierarchy row, boolean inner, ConversionContext context) {
        List<ElementorElement> columns = new ArrayList<>();
        for (ComponentHierarchy child : row.children) {
            if (child.type == NodeKind.COLUMN) {
                columns.add(column(child, inner, context));
            } else {
                columns.add(fullWidthColumn(List.of(content(child, context)), inner, context));
            }
        }
        return columns;
    }

    private ElementorElement column(ComponentHierarchy node, boolean inner, ConversionContext context) {
        String id = context.register(node);
        reviewStructure(node, context);

        double size = node.columnSize != null ? node.columnSize : 100.0;
        Settings settings = Settings.create()
                .put("_column_size", (int) Math.round(size))
                .put("_inline_size", size != Math.rint(size) ? round(size) : null);
        if (!node.synthetic) {
            boxSettings(settings, node, context);
        }

        List<ElementorElement> elements = new ArrayList<>();
        for (ComponentHierarchy child : node.children) {
            elements.add(content(child, context));
        }
        return ElementorElement.column(id, inner, settings.build(), elements);
    }

    private ElementorElement fullWidthColumn(List<ElementorElement> elements, boolean inner,
                                             ConversionContext context) {
        return ElementorElement.column(context.emit(), inner, Map.of("_column_size", 100), elements);
    }

    private ElementorElement content(ComponentHierarchy node, ConversionContext context) {
        return switch (node.type) {
            case WIDGET -> widget(node, context);
            case SECTION, CONTAINER -> section(node, true, context);
            case ROW -> {
                String id = context.emit();
                context.bind(node, id);
                reviewStructure(node, context);
                yield ElementorElement.section(id, true, Map.of(), columns(node, true, context));
            }
            case COLUMN -> ElementorElement.section(context.emit(), true, Map.of(),
                    List.of(column(node, true, context)));
        };
    }

    private ElementorElement widget(ComponentHierarchy node, ConversionContext context) {
        WidgetMapping mapping = plan(node, context);
        String id = context.register(node);
        Settings settings = Settings.create().putAll(mapping.settings);
        if (!mapping.htmlFallback) {
            settings.put("_element_id", node.props.elementId);
            settings.put("_css_classes", node.props.className);
            if (context.options.includeAnimations) {
                settings.put("_animation", animation(node.styles));
            }
        }
        return ElementorElement.widget(id, mapping.name, settings.build());
    }

    @Override
    protected WidgetMapping htmlWidget(String html, ComponentHierarchy node) {
        return WidgetMapping.fallback("html", Settings.create().put("html", html).build());
    }

    @Override
    protected WidgetMapping mapWidget(ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        return switch (node.componentType) {
            case HEADING -> {
                Settings settings = Settings.create()
                        .put("title", text(node))
                        .put("header_size", "h" + headingLevel(node))
                        .put("align", styles.textAlign());
                color(settings, "title_color", styles.color(), context);
                typography(settings, node, context);
                yield WidgetMapping.of("heading", settings.build());
            }
            case TEXT, PARAGRAPH, LINK -> {
                Settings settings = Settings.create()
                        .put("editor", node.componentType == ComponentType.LINK
                                ? originalHtml(node) : innerHtml(node))
                        .put("align", styles.textAlign());
                color(settings, "text_color", styles.color(), context);
                typography(settings, node, context);
                yield WidgetMapping.of("text-editor", settings.build());
            }
            case BUTTON, SUBMIT_BUTTON -> {
                Settings settings = Settings.create()
                        .put("text", text(node).isEmpty() ? node.props.value : text(node))
                        .put("link", link(node))
                        .put("button_type", "primary")
                        .put("size", "md")
                        .put("align", styles.textAlign());
                color(settings, "button_text_color", styles.color(), context);
                color(settings, "background_color", styles.backgroundColor(), context);
                if (styles.borderRadius != null) {
                    settings.put("border_radius", sizeUnit(pixels(styles.borderRadius.topLeft), "px"));
                }
                settings.put("button_padding", dimensions(styles.padding));
                typography(settings, node, context);
                yield WidgetMapping.of("button", settings.build());
            }
            case IMAGE -> {
                Settings settings = Settings.create()
                        .put("image", Settings.create().put("url", node.props.src).put("id", "")
                                .put("alt", node.props.alt).build())
                        .put("image_size", "full")
                        .put("align", styles.textAlign());
                if (node.props.href != null) {
                    settings.put("link_to", "custom").put("link", link(node));
                }
                yield WidgetMapping.of("image", settings.build());
            }
            case VIDEO -> {
                String url = node.props.src != null ? node.props.src : node.props.href;
                String videoType = videoType(url);
                Settings settings = Settings.create().put("video_type", videoType);
                if ("hosted".equals(videoType)) {
                    settings.put("hosted_url", Settings.create().put("url", url).build());
                } else {
                    settings.put(videoType + "_url", url);
                }
                settings.put("image_overlay", node.props.poster != null
                        ? Map.of("url", node.props.poster) : null);
                yield WidgetMapping.of("video", settings.build());
            }
            case ICON -> {
                Settings settings = Settings.create()
                        .put("selected_icon", Map.of("value", iconClass(node), "library", "fa-solid"))
                        .put("link", link(node));
                color(settings, "primary_color", styles.color(), context);
                settings.put("size", sizeUnit(pixels(styles.fontSize()), "px"));
                yield WidgetMapping.of("icon", settings.build());
            }
            case SPACER -> WidgetMapping.of("spacer", Settings.create()
                    .put("space", sizeUnit(pixels(styles.height()), "px")).build());
            case DIVIDER -> {
                Settings settings = Settings.create();
                if (styles.border != null) {
                    settings.put("style", styles.border.style)
                            .put("weight", sizeUnit(pixels(styles.border.width), "px"));
                    color(settings, "color", styles.border.color, context);
                }
                yield WidgetMapping.of("divider", settings.build());
            }
            case GOOGLE_MAPS -> WidgetMapping.of("google_maps", Settings.create()
                    .put("address", node.props.src != null ? node.props.src : text(node))
                    .put("zoom", sizeUnit(10.0, "px"))
                    .put("height", sizeUnit(pixels(styles.height()), "px")).build());
            case TABS, ACCORDION -> {
                List<Map<String, Object>> tabs = new ArrayList<>();
                for (String item : node.props.items) {
                    tabs.add(Settings.create().put("tab_title", item).put("tab_content", item).build());
                }
                yield WidgetMapping.of(node.componentType == ComponentType.TABS
                        ? "tabs" : "accordion", Settings.create().put("tabs", tabs).build());
            }
            case CAROUSEL, SLIDER -> WidgetMapping.of("image-carousel", Settings.create()
                    .put("carousel", media(node))
                    .put("slides_to_show", "1")
                    .put("navigation", "both")
                    .put("autoplay", "yes").build());
            case GALLERY -> WidgetMapping.of("image-gallery", Settings.create()
                    .put("wp_gallery", media(node))
                    .put("gallery_columns", String.valueOf(Math.max(1, Math.min(4, node.props.mediaUrls.size()))))
                    .build());
            case TESTIMONIAL -> WidgetMapping.of("testimonial", Settings.create()
                    .put("testimonial_content", text(node))
                    .put("testimonial_image", node.props.src != null ? Map.of("url", node.props.src) : null)
                    .build());
            case PROGRESS_BAR -> WidgetMapping.of("progress", Settings.create()
                    .put("title", text(node))
                    .put("percent", sizeUnit(percentOf(node), "%")).build());
            case LIST -> {
                List<Map<String, Object>> icons = new ArrayList<>();
                for (String item : node.props.items) {
                    icons.add(Settings.create().put("text", item)
                            .put("selected_icon", Map.of("value", "fas fa-check", "library", "fa-solid")).build());
                }
                yield WidgetMapping.of("icon-list", Settings.create().put("icon_list", icons).build());
            }
            case ICON_BOX, FEATURE_BOX -> WidgetMapping.of("icon-box", Settings.create()
                    .put("title_text", firstItemOrText(node))
                    .put("description_text", text(node))
                    .put("link", link(node)).build());
            case CTA -> WidgetMapping.of("call-to-action", Settings.create()
                    .put("title", firstItemOrText(node))
                    .put("description", text(node))
                    .put("button", "Click Here")
                    .put("link", link(node)).build());
            case PRICING_TABLE -> WidgetMapping.of("price-table", Settings.create()
                    .put("heading", firstItemOrText(node))
                    .put("features_list", features(node))
                    .put("button_text", "Click Here").build());
            case COUNTDOWN -> WidgetMapping.of("countdown", Settings.create()
                    .put("countdown_type", "due_date")
                    .put("due_date", node.props.dataAttributes.get("data-date")).build());
            case SOCIAL_SHARE -> {
                List<Map<String, Object>> icons = new ArrayList<>();
                for (String item : node.props.items) {
                    icons.add(Map.of("social_icon", Map.of("value", "fab fa-" + item.toLowerCase(Locale.ROOT)
                            .replaceAll("[^a-z0-9]+", "-"), "library", "fa-brands")));
                }
                yield WidgetMapping.of("social-icons", Settings.create().put("social_icon_list", icons).build());
            }
            case FORM -> WidgetMapping.of("form", Settings.create()
                    .put("form_name", node.props.name != null ? node.props.name : "Contact Form")
                    .put("form_fields", formFields(node))
                    .put("button_text", "Send").build());
            case MENU -> WidgetMapping.of("nav-menu", Settings.create()
                    .put("layout", "horizontal")
                    .put("menu_items", node.props.items).build());
            case SEARCH_BAR -> WidgetMapping.of("search-form", Settings.create()
                    .put("placeholder", node.props.placeholder)
                    .put("skin", "classic").build());
            case CODE_BLOCK -> WidgetMapping.of("code-highlight", Settings.create()
                    .put("language", "markup")
                    .put("code", text(node)).build());
            case BLOCKQUOTE -> WidgetMapping.of("blockquote", Settings.create()
                    .put("blockquote_content", text(node)).build());
            case CARD, MODAL, INPUT, TEXTAREA, SELECT, CHECKBOX, RADIO, FILE_UPLOAD, BREADCRUMBS, PAGINATION,
                 TABLE, TEAM_MEMBER, BLOG_CARD, PRODUCT_CARD, SOCIAL_FEED,
                 CONTAINER, SECTION, COLUMN, ROW, GRID, HERO, SIDEBAR, HEADER, FOOTER, UNKNOWN ->
                    WidgetMapping.unmapped("text-editor", Settings.create().put("editor", originalHtml(node)).build());
        };
    }

    private void typography(Settings settings, ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        Settings typography = Settings.create()
                .put("typography_font_family", TypographyUsage.normalizeFontFamily(styles.fontFamily()))
                .put("typography_font_size", sizeUnit(pixels(styles.fontSize()), "px"))
                .put("typography_font_weight", styles.fontWeight())
                .put("typography_line_height", lineHeight(styles.lineHeight()))
                .put("typography_letter_spacing", sizeUnit(pixels(styles.letterSpacing()), "px"))
                .put("typography_text_transform", styles.textTransform());
        if (typography.isEmpty()) {
            return;
        }
        settings.put("typography_typography", "custom").putAll(typography.build());
        if (context.options.includeResponsive) {
            responsive(settings, "typography_font_size", node, s -> sizeUnit(pixels(s.fontSize()), "px"));
            responsive(settings, "align", node, ExtractedStyles::textAlign);
        }
        String global = typographyGlobal(node, context);
        if (global != null) {
            globalRefs(settings).put("typography_typography", "globals/typography?id=" + global);
        }
    }

    private void color(Settings settings, String key, String color, ConversionContext context) {
        if (color == null) {
            return;
        }
        settings.put(key, color);
        String slot = context.colorSlot(color);
        if (slot != null) {
            globalRefs(settings).put(key, "globals/colors?id=" + slot);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> globalRefs(Settings settings) {
        Map<String, Object> values = settings.build();
        return (Map<String, Object>) values.computeIfAbsent("__globals__", k -> new LinkedHashMap<String, Object>());
    }

    private static String typographyGlobal(ComponentHierarchy node, ConversionContext context) {
        if (context.typography == null) {
            return null;
        }
        String family = TypographyUsage.normalizeFontFamily(node.styles.fontFamily());
        String headingId = node.componentType == ComponentType.HEADING
                ? "h" + headingLevel(node) : null;
        for (ElementorGlobalFont font : context.typography.elementorGlobalFonts) {
            if (font.id.equals(headingId)) {
                return font.id;
            }
        }
        if (family == null) {
            return null;
        }
        for (ElementorGlobalFont font : context.typography.elementorGlobalFonts) {
            if ((font.id.equals("primary") || font.id.equals("secondary")) && family.equals(font.fontFamily)) {
                return font.id;
            }
        }
        return null;
    }

    private void responsive(Settings settings, String key, ComponentHierarchy node,
                            Function<ExtractedStyles, Object> value) {
        ExtractedStyles tablet = tabletStyles(node);
        ExtractedStyles mobile = mobileStyles(node);
        if (tablet != null) {
            settings.put(key + "_tablet", value.apply(tablet));
        }
        if (mobile != null) {
            settings.put(key + "_mobile", value.apply(mobile));
        }
    }

    private void boxSettings(Settings settings, ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        if (styles.backgroundColor() != null) {
            settings.put("background_background", "classic");
            color(settings, "background_color", styles.backgroundColor(), context);
        }
        String image = backgroundUrl(styles.backgroundImage());
        if (image != null) {
            settings.put("background_background", "classic")
                    .put("background_image", Map.of("url", image, "id", ""));
        }
        settings.put("padding", dimensions(styles.padding));
        settings.put("margin", dimensions(styles.margin));
        if (context.options.includeResponsive) {
            responsive(settings, "padding", node, s -> dimensions(s.padding));
        }
        if (context.options.includeAnimations) {
            settings.put("animation", animation(styles));
        }
    }

    private static Map<String, Object> dimensions(BoxSpacing box) {
        if (box == null) {
            return null;
        }
        return Settings.create()
                .put("unit", "px")
                .put("top", pixelString(box.top))
                .put("right", pixelString(box.right))
                .put("bottom", pixelString(box.bottom))
                .put("left", pixelString(box.left))
                .put("isLinked", box.isUniform())
                .build();
    }

    private static String pixelString(String value) {
        Double px = pixels(value);
        return px != null ? String.valueOf(Math.round(px)) : "0";
    }

    private static Map<String, Object> lineHeight(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            return sizeUnit(Double.parseDouble(trimmed), "em");
        }
        return sizeUnit(pixels(trimmed), "px");
    }

    private static Map<String, Object> link(ComponentHierarchy node) {
        if (node.props.href == null) {
            return null;
        }
        return Settings.create()
                .put("url", node.props.href)
                .put("is_external", isExternal(node) ? "on" : "")
                .put("nofollow", "")
                .build();
    }

    private static List<Map<String, Object>> media(ComponentHierarchy node) {
        List<Map<String, Object>> media = new ArrayList<>();
        for (String url : node.props.mediaUrls) {
            media.add(Map.of("id", "", "url", url));
        }
        return media;
    }

    private static List<Map<String, Object>> features(ComponentHierarchy node) {
        List<Map<String, Object>> features = new ArrayList<>();
        for (String item : node.props.items) {
            features.add(Map.of("item_text", item));
        }
        return features;
    }

    private static List<Map<String, Object>> formFields(ComponentHierarchy node) {
        List<Map<String, Object>> fields = new ArrayList<>();
        int index = 0;
        for (String item : node.props.items) {
            fields.add(Settings.create()
                    .put("custom_id", "field_" + index++)
                    .put("field_type", "text")
                    .put("field_label", item)
                    .put("placeholder", item)
                    .build());
        }
        return fields;
    }

    private static String firstItemOrText(ComponentHierarchy node) {
        return node.props.items.isEmpty() ? text(node) : node.props.items.get(0);
    }

    private static Double percentOf(ComponentHierarchy node) {
        String now = node.props.ariaAttributes.get("aria-valuenow");
        if (now == null || !NUMBER.matcher(now.trim()).matches()) {
            return null;
        }
        return Double.parseDouble(now.trim());
    }

    private static String iconClass(ComponentHierarchy node) {
        return node.props.className != null ? node.props.className : "fas fa-star";
    }

    static String videoType(String url) {
        if (url == null) {
            return "hosted";
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("youtube.com") || lower.contains("youtu.be")) {
            return "youtube";
        }
        if (lower.contains("vimeo.com")) {
            return "vimeo";
        }
        return "hosted";
    }

    private static String animation(ExtractedStyles styles) {
        String name = styles.get("animationName");
        if (name == null || name.equalsIgnoreCase("none")) {
            return styles.has("transition") ? "fadeIn" : null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("slide")) {
            return "slideInUp";
        }
        if (lower.contains("zoom") || lower.contains("scale")) {
            return "zoomIn";
        }
        if (lower.contains("bounce")) {
            return "bounce";
        }
        return "fadeIn";
    }

    private static Map<String, Object> pageSettings(ConversionContext context) {
        Settings settings = Settings.create()
                .put("post_status", "draft")
                .put("template", "default");
        if (context.designTokens != null && context.designTokens.colors != null) {
            settings.put("background_background", "classic")
                    .put("background_color", context.designTokens.colors.background);
        }
        return settings.build();
    }

    private static ElementorExport.Globals globals(ConversionContext context) {
        List<Map<String, Object>> colors = new ArrayList<>();
        if (context.designTokens != null && context.designTokens.colors != null) {
            ColorPalette palette = context.designTokens.colors;
            addColor(colors, "primary", "Primary", palette.primary);
            addColor(colors, "secondary", "Secondary", palette.secondary);
            addColor(colors, "text", "Text", palette.text);
            addColor(colors, "accent", "Accent", palette.accent);
        }
        List<ElementorGlobalFont> fonts = context.typography != null
                ? context.typography.elementorGlobalFonts : List.of();
        return new ElementorExport.Globals(colors, fonts);
    }

    private static void addColor(List<Map<String, Object>> colors, String id, String title, String color) {
        if (color != null) {
            colors.add(Map.of("_id", id, "title", title, "color", color));
        }
    }
}
