package org.dxworks.pageframe.converter.beaver;

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
import org.dxworks.pageframe.model.typography.GlobalTypographySettings;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a row / column-group / column / module tree and flattens it into
 * the node table with its adjacency lists as the last step.
 */
public class BeaverConverter extends AbstractConverter {

    private static final class Draft {
        final String id;
        final BeaverNode.Type type;
        final Map<String, Object> settings;
        final List<Draft> children = new ArrayList<>();

        Draft(String id, BeaverNode.Type type, Map<String, Object> settings) {
            this.id = id;
            this.type = type;
            this.settings = settings;
        }
    }

    @Override
    public PageBuilder builder() {
        return PageBuilder.BEAVER;
    }

    @Override
    protected IdGenerator newIdGenerator() {
        return IdGenerator.hex13();
    }

    @Override
    protected Object export(List<ComponentHierarchy> roots, ConversionContext context) {
        List<Draft> rows = new ArrayList<>();
        for (ComponentHierarchy root : roots) {
            rows.add(row(root, context));
        }

        Map<String, BeaverNode> nodes = new LinkedHashMap<>();
        Map<String, List<String>> nodeOrder = new LinkedHashMap<>();
        flatten(BeaverExport.ROOT, rows, nodes, nodeOrder);
        return new BeaverExport(nodes, nodeOrder, colorScheme(context), typography(context));
    }

    private static void flatten(String parent, List<Draft> drafts, Map<String, BeaverNode> nodes,
                                Map<String, List<String>> nodeOrder) {
        List<String> order = new ArrayList<>();
        for (int position = 0; position < drafts.size(); position++) {
            Draft draft = drafts.get(position);
            String parentId = BeaverExport.ROOT.equals(parent) ? null : parent;
            nodes.put(draft.id, new BeaverNode(draft.id, draft.type, parentId, position, draft.settings));
            order.add(draft.id);
        }
        nodeOrder.put(parent, order);
        for (Draft draft : drafts) {
            if (!draft.children.isEmpty()) {
                flatten(draft.id, draft.children, nodes, nodeOrder);
            }
        }
    }

    private Draft row(ComponentHierarchy node, ConversionContext context) {
        if (node.type != NodeKind.SECTION && node.type != NodeKind.CONTAINER) {
            Draft row = new Draft(context.emit(), BeaverNode.Type.ROW, Map.of("width", "fixed"));
            row.children.add(columnGroup(List.of(node), context));
            return row;
        }
        Draft row = new Draft(context.register(node), BeaverNode.Type.ROW, rowSettings(node, context));
        reviewStructure(node, context);
        addGroups(row, node, context);
        return row;
    }

    /**
     * Rows of the hierarchy become column groups of the enclosing node; any
     * other child is gathered into a full-width group.
     */
    private void addGroups(Draft parent, ComponentHierarchy node, ConversionContext context) {
        List<ComponentHierarchy> loose = new ArrayList<>();
        for (ComponentHierarchy child : node.children) {
            if (child.type == NodeKind.ROW) {
                if (!loose.isEmpty()) {
                    parent.children.add(columnGroup(loose, context));
                    loose = new ArrayList<>();
                }
                parent.children.add(columnGroup(child, context));
            } else {
                loose.add(child);
            }
        }
        if (!loose.isEmpty()) {
            parent.children.add(columnGroup(loose, context));
        }
    }

    private Draft columnGroup(ComponentHierarchy row, ConversionContext context) {
        Draft group = new Draft(context.register(row), BeaverNode.Type.COLUMN_GROUP, Map.of());
        reviewStructure(row, context);
        for (ComponentHierarchy child : row.children) {
            if (child.type == NodeKind.COLUMN) {
                group.children.add(column(child, context));
            } else {
                group.children.add(fullWidthColumn(List.of(child), context));
            }
        }
        return group;
    }

    private Draft columnGroup(List<ComponentHierarchy> content, ConversionContext context) {
        Draft group = new Draft(context.emit(), BeaverNode.Type.COLUMN_GROUP, Map.of());
        group.children.add(fullWidthColumn(content, context));
        return group;
    }

    private Draft column(ComponentHierarchy node, ConversionContext context) {
        double size = node.columnSize != null ? round(node.columnSize) : 100.0;
        Settings settings = Settings.create().put("size", size);
        if (!node.synthetic) {
            boxSettings(settings, node.styles, context);
        }
        Draft column = new Draft(context.register(node), BeaverNode.Type.COLUMN, settings.build());
        reviewStructure(node, context);
        addContent(column, node.children, context);
        return column;
    }

    private Draft fullWidthColumn(List<ComponentHierarchy> content, ConversionContext context) {
        Draft column = new Draft(context.emit(), BeaverNode.Type.COLUMN, Settings.create().put("size", 100.0).build());
        addContent(column, content, context);
        return column;
    }

    private void addContent(Draft column, List<ComponentHierarchy> content, ConversionContext context) {
        for (ComponentHierarchy child : content) {
            switch (child.type) {
                case WIDGET -> column.children.add(module(child, context));
                case ROW -> column.children.add(columnGroup(child, context));
                case COLUMN -> {
                    Draft group = new Draft(context.emit(), BeaverNode.Type.COLUMN_GROUP, Map.of());
                    group.children.add(column(child, context));
                    column.children.add(group);
                }
                case SECTION, CONTAINER -> {
                    // nested layouts become column groups folded from the container and its row
                    Draft group = new Draft(context.register(child), BeaverNode.Type.COLUMN_GROUP, Map.of());
                    reviewStructure(child, context);
                    for (ComponentHierarchy grandChild : child.children) {
                        if (grandChild.type == NodeKind.ROW) {
                            context.bind(grandChild, group.id);
                            reviewStructure(grandChild, context);
                            for (ComponentHierarchy col : grandChild.children) {
                                group.children.add(col.type == NodeKind.COLUMN
                                        ? column(col, context)
                                        : fullWidthColumn(List.of(col), context));
                            }
                        } else {
                            group.children.add(fullWidthColumn(List.of(grandChild), context));
                        }
                    }
                    column.children.add(group);
                }
            }
        }
    }

    private Draft module(ComponentHierarchy node, ConversionContext context) {
        WidgetMapping mapping = plan(node, context);
        Settings settings = Settings.create().put("type", mapping.name).putAll(mapping.settings);
        if (!mapping.htmlFallback) {
            settings.put("id", node.props.elementId);
            settings.put("class", node.props.className);
            boxSettings(settings, node.styles, context);
            if (context.options.includeResponsive) {
                responsive(settings, node);
            }
        }
        return new Draft(context.register(node), BeaverNode.Type.MODULE, settings.build());
    }

    @Override
    protected WidgetMapping htmlWidget(String html, ComponentHierarchy node) {
        return WidgetMapping.fallback("html", Settings.create().put("html", html).build());
    }

    @Override
    protected WidgetMapping mapWidget(ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        return switch (node.componentType) {
            case HEADING -> WidgetMapping.of("heading", Settings.create()
                    .put("heading", text(node))
                    .put("tag", "h" + headingLevel(node))
                    .put("color", styles.color())
                    .put("color_preset", context.colorSlot(styles.color()))
                    .put("typography", typography(styles))
                    .put("alignment", styles.textAlign() != null ? styles.textAlign() : "left")
                    .build());
            case TEXT, PARAGRAPH, LINK, BLOCKQUOTE -> WidgetMapping.of("rich-text", Settings.create()
                    .put("text", node.componentType == ComponentType.LINK
                            ? originalHtml(node) : innerHtml(node))
                    .put("color", styles.color())
                    .put("color_preset", context.colorSlot(styles.color()))
                    .put("typography", typography(styles))
                    .build());
            case IMAGE -> WidgetMapping.of("photo", Settings.create()
                    .put("photo_source", "url")
                    .put("photo_url", node.props.src)
                    .put("alt", node.props.alt)
                    .put("link_type", node.props.href != null ? "url" : "none")
                    .put("link_url", node.props.href)
                    .put("align", "center")
                    .build());
            case BUTTON, SUBMIT_BUTTON -> WidgetMapping.of("button", Settings.create()
                    .put("text", text(node))
                    .put("link", node.props.href != null ? node.props.href : "#")
                    .put("link_target", node.props.target != null ? node.props.target : "_self")
                    .put("bg_color", styles.backgroundColor())
                    .put("bg_color_preset", context.colorSlot(styles.backgroundColor()))
                    .put("text_color", styles.color())
                    .put("style", "flat")
                    .put("width", "auto")
                    .put("align", styles.textAlign() != null ? styles.textAlign() : "left")
                    .build());
            case VIDEO -> {
                String url = node.props.src != null ? node.props.src : node.props.href;
                boolean embed = url != null && !url.matches("(?i).*\\.(mp4|webm|ogg)(\\?.*)?$");
                yield WidgetMapping.of("video", Settings.create()
                        .put("video_type", embed ? "embed" : "media_library")
                        .put("embed_code", embed ? "<iframe src=\"" + url + "\" allowfullscreen></iframe>" : null)
                        .put("video_url", embed ? null : url)
                        .put("poster_src", node.props.poster)
                        .build());
            }
            case ICON -> WidgetMapping.of("icon", Settings.create()
                    .put("icon", node.props.className != null ? node.props.className : "fas fa-star")
                    .put("color", styles.color())
                    .put("size", pixels(styles.fontSize()))
                    .put("link", node.props.href)
                    .build());
            case DIVIDER -> WidgetMapping.of("separator", Settings.create()
                    .put("color", styles.border != null ? styles.border.color : null)
                    .put("height", styles.border != null ? pixels(styles.border.width) : null)
                    .put("style", styles.border != null ? styles.border.style : "solid")
                    .put("width", 100)
                    .build());
            case SPACER -> WidgetMapping.of("spacer", Settings.create()
                    .put("size", pixels(styles.height()) != null ? pixels(styles.height()) : 50.0)
                    .build());
            case GALLERY -> WidgetMapping.of("gallery", Settings.create()
                    .put("photos", node.props.mediaUrls)
                    .put("layout", "grid")
                    .put("show_captions", "hover")
                    .build());
            case CAROUSEL, SLIDER -> WidgetMapping.of("slideshow", Settings.create()
                    .put("photos", node.props.mediaUrls)
                    .put("transition", "fade")
                    .put("auto_play", true)
                    .put("show_arrows", true)
                    .build());
            case ACCORDION, TABS -> {
                List<Map<String, Object>> items = new ArrayList<>();
                for (String item : node.props.items) {
                    items.add(Settings.create().put("label", item).put("content", item).build());
                }
                yield WidgetMapping.of(node.componentType == ComponentType.TABS
                        ? "tabs" : "accordion", Settings.create().put("items", items).build());
            }
            case FORM -> WidgetMapping.of("contact-form", Settings.create()
                    .put("name_toggle", "show")
                    .put("email_toggle", "show")
                    .put("message_toggle", "show")
                    .put("btn_text", "Send")
                    .build());
            case GOOGLE_MAPS -> WidgetMapping.of("map", Settings.create()
                    .put("address", node.props.src)
                    .put("height", pixels(styles.height()) != null ? pixels(styles.height()) : 400.0)
                    .build());
            case CTA -> WidgetMapping.of("callout", Settings.create()
                    .put("heading", node.props.items.isEmpty() ? "" : node.props.items.get(0))
                    .put("text", text(node))
                    .put("cta_type", node.props.href != null ? "button" : "none")
                    .put("btn_link", node.props.href)
                    .build());
            case TESTIMONIAL -> WidgetMapping.of("testimonials", Settings.create()
                    .put("testimonials", List.of(Map.of("testimonial", text(node))))
                    .put("layout", "wide")
                    .build());
            case PRICING_TABLE -> WidgetMapping.of("pricing-table", Settings.create()
                    .put("pricing_columns", List.of(Settings.create()
                            .put("title", node.props.items.isEmpty() ? text(node) : node.props.items.get(0))
                            .put("features", node.props.items)
                            .build()))
                    .build());
            case COUNTDOWN -> WidgetMapping.of("countdown", Settings.create()
                    .put("date", node.props.dataAttributes.get("data-date"))
                    .build());
            case LIST -> WidgetMapping.of("list", Settings.create()
                    .put("list_type", Boolean.TRUE.equals(node.props.ordered) ? "ol" : "ul")
                    .put("list_items", node.props.items)
                    .build());
            case MENU -> WidgetMapping.of("menu", Settings.create()
                    .put("menu_layout", "horizontal")
                    .put("items", node.props.items)
                    .build());
            case SEARCH_BAR -> WidgetMapping.of("search", Settings.create()
                    .put("placeholder", node.props.placeholder)
                    .build());
            case SOCIAL_SHARE -> WidgetMapping.of("social-buttons", Settings.create()
                    .put("show_facebook", "1")
                    .put("show_twitter", "1")
                    .build());
            case ICON_BOX, FEATURE_BOX -> WidgetMapping.of("info-box", Settings.create()
                    .put("title", node.props.items.isEmpty() ? "" : node.props.items.get(0))
                    .put("text", text(node))
                    .build());
            case CARD, MODAL, INPUT, TEXTAREA, SELECT, CHECKBOX, RADIO, FILE_UPLOAD, PROGRESS_BAR, BREADCRUMBS,
                 PAGINATION, TABLE, CODE_BLOCK, TEAM_MEMBER, BLOG_CARD, PRODUCT_CARD, SOCIAL_FEED,
                 CONTAINER, SECTION, COLUMN, ROW, GRID, HERO, SIDEBAR, HEADER, FOOTER, UNKNOWN ->
                    WidgetMapping.unmapped("rich-text", Settings.create().put("text", originalHtml(node)).build());
        };
    }

    private Map<String, Object> rowSettings(ComponentHierarchy node, ConversionContext context) {
        Settings settings = Settings.create().put("width", "fixed");
        if (!node.synthetic) {
            boxSettings(settings, node.styles, context);
            String image = backgroundUrl(node.styles.backgroundImage());
            if (image != null) {
                settings.put("bg_type", "photo").put("bg_image_src", image);
            } else if (node.styles.backgroundColor() != null) {
                settings.put("bg_type", "color");
            }
        }
        return settings.build();
    }

    private static void boxSettings(Settings settings, ExtractedStyles styles, ConversionContext context) {
        settings.put("bg_color", styles.backgroundColor());
        settings.put("bg_color_preset", context.colorSlot(styles.backgroundColor()));
        spacing(settings, "padding", styles.padding);
        spacing(settings, "margin", styles.margin);
        if (context.options.includeAnimations && styles.has("animationName")) {
            settings.put("animation", "fade-in");
        }
    }

    private static void spacing(Settings settings, String prefix, BoxSpacing box) {
        if (box == null) {
            return;
        }
        settings.put(prefix + "_top", pixels(box.top));
        settings.put(prefix + "_right", pixels(box.right));
        settings.put(prefix + "_bottom", pixels(box.bottom));
        settings.put(prefix + "_left", pixels(box.left));
        settings.put(prefix + "_unit", "px");
    }

    private static void responsive(Settings settings, ComponentHierarchy node) {
        ExtractedStyles tablet = tabletStyles(node);
        ExtractedStyles mobile = mobileStyles(node);
        if (tablet != null) {
            settings.put("font_size_medium", pixels(tablet.fontSize()));
            spacing(settings, "padding_medium", tablet.padding);
        }
        if (mobile != null) {
            settings.put("font_size_responsive", pixels(mobile.fontSize()));
            spacing(settings, "padding_responsive", mobile.padding);
        }
    }

    private static Map<String, Object> typography(ExtractedStyles styles) {
        return Settings.create()
                .put("font_family", TypographyUsage.normalizeFontFamily(styles.fontFamily()))
                .put("font_weight", styles.fontWeight())
                .put("font_size", sizeUnit(pixels(styles.fontSize()), "px"))
                .put("line_height", styles.lineHeight())
                .put("letter_spacing", sizeUnit(pixels(styles.letterSpacing()), "px"))
                .put("text_transform", styles.textTransform())
                .build();
    }

    private static Map<String, Object> colorScheme(ConversionContext context) {
        if (context.designTokens == null || context.designTokens.colors == null) {
            return Map.of();
        }
        ColorPalette palette = context.designTokens.colors;
        return Settings.create()
                .put("primary", palette.primary)
                .put("secondary", palette.secondary)
                .put("accent", palette.accent)
                .put("text", palette.text)
                .put("background", palette.background)
                .build();
    }

    private static Map<String, Object> typography(ConversionContext context) {
        if (context.typography == null) {
            return Map.of();
        }
        GlobalTypographySettings global = context.typography.globalSettings;
        return Settings.create()
                .put("body_font_family", global.baseFontFamily)
                .put("body_font_size", global.baseFontSize)
                .put("body_line_height", global.baseLineHeight)
                .put("heading_font_family", global.headingFontFamily)
                .put("heading_font_weight", String.valueOf(global.headingFontWeight))
                .build();
    }
}
