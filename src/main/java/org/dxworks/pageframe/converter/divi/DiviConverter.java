package org.dxworks.pageframe.converter.divi;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

public class DiviConverter extends AbstractConverter {

    /**
     * Column fractions the builder offers, with their width in percent.
     */
    enum ColumnType {
        FULL("4_4", 100.0),
        FOUR_FIFTHS("4_5", 80.0),
        THREE_QUARTERS("3_4", 75.0),
        TWO_THIRDS("2_3", 200.0 / 3),
        THREE_FIFTHS("3_5", 60.0),
        HALF("1_2", 50.0),
        TWO_FIFTHS("2_5", 40.0),
        THIRD("1_3", 100.0 / 3),
        QUARTER("1_4", 25.0),
        FIFTH("1_5", 20.0),
        SIXTH("1_6", 100.0 / 6);

        final String id;
        final double percent;

        ColumnType(String id, double percent) {
            this.id = id;
            this.percent = percent;
        }

        static ColumnType nearest(double percent) {
            ColumnType best = FULL;
            for (ColumnType type : values()) {
                if (Math.abs(type.percent - percent) < Math.abs(best.percent - percent)) {
                    best = type;
                }
            }
            return best;
        }
    }

    @Override
    public PageBuilder builder() {
        return PageBuilder.DIVI;
    }

    @Override
    protected IdGenerator newIdGenerator() {
        return IdGenerator.prefixed("divi");
    }

    @Override
    protected Object export(List<ComponentHierarchy> roots, ConversionContext context) {
        List<DiviElement> sections = new ArrayList<>();
        for (ComponentHierarchy root : roots) {
            sections.add(section(root, context));
        }
        return new DiviExport(sections, ShortcodeWriter.write(sections), globalColors(context));
    }

    private DiviElement section(ComponentHierarchy node, ConversionContext context) {
        if (node.type != NodeKind.SECTION && node.type != NodeKind.CONTAINER) {
            context.emit();
            return new DiviElement("et_pb_section", Map.of("fb_built", "1"),
                    List.of(fullWidthRow("et_pb_row", "et_pb_column", List.of(node), context)), null);
        }
        context.register(node);
        reviewStructure(node, context);

        Settings attrs = Settings.create().put("fb_built", "1").put("_builder_version", "4.16");
        if (!node.synthetic) {
            designAttrs(attrs, node.styles);
            attrs.put("module_id", node.props.elementId);
            attrs.put("module_class", node.props.className);
        }
        return new DiviElement("et_pb_section", attrs.build(), rows(node, "et_pb_row", "et_pb_column", context), null);
    }

    private List<DiviElement> rows(ComponentHierarchy node, String rowType, String columnType,
                                   ConversionContext context) {
        List<DiviElement> rows = new ArrayList<>();
        List<ComponentHierarchy> loose = new ArrayList<>();
        for (ComponentHierarchy child : node.children) {
            if (child.type == NodeKind.ROW) {
                if (!loose.isEmpty()) {
                    rows.add(fullWidthRow(rowType, columnType, loose, context));
                    loose = new ArrayList<>();
                }
                rows.add(row(child, rowType, columnType, context));
            } else {
                loose.add(child);
            }
        }
        if (!loose.isEmpty()) {
            rows.add(fullWidthRow(rowType, columnType, loose, context));
        }
        return rows;
    }

    private DiviElement row(ComponentHierarchy row, String rowType, String columnType, ConversionContext context) {
        context.register(row);
        reviewStructure(row, context);

        List<DiviElement> columns = new ArrayList<>();
        StringJoiner structure = new StringJoiner(",");
        for (ComponentHierarchy child : row.children) {
            double size = child.type == NodeKind.COLUMN && child.columnSize != null ? child.columnSize : 100.0;
            String type = ColumnType.nearest(size).id;
            structure.add(type);
            if (child.type == NodeKind.COLUMN) {
                columns.add(column(child, columnType, type, context));
            } else {
                context.emit();
                columns.add(new DiviElement(columnType, Map.of("type", type), modules(List.of(child), context), null));
            }
        }
        Map<String, Object> attrs = Settings.create()
                .put("column_structure", structure.toString())
                .put("_builder_version", "4.16")
                .build();
        return new DiviElement(rowType, attrs, columns, null);
    }

    private DiviElement fullWidthRow(String rowType, String columnType, List<ComponentHierarchy> content,
                                     ConversionContext context) {
        context.emit();
        context.emit();
        DiviElement column = new DiviElement(columnType, Map.of("type", ColumnType.FULL.id),
                modules(content, context), null);
        return new DiviElement(rowType, Map.of("column_structure", ColumnType.FULL.id), List.of(column), null);
    }

    private DiviElement column(ComponentHierarchy node, String columnType, String type, ConversionContext context) {
        context.register(node);
        reviewStructure(node, context);
        Settings attrs = Settings.create().put("type", type);
        if (!node.synthetic) {
            designAttrs(attrs, node.styles);
        }
        return new DiviElement(columnType, attrs.build(), modules(node.children, context), null);
    }

    /**
     * Column content. Nested layouts become inner rows.
     */
    private List<DiviElement> modules(List<ComponentHierarchy> content, ConversionContext context) {
        List<DiviElement> modules = new ArrayList<>();
        for (ComponentHierarchy child : content) {
            switch (child.type) {
                case WIDGET -> modules.add(module(child, context));
                case ROW -> modules.add(row(child, "et_pb_row_inner", "et_pb_column_inner", context));
                case COLUMN -> {
                    context.emit();
                    modules.add(new DiviElement("et_pb_row_inner", Map.of("column_structure", ColumnType.FULL.id),
                            List.of(column(child, "et_pb_column_inner", ColumnType.FULL.id, context)), null));
                }
                case SECTION, CONTAINER -> {
                    context.register(child);
                    reviewStructure(child, context);
                    modules.addAll(rows(child, "et_pb_row_inner", "et_pb_column_inner", context));
                }
            }
        }
        return modules;
    }

    private DiviElement module(ComponentHierarchy node, ConversionContext context) {
        WidgetMapping mapping = plan(node, context);
        context.register(node);
        Settings attrs = Settings.create().put("_builder_version", "4.16").putAll(mapping.settings);
        if (!mapping.htmlFallback) {
            attrs.put("module_id", node.props.elementId);
            attrs.put("module_class", node.props.className);
            if (context.options.includeResponsive) {
                responsive(attrs, node);
            }
            if (context.options.includeAnimations && node.styles.has("animationName")) {
                attrs.put("animation_style", "fade");
            }
        }
        return new DiviElement(mapping.name, attrs.build(), childModules(mapping.name, node),
                moduleContent(mapping, node));
    }

    @Override
    protected WidgetMapping htmlWidget(String html, ComponentHierarchy node) {
        return WidgetMapping.fallback("et_pb_code", Map.of());
    }

    @Override
    protected WidgetMapping mapWidget(ComponentHierarchy node, ConversionContext context) {
        ExtractedStyles styles = node.styles;
        return switch (node.componentType) {
            case HEADING, TEXT, PARAGRAPH, LINK, LIST, BLOCKQUOTE -> {
                Settings attrs = Settings.create()
                        .put("text_text_color", styles.color())
                        .put("text_font_size", styles.fontSize())
                        .put("text_orientation", styles.textAlign())
                        .put("text_font", font(styles))
                        .put("background_layout", "light");
                if (node.componentType == ComponentType.HEADING) {
                    attrs.put("header_font_size", styles.fontSize());
                }
                yield WidgetMapping.of("et_pb_text", attrs.build());
            }
            case IMAGE -> WidgetMapping.of("et_pb_image", Settings.create()
                    .put("src", node.props.src)
                    .put("alt", node.props.alt)
                    .put("url", node.props.href)
                    .put("url_new_window", isExternal(node) ? "on" : "off")
                    .put("show_in_lightbox", "off")
                    .put("align", "center")
                    .build());
            case VIDEO -> WidgetMapping.of("et_pb_video", Settings.create()
                    .put("src", node.props.src != null ? node.props.src : node.props.href)
                    .put("image_src", node.props.poster)
                    .build());
            case GALLERY -> WidgetMapping.of("et_pb_gallery", Settings.create()
                    .put("gallery_ids", "")
                    .put("show_title_and_caption", "on")
                    .put("show_pagination", "on")
                    .put("fullwidth", "off")
                    .build());
            case CAROUSEL, SLIDER -> WidgetMapping.of("et_pb_slider", Settings.create()
                    .put("show_arrows", "on")
                    .put("show_pagination", "on")
                    .put("auto", "off")
                    .build());
            case BUTTON, SUBMIT_BUTTON -> WidgetMapping.of("et_pb_button", Settings.create()
                    .put("button_text", text(node).isEmpty() ? "Click Here" : text(node))
                    .put("button_url", node.props.href != null ? node.props.href : "#")
                    .put("url_new_window", isExternal(node) ? "on" : "off")
                    .put("button_alignment", styles.textAlign())
                    .put("custom_button", styles.backgroundColor() != null || styles.color() != null ? "on" : "off")
                    .put("button_bg_color", styles.backgroundColor())
                    .put("button_text_color", styles.color())
                    .build());
            case FORM -> WidgetMapping.of("et_pb_contact_form", Settings.create()
                    .put("title", node.props.name)
                    .put("submit_button_text", "Submit")
                    .build());
            case SEARCH_BAR -> WidgetMapping.of("et_pb_search", Settings.create()
                    .put("placeholder", node.props.placeholder)
                    .build());
            case ACCORDION -> WidgetMapping.of("et_pb_accordion", Map.of());
            case TABS -> WidgetMapping.of("et_pb_tabs", Map.of());
            case DIVIDER -> WidgetMapping.of("et_pb_divider", Settings.create()
                    .put("show_divider", "on")
                    .put("color", styles.border != null ? styles.border.color : null)
                    .put("divider_weight", styles.border != null ? styles.border.width : null)
                    .build());
            case SPACER -> WidgetMapping.of("et_pb_divider", Settings.create()
                    .put("show_divider", "off")
                    .put("height", styles.height())
                    .build());
            case CODE_BLOCK -> WidgetMapping.of("et_pb_code", Map.of());
            case PRICING_TABLE -> WidgetMapping.of("et_pb_pricing_tables", Map.of());
            case TESTIMONIAL -> WidgetMapping.of("et_pb_testimonial", Settings.create()
                    .put("author", node.props.items.isEmpty() ? null : node.props.items.get(0))
                    .put("portrait_url", node.props.src)
                    .put("quote_icon", "on")
                    .build());
            case COUNTDOWN -> WidgetMapping.of("et_pb_countdown_timer", Settings.create()
                    .put("date_time", node.props.dataAttributes.get("data-date"))
                    .build());
            case GOOGLE_MAPS -> WidgetMapping.of("et_pb_map", Settings.create()
                    .put("address", node.props.src)
                    .put("zoom_level", "14")
                    .build());
            case ICON_BOX, FEATURE_BOX -> WidgetMapping.of("et_pb_blurb", Settings.create()
                    .put("title", node.props.items.isEmpty() ? null : node.props.items.get(0))
                    .put("use_icon", "on")
                    .put("icon_placement", "top")
                    .build());
            case CTA -> WidgetMapping.of("et_pb_cta", Settings.create()
                    .put("title", node.props.items.isEmpty() ? null : node.props.items.get(0))
                    .put("button_text", "Click Here")
                    .put("button_url", node.props.href != null ? node.props.href : "#")
                    .build());
            case PROGRESS_BAR -> WidgetMapping.of("et_pb_counters", Map.of());
            case SOCIAL_SHARE -> WidgetMapping.of("et_pb_social_media_follow", Map.of());
            case MENU -> WidgetMapping.of("et_pb_menu", Settings.create()
                    .put("menu_style", "left_aligned")
                    .build());
            case TEAM_MEMBER -> WidgetMapping.of("et_pb_team_member", Settings.create()
                    .put("name", node.props.items.isEmpty() ? text(node) : node.props.items.get(0))
                    .put("image_url", node.props.src)
                    .build());
            case ICON -> WidgetMapping.of("et_pb_icon", Settings.create()
                    .put("font_icon", node.props.className)
                    .put("icon_color", styles.color())
                    .build());
            case CARD, MODAL, INPUT, TEXTAREA, SELECT, CHECKBOX, RADIO, FILE_UPLOAD, BREADCRUMBS, PAGINATION,
                 TABLE, BLOG_CARD, PRODUCT_CARD, SOCIAL_FEED,
                 CONTAINER, SECTION, COLUMN, ROW, GRID, HERO, SIDEBAR, HEADER, FOOTER, UNKNOWN ->
                    WidgetMapping.unmapped("et_pb_text", Map.of());
        };
    }

    private String moduleContent(WidgetMapping mapping, ComponentHierarchy node) {
        if (mapping.htmlFallback || !mapping.explicit) {
            return originalHtml(node);
        }
        return switch (mapping.name) {
            case "et_pb_text" -> switch (node.componentType) {
                case HEADING -> {
                    int level = headingLevel(node);
                    yield "<h" + level + ">" + innerHtml(node) + "</h" + level + ">";
                }
                case LINK, LIST, BLOCKQUOTE -> originalHtml(node);
                default -> "<p>" + innerHtml(node) + "</p>";
            };
            case "et_pb_code" -> originalHtml(node);
            case "et_pb_testimonial", "et_pb_blurb", "et_pb_cta", "et_pb_team_member" -> "<p>" + text(node) + "</p>";
            default -> null;
        };
    }

    private static List<DiviElement> childModules(String module, ComponentHierarchy node) {
        List<DiviElement> children = new ArrayList<>();
        switch (module) {
            case "et_pb_slider" -> node.props.mediaUrls.forEach(url -> children.add(
                    DiviElement.module("et_pb_slide", Settings.create().put("image", url).build(), null)));
            case "et_pb_accordion" -> node.props.items.forEach(item -> children.add(
                    DiviElement.module("et_pb_accordion_item", Settings.create().put("title", item).build(), item)));
            case "et_pb_tabs" -> node.props.items.forEach(item -> children.add(
                    DiviElement.module("et_pb_tab", Settings.create().put("title", item).build(), item)));
            case "et_pb_pricing_tables" -> children.add(DiviElement.module("et_pb_pricing_table",
                    Settings.create().put("title", node.props.items.isEmpty() ? text(node) : node.props.items.get(0))
                            .build(),
                    String.join("\n", node.props.items)));
            case "et_pb_counters" -> children.add(DiviElement.module("et_pb_counter",
                    Settings.create().put("percent", node.props.ariaAttributes.get("aria-valuenow")).build(),
                    text(node)));
            case "et_pb_social_media_follow" -> node.props.items.forEach(item -> children.add(
                    DiviElement.module("et_pb_social_media_follow_network",
                            Settings.create().put("social_network", item.toLowerCase()).put("url", "#").build(), item)));
            default -> {
            }
        }
        return children;
    }

    private static void designAttrs(Settings attrs, ExtractedStyles styles) {
        attrs.put("background_color", styles.backgroundColor());
        attrs.put("background_image", backgroundUrl(styles.backgroundImage()));
        attrs.put("custom_padding", spacing(styles.padding));
        attrs.put("custom_margin", spacing(styles.margin));
    }

    private static void responsive(Settings attrs, ComponentHierarchy node) {
        ExtractedStyles tablet = tabletStyles(node);
        ExtractedStyles mobile = mobileStyles(node);
        if (tablet != null && tablet.fontSize() != null) {
            attrs.put("text_font_size_tablet", tablet.fontSize());
        }
        if (mobile != null && mobile.fontSize() != null) {
            attrs.put("text_font_size_phone", mobile.fontSize());
        }
        if (tablet != null || mobile != null) {
            attrs.put("text_font_size_last_edited", "on|desktop");
        }
    }

    /**
     * Divi's {@code top|right|bottom|left} spacing value.
     */
    static String spacing(BoxSpacing box) {
        if (box == null) {
            return null;
        }
        return box.top + "|" + box.right + "|" + box.bottom + "|" + box.left;
    }

    /**
     * Divi's pipe-separated font value: family, weight, then style flags.
     */
    private static String font(ExtractedStyles styles) {
        String family = TypographyUsage.normalizeFontFamily(styles.fontFamily());
        if (family == null && styles.fontWeight() == null) {
            return null;
        }
        return (family != null ? family : "") + "|" + (styles.fontWeight() != null ? styles.fontWeight() : "")
                + "|||||||";
    }

    private static List<Map<String, Object>> globalColors(ConversionContext context) {
        List<Map<String, Object>> colors = new ArrayList<>();
        if (context.designTokens == null || context.designTokens.colors == null) {
            return colors;
        }
        ColorPalette palette = context.designTokens.colors;
        addColor(colors, "primary", palette.primary);
        addColor(colors, "secondary", palette.secondary);
        addColor(colors, "accent", palette.accent);
        addColor(colors, "text", palette.text);
        return colors;
    }

    private static void addColor(List<Map<String, Object>> colors, String slot, String color) {
        if (color != null) {
            colors.add(Settings.create().put("id", "gcid-" + slot).put("color", color).put("active", "yes").build());
        }
    }
}
