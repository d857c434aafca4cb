package org.dxworks.pageframe.converter.oxygen;

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

public class OxygenConverter extends AbstractConverter {

    /**
     * Fixed global color ids, so a palette slot always resolves to the same
     * {@code color(N)} reference.
     */
    static final List<String> COLOR_SLOTS = List.of("primary", "secondary", "accent", "text", "background");

    @Override
    public PageBuilder builder() {
        return PageBuilder.OXYGEN;
    }

    @Override
    protected IdGenerator newIdGenerator() {
        return IdGenerator.sequential();
    }

    @Override
    protected Object export(List<ComponentHierarchy> roots, ConversionContext context) {
        OxygenComponent root = OxygenComponent.root();
        for (ComponentHierarchy node : roots) {
            root.children.add(component(node, root, context));
        }
        return new OxygenExport(root, globalColors(context), typography(context));
    }

    private OxygenComponent component(ComponentHierarchy node, OxygenComponent parent, ConversionContext context) {
        if (node.type == NodeKind.WIDGET) {
            return widget(node, parent, context);
        }
        int id = Integer.parseInt(context.register(node));
        reviewStructure(node, context);

        String name = switch (node.type) {
            case SECTION -> parent.depth == 0 ? "ct_section" : "ct_div_block";
            case CONTAINER -> "ct_div_block";
            case ROW -> "ct_columns";
            case COLUMN -> "ct_column";
            case WIDGET -> throw new IllegalArgumentException("Widgets are not layout components");
        };
        Settings options = base(id, name, parent);
        Settings original = Settings.create();
        switch (node.type) {
            case SECTION, CONTAINER -> {
                if (!node.synthetic) {
                    options.put("tag", tagOf(node));
                }
            }
            case ROW -> original.put("flex-direction", "row");
            case COLUMN -> {
                if (node.columnSize != null) {
                    original.put("width", round(node.columnSize)).put("width-unit", "%");
                }
            }
            case WIDGET -> {
            }
        }
        if (!node.synthetic) {
            decorate(options, original, node, context);
        }
        options.put("original", original.build());

        OxygenComponent component = new OxygenComponent(id, name, parent.depth + 1, options.build());
        for (ComponentHierarchy child : node.children) {
            component.children.add(component(child, component, context));
        }
        return component;
    }

    private OxygenComponent widget(ComponentHierarchy node, OxygenComponent parent, ConversionContext context) {
        WidgetMapping mapping = plan(node, context);
        int id = Integer.parseInt(context.register(node));
        Settings options = base(id, mapping.name, parent).putAll(mapping.settings);
        Settings original = Settings.create();
        if (!mapping.htmlFallback) {
            decorate(options, original, node, context);
        }
        options.put("original", original.build());

        OxygenComponent component = new OxygenComponent(id, mapping.name, parent.depth + 1, options.build());
        if (!mapping.htmlFallback && "ct_slider".equals(mapping.name)) {
            for (String url : node.props.mediaUrls) {
                component.children.add(slide(url, component, context));
            }
        }
        return component;
    }

    private static OxygenComponent slide(String url, OxygenComponent slider, ConversionContext context) {
        int slideId = Integer.parseInt(context.emit());
        OxygenComponent slide = new OxygenComponent(slideId, "ct_slide", slider.depth + 1,
                base(slideId, "ct_slide", slider).build());
        int imageId = Integer.parseInt(context.emit());
        slide.children.add(new OxygenComponent(imageId, "ct_image", slide.depth + 1,
                base(imageId, "ct_image", slide).put("src", url).build()));
        return slide;
    }

    private static Settings base(int id, String name, OxygenComponent parent) {
        return Settings.create()
                .put("ct_id", id)
                .put("ct_parent", parent.id)
                .put("selector", selector(name, id))
                .put("nicename", nicename(name) + " (#" + id + ")");
    }

    static String selector(String name, int id) {
        return name.replaceFirst("^(ct|oxy)_", "").replace('_', '-') + "-" + id;
    }

    private static String nicename(String name) {
        String bare = name.replaceFirst("^(ct|oxy)_", "").replace('_', ' ');
        return bare.isEmpty() ? name : Character.toUpperCase(bare.charAt(0)) + bare.substring(1);
    }

    /**
     * Copies element identity and styles into the component's options and
     * its {@code original} (desktop) style state.
     */
    private void decorate(Settings options, Settings original, ComponentHierarchy node, ConversionContext context) {
        options.put("ct_css_id", node.props.elementId);
        if (node.props.className != null && !node.props.className.isBlank()) {
            options.put("classes", List.of(node.props.className.trim().split("\\s+")));
        }
        styles(original, node.styles, context);
        if (context.options.includeResponsive) {
            Settings media = Settings.create()
                    .put("tablet", breakpoint(tabletStyles(node), context))
                    .put("phone-portrait", breakpoint(mobileStyles(node), context));
            options.put("media", media.build());
        }
        if (context.options.includeAnimations) {
            String animation = animation(node.styles);
            if (animation != null) {
                options.put("aos-enable", "true").put("aos-type", animation);
            }
        }
    }

    private static Map<String, Object> breakpoint(ExtractedStyles styles, ConversionContext context) {
        if (styles == null) {
            return null;
        }
        Settings original = Settings.create();
        styles(original, styles, context);
        if (styles.is("display", "none")) {
            original.put("display", "none");
        }
        return original.isEmpty() ? null : Map.of("original", original.build());
    }

    private static void styles(Settings original, ExtractedStyles styles, ConversionContext context) {
        original.put("color", color(styles.color(), context));
        original.put("background-color", color(styles.backgroundColor(), context));
        String image = backgroundUrl(styles.backgroundImage());
        if (image != null) {
            original.put("background-image", image).put("background-size", "cover");
        }
        original.put("font-family", styles.fontFamily());
        original.put("font-size", styles.fontSize());
        original.put("font-weight", styles.fontWeight());
        original.put("line-height", styles.lineHeight());
        original.put("letter-spacing", styles.letterSpacing());
        original.put("text-transform", styles.textTransform());
        original.put("text-align", styles.textAlign());
        original.put("width", styles.width());
        original.put("height", styles.height());
        box(original, "padding", styles.padding);
        box(original, "margin", styles.margin);
        if (styles.border != null) {
            original.put("border-all-width", styles.border.width)
                    .put("border-all-style", styles.border.style)
                    .put("border-all-color", color(styles.border.color, context));
        }
        if (styles.borderRadius != null) {
            original.put("border-radius", styles.borderRadius.topLeft);
        }
    }

    private static void box(Settings original, String property, BoxSpacing box) {
        if (box == null) {
            return;
        }
        original.put(property + "-top", box.top)
                .put(property + "-right", box.right)
                .put(property + "-bottom", box.bottom)
                .put(property + "-left", box.left);
    }

    /**
     * Palette colors are written as Oxygen global color references.
     */
    private static String color(String color, ConversionContext context) {
        if (color == null) {
            return null;
        }
        String slot = context.colorSlot(color);
        return slot != null ? "color(" + (COLOR_SLOTS.indexOf(slot) + 1) + ")" : color;
    }

    @Override
    protected WidgetMapping htmlWidget(String html, ComponentHierarchy node) {
        return WidgetMapping.fallback("ct_code_block", Settings.create()
                .put("code-php", html)
                .build());
    }

    @Override
    protected WidgetMapping mapWidget(ComponentHierarchy node, ConversionContext context) {
        return switch (node.componentType) {
            case HEADING -> WidgetMapping.of("ct_headline", Settings.create()
                    .put("ct_content", text(node))
                    .put("tag", "h" + headingLevel(node))
                    .build());
            case TEXT, PARAGRAPH -> WidgetMapping.of("ct_text_block", Settings.create()
                    .put("ct_content", innerHtml(node))
                    .build());
            case LIST, BLOCKQUOTE, CODE_BLOCK, TABLE -> WidgetMapping.of("oxy_rich_text", Settings.create()
                    .put("ct_content", originalHtml(node))
                    .build());
            case LINK -> WidgetMapping.of("ct_link_text", Settings.create()
                    .put("ct_content", text(node))
                    .put("url", node.props.href != null ? node.props.href : "#")
                    .put("target", isExternal(node) ? "_blank" : "_self")
                    .build());
            case BUTTON, SUBMIT_BUTTON -> WidgetMapping.of("ct_link_button", Settings.create()
                    .put("ct_content", text(node).isEmpty() ? node.props.value : text(node))
                    .put("url", node.props.href != null ? node.props.href : "#")
                    .put("target", isExternal(node) ? "_blank" : "_self")
                    .build());
            case IMAGE -> WidgetMapping.of("ct_image", Settings.create()
                    .put("src", node.props.src)
                    .put("alt", node.props.alt)
                    .put("image_type", "1")
                    .build());
            case VIDEO -> WidgetMapping.of("ct_video", Settings.create()
                    .put("src", node.props.src != null ? node.props.src : node.props.href)
                    .put("embed_src", embedUrl(node.props.src != null ? node.props.src : node.props.href))
                    .put("use-custom", "0")
                    .build());
            case ICON -> WidgetMapping.of("ct_fancy_icon", Settings.create()
                    .put("icon-id", iconId(node))
                    .build());
            case DIVIDER, SPACER -> WidgetMapping.of("ct_div_block", Map.of());
            case CAROUSEL, SLIDER -> WidgetMapping.of("ct_slider", Settings.create()
                    .put("slider-autoplay", "yes")
                    .put("slider-show-arrows", "yes")
                    .put("slider-show-dots", "yes")
                    .build());
            case GALLERY -> WidgetMapping.of("oxy_gallery", Settings.create()
                    .put("gallery_source", "urls")
                    .put("image_urls", String.join(",", node.props.mediaUrls))
                    .put("layout", "grid")
                    .put("columns", String.valueOf(Math.max(1, Math.min(4, node.props.mediaUrls.size()))))
                    .build());
            case TABS -> WidgetMapping.of("oxy_tabs", Settings.create()
                    .put("tabs", node.props.items)
                    .put("active_tab", 1)
                    .build());
            case ACCORDION -> WidgetMapping.of("oxy_toggle", Settings.create()
                    .put("toggles", node.props.items)
                    .put("initial_state", "closed")
                    .build());
            case MENU -> WidgetMapping.of("oxy_nav_menu", Settings.create()
                    .put("menu_id", "")
                    .put("dropdowns", "on")
                    .put("responsive", "tablet")
                    .build());
            case SEARCH_BAR -> WidgetMapping.of("oxy_search_form", Settings.create()
                    .put("placeholder", node.props.placeholder)
                    .build());
            case GOOGLE_MAPS -> WidgetMapping.of("oxy_map", Settings.create()
                    .put("map_address", node.props.src != null ? node.props.src : text(node))
                    .put("map_zoom", "14")
                    .build());
            case PROGRESS_BAR -> WidgetMapping.of("oxy_progress_bar", Settings.create()
                    .put("progress_bar_left_text", text(node))
                    .put("progress_bar_progress", node.props.ariaAttributes.get("aria-valuenow"))
                    .build());
            case PRICING_TABLE -> WidgetMapping.of("oxy_pricing_box", Settings.create()
                    .put("pricing_box_package_title", firstItemOrText(node))
                    .put("pricing_box_content", String.join("<br>", node.props.items))
                    .build());
            case TESTIMONIAL -> WidgetMapping.of("oxy_testimonial", Settings.create()
                    .put("testimonial_text", text(node))
                    .put("testimonial_photo", node.props.src)
                    .build());
            case ICON_BOX, FEATURE_BOX -> WidgetMapping.of("oxy_icon_box", Settings.create()
                    .put("icon_box_heading", firstItemOrText(node))
                    .put("icon_box_text", text(node))
                    .build());
            case SOCIAL_SHARE -> {
                Settings settings = Settings.create().put("icon-layout", "row");
                for (String item : node.props.items) {
                    settings.put("icon-" + item.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-"), "#");
                }
                yield WidgetMapping.of("oxy_social_icons", settings.build());
            }
            case CARD, CTA, MODAL, FORM, INPUT, TEXTAREA, SELECT, CHECKBOX, RADIO, FILE_UPLOAD, BREADCRUMBS,
                 PAGINATION, COUNTDOWN, TEAM_MEMBER, BLOG_CARD, PRODUCT_CARD, SOCIAL_FEED,
                 CONTAINER, SECTION, COLUMN, ROW, GRID, HERO, SIDEBAR, HEADER, FOOTER, UNKNOWN ->
                    WidgetMapping.unmapped("ct_text_block", Settings.create()
                            .put("ct_content", originalHtml(node))
                            .build());
        };
    }

    static String embedUrl(String url) {
        if (url == null) {
            return null;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("youtube.com/watch")) {
            int v = url.indexOf("v=");
            if (v >= 0) {
                String id = url.substring(v + 2);
                int amp = id.indexOf('&');
                return "https://www.youtube.com/embed/" + (amp >= 0 ? id.substring(0, amp) : id);
            }
        }
        if (lower.contains("youtu.be/")) {
            return "https://www.youtube.com/embed/" + url.substring(url.lastIndexOf('/') + 1);
        }
        if (lower.contains("vimeo.com/") && !lower.contains("player.vimeo.com")) {
            return "https://player.vimeo.com/video/" + url.substring(url.lastIndexOf('/') + 1);
        }
        return url;
    }

    private static String iconId(ComponentHierarchy node) {
        String className = node.props.className;
        if (className != null) {
            for (String cls : className.trim().split("\\s+")) {
                if (cls.startsWith("fa-") && !cls.equals("fa-solid") && !cls.equals("fa-brands")) {
                    return "FontAwesomeicon-" + cls.substring(3);
                }
            }
        }
        return "FontAwesomeicon-star";
    }

    private static String firstItemOrText(ComponentHierarchy node) {
        return node.props.items.isEmpty() ? text(node) : node.props.items.get(0);
    }

    private static String animation(ExtractedStyles styles) {
        String name = styles.get("animationName");
        if (name == null || name.equalsIgnoreCase("none")) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("slide")) {
            return "slide-up";
        }
        if (lower.contains("zoom") || lower.contains("scale")) {
            return "zoom-in";
        }
        return "fade";
    }

    private static Map<String, Object> globalColors(ConversionContext context) {
        if (context.designTokens == null || context.designTokens.colors == null) {
            return null;
        }
        ColorPalette palette = context.designTokens.colors;
        List<Map<String, Object>> colors = new ArrayList<>();
        for (int i = 0; i < COLOR_SLOTS.size(); i++) {
            String slot = COLOR_SLOTS.get(i);
            String value = switch (slot) {
                case "primary" -> palette.primary;
                case "secondary" -> palette.secondary;
                case "accent" -> palette.accent;
                case "text" -> palette.text;
                default -> palette.background;
            };
            if (value != null) {
                colors.add(Settings.create()
                        .put("id", i + 1)
                        .put("name", Character.toUpperCase(slot.charAt(0)) + slot.substring(1))
                        .put("value", value)
                        .put("set", 0)
                        .build());
            }
        }
        return Settings.create()
                .put("colors", colors)
                .put("sets", List.of(Map.of("id", 0, "name", "Global Colors")))
                .build();
    }

    private static Map<String, Object> typography(ConversionContext context) {
        if (context.typography == null) {
            return null;
        }
        GlobalTypographySettings global = context.typography.globalSettings;
        Settings fonts = Settings.create()
                .put("Text", global.baseFontFamily)
                .put("Display", global.headingFontFamily);
        Settings headings = Settings.create();
        for (int level = 1; level <= 6; level++) {
            TextStyle style = context.typography.textStyles.heading(level);
            if (style != null) {
                headings.put("H" + level, Settings.create()
                        .put("font-size", style.fontSize)
                        .put("font-weight", style.fontWeight)
                        .put("line-height", style.lineHeight)
                        .build());
            }
        }
        return Settings.create()
                .put("fonts", fonts.build())
                .put("body_text", Settings.create()
                        .put("font-size", global.baseFontSize + "px")
                        .put("line-height", String.valueOf(global.baseLineHeight))
                        .put("color", global.baseColor)
                        .build())
                .put("headings", headings.build())
                .build();
    }
}
