package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ElementContext;
import org.dxworks.pageframe.model.ElementPosition;
import org.dxworks.pageframe.model.ExtractedStyles;
import org.dxworks.pageframe.model.InteractiveStates;
import org.dxworks.pageframe.model.ResponsiveStyles;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a snapshot tree into {@link AnalyzedElement}s. Markup is re-serialized
 * through jsoup so attribute values and text come out escaped.
 */
public class ElementAnalyzer {

    private static final Pattern CUSTOM_BREAKPOINT = Pattern.compile("(min|max)-(\\d+)(?:px)?");
    private static final List<String> HERO_KEYWORDS = List.of("hero", "banner");
    private static final List<String> CARD_KEYWORDS = List.of("card", "box");

    public AnalyzedElement analyze(DomNode root) {
        if (root == null || root.tagName == null) {
            throw new IllegalArgumentException("DOM root must not be null");
        }
        Document shell = Document.createShell("");
        shell.outputSettings().prettyPrint(false);
        Element markupRoot = toMarkup(root, shell.body());
        return analyze(root, markupRoot, Ancestry.NONE, 0, null, List.of());
    }

    /**
     * Visits every element of the tree in pre-order.
     */
    public static void walk(AnalyzedElement element, Consumer<AnalyzedElement> visitor) {
        visitor.accept(element);
        for (AnalyzedElement child : element.children) {
            walk(child, visitor);
        }
    }

    public static List<AnalyzedElement> preOrder(AnalyzedElement root) {
        List<AnalyzedElement> all = new ArrayList<>();
        walk(root, all::add);
        return all;
    }

    private AnalyzedElement analyze(DomNode node, Element markup, Ancestry ancestry, int depth,
                                    String parentTag, List<String> siblingTags) {
        String tag = node.tagName.toLowerCase(Locale.ROOT);
        ElementContext context = ancestry.toContext(depth, parentTag, siblingTags);
        Ancestry childAncestry = ancestry.including(tag, node.attributes.get("class"));

        List<String> childTags = new ArrayList<>();
        for (DomNode child : node.children) {
            childTags.add(child.tagName.toLowerCase(Locale.ROOT));
        }

        List<AnalyzedElement> children = new ArrayList<>();
        List<Element> childMarkup = markup.children();
        for (int i = 0; i < node.children.size(); i++) {
            List<String> siblings = new ArrayList<>(childTags);
            siblings.remove(i);
            children.add(analyze(node.children.get(i), childMarkup.get(i), childAncestry, depth + 1, tag, siblings));
        }

        ExtractedStyles styles = StyleExtractor.extract(node.computedStyles);
        return new AnalyzedElement(
                tag,
                node.attributes,
                collapseWhitespace(markup.text()),
                markup.html(),
                markup.outerHtml(),
                styles,
                responsiveStyles(node.responsiveStyles),
                interactiveStates(styles, node.stateStyles),
                context,
                children,
                node.rect != null
                        ? new ElementPosition(node.rect.x, node.rect.y, node.rect.width, node.rect.height)
                        : ElementPosition.ZERO);
    }

    private static Element toMarkup(DomNode node, Element parent) {
        if (node.tagName == null) {
            throw new IllegalArgumentException("DOM node without tag name under <" + parent.tagName() + ">");
        }
        Element element = parent.appendElement(node.tagName.toLowerCase(Locale.ROOT));
        node.attributes.forEach(element::attr);
        if (node.text != null) {
            element.appendText(node.text);
        }
        for (DomNode child : node.children) {
            toMarkup(child, element);
        }
        return element;
    }

    private static ResponsiveStyles responsiveStyles(Map<String, Map<String, String>> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        ExtractedStyles desktop = null;
        ExtractedStyles laptop = null;
        ExtractedStyles tablet = null;
        ExtractedStyles mobile = null;
        List<ResponsiveStyles.CustomBreakpoint> custom = new ArrayList<>();

        for (Map.Entry<String, Map<String, String>> entry : raw.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            ExtractedStyles styles = StyleExtractor.extract(entry.getValue());
            switch (key) {
                case "desktop" -> desktop = styles;
                case "laptop" -> laptop = styles;
                case "tablet" -> tablet = styles;
                case "mobile" -> mobile = styles;
                default -> {
                    Matcher matcher = CUSTOM_BREAKPOINT.matcher(key);
                    if (matcher.matches()) {
                        int px = Integer.parseInt(matcher.group(2));
                        boolean min = matcher.group(1).equals("min");
                        custom.add(new ResponsiveStyles.CustomBreakpoint(min ? px : null, min ? null : px, styles));
                    }
                }
            }
        }
        ResponsiveStyles responsive = new ResponsiveStyles(desktop, laptop, tablet, mobile, custom);
        return responsive.isEmpty() ? null : responsive;
    }

    private static InteractiveStates interactiveStates(ExtractedStyles normal, Map<String, Map<String, String>> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return new InteractiveStates(
                normal,
                stateOrNull(raw, "hover"),
                stateOrNull(raw, "focus"),
                stateOrNull(raw, "active"),
                stateOrNull(raw, "before"),
                stateOrNull(raw, "after"));
    }

    private static ExtractedStyles stateOrNull(Map<String, Map<String, String>> raw, String state) {
        Map<String, String> styles = raw.get(state);
        return styles == null || styles.isEmpty() ? null : StyleExtractor.extract(styles);
    }

    static String collapseWhitespace(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }

    /**
     * Context flags accumulated from the ancestors of an element (the element
     * itself excluded).
     */
    private static final class Ancestry {
        static final Ancestry NONE = new Ancestry(false, false, false, false, false, false, false);

        final boolean hero;
        final boolean form;
        final boolean card;
        final boolean nav;
        final boolean header;
        final boolean footer;
        final boolean section;

        Ancestry(boolean hero, boolean form, boolean card, boolean nav, boolean header, boolean footer,
                 boolean section) {
            this.hero = hero;
            this.form = form;
            this.card = card;
            this.nav = nav;
            this.header = header;
            this.footer = footer;
            this.section = section;
        }

        Ancestry including(String tag, String classAttr) {
            String classes = classAttr == null ? "" : classAttr.toLowerCase(Locale.ROOT);
            return new Ancestry(
                    hero || HERO_KEYWORDS.stream().anyMatch(classes::contains),
                    form || tag.equals("form"),
                    card || CARD_KEYWORDS.stream().anyMatch(classes::contains),
                    nav || tag.equals("nav"),
                    header || tag.equals("header"),
                    footer || tag.equals("footer"),
                    section || tag.equals("section"));
        }

        ElementContext toContext(int depth, String parentTag, List<String> siblingTags) {
            return new ElementContext(hero, form, card, nav, header, footer, section, depth, parentTag, siblingTags);
        }
    }
}
