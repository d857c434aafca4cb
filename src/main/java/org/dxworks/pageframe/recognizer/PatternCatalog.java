package org.dxworks.pageframe.recognizer;

import org.dxworks.pageframe.analyzer.ColumnClasses;
import org.dxworks.pageframe.analyzer.DimensionParser;
import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ExtractedStyles;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import static org.dxworks.pageframe.model.ComponentType.*;
import static org.dxworks.pageframe.recognizer.PatternCondition.attr;
import static org.dxworks.pageframe.recognizer.PatternCondition.classes;
import static org.dxworks.pageframe.recognizer.PatternCondition.content;
import static org.dxworks.pageframe.recognizer.PatternCondition.context;
import static org.dxworks.pageframe.recognizer.PatternCondition.role;
import static org.dxworks.pageframe.recognizer.PatternCondition.shape;
import static org.dxworks.pageframe.recognizer.PatternCondition.style;
import static org.dxworks.pageframe.recognizer.PatternCondition.tag;

/**
 * The static recognition rule set, sorted by descending priority. Patterns of
 * equal priority keep their declaration order.
 */
public final class PatternCatalog {

    public static final String VERSION = "1.4.0";

    private static final String[] HEADINGS = {"h1", "h2", "h3", "h4", "h5", "h6"};
    private static final String[] BLOCKS = {"div", "article", "aside", "li", "figure"};
    private static final List<String> LAYOUT_CLASSES = List.of("row", "container", "wrapper");

    private static final List<RecognitionPattern> PATTERNS = sortByPriority(List.of(
            // Page regions
            RecognitionPattern.of("header-tag", HEADER, 95, 100, tag("header")),
            RecognitionPattern.of("footer-tag", FOOTER, 95, 100, tag("footer")),
            RecognitionPattern.of("header-class", HEADER, 80, 92,
                    tag("div", "section"), classes("site-header", "page-header", "masthead", "header")),
            RecognitionPattern.of("footer-class", FOOTER, 80, 92,
                    tag("div", "section"), classes("site-footer", "footer")),
            RecognitionPattern.of("hero-class", HERO, 90, 96,
                    tag("section", "div", "header"), classes("hero", "banner", "jumbotron", "masthead-hero")),
            RecognitionPattern.of("hero-shape", HERO, 75, 73,
                    tag("section", "div"), shape("h1 over background image or tall block", PatternCatalog::looksLikeHero)),
            RecognitionPattern.of("sidebar-tag", SIDEBAR, 90, 95, tag("aside")),
            RecognitionPattern.of("sidebar-class", SIDEBAR, 80, 85, tag("div", "section"), classes("sidebar")),

            // Navigation
            RecognitionPattern.of("breadcrumbs-class", BREADCRUMBS, 90, 99, classes("breadcrumb")),
            RecognitionPattern.of("breadcrumbs-label", BREADCRUMBS, 90, 99, attr("aria-label", "breadcrumb")),
            RecognitionPattern.of("nav-tag", MENU, 90, 97, tag("nav")),
            RecognitionPattern.of("menu-class", MENU, 80, 88, tag("ul", "div"), classes("menu", "navbar", "nav-links")),
            RecognitionPattern.of("menu-role", MENU, 85, 88, role("navigation", "menubar", "menu")),
            RecognitionPattern.of("pagination-class", PAGINATION, 85, 95, classes("pagination", "pager", "page-numbers")),
            RecognitionPattern.of("search-role", SEARCH_BAR, 90, 98, role("search")),
            RecognitionPattern.of("search-form", SEARCH_BAR, 85, 97,
                    tag("form", "div"), classes("search"), shape("contains an input", e -> e.hasDescendant("input"))),
            RecognitionPattern.of("search-input", SEARCH_BAR, 85, 94, tag("input"), attr("type", "^search$")),

            // Forms
            RecognitionPattern.of("form-tag", FORM, 90, 93, tag("form")),
            RecognitionPattern.of("file-input", FILE_UPLOAD, 95, 92, tag("input"), attr("type", "^file$")),
            RecognitionPattern.of("checkbox-input", CHECKBOX, 95, 92, tag("input"), attr("type", "^checkbox$")),
            RecognitionPattern.of("radio-input", RADIO, 95, 92, tag("input"), attr("type", "^radio$")),
            RecognitionPattern.of("submit-input", SUBMIT_BUTTON, 95, 92, tag("input"), attr("type", "^(submit|button)$")),
            RecognitionPattern.of("submit-button", SUBMIT_BUTTON, 90, 91, tag("button"), attr("type", "^submit$")),
            RecognitionPattern.of("form-button", SUBMIT_BUTTON, 80, 90,
                    tag("button"), context("inside form", c -> c.insideForm)),
            RecognitionPattern.of("textarea-tag", TEXTAREA, 95, 92, tag("textarea")),
            RecognitionPattern.of("select-tag", SELECT, 95, 92, tag("select")),
            RecognitionPattern.of("input-tag", INPUT, 90, 89, tag("input")),

            // Interactive
            RecognitionPattern.of("modal-role", MODAL, 90, 87, role("dialog", "alertdialog")),
            RecognitionPattern.of("modal-tag", MODAL, 90, 87, tag("dialog")),
            RecognitionPattern.of("modal-class", MODAL, 80, 86, tag(BLOCKS), classes("modal", "popup", "lightbox")),
            RecognitionPattern.of("tabs-role", TABS, 90, 87, role("tablist")),
            RecognitionPattern.of("tabs-class", TABS, 80, 85, tag("div", "ul", "section"), classes("tabs", "tab-list", "tabset")),
            RecognitionPattern.of("accordion-class", ACCORDION, 85, 85,
                    tag("div", "section", "ul", "dl"), classes("accordion", "faq", "collapsible", "toggle")),
            RecognitionPattern.of("accordion-details", ACCORDION, 80, 84, tag("details")),
            RecognitionPattern.of("carousel-class", CAROUSEL, 85, 85, tag(BLOCKS), classes("carousel", "slick", "swiper", "owl-")),
            RecognitionPattern.of("slider-class", SLIDER, 80, 84, tag(BLOCKS), classes("slider", "slideshow")),
            RecognitionPattern.of("gallery-class", GALLERY, 85, 83, tag("div", "section", "ul", "figure"), classes("gallery")),
            RecognitionPattern.of("gallery-shape", GALLERY, 70, 60,
                    tag("div", "ul"), shape("three or more images", e -> countImages(e) >= 3 && !hasHeading(e))),

            // Content blocks
            RecognitionPattern.of("pricing-class", PRICING_TABLE, 85, 82,
                    tag(BLOCKS), classes("pricing", "price-table", "plan"), notLayout()),
            RecognitionPattern.of("testimonial-class", TESTIMONIAL, 85, 82,
                    tag(BLOCKS), classes("testimonial", "review"), notLayout()),
            RecognitionPattern.of("team-class", TEAM_MEMBER, 80, 81,
                    tag(BLOCKS), classes("team-member", "member", "staff"), notLayout()),
            RecognitionPattern.of("product-class", PRODUCT_CARD, 80, 81,
                    tag(BLOCKS), classes("product"), shape("has an image", e -> countImages(e) >= 1), notLayout()),
            RecognitionPattern.of("blog-article", BLOG_CARD, 80, 81,
                    tag("article"), shape("has a heading", PatternCatalog::hasHeading)),
            RecognitionPattern.of("blog-class", BLOG_CARD, 75, 80,
                    tag("div", "li"), classes("post", "blog", "entry"), shape("has a heading", PatternCatalog::hasHeading)),
            RecognitionPattern.of("progress-tag", PROGRESS_BAR, 95, 92, tag("progress")),
            RecognitionPattern.of("progress-role", PROGRESS_BAR, 90, 91, role("progressbar")),
            RecognitionPattern.of("progress-class", PROGRESS_BAR, 80, 80, tag("div"), classes("progress")),
            RecognitionPattern.of("countdown-class", COUNTDOWN, 85, 82, classes("countdown", "timer")),
            RecognitionPattern.of("countdown-content", COUNTDOWN, 70, 60,
                    tag("div", "span"), content("^\\d{1,2}\\s*d(ays)?\\s*:?\\s*\\d{1,2}\\s*h")),
            RecognitionPattern.of("share-class", SOCIAL_SHARE, 80, 80, classes("social-share", "share-buttons", "sharing")),
            RecognitionPattern.of("feed-class", SOCIAL_FEED, 75, 79, classes("social-feed", "instagram-feed", "twitter-timeline")),
            RecognitionPattern.of("maps-embed", GOOGLE_MAPS, 90, 88, tag("iframe"), attr("src", "google\\.[a-z.]+/maps")),
            RecognitionPattern.of("video-embed", VIDEO, 90, 88, tag("iframe"), attr("src", "youtube|youtu\\.be|vimeo|wistia")),
            RecognitionPattern.of("video-tag", VIDEO, 95, 92, tag("video")),
            RecognitionPattern.of("cta-class", CTA, 80, 78, tag(BLOCKS), classes("cta", "call-to-action"), notLayout()),
            RecognitionPattern.of("icon-box-class", ICON_BOX, 80, 77, tag(BLOCKS), classes("icon-box", "iconbox"), notLayout()),
            RecognitionPattern.of("icon-box-shape", ICON_BOX, 70, 62,
                    tag("div", "li"), shape("icon above heading", e -> hasIcon(e) && hasHeading(e) && countImages(e) == 0)),
            RecognitionPattern.of("feature-class", FEATURE_BOX, 80, 77,
                    tag(BLOCKS), classes("feature", "benefit", "service"), notLayout()),
            RecognitionPattern.of("card-structure", CARD, 90, 76,
                    tag("div", "li"), shape("image, heading and text", PatternCatalog::hasCardStructure), notLayout()),
            RecognitionPattern.of("card-class", CARD, 85, 75,
                    tag("div", "li", "a"), classes("card", "tile", "panel")),

            // Layout
            RecognitionPattern.of("grid-style", GRID, 85, 74,
                    tag("div", "section", "ul"), style("display: grid", s -> s.is("display", "grid"))),
            RecognitionPattern.of("column-class", COLUMN, 85, 74,
                    tag("div", "section"), shape("column class", ColumnClasses::hasColumnClass)),
            RecognitionPattern.of("row-class", ROW, 80, 73, tag("div", "section"), classes("row")),
            RecognitionPattern.of("grid-class", GRID, 75, 72, tag("div", "section", "ul"), classes("grid")),
            RecognitionPattern.of("section-tag", SECTION, 90, 72, tag("section")),
            RecognitionPattern.of("container-class", CONTAINER, 80, 71,
                    tag("div", "main"), classes("container", "wrapper", "wrap", "inner")),
            RecognitionPattern.of("main-tag", CONTAINER, 80, 65, tag("main", "body")),
            RecognitionPattern.of("flex-row", ROW, 65, 55,
                    tag("div"), style("display: flex, row direction", PatternCatalog::isFlexRow),
                    shape("two or more element children", e -> e.children.size() >= 2)),

            // Data and text blocks
            RecognitionPattern.of("table-tag", TABLE, 95, 70, tag("table")),
            RecognitionPattern.of("list-tag", LIST, 90, 68, tag("ul", "ol", "dl")),
            RecognitionPattern.of("blockquote-tag", BLOCKQUOTE, 95, 68, tag("blockquote")),
            RecognitionPattern.of("pre-tag", CODE_BLOCK, 95, 68, tag("pre")),
            RecognitionPattern.of("code-tag", CODE_BLOCK, 80, 66, tag("code")),

            // Basic
            RecognitionPattern.of("link-button", BUTTON, 90, 62, tag("a"), classes("btn", "button")),
            RecognitionPattern.of("role-button", BUTTON, 85, 61, tag("a", "div", "span"), role("button")),
            RecognitionPattern.of("icon-class", ICON, 85, 61,
                    tag("i", "span"), classes("icon", "fa-", "bi-", "material-icons", "dashicons")),
            RecognitionPattern.of("heading-tag", HEADING, 95, 60, tag(HEADINGS)),
            RecognitionPattern.of("heading-role", HEADING, 80, 59, role("heading")),
            RecognitionPattern.of("button-tag", BUTTON, 95, 60, tag("button")),
            RecognitionPattern.of("image-tag", IMAGE, 95, 60, tag("img", "picture")),
            RecognitionPattern.of("figure-image", IMAGE, 85, 59,
                    tag("figure"), shape("single image", e -> countImages(e) == 1)),
            RecognitionPattern.of("hr-tag", DIVIDER, 95, 60, tag("hr")),
            RecognitionPattern.of("divider-class", DIVIDER, 80, 57, tag("div", "span"), classes("divider", "separator")),
            RecognitionPattern.of("svg-icon", ICON, 75, 58, tag("svg")),
            RecognitionPattern.of("spacer-class", SPACER, 80, 56, tag("div"), classes("spacer", "gap")),
            RecognitionPattern.of("spacer-shape", SPACER, 60, 40,
                    tag("div"), shape("empty block with a height", PatternCatalog::isEmptySpacer)),
            RecognitionPattern.of("paragraph-tag", PARAGRAPH, 95, 55, tag("p")),
            RecognitionPattern.of("link-tag", LINK, 85, 50, tag("a")),
            RecognitionPattern.of("inline-text", TEXT, 80, 45,
                    tag("span", "strong", "em", "b", "small", "label", "figcaption", "cite", "address", "time", "mark")),
            RecognitionPattern.of("text-block", TEXT, 65, 35,
                    tag("div"), shape("text only", e -> e.children.isEmpty() && !e.textContent.isBlank())),
            RecognitionPattern.of("generic-block", CONTAINER, 65, 30,
                    tag("div", "article", "figure", "li", "dd", "dt"))
    ));

    private PatternCatalog() {
    }

    public static List<RecognitionPattern> patterns() {
        return PATTERNS;
    }

    private static List<RecognitionPattern> sortByPriority(List<RecognitionPattern> patterns) {
        List<RecognitionPattern> sorted = new ArrayList<>(patterns);
        sorted.sort(Comparator.comparingInt((RecognitionPattern p) -> p.priority).reversed());
        return List.copyOf(sorted);
    }

    private static boolean hasHeading(AnalyzedElement element) {
        return element.hasDescendant(HEADINGS);
    }

    private static int countImages(AnalyzedElement element) {
        int count = 0;
        for (AnalyzedElement child : element.children) {
            count += child.isTag("img") ? 1 : countImages(child);
        }
        return count;
    }

    private static boolean hasIcon(AnalyzedElement element) {
        for (AnalyzedElement child : element.children) {
            if (child.isTag("svg") || (child.isTag("i", "span") && child.hasClassKeyword(List.of("icon", "fa-")))
                    || hasIcon(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * One card: an image, a single heading and some text. Several headings
     * mean a wrapper around several cards.
     */
    private static boolean hasCardStructure(AnalyzedElement element) {
        return countImages(element) >= 1 && countHeadings(element) == 1 && element.hasDescendant("p");
    }

    private static int countHeadings(AnalyzedElement element) {
        int count = 0;
        for (AnalyzedElement child : element.children) {
            count += child.isTag(HEADINGS) ? 1 : countHeadings(child);
        }
        return count;
    }

    /**
     * Content blocks never match rows, containers, columns, grids or elements
     * whose children are columns; those keep their layout role.
     */
    private static PatternCondition notLayout() {
        return shape("not a layout wrapper", e -> !isLayoutWrapper(e));
    }

    static boolean isLayoutWrapper(AnalyzedElement element) {
        if (ColumnClasses.hasColumnClass(element) || hasLayoutClass(element) || element.styles.is("display", "grid")) {
            return true;
        }
        for (AnalyzedElement child : element.children) {
            if (ColumnClasses.hasColumnClass(child) || hasLayoutClass(child)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasLayoutClass(AnalyzedElement element) {
        for (String cls : element.classes) {
            String lower = cls.toLowerCase(Locale.ROOT);
            for (String keyword : LAYOUT_CLASSES) {
                if (lower.equals(keyword) || lower.startsWith(keyword + "-")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean looksLikeHero(AnalyzedElement element) {
        if (!element.hasDescendant("h1")) {
            return false;
        }
        ExtractedStyles styles = element.styles;
        boolean backgroundImage = styles.has("backgroundImage") && styles.backgroundImage().contains("url(");
        double minHeight = DimensionParser.toPixels(styles.get("minHeight")).orElse(0);
        double height = DimensionParser.toPixels(styles.height()).orElse(0);
        return backgroundImage || Math.max(minHeight, height) >= 400;
    }

    private static boolean isFlexRow(ExtractedStyles styles) {
        if (!styles.is("display", "flex")) {
            return false;
        }
        String direction = styles.get("flexDirection");
        return direction == null || direction.startsWith("row");
    }

    private static boolean isEmptySpacer(AnalyzedElement element) {
        return element.children.isEmpty() && element.textContent.isBlank()
                && DimensionParser.toPixels(element.styles.height()).orElse(0) > 0;
    }
}
