package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComponentType {
    // Basic
    BUTTON("button", Category.BASIC),
    HEADING("heading", Category.BASIC),
    TEXT("text", Category.BASIC),
    PARAGRAPH("paragraph", Category.BASIC),
    IMAGE("image", Category.BASIC),
    VIDEO("video", Category.BASIC),
    ICON("icon", Category.BASIC),
    SPACER("spacer", Category.BASIC),
    DIVIDER("divider", Category.BASIC),
    LINK("link", Category.BASIC),

    // Layout
    CONTAINER("container", Category.LAYOUT),
    SECTION("section", Category.LAYOUT),
    COLUMN("column", Category.LAYOUT),
    ROW("row", Category.LAYOUT),
    GRID("grid", Category.LAYOUT),
    CARD("card", Category.CONTENT),
    HERO("hero", Category.LAYOUT),
    SIDEBAR("sidebar", Category.LAYOUT),
    HEADER("header", Category.LAYOUT),
    FOOTER("footer", Category.LAYOUT),

    // Forms
    FORM("form", Category.FORM),
    INPUT("input", Category.FORM),
    TEXTAREA("textarea", Category.FORM),
    SELECT("select", Category.FORM),
    CHECKBOX("checkbox", Category.FORM),
    RADIO("radio", Category.FORM),
    SUBMIT_BUTTON("submit-button", Category.FORM),
    FILE_UPLOAD("file-upload", Category.FORM),

    // Advanced
    ACCORDION("accordion", Category.ADVANCED),
    TABS("tabs", Category.ADVANCED),
    MODAL("modal", Category.ADVANCED),
    CAROUSEL("carousel", Category.ADVANCED),
    SLIDER("slider", Category.ADVANCED),
    GALLERY("gallery", Category.ADVANCED),
    TESTIMONIAL("testimonial", Category.CONTENT),
    PRICING_TABLE("pricing-table", Category.CONTENT),
    PROGRESS_BAR("progress-bar", Category.ADVANCED),
    COUNTDOWN("countdown", Category.ADVANCED),
    SOCIAL_SHARE("social-share", Category.ADVANCED),
    BREADCRUMBS("breadcrumbs", Category.NAVIGATION),
    PAGINATION("pagination", Category.NAVIGATION),
    TABLE("table", Category.CONTENT),
    LIST("list", Category.CONTENT),
    BLOCKQUOTE("blockquote", Category.CONTENT),
    CODE_BLOCK("code-block", Category.CONTENT),
    CTA("cta", Category.CONTENT),
    FEATURE_BOX("feature-box", Category.CONTENT),
    ICON_BOX("icon-box", Category.CONTENT),
    TEAM_MEMBER("team-member", Category.CONTENT),
    BLOG_CARD("blog-card", Category.CONTENT),
    PRODUCT_CARD("product-card", Category.CONTENT),
    SEARCH_BAR("search-bar", Category.NAVIGATION),
    MENU("menu", Category.NAVIGATION),
    GOOGLE_MAPS("google-maps", Category.ADVANCED),
    SOCIAL_FEED("social-feed", Category.ADVANCED),
    UNKNOWN("unknown", Category.UNKNOWN);

    public enum Category {
        BASIC, LAYOUT, FORM, CONTENT, ADVANCED, NAVIGATION, UNKNOWN
    }

    private final String id;
    private final Category category;

    ComponentType(String id, Category category) {
        this.id = id;
        this.category = category;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Layout types become structural nodes (section/container/column) in the
     * hierarchy instead of widgets.
     */
    public boolean isLayout() {
        return category == Category.LAYOUT;
    }

    @JsonCreator
    public static ComponentType fromId(String id) {
        for (ComponentType type : values()) {
            if (type.id.equalsIgnoreCase(id)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
