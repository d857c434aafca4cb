package org.dxworks.pageframe.model;

import java.util.List;

public class ElementContext {
    public final boolean insideHero;
    public final boolean insideForm;
    public final boolean insideCard;
    public final boolean insideNav;
    public final boolean insideHeader;
    public final boolean insideFooter;
    public final boolean insideSection;
    public final int depth;
    public final String parentTag;
    public final List<String> siblingTags;

    public ElementContext(boolean insideHero, boolean insideForm, boolean insideCard, boolean insideNav,
                          boolean insideHeader, boolean insideFooter, boolean insideSection,
                          int depth, String parentTag, List<String> siblingTags) {
        this.insideHero = insideHero;
        this.insideForm = insideForm;
        this.insideCard = insideCard;
        this.insideNav = insideNav;
        this.insideHeader = insideHeader;
        this.insideFooter = insideFooter;
        this.insideSection = insideSection;
        this.depth = depth;
        this.parentTag = parentTag;
        this.siblingTags = List.copyOf(siblingTags);
    }

    public static ElementContext root() {
        return new ElementContext(false, false, false, false, false, false, false, 0, null, List.of());
    }
}
