package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class InteractiveStates {
    public final ExtractedStyles normal;
    public final ExtractedStyles hover;
    public final ExtractedStyles focus;
    public final ExtractedStyles active;
    public final ExtractedStyles before; // ::before
    public final ExtractedStyles after;  // ::after

    public InteractiveStates(ExtractedStyles normal, ExtractedStyles hover, ExtractedStyles focus,
                             ExtractedStyles active, ExtractedStyles before, ExtractedStyles after) {
        this.normal = normal;
        this.hover = hover;
        this.focus = focus;
        this.active = active;
        this.before = before;
        this.after = after;
    }

    public boolean hasHover() {
        return hover != null && !hover.isEmpty();
    }
}
