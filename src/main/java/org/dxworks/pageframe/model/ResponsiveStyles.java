package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponsiveStyles {
    public final ExtractedStyles desktop;  // 1920px
    public final ExtractedStyles laptop;   // 1366px
    public final ExtractedStyles tablet;   // 768px
    public final ExtractedStyles mobile;   // 375px
    public final List<CustomBreakpoint> custom;

    public ResponsiveStyles(ExtractedStyles desktop, ExtractedStyles laptop, ExtractedStyles tablet,
                            ExtractedStyles mobile, List<CustomBreakpoint> custom) {
        this.desktop = desktop;
        this.laptop = laptop;
        this.tablet = tablet;
        this.mobile = mobile;
        this.custom = List.copyOf(custom);
    }

    public boolean isEmpty() {
        return desktop == null && laptop == null && tablet == null && mobile == null && custom.isEmpty();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CustomBreakpoint {
        public final Integer minWidth;
        public final Integer maxWidth;
        public final ExtractedStyles styles;

        public CustomBreakpoint(Integer minWidth, Integer maxWidth, ExtractedStyles styles) {
            this.minWidth = minWidth;
            this.maxWidth = maxWidth;
            this.styles = styles;
        }
    }
}
