package org.dxworks.pageframe.converter.elementor;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public class ElementorExport {
    public final String version;
    public final String title;
    public final String type = "page";
    public final List<ElementorElement> content;
    @JsonProperty("page_settings")
    public final Map<String, Object> pageSettings;
    public final Globals globals;

    public ElementorExport(String version, String title, List<ElementorElement> content,
                           Map<String, Object> pageSettings, Globals globals) {
        this.version = version;
        this.title = title;
        this.content = List.copyOf(content);
        this.pageSettings = pageSettings;
        this.globals = globals;
    }

    public static class Globals {
        @JsonProperty("system_colors")
        public final List<Map<String, Object>> systemColors;
        @JsonProperty("system_typography")
        public final List<?> systemTypography;

        public Globals(List<Map<String, Object>> systemColors, List<?> systemTypography) {
            this.systemColors = List.copyOf(systemColors);
            this.systemTypography = List.copyOf(systemTypography);
        }
    }
}
