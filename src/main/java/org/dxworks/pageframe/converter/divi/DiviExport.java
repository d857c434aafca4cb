package org.dxworks.pageframe.converter.divi;

import java.util.List;
import java.util.Map;

public class DiviExport {
    public final String context = "et_builder";
    public final List<DiviElement> sections;
    public final String postContent;
    public final List<Map<String, Object>> globalColors;

    public DiviExport(List<DiviElement> sections, String postContent, List<Map<String, Object>> globalColors) {
        this.sections = List.copyOf(sections);
        this.postContent = postContent;
        this.globalColors = List.copyOf(globalColors);
    }
}
