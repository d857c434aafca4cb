package org.dxworks.pageframe.converter.gutenberg;

import java.util.List;
import java.util.Map;

public class GutenbergExport {
    public final List<GutenbergBlock> blocks;
    public final String postContent;
    public final Map<String, Object> globalStyles; // theme.json shape

    public GutenbergExport(List<GutenbergBlock> blocks, String postContent, Map<String, Object> globalStyles) {
        this.blocks = List.copyOf(blocks);
        this.postContent = postContent;
        this.globalStyles = globalStyles;
    }
}
