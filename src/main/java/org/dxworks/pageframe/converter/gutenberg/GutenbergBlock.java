package org.dxworks.pageframe.converter.gutenberg;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed form of a block. For blocks with inner blocks, {@code innerHTML}
 * is the wrapper markup with the inner blocks cut out.
 */
public class GutenbergBlock {
    public final String blockName;
    public final Map<String, Object> attrs;
    public final List<GutenbergBlock> innerBlocks;
    public final String innerHTML;

    public GutenbergBlock(String blockName, Map<String, Object> attrs, List<GutenbergBlock> innerBlocks,
                          String innerHTML) {
        this.blockName = blockName;
        this.attrs = attrs != null ? new LinkedHashMap<>(attrs) : new LinkedHashMap<>();
        this.innerBlocks = List.copyOf(innerBlocks);
        this.innerHTML = innerHTML != null ? innerHTML : "";
    }

    public static GutenbergBlock leaf(String blockName, Map<String, Object> attrs, String innerHTML) {
        return new GutenbergBlock(blockName, attrs, List.of(), innerHTML);
    }

    public boolean isEmpty() {
        return innerBlocks.isEmpty() && innerHTML.isEmpty();
    }
}
