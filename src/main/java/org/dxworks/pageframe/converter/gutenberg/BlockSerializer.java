package org.dxworks.pageframe.converter.gutenberg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Writes blocks in the comment-delimited post content format:
 * {@code <!-- wp:name {"attr":1} -->html<!-- /wp:name -->}, self-closing
 * when a block has no markup. The {@code core/} namespace is omitted.
 */
public final class BlockSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String CORE_PREFIX = "core/";

    private BlockSerializer() {
    }

    public static String serialize(List<GutenbergBlock> blocks) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) {
                out.append("\n\n");
            }
            write(blocks.get(i), out);
        }
        return out.toString();
    }

    public static String serialize(GutenbergBlock block) {
        StringBuilder out = new StringBuilder();
        write(block, out);
        return out.toString();
    }

    private static void write(GutenbergBlock block, StringBuilder out) {
        String name = shortName(block.blockName);
        String attrs = block.attrs.isEmpty() ? "" : " " + encodeAttrs(block);
        if (block.isEmpty()) {
            out.append("<!-- wp:").append(name).append(attrs).append(" /-->");
            return;
        }
        out.append("<!-- wp:").append(name).append(attrs).append(" -->\n");
        if (block.innerBlocks.isEmpty()) {
            out.append(block.innerHTML);
        } else {
            int split = wrapperSplit(block.innerHTML);
            out.append(block.innerHTML, 0, split);
            for (GutenbergBlock inner : block.innerBlocks) {
                out.append('\n');
                write(inner, out);
                out.append('\n');
            }
            out.append(block.innerHTML.substring(split));
        }
        out.append("\n<!-- /wp:").append(name).append(" -->");
    }

    /**
     * Inner blocks go before the wrapper's closing tag, or after the whole
     * markup when it has none.
     */
    static int wrapperSplit(String wrapper) {
        int close = wrapper.lastIndexOf("</");
        return close >= 0 ? close : wrapper.length();
    }

    static String shortName(String blockName) {
        return blockName.startsWith(CORE_PREFIX) ? blockName.substring(CORE_PREFIX.length()) : blockName;
    }

    /**
     * JSON with the characters that would end or confuse an HTML comment
     * escaped, the way WordPress stores block attributes.
     */
    private static String encodeAttrs(GutenbergBlock block) {
        try {
            return MAPPER.writeValueAsString(block.attrs)
                    .replace("--", "\\u002d\\u002d")
                    .replace("<", "\\u003c")
                    .replace(">", "\\u003e")
                    .replace("&", "\\u0026");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize attributes of " + block.blockName, e);
        }
    }
}
