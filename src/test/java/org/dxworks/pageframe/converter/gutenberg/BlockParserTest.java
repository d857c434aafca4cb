package org.dxworks.pageframe.converter.gutenberg;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockParserTest {

    @Test
    void nestedBlocks_keepNamesAndAttributes() {
        GutenbergBlock heading = GutenbergBlock.leaf("core/heading", Map.of("level", 3),
                "<h3 class=\"wp-block-heading\">Title</h3>");
        GutenbergBlock spacer = GutenbergBlock.leaf("core/spacer", Map.of("height", "40px"), "");
        GutenbergBlock group = new GutenbergBlock("core/group", Map.of("tagName", "section"),
                List.of(heading, spacer), "<section class=\"wp-block-group\"></section>");

        String content = BlockSerializer.serialize(List.of(group));
        List<GutenbergBlock> parsed = BlockParser.parse(content);

        assertEquals(1, parsed.size());
        GutenbergBlock parsedGroup = parsed.get(0);
        assertEquals("core/group", parsedGroup.blockName);
        assertEquals("section", parsedGroup.attrs.get("tagName"));
        assertEquals(2, parsedGroup.innerBlocks.size());
        assertEquals(3, parsedGroup.innerBlocks.get(0).attrs.get("level"));
        assertEquals("<h3 class=\"wp-block-heading\">Title</h3>", parsedGroup.innerBlocks.get(0).innerHTML);
        assertTrue(parsedGroup.innerBlocks.get(1).isEmpty());
    }

    @Test
    void serializer_dropsCoreNamespaceAndEscapesComments() {
        GutenbergBlock block = GutenbergBlock.leaf("core/html", Map.of("content", "a-->b"), "<b>x</b>");

        String content = BlockSerializer.serialize(block);

        assertTrue(content.startsWith("<!-- wp:html {\"content\":\"a\\u002d\\u002d\\u003eb\"} -->"));
        assertEquals("a-->b", BlockParser.parse(content).get(0).attrs.get("content"));
    }

    @Test
    void looseMarkup_becomesFreeform() {
        List<GutenbergBlock> parsed = BlockParser.parse("<p>legacy</p>\n\n<!-- wp:separator /-->");

        assertEquals("core/freeform", parsed.get(0).blockName);
        assertEquals("<p>legacy</p>", parsed.get(0).innerHTML);
        assertEquals("core/separator", parsed.get(1).blockName);
    }

    @Test
    void mismatchedDelimiters_areRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> BlockParser.parse("<!-- wp:group --><p>x</p><!-- /wp:column -->"));
        assertThrows(IllegalArgumentException.class, () -> BlockParser.parse("<!-- wp:group --><p>x</p>"));
        assertThrows(IllegalArgumentException.class, () -> BlockParser.parse(null));
    }
}
