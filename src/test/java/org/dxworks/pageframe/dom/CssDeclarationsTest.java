package org.dxworks.pageframe.dom;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CssDeclarationsTest {

    @Test
    void parse_keepsDeclarationOrder() {
        Map<String, String> styles = CssDeclarations.parse("color: red; Font-Size: 16px;margin:0 auto");

        assertEquals(Map.of("color", "red", "font-size", "16px", "margin", "0 auto"), styles);
        assertEquals("color", styles.keySet().iterator().next());
    }

    @Test
    void parse_semicolonInsideUrlOrQuotes_doesNotSplit() {
        Map<String, String> styles = CssDeclarations.parse(
                "background-image: url(data:image/png;base64,AAAA); font-family: \"A;B\", serif");

        assertEquals("url(data:image/png;base64,AAAA)", styles.get("background-image"));
        assertEquals("\"A;B\", serif", styles.get("font-family"));
    }

    @Test
    void parse_dropsImportantAndLaterDeclarationWins() {
        Map<String, String> styles = CssDeclarations.parse("color: red !important; color: blue");

        assertEquals("blue", styles.get("color"));
        assertEquals("red", CssDeclarations.parse("color: red !important").get("color"));
    }

    @Test
    void parse_blankOrMalformed_isEmpty() {
        assertTrue(CssDeclarations.parse(null).isEmpty());
        assertTrue(CssDeclarations.parse("   ").isEmpty());
        assertTrue(CssDeclarations.parse("no-colon; :novalue").isEmpty());
    }
}
