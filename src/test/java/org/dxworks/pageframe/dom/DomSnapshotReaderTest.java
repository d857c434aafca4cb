package org.dxworks.pageframe.dom;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DomSnapshotReaderTest {

    private final DomSnapshotReader reader = new DomSnapshotReader();

    @Test
    void readJson_bareRootNode() throws IOException {
        DomSnapshot snapshot = reader.readJson("{\"tagName\":\"div\",\"children\":[{\"tagName\":\"h1\",\"text\":\"Hi\","
                + "\"computedStyles\":{\"font-size\":\"32px\"}}]}");

        assertEquals("div", snapshot.root.tagName);
        assertEquals(1, snapshot.root.children.size());
        assertEquals("Hi", snapshot.root.children.get(0).text);
        assertEquals("32px", snapshot.root.children.get(0).computedStyles.get("font-size"));
    }

    @Test
    void readJson_snapshotObject() throws IOException {
        DomSnapshot snapshot = reader.readJson("{\"url\":\"https://example.com\",\"root\":{\"tagName\":\"body\"},"
                + "\"scripts\":[\"console.log(1)\"],\"unknown\":true}");

        assertEquals("https://example.com", snapshot.url);
        assertEquals("body", snapshot.root.tagName);
        assertEquals(1, snapshot.scripts.size());
    }

    @Test
    void readJson_nullRoot_failsFast() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> reader.readJson("{\"root\":null}"));
        assertEquals("DOM root must not be null", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> reader.readJson("null"));
    }

    @Test
    void readHtml_liftsScriptsAndStylesOutOfTheTree() {
        DomSnapshot snapshot = reader.readHtml("<html><head><title>Home</title><style>h1{color:red}</style></head>"
                + "<body><h1 style=\"font-size: 40px\">Hello <b>there</b></h1>"
                + "<script>track()</script><script src=\"/app.js\"></script></body></html>");

        assertEquals("Home", snapshot.title);
        assertEquals("body", snapshot.root.tagName);
        assertEquals(1, snapshot.root.children.size());
        DomNode heading = snapshot.root.children.get(0);
        assertEquals("40px", heading.computedStyles.get("font-size"));
        assertEquals("Hello", heading.text.trim());
        assertEquals("b", heading.children.get(0).tagName);
        assertEquals(2, snapshot.scripts.size());
        assertEquals("/app.js", snapshot.scripts.get(1));
        assertEquals("h1{color:red}", snapshot.stylesheets.get(0));
        assertNull(snapshot.url);
    }

    @Test
    void read_detectsFormatFromExtension(@TempDir Path dir) throws IOException {
        Path html = dir.resolve("page.html");
        Files.writeString(html, "<p>Text</p>");
        Path unsupported = dir.resolve("page.txt");
        Files.writeString(unsupported, "text");

        assertEquals("p", reader.read(html).root.children.get(0).tagName);
        assertThrows(IllegalArgumentException.class, () -> reader.read(unsupported));
    }
}
