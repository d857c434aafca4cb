package org.dxworks.pageframe.dom;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads page snapshots either from the JSON export of the cloning stage or
 * from a static HTML document.
 */
public class DomSnapshotReader {

    private static final Set<String> NON_CONTENT_TAGS = Set.of("script", "style", "link", "noscript", "template");

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public DomSnapshot read(Path path) throws IOException {
        InputFormat format = InputFormat.detect(path)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported input file: " + path
                        + " (expected .json, .html or .htm)"));
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return switch (format) {
            case JSON -> readJson(content);
            case HTML -> readHtml(content);
        };
    }

    public DomSnapshot readJson(Path path) throws IOException {
        return readJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Accepts either a snapshot object ({@code {"root": {...}, "scripts": [...]}})
     * or a bare root node.
     */
    public DomSnapshot readJson(String json) throws IOException {
        JsonNode tree = mapper.readTree(json);
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            throw new IllegalArgumentException("DOM root must not be null");
        }

        DomSnapshot snapshot;
        if (tree.has("root")) {
            snapshot = mapper.treeToValue(tree, DomSnapshot.class);
        } else {
            snapshot = new DomSnapshot(mapper.treeToValue(tree, DomNode.class));
        }
        if (snapshot.root == null || snapshot.root.tagName == null) {
            throw new IllegalArgumentException("DOM root must not be null");
        }
        return snapshot;
    }

    /**
     * Parses a static page. Inline {@code style} attributes become the computed
     * styles, {@code <body>} is the root, and scripts and stylesheets are lifted
     * out of the element tree into the snapshot lists.
     */
    public DomSnapshot readHtml(String html) {
        if (html == null) {
            throw new IllegalArgumentException("DOM root must not be null");
        }
        Document doc = Jsoup.parse(html);

        DomSnapshot snapshot = new DomSnapshot();
        snapshot.title = doc.title();
        for (Element script : doc.select("script")) {
            snapshot.scripts.add(script.hasAttr("src") ? script.attr("src") : script.data());
        }
        for (Element style : doc.select("style")) {
            snapshot.stylesheets.add(style.data());
        }
        for (Element link : doc.select("link[rel=stylesheet]")) {
            snapshot.stylesheets.add(link.attr("href"));
        }
        snapshot.root = toDomNode(doc.body());
        return snapshot;
    }

    private DomNode toDomNode(Element element) {
        DomNode node = new DomNode(element.normalName());
        for (Attribute attribute : element.attributes()) {
            node.attributes.put(attribute.getKey(), attribute.getValue());
        }
        node.computedStyles.putAll(CssDeclarations.parse(element.attr("style")));

        String ownText = element.ownText();
        if (!ownText.isBlank()) {
            node.text = ownText;
        }
        for (Element child : element.children()) {
            if (!NON_CONTENT_TAGS.contains(child.normalName())) {
                node.children.add(toDomNode(child));
            }
        }
        return node;
    }
}
