package org.dxworks.pageframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void main_writesOneLinePerBuilderBetweenRunAndDone() throws Exception {
        Path input = tempDir.resolve("page.html");
        Files.writeString(input, "<html><head><title>Launch</title></head><body>"
                + "<section class=\"hero\"><h1>Launch day</h1><p>Everything ships today.</p>"
                + "<a class=\"btn\" href=\"/go\">Go</a></section>"
                + "<marquee>Sale</marquee>"
                + "</body></html>");
        Path output = tempDir.resolve("out/result.jsonl");

        App.main(new String[]{input.toString(), output.toString(),
                "elementor", "gutenberg", "beaver", "divi", "bricks", "oxygen"});

        List<JsonNode> lines = new ArrayList<>();
        for (String line : Files.readAllLines(output)) {
            lines.add(MAPPER.readTree(line));
        }
        assertEquals(8, lines.size());
        assertEquals("run", lines.get(0).get("kind").asText());
        assertEquals(6, lines.get(0).get("builders").size());

        Set<String> builders = new HashSet<>();
        for (JsonNode line : lines.subList(1, 7)) {
            assertEquals("conversion", line.get("kind").asText());
            assertEquals("done", line.get("state").asText());
            assertTrue(line.get("stats").get("htmlFallbacks").asInt() >= 1);
            builders.add(line.get("builder").asText());
        }
        assertEquals(Set.of("elementor", "gutenberg", "beaver", "divi", "bricks", "oxygen"), builders);

        JsonNode done = lines.get(7);
        assertEquals("done", done.get("kind").asText());
        assertEquals(6, done.get("builders_converted").asInt());
        assertEquals(0, done.get("builders_with_errors").asInt());
    }

    @Test
    void main_writesErrorLinesForUnreadableInput() throws Exception {
        Path input = tempDir.resolve("broken.json");
        Files.writeString(input, "{\"root\": null}");
        Path output = tempDir.resolve("errors.jsonl");

        App.main(new String[]{input.toString(), output.toString(), "divi", "oxygen"});

        List<String> lines = Files.readAllLines(output);
        assertEquals(4, lines.size());
        JsonNode error = MAPPER.readTree(lines.get(1));
        assertEquals("error", error.get("kind").asText());
        assertEquals("divi", error.get("builder").asText());
        assertEquals("DOM root must not be null", error.get("error").asText());
        assertEquals(2, MAPPER.readTree(lines.get(3)).get("builders_with_errors").asInt());
    }
}
