package org.dxworks.pageframe.converter.gutenberg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads comment-delimited post content back into blocks. Names without a
 * namespace are read as {@code core/} blocks. Non-blank markup outside any
 * block becomes a {@code core/freeform} block.
 */
public final class BlockParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> ATTRS = new TypeReference<>() {
    };

    private static final Pattern DELIMITER = Pattern.compile(
            "<!--\\s+(/)?wp:([a-z][a-z0-9_-]*(?:/[a-z][a-z0-9_-]*)?)\\s+(?:(\\{.*?\\})\\s+)?(/)?-->",
            Pattern.DOTALL);

    private BlockParser() {
    }

    private static final class Frame {
        final String name;
        final Map<String, Object> attrs;
        final List<GutenbergBlock> inner = new ArrayList<>();
        final StringBuilder html = new StringBuilder();

        Frame(String name, Map<String, Object> attrs) {
            this.name = name;
            this.attrs = attrs;
        }
    }

    public static List<GutenbergBlock> parse(String postContent) {
        if (postContent == null) {
            throw new IllegalArgumentException("Post content must not be null");
        }
        Deque<Frame> stack = new ArrayDeque<>();
        Frame document = new Frame(null, Map.of());
        stack.push(document);

        Matcher matcher = DELIMITER.matcher(postContent);
        int position = 0;
        while (matcher.find()) {
            appendText(stack.peek(), postContent.substring(position, matcher.start()));
            position = matcher.end();

            String name = fullName(matcher.group(2));
            if (matcher.group(1) != null) {
                Frame closed = stack.pop();
                if (closed == document || !closed.name.equals(name)) {
                    throw new IllegalArgumentException("Unexpected closing delimiter for " + name
                            + " at offset " + matcher.start());
                }
                stack.peek().inner.add(new GutenbergBlock(closed.name, closed.attrs, closed.inner,
                        closed.html.toString()));
            } else if (matcher.group(4) != null) {
                stack.peek().inner.add(GutenbergBlock.leaf(name, attrs(matcher.group(3)), ""));
            } else {
                stack.push(new Frame(name, attrs(matcher.group(3))));
            }
        }
        appendText(stack.peek(), postContent.substring(position));
        if (stack.size() > 1) {
            throw new IllegalArgumentException("Unclosed block " + stack.peek().name);
        }
        return document.inner;
    }

    private static void appendText(Frame frame, String text) {
        String segment = trimOneNewline(text);
        if (frame.name == null) {
            if (!segment.isBlank()) {
                frame.inner.add(GutenbergBlock.leaf("core/freeform", Map.of(), segment.strip()));
            }
            return;
        }
        frame.html.append(segment);
    }

    private static String trimOneNewline(String text) {
        int start = text.startsWith("\n") ? 1 : 0;
        int end = text.length();
        if (end > start && text.endsWith("\n")) {
            end--;
        }
        return text.substring(start, end);
    }

    private static String fullName(String name) {
        return name.contains("/") ? name : BlockSerializer.CORE_PREFIX + name;
    }

    private static Map<String, Object> attrs(String json) {
        if (json == null) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(json, ATTRS);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed block attributes: " + json, e);
        }
    }
}
