package org.dxworks.pageframe.dom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One element of a parsed page, as produced by the cloning stage: tag,
 * attributes, own text, resolved styles and ordered children.
 * <p>
 * Style maps accept kebab-case or camelCase property names. Responsive keys are
 * {@code desktop}, {@code laptop}, {@code tablet}, {@code mobile} or a custom
 * {@code min-<px>} / {@code max-<px>} breakpoint; state keys are {@code hover},
 * {@code focus}, {@code active}, {@code before} and {@code after}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class DomNode {
    public String tagName;
    public Map<String, String> attributes = new LinkedHashMap<>();
    public String text;
    public Map<String, String> computedStyles = new LinkedHashMap<>();
    public Map<String, Map<String, String>> responsiveStyles = new LinkedHashMap<>();
    public Map<String, Map<String, String>> stateStyles = new LinkedHashMap<>();
    public DomRect rect;
    public List<DomNode> children = new ArrayList<>();

    public DomNode() {
    }

    public DomNode(String tagName) {
        this.tagName = tagName;
    }

    public static DomNode element(String tagName) {
        return new DomNode(tagName);
    }

    public DomNode attr(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    public DomNode text(String text) {
        this.text = text;
        return this;
    }

    public DomNode style(String property, String value) {
        computedStyles.put(property, value);
        return this;
    }

    public DomNode responsive(String viewport, String property, String value) {
        responsiveStyles.computeIfAbsent(viewport, k -> new LinkedHashMap<>()).put(property, value);
        return this;
    }

    public DomNode state(String state, String property, String value) {
        stateStyles.computeIfAbsent(state, k -> new LinkedHashMap<>()).put(property, value);
        return this;
    }

    public DomNode rect(double x, double y, double width, double height) {
        this.rect = new DomRect(x, y, width, height);
        return this;
    }

    public DomNode child(DomNode... nodes) {
        children.addAll(List.of(nodes));
        return this;
    }
}
