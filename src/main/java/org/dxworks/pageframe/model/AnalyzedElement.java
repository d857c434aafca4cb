package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One DOM node after style normalization. Instances are immutable once the
 * analyzer returns them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyzedElement {
    public final String tagName;
    public final String id;
    public final List<String> classes;
    public final Map<String, String> attributes;
    public final String textContent;
    public final String innerHTML;
    @JsonIgnore
    public final String outerHTML;
    public final ExtractedStyles styles;
    public final ResponsiveStyles responsiveStyles; // nullable
    public final InteractiveStates interactiveStates; // nullable
    public final ElementContext context;
    public final List<AnalyzedElement> children;
    public final ElementPosition position;

    public AnalyzedElement(String tagName,
                           Map<String, String> attributes,
                           String textContent,
                           String innerHTML,
                           String outerHTML,
                           ExtractedStyles styles,
                           ResponsiveStyles responsiveStyles,
                           InteractiveStates interactiveStates,
                           ElementContext context,
                           List<AnalyzedElement> children,
                           ElementPosition position) {
        this.tagName = tagName.toLowerCase(Locale.ROOT);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.id = this.attributes.get("id");
        this.classes = splitClasses(this.attributes.get("class"));
        this.textContent = textContent;
        this.innerHTML = innerHTML;
        this.outerHTML = outerHTML;
        this.styles = styles;
        this.responsiveStyles = responsiveStyles;
        this.interactiveStates = interactiveStates;
        this.context = context;
        this.children = List.copyOf(children);
        this.position = position;
    }

    public String attr(String name) {
        return attributes.get(name);
    }

    public boolean isTag(String... tags) {
        for (String tag : tags) {
            if (tagName.equals(tag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Case-insensitive substring match of any keyword against any class name.
     */
    public boolean hasClassKeyword(List<String> keywords) {
        for (String cls : classes) {
            String lower = cls.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    public long countChildren(String... tags) {
        return children.stream().filter(c -> c.isTag(tags)).count();
    }

    public boolean hasDescendant(String... tags) {
        for (AnalyzedElement child : children) {
            if (child.isTag(tags) || child.hasDescendant(tags)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of elements in this subtree, this element included.
     */
    public int subtreeSize() {
        int size = 1;
        for (AnalyzedElement child : children) {
            size += child.subtreeSize();
        }
        return size;
    }

    private static List<String> splitClasses(String classAttr) {
        if (classAttr == null || classAttr.isBlank()) {
            return List.of();
        }
        return List.of(classAttr.trim().split("\\s+"));
    }
}
