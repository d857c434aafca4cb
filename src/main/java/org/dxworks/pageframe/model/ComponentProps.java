package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builder-neutral content properties of a component.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ComponentProps {
    // Content
    public String textContent;
    public String innerHTML;

    // Links
    public String href;
    public String target;

    // Media
    public String src;
    public String alt;
    public String poster;

    // Form
    public String type;
    public String name;
    public String placeholder;
    public String value;
    public Boolean required;

    // Layout
    public String width;
    public String height;

    public String className;
    public String elementId;
    public Integer headingLevel;
    public Boolean ordered;
    public List<String> items = new ArrayList<>(); // list items, options, slides, tab titles
    public List<String> mediaUrls = new ArrayList<>(); // gallery/carousel image sources
    public List<List<String>> tableRows = new ArrayList<>();

    public Map<String, String> dataAttributes = new LinkedHashMap<>();
    public Map<String, String> ariaAttributes = new LinkedHashMap<>();
}
