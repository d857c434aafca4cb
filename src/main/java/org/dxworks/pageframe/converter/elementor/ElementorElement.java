package org.dxworks.pageframe.converter.elementor;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Section, column or widget of an Elementor document. Sections hold columns,
 * columns hold widgets and inner sections.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementorElement {
    public final String id;
    public final String elType;
    public final Boolean isInner;
    public final String widgetType;
    public final Map<String, Object> settings;
    public final List<ElementorElement> elements;

    private ElementorElement(String id, String elType, Boolean isInner, String widgetType,
                             Map<String, Object> settings, List<ElementorElement> elements) {
        this.id = id;
        this.elType = elType;
        this.isInner = isInner;
        this.widgetType = widgetType;
        this.settings = settings;
        this.elements = List.copyOf(elements);
    }

    public static ElementorElement section(String id, boolean inner, Map<String, Object> settings,
                                           List<ElementorElement> columns) {
        return new ElementorElement(id, "section", inner, null, settings, columns);
    }

    public static ElementorElement column(String id, boolean inner, Map<String, Object> settings,
                                          List<ElementorElement> elements) {
        return new ElementorElement(id, "column", inner, null, settings, elements);
    }

    public static ElementorElement widget(String id, String widgetType, Map<String, Object> settings) {
        return new ElementorElement(id, "widget", null, widgetType, settings, List.of());
    }
}
