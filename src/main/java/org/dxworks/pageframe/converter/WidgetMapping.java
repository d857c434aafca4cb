package org.dxworks.pageframe.converter;

import java.util.Map;

/**
 * A builder-native widget name with its settings. Mappings produced by the
 * default arm of a converter's type switch are not explicit; HTML fallbacks
 * are neither explicit nor native.
 */
public final class WidgetMapping {
    public final String name;
    public final Map<String, Object> settings;
    public final boolean explicit;
    public final boolean htmlFallback;

    private WidgetMapping(String name, Map<String, Object> settings, boolean explicit, boolean htmlFallback) {
        this.name = name;
        this.settings = settings;
        this.explicit = explicit;
        this.htmlFallback = htmlFallback;
    }

    public static WidgetMapping of(String name, Map<String, Object> settings) {
        return new WidgetMapping(name, settings, true, false);
    }

    public static WidgetMapping unmapped(String name, Map<String, Object> settings) {
        return new WidgetMapping(name, settings, false, false);
    }

    public static WidgetMapping fallback(String name, Map<String, Object> settings) {
        return new WidgetMapping(name, settings, false, true);
    }
}
