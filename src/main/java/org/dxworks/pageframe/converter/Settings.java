package org.dxworks.pageframe.converter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered settings map that skips absent values, so exports only
 * carry what the source page declared.
 */
public final class Settings {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Settings() {
    }

    public static Settings create() {
        return new Settings();
    }

    public Settings put(String key, Object value) {
        if (value == null) {
            return this;
        }
        if (value instanceof String && ((String) value).isBlank()) {
            return this;
        }
        if (value instanceof Collection && ((Collection<?>) value).isEmpty()) {
            return this;
        }
        if (value instanceof Map && ((Map<?, ?>) value).isEmpty()) {
            return this;
        }
        values.put(key, value);
        return this;
    }

    public Settings putAll(Map<String, Object> other) {
        other.forEach(this::put);
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> build() {
        return values;
    }
}
