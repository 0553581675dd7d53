package com.overseer.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalises the open key-value maps carried by requests, messages and directives.
 * <p>
 * Values are kept when they are strings, numbers, booleans, nested maps or lists of those
 * (any collection becomes a list).
 * Enums are stored by name and any other value by its {@code toString()}, so copying never
 * fails. The result keeps insertion order and is unmodifiable.
 */
public final class ContextValues {

    private ContextValues() {} // utility class

    public static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), normalise(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object normalise(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            var nested = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                nested.put(String.valueOf(entry.getKey()), normalise(entry.getValue()));
            }
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Collection<?> list) {
            var items = new ArrayList<Object>(list.size());
            for (Object item : list) {
                items.add(normalise(item));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(value);
    }
}
