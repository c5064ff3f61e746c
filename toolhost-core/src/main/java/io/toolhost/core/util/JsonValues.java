package io.toolhost.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Helpers for JSON values held as plain maps and lists.
///
/// Keeps the core module free of a JSON library; the server module converts
/// Jackson trees into these shapes before they reach core types.
public final class JsonValues {

    private JsonValues() {}

    /// Copies a JSON object into unmodifiable maps and lists, recursively.
    ///
    /// Key order and JSON `null` values are kept, so `Map.copyOf` cannot be used.
    ///
    /// @param value the object to copy, may be null
    /// @return immutable deep copy, empty for null
    public static Map<String, Object> immutableCopy(Map<String, ?> value) {
        if (value == null) {
            return Map.of();
        }
        return copyMap(value);
    }

    private static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(copy(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Map<String, Object> copyMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copy(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
