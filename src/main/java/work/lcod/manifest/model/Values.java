package work.lcod.manifest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions from the decoded manifest tree. Inputs have passed schema validation, so mismatching shapes
 * simply read as absent.
 */
final class Values {
    private Values() {}

    /**
     * Read-only copy of {@code map}; nested mappings and lists are copied and wrapped too.
     */
    @SuppressWarnings("unchecked")
    static <K, V> Map<K, V> freeze(Map<K, V> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<K, V>();
        map.forEach((key, value) -> copy.put(key, (V) deepFreeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    static <T> List<T> freeze(List<T> list) {
        if (list == null || list.isEmpty()) {
            return List.of();
        }
        var copy = new ArrayList<T>(list.size());
        for (var item : list) {
            copy.add((T) deepFreeze(item));
        }
        return Collections.unmodifiableList(copy);
    }

    private static Object deepFreeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freeze(map);
        }
        if (value instanceof List<?> list) {
            return freeze(list);
        }
        return value;
    }

    static Optional<String> string(Map<String, Object> map, String key) {
        return map.get(key) instanceof String str ? Optional.of(str) : Optional.empty();
    }

    static String string(Map<String, Object> map, String key, String fallback) {
        return string(map, key).orElse(fallback);
    }

    static List<String> strings(Object value) {
        if (value instanceof String str) {
            return List.of(str);
        }
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        var out = new ArrayList<String>(list.size());
        for (var item : list) {
            if (item != null) {
                out.add(String.valueOf(item));
            }
        }
        return out;
    }

    static Map<String, Object> object(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    static Map<String, String> stringValues(Object value) {
        var out = new LinkedHashMap<String, String>();
        object(value).forEach((key, raw) -> {
            if (raw != null) {
                out.put(key, String.valueOf(raw));
            }
        });
        return out;
    }
}
