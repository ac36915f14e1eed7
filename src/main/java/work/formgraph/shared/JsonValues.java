package work.formgraph.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for the plain JSON-compatible values (maps, lists, scalars) exchanged at the engine boundary.
 */
public final class JsonValues {
    private JsonValues() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asArray(Object value) {
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        return null;
    }

    public static Map<String, Object> objectAt(Map<String, Object> source, String key) {
        return source == null ? null : asObject(source.get(key));
    }

    public static List<Object> arrayAt(Map<String, Object> source, String key) {
        return source == null ? null : asArray(source.get(key));
    }

    public static String stringAt(Map<String, Object> source, String key) {
        if (source == null) {
            return null;
        }
        return source.get(key) instanceof String str ? str : null;
    }

    public static Number numberAt(Map<String, Object> source, String key) {
        if (source == null) {
            return null;
        }
        return source.get(key) instanceof Number num ? num : null;
    }

    public static Integer integerAt(Map<String, Object> source, String key) {
        Number num = numberAt(source, key);
        return num == null ? null : num.intValue();
    }

    public static Boolean booleanAt(Map<String, Object> source, String key) {
        if (source == null) {
            return null;
        }
        return source.get(key) instanceof Boolean flag ? flag : null;
    }

    public static List<String> stringsAt(Map<String, Object> source, String key) {
        List<Object> raw = arrayAt(source, key);
        if (raw == null) {
            return null;
        }
        var out = new ArrayList<String>(raw.size());
        for (Object item : raw) {
            if (item != null) {
                out.add(String.valueOf(item));
            }
        }
        return out;
    }

    /**
     * Parses numbers given either as JSON numbers or as numeric strings.
     */
    public static Optional<Number> toNumber(Object value) {
        if (value instanceof Number num) {
            return Optional.of(num);
        }
        if (value instanceof String str && !str.isBlank()) {
            String trimmed = str.trim();
            try {
                if (trimmed.contains(".") || trimmed.contains("e") || trimmed.contains("E")) {
                    return Optional.of(Double.parseDouble(trimmed));
                }
                long parsed = Long.parseLong(trimmed);
                if (parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE) {
                    return Optional.of((int) parsed);
                }
                return Optional.of(parsed);
            } catch (NumberFormatException ignored) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopyObject(Map<String, Object> value) {
        return value == null ? null : (Map<String, Object>) deepCopy(value);
    }

    /**
     * Returns a deep, read-only copy. Used for documents handed out from caches.
     */
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> freezeObject(Map<String, Object> value) {
        return (Map<String, Object>) freeze(value);
    }
}
