package io.gdcc.healthdcat.plugin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable key/value options handed to a stage. Values keep whatever type the caller supplied;
 * the typed accessors also accept string forms (e.g. {@code "true"}, {@code "a,b"}) so options
 * read from properties files work unchanged.
 */
public final class StageOptions {
    private static final StageOptions EMPTY = new StageOptions(Collections.emptyMap());

    private final Map<String, Object> values;

    private StageOptions(Map<String, Object> values) {
        this.values = values;
    }

    public static StageOptions empty() {
        return EMPTY;
    }

    public static StageOptions of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new StageOptions(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static StageOptions of(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return of(map);
    }

    public StageOptions with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(Objects.requireNonNull(key, "key"), value);
        return new StageOptions(Collections.unmodifiableMap(copy));
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public String getString(String key, String defaultValue) {
        String value = getString(key);
        return (value == null || value.isBlank()) ? defaultValue : value;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? defaultValue : Boolean.parseBoolean(s);
    }

    /** A collection value, or a comma separated string. Blank entries are dropped. */
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?>) {
            for (Object item : (Collection<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    out.add(item.toString().trim());
                }
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return List.copyOf(out);
    }

    /** A map value with string keys and values, in the caller's iteration order. */
    public Map<String, String> getStringMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(
                    "Option '" + key + "' must be a map but was " + value.getClass().getName());
        }
        Map<String, String> out = new LinkedHashMap<>();
        ((Map<?, ?>) value)
                .forEach(
                        (k, v) -> {
                            if (k != null && v != null) {
                                out.put(k.toString(), v.toString());
                            }
                        });
        return Collections.unmodifiableMap(out);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "StageOptions" + values;
    }
}
