package io.gdcc.healthdcat.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One tabular row: an ordered mapping from column name to a scalar value. Values are {@link
 * String}, {@link Number}, {@link Boolean} or {@code null} for an empty cell.
 *
 * <p>Records are immutable; the {@code with*} methods return modified copies so a stage never
 * changes a record another stage still holds.
 */
public final class Record {
    private final Map<String, Object> values;

    private Record(Map<String, Object> values) {
        this.values = values;
    }

    public static Record of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach(
                (column, value) -> {
                    Objects.requireNonNull(column, "column name");
                    copy.put(column, checkScalar(column, value));
                });
        return new Record(Collections.unmodifiableMap(copy));
    }

    /** Builds a record from alternating column/value arguments. */
    public static Record of(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected column/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            map.put(String.valueOf(columnsAndValues[i]), columnsAndValues[i + 1]);
        }
        return of(map);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public List<String> columnList() {
        return List.copyOf(values.keySet());
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        return values.get(column);
    }

    /** String form of the value, or {@code null} when absent or empty. */
    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    /** True when the column is absent, null, or only whitespace. */
    public boolean isBlank(String column) {
        String value = getString(column);
        return value == null || value.isBlank();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public Record with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(Objects.requireNonNull(column, "column"), checkScalar(column, value));
        return new Record(Collections.unmodifiableMap(copy));
    }

    public Record without(String column) {
        if (!values.containsKey(column)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(column);
        return new Record(Collections.unmodifiableMap(copy));
    }

    /**
     * Renames columns in place, keeping their positions. All renames read the original record, so
     * {@code {a=b, b=a}} swaps two columns. A rename onto a column that is not itself renamed
     * replaces that column's value and drops its old position.
     *
     * @param renames old column name to new column name
     */
    public Record renamed(Map<String, String> renames) {
        Set<String> replaced = new HashSet<>();
        renames.forEach(
                (from, to) -> {
                    if (values.containsKey(from) && !from.equals(to)) {
                        replaced.add(to);
                    }
                });
        if (replaced.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach(
                (column, value) -> {
                    String to = renames.get(column);
                    if (to != null) {
                        copy.put(to, value);
                    } else if (!replaced.contains(column)) {
                        copy.put(column, value);
                    }
                });
        return new Record(Collections.unmodifiableMap(copy));
    }

    private static Object checkScalar(String column, Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException(
                "Column '"
                        + column
                        + "' holds a non-scalar value of type "
                        + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Record)) {
            return false;
        }
        return values.equals(((Record) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
