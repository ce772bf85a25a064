package io.github.flameyossnowy.linkage.api.connection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One result row as returned by the storage layer, keyed by column label.
 * Label lookup ignores case.
 */
public final class Row {
    private final Map<String, Object> values;
    private final Map<String, String> labels = new LinkedHashMap<>();

    public Row(@NotNull Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
        for (String label : values.keySet()) {
            labels.putIfAbsent(label.toLowerCase(Locale.ROOT), label);
        }
    }

    public static Row of(Object... labelsAndValues) {
        if (labelsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected label/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < labelsAndValues.length; i += 2) {
            map.put((String) labelsAndValues[i], labelsAndValues[i + 1]);
        }
        return new Row(map);
    }

    public boolean contains(@NotNull String label) {
        return labels.containsKey(label.toLowerCase(Locale.ROOT));
    }

    public boolean containsAny(@NotNull String... candidates) {
        for (String candidate : candidates) {
            if (contains(candidate)) return true;
        }
        return false;
    }

    public @Nullable Object get(@NotNull String label) {
        String actual = labels.get(label.toLowerCase(Locale.ROOT));
        return actual == null ? null : values.get(actual);
    }

    /**
     * The value of the first candidate label present in this row.
     */
    public @Nullable Object getAny(@NotNull String... candidates) {
        for (String candidate : candidates) {
            if (contains(candidate)) return get(candidate);
        }
        return null;
    }

    public @Nullable Long getLong(@NotNull String label) {
        Object value = get(label);
        if (value == null) return null;
        if (value instanceof Number number) return number.longValue();
        return Long.parseLong(value.toString());
    }

    public @Nullable Double getDouble(@NotNull String label) {
        Object value = get(label);
        if (value == null) return null;
        if (value instanceof Number number) return number.doubleValue();
        return Double.parseDouble(value.toString());
    }

    public @NotNull Set<String> labels() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public @NotNull Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
