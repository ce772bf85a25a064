package io.github.flameyossnowy.linkage.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An equality condition on a primary-key or unique field, identifying at most one row.
 */
public record UniqueWhere(@NotNull String field, @NotNull Object value) {
    public UniqueWhere {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    public static UniqueWhere of(String field, Object value) {
        return new UniqueWhere(field, value);
    }

    public Filter toFilter() {
        return Filter.equals(field, value);
    }

    @Override
    public String toString() {
        return field + " = " + value;
    }
}
