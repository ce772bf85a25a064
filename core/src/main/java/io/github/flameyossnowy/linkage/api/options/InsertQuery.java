package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inserts one row.
 *
 * @param values column to storage value, in insertion order
 */
public record InsertQuery(@NotNull EntityModel<?> model, @NotNull Map<String, Object> values) implements Query {
    public InsertQuery {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
