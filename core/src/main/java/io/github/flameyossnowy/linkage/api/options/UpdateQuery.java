package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param updates column to new storage value
 */
public record UpdateQuery(
    @NotNull EntityModel<?> model,
    @NotNull Map<String, Object> updates,
    @NotNull List<WhereParam> filters
) implements Query {
    public UpdateQuery {
        updates = Collections.unmodifiableMap(new LinkedHashMap<>(updates));
        filters = List.copyOf(filters);
    }
}
