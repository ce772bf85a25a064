package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

/**
 * Storage-facing query descriptions handed to a {@code ConnectionLike}.
 * <p>
 * They are backend-agnostic: filters use logical field names and the entity model, and rendering to a
 * concrete query language is left to the storage layer.
 */
public sealed interface Query permits SelectQuery, CountQuery, InsertQuery, UpdateQuery, DeleteQuery, AggregationQuery {

    @NotNull EntityModel<?> model();

    static SelectQuery.Builder select(@NotNull EntityModel<?> model) {
        return new SelectQuery.Builder(model);
    }
}
