package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import org.jetbrains.annotations.NotNull;

/**
 * A foreign key that cannot be assigned until the write runs against a connection.
 * <p>
 * Lookups are created while a write is planned and consumed exactly once, in creation order, right
 * before the owning row is inserted or updated. They are never retried.
 */
public sealed interface DeferredLookup permits DeferredLookup.ByCondition, DeferredLookup.ParentKey {

    /**
     * The field on the write model that receives the resolved key.
     */
    @NotNull String assignField();

    /**
     * Resolve {@code condition} to the primary key of a {@code targetEntity} row.
     */
    record ByCondition(@NotNull String targetEntity, @NotNull UniqueWhere condition, @NotNull String assignField) implements DeferredLookup {}

    /**
     * Take the key of the parent row inserted just before this one.
     */
    record ParentKey(@NotNull String assignField) implements DeferredLookup {}
}
