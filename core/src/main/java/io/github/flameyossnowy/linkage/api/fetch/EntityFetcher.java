package io.github.flameyossnowy.linkage.api.fetch;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.result.RelationValue;
import io.github.flameyossnowy.linkage.api.result.Selected;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Loads the rows related to one entity through one of its relations.
 * <p>
 * A fetcher is registered per entity and serves that entity's own relations. When {@code foreignKey}
 * is empty on a belongs-to relation the fetcher completes with an empty single value and does no I/O.
 */
public interface EntityFetcher {

    /**
     * @param foreignKey       the value read through {@code RelationDescriptor.getForeignKey}
     * @param foreignKeyColumn the relation's foreign key column
     * @param targetEntity     name of the related entity
     * @param relationName     relation on the fetcher's entity
     * @param filter           predicates, ordering and pagination for the related rows
     */
    @NotNull CompletableFuture<RelationValue<ModelWithRelations<?>>> fetchByForeignKey(
        @NotNull ConnectionLike connection,
        @NotNull Optional<Key> foreignKey,
        @NotNull String foreignKeyColumn,
        @NotNull String targetEntity,
        @NotNull String relationName,
        @NotNull RelationFilter filter
    );

    /**
     * Same as {@link #fetchByForeignKey} but loads only the fields the filter selects, plus the key fields
     * its nested includes need.
     */
    @NotNull CompletableFuture<RelationValue<Selected<?>>> fetchByForeignKeyWithSelection(
        @NotNull ConnectionLike connection,
        @NotNull Optional<Key> foreignKey,
        @NotNull String foreignKeyColumn,
        @NotNull String targetEntity,
        @NotNull String relationName,
        @NotNull RelationFilter filter
    );

    /**
     * Counts related rows matching the filter's predicates. Pagination is ignored.
     */
    @NotNull CompletableFuture<Long> countByForeignKey(
        @NotNull ConnectionLike connection,
        @NotNull Optional<Key> foreignKey,
        @NotNull String relationName,
        @NotNull RelationFilter filter
    );
}
