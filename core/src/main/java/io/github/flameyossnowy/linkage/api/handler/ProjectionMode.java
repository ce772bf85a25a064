package io.github.flameyossnowy.linkage.api.handler;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.fetch.EntityFetcher;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.result.RelationNode;
import io.github.flameyossnowy.linkage.api.result.RelationValue;
import io.github.flameyossnowy.linkage.api.result.Selected;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * How the include engine loads related rows: as full models or as partial projections.
 *
 * @param <N> the node type produced for related rows
 */
public interface ProjectionMode<N> {

    @NotNull CompletableFuture<RelationValue<N>> fetch(
        @NotNull EntityFetcher fetcher,
        @NotNull ConnectionLike connection,
        @NotNull Optional<Key> foreignKey,
        @NotNull RelationDescriptor<?> descriptor,
        @NotNull RelationFilter filter
    );

    @NotNull RelationNode<?, N> asNode(@NotNull N node);

    ProjectionMode<ModelWithRelations<?>> FULL = new ProjectionMode<>() {
        @Override
        public @NotNull CompletableFuture<RelationValue<ModelWithRelations<?>>> fetch(
            @NotNull EntityFetcher fetcher,
            @NotNull ConnectionLike connection,
            @NotNull Optional<Key> foreignKey,
            @NotNull RelationDescriptor<?> descriptor,
            @NotNull RelationFilter filter
        ) {
            return fetcher.fetchByForeignKey(connection, foreignKey, descriptor.foreignKeyColumn(),
                descriptor.targetEntity(), descriptor.name(), filter);
        }

        @Override
        public @NotNull RelationNode<?, ModelWithRelations<?>> asNode(@NotNull ModelWithRelations<?> node) {
            return node;
        }

        @Override
        public String toString() {
            return "FULL";
        }
    };

    ProjectionMode<Selected<?>> SELECTED = new ProjectionMode<>() {
        @Override
        public @NotNull CompletableFuture<RelationValue<Selected<?>>> fetch(
            @NotNull EntityFetcher fetcher,
            @NotNull ConnectionLike connection,
            @NotNull Optional<Key> foreignKey,
            @NotNull RelationDescriptor<?> descriptor,
            @NotNull RelationFilter filter
        ) {
            return fetcher.fetchByForeignKeyWithSelection(connection, foreignKey, descriptor.foreignKeyColumn(),
                descriptor.targetEntity(), descriptor.name(), filter);
        }

        @Override
        public @NotNull RelationNode<?, Selected<?>> asNode(@NotNull Selected<?> node) {
            return node;
        }

        @Override
        public String toString() {
            return "SELECTED";
        }
    };
}
