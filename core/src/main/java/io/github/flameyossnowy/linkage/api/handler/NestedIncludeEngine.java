package io.github.flameyossnowy.linkage.api.handler;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.linkage.api.fetch.EntityFetcher;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.result.RelationNode;
import io.github.flameyossnowy.linkage.api.result.RelationValue;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Loads requested relations into result nodes, depth first.
 * <p>
 * Relations are processed one at a time and every fetch is awaited before the next starts, so a
 * connection or transaction handle is never used concurrently. For each requested relation:
 * <ol>
 *     <li>the descriptor is looked up on the node's entity and the foreign key is read;</li>
 *     <li>a belongs-to relation with no foreign key is left unloaded;</li>
 *     <li>a count-only request stores the related row count and loads nothing;</li>
 *     <li>otherwise the related rows are fetched, their own includes are loaded, and the result is stored.</li>
 * </ol>
 * Depth is bounded only by the include tree.
 */
public final class NestedIncludeEngine {
    private final EntityRegistry registry;

    public NestedIncludeEngine(@NotNull EntityRegistry registry) {
        this.registry = registry;
    }

    public <N> @NotNull CompletableFuture<Void> apply(
        @NotNull ConnectionLike connection,
        @NotNull RelationNode<?, N> node,
        @NotNull List<RelationFilter> includes,
        @NotNull ProjectionMode<N> mode
    ) {
        if (includes.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return Futures.sequential(distinctRelations(node, includes), include -> applyOne(connection, node, include, mode))
            .thenApply(ignored -> null);
    }

    /**
     * Loads the same includes into each node in turn.
     */
    public <N> @NotNull CompletableFuture<Void> applyAll(
        @NotNull ConnectionLike connection,
        @NotNull List<N> nodes,
        @NotNull List<RelationFilter> includes,
        @NotNull ProjectionMode<N> mode
    ) {
        if (includes.isEmpty() || nodes.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return Futures.sequential(nodes, node -> apply(connection, mode.asNode(node), includes, mode))
            .thenApply(ignored -> null);
    }

    private <T, N> CompletableFuture<Void> applyOne(
        ConnectionLike connection,
        RelationNode<T, N> node,
        RelationFilter include,
        ProjectionMode<N> mode
    ) {
        return Futures.defer(() -> {
            String entityName = node.entityModel().entityName();
            RelationDescriptor<T> descriptor = node.entityModel().getRelationDescriptor(include.relation())
                .orElseThrow(() -> new RelationNotFoundException(entityName, include.relation()));

            Optional<Key> foreignKey = descriptor.getForeignKey(node.entity());
            if (foreignKey.isEmpty() && !descriptor.isHasMany()) {
                Logging.deepInfo(() -> "Skipping " + entityName + '.' + descriptor.name() + ": foreign key is not set");
                return CompletableFuture.completedFuture(null);
            }

            EntityFetcher fetcher = registry.requireFetcher(entityName);

            if (include.isCountOnly()) {
                return fetcher.countByForeignKey(connection, foreignKey, descriptor.name(), include)
                    .thenAccept(count -> node.counts().put(descriptor.name(), count));
            }

            Logging.deepInfo(() -> "Including " + entityName + '.' + descriptor.name() + " (" + mode + ')');
            return mode.fetch(fetcher, connection, foreignKey, descriptor, include)
                .thenCompose(value -> loadChildren(connection, value, include, mode).thenApply(ignored -> value))
                .thenCompose(value -> {
                    if (!include.includeCount()) {
                        return CompletableFuture.completedFuture(value);
                    }
                    return fetcher.countByForeignKey(connection, foreignKey, descriptor.name(), include)
                        .thenApply(count -> {
                            node.counts().put(descriptor.name(), count);
                            return value;
                        });
                })
                .thenAccept(value -> descriptor.setField(node, value));
        });
    }

    private <N> CompletableFuture<Void> loadChildren(
        ConnectionLike connection,
        RelationValue<N> value,
        RelationFilter include,
        ProjectionMode<N> mode
    ) {
        if (include.nestedIncludes().isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return applyAll(connection, value.nodes(), include.nestedIncludes(), mode);
    }

    private static List<RelationFilter> distinctRelations(RelationNode<?, ?> node, List<RelationFilter> includes) {
        Set<String> seen = new LinkedHashSet<>();
        List<RelationFilter> unique = new ArrayList<>(includes.size());
        for (RelationFilter include : includes) {
            if (seen.add(include.relation())) {
                unique.add(include);
            } else {
                Logging.warn("Relation '" + include.relation() + "' of " + node.entityModel().entityName()
                    + " was included more than once, only the first include is used");
            }
        }
        return unique;
    }
}
