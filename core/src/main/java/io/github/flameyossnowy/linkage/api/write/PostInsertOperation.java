package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Nested has-many rows created once the owning row has a key.
 * <p>
 * Each child is planned like a top-level create, with its foreign key taken from the parent.
 * Children may carry nested creates of their own, which run the same way after the child insert.
 */
public final class PostInsertOperation {
    private final RelationDescriptor<?> descriptor;
    private final EntityModel<?> target;
    private final List<List<SetParam>> rows;

    public PostInsertOperation(@NotNull RelationDescriptor<?> descriptor, @NotNull EntityModel<?> target, @NotNull List<List<SetParam>> rows) {
        this.descriptor = descriptor;
        this.target = target;
        this.rows = List.copyOf(rows);
    }

    public @NotNull RelationDescriptor<?> descriptor() {
        return descriptor;
    }

    public @NotNull List<List<SetParam>> rows() {
        return rows;
    }

    /**
     * @return the keys of the created children, in row order
     */
    public @NotNull CompletableFuture<List<Key>> run(@NotNull ConnectionLike connection, @NotNull Key parentKey, @NotNull WriteExecutor executor) {
        Logging.info(() -> "Creating " + rows.size() + " nested " + target.entityName() + " row(s) for " + descriptor.name() + " of " + parentKey);
        return Futures.sequential(rows, row -> createChild(connection, target, row, parentKey, executor));
    }

    private <C> CompletableFuture<Key> createChild(ConnectionLike connection, EntityModel<C> model, List<SetParam> row, Key parentKey, WriteExecutor executor) {
        return Futures.defer(() -> {
            WritePlan<C> plan = executor.planner().planCreate(model, row);
            List<DeferredLookup> lookups = new ArrayList<>(plan.lookups().size() + 1);
            lookups.add(new DeferredLookup.ParentKey(descriptor.foreignKeyField()));
            lookups.addAll(plan.lookups());
            WritePlan<C> withParent = new WritePlan<>(plan.active(), lookups, plan.postInsert(), plan.relationSets(), plan.atomics());
            return executor.insert(connection, withParent, parentKey);
        });
    }
}
