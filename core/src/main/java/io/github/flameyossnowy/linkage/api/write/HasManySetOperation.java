package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Replaces the members of a has-many relation with exactly the given rows.
 * <p>
 * Current members that are not in the new set are detached: their foreign key is cleared when it is
 * nullable, otherwise they are deleted. The new members are then pointed at the parent.
 */
public final class HasManySetOperation {
    private final RelationDescriptor<?> descriptor;
    private final EntityModel<?> target;
    private final List<UniqueWhere> targets;

    public HasManySetOperation(@NotNull RelationDescriptor<?> descriptor, @NotNull EntityModel<?> target, @NotNull List<UniqueWhere> targets) {
        this.descriptor = descriptor;
        this.target = target;
        this.targets = List.copyOf(targets);
    }

    public @NotNull RelationDescriptor<?> descriptor() {
        return descriptor;
    }

    public @NotNull List<UniqueWhere> targets() {
        return targets;
    }

    public @NotNull CompletableFuture<Void> run(@NotNull ConnectionLike connection, @NotNull Key parentKey, @NotNull DeferredLookupResolver resolver) {
        return Futures.sequential(targets, condition -> resolver.lookupKey(connection, target, condition))
            .thenCompose(keys -> {
                List<Object> ids = new ArrayList<>(keys.size());
                for (Key key : keys) {
                    ids.add(key.toDbValue());
                }
                Logging.info(() -> "Setting " + descriptor.name() + " of " + parentKey + " to " + ids);
                return detach(connection, parentKey, ids).thenCompose(ignored -> attach(connection, parentKey, ids));
            });
    }

    private CompletableFuture<Long> detach(ConnectionLike connection, Key parentKey, List<Object> ids) {
        String foreignKey = descriptor.foreignKeyField();
        Filter ownedByParent = Filter.equals(foreignKey, parentKey.toDbValue());

        if (descriptor.isForeignKeyNullable()) {
            Map<String, Object> clear = new HashMap<>();
            clear.put(target.columnOf(foreignKey), null);
            return connection.update(new UpdateQuery(target, clear, List.of(ownedByParent)));
        }

        List<WhereParam> where = new ArrayList<>(2);
        where.add(ownedByParent);
        if (!ids.isEmpty()) {
            where.add(Filter.notIn(target.getPrimaryKey().name(), ids));
        }
        return connection.delete(new DeleteQuery(target, where));
    }

    private CompletableFuture<Void> attach(ConnectionLike connection, Key parentKey, List<Object> ids) {
        if (ids.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        FieldModel<?> foreignKey = target.requireField(descriptor.foreignKeyField());
        Map<String, Object> assign = new HashMap<>();
        assign.put(foreignKey.columnName(), foreignKey.toDbValue(foreignKey.fromDbValue(parentKey.toDbValue())));
        UpdateQuery query = new UpdateQuery(target, assign, List.of(Filter.in(target.getPrimaryKey().name(), ids)));
        return connection.update(query).thenApply(ignored -> null);
    }
}
