package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.exceptions.DeferredLookupFailedException;
import io.github.flameyossnowy.linkage.api.exceptions.NotFoundForConditionException;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.options.ColumnSelection;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves queued {@link DeferredLookup}s against a connection or transaction and assigns the keys.
 * <p>
 * Lookups run one after another in queue order. The first miss fails the whole write with
 * {@link NotFoundForConditionException}; keys already assigned by earlier lookups are not rolled back
 * here, the surrounding transaction takes care of that.
 */
public final class DeferredLookupResolver {
    private final EntityRegistry registry;

    public DeferredLookupResolver(@NotNull EntityRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param parentKey key of the row inserted just before, required by {@link DeferredLookup.ParentKey} entries
     */
    public <T> @NotNull CompletableFuture<Void> resolveAll(
        @NotNull ConnectionLike connection,
        @NotNull List<DeferredLookup> lookups,
        @NotNull ActiveModel<T> target,
        @Nullable Key parentKey
    ) {
        if (lookups.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return Futures.sequential(lookups, lookup -> resolve(connection, lookup, parentKey)
                .thenAccept(key -> assign(target, lookup.assignField(), key)))
            .thenApply(ignored -> null);
    }

    /**
     * The primary key of the single row of {@code model} matching {@code condition}.
     */
    public @NotNull CompletableFuture<Key> lookupKey(
        @NotNull ConnectionLike connection,
        @NotNull EntityModel<?> model,
        @NotNull UniqueWhere condition
    ) {
        return Futures.defer(() -> {
            FieldModel<?> primaryKey = model.getPrimaryKey();
            if (primaryKey.name().equals(condition.field())) {
                return CompletableFuture.completedFuture(Key.of(primaryKey.fromDbValue(condition.value())));
            }

            model.requireField(condition.field());
            SelectQuery query = new SelectQuery.Builder(model)
                .columns(List.of(new ColumnSelection(primaryKey.columnName(), primaryKey.name())))
                .where(condition.toFilter())
                .limit(1)
                .build();

            Logging.deepInfo(() -> "Resolving " + model.entityName() + " where " + condition);
            return connection.select(query).thenApply(rows -> {
                if (rows.isEmpty()) {
                    throw new NotFoundForConditionException(model.entityName(), condition.toString());
                }
                Object raw = rows.get(0).getAny(primaryKey.name(), primaryKey.columnName());
                return Key.of(primaryKey.fromDbValue(raw));
            });
        });
    }

    private CompletableFuture<Key> resolve(ConnectionLike connection, DeferredLookup lookup, @Nullable Key parentKey) {
        if (lookup instanceof DeferredLookup.ParentKey) {
            if (parentKey == null) {
                return CompletableFuture.failedFuture(
                    new DeferredLookupFailedException("Parent key for '" + lookup.assignField() + "' is not known yet"));
            }
            return CompletableFuture.completedFuture(parentKey);
        }
        DeferredLookup.ByCondition byCondition = (DeferredLookup.ByCondition) lookup;
        return lookupKey(connection, registry.requireModel(byCondition.targetEntity()), byCondition.condition());
    }

    private static void assign(ActiveModel<?> target, String field, Key key) {
        Logging.deepInfo(() -> "Assigning " + key + " to " + target.model().entityName() + '.' + field);
        target.set(field, key.toDbValue());
    }
}
