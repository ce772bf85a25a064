package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.exceptions.DatabaseException;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.InsertQuery;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs {@link WritePlan}s against a connection or transaction.
 * <p>
 * The executor itself never opens a transaction. Callers that need several statements to land together
 * pass in a {@link io.github.flameyossnowy.linkage.api.connection.DatabaseTransaction}.
 */
public final class WriteExecutor {
    private final WritePlanner planner;
    private final DeferredLookupResolver resolver;

    public WriteExecutor(@NotNull EntityRegistry registry) {
        this(new WritePlanner(registry), new DeferredLookupResolver(registry));
    }

    public WriteExecutor(@NotNull WritePlanner planner, @NotNull DeferredLookupResolver resolver) {
        this.planner = planner;
        this.resolver = resolver;
    }

    public @NotNull WritePlanner planner() {
        return planner;
    }

    public @NotNull DeferredLookupResolver resolver() {
        return resolver;
    }

    /**
     * Inserts the planned row: resolves lookups, inserts, then runs nested creates and relation sets with the new key.
     *
     * @param parentKey key substituted for {@link DeferredLookup.ParentKey} lookups, null for a top-level create
     * @return the key of the inserted row
     */
    public <T> @NotNull CompletableFuture<Key> insert(@NotNull ConnectionLike connection, @NotNull WritePlan<T> plan, @Nullable Key parentKey) {
        EntityModel<T> model = plan.active().model();
        return resolver.resolveAll(connection, plan.lookups(), plan.active(), parentKey)
            .thenCompose(ignored -> connection.insert(new InsertQuery(model, plan.active().toColumns())))
            .thenApply(generated -> keyOf(plan.active(), generated))
            .thenCompose(key -> {
                Logging.deepInfo(() -> "Inserted " + model.entityName() + ' ' + key);
                return afterWrite(connection, plan, key).thenApply(ignored -> key);
            });
    }

    /**
     * Applies the planned changes to an existing row.
     * <p>
     * Relation sets run first, then lookups are resolved, atomic operations are computed from
     * {@code current}, the changed scalars are written by primary key, and nested creates run last.
     *
     * @return the number of rows the scalar update touched, 0 when only relations changed
     */
    public <T> @NotNull CompletableFuture<Long> update(@NotNull ConnectionLike connection, @NotNull WritePlan<T> plan, @NotNull T current) {
        EntityModel<T> model = plan.active().model();
        return Futures.defer(() -> {
            Key key = model.primaryKeyOf(current);
            ActiveModel<T> active = ActiveModel.of(model, current);
            active.merge(plan.active());

            return applyRelationSets(connection, plan.relationSets(), key)
                .thenCompose(ignored -> resolver.resolveAll(connection, plan.lookups(), active, null))
                .thenCompose(ignored -> {
                    for (SetParam.Atomic atomic : plan.atomics()) {
                        applyAtomic(active, atomic);
                    }
                    Map<String, Object> changes = active.changedColumns();
                    if (changes.isEmpty()) {
                        return CompletableFuture.completedFuture(0L);
                    }
                    Filter byKey = Filter.equals(model.getPrimaryKey().name(), key.toDbValue());
                    return connection.update(new UpdateQuery(model, changes, List.of(byKey)));
                })
                .thenCompose(count -> runPostInsert(connection, plan.postInsert(), key).thenApply(ignored -> count));
        });
    }

    public @NotNull CompletableFuture<Void> applyRelationSets(@NotNull ConnectionLike connection, @NotNull List<HasManySetOperation> operations, @NotNull Key parentKey) {
        return Futures.sequential(operations, operation -> operation.run(connection, parentKey, resolver))
            .thenApply(ignored -> null);
    }

    private <T> CompletableFuture<Void> afterWrite(ConnectionLike connection, WritePlan<T> plan, Key key) {
        return runPostInsert(connection, plan.postInsert(), key)
            .thenCompose(ignored -> applyRelationSets(connection, plan.relationSets(), key));
    }

    private CompletableFuture<Void> runPostInsert(ConnectionLike connection, List<PostInsertOperation> operations, Key parentKey) {
        return Futures.sequential(operations, operation -> operation.run(connection, parentKey, this))
            .thenApply(ignored -> null);
    }

    private static <T> Key keyOf(ActiveModel<T> active, Optional<Object> generated) {
        FieldModel<T> primaryKey = active.model().getPrimaryKey();
        Object explicit = active.get(primaryKey.name());
        if (explicit != null) {
            return Key.of(explicit);
        }
        if (generated.isPresent()) {
            return Key.of(primaryKey.fromDbValue(generated.get()));
        }
        throw new DatabaseException("Insert into " + active.model().tableName() + " returned no primary key");
    }

    private static <T> void applyAtomic(ActiveModel<T> active, SetParam.Atomic atomic) {
        Object current = active.get(atomic.field());
        if (current == null) {
            throw new QueryValidationException("Cannot " + atomic.operation() + " '" + atomic.field() + "': current value is null");
        }
        BigDecimal left = new BigDecimal(current.toString());
        BigDecimal right = new BigDecimal(atomic.operand().toString());
        BigDecimal result = switch (atomic.operation()) {
            case INCREMENT -> left.add(right);
            case DECREMENT -> left.subtract(right);
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> {
                if (right.signum() == 0) {
                    throw new QueryValidationException("Cannot divide '" + atomic.field() + "' by zero");
                }
                yield left.divide(right, MathContext.DECIMAL64);
            }
        };
        active.set(atomic.field(), narrow(result, active.model().requireField(atomic.field()).type()));
    }

    private static Object narrow(BigDecimal value, Class<?> type) {
        if (type == Integer.class || type == int.class
            || type == Long.class || type == long.class
            || type == Short.class || type == short.class
            || type == BigInteger.class) {
            return value.toBigInteger();
        }
        return value;
    }
}
