package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import io.github.flameyossnowy.linkage.api.write.WritePlan;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Updates the row identified by a unique condition and returns it as stored afterwards.
 * <p>
 * Relation sets run first, then the scalar changes, atomic operations included, are written by primary key.
 * Fails with {@link RecordNotFoundException} when no row matches.
 */
public final class UpdateQueryBuilder<T> extends AbstractQueryBuilder<T, ModelWithRelations<T>> {
    private final UniqueWhere where;
    private final List<SetParam> params;
    private final List<RelationFilter> includes = new ArrayList<>();

    UpdateQueryBuilder(@NotNull EntityClient<T> client, @NotNull UniqueWhere where, @NotNull List<SetParam> params) {
        super(client);
        this.where = where;
        this.params = List.copyOf(params);
    }

    public UpdateQueryBuilder<T> with(RelationFilter... includes) {
        this.includes.addAll(Arrays.asList(includes));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<ModelWithRelations<T>> run(@NotNull ConnectionLike connection) {
        WritePlan<T> plan = context().writer().planner().planUpdate(model(), params);
        context().includeValidator().validate(model(), includes);
        if (plan.needsTransaction() || !plan.atomics().isEmpty()) {
            return Transactions.scoped(connection, scoped -> update(scoped, plan));
        }
        return update(connection, plan);
    }

    private CompletableFuture<ModelWithRelations<T>> update(ConnectionLike connection, WritePlan<T> plan) {
        return selectOne(connection, List.of(uniqueFilter(where))).thenCompose(found -> {
            ModelWithRelations<T> current = found.orElseThrow(() -> new RecordNotFoundException("No record found to update"));
            Key key = keyAfterUpdate(plan, current.entity());
            return context().writer().update(connection, plan, current.entity())
                .thenCompose(ignored -> selectOne(connection, List.of(keyFilter(key))))
                .thenApply(updated -> updated.orElseThrow(() -> new RecordNotFoundException("No record found to update")))
                .thenCompose(node -> loadIncludes(connection, node, includes));
        });
    }

    private Key keyAfterUpdate(WritePlan<T> plan, T current) {
        FieldModel<T> primaryKey = model().getPrimaryKey();
        Object changed = plan.active().changedFields().contains(primaryKey.name()) ? plan.active().get(primaryKey.name()) : null;
        return changed == null ? model().primaryKeyOf(current) : Key.of(changed);
    }
}
