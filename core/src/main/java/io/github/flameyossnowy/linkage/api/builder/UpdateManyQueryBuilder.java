package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import io.github.flameyossnowy.linkage.api.write.WritePlan;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Applies the same scalar changes to every matching row and returns the number of rows updated.
 * <p>
 * Only plain assignments, connects and disconnects are accepted. Atomic operations, nested creates and
 * relation sets need the individual rows and are rejected.
 */
public final class UpdateManyQueryBuilder<T> extends AbstractQueryBuilder<T, Long> {
    private final List<SetParam> params;
    private final List<WhereParam> where = new ArrayList<>();

    UpdateManyQueryBuilder(@NotNull EntityClient<T> client, @NotNull List<SetParam> params) {
        super(client);
        this.params = List.copyOf(params);
    }

    public UpdateManyQueryBuilder<T> where(WhereParam... conditions) {
        where.addAll(Arrays.asList(conditions));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<Long> run(@NotNull ConnectionLike connection) {
        WritePlan<T> plan = context().writer().planner().planUpdate(model(), params);
        if (!plan.atomics().isEmpty() || !plan.postInsert().isEmpty() || !plan.relationSets().isEmpty()) {
            throw new QueryValidationException("updateMany on " + model().entityName() + " only supports field assignments, connects and disconnects");
        }
        List<WhereParam> resolved = context().resolver().resolveWhere(model(), where);
        if (plan.lookups().isEmpty()) {
            return update(connection, plan, resolved);
        }
        return Transactions.scoped(connection, scoped ->
            context().writer().resolver().resolveAll(scoped, plan.lookups(), plan.active(), null)
                .thenCompose(ignored -> update(scoped, plan, resolved)));
    }

    private CompletableFuture<Long> update(ConnectionLike connection, WritePlan<T> plan, List<WhereParam> resolved) {
        Map<String, Object> changes = plan.active().changedColumns();
        if (changes.isEmpty()) {
            return CompletableFuture.completedFuture(0L);
        }
        return connection.update(new UpdateQuery(model(), changes, resolved));
    }
}
