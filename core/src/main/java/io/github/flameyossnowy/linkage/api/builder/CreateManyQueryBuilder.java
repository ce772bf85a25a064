package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import io.github.flameyossnowy.linkage.api.write.WritePlan;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Inserts several rows in one transaction and returns how many were created.
 */
public final class CreateManyQueryBuilder<T> extends AbstractQueryBuilder<T, Long> {
    private final List<List<SetParam>> rows;

    CreateManyQueryBuilder(@NotNull EntityClient<T> client, @NotNull List<List<SetParam>> rows) {
        super(client);
        this.rows = rows.stream().map(List::copyOf).toList();
    }

    @Override
    protected @NotNull CompletableFuture<Long> run(@NotNull ConnectionLike connection) {
        if (rows.isEmpty()) {
            return CompletableFuture.completedFuture(0L);
        }
        List<WritePlan<T>> plans = new ArrayList<>(rows.size());
        for (List<SetParam> row : rows) {
            plans.add(context().writer().planner().planCreate(model(), row));
        }
        return Transactions.scoped(connection, scoped ->
            Futures.sequential(plans, plan -> context().writer().insert(scoped, plan, null))
                .thenApply(keys -> (long) keys.size()));
    }
}
