package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Deletes every matching row and returns how many were deleted. Without conditions every row goes.
 */
public final class DeleteManyQueryBuilder<T> extends AbstractQueryBuilder<T, Long> {
    private final List<WhereParam> where = new ArrayList<>();

    DeleteManyQueryBuilder(@NotNull EntityClient<T> client) {
        super(client);
    }

    public DeleteManyQueryBuilder<T> where(WhereParam... conditions) {
        where.addAll(Arrays.asList(conditions));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<Long> run(@NotNull ConnectionLike connection) {
        return connection.delete(new DeleteQuery(model(), context().resolver().resolveWhere(model(), where)));
    }
}
