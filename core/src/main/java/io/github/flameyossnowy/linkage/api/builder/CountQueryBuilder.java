package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.options.CountQuery;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public final class CountQueryBuilder<T> extends AbstractQueryBuilder<T, Long> {
    private final List<WhereParam> where = new ArrayList<>();

    CountQueryBuilder(@NotNull EntityClient<T> client) {
        super(client);
    }

    public CountQueryBuilder<T> where(WhereParam... conditions) {
        where.addAll(Arrays.asList(conditions));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<Long> run(@NotNull ConnectionLike connection) {
        return connection.count(new CountQuery(model(), context().resolver().resolveWhere(model(), where)));
    }
}
