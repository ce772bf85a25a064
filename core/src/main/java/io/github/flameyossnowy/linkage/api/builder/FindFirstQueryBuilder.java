package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.options.OrderBy;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Finds the first row matching the conditions in the given order.
 */
public final class FindFirstQueryBuilder<T> extends AbstractQueryBuilder<T, Optional<ModelWithRelations<T>>> {
    private final FindArguments<T> arguments = new FindArguments<>();

    FindFirstQueryBuilder(@NotNull EntityClient<T> client) {
        super(client);
        arguments.take = 1;
    }

    public FindFirstQueryBuilder<T> where(WhereParam... conditions) {
        arguments.where.addAll(Arrays.asList(conditions));
        return this;
    }

    public FindFirstQueryBuilder<T> orderBy(OrderBy... order) {
        arguments.orderBy.addAll(Arrays.asList(order));
        return this;
    }

    public FindFirstQueryBuilder<T> skip(int skip) {
        arguments.skip = skip;
        return this;
    }

    public FindFirstQueryBuilder<T> cursor(Key cursor) {
        arguments.cursor = cursor;
        return this;
    }

    public FindFirstQueryBuilder<T> with(RelationFilter... includes) {
        arguments.with(includes);
        return this;
    }

    public FindFirstSelectedQueryBuilder<T> select(String... fields) {
        return new FindFirstSelectedQueryBuilder<>(client, arguments.copy(), List.of(fields));
    }

    @Override
    protected @NotNull CompletableFuture<Optional<ModelWithRelations<T>>> run(@NotNull ConnectionLike connection) {
        return arguments.findFull(context(), connection, model()).thenApply(FindFirstQueryBuilder::first);
    }

    static <N> Optional<N> first(List<N> nodes) {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }
}
