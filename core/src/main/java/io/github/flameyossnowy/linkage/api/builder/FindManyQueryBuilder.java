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
import java.util.concurrent.CompletableFuture;

/**
 * Finds every row matching the conditions.
 *
 * <pre>{@code
 * client.entity(Post.class).findMany()
 *     .where(Filter.equals("published", true))
 *     .orderBy(OrderBy.desc("createdAt"))
 *     .take(-5)
 *     .with(RelationFilter.include("author").build())
 *     .exec();
 * }</pre>
 * A negative {@code take} returns the last rows of the ordering, still in that ordering.
 */
public final class FindManyQueryBuilder<T> extends AbstractQueryBuilder<T, List<ModelWithRelations<T>>> {
    private final FindArguments<T> arguments = new FindArguments<>();

    FindManyQueryBuilder(@NotNull EntityClient<T> client) {
        super(client);
    }

    public FindManyQueryBuilder<T> where(WhereParam... conditions) {
        arguments.where.addAll(Arrays.asList(conditions));
        return this;
    }

    public FindManyQueryBuilder<T> orderBy(OrderBy... order) {
        arguments.orderBy.addAll(Arrays.asList(order));
        return this;
    }

    public FindManyQueryBuilder<T> take(int take) {
        arguments.take = take;
        return this;
    }

    public FindManyQueryBuilder<T> skip(int skip) {
        arguments.skip = skip;
        return this;
    }

    /**
     * Starts after the row with this primary key, exclusive.
     */
    public FindManyQueryBuilder<T> cursor(Key cursor) {
        arguments.cursor = cursor;
        return this;
    }

    public FindManyQueryBuilder<T> distinct() {
        arguments.distinct = true;
        return this;
    }

    /**
     * Keeps one row per distinct combination of the given fields.
     */
    public FindManyQueryBuilder<T> distinct(String... fields) {
        arguments.distinctOn.addAll(Arrays.asList(fields));
        return this;
    }

    public FindManyQueryBuilder<T> with(RelationFilter... includes) {
        arguments.with(includes);
        return this;
    }

    public FindManySelectedQueryBuilder<T> select(String... fields) {
        return new FindManySelectedQueryBuilder<>(client, arguments.copy(), List.of(fields));
    }

    @Override
    protected @NotNull CompletableFuture<List<ModelWithRelations<T>>> run(@NotNull ConnectionLike connection) {
        return arguments.findFull(context(), connection, model());
    }
}
