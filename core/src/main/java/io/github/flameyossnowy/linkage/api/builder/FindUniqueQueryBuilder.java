package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Finds the row identified by a primary key or unique field.
 *
 * <pre>{@code
 * users.findUnique(UniqueWhere.of("id", 1))
 *     .with(RelationFilter.include("posts").take(1).skip(1).build())
 *     .exec();
 * }</pre>
 */
public final class FindUniqueQueryBuilder<T> extends AbstractQueryBuilder<T, Optional<ModelWithRelations<T>>> {
    private final UniqueWhere where;
    private final FindArguments<T> arguments = new FindArguments<>();

    FindUniqueQueryBuilder(@NotNull EntityClient<T> client, @NotNull UniqueWhere where) {
        super(client);
        this.where = where;
        arguments.take = 1;
    }

    public FindUniqueQueryBuilder<T> with(RelationFilter... includes) {
        arguments.with(includes);
        return this;
    }

    public FindUniqueSelectedQueryBuilder<T> select(String... fields) {
        return new FindUniqueSelectedQueryBuilder<>(client, where, arguments.copy(), List.of(fields));
    }

    @Override
    protected @NotNull CompletableFuture<Optional<ModelWithRelations<T>>> run(@NotNull ConnectionLike connection) {
        FindArguments<T> bound = arguments.copy();
        bound.where.add(uniqueFilter(where));
        return bound.findFull(context(), connection, model()).thenApply(FindFirstQueryBuilder::first);
    }
}
