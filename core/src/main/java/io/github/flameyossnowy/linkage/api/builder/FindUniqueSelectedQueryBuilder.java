package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.result.Selected;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public final class FindUniqueSelectedQueryBuilder<T> extends AbstractQueryBuilder<T, Optional<Selected<T>>> {
    private final UniqueWhere where;
    private final FindArguments<T> arguments;
    private final List<String> fields;

    FindUniqueSelectedQueryBuilder(@NotNull EntityClient<T> client, @NotNull UniqueWhere where, @NotNull FindArguments<T> arguments, @NotNull List<String> fields) {
        super(client);
        this.where = where;
        this.arguments = arguments;
        this.fields = fields;
    }

    public FindUniqueSelectedQueryBuilder<T> with(RelationFilter... includes) {
        arguments.with(includes);
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<Optional<Selected<T>>> run(@NotNull ConnectionLike connection) {
        FindArguments<T> bound = arguments.copy();
        bound.where.add(uniqueFilter(where));
        return bound.findSelected(context(), connection, model(), fields).thenApply(FindFirstQueryBuilder::first);
    }
}
