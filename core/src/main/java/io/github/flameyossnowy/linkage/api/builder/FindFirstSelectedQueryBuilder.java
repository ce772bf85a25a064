package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.result.Selected;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public final class FindFirstSelectedQueryBuilder<T> extends AbstractQueryBuilder<T, Optional<Selected<T>>> {
    private final FindArguments<T> arguments;
    private final List<String> fields;

    FindFirstSelectedQueryBuilder(@NotNull EntityClient<T> client, @NotNull FindArguments<T> arguments, @NotNull List<String> fields) {
        super(client);
        this.arguments = arguments;
        this.fields = fields;
    }

    public FindFirstSelectedQueryBuilder<T> with(RelationFilter... includes) {
        arguments.with(includes);
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<Optional<Selected<T>>> run(@NotNull ConnectionLike connection) {
        return arguments.findSelected(context(), connection, model(), fields).thenApply(FindFirstQueryBuilder::first);
    }
}
