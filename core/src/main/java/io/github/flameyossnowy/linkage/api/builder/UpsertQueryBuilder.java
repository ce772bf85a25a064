package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Updates the row identified by a unique condition, or creates it when there is none.
 * <p>
 * The create parameters are used alone on a miss; they are not merged with the update parameters.
 * Lookup and write run in one transaction.
 */
public final class UpsertQueryBuilder<T> extends AbstractQueryBuilder<T, ModelWithRelations<T>> {
    private final UniqueWhere where;
    private final List<SetParam> create;
    private final List<SetParam> update;
    private RelationFilter[] includes = new RelationFilter[0];

    UpsertQueryBuilder(@NotNull EntityClient<T> client, @NotNull UniqueWhere where, @NotNull List<SetParam> create, @NotNull List<SetParam> update) {
        super(client);
        this.where = where;
        this.create = List.copyOf(create);
        this.update = List.copyOf(update);
    }

    public UpsertQueryBuilder<T> with(RelationFilter... includes) {
        this.includes = includes.clone();
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<ModelWithRelations<T>> run(@NotNull ConnectionLike connection) {
        return Transactions.scoped(connection, scoped -> selectOne(scoped, List.of(uniqueFilter(where)))
            .thenCompose(found -> {
                if (found.isPresent()) {
                    return new UpdateQueryBuilder<>(client, where, update).with(includes).exec(scoped);
                }
                return new CreateQueryBuilder<>(client, create).with(includes).exec(scoped);
            }));
    }
}
