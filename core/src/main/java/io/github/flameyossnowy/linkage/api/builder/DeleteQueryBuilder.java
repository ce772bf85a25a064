package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Transactions;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Deletes the row identified by a unique condition and returns it as it was, relations loaded before the delete.
 */
public final class DeleteQueryBuilder<T> extends AbstractQueryBuilder<T, ModelWithRelations<T>> {
    private final UniqueWhere where;
    private final List<RelationFilter> includes = new ArrayList<>();

    DeleteQueryBuilder(@NotNull EntityClient<T> client, @NotNull UniqueWhere where) {
        super(client);
        this.where = where;
    }

    public DeleteQueryBuilder<T> with(RelationFilter... includes) {
        this.includes.addAll(Arrays.asList(includes));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<ModelWithRelations<T>> run(@NotNull ConnectionLike connection) {
        context().includeValidator().validate(model(), includes);
        return Transactions.scoped(connection, scoped -> selectOne(scoped, List.of(uniqueFilter(where)))
            .thenApply(found -> found.orElseThrow(() -> new RecordNotFoundException("No record found to delete")))
            .thenCompose(node -> loadIncludes(scoped, node, includes))
            .thenCompose(node -> {
                DeleteQuery query = new DeleteQuery(model(), List.of(keyFilter(model().primaryKeyOf(node.entity()))));
                return scoped.delete(query).thenApply(count -> {
                    Logging.info(() -> "Deleted " + model().entityName() + " where " + where);
                    return node;
                });
            }));
    }
}
