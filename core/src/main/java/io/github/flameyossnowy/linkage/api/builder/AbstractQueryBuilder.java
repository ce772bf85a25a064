package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.handler.ProjectionMode;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Base of every builder: binds it to an entity client and gives it a default connection.
 *
 * @param <T> the entity type
 * @param <R> the result type
 */
public abstract class AbstractQueryBuilder<T, R> implements BatchOperation<R> {
    protected final EntityClient<T> client;

    protected AbstractQueryBuilder(@NotNull EntityClient<T> client) {
        this.client = client;
    }

    /**
     * Runs on the client's connection.
     */
    public @NotNull CompletableFuture<R> exec() {
        return exec(client.connection());
    }

    @Override
    public final @NotNull CompletableFuture<R> exec(@NotNull ConnectionLike connection) {
        return Futures.defer(() -> run(connection));
    }

    protected abstract @NotNull CompletableFuture<R> run(@NotNull ConnectionLike connection);

    protected @NotNull EntityModel<T> model() {
        return client.model();
    }

    protected @NotNull QueryContext context() {
        return client.context();
    }

    protected @NotNull Filter uniqueFilter(@NotNull UniqueWhere where) {
        FieldModel<T> field = model().requireField(where.field());
        if (!field.id() && !field.unique()) {
            throw new QueryValidationException("Field '" + field.name() + "' of " + model().entityName() + " is not unique");
        }
        return where.toFilter();
    }

    protected @NotNull Filter keyFilter(@NotNull Key key) {
        return Filter.equals(model().getPrimaryKey().name(), key.toDbValue());
    }

    /**
     * Reads the first row matching {@code where} as a full model, without relations.
     */
    protected @NotNull CompletableFuture<Optional<ModelWithRelations<T>>> selectOne(@NotNull ConnectionLike connection, @NotNull List<WhereParam> where) {
        SelectQuery query = new SelectQuery.Builder(model())
            .where(context().resolver().resolveWhere(model(), where))
            .limit(1)
            .build();
        return connection.select(query)
            .thenApply(rows -> rows.isEmpty() ? Optional.empty() : Optional.of(ModelWithRelations.fromRow(model(), rows.get(0))));
    }

    protected @NotNull CompletableFuture<ModelWithRelations<T>> loadIncludes(
        @NotNull ConnectionLike connection,
        @NotNull ModelWithRelations<T> node,
        @NotNull List<RelationFilter> includes
    ) {
        return context().includeEngine().apply(connection, node, includes, ProjectionMode.FULL)
            .thenApply(ignored -> node);
    }
}
