package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import io.github.flameyossnowy.linkage.api.write.SetParam;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;

/**
 * Entry point for the queries of one entity, bound to a connection or transaction.
 *
 * <pre>{@code
 * EntityClient<User> users = client.entity(User.class);
 * ModelWithRelations<User> ada = users.create(SetParam.set("email", "ada@example.com")).exec().join();
 * }</pre>
 */
public final class EntityClient<T> {
    private final QueryContext context;
    private final EntityModel<T> model;
    private final ConnectionLike connection;

    public EntityClient(@NotNull QueryContext context, @NotNull EntityModel<T> model, @NotNull ConnectionLike connection) {
        this.context = context;
        this.model = model;
        this.connection = connection;
    }

    public @NotNull EntityModel<T> model() {
        return model;
    }

    public @NotNull ConnectionLike connection() {
        return connection;
    }

    public @NotNull QueryContext context() {
        return context;
    }

    /**
     * The same client running on another connection or transaction.
     */
    public @NotNull EntityClient<T> on(@NotNull ConnectionLike connection) {
        return new EntityClient<>(context, model, connection);
    }

    public FindUniqueQueryBuilder<T> findUnique(UniqueWhere where) {
        return new FindUniqueQueryBuilder<>(this, where);
    }

    public FindFirstQueryBuilder<T> findFirst() {
        return new FindFirstQueryBuilder<>(this);
    }

    public FindManyQueryBuilder<T> findMany() {
        return new FindManyQueryBuilder<>(this);
    }

    public CountQueryBuilder<T> count() {
        return new CountQueryBuilder<>(this);
    }

    public CreateQueryBuilder<T> create(SetParam... params) {
        return create(Arrays.asList(params));
    }

    public CreateQueryBuilder<T> create(List<SetParam> params) {
        return new CreateQueryBuilder<>(this, params);
    }

    public CreateManyQueryBuilder<T> createMany(List<List<SetParam>> rows) {
        return new CreateManyQueryBuilder<>(this, rows);
    }

    public UpdateQueryBuilder<T> update(UniqueWhere where, SetParam... params) {
        return update(where, Arrays.asList(params));
    }

    public UpdateQueryBuilder<T> update(UniqueWhere where, List<SetParam> params) {
        return new UpdateQueryBuilder<>(this, where, params);
    }

    public UpdateManyQueryBuilder<T> updateMany(SetParam... params) {
        return new UpdateManyQueryBuilder<>(this, Arrays.asList(params));
    }

    public UpsertQueryBuilder<T> upsert(UniqueWhere where, List<SetParam> create, List<SetParam> update) {
        return new UpsertQueryBuilder<>(this, where, create, update);
    }

    public DeleteQueryBuilder<T> delete(UniqueWhere where) {
        return new DeleteQueryBuilder<>(this, where);
    }

    public DeleteManyQueryBuilder<T> deleteMany() {
        return new DeleteManyQueryBuilder<>(this);
    }

    public AggregateQueryBuilder<T> aggregate() {
        return new AggregateQueryBuilder<>(this);
    }

    public GroupByQueryBuilder<T> groupBy(String... fields) {
        return new GroupByQueryBuilder<>(this, Arrays.asList(fields));
    }
}
