package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.options.AggregateFieldDefinition;
import io.github.flameyossnowy.linkage.api.options.AggregationQuery;
import io.github.flameyossnowy.linkage.api.options.AggregationType;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.result.AggregateResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Computes aggregates over every matching row.
 *
 * <pre>{@code
 * AggregateResult stats = users.aggregate().count().avg("age").max("age").where(Filter.gt("age", 18)).exec().join();
 * double average = stats.avg("age");
 * }</pre>
 */
public final class AggregateQueryBuilder<T> extends AbstractQueryBuilder<T, AggregateResult> {
    private final List<AggregateFieldDefinition> aggregates = new ArrayList<>();
    private final List<WhereParam> where = new ArrayList<>();

    AggregateQueryBuilder(@NotNull EntityClient<T> client) {
        super(client);
    }

    public AggregateQueryBuilder<T> count() {
        aggregates.add(AggregateFieldDefinition.count());
        return this;
    }

    public AggregateQueryBuilder<T> count(String field) {
        return add(AggregationType.COUNT, field);
    }

    public AggregateQueryBuilder<T> sum(String field) {
        return add(AggregationType.SUM, field);
    }

    public AggregateQueryBuilder<T> avg(String field) {
        return add(AggregationType.AVG, field);
    }

    public AggregateQueryBuilder<T> min(String field) {
        return add(AggregationType.MIN, field);
    }

    public AggregateQueryBuilder<T> max(String field) {
        return add(AggregationType.MAX, field);
    }

    public AggregateQueryBuilder<T> where(WhereParam... conditions) {
        where.addAll(Arrays.asList(conditions));
        return this;
    }

    private AggregateQueryBuilder<T> add(AggregationType type, String field) {
        model().requireField(field);
        aggregates.add(AggregateFieldDefinition.of(type, field));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<AggregateResult> run(@NotNull ConnectionLike connection) {
        if (aggregates.isEmpty()) {
            throw new QueryValidationException("aggregate on " + model().entityName() + " needs at least one aggregate");
        }
        AggregationQuery query = new AggregationQuery(
            model(),
            List.of(),
            aggregates,
            context().resolver().resolveWhere(model(), where),
            List.of(),
            List.of(),
            -1,
            0
        );
        return connection.aggregate(query)
            .thenApply(rows -> new AggregateResult(model(), rows.isEmpty() ? new Row(Map.of()) : rows.get(0)));
    }
}
