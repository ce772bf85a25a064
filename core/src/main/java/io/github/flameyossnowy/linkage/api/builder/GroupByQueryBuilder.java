package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.options.AggregateFieldDefinition;
import io.github.flameyossnowy.linkage.api.options.AggregationQuery;
import io.github.flameyossnowy.linkage.api.options.AggregationType;
import io.github.flameyossnowy.linkage.api.options.FieldOp;
import io.github.flameyossnowy.linkage.api.options.HavingFilter;
import io.github.flameyossnowy.linkage.api.options.OrderBy;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.result.GroupByRow;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Groups matching rows by one or more fields and computes aggregates per group.
 *
 * <pre>{@code
 * users.groupBy("country")
 *     .count()
 *     .avg("age")
 *     .having(AggregateFieldDefinition.count(), new FieldOp.Gt(10))
 *     .orderBy(OrderBy.aggregate(AggregateFieldDefinition.count(), SortOrder.DESC))
 *     .exec();
 * }</pre>
 */
public final class GroupByQueryBuilder<T> extends AbstractQueryBuilder<T, List<GroupByRow>> {
    private final List<String> groupFields;
    private final List<AggregateFieldDefinition> aggregates = new ArrayList<>();
    private final List<WhereParam> where = new ArrayList<>();
    private final List<HavingFilter> having = new ArrayList<>();
    private final List<OrderBy> orderBy = new ArrayList<>();
    private int take = -1;
    private int skip;

    GroupByQueryBuilder(@NotNull EntityClient<T> client, @NotNull List<String> groupFields) {
        super(client);
        if (groupFields.isEmpty()) {
            throw new QueryValidationException("groupBy needs at least one field");
        }
        for (String field : groupFields) {
            model().requireField(field);
        }
        this.groupFields = List.copyOf(groupFields);
    }

    public GroupByQueryBuilder<T> count() {
        aggregates.add(AggregateFieldDefinition.count());
        return this;
    }

    public GroupByQueryBuilder<T> sum(String field) {
        return add(AggregationType.SUM, field);
    }

    public GroupByQueryBuilder<T> avg(String field) {
        return add(AggregationType.AVG, field);
    }

    public GroupByQueryBuilder<T> min(String field) {
        return add(AggregationType.MIN, field);
    }

    public GroupByQueryBuilder<T> max(String field) {
        return add(AggregationType.MAX, field);
    }

    public GroupByQueryBuilder<T> where(WhereParam... conditions) {
        where.addAll(Arrays.asList(conditions));
        return this;
    }

    public GroupByQueryBuilder<T> having(AggregateFieldDefinition aggregate, FieldOp operation) {
        if (!aggregate.isCountAll()) {
            model().requireField(aggregate.field());
        }
        having.add(new HavingFilter(aggregate, operation));
        return this;
    }

    /**
     * Orders groups by group fields or by aggregates.
     */
    public GroupByQueryBuilder<T> orderBy(OrderBy... order) {
        for (OrderBy option : order) {
            if (option instanceof OrderBy.RelationCount) {
                throw new QueryValidationException("groupBy cannot order by a relation count");
            }
            if (option instanceof OrderBy.Field field && !groupFields.contains(field.field())) {
                throw new QueryValidationException("groupBy can only order by group fields, '" + field.field() + "' is not one");
            }
        }
        orderBy.addAll(Arrays.asList(order));
        return this;
    }

    public GroupByQueryBuilder<T> take(int take) {
        if (take < 0) {
            throw new QueryValidationException("take must be >= 0 in groupBy");
        }
        this.take = take;
        return this;
    }

    public GroupByQueryBuilder<T> skip(int skip) {
        if (skip < 0) {
            throw new QueryValidationException("skip must be >= 0");
        }
        this.skip = skip;
        return this;
    }

    private GroupByQueryBuilder<T> add(AggregationType type, String field) {
        model().requireField(field);
        aggregates.add(AggregateFieldDefinition.of(type, field));
        return this;
    }

    @Override
    protected @NotNull CompletableFuture<List<GroupByRow>> run(@NotNull ConnectionLike connection) {
        AggregationQuery query = new AggregationQuery(
            model(),
            groupFields,
            aggregates,
            context().resolver().resolveWhere(model(), where),
            having,
            context().resolver().resolveOrder(model(), orderBy),
            take,
            skip
        );
        return connection.aggregate(query).thenApply(rows -> {
            List<GroupByRow> groups = new ArrayList<>(rows.size());
            for (Row row : rows) {
                groups.add(new GroupByRow(model(), row, groupFields));
            }
            return groups;
        });
    }
}
