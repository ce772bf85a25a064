package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.options.AggregateFieldDefinition;
import io.github.flameyossnowy.linkage.api.options.NullsOrder;
import io.github.flameyossnowy.linkage.api.options.SortOption;
import io.github.flameyossnowy.linkage.api.options.SortOrder;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.StringJoiner;

public final class SqlSortBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public SqlSortBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    public String buildSortOptions(@NotNull Iterable<SortOption> sortOptions, @NotNull SqlScope scope) {
        StringJoiner joiner = new StringJoiner(", ");
        for (SortOption sortOption : sortOptions) {
            if (sortOption instanceof SortOption.Column column) {
                String expression = scope.qualifier() + '.' + sqlType.quote(column.column());
                // "x IS NULL" sorts false before true, which works on every dialect
                if (column.nulls() != null) {
                    joiner.add(expression + " IS NULL " + (column.nulls() == NullsOrder.FIRST ? "DESC" : "ASC"));
                }
                joiner.add(expression + ' ' + direction(column.order()));
            } else if (sortOption instanceof SortOption.RelationCount count) {
                String alias = sqlType.quote(scope.nextAlias());
                joiner.add("(SELECT COUNT(*) FROM " + sqlType.quote(count.target().tableName()) + ' ' + alias
                    + " WHERE " + alias + '.' + sqlType.quote(count.targetColumn())
                    + " = " + scope.qualifier() + '.' + sqlType.quote(count.localColumn()) + ") "
                    + direction(count.order()));
            } else {
                SortOption.Aggregate aggregate = (SortOption.Aggregate) sortOption;
                joiner.add(aggregateExpression(aggregate.aggregate(), scope) + ' ' + direction(aggregate.order()));
            }
        }
        return joiner.toString();
    }

    /**
     * {@code COUNT(*)} or {@code FN(qualifier."column")}.
     */
    public String aggregateExpression(@NotNull AggregateFieldDefinition aggregate, @NotNull SqlScope scope) {
        if (aggregate.isCountAll()) {
            return "COUNT(*)";
        }
        EntityModel<?> model = scope.model();
        return aggregate.aggregationType().name() + '(' + scope.qualifier() + '.' + sqlType.quote(model.columnOf(aggregate.field())) + ')';
    }

    private static String direction(SortOrder order) {
        return order == SortOrder.ASC ? "ASC" : "DESC";
    }
}
