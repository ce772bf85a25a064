package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.options.AggregateFieldDefinition;
import io.github.flameyossnowy.linkage.api.options.AggregationQuery;
import io.github.flameyossnowy.linkage.api.options.HavingFilter;
import io.github.flameyossnowy.linkage.api.options.QueryMode;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Parses aggregation queries into SQL.
 *
 * <pre>
 * SELECT "users"."status" AS "status", COUNT(*) AS "_count"
 * FROM "users"
 * WHERE "users"."active" = ?
 * GROUP BY "users"."status"
 * HAVING COUNT(*) > ?
 * ORDER BY COUNT(*) DESC
 * </pre>
 */
public final class AggregationSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final SqlConditionBuilder conditionBuilder;
    private final SqlSortBuilder sortBuilder;

    public AggregationSqlBuilder(QueryParseEngine.SQLType sqlType, SqlConditionBuilder conditionBuilder, SqlSortBuilder sortBuilder) {
        this.sqlType = sqlType;
        this.conditionBuilder = conditionBuilder;
        this.sortBuilder = sortBuilder;
    }

    public SqlStatement parseAggregation(@NotNull AggregationQuery query) {
        String table = sqlType.quote(query.model().tableName());
        SqlScope scope = SqlScope.root(query.model(), table);
        List<Object> params = new ArrayList<>();

        StringJoiner select = new StringJoiner(", ");
        StringJoiner groupBy = new StringJoiner(", ");
        for (String field : query.groupByFields()) {
            String column = conditionBuilder.column(scope, field);
            select.add(column + " AS " + sqlType.quote(field));
            groupBy.add(column);
        }
        for (AggregateFieldDefinition aggregate : query.aggregates()) {
            select.add(sortBuilder.aggregateExpression(aggregate, scope) + " AS " + sqlType.quote(aggregate.alias()));
        }
        if (select.length() == 0) {
            throw new IllegalArgumentException("Aggregation on '" + query.model().tableName() + "' selects nothing");
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(select).append(" FROM ").append(table);

        String conditions = conditionBuilder.buildConditions(query.whereFilters(), scope, params);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(conditions);
        }

        if (!query.groupByFields().isEmpty()) {
            sql.append(" GROUP BY ").append(groupBy);
        }

        if (!query.havingFilters().isEmpty()) {
            StringJoiner having = new StringJoiner(" AND ");
            for (HavingFilter filter : query.havingFilters()) {
                String expression = sortBuilder.aggregateExpression(filter.aggregate(), scope);
                having.add(conditionBuilder.buildOperation(expression, filter.operation(), QueryMode.DEFAULT, null, params));
            }
            sql.append(" HAVING ").append(having);
        }

        if (!query.orderBy().isEmpty()) {
            sql.append(" ORDER BY ").append(sortBuilder.buildSortOptions(query.orderBy(), scope));
        }

        sql.append(sqlType.limitClause(query.limit(), query.offset()));
        return new SqlStatement(sql.toString(), params);
    }
}
