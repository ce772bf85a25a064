package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.options.ColumnSelection;
import io.github.flameyossnowy.linkage.api.options.CountQuery;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.SortOrder;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

public final class SelectSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final SqlConditionBuilder conditionBuilder;
    private final SqlSortBuilder sortBuilder;

    public SelectSqlBuilder(QueryParseEngine.SQLType sqlType, SqlConditionBuilder conditionBuilder, SqlSortBuilder sortBuilder) {
        this.sqlType = sqlType;
        this.conditionBuilder = conditionBuilder;
        this.sortBuilder = sortBuilder;
    }

    public SqlStatement parseSelect(@NotNull SelectQuery query) {
        EntityModel<?> model = query.model();
        String table = sqlType.quote(model.tableName());
        SqlScope scope = SqlScope.root(model, table);
        List<Object> params = new ArrayList<>();

        List<String> distinctColumns = new ArrayList<>(query.distinctOn().size());
        for (String field : query.distinctOn()) {
            distinctColumns.add(conditionBuilder.column(scope, field));
        }
        boolean nativeDistinctOn = !distinctColumns.isEmpty() && sqlType.supportsDistinctOn();

        StringBuilder sql = new StringBuilder("SELECT ");
        if (nativeDistinctOn) {
            sql.append("DISTINCT ON (").append(String.join(", ", distinctColumns)).append(") ");
        } else if (query.distinct()) {
            sql.append("DISTINCT ");
        }
        sql.append(columns(query.columns(), scope)).append(" FROM ").append(table);

        String conditions = conditionBuilder.buildConditions(query.filters(), scope, params);
        String where = conditions;
        if (!distinctColumns.isEmpty() && !nativeDistinctOn) {
            String emulation = distinctOnEmulation(query, params);
            where = conditions.isEmpty() ? emulation : conditions + " AND " + emulation;
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(where);
        }

        List<String> order = new ArrayList<>();
        if (nativeDistinctOn) {
            // DISTINCT ON requires its expressions to lead the ORDER BY
            SortOrder leading = query.sortOptions().isEmpty() ? SortOrder.ASC : query.sortOptions().get(0).order();
            for (String column : distinctColumns) {
                order.add(column + (leading == SortOrder.ASC ? " ASC" : " DESC"));
            }
        }
        if (!query.sortOptions().isEmpty()) {
            order.add(sortBuilder.buildSortOptions(query.sortOptions(), scope));
        }
        if (!order.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", order));
        }

        sql.append(sqlType.limitClause(query.limit(), query.offset()));
        return new SqlStatement(sql.toString(), params);
    }

    public SqlStatement parseCount(@NotNull CountQuery query) {
        EntityModel<?> model = query.model();
        String table = sqlType.quote(model.tableName());
        List<Object> params = new ArrayList<>();

        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(table);
        String conditions = conditionBuilder.buildConditions(query.filters(), SqlScope.root(model, table), params);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(conditions);
        }
        return new SqlStatement(sql.toString(), params);
    }

    private String columns(List<ColumnSelection> columns, SqlScope scope) {
        if (columns.isEmpty()) {
            return scope.qualifier() + ".*";
        }
        StringJoiner joiner = new StringJoiner(", ");
        for (ColumnSelection column : columns) {
            String expression = scope.qualifier() + '.' + sqlType.quote(column.column());
            joiner.add(column.alias() == null ? expression : expression + " AS " + sqlType.quote(column.alias()));
        }
        return joiner.toString();
    }

    /**
     * Keeps the row with the lowest primary key of each distinct group.
     */
    private String distinctOnEmulation(SelectQuery query, List<Object> params) {
        EntityModel<?> model = query.model();
        String alias = sqlType.quote("d0");
        SqlScope inner = SqlScope.root(model, alias);
        String primaryKey = sqlType.quote(model.getPrimaryKey().columnName());

        StringJoiner groups = new StringJoiner(", ");
        for (String field : query.distinctOn()) {
            groups.add(conditionBuilder.column(inner, field));
        }

        StringBuilder sql = new StringBuilder(sqlType.quote(model.tableName())).append('.').append(primaryKey)
            .append(" IN (SELECT MIN(").append(alias).append('.').append(primaryKey).append(") FROM ")
            .append(sqlType.quote(model.tableName())).append(' ').append(alias);
        String conditions = conditionBuilder.buildConditions(query.filters(), inner, params);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(conditions);
        }
        return sql.append(" GROUP BY ").append(groups).append(')').toString();
    }

}
