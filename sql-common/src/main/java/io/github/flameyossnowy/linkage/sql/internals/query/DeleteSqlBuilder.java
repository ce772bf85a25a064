package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public final class DeleteSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final SqlConditionBuilder conditionBuilder;

    public DeleteSqlBuilder(QueryParseEngine.SQLType sqlType, SqlConditionBuilder conditionBuilder) {
        this.sqlType = sqlType;
        this.conditionBuilder = conditionBuilder;
    }

    public SqlStatement parseDelete(@NotNull DeleteQuery query) {
        String table = sqlType.quote(query.model().tableName());
        if (query.filters().isEmpty()) {
            return new SqlStatement("DELETE FROM " + table, List.of());
        }

        List<Object> params = new ArrayList<>();
        String conditions = conditionBuilder.buildConditions(query.filters(), SqlScope.root(query.model(), table), params);
        return new SqlStatement("DELETE FROM " + table + " WHERE " + conditions, params);
    }
}
