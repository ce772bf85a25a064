package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

public final class UpdateSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final SqlConditionBuilder conditionBuilder;

    public UpdateSqlBuilder(QueryParseEngine.SQLType sqlType, SqlConditionBuilder conditionBuilder) {
        this.sqlType = sqlType;
        this.conditionBuilder = conditionBuilder;
    }

    /**
     * @throws IllegalArgumentException when the update sets no column
     */
    public SqlStatement parseUpdate(@NotNull UpdateQuery query) {
        if (query.updates().isEmpty()) {
            throw new IllegalArgumentException("Update on '" + query.model().tableName() + "' sets no column");
        }
        String table = sqlType.quote(query.model().tableName());
        List<Object> params = new ArrayList<>();

        StringJoiner setClause = new StringJoiner(", ");
        for (Map.Entry<String, Object> entry : query.updates().entrySet()) {
            setClause.add(sqlType.quote(entry.getKey()) + " = ?");
            params.add(entry.getValue());
        }

        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ").append(setClause);
        String conditions = conditionBuilder.buildConditions(query.filters(), SqlScope.root(query.model(), table), params);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(conditions);
        }
        return new SqlStatement(sql.toString(), params);
    }
}
