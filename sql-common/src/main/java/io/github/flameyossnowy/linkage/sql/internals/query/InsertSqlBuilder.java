package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.options.InsertQuery;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

public final class InsertSqlBuilder {
    private final QueryParseEngine.SQLType sqlType;

    public InsertSqlBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
    }

    public SqlStatement parseInsert(@NotNull InsertQuery query) {
        StringBuilder queryBuilder = new StringBuilder("INSERT INTO ").append(sqlType.quote(query.model().tableName()));

        if (query.values().isEmpty()) {
            queryBuilder.append(sqlType == QueryParseEngine.SQLType.MYSQL ? " () VALUES ()" : " DEFAULT VALUES");
            return new SqlStatement(queryBuilder.toString(), List.of());
        }

        StringJoiner columnJoiner = new StringJoiner(", ");
        StringJoiner joiner = new StringJoiner(", ");
        List<Object> params = new ArrayList<>(query.values().size());
        for (Map.Entry<String, Object> entry : query.values().entrySet()) {
            columnJoiner.add(sqlType.quote(entry.getKey()));
            joiner.add("?");
            params.add(entry.getValue());
        }

        queryBuilder.append(" (").append(columnJoiner).append(") VALUES (").append(joiner).append(')');
        return new SqlStatement(queryBuilder.toString(), params);
    }
}
