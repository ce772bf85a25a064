package io.github.flameyossnowy.linkage.sql.internals;

import io.github.flameyossnowy.linkage.api.options.AggregationQuery;
import io.github.flameyossnowy.linkage.api.options.CountQuery;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.InsertQuery;
import io.github.flameyossnowy.linkage.api.options.Query;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import io.github.flameyossnowy.linkage.sql.internals.query.AggregationSqlBuilder;
import io.github.flameyossnowy.linkage.sql.internals.query.DeleteSqlBuilder;
import io.github.flameyossnowy.linkage.sql.internals.query.InsertSqlBuilder;
import io.github.flameyossnowy.linkage.sql.internals.query.SelectSqlBuilder;
import io.github.flameyossnowy.linkage.sql.internals.query.SqlConditionBuilder;
import io.github.flameyossnowy.linkage.sql.internals.query.SqlSortBuilder;
import io.github.flameyossnowy.linkage.sql.internals.query.SqlStatement;
import io.github.flameyossnowy.linkage.sql.internals.query.UpdateSqlBuilder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Renders query records to parameterized SQL for one dialect.
 * <p>
 * Field names in the records are mapped to columns through each record's entity model, and every
 * value is bound as a {@code ?} parameter.
 */
public class QueryParseEngine {
    private final SQLType sqlType;
    private final SelectSqlBuilder selectSqlBuilder;
    private final InsertSqlBuilder insertSqlBuilder;
    private final UpdateSqlBuilder updateSqlBuilder;
    private final DeleteSqlBuilder deleteSqlBuilder;
    private final AggregationSqlBuilder aggregationSqlBuilder;

    public QueryParseEngine(@NotNull SQLType sqlType) {
        this.sqlType = sqlType;
        SqlConditionBuilder conditionBuilder = new SqlConditionBuilder(sqlType);
        SqlSortBuilder sortBuilder = new SqlSortBuilder(sqlType);
        this.selectSqlBuilder = new SelectSqlBuilder(sqlType, conditionBuilder, sortBuilder);
        this.insertSqlBuilder = new InsertSqlBuilder(sqlType);
        this.updateSqlBuilder = new UpdateSqlBuilder(sqlType, conditionBuilder);
        this.deleteSqlBuilder = new DeleteSqlBuilder(sqlType, conditionBuilder);
        this.aggregationSqlBuilder = new AggregationSqlBuilder(sqlType, conditionBuilder, sortBuilder);
    }

    public @NotNull SQLType sqlType() {
        return sqlType;
    }

    public @NotNull SqlStatement parseSelect(@NotNull SelectQuery query) {
        return logged("select", selectSqlBuilder.parseSelect(query));
    }

    public @NotNull SqlStatement parseCount(@NotNull CountQuery query) {
        return logged("count", selectSqlBuilder.parseCount(query));
    }

    public @NotNull SqlStatement parseInsert(@NotNull InsertQuery query) {
        return logged("insert", insertSqlBuilder.parseInsert(query));
    }

    public @NotNull SqlStatement parseUpdate(@NotNull UpdateQuery query) {
        return logged("update", updateSqlBuilder.parseUpdate(query));
    }

    public @NotNull SqlStatement parseDelete(@NotNull DeleteQuery query) {
        return logged("delete", deleteSqlBuilder.parseDelete(query));
    }

    public @NotNull SqlStatement parseAggregation(@NotNull AggregationQuery query) {
        return logged("aggregation", aggregationSqlBuilder.parseAggregation(query));
    }

    public @NotNull SqlStatement parse(@NotNull Query query) {
        if (query instanceof SelectQuery select) return parseSelect(select);
        if (query instanceof CountQuery count) return parseCount(count);
        if (query instanceof InsertQuery insert) return parseInsert(insert);
        if (query instanceof UpdateQuery update) return parseUpdate(update);
        if (query instanceof DeleteQuery delete) return parseDelete(delete);
        return parseAggregation((AggregationQuery) query);
    }

    private static SqlStatement logged(String kind, SqlStatement statement) {
        Logging.deepInfo(() -> "Parsed query for " + kind + ": " + statement.sql());
        return statement;
    }

    public enum SQLType {
        MYSQL("MySQL", '`', false, null),
        SQLITE("SQLite", '"', false, "SELECT last_insert_rowid()"),
        POSTGRESQL("PostgreSQL", '"', true, null);

        private final String name;
        private final char quoteChar;
        private final boolean supportsDistinctOn;
        private final String generatedKeyQuery;

        SQLType(String name, char quoteChar, boolean supportsDistinctOn, String generatedKeyQuery) {
            this.name = name;
            this.quoteChar = quoteChar;
            this.supportsDistinctOn = supportsDistinctOn;
            this.generatedKeyQuery = generatedKeyQuery;
        }

        public String getName() {
            return name;
        }

        public char quoteChar() {
            return quoteChar;
        }

        public boolean supportsDistinctOn() {
            return supportsDistinctOn;
        }

        /**
         * Statement returning the key of the last insert on the same connection, or null when the
         * driver reports it through {@link java.sql.Statement#getGeneratedKeys()}.
         */
        public @Nullable String generatedKeyQuery() {
            return generatedKeyQuery;
        }

        public @NotNull String quote(@NotNull String identifier) {
            String escaped = identifier.replace(String.valueOf(quoteChar), String.valueOf(quoteChar) + quoteChar);
            return quoteChar + escaped + quoteChar;
        }

        /**
         * Row limit clause, including the dialect's way of writing "no limit" before an offset.
         */
        public @NotNull String limitClause(int limit, int offset) {
            if (limit < 0 && offset <= 0) return "";
            StringBuilder clause = new StringBuilder();
            if (limit >= 0) {
                clause.append(" LIMIT ").append(limit);
            } else if (this == SQLITE) {
                clause.append(" LIMIT -1");
            } else if (this == MYSQL) {
                clause.append(" LIMIT 18446744073709551615");
            }
            if (offset > 0) {
                clause.append(" OFFSET ").append(offset);
            }
            return clause.toString();
        }
    }
}
