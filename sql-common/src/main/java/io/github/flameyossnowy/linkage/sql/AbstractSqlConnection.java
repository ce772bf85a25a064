package io.github.flameyossnowy.linkage.sql;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.DatabaseException;
import io.github.flameyossnowy.linkage.api.options.AggregationQuery;
import io.github.flameyossnowy.linkage.api.options.CountQuery;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.InsertQuery;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.linkage.sql.internals.repository.SqlQueryExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Query execution shared by plain connections and transactions. Subclasses decide which JDBC
 * connection each operation runs on.
 * <p>
 * Without an executor, work runs on the calling thread and the returned future is already complete.
 */
public abstract class AbstractSqlConnection implements ConnectionLike {
    protected final QueryParseEngine engine;
    protected final SqlQueryExecutor queryExecutor;
    protected final @Nullable Executor executor;

    protected AbstractSqlConnection(@NotNull QueryParseEngine engine, @NotNull SqlQueryExecutor queryExecutor, @Nullable Executor executor) {
        this.engine = engine;
        this.queryExecutor = queryExecutor;
        this.executor = executor;
    }

    @FunctionalInterface
    protected interface SqlWork<R> {
        R run(Connection connection) throws SQLException;
    }

    protected abstract <R> R withConnection(@NotNull SqlWork<R> work) throws SQLException;

    protected <R> @NotNull CompletableFuture<R> submit(@NotNull SqlWork<R> work) {
        if (executor == null) {
            try {
                return CompletableFuture.completedFuture(call(work));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.supplyAsync(() -> call(work), executor);
    }

    private <R> R call(SqlWork<R> work) {
        try {
            return withConnection(work);
        } catch (SQLException e) {
            throw new DatabaseException("Database access failed: " + e.getMessage(), e);
        }
    }

    @Override
    public @NotNull CompletableFuture<List<Row>> select(@NotNull SelectQuery query) {
        return submit(connection -> queryExecutor.executeQuery(connection, engine.parseSelect(query)));
    }

    @Override
    public @NotNull CompletableFuture<Long> count(@NotNull CountQuery query) {
        return submit(connection -> queryExecutor.executeScalar(connection, engine.parseCount(query)));
    }

    @Override
    public @NotNull CompletableFuture<Optional<Object>> insert(@NotNull InsertQuery query) {
        return submit(connection -> queryExecutor.executeInsert(connection, query, engine.parseInsert(query)));
    }

    @Override
    public @NotNull CompletableFuture<Long> update(@NotNull UpdateQuery query) {
        if (query.updates().isEmpty()) {
            return CompletableFuture.completedFuture(0L);
        }
        return submit(connection -> queryExecutor.executeUpdate(connection, engine.parseUpdate(query)));
    }

    @Override
    public @NotNull CompletableFuture<Long> delete(@NotNull DeleteQuery query) {
        return submit(connection -> queryExecutor.executeUpdate(connection, engine.parseDelete(query)));
    }

    @Override
    public @NotNull CompletableFuture<List<Row>> aggregate(@NotNull AggregationQuery query) {
        return submit(connection -> queryExecutor.executeQuery(connection, engine.parseAggregation(query)));
    }

    public @NotNull QueryParseEngine.SQLType sqlType() {
        return engine.sqlType();
    }
}
