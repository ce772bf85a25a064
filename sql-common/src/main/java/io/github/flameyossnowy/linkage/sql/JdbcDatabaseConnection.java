package io.github.flameyossnowy.linkage.sql;

import io.github.flameyossnowy.linkage.api.connection.DatabaseConnection;
import io.github.flameyossnowy.linkage.api.connection.DatabaseTransaction;
import io.github.flameyossnowy.linkage.api.exceptions.ConnectionException;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.linkage.sql.internals.SqlConnectionProvider;
import io.github.flameyossnowy.linkage.sql.internals.repository.SqlQueryExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A {@link DatabaseConnection} over JDBC. Each operation borrows a connection from the provider and
 * returns it afterwards; {@link #begin()} pins one connection for the transaction's lifetime.
 */
public class JdbcDatabaseConnection extends AbstractSqlConnection implements DatabaseConnection {
    private final SqlConnectionProvider dataSource;

    public JdbcDatabaseConnection(@NotNull SqlConnectionProvider dataSource, @NotNull QueryParseEngine.SQLType sqlType, @Nullable Executor executor) {
        super(new QueryParseEngine(sqlType), new SqlQueryExecutor(dataSource, sqlType), executor);
        this.dataSource = dataSource;
    }

    public JdbcDatabaseConnection(@NotNull SqlConnectionProvider dataSource, @NotNull QueryParseEngine.SQLType sqlType) {
        this(dataSource, sqlType, null);
    }

    @Override
    protected <R> R withConnection(@NotNull SqlWork<R> work) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            return work.run(connection);
        }
    }

    @Override
    public @NotNull CompletableFuture<DatabaseTransaction> begin() {
        return submitOpen().thenApply(connection -> new JdbcDatabaseTransaction(connection, engine, queryExecutor, executor));
    }

    private CompletableFuture<Connection> submitOpen() {
        if (executor == null) {
            try {
                return CompletableFuture.completedFuture(open());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return CompletableFuture.supplyAsync(this::open, executor);
    }

    private Connection open() {
        try {
            Connection connection = dataSource.getConnection();
            connection.setAutoCommit(false);
            return connection;
        } catch (SQLException e) {
            throw new ConnectionException("Could not open a transaction: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            dataSource.close();
        } catch (Exception e) {
            Logging.error("Failed to close connection provider", e);
        }
    }
}
