package io.github.flameyossnowy.linkage.sql;

import io.github.flameyossnowy.linkage.api.connection.DatabaseTransaction;
import io.github.flameyossnowy.linkage.api.exceptions.TransactionException;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import io.github.flameyossnowy.linkage.sql.internals.repository.SqlQueryExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A transaction pinned to one JDBC connection with auto-commit off. Committing or rolling back closes it.
 */
public class JdbcDatabaseTransaction extends AbstractSqlConnection implements DatabaseTransaction {
    private final Connection connection;
    private volatile boolean ended;

    JdbcDatabaseTransaction(
        @NotNull Connection connection,
        @NotNull QueryParseEngine engine,
        @NotNull SqlQueryExecutor queryExecutor,
        @Nullable Executor executor
    ) {
        super(engine, queryExecutor, executor);
        this.connection = connection;
    }

    @Override
    protected <R> R withConnection(@NotNull SqlWork<R> work) throws SQLException {
        if (ended) {
            throw new TransactionException("Transaction already ended");
        }
        return work.run(connection);
    }

    @Override
    public @NotNull CompletableFuture<Void> commit() {
        return end(true);
    }

    @Override
    public @NotNull CompletableFuture<Void> rollback() {
        return end(false);
    }

    private CompletableFuture<Void> end(boolean commit) {
        return submit(connection -> {
            ended = true;
            try {
                if (commit) {
                    connection.commit();
                } else {
                    connection.rollback();
                }
            } catch (SQLException e) {
                throw new TransactionException((commit ? "Commit" : "Rollback") + " failed: " + e.getMessage(), e);
            } finally {
                close(connection);
            }
            return null;
        });
    }

    private static void close(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            Logging.error("Failed to close transaction connection", e);
        }
    }
}
