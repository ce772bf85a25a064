package io.github.flameyossnowy.linkage.api.connection;

import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Runs work inside a transaction: begin, run, commit, and roll back if anything failed.
 */
public final class Transactions {
    private Transactions() {}

    public static <R> @NotNull CompletableFuture<R> run(
        @NotNull DatabaseConnection connection,
        @NotNull Function<DatabaseTransaction, CompletableFuture<R>> work
    ) {
        return connection.begin().thenCompose(transaction -> {
            Logging.info("Transaction started");
            return Futures.defer(() -> work.apply(transaction))
                .handle((result, error) -> {
                    if (error == null) {
                        return transaction.commit().thenApply(ignored -> {
                            Logging.info("Transaction committed");
                            return result;
                        });
                    }
                    Throwable cause = Futures.unwrap(error);
                    Logging.info(() -> "Rolling back transaction after " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
                    return transaction.rollback()
                        .handle((ignored, rollbackError) -> {
                            if (rollbackError != null) {
                                cause.addSuppressed(Futures.unwrap(rollbackError));
                            }
                            throw new CompletionException(cause);
                        })
                        .thenApply(ignored -> (R) null);
                })
                .thenCompose(future -> future);
        });
    }

    /**
     * Runs {@code work} in a new transaction when {@code connection} is a bare {@link DatabaseConnection},
     * and directly otherwise, so the work joins a transaction the caller already opened.
     */
    public static <R> @NotNull CompletableFuture<R> scoped(
        @NotNull ConnectionLike connection,
        @NotNull Function<ConnectionLike, CompletableFuture<R>> work
    ) {
        if (connection instanceof DatabaseConnection database) {
            return run(database, work::apply);
        }
        return Futures.defer(() -> work.apply(connection));
    }
}
