package io.github.flameyossnowy.linkage.api.connection;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * A connection outside any transaction, able to open one.
 */
public interface DatabaseConnection extends ConnectionLike, AutoCloseable {
    @NotNull CompletableFuture<DatabaseTransaction> begin();

    @Override
    void close();
}
