package io.github.flameyossnowy.linkage.api.connection;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * An open transaction. Exactly one of {@link #commit()} or {@link #rollback()} ends it.
 */
public interface DatabaseTransaction extends ConnectionLike {
    @NotNull CompletableFuture<Void> commit();

    @NotNull CompletableFuture<Void> rollback();
}
