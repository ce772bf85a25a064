package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * A query that can run against any connection or transaction, used as a member of a {@link Batch}.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface BatchOperation<R> {
    @NotNull CompletableFuture<R> exec(@NotNull ConnectionLike connection);
}
