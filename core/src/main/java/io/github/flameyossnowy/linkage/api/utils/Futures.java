package io.github.flameyossnowy.linkage.api.utils;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Helpers for chaining {@link CompletableFuture}s one after another.
 */
public final class Futures {
    private Futures() {}

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers added by future composition.
     */
    public static @NotNull Throwable unwrap(@NotNull Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Runs {@code action} on each item in order, starting the next only once the previous completed.
     * The first failure stops the chain.
     */
    public static <T, R> @NotNull CompletableFuture<List<R>> sequential(
        @NotNull List<T> items,
        @NotNull Function<? super T, CompletableFuture<R>> action
    ) {
        List<R> results = new ArrayList<>(items.size());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (T item : items) {
            chain = chain.thenCompose(ignored -> action.apply(item)).thenAccept(results::add);
        }
        return chain.thenApply(ignored -> results);
    }

    /**
     * Calls {@code supplier}, turning a synchronous throw into a failed future.
     */
    public static <T> @NotNull CompletableFuture<T> defer(@NotNull Supplier<CompletableFuture<T>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
