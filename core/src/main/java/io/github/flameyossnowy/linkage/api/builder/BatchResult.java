package io.github.flameyossnowy.linkage.api.builder;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Results of an executed {@link Batch}, in the order the members were added.
 */
public final class BatchResult {
    private final List<Object> results;

    BatchResult(@NotNull List<Object> results) {
        this.results = Collections.unmodifiableList(results);
    }

    @SuppressWarnings("unchecked")
    public <R> R get(@NotNull BatchHandle<R> handle) {
        return (R) results.get(handle.index());
    }

    public int size() {
        return results.size();
    }

    public @NotNull List<Object> asList() {
        return results;
    }
}
