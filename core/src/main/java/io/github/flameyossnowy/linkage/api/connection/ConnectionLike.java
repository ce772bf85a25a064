package io.github.flameyossnowy.linkage.api.connection;

import io.github.flameyossnowy.linkage.api.options.AggregationQuery;
import io.github.flameyossnowy.linkage.api.options.CountQuery;
import io.github.flameyossnowy.linkage.api.options.DeleteQuery;
import io.github.flameyossnowy.linkage.api.options.InsertQuery;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.UpdateQuery;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Something queries can run against: a plain connection or an open transaction.
 * <p>
 * A handle is used by one operation at a time; callers issue the next query only after the previous
 * future completed.
 */
public interface ConnectionLike {
    @NotNull CompletableFuture<List<Row>> select(@NotNull SelectQuery query);

    @NotNull CompletableFuture<Long> count(@NotNull CountQuery query);

    /**
     * Inserts a row.
     *
     * @return the generated primary key, or the explicit one from the insert values; empty if neither is known
     */
    @NotNull CompletableFuture<Optional<Object>> insert(@NotNull InsertQuery query);

    /**
     * @return the number of affected rows
     */
    @NotNull CompletableFuture<Long> update(@NotNull UpdateQuery query);

    /**
     * @return the number of deleted rows
     */
    @NotNull CompletableFuture<Long> delete(@NotNull DeleteQuery query);

    @NotNull CompletableFuture<List<Row>> aggregate(@NotNull AggregationQuery query);
}
