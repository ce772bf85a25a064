package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

/**
 * The table columns are rendered against: its model and the qualifier placed in front of each column.
 * Correlated subqueries open a nested scope one level deeper.
 */
public record SqlScope(@NotNull EntityModel<?> model, @NotNull String qualifier, int depth) {

    public static @NotNull SqlScope root(@NotNull EntityModel<?> model, @NotNull String quotedTable) {
        return new SqlScope(model, quotedTable, 0);
    }

    public @NotNull SqlScope nested(@NotNull EntityModel<?> target, @NotNull String quotedAlias) {
        return new SqlScope(target, quotedAlias, depth + 1);
    }

    public @NotNull String nextAlias() {
        return "r" + (depth + 1);
    }
}
