package io.github.flameyossnowy.linkage.sql.internals.query;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text with its {@code ?} parameters in binding order.
 */
public record SqlStatement(@NotNull String sql, @NotNull List<Object> params) {
    public SqlStatement {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }
}
