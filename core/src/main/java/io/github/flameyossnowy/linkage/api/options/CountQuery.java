package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * {@code COUNT(*)} over the rows matching {@code filters}.
 */
public record CountQuery(@NotNull EntityModel<?> model, @NotNull List<WhereParam> filters) implements Query {
    public CountQuery {
        filters = List.copyOf(filters);
    }
}
