package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public record DeleteQuery(@NotNull EntityModel<?> model, @NotNull List<WhereParam> filters) implements Query {
    public DeleteQuery {
        filters = List.copyOf(filters);
    }
}
