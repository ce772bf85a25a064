package io.github.flameyossnowy.linkage.api.result;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A loaded relation.
 * <p>
 * A belongs-to relation loads as {@link One}, which holds {@code null} when the foreign key is unset
 * or points nowhere. A has-many relation loads as {@link Many}.
 *
 * @param <N> the node type of the related rows
 */
public sealed interface RelationValue<N> permits RelationValue.One, RelationValue.Many {

    record One<N>(@Nullable N value) implements RelationValue<N> {}

    record Many<N>(@NotNull List<N> values) implements RelationValue<N> {
        public Many {
            values = List.copyOf(values);
        }
    }

    static <N> RelationValue<N> one(@Nullable N value) {
        return new One<>(value);
    }

    static <N> RelationValue<N> none() {
        return new One<>(null);
    }

    static <N> RelationValue<N> many(@NotNull List<N> values) {
        return new Many<>(values);
    }

    /**
     * Every node held by this value, in order.
     */
    default @NotNull List<N> nodes() {
        if (this instanceof Many<N> many) return many.values();
        N value = ((One<N>) this).value();
        return value == null ? List.of() : List.of(value);
    }
}
