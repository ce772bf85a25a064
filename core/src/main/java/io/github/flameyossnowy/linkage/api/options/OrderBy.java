package io.github.flameyossnowy.linkage.api.options;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Caller-facing ordering, expressed in logical names.
 */
public sealed interface OrderBy permits OrderBy.Field, OrderBy.RelationCount, OrderBy.Aggregate {

    @NotNull SortOrder order();

    /**
     * @param nulls placement of NULLs, or {@code null} for the database default
     */
    record Field(@NotNull String field, @NotNull SortOrder order, @Nullable NullsOrder nulls) implements OrderBy {}

    /**
     * Orders by the number of rows in a has-many relation.
     */
    record RelationCount(@NotNull String relation, @NotNull SortOrder order) implements OrderBy {}

    /**
     * Orders grouped rows by an aggregate.
     */
    record Aggregate(@NotNull AggregateFieldDefinition aggregate, @NotNull SortOrder order) implements OrderBy {}

    static OrderBy asc(String field) {
        return new Field(field, SortOrder.ASC, null);
    }

    static OrderBy desc(String field) {
        return new Field(field, SortOrder.DESC, null);
    }

    static OrderBy field(String field, SortOrder order, NullsOrder nulls) {
        return new Field(field, order, nulls);
    }

    static OrderBy relationCount(String relation, SortOrder order) {
        return new RelationCount(relation, order);
    }

    static OrderBy aggregate(AggregateFieldDefinition aggregate, SortOrder order) {
        return new Aggregate(aggregate, order);
    }
}
