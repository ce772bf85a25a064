package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Storage-facing ordering with relation names already resolved to join columns.
 */
public sealed interface SortOption permits SortOption.Column, SortOption.RelationCount, SortOption.Aggregate {

    @NotNull SortOrder order();

    @NotNull SortOption reverse();

    record Column(@NotNull String column, @NotNull SortOrder order, @Nullable NullsOrder nulls) implements SortOption {
        @Override
        public @NotNull SortOption reverse() {
            return new Column(column, order.reverse(), nulls == null ? null : nulls.reverse());
        }
    }

    /**
     * {@code ORDER BY (SELECT COUNT(*) FROM target WHERE target.targetColumn = outer.localColumn)}.
     */
    record RelationCount(
        @NotNull EntityModel<?> target,
        @NotNull String targetColumn,
        @NotNull String localColumn,
        @NotNull SortOrder order
    ) implements SortOption {
        @Override
        public @NotNull SortOption reverse() {
            return new RelationCount(target, targetColumn, localColumn, order.reverse());
        }
    }

    record Aggregate(@NotNull AggregateFieldDefinition aggregate, @NotNull SortOrder order) implements SortOption {
        @Override
        public @NotNull SortOption reverse() {
            return new Aggregate(aggregate, order.reverse());
        }
    }
}
