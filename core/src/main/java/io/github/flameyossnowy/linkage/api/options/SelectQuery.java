package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable row fetch description.
 *
 * @param columns    projected expressions, empty for every column
 * @param limit      maximum row count, or -1 for no limit
 * @param offset     rows to skip, or 0
 * @param distinctOn columns that must be unique across the result; empty for none
 */
public record SelectQuery(
    @NotNull EntityModel<?> model,
    @NotNull List<ColumnSelection> columns,
    @NotNull List<WhereParam> filters,
    @NotNull List<SortOption> sortOptions,
    int limit,
    int offset,
    boolean distinct,
    @NotNull List<String> distinctOn
) implements Query {

    public SelectQuery {
        columns = List.copyOf(columns);
        filters = List.copyOf(filters);
        sortOptions = List.copyOf(sortOptions);
        distinctOn = List.copyOf(distinctOn);
    }

    public static class Builder {
        private final EntityModel<?> model;
        private final List<ColumnSelection> columns = new ArrayList<>();
        private final List<WhereParam> filters = new ArrayList<>();
        private final List<SortOption> sortOptions = new ArrayList<>();
        private final List<String> distinctOn = new ArrayList<>();
        private int limit = -1;
        private int offset;
        private boolean distinct;

        public Builder(EntityModel<?> model) {
            this.model = model;
        }

        public Builder columns(Collection<ColumnSelection> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder where(WhereParam filter) {
            filters.add(filter);
            return this;
        }

        public Builder where(Collection<? extends WhereParam> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public Builder orderBy(SortOption option) {
            sortOptions.add(option);
            return this;
        }

        public Builder orderBy(Collection<SortOption> options) {
            sortOptions.addAll(options);
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder distinctOn(Collection<String> columns) {
            this.distinctOn.addAll(columns);
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(model, columns, filters, sortOptions, limit, offset, distinct, distinctOn);
        }
    }
}
