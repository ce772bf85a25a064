package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.key.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Describes one relation to eagerly load, and recursively the relations below it.
 * <p>
 * Pagination, ordering, cursor and distinctness apply to the related fetch itself. A {@code null}
 * {@link #nestedSelectAliases()} means every field of the related entity is loaded.
 *
 * <pre>{@code
 * RelationFilter.include("posts")
 *     .where(Filter.contains("title", "java"))
 *     .orderBy("createdAt", SortOrder.DESC)
 *     .take(10)
 *     .with(RelationFilter.include("comments").count().build())
 *     .build();
 * }</pre>
 */
public record RelationFilter(
    @NotNull String relation,
    @NotNull List<Filter> filters,
    @Nullable List<String> nestedSelectAliases,
    @NotNull List<RelationFilter> nestedIncludes,
    @Nullable Integer take,
    @Nullable Integer skip,
    @NotNull List<OrderBy.Field> orderBy,
    @Nullable Key cursor,
    boolean includeCount,
    boolean distinct
) {
    public RelationFilter {
        Objects.requireNonNull(relation, "relation");
        filters = List.copyOf(filters);
        nestedSelectAliases = nestedSelectAliases == null ? null : List.copyOf(nestedSelectAliases);
        nestedIncludes = List.copyOf(nestedIncludes);
        orderBy = List.copyOf(orderBy);
    }

    public static @NotNull Builder include(@NotNull String relation) {
        return new Builder(relation);
    }

    /**
     * True when only the related row count is wanted and nothing needs to be fetched.
     */
    public boolean isCountOnly() {
        return includeCount && nestedIncludes.isEmpty();
    }

    public boolean hasSelection() {
        return nestedSelectAliases != null;
    }

    public static final class Builder {
        private final String relation;
        private final List<Filter> filters = new ArrayList<>();
        private final List<RelationFilter> nestedIncludes = new ArrayList<>();
        private final List<OrderBy.Field> orderBy = new ArrayList<>();
        private List<String> nestedSelectAliases;
        private Integer take;
        private Integer skip;
        private Key cursor;
        private boolean includeCount;
        private boolean distinct;

        private Builder(String relation) {
            this.relation = relation;
        }

        public Builder where(Filter... filters) {
            this.filters.addAll(List.of(filters));
            return this;
        }

        public Builder where(Collection<Filter> filters) {
            this.filters.addAll(filters);
            return this;
        }

        /**
         * Restricts the related entity to the given field aliases. Key fields needed for further
         * traversal are added automatically.
         */
        public Builder select(String... aliases) {
            this.nestedSelectAliases = List.of(aliases);
            return this;
        }

        public Builder with(RelationFilter... includes) {
            this.nestedIncludes.addAll(List.of(includes));
            return this;
        }

        public Builder with(Builder... includes) {
            for (Builder include : includes) {
                this.nestedIncludes.add(include.build());
            }
            return this;
        }

        public Builder take(int take) {
            this.take = take;
            return this;
        }

        public Builder skip(int skip) {
            this.skip = skip;
            return this;
        }

        public Builder orderBy(String field, SortOrder order) {
            this.orderBy.add(new OrderBy.Field(field, order, null));
            return this;
        }

        public Builder orderBy(String field, SortOrder order, NullsOrder nulls) {
            this.orderBy.add(new OrderBy.Field(field, order, nulls));
            return this;
        }

        public Builder cursor(Key cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder count() {
            this.includeCount = true;
            return this;
        }

        public Builder distinct() {
            this.distinct = true;
            return this;
        }

        public RelationFilter build() {
            return new RelationFilter(
                relation,
                filters,
                nestedSelectAliases,
                nestedIncludes,
                take,
                skip,
                orderBy,
                cursor,
                includeCount,
                distinct
            );
        }
    }
}
