package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Aggregates with optional GROUP BY and HAVING.
 * Result rows are labelled by group field name and by aggregate alias.
 *
 * @param groupByFields logical field names
 * @param limit         -1 for no limit
 */
public record AggregationQuery(
    @NotNull EntityModel<?> model,
    @NotNull List<String> groupByFields,
    @NotNull List<AggregateFieldDefinition> aggregates,
    @NotNull List<WhereParam> whereFilters,
    @NotNull List<HavingFilter> havingFilters,
    @NotNull List<SortOption> orderBy,
    int limit,
    int offset
) implements Query {
    public AggregationQuery {
        groupByFields = List.copyOf(groupByFields);
        aggregates = List.copyOf(aggregates);
        whereFilters = List.copyOf(whereFilters);
        havingFilters = List.copyOf(havingFilters);
        orderBy = List.copyOf(orderBy);
    }
}
