package io.github.flameyossnowy.linkage.api.fetch;

import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.options.ColumnSelection;
import io.github.flameyossnowy.linkage.api.options.FieldOp;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.SelectQuery;
import io.github.flameyossnowy.linkage.api.options.SortOption;
import io.github.flameyossnowy.linkage.api.options.SortOrder;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds a {@link SelectQuery} with take, skip and cursor semantics applied in the query itself.
 * <ul>
 *     <li>A negative {@code take} returns the last rows: ordering is reversed for the query and
 *     {@link Planned#reversed()} tells the caller to reverse the fetched rows back.</li>
 *     <li>A negative {@code skip} is rejected, and so is a {@code take} of {@link Integer#MIN_VALUE}.</li>
 *     <li>A cursor keeps only rows strictly after the cursor's primary key in the effective order.
 *     Without an explicit order, rows are ordered by primary key.</li>
 * </ul>
 */
public final class PagedQueryPlanner {
    private PagedQueryPlanner() {}

    public record Planned(@NotNull SelectQuery query, boolean reversed) {
        public <R> @NotNull List<R> restoreOrder(@NotNull List<R> rows) {
            if (!reversed) return rows;
            List<R> copy = new ArrayList<>(rows);
            Collections.reverse(copy);
            return copy;
        }
    }

    public static @NotNull Planned plan(
        @NotNull EntityModel<?> model,
        @NotNull List<ColumnSelection> columns,
        @NotNull List<WhereParam> where,
        @NotNull List<SortOption> order,
        @Nullable Integer take,
        @Nullable Integer skip,
        @Nullable Key cursor,
        boolean distinct,
        @NotNull List<String> distinctOn
    ) {
        if (skip != null && skip < 0) {
            throw new QueryValidationException("skip must be >= 0");
        }
        if (take != null && take == Integer.MIN_VALUE) {
            throw new QueryValidationException("take must be greater than " + Integer.MIN_VALUE);
        }

        FieldModel<?> primaryKey = model.getPrimaryKey();
        List<SortOption> sort = new ArrayList<>(order);
        List<WhereParam> filters = new ArrayList<>(where);

        boolean reversed = take != null && take < 0;
        if ((reversed || cursor != null) && sort.isEmpty()) {
            sort.add(new SortOption.Column(primaryKey.columnName(), SortOrder.ASC, null));
        }
        if (reversed) {
            sort.replaceAll(SortOption::reverse);
        }

        if (cursor != null) {
            SortOrder direction = sort.get(0).order();
            FieldOp comparison = direction == SortOrder.ASC
                ? new FieldOp.Gt(cursor.toDbValue())
                : new FieldOp.Lt(cursor.toDbValue());
            filters.add(new Filter(primaryKey.name(), comparison));
        }

        SelectQuery.Builder builder = new SelectQuery.Builder(model)
            .columns(columns)
            .where(filters)
            .orderBy(sort)
            .distinct(distinct)
            .distinctOn(distinctOn);
        if (take != null) builder.limit(Math.abs(take));
        if (skip != null) builder.offset(skip);
        return new Planned(builder.build(), reversed);
    }
}
