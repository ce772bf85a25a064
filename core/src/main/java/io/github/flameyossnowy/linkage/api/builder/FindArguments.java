package io.github.flameyossnowy.linkage.api.builder;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.fetch.PagedQueryPlanner;
import io.github.flameyossnowy.linkage.api.handler.ProjectionMode;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.options.ColumnSelection;
import io.github.flameyossnowy.linkage.api.options.OrderBy;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.result.RelationNode;
import io.github.flameyossnowy.linkage.api.result.Selected;
import io.github.flameyossnowy.linkage.api.selection.ProjectionPlanner;
import io.github.flameyossnowy.linkage.api.selection.RequiredFieldSet;
import io.github.flameyossnowy.linkage.api.utils.Futures;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Arguments shared by the find builders, and the read pipeline they run:
 * validate includes, query the root rows, decode them, then load relations row by row.
 */
final class FindArguments<T> {
    final List<WhereParam> where = new ArrayList<>();
    final List<OrderBy> orderBy = new ArrayList<>();
    final List<RelationFilter> includes = new ArrayList<>();
    final List<String> distinctOn = new ArrayList<>();
    @Nullable Integer take;
    @Nullable Integer skip;
    @Nullable Key cursor;
    boolean distinct;

    FindArguments<T> copy() {
        FindArguments<T> copy = new FindArguments<>();
        copy.where.addAll(where);
        copy.orderBy.addAll(orderBy);
        copy.includes.addAll(includes);
        copy.distinctOn.addAll(distinctOn);
        copy.take = take;
        copy.skip = skip;
        copy.cursor = cursor;
        copy.distinct = distinct;
        return copy;
    }

    void with(RelationFilter... relations) {
        includes.addAll(Arrays.asList(relations));
    }

    CompletableFuture<List<ModelWithRelations<T>>> findFull(QueryContext context, ConnectionLike connection, EntityModel<T> model) {
        return find(context, connection, model, List.of(), row -> ModelWithRelations.fromRow(model, row), ProjectionMode.FULL);
    }

    CompletableFuture<List<Selected<T>>> findSelected(QueryContext context, ConnectionLike connection, EntityModel<T> model, List<String> aliases) {
        Set<String> required = RequiredFieldSet.compute(model, aliases, includes);
        List<ColumnSelection> columns = ProjectionPlanner.plan(model, required);
        return find(context, connection, model, columns, row -> Selected.fill(model, row, required), ProjectionMode.SELECTED);
    }

    private <N extends RelationNode<T, M>, M> CompletableFuture<List<N>> find(
        QueryContext context,
        ConnectionLike connection,
        EntityModel<T> model,
        List<ColumnSelection> columns,
        Function<Row, N> decoder,
        ProjectionMode<M> mode
    ) {
        context.includeValidator().validate(model, includes);
        PagedQueryPlanner.Planned planned = PagedQueryPlanner.plan(
            model,
            columns,
            context.resolver().resolveWhere(model, where),
            context.resolver().resolveOrder(model, orderBy),
            take,
            skip,
            cursor,
            distinct,
            distinctOn
        );

        return connection.select(planned.query()).thenCompose(rows -> {
            List<N> nodes = new ArrayList<>(rows.size());
            for (Row row : planned.restoreOrder(rows)) {
                nodes.add(decoder.apply(row));
            }
            Logging.deepInfo(() -> "Found " + nodes.size() + ' ' + model.entityName() + " row(s)");
            if (includes.isEmpty()) {
                return CompletableFuture.completedFuture(nodes);
            }
            return Futures.sequential(nodes, node -> context.includeEngine().apply(connection, node, includes, mode))
                .thenApply(ignored -> nodes);
        });
    }
}
