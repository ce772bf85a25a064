package io.github.flameyossnowy.linkage.api.fetch;

import io.github.flameyossnowy.linkage.api.connection.ConnectionLike;
import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.ColumnSelection;
import io.github.flameyossnowy.linkage.api.options.CountQuery;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.api.result.ModelWithRelations;
import io.github.flameyossnowy.linkage.api.result.RelationValue;
import io.github.flameyossnowy.linkage.api.result.Selected;
import io.github.flameyossnowy.linkage.api.selection.ProjectionPlanner;
import io.github.flameyossnowy.linkage.api.selection.RequiredFieldSet;
import io.github.flameyossnowy.linkage.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Fetcher for the relations of one entity, driven purely by its descriptors and the registry's models.
 * <p>
 * Related rows are loaded with one query per call. Filters, ordering, cursor, distinctness and pagination
 * are part of that query.
 */
public final class DefaultEntityFetcher<T> implements EntityFetcher {
    private final EntityModel<T> model;
    private final EntityRegistry registry;
    private final QueryResolver resolver;

    private DefaultEntityFetcher(EntityModel<T> model, EntityRegistry registry) {
        this.model = model;
        this.registry = registry;
        this.resolver = new QueryResolver(registry);
    }

    public static <T> @NotNull DefaultEntityFetcher<T> of(@NotNull EntityModel<T> model, @NotNull EntityRegistry registry) {
        return new DefaultEntityFetcher<>(model, registry);
    }

    @Override
    public @NotNull CompletableFuture<RelationValue<ModelWithRelations<?>>> fetchByForeignKey(
        @NotNull ConnectionLike connection,
        @NotNull Optional<Key> foreignKey,
        @NotNull String foreignKeyColumn,
        @NotNull String targetEntity,
        @NotNull String relationName,
        @NotNull RelationFilter filter
    ) {
        RelationDescriptor<T> descriptor = descriptor(relationName);
        EntityModel<?> target = registry.requireModel(targetEntity);
        return fetch(connection, descriptor, target, foreignKey, filter, List.of(), row -> ModelWithRelations.fromRow(target, row));
    }

    @Override
    public @NotNull CompletableFuture<RelationValue<Selected<?>>> fetchByForeignKeyWithSelection(
        @NotNull ConnectionLike connection,
        @NotNull Optional<Key> foreignKey,
        @NotNull String foreignKeyColumn,
        @NotNull String targetEntity,
        @NotNull String relationName,
        @NotNull RelationFilter filter
    ) {
        RelationDescriptor<T> descriptor = descriptor(relationName);
        EntityModel<?> target = registry.requireModel(targetEntity);
        Set<String> required = RequiredFieldSet.compute(target, filter.nestedSelectAliases(), filter.nestedIncludes());
        List<ColumnSelection> columns = ProjectionPlanner.plan(target, required);
        return fetch(connection, descriptor, target, foreignKey, filter, columns, row -> Selected.fill(target, row, required));
    }

    @Override
    public @NotNull CompletableFuture<Long> countByForeignKey(
        @NotNull ConnectionLike connection,
        @NotNull Optional<Key> foreignKey,
        @NotNull String relationName,
        @NotNull RelationFilter filter
    ) {
        RelationDescriptor<T> descriptor = descriptor(relationName);
        if (foreignKey.isEmpty()) {
            return CompletableFuture.completedFuture(0L);
        }
        EntityModel<?> target = registry.requireModel(descriptor.targetEntity());
        CountQuery query = new CountQuery(target, relationWhere(descriptor, target, foreignKey.get(), filter));
        return connection.count(query);
    }

    private <N> CompletableFuture<RelationValue<N>> fetch(
        ConnectionLike connection,
        RelationDescriptor<T> descriptor,
        EntityModel<?> target,
        Optional<Key> foreignKey,
        RelationFilter filter,
        List<ColumnSelection> columns,
        Function<Row, N> decoder
    ) {
        if (foreignKey.isEmpty()) {
            return CompletableFuture.completedFuture(descriptor.isHasMany() ? RelationValue.<N>many(List.of()) : RelationValue.<N>none());
        }

        List<WhereParam> where = relationWhere(descriptor, target, foreignKey.get(), filter);
        Logging.deepInfo(() -> "Fetching " + model.entityName() + '.' + descriptor.name() + " for " + foreignKey.get());

        if (!descriptor.isHasMany()) {
            PagedQueryPlanner.Planned planned = PagedQueryPlanner.plan(target, columns, where, List.of(), 1, null, null, false, List.of());
            return connection.select(planned.query())
                .thenApply(rows -> rows.isEmpty() ? RelationValue.<N>none() : RelationValue.<N>one(decoder.apply(rows.get(0))));
        }

        PagedQueryPlanner.Planned planned = PagedQueryPlanner.plan(
            target,
            columns,
            where,
            resolver.resolveOrder(target, filter.orderBy()),
            filter.take(),
            filter.skip(),
            filter.cursor(),
            filter.distinct(),
            List.of()
        );
        return connection.select(planned.query()).thenApply(rows -> {
            List<N> nodes = new ArrayList<>(rows.size());
            for (Row row : planned.restoreOrder(rows)) {
                nodes.add(decoder.apply(row));
            }
            return RelationValue.<N>many(nodes);
        });
    }

    private List<WhereParam> relationWhere(RelationDescriptor<T> descriptor, EntityModel<?> target, Key key, RelationFilter filter) {
        FieldModel<?> joinField = target.fieldByColumn(descriptor.targetColumn());
        String joinName = joinField == null ? descriptor.targetColumn() : joinField.name();

        List<WhereParam> where = new ArrayList<>(filter.filters().size() + 1);
        where.add(Filter.equals(joinName, key.toDbValue()));
        where.addAll(resolver.resolveWhere(target, filter.filters()));
        return where;
    }

    private RelationDescriptor<T> descriptor(String relationName) {
        return model.getRelationDescriptor(relationName)
            .orElseThrow(() -> new RelationNotFoundException(model.entityName(), relationName));
    }
}
