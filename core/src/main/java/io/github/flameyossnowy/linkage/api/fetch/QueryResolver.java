package io.github.flameyossnowy.linkage.api.fetch;

import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.OrderBy;
import io.github.flameyossnowy.linkage.api.options.SortOption;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks caller conditions against an entity model and resolves relation names into join columns.
 */
public final class QueryResolver {
    private final EntityRegistry registry;

    public QueryResolver(@NotNull EntityRegistry registry) {
        this.registry = registry;
    }

    public @NotNull List<WhereParam> resolveWhere(@NotNull EntityModel<?> model, @NotNull List<? extends WhereParam> conditions) {
        List<WhereParam> resolved = new ArrayList<>(conditions.size());
        for (WhereParam condition : conditions) {
            resolved.add(resolve(model, condition));
        }
        return resolved;
    }

    private WhereParam resolve(EntityModel<?> model, WhereParam condition) {
        if (condition instanceof Filter filter) {
            boolean jsonField = model.requireField(filter.field()).isJson();
            if (filter.operation().isJson() && !jsonField) {
                throw new QueryValidationException("Field '" + filter.field() + "' of " + model.entityName() + " is not a JSON field");
            }
            return filter;
        }
        if (condition instanceof WhereParam.And and) {
            return new WhereParam.And(resolveWhere(model, and.conditions()));
        }
        if (condition instanceof WhereParam.Or or) {
            return new WhereParam.Or(resolveWhere(model, or.conditions()));
        }
        if (condition instanceof WhereParam.Not not) {
            return new WhereParam.Not(resolveWhere(model, not.conditions()));
        }
        if (condition instanceof WhereParam.RelationCondition relation) {
            RelationDescriptor<?> descriptor = descriptor(model, relation.relation());
            EntityModel<?> target = registry.requireModel(descriptor.targetEntity());
            return new WhereParam.ResolvedRelationCondition(
                target,
                descriptor.targetColumn(),
                descriptor.localColumn(),
                relation.quantifier(),
                resolveWhere(target, relation.conditions())
            );
        }
        return condition;
    }

    public @NotNull List<SortOption> resolveOrder(@NotNull EntityModel<?> model, @NotNull List<? extends OrderBy> orders) {
        List<SortOption> resolved = new ArrayList<>(orders.size());
        for (OrderBy order : orders) {
            if (order instanceof OrderBy.Field field) {
                resolved.add(new SortOption.Column(model.requireField(field.field()).columnName(), field.order(), field.nulls()));
            } else if (order instanceof OrderBy.RelationCount count) {
                RelationDescriptor<?> descriptor = descriptor(model, count.relation());
                EntityModel<?> target = registry.requireModel(descriptor.targetEntity());
                resolved.add(new SortOption.RelationCount(target, descriptor.targetColumn(), descriptor.localColumn(), count.order()));
            } else if (order instanceof OrderBy.Aggregate aggregate) {
                resolved.add(new SortOption.Aggregate(aggregate.aggregate(), aggregate.order()));
            }
        }
        return resolved;
    }

    private static RelationDescriptor<?> descriptor(EntityModel<?> model, String relation) {
        return model.getRelationDescriptor(relation)
            .orElseThrow(() -> new RelationNotFoundException(model.entityName(), relation));
    }
}
