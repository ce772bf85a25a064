package io.github.flameyossnowy.linkage.api.handler;

import io.github.flameyossnowy.linkage.api.exceptions.InvalidIncludePathException;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.OrderBy;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Checks a whole include tree against the entity graph before any query runs.
 * <p>
 * Each nested include must name a relation of its parent relation's target entity, and every selected
 * alias or ordering field must exist on that target.
 */
public final class IncludePathValidator {
    private final EntityRegistry registry;

    public IncludePathValidator(@NotNull EntityRegistry registry) {
        this.registry = registry;
    }

    public void validate(@NotNull EntityModel<?> root, @NotNull List<RelationFilter> includes) {
        validate(root, includes, "");
    }

    private void validate(EntityModel<?> model, List<RelationFilter> includes, String prefix) {
        for (RelationFilter include : includes) {
            String path = prefix.isEmpty() ? include.relation() : prefix + '.' + include.relation();
            RelationDescriptor<?> descriptor = model.getRelationDescriptor(include.relation())
                .orElseThrow(() -> new InvalidIncludePathException(path,
                    "'" + model.entityName() + "' has no relation named '" + include.relation() + "'"));

            EntityModel<?> target = registry.getModel(descriptor.targetEntity())
                .orElseThrow(() -> new InvalidIncludePathException(path,
                    "target entity '" + descriptor.targetEntity() + "' is not registered"));

            if (include.skip() != null && include.skip() < 0) {
                throw new InvalidIncludePathException(path, "skip must be >= 0");
            }
            if (include.nestedSelectAliases() != null) {
                for (String alias : include.nestedSelectAliases()) {
                    if (target.fieldByName(alias) == null) {
                        throw new InvalidIncludePathException(path, "'" + target.entityName() + "' has no field named '" + alias + "'");
                    }
                }
            }
            for (OrderBy.Field order : include.orderBy()) {
                if (target.fieldByName(order.field()) == null) {
                    throw new InvalidIncludePathException(path, "cannot order by unknown field '" + order.field() + "'");
                }
            }

            validate(target, include.nestedIncludes(), path);
        }
    }
}
