package io.github.flameyossnowy.linkage.api.selection;

import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.RelationFilter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes which fields a projected fetch must read.
 * <p>
 * The result is the requested aliases, the primary key, and the local key field of every nested
 * include, so a caller that selected two scalar columns can still traverse the relations it asked for.
 */
public final class RequiredFieldSet {
    private RequiredFieldSet() {}

    /**
     * @param requested requested aliases, or {@code null} for every field
     * @throws QueryValidationException  if an alias is not a field of {@code model}
     * @throws RelationNotFoundException if a nested include is not a relation of {@code model}
     */
    public static <T> @NotNull Set<String> compute(
        @NotNull EntityModel<T> model,
        @Nullable Collection<String> requested,
        @NotNull List<RelationFilter> nestedIncludes
    ) {
        Set<String> required = new LinkedHashSet<>();
        if (requested == null) {
            for (FieldModel<T> field : model.fields()) {
                required.add(field.name());
            }
        } else {
            for (String alias : requested) {
                required.add(model.requireField(alias).name());
            }
        }

        required.add(model.getPrimaryKey().name());

        for (RelationFilter include : nestedIncludes) {
            RelationDescriptor<T> descriptor = model.getRelationDescriptor(include.relation())
                .orElseThrow(() -> new RelationNotFoundException(model.entityName(), include.relation()));
            required.add(descriptor.localKeyField());
        }
        return Collections.unmodifiableSet(required);
    }
}
