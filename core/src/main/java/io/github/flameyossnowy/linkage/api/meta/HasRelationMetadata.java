package io.github.flameyossnowy.linkage.api.meta;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Access to the relation descriptor table of an entity type.
 */
public interface HasRelationMetadata<T> {
    @NotNull List<RelationDescriptor<T>> relationDescriptors();

    default @NotNull Optional<RelationDescriptor<T>> getRelationDescriptor(@NotNull String name) {
        for (RelationDescriptor<T> descriptor : relationDescriptors()) {
            if (descriptor.name().equals(name)) return Optional.of(descriptor);
        }
        return Optional.empty();
    }
}
