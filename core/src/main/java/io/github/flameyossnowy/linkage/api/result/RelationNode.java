package io.github.flameyossnowy.linkage.api.result;

import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFetchedException;
import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An entity row together with the relation slots the traversal engine fills in.
 * <p>
 * A slot that was never written means the relation was not requested. Nodes are mutated in place
 * while a query runs and are not meant to be shared between concurrent writers.
 *
 * @param <T> the entity type
 * @param <N> the node type used for related rows
 */
public abstract class RelationNode<T, N> {
    private final EntityModel<T> entityModel;
    private final T entity;
    private final Map<String, RelationValue<N>> relations = new LinkedHashMap<>();
    private final Counts counts = new Counts();

    protected RelationNode(@NotNull EntityModel<T> entityModel, @NotNull T entity) {
        this.entityModel = entityModel;
        this.entity = entity;
    }

    public @NotNull EntityModel<T> entityModel() {
        return entityModel;
    }

    public @NotNull T entity() {
        return entity;
    }

    public @NotNull Counts counts() {
        return counts;
    }

    public boolean isLoaded(@NotNull String relation) {
        return relations.containsKey(relation);
    }

    public @NotNull Optional<RelationValue<N>> relation(@NotNull String relation) {
        return Optional.ofNullable(relations.get(relation));
    }

    public @NotNull Map<String, RelationValue<N>> relations() {
        return Collections.unmodifiableMap(relations);
    }

    /**
     * Stores a loaded relation. Callers go through {@code RelationDescriptor.setField} so the value shape
     * is checked against the relation kind.
     */
    public void setRelation(@NotNull String relation, @NotNull RelationValue<N> value) {
        relations.put(relation, value);
    }

    protected @NotNull RelationValue<N> requireRelation(String relation) {
        RelationValue<N> value = relations.get(relation);
        if (value == null) {
            throw new RelationNotFetchedException("Relation '" + relation + "' on " + entityModel.entityName() + " was not fetched");
        }
        return value;
    }

    protected static <R> void checkType(RelationNode<?, ?> node, Class<R> type, String relation) {
        if (!type.isInstance(node.entity())) {
            throw new TypeConversionException("Relation '" + relation + "' holds " + node.entity().getClass().getSimpleName()
                + ", not " + type.getSimpleName());
        }
    }

    protected static TypeConversionException shapeMismatch(String relation, String expected) {
        return new TypeConversionException("Relation '" + relation + "' is not " + expected);
    }
}
