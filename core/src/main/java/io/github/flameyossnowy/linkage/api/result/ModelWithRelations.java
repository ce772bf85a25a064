package io.github.flameyossnowy.linkage.api.result;

import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A fully loaded entity plus whichever relations were requested.
 *
 * <pre>{@code
 * ModelWithRelations<Post> post = ...;
 * Optional<ModelWithRelations<User>> author = post.one("author", User.class);
 * List<ModelWithRelations<Comment>> comments = post.many("comments", Comment.class);
 * }</pre>
 */
public final class ModelWithRelations<T> extends RelationNode<T, ModelWithRelations<?>> {

    public ModelWithRelations(@NotNull EntityModel<T> entityModel, @NotNull T entity) {
        super(entityModel, entity);
    }

    public static <T> @NotNull ModelWithRelations<T> fromRow(@NotNull EntityModel<T> model, @NotNull Row row) {
        return new ModelWithRelations<>(model, model.fromRow(row));
    }

    /**
     * Reads a loaded belongs-to relation.
     *
     * @return empty when the relation was loaded and there is no related row
     * @throws io.github.flameyossnowy.linkage.api.exceptions.RelationNotFetchedException if it was not loaded
     */
    @SuppressWarnings("unchecked")
    public <R> @NotNull Optional<ModelWithRelations<R>> one(@NotNull String relation, @NotNull Class<R> type) {
        RelationValue<ModelWithRelations<?>> value = requireRelation(relation);
        if (!(value instanceof RelationValue.One<ModelWithRelations<?>> one)) {
            throw shapeMismatch(relation, "a single relation");
        }
        if (one.value() == null) return Optional.empty();
        checkType(one.value(), type, relation);
        return Optional.of((ModelWithRelations<R>) one.value());
    }

    /**
     * Reads a loaded has-many relation.
     */
    @SuppressWarnings("unchecked")
    public <R> @NotNull List<ModelWithRelations<R>> many(@NotNull String relation, @NotNull Class<R> type) {
        RelationValue<ModelWithRelations<?>> value = requireRelation(relation);
        if (!(value instanceof RelationValue.Many<ModelWithRelations<?>> many)) {
            throw shapeMismatch(relation, "a list relation");
        }
        List<ModelWithRelations<R>> result = new ArrayList<>(many.values().size());
        for (ModelWithRelations<?> node : many.values()) {
            checkType(node, type, relation);
            result.add((ModelWithRelations<R>) node);
        }
        return result;
    }

    @Override
    public String toString() {
        return "ModelWithRelations{" + entity() + ", relations=" + relations().keySet() + ", " + counts() + '}';
    }
}
