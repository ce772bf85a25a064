package io.github.flameyossnowy.linkage.api.result;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.FieldNotFetchedException;
import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A partially loaded entity.
 * <p>
 * Only the fields named in the fetched set were read from storage. The others keep whatever the
 * entity's no-arg constructor left there and must not be read: {@link #get(String, Class)} refuses
 * them, and JSON serialization omits them instead of writing {@code null}.
 */
@JsonAutoDetect(
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    fieldVisibility = JsonAutoDetect.Visibility.NONE
)
public final class Selected<T> extends RelationNode<T, Selected<?>> {
    private final Set<String> fetched;

    private Selected(@NotNull EntityModel<T> entityModel, @NotNull T entity, @NotNull Set<String> fetched) {
        super(entityModel, entity);
        this.fetched = Collections.unmodifiableSet(fetched);
    }

    /**
     * Fills a fresh entity from {@code row}, restricted to {@code requiredFields} plus the primary key.
     * Fields missing from the row stay unfetched.
     */
    public static <T> @NotNull Selected<T> fill(@NotNull EntityModel<T> model, @NotNull Row row, @NotNull Set<String> requiredFields) {
        T entity = model.newInstance();
        Set<String> fetched = new LinkedHashSet<>();
        for (FieldModel<T> field : model.fields()) {
            if (!field.id() && !requiredFields.contains(field.name())) continue;
            if (!row.containsAny(field.name(), field.columnName())) continue;

            Object raw = row.getAny(field.name(), field.columnName());
            Object value = field.fromDbValue(raw);
            if (value != null || !field.type().isPrimitive()) {
                field.setValue(entity, value);
            }
            fetched.add(field.name());
        }
        return new Selected<>(model, entity, fetched);
    }

    public boolean isFetched(@NotNull String alias) {
        return fetched.contains(alias);
    }

    public @NotNull Set<String> fetchedFields() {
        return fetched;
    }

    /**
     * Reads a fetched field. A {@code null} result means the stored value is NULL.
     *
     * @throws FieldNotFetchedException if the field was not part of the selection
     */
    public <V> @Nullable V get(@NotNull String alias, @NotNull Class<V> type) {
        if (!fetched.contains(alias)) {
            throw new FieldNotFetchedException("Field '" + alias + "' of " + entityModel().entityName() + " was not selected");
        }
        FieldModel<T> field = entityModel().fieldByName(alias);
        Object value = field == null ? null : field.getValue(entity());
        if (value == null) return null;
        if (!boxed(type).isInstance(value)) {
            throw new TypeConversionException("Field '" + alias + "' holds " + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        @SuppressWarnings("unchecked")
        V cast = (V) value;
        return cast;
    }

    /**
     * Empty when the field was not fetched or is NULL.
     */
    public <V> @NotNull Optional<V> find(@NotNull String alias, @NotNull Class<V> type) {
        return fetched.contains(alias) ? Optional.ofNullable(get(alias, type)) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public <R> @NotNull Optional<Selected<R>> one(@NotNull String relation, @NotNull Class<R> type) {
        RelationValue<Selected<?>> value = requireRelation(relation);
        if (!(value instanceof RelationValue.One<Selected<?>> one)) {
            throw shapeMismatch(relation, "a single relation");
        }
        if (one.value() == null) return Optional.empty();
        checkType(one.value(), type, relation);
        return Optional.of((Selected<R>) one.value());
    }

    @SuppressWarnings("unchecked")
    public <R> @NotNull List<Selected<R>> many(@NotNull String relation, @NotNull Class<R> type) {
        RelationValue<Selected<?>> value = requireRelation(relation);
        if (!(value instanceof RelationValue.Many<Selected<?>> many)) {
            throw shapeMismatch(relation, "a list relation");
        }
        List<Selected<R>> result = new ArrayList<>(many.values().size());
        for (Selected<?> node : many.values()) {
            checkType(node, type, relation);
            result.add((Selected<R>) node);
        }
        return result;
    }

    /**
     * The fetched fields, loaded relations and counts, in declaration order.
     */
    @JsonAnyGetter
    public @NotNull Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (FieldModel<T> field : entityModel().fields()) {
            if (fetched.contains(field.name())) {
                map.put(field.name(), field.getValue(entity()));
            }
        }
        for (Map.Entry<String, RelationValue<Selected<?>>> entry : relations().entrySet()) {
            if (entry.getValue() instanceof RelationValue.Many<Selected<?>> many) {
                map.put(entry.getKey(), many.values());
            } else {
                map.put(entry.getKey(), ((RelationValue.One<Selected<?>>) entry.getValue()).value());
            }
        }
        if (!counts().isEmpty()) {
            map.put("_count", counts().asMap());
        }
        return map;
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        return Character.class;
    }

    @Override
    public String toString() {
        return "Selected" + toMap();
    }
}
