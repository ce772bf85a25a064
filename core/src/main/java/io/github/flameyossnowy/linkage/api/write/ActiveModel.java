package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The in-progress state of a row being written: field values plus which of them changed.
 */
public final class ActiveModel<T> {
    private final EntityModel<T> model;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> changed = new LinkedHashSet<>();

    private ActiveModel(EntityModel<T> model) {
        this.model = model;
    }

    public static <T> @NotNull ActiveModel<T> empty(@NotNull EntityModel<T> model) {
        return new ActiveModel<>(model);
    }

    /**
     * A model holding the current values of {@code entity}, with nothing marked as changed.
     */
    public static <T> @NotNull ActiveModel<T> of(@NotNull EntityModel<T> model, @NotNull T entity) {
        ActiveModel<T> active = new ActiveModel<>(model);
        for (FieldModel<T> field : model.fields()) {
            active.values.put(field.name(), field.getValue(entity));
        }
        return active;
    }

    public @NotNull EntityModel<T> model() {
        return model;
    }

    /**
     * Sets a field, converting the value to the field's declared type.
     */
    public void set(@NotNull String field, @Nullable Object value) {
        FieldModel<T> fieldModel = model.requireField(field);
        values.put(fieldModel.name(), fieldModel.fromDbValue(value));
        changed.add(fieldModel.name());
    }

    public @Nullable Object get(@NotNull String field) {
        return values.get(field);
    }

    public boolean isSet(@NotNull String field) {
        return values.containsKey(field);
    }

    public @NotNull Set<String> changedFields() {
        return Collections.unmodifiableSet(changed);
    }

    /**
     * Copies every change of {@code other} into this model.
     */
    public void merge(@NotNull ActiveModel<T> other) {
        for (String field : other.changed) {
            set(field, other.values.get(field));
        }
    }

    /**
     * Column to storage value for every set field, as used by an insert.
     */
    public @NotNull Map<String, Object> toColumns() {
        return columns(values.keySet());
    }

    /**
     * Column to storage value for the changed fields only, as used by an update.
     */
    public @NotNull Map<String, Object> changedColumns() {
        return columns(changed);
    }

    private Map<String, Object> columns(Set<String> fields) {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (String name : fields) {
            FieldModel<T> field = model.requireField(name);
            columns.put(field.columnName(), field.toDbValue(values.get(name)));
        }
        return columns;
    }

    @Override
    public String toString() {
        return "ActiveModel[" + model.entityName() + ' ' + values + ']';
    }
}
