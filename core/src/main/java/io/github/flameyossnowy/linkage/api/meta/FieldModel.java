package io.github.flameyossnowy.linkage.api.meta;

import io.github.flameyossnowy.linkage.api.exceptions.InvalidConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Represents metadata about a scalar field in an entity.
 * Generic type T represents the entity type this field belongs to.
 */
public interface FieldModel<T> {
    /**
     * Logical name, also used as the alias in projected queries.
     */
    String name();

    String columnName();

    Class<?> type();

    boolean id();

    boolean autoIncrement();

    boolean nullable();

    boolean unique();

    boolean isJson();

    Object getValue(T entity);

    void setValue(T entity, Object value);

    /**
     * Converts a raw storage value to this field's declared type.
     */
    default @Nullable Object fromDbValue(@Nullable Object raw) {
        return ValueConverter.fromDbValue(raw, type());
    }

    default @Nullable Object toDbValue(@Nullable Object value) {
        return ValueConverter.toDbValue(value);
    }

    static <T> Builder<T> builder(@NotNull String name, @NotNull Class<?> type) {
        return new Builder<>(name, type);
    }

    final class Builder<T> {
        private final String name;
        private final Class<?> type;
        private String columnName;
        private boolean id;
        private boolean autoIncrement;
        private boolean nullable;
        private boolean unique;
        private boolean json;
        private Function<T, Object> getter;
        private BiConsumer<T, Object> setter;

        private Builder(String name, Class<?> type) {
            this.name = name;
            this.type = type;
            this.columnName = name;
        }

        public Builder<T> column(String columnName) {
            this.columnName = columnName;
            return this;
        }

        public Builder<T> id() {
            this.id = true;
            this.unique = true;
            return this;
        }

        public Builder<T> autoIncrement() {
            this.autoIncrement = true;
            return this;
        }

        public Builder<T> nullable() {
            this.nullable = true;
            return this;
        }

        public Builder<T> unique() {
            this.unique = true;
            return this;
        }

        public Builder<T> json() {
            this.json = true;
            return this;
        }

        @SuppressWarnings("unchecked")
        public <V> Builder<T> accessors(Function<T, V> getter, BiConsumer<T, V> setter) {
            this.getter = (Function<T, Object>) getter;
            this.setter = (BiConsumer<T, Object>) setter;
            return this;
        }

        public FieldModel<T> build() {
            if (getter == null || setter == null) {
                throw new InvalidConfigurationException("Field '" + name + "' needs both accessors");
            }
            return new DefaultFieldModel<>(name, columnName, type, id, autoIncrement, nullable, unique, json, getter, setter);
        }
    }
}
