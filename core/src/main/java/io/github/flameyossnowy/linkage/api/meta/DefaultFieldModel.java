package io.github.flameyossnowy.linkage.api.meta;

import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;

import java.util.function.BiConsumer;
import java.util.function.Function;

record DefaultFieldModel<T>(
    String name,
    String columnName,
    Class<?> type,
    boolean id,
    boolean autoIncrement,
    boolean nullable,
    boolean unique,
    boolean isJson,
    Function<T, Object> getter,
    BiConsumer<T, Object> setter
) implements FieldModel<T> {

    @Override
    public Object getValue(T entity) {
        return getter.apply(entity);
    }

    @Override
    public void setValue(T entity, Object value) {
        if (value == null && type.isPrimitive()) {
            throw new TypeConversionException("Cannot assign null to primitive field '" + name + "'");
        }
        setter.accept(entity, value);
    }

    @Override
    public String toString() {
        return "FieldModel[" + name + " -> " + columnName + ']';
    }
}
