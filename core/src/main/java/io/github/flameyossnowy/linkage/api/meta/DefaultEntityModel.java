package io.github.flameyossnowy.linkage.api.meta;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

final class DefaultEntityModel<T> implements EntityModel<T> {
    private final String entityName;
    private final String tableName;
    private final Class<T> entityClass;
    private final Supplier<T> factory;
    private final List<FieldModel<T>> fields;
    private final FieldModel<T> primaryKey;
    private final List<RelationDescriptor<T>> relations;
    private final Map<String, FieldModel<T>> byName = new HashMap<>();
    private final Map<String, FieldModel<T>> byColumn = new HashMap<>();
    private final Map<String, RelationDescriptor<T>> relationsByName = new HashMap<>();

    DefaultEntityModel(
        String entityName,
        String tableName,
        Class<T> entityClass,
        Supplier<T> factory,
        List<FieldModel<T>> fields,
        FieldModel<T> primaryKey,
        List<RelationDescriptor<T>> relations
    ) {
        this.entityName = entityName;
        this.tableName = tableName;
        this.entityClass = entityClass;
        this.factory = factory;
        this.fields = List.copyOf(fields);
        this.primaryKey = primaryKey;
        this.relations = List.copyOf(relations);

        for (FieldModel<T> field : this.fields) {
            byName.put(field.name(), field);
            byColumn.put(field.columnName().toLowerCase(Locale.ROOT), field);
        }
        for (RelationDescriptor<T> relation : this.relations) {
            relationsByName.put(relation.name(), relation);
        }
    }

    @Override
    public String entityName() {
        return entityName;
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Override
    public Class<T> entityClass() {
        return entityClass;
    }

    @Override
    public List<FieldModel<T>> fields() {
        return fields;
    }

    @Override
    public FieldModel<T> getPrimaryKey() {
        return primaryKey;
    }

    @Override
    public @Nullable FieldModel<T> fieldByName(String name) {
        return byName.get(name);
    }

    @Override
    public @Nullable FieldModel<T> fieldByColumn(String column) {
        return byColumn.get(column.toLowerCase(Locale.ROOT));
    }

    @Override
    public T newInstance() {
        return factory.get();
    }

    @Override
    public @NotNull List<RelationDescriptor<T>> relationDescriptors() {
        return relations;
    }

    @Override
    public @NotNull Optional<RelationDescriptor<T>> getRelationDescriptor(@NotNull String name) {
        return Optional.ofNullable(relationsByName.get(name));
    }

    @Override
    public String toString() {
        return "EntityModel[" + entityName + " -> " + tableName + ']';
    }
}
