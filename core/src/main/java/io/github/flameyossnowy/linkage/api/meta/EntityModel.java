package io.github.flameyossnowy.linkage.api.meta;

import io.github.flameyossnowy.linkage.api.connection.Row;
import io.github.flameyossnowy.linkage.api.exceptions.InvalidConfigurationException;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.key.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Represents metadata about an entity: its table, scalar fields and relations.
 *
 * <pre>{@code
 * EntityModel<User> users = EntityModel.builder("user", "users", User.class, User::new)
 *     .field(FieldModel.<User>builder("id", Long.class).id().autoIncrement().accessors(User::getId, User::setId).build())
 *     .field(FieldModel.<User>builder("email", String.class).unique().accessors(User::getEmail, User::setEmail).build())
 *     .relation(RelationDescriptor.<User>hasMany("posts", "post").foreignKey("userId", "user_id").targetTable("posts", "id").build())
 *     .build();
 * }</pre>
 */
public interface EntityModel<T> extends HasRelationMetadata<T> {
    String entityName();

    String tableName();

    Class<T> entityClass();

    List<FieldModel<T>> fields();

    FieldModel<T> getPrimaryKey();

    @Nullable FieldModel<T> fieldByName(String name);

    @Nullable FieldModel<T> fieldByColumn(String column);

    T newInstance();

    default @NotNull FieldModel<T> requireField(@NotNull String name) {
        FieldModel<T> field = fieldByName(name);
        if (field == null) {
            throw new QueryValidationException("Unknown field '" + name + "' on entity '" + entityName() + "'");
        }
        return field;
    }

    /**
     * Physical column for a logical field name. Unknown names pass through unchanged.
     */
    default @NotNull String columnOf(@NotNull String fieldName) {
        FieldModel<T> field = fieldByName(fieldName);
        return field == null ? fieldName : field.columnName();
    }

    default @NotNull Key primaryKeyOf(@NotNull T entity) {
        return Key.of(getPrimaryKey().getValue(entity));
    }

    /**
     * Builds a full entity from a row. Row labels may be logical names or column names.
     */
    default @NotNull T fromRow(@NotNull Row row) {
        T entity = newInstance();
        for (FieldModel<T> field : fields()) {
            if (!row.containsAny(field.name(), field.columnName())) continue;
            Object value = field.fromDbValue(row.getAny(field.name(), field.columnName()));
            if (value == null && field.type().isPrimitive()) continue;
            field.setValue(entity, value);
        }
        return entity;
    }

    static <T> Builder<T> builder(@NotNull String entityName, @NotNull String tableName, @NotNull Class<T> entityClass, @NotNull Supplier<T> factory) {
        return new Builder<>(entityName, tableName, entityClass, factory);
    }

    final class Builder<T> {
        private final String entityName;
        private final String tableName;
        private final Class<T> entityClass;
        private final Supplier<T> factory;
        private final List<FieldModel<T>> fields = new ArrayList<>();
        private final List<RelationDescriptor<T>> relations = new ArrayList<>();

        private Builder(String entityName, String tableName, Class<T> entityClass, Supplier<T> factory) {
            this.entityName = Objects.requireNonNull(entityName, "entityName");
            this.tableName = Objects.requireNonNull(tableName, "tableName");
            this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder<T> field(FieldModel<T> field) {
            fields.add(field);
            return this;
        }

        public Builder<T> relation(RelationDescriptor<T> relation) {
            relations.add(relation);
            return this;
        }

        public EntityModel<T> build() {
            FieldModel<T> primaryKey = null;
            for (FieldModel<T> field : fields) {
                if (!field.id()) continue;
                if (primaryKey != null) {
                    throw new InvalidConfigurationException("Entity '" + entityName + "' declares more than one primary key");
                }
                primaryKey = field;
            }
            if (primaryKey == null) {
                throw new InvalidConfigurationException("Entity '" + entityName + "' has no primary key");
            }

            List<RelationDescriptor<T>> bound = new ArrayList<>(relations.size());
            for (RelationDescriptor<T> relation : relations) {
                for (RelationDescriptor<T> existing : bound) {
                    if (existing.name().equals(relation.name())) {
                        throw new InvalidConfigurationException("Entity '" + entityName + "' declares relation '" + relation.name() + "' twice");
                    }
                }
                FieldModel<T> foreignKey = relation.isHasMany() ? null : findField(relation.foreignKeyField());
                bound.add(relation.bind(primaryKey, foreignKey));
            }

            return new DefaultEntityModel<>(entityName, tableName, entityClass, factory, fields, primaryKey, bound);
        }

        private FieldModel<T> findField(String name) {
            for (FieldModel<T> field : fields) {
                if (field.name().equals(name)) return field;
            }
            return null;
        }
    }
}
