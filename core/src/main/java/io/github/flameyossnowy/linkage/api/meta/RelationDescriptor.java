package io.github.flameyossnowy.linkage.api.meta;

import io.github.flameyossnowy.linkage.api.exceptions.InvalidConfigurationException;
import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;
import io.github.flameyossnowy.linkage.api.key.Key;
import io.github.flameyossnowy.linkage.api.result.RelationNode;
import io.github.flameyossnowy.linkage.api.result.RelationValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Static description of one relation of entity {@code T}.
 * <p>
 * For {@link RelationKind#BELONGS_TO} the foreign key column lives on {@code T}'s table and points at
 * the target's primary key. For {@link RelationKind#HAS_MANY} it lives on the target table and points
 * back at {@code T}'s primary key.
 *
 * <pre>{@code
 * RelationDescriptor.<Post>belongsTo("author", "user")
 *     .foreignKey("userId", "user_id")
 *     .targetTable("users", "id")
 *     .build();
 *
 * RelationDescriptor.<User>hasMany("posts", "post")
 *     .foreignKey("userId", "user_id")
 *     .targetTable("posts", "id")
 *     .build();
 * }</pre>
 */
public final class RelationDescriptor<T> {
    private final String name;
    private final String targetEntity;
    private final String foreignKeyColumn;
    private final String foreignKeyField;
    private final String targetTableName;
    private final String currentPrimaryKeyColumn;
    private final String currentPrimaryKeyField;
    private final String targetPrimaryKeyColumn;
    private final RelationKind kind;
    private final boolean foreignKeyNullable;
    private final Function<T, Object> keyAccessor;

    private RelationDescriptor(Builder<T> builder, String currentPrimaryKeyField, String currentPrimaryKeyColumn, Function<T, Object> keyAccessor) {
        this.name = builder.name;
        this.targetEntity = builder.targetEntity;
        this.foreignKeyColumn = builder.foreignKeyColumn;
        this.foreignKeyField = builder.foreignKeyField;
        this.targetTableName = builder.targetTableName;
        this.targetPrimaryKeyColumn = builder.targetPrimaryKeyColumn;
        this.kind = builder.kind;
        this.foreignKeyNullable = builder.foreignKeyNullable;
        this.currentPrimaryKeyField = currentPrimaryKeyField;
        this.currentPrimaryKeyColumn = currentPrimaryKeyColumn;
        this.keyAccessor = keyAccessor;
    }

    public static <T> Builder<T> belongsTo(@NotNull String name, @NotNull String targetEntity) {
        return new Builder<>(name, targetEntity, RelationKind.BELONGS_TO);
    }

    public static <T> Builder<T> hasMany(@NotNull String name, @NotNull String targetEntity) {
        return new Builder<>(name, targetEntity, RelationKind.HAS_MANY);
    }

    public String name() {
        return name;
    }

    public String targetEntity() {
        return targetEntity;
    }

    public String foreignKeyColumn() {
        return foreignKeyColumn;
    }

    public String foreignKeyField() {
        return foreignKeyField;
    }

    public String targetTableName() {
        return targetTableName;
    }

    public String currentPrimaryKeyColumn() {
        return currentPrimaryKeyColumn;
    }

    public String currentPrimaryKeyField() {
        return currentPrimaryKeyField;
    }

    public String targetPrimaryKeyColumn() {
        return targetPrimaryKeyColumn;
    }

    public RelationKind kind() {
        return kind;
    }

    public boolean isHasMany() {
        return kind == RelationKind.HAS_MANY;
    }

    public boolean isForeignKeyNullable() {
        return foreignKeyNullable;
    }

    /**
     * Field on {@code T} whose value drives traversal: the foreign key for belongs-to,
     * the primary key for has-many.
     */
    public String localKeyField() {
        return kind == RelationKind.BELONGS_TO ? foreignKeyField : currentPrimaryKeyField;
    }

    /**
     * Column on {@code T}'s table that the join starts from.
     */
    public String localColumn() {
        return kind == RelationKind.BELONGS_TO ? foreignKeyColumn : currentPrimaryKeyColumn;
    }

    /**
     * Column on the target table matched against {@link #localColumn()}.
     */
    public String targetColumn() {
        return kind == RelationKind.BELONGS_TO ? targetPrimaryKeyColumn : foreignKeyColumn;
    }

    /**
     * The key used to look up related rows, or empty when the entity's foreign key is unset.
     */
    public @NotNull Optional<Key> getForeignKey(@NotNull T entity) {
        Object raw = keyAccessor.apply(entity);
        return raw == null ? Optional.empty() : Optional.of(Key.of(raw));
    }

    /**
     * Writes a loaded relation into {@code node}.
     *
     * @throws TypeConversionException if the value shape does not match this relation's kind
     */
    public <N> void setField(@NotNull RelationNode<?, N> node, @NotNull RelationValue<N> value) {
        boolean many = value instanceof RelationValue.Many<N>;
        if (many != isHasMany()) {
            throw new TypeConversionException("Relation '" + name + "' is " + kind + " but received a "
                + (many ? "list" : "single") + " value");
        }
        node.setRelation(name, value);
    }

    /**
     * Completes the current-side columns once the owning entity's primary key is known.
     */
    RelationDescriptor<T> bind(FieldModel<T> primaryKey, @Nullable FieldModel<T> foreignKey) {
        Function<T, Object> accessor;
        if (kind == RelationKind.HAS_MANY) {
            accessor = primaryKey::getValue;
        } else {
            if (foreignKey == null) {
                throw new InvalidConfigurationException("Relation '" + name + "' references unknown field '" + foreignKeyField + "'");
            }
            accessor = foreignKey::getValue;
        }
        return new RelationDescriptor<>(new Builder<>(this), primaryKey.name(), primaryKey.columnName(), accessor);
    }

    @Override
    public String toString() {
        return "RelationDescriptor[" + name + ' ' + kind + " -> " + targetEntity + " via " + foreignKeyColumn + ']';
    }

    public static final class Builder<T> {
        private final String name;
        private final String targetEntity;
        private final RelationKind kind;
        private String foreignKeyColumn;
        private String foreignKeyField;
        private String targetTableName;
        private String targetPrimaryKeyColumn = "id";
        private boolean foreignKeyNullable;

        private Builder(String name, String targetEntity, RelationKind kind) {
            this.name = Objects.requireNonNull(name, "name");
            this.targetEntity = Objects.requireNonNull(targetEntity, "targetEntity");
            this.kind = kind;
        }

        private Builder(RelationDescriptor<T> source) {
            this.name = source.name;
            this.targetEntity = source.targetEntity;
            this.kind = source.kind;
            this.foreignKeyColumn = source.foreignKeyColumn;
            this.foreignKeyField = source.foreignKeyField;
            this.targetTableName = source.targetTableName;
            this.targetPrimaryKeyColumn = source.targetPrimaryKeyColumn;
            this.foreignKeyNullable = source.foreignKeyNullable;
        }

        /**
         * @param field  logical name of the foreign key field
         * @param column physical foreign key column
         */
        public Builder<T> foreignKey(String field, String column) {
            this.foreignKeyField = field;
            this.foreignKeyColumn = column;
            return this;
        }

        public Builder<T> targetTable(String table, String primaryKeyColumn) {
            this.targetTableName = table;
            this.targetPrimaryKeyColumn = primaryKeyColumn;
            return this;
        }

        public Builder<T> nullable() {
            this.foreignKeyNullable = true;
            return this;
        }

        /**
         * An unbound descriptor; {@link EntityModel.Builder} binds it to the owning entity's fields.
         */
        public RelationDescriptor<T> build() {
            if (foreignKeyField == null || foreignKeyColumn == null) {
                throw new InvalidConfigurationException("Relation '" + name + "' has no foreign key");
            }
            if (targetTableName == null) {
                throw new InvalidConfigurationException("Relation '" + name + "' has no target table");
            }
            return new RelationDescriptor<>(this, null, null, entity -> {
                throw new InvalidConfigurationException("Relation '" + name + "' is not bound to an entity model");
            });
        }
    }
}
