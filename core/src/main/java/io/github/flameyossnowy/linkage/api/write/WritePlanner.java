package io.github.flameyossnowy.linkage.api.write;

import io.github.flameyossnowy.linkage.api.exceptions.InvalidFieldTypeException;
import io.github.flameyossnowy.linkage.api.exceptions.QueryValidationException;
import io.github.flameyossnowy.linkage.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.linkage.api.fetch.EntityRegistry;
import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.meta.RelationDescriptor;
import io.github.flameyossnowy.linkage.api.options.UniqueWhere;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Sorts the {@link SetParam}s of a write into a {@link WritePlan}.
 * <p>
 * Connects whose target is known by primary key are assigned right away; every other connect
 * becomes a {@link DeferredLookup}. Nothing here touches storage.
 */
public final class WritePlanner {
    private final EntityRegistry registry;

    public WritePlanner(@NotNull EntityRegistry registry) {
        this.registry = registry;
    }

    public <T> @NotNull WritePlan<T> planCreate(@NotNull EntityModel<T> model, @NotNull List<? extends SetParam> params) {
        return plan(model, params, false);
    }

    public <T> @NotNull WritePlan<T> planUpdate(@NotNull EntityModel<T> model, @NotNull List<? extends SetParam> params) {
        return plan(model, params, true);
    }

    private <T> WritePlan<T> plan(EntityModel<T> model, List<? extends SetParam> params, boolean update) {
        ActiveModel<T> active = ActiveModel.empty(model);
        List<DeferredLookup> lookups = new ArrayList<>();
        List<PostInsertOperation> postInsert = new ArrayList<>();
        List<HasManySetOperation> relationSets = new ArrayList<>();
        List<SetParam.Atomic> atomics = new ArrayList<>();

        for (SetParam param : params) {
            if (param instanceof SetParam.Set set) {
                active.set(set.field(), set.value());
            } else if (param instanceof SetParam.Atomic atomic) {
                if (!update) {
                    throw new QueryValidationException("Atomic " + atomic.operation() + " on '" + atomic.field() + "' is only allowed in an update");
                }
                FieldModel<T> field = model.requireField(atomic.field());
                if (!isNumeric(field.type())) {
                    throw new InvalidFieldTypeException("Atomic " + atomic.operation() + " needs a numeric field, '" + field.name() + "' is " + field.type().getSimpleName());
                }
                atomics.add(atomic);
            } else if (param instanceof SetParam.Connect connect) {
                RelationDescriptor<T> descriptor = belongsTo(model, connect.relation(), "connect");
                connect(active, lookups, descriptor, connect.target());
            } else if (param instanceof SetParam.Disconnect disconnect) {
                RelationDescriptor<T> descriptor = belongsTo(model, disconnect.relation(), "disconnect");
                if (!descriptor.isForeignKeyNullable()) {
                    throw new QueryValidationException("Relation '" + descriptor.name() + "' of " + model.entityName() + " is required and cannot be disconnected");
                }
                active.set(descriptor.foreignKeyField(), null);
            } else if (param instanceof SetParam.CreateNested nested) {
                RelationDescriptor<T> descriptor = hasMany(model, nested.relation(), "create");
                postInsert.add(new PostInsertOperation(descriptor, registry.requireModel(descriptor.targetEntity()), nested.rows()));
            } else if (param instanceof SetParam.SetRelation setRelation) {
                RelationDescriptor<T> descriptor = hasMany(model, setRelation.relation(), "set");
                relationSets.add(new HasManySetOperation(descriptor, registry.requireModel(descriptor.targetEntity()), setRelation.targets()));
            }
        }
        return new WritePlan<>(active, lookups, postInsert, relationSets, atomics);
    }

    private <T> void connect(ActiveModel<T> active, List<DeferredLookup> lookups, RelationDescriptor<T> descriptor, RelationConnect target) {
        EntityModel<?> targetModel = registry.requireModel(descriptor.targetEntity());
        FieldModel<?> targetKey = targetModel.getPrimaryKey();

        if (target instanceof RelationConnect.ById byId) {
            active.set(descriptor.foreignKeyField(), byId.key().toDbValue());
            return;
        }

        UniqueWhere condition = ((RelationConnect.ByUnique) target).condition();
        if (targetKey.name().equals(condition.field())) {
            active.set(descriptor.foreignKeyField(), targetKey.toDbValue(targetKey.fromDbValue(condition.value())));
            return;
        }

        FieldModel<?> field = targetModel.requireField(condition.field());
        if (!field.unique()) {
            throw new QueryValidationException("Field '" + field.name() + "' of " + targetModel.entityName() + " is not unique and cannot identify a row to connect");
        }
        lookups.add(new DeferredLookup.ByCondition(targetModel.entityName(), condition, descriptor.foreignKeyField()));
    }

    private static <T> RelationDescriptor<T> belongsTo(EntityModel<T> model, String relation, String action) {
        RelationDescriptor<T> descriptor = descriptor(model, relation);
        if (descriptor.isHasMany()) {
            throw new QueryValidationException("Cannot " + action + " has-many relation '" + relation + "' of " + model.entityName());
        }
        return descriptor;
    }

    private static <T> RelationDescriptor<T> hasMany(EntityModel<T> model, String relation, String action) {
        RelationDescriptor<T> descriptor = descriptor(model, relation);
        if (!descriptor.isHasMany()) {
            throw new QueryValidationException("Cannot " + action + " belongs-to relation '" + relation + "' of " + model.entityName());
        }
        return descriptor;
    }

    private static <T> RelationDescriptor<T> descriptor(EntityModel<T> model, String relation) {
        return model.getRelationDescriptor(relation)
            .orElseThrow(() -> new RelationNotFoundException(model.entityName(), relation));
    }

    private static boolean isNumeric(Class<?> type) {
        return Number.class.isAssignableFrom(type)
            || type == int.class || type == long.class || type == short.class
            || type == double.class || type == float.class;
    }
}
