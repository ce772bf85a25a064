package io.github.flameyossnowy.linkage.api.options;

import io.github.flameyossnowy.linkage.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A condition tree over one entity's fields.
 * <p>
 * Field names are logical names; the storage layer maps them to columns through the entity model.
 * {@link RelationCondition} names a relation and is turned into a {@link ResolvedRelationCondition}
 * before it reaches the storage layer.
 */
public sealed interface WhereParam permits Filter, WhereParam.And, WhereParam.Or, WhereParam.Not,
    WhereParam.RelationCondition, WhereParam.ResolvedRelationCondition {

    record And(@NotNull List<WhereParam> conditions) implements WhereParam {
        public And {
            conditions = List.copyOf(conditions);
        }
    }

    record Or(@NotNull List<WhereParam> conditions) implements WhereParam {
        public Or {
            conditions = List.copyOf(conditions);
        }
    }

    /**
     * Negates the conjunction of its conditions.
     */
    record Not(@NotNull List<WhereParam> conditions) implements WhereParam {
        public Not {
            conditions = List.copyOf(conditions);
        }
    }

    record RelationCondition(
        @NotNull String relation,
        @NotNull RelationQuantifier quantifier,
        @NotNull List<WhereParam> conditions
    ) implements WhereParam {
        public RelationCondition {
            conditions = List.copyOf(conditions);
        }
    }

    /**
     * A relation condition with its join columns looked up, ready to render as a correlated subquery.
     *
     * @param target         the related entity
     * @param targetColumn   column on the related table joined against {@code localColumn}
     * @param localColumn    column on the outer table
     */
    record ResolvedRelationCondition(
        @NotNull EntityModel<?> target,
        @NotNull String targetColumn,
        @NotNull String localColumn,
        @NotNull RelationQuantifier quantifier,
        @NotNull List<WhereParam> conditions
    ) implements WhereParam {
        public ResolvedRelationCondition {
            conditions = List.copyOf(conditions);
        }
    }

    static WhereParam and(WhereParam... conditions) {
        return new And(List.of(conditions));
    }

    static WhereParam or(WhereParam... conditions) {
        return new Or(List.of(conditions));
    }

    static WhereParam not(WhereParam... conditions) {
        return new Not(List.of(conditions));
    }

    static WhereParam some(String relation, WhereParam... conditions) {
        return new RelationCondition(relation, RelationQuantifier.SOME, List.of(conditions));
    }

    static WhereParam every(String relation, WhereParam... conditions) {
        return new RelationCondition(relation, RelationQuantifier.EVERY, List.of(conditions));
    }

    static WhereParam none(String relation, WhereParam... conditions) {
        return new RelationCondition(relation, RelationQuantifier.NONE, List.of(conditions));
    }
}
