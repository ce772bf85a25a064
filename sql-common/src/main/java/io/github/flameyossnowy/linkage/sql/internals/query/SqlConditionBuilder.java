package io.github.flameyossnowy.linkage.sql.internals.query;

import io.github.flameyossnowy.linkage.api.meta.FieldModel;
import io.github.flameyossnowy.linkage.api.meta.ValueConverter;
import io.github.flameyossnowy.linkage.api.options.FieldOp;
import io.github.flameyossnowy.linkage.api.options.Filter;
import io.github.flameyossnowy.linkage.api.options.QueryMode;
import io.github.flameyossnowy.linkage.api.options.WhereParam;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders condition trees to SQL, appending bound values to the caller's parameter list in order.
 */
public final class SqlConditionBuilder {
    private static final String ALWAYS = "1 = 1";
    private static final String NEVER = "1 = 0";

    private final QueryParseEngine.SQLType sqlType;
    private final SqlJsonConditionBuilder jsonBuilder;

    public SqlConditionBuilder(QueryParseEngine.SQLType sqlType) {
        this.sqlType = sqlType;
        this.jsonBuilder = new SqlJsonConditionBuilder(sqlType, this);
    }

    /**
     * The conditions joined with {@code AND}, or an empty string when there are none.
     */
    public String buildConditions(@NotNull List<WhereParam> filters, @NotNull SqlScope scope, @NotNull List<Object> params) {
        StringJoiner joiner = new StringJoiner(" AND ");
        for (WhereParam filter : filters) {
            joiner.add(buildCondition(filter, scope, params));
        }
        return joiner.toString();
    }

    public String buildCondition(@NotNull WhereParam filter, @NotNull SqlScope scope, @NotNull List<Object> params) {
        if (filter instanceof Filter f) {
            return buildFilter(f, scope, params);
        }
        if (filter instanceof WhereParam.And and) {
            return and.conditions().isEmpty() ? ALWAYS : group(and.conditions(), " AND ", scope, params);
        }
        if (filter instanceof WhereParam.Or or) {
            return or.conditions().isEmpty() ? NEVER : group(or.conditions(), " OR ", scope, params);
        }
        if (filter instanceof WhereParam.Not not) {
            return not.conditions().isEmpty() ? ALWAYS : "NOT " + group(not.conditions(), " AND ", scope, params);
        }
        if (filter instanceof WhereParam.ResolvedRelationCondition relation) {
            return buildRelationCondition(relation, scope, params);
        }
        throw new IllegalStateException("Unresolved condition reached the SQL layer: " + filter);
    }

    private String group(List<WhereParam> conditions, String separator, SqlScope scope, List<Object> params) {
        StringJoiner joiner = new StringJoiner(separator, "(", ")");
        for (WhereParam condition : conditions) {
            joiner.add(buildCondition(condition, scope, params));
        }
        return joiner.toString();
    }

    /**
     * {@code EXISTS} over the related rows joined to the current row. {@code EVERY} is "no related row fails".
     */
    private String buildRelationCondition(WhereParam.ResolvedRelationCondition relation, SqlScope scope, List<Object> params) {
        String alias = sqlType.quote(scope.nextAlias());
        SqlScope inner = scope.nested(relation.target(), alias);

        StringBuilder sql = new StringBuilder("SELECT 1 FROM ")
            .append(sqlType.quote(relation.target().tableName())).append(' ').append(alias)
            .append(" WHERE ").append(alias).append('.').append(sqlType.quote(relation.targetColumn()))
            .append(" = ").append(scope.qualifier()).append('.').append(sqlType.quote(relation.localColumn()));

        String nested = relation.conditions().isEmpty() ? "" : group(relation.conditions(), " AND ", inner, params);
        return switch (relation.quantifier()) {
            case SOME -> "EXISTS (" + sql + (nested.isEmpty() ? "" : " AND " + nested) + ")";
            case NONE -> "NOT EXISTS (" + sql + (nested.isEmpty() ? "" : " AND " + nested) + ")";
            case EVERY -> nested.isEmpty() ? ALWAYS : "NOT EXISTS (" + sql + " AND NOT " + nested + ")";
        };
    }

    private String buildFilter(Filter filter, SqlScope scope, List<Object> params) {
        FieldModel<?> field = scope.model().fieldByName(filter.field());
        String column = column(scope, filter.field());
        if (filter.operation().isJson()) {
            return jsonBuilder.buildJsonCondition(column, filter.operation(), filter.mode(), params);
        }
        return buildOperation(column, filter.operation(), filter.mode(), field, params);
    }

    public String column(SqlScope scope, String field) {
        return scope.qualifier() + '.' + sqlType.quote(scope.model().columnOf(field));
    }

    /**
     * Applies a scalar operation to an arbitrary SQL expression.
     *
     * @param field the field the expression reads, used to convert bound values; null for computed expressions
     */
    public String buildOperation(
        @NotNull String expression,
        @NotNull FieldOp operation,
        @NotNull QueryMode mode,
        @Nullable FieldModel<?> field,
        @NotNull List<Object> params
    ) {
        boolean insensitive = mode == QueryMode.INSENSITIVE;
        if (operation instanceof FieldOp.Equals equals) {
            if (equals.value() == null) return expression + " IS NULL";
            return compare(expression, "=", equals.value(), insensitive, field, params);
        }
        if (operation instanceof FieldOp.NotEquals notEquals) {
            if (notEquals.value() == null) return expression + " IS NOT NULL";
            return compare(expression, "<>", notEquals.value(), insensitive, field, params);
        }
        if (operation instanceof FieldOp.Gt gt) return compare(expression, ">", gt.value(), false, field, params);
        if (operation instanceof FieldOp.Lt lt) return compare(expression, "<", lt.value(), false, field, params);
        if (operation instanceof FieldOp.Gte gte) return compare(expression, ">=", gte.value(), false, field, params);
        if (operation instanceof FieldOp.Lte lte) return compare(expression, "<=", lte.value(), false, field, params);
        if (operation instanceof FieldOp.In in) {
            if (in.values().isEmpty()) return NEVER;
            return in(expression, "IN", in.values(), insensitive, field, params);
        }
        if (operation instanceof FieldOp.NotIn notIn) {
            if (notIn.values().isEmpty()) return ALWAYS;
            return in(expression, "NOT IN", notIn.values(), insensitive, field, params);
        }
        if (operation instanceof FieldOp.Contains contains) return like(expression, contains.value(), true, true, insensitive, params);
        if (operation instanceof FieldOp.StartsWith startsWith) return like(expression, startsWith.value(), false, true, insensitive, params);
        if (operation instanceof FieldOp.EndsWith endsWith) return like(expression, endsWith.value(), true, false, insensitive, params);
        if (operation instanceof FieldOp.IsNull) return expression + " IS NULL";
        if (operation instanceof FieldOp.IsNotNull) return expression + " IS NOT NULL";
        throw new IllegalArgumentException("Operation " + operation + " cannot be applied to a plain column");
    }

    private static String compare(String expression, String operator, Object value, boolean insensitive, FieldModel<?> field, List<Object> params) {
        params.add(bind(field, value));
        if (insensitive) {
            return "LOWER(" + expression + ") " + operator + " LOWER(?)";
        }
        return expression + ' ' + operator + " ?";
    }

    private static String in(String expression, String operator, List<?> values, boolean insensitive, FieldModel<?> field, List<Object> params) {
        String placeholder = insensitive ? "LOWER(?)" : "?";
        for (Object value : values) {
            params.add(bind(field, value));
        }
        String target = insensitive ? "LOWER(" + expression + ")" : expression;
        return target + ' ' + operator + " (" + String.join(", ", Collections.nCopies(values.size(), placeholder)) + ")";
    }

    /**
     * Substring matching. SQLite's {@code LIKE} ignores ASCII case, so case-sensitive matching there uses {@code GLOB}.
     */
    String like(String expression, String value, boolean anyPrefix, boolean anySuffix, boolean insensitive, List<Object> params) {
        if (!insensitive && sqlType == QueryParseEngine.SQLType.SQLITE) {
            params.add((anyPrefix ? "*" : "") + escapeGlob(value) + (anySuffix ? "*" : ""));
            return expression + " GLOB ?";
        }
        params.add((anyPrefix ? "%" : "") + escapeLike(value) + (anySuffix ? "%" : ""));
        if (insensitive) {
            return "LOWER(" + expression + ") LIKE LOWER(?) ESCAPE '\\'";
        }
        return expression + " LIKE ? ESCAPE '\\'";
    }

    static Object bind(@Nullable FieldModel<?> field, Object value) {
        return field == null ? ValueConverter.toDbValue(value) : field.toDbValue(value);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static String escapeGlob(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[') {
                escaped.append('[').append(c).append(']');
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
