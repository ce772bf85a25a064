package io.github.flameyossnowy.linkage.sql.internals.query;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.flameyossnowy.linkage.api.options.FieldOp;
import io.github.flameyossnowy.linkage.api.options.JsonNullKind;
import io.github.flameyossnowy.linkage.api.options.QueryMode;
import io.github.flameyossnowy.linkage.sql.internals.QueryParseEngine;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * JSON filters per dialect: SQLite's {@code json_extract}/{@code json_each}, PostgreSQL's {@code jsonb}
 * operators and MySQL's {@code JSON_*} functions. Paths are always bound as parameters.
 */
final class SqlJsonConditionBuilder {
    private final QueryParseEngine.SQLType sqlType;
    private final SqlConditionBuilder conditionBuilder;

    SqlJsonConditionBuilder(QueryParseEngine.SQLType sqlType, SqlConditionBuilder conditionBuilder) {
        this.sqlType = sqlType;
        this.conditionBuilder = conditionBuilder;
    }

    String buildJsonCondition(@NotNull String column, @NotNull FieldOp operation, @NotNull QueryMode mode, @NotNull List<Object> params) {
        List<String> path = List.of();
        FieldOp inner = operation;
        if (operation instanceof FieldOp.JsonPath jsonPath) {
            path = jsonPath.path();
            inner = jsonPath.inner();
        }

        if (!inner.isJson()) {
            return scalarAtPath(column, path, inner, mode, params);
        }
        return switch (sqlType) {
            case SQLITE -> sqlite(column, path, inner, mode, params);
            case POSTGRESQL -> postgres(column, path, inner, mode, params);
            case MYSQL -> mysql(column, path, inner, mode, params);
        };
    }

    private String scalarAtPath(String column, List<String> path, FieldOp operation, QueryMode mode, List<Object> params) {
        String expression;
        if (sqlType == QueryParseEngine.SQLType.POSTGRESQL) {
            params.add(postgresPath(path));
            expression = isNumeric(operation) ? "(" + column + "::jsonb #>> ?::text[])::numeric" : "(" + column + "::jsonb #>> ?::text[])";
        } else if (sqlType == QueryParseEngine.SQLType.MYSQL) {
            params.add(jsonPath(path));
            expression = "JSON_UNQUOTE(JSON_EXTRACT(" + column + ", ?))";
        } else {
            params.add(jsonPath(path));
            expression = "json_extract(" + column + ", ?)";
        }
        return conditionBuilder.buildOperation(expression, unwrapJsonValues(operation), mode, null, params);
    }

    private String sqlite(String column, List<String> path, FieldOp operation, QueryMode mode, List<Object> params) {
        String base = jsonPath(path);
        if (operation instanceof FieldOp.JsonStringContains contains) {
            params.add(base);
            return conditionBuilder.like("json_extract(" + column + ", ?)", contains.value(), true, true, mode == QueryMode.INSENSITIVE, params);
        }
        if (operation instanceof FieldOp.JsonStringStartsWith startsWith) {
            params.add(base);
            return conditionBuilder.like("json_extract(" + column + ", ?)", startsWith.value(), false, true, mode == QueryMode.INSENSITIVE, params);
        }
        if (operation instanceof FieldOp.JsonStringEndsWith endsWith) {
            params.add(base);
            return conditionBuilder.like("json_extract(" + column + ", ?)", endsWith.value(), true, false, mode == QueryMode.INSENSITIVE, params);
        }
        if (operation instanceof FieldOp.JsonArrayContains contains) {
            params.add(base);
            params.add(sqliteValue(contains.value()));
            return "EXISTS (SELECT 1 FROM json_each(" + column + ", ?) WHERE json_each.value = " + sqlitePlaceholder(contains.value()) + ")";
        }
        if (operation instanceof FieldOp.JsonArrayStartsWith startsWith) {
            params.add(base + "[0]");
            params.add(sqliteValue(startsWith.value()));
            return "json_extract(" + column + ", ?) = " + sqlitePlaceholder(startsWith.value());
        }
        if (operation instanceof FieldOp.JsonArrayEndsWith endsWith) {
            params.add(base + "[#-1]");
            params.add(sqliteValue(endsWith.value()));
            return "json_extract(" + column + ", ?) = " + sqlitePlaceholder(endsWith.value());
        }
        if (operation instanceof FieldOp.JsonObjectContains contains) {
            params.add(base + key(contains.key()));
            return "json_type(" + column + ", ?) IS NOT NULL";
        }
        JsonNullKind kind = ((FieldOp.JsonNull) operation).kind();
        return jsonNull(kind, path.isEmpty() ? column + " IS NULL" : "json_type(" + column + ", ?) IS NULL",
            "json_type(" + column + ", ?) = 'null'", path.isEmpty() ? null : base, base, params);
    }

    private String postgres(String column, List<String> path, FieldOp operation, QueryMode mode, List<Object> params) {
        String text = path.isEmpty() ? "(" + column + "::jsonb #>> '{}')" : "(" + column + "::jsonb #>> ?::text[])";
        String json = path.isEmpty() ? "(" + column + "::jsonb)" : "(" + column + "::jsonb #> ?::text[])";
        String pathParam = postgresPath(path);
        boolean insensitive = mode == QueryMode.INSENSITIVE;

        if (operation instanceof FieldOp.JsonStringContains contains) {
            addPath(path, pathParam, params);
            return conditionBuilder.like(text, contains.value(), true, true, insensitive, params);
        }
        if (operation instanceof FieldOp.JsonStringStartsWith startsWith) {
            addPath(path, pathParam, params);
            return conditionBuilder.like(text, startsWith.value(), false, true, insensitive, params);
        }
        if (operation instanceof FieldOp.JsonStringEndsWith endsWith) {
            addPath(path, pathParam, params);
            return conditionBuilder.like(text, endsWith.value(), true, false, insensitive, params);
        }
        if (operation instanceof FieldOp.JsonArrayContains contains) {
            addPath(path, pathParam, params);
            params.add("[" + contains.value() + "]");
            return json + " @> ?::jsonb";
        }
        if (operation instanceof FieldOp.JsonArrayStartsWith startsWith) {
            addPath(path, pathParam, params);
            params.add(startsWith.value().toString());
            return "(" + json + " -> 0) = ?::jsonb";
        }
        if (operation instanceof FieldOp.JsonArrayEndsWith endsWith) {
            addPath(path, pathParam, params);
            params.add(endsWith.value().toString());
            return "(" + json + " -> -1) = ?::jsonb";
        }
        if (operation instanceof FieldOp.JsonObjectContains contains) {
            addPath(path, pathParam, params);
            params.add(contains.key());
            return "jsonb_exists(" + json + ", ?)";
        }
        JsonNullKind kind = ((FieldOp.JsonNull) operation).kind();
        String pathOrNull = path.isEmpty() ? null : pathParam;
        return jsonNull(kind, json + " IS NULL", "jsonb_typeof(" + json + ") = 'null'", pathOrNull, pathOrNull, params);
    }

    private String mysql(String column, List<String> path, FieldOp operation, QueryMode mode, List<Object> params) {
        String base = jsonPath(path);
        boolean insensitive = mode == QueryMode.INSENSITIVE;

        if (operation instanceof FieldOp.JsonStringContains contains) {
            params.add(base);
            return conditionBuilder.like("JSON_UNQUOTE(JSON_EXTRACT(" + column + ", ?))", contains.value(), true, true, insensitive, params);
        }
        if (operation instanceof FieldOp.JsonStringStartsWith startsWith) {
            params.add(base);
            return conditionBuilder.like("JSON_UNQUOTE(JSON_EXTRACT(" + column + ", ?))", startsWith.value(), false, true, insensitive, params);
        }
        if (operation instanceof FieldOp.JsonStringEndsWith endsWith) {
            params.add(base);
            return conditionBuilder.like("JSON_UNQUOTE(JSON_EXTRACT(" + column + ", ?))", endsWith.value(), true, false, insensitive, params);
        }
        if (operation instanceof FieldOp.JsonArrayContains contains) {
            params.add(contains.value().toString());
            params.add(base);
            return "JSON_CONTAINS(" + column + ", ?, ?)";
        }
        if (operation instanceof FieldOp.JsonArrayStartsWith startsWith) {
            params.add(base + "[0]");
            params.add(startsWith.value().toString());
            return "JSON_EXTRACT(" + column + ", ?) = CAST(? AS JSON)";
        }
        if (operation instanceof FieldOp.JsonArrayEndsWith endsWith) {
            params.add(base + "[last]");
            params.add(endsWith.value().toString());
            return "JSON_EXTRACT(" + column + ", ?) = CAST(? AS JSON)";
        }
        if (operation instanceof FieldOp.JsonObjectContains contains) {
            params.add(base + key(contains.key()));
            return "JSON_CONTAINS_PATH(" + column + ", 'one', ?)";
        }
        JsonNullKind kind = ((FieldOp.JsonNull) operation).kind();
        return jsonNull(kind, path.isEmpty() ? column + " IS NULL" : "JSON_EXTRACT(" + column + ", ?) IS NULL",
            "JSON_TYPE(JSON_EXTRACT(" + column + ", ?)) = 'NULL'", path.isEmpty() ? null : base, base, params);
    }

    /**
     * @param dbNullParam   parameter of the database-null expression, or null when it has none
     * @param jsonNullParam parameter of the JSON-null expression, or null when it has none
     */
    private static String jsonNull(JsonNullKind kind, String dbNull, String jsonNull, String dbNullParam, String jsonNullParam, List<Object> params) {
        return switch (kind) {
            case DB_NULL -> {
                if (dbNullParam != null) params.add(dbNullParam);
                yield dbNull;
            }
            case JSON_NULL -> {
                if (jsonNullParam != null) params.add(jsonNullParam);
                yield jsonNull;
            }
            case ANY_NULL -> {
                if (dbNullParam != null) params.add(dbNullParam);
                if (jsonNullParam != null) params.add(jsonNullParam);
                yield "(" + dbNull + " OR " + jsonNull + ")";
            }
        };
    }

    private static void addPath(List<String> path, String pathParam, List<Object> params) {
        if (!path.isEmpty()) params.add(pathParam);
    }

    static String jsonPath(List<String> path) {
        StringBuilder builder = new StringBuilder("$");
        for (String segment : path) {
            if (isIndex(segment)) {
                builder.append('[').append(segment).append(']');
            } else {
                builder.append(key(segment));
            }
        }
        return builder.toString();
    }

    private static String key(String segment) {
        return ".\"" + segment.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static String postgresPath(List<String> path) {
        StringBuilder builder = new StringBuilder("{");
        for (int i = 0; i < path.size(); i++) {
            if (i > 0) builder.append(',');
            builder.append('"').append(path.get(i).replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
        }
        return builder.append('}').toString();
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) return false;
        for (char c : segment.toCharArray()) {
            if (!Character.isDigit(c)) return false;
        }
        return true;
    }

    private static boolean isNumeric(FieldOp operation) {
        Object value = null;
        if (operation instanceof FieldOp.Gt gt) value = gt.value();
        else if (operation instanceof FieldOp.Lt lt) value = lt.value();
        else if (operation instanceof FieldOp.Gte gte) value = gte.value();
        else if (operation instanceof FieldOp.Lte lte) value = lte.value();
        else if (operation instanceof FieldOp.Equals equals) value = equals.value();
        if (value instanceof JsonNode node) return node.isNumber();
        return value instanceof Number;
    }

    /**
     * Scalar comparisons at a path compare against the extracted SQL value, so JSON operands are unwrapped to scalars.
     */
    private FieldOp unwrapJsonValues(FieldOp operation) {
        if (operation instanceof FieldOp.Equals equals && equals.value() instanceof JsonNode node) return new FieldOp.Equals(scalar(node));
        if (operation instanceof FieldOp.NotEquals notEquals && notEquals.value() instanceof JsonNode node) return new FieldOp.NotEquals(scalar(node));
        if (operation instanceof FieldOp.Gt gt && gt.value() instanceof JsonNode node) return new FieldOp.Gt(scalar(node));
        if (operation instanceof FieldOp.Lt lt && lt.value() instanceof JsonNode node) return new FieldOp.Lt(scalar(node));
        if (operation instanceof FieldOp.Gte gte && gte.value() instanceof JsonNode node) return new FieldOp.Gte(scalar(node));
        if (operation instanceof FieldOp.Lte lte && lte.value() instanceof JsonNode node) return new FieldOp.Lte(scalar(node));
        if (sqlType == QueryParseEngine.SQLType.POSTGRESQL && !isNumeric(operation)) {
            if (operation instanceof FieldOp.Equals equals && equals.value() != null) return new FieldOp.Equals(equals.value().toString());
            if (operation instanceof FieldOp.NotEquals notEquals && notEquals.value() != null) return new FieldOp.NotEquals(notEquals.value().toString());
        }
        return operation;
    }

    private Object scalar(JsonNode node) {
        if (node.isTextual()) return node.textValue();
        if (node.isNumber()) return node.numberValue();
        if (node.isBoolean()) return sqlType == QueryParseEngine.SQLType.SQLITE ? (node.booleanValue() ? 1 : 0) : node.booleanValue();
        if (node.isNull()) return null;
        return node.toString();
    }

    private Object sqliteValue(JsonNode node) {
        return node.isContainerNode() ? node.toString() : scalar(node);
    }

    private static String sqlitePlaceholder(JsonNode node) {
        return node.isContainerNode() ? "json(?)" : "?";
    }
}
