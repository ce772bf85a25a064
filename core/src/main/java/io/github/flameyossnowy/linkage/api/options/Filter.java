package io.github.flameyossnowy.linkage.api.options;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A single predicate on one field: {@code field <operation>}.
 *
 * <pre>{@code
 * Filter.gte("age", 18);
 * Filter.contains("name", "ann").insensitive();
 * Filter.json("customData", List.of("tier"), new FieldOp.Equals("gold"));
 * }</pre>
 */
public record Filter(@NotNull String field, @NotNull FieldOp operation, @NotNull QueryMode mode) implements WhereParam {

    public Filter {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(mode, "mode");
    }

    public Filter(@NotNull String field, @NotNull FieldOp operation) {
        this(field, operation, QueryMode.DEFAULT);
    }

    @Contract(pure = true)
    public @NotNull Filter insensitive() {
        return new Filter(field, operation, QueryMode.INSENSITIVE);
    }

    public static Filter equals(String field, @Nullable Object value) {
        return new Filter(field, new FieldOp.Equals(value));
    }

    public static Filter notEquals(String field, @Nullable Object value) {
        return new Filter(field, new FieldOp.NotEquals(value));
    }

    public static Filter gt(String field, Object value) {
        return new Filter(field, new FieldOp.Gt(value));
    }

    public static Filter lt(String field, Object value) {
        return new Filter(field, new FieldOp.Lt(value));
    }

    public static Filter gte(String field, Object value) {
        return new Filter(field, new FieldOp.Gte(value));
    }

    public static Filter lte(String field, Object value) {
        return new Filter(field, new FieldOp.Lte(value));
    }

    public static Filter in(String field, Collection<?> values) {
        return new Filter(field, new FieldOp.In(List.copyOf(values)));
    }

    public static Filter notIn(String field, Collection<?> values) {
        return new Filter(field, new FieldOp.NotIn(List.copyOf(values)));
    }

    public static Filter contains(String field, String value) {
        return new Filter(field, new FieldOp.Contains(value));
    }

    public static Filter startsWith(String field, String value) {
        return new Filter(field, new FieldOp.StartsWith(value));
    }

    public static Filter endsWith(String field, String value) {
        return new Filter(field, new FieldOp.EndsWith(value));
    }

    public static Filter isNull(String field) {
        return new Filter(field, new FieldOp.IsNull());
    }

    public static Filter isNotNull(String field) {
        return new Filter(field, new FieldOp.IsNotNull());
    }

    public static Filter json(String field, List<String> path, FieldOp inner) {
        return new Filter(field, new FieldOp.JsonPath(path, inner));
    }

    public static Filter jsonArrayContains(String field, JsonNode value) {
        return new Filter(field, new FieldOp.JsonArrayContains(value));
    }

    public static Filter jsonObjectContains(String field, String key) {
        return new Filter(field, new FieldOp.JsonObjectContains(key));
    }

    public static Filter jsonNull(String field, JsonNullKind kind) {
        return new Filter(field, new FieldOp.JsonNull(kind));
    }
}
