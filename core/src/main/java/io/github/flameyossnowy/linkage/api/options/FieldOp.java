package io.github.flameyossnowy.linkage.api.options;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The operation half of a {@link Filter}.
 * <p>
 * Scalar comparisons carry their operand as an already decoded Java value. JSON variants
 * carry Jackson nodes, or a path plus an inner operation applied to the extracted value.
 */
public sealed interface FieldOp {

    record Equals(@Nullable Object value) implements FieldOp {}

    record NotEquals(@Nullable Object value) implements FieldOp {}

    record Gt(@NotNull Object value) implements FieldOp {}

    record Lt(@NotNull Object value) implements FieldOp {}

    record Gte(@NotNull Object value) implements FieldOp {}

    record Lte(@NotNull Object value) implements FieldOp {}

    record In(@NotNull List<?> values) implements FieldOp {
        public In {
            values = List.copyOf(values);
        }
    }

    record NotIn(@NotNull List<?> values) implements FieldOp {
        public NotIn {
            values = List.copyOf(values);
        }
    }

    record Contains(@NotNull String value) implements FieldOp {}

    record StartsWith(@NotNull String value) implements FieldOp {}

    record EndsWith(@NotNull String value) implements FieldOp {}

    record IsNull() implements FieldOp {}

    record IsNotNull() implements FieldOp {}

    /**
     * Applies {@code inner} to the JSON value found at {@code path}, for example
     * {@code ["profile", "name"]}.
     */
    record JsonPath(@NotNull List<String> path, @NotNull FieldOp inner) implements FieldOp {
        public JsonPath {
            path = List.copyOf(path);
            Objects.requireNonNull(inner, "inner");
            if (inner instanceof JsonPath) {
                throw new IllegalArgumentException("JSON paths cannot be nested, concatenate the path instead");
            }
        }
    }

    record JsonStringContains(@NotNull String value) implements FieldOp {}

    record JsonStringStartsWith(@NotNull String value) implements FieldOp {}

    record JsonStringEndsWith(@NotNull String value) implements FieldOp {}

    record JsonArrayContains(@NotNull JsonNode value) implements FieldOp {}

    record JsonArrayStartsWith(@NotNull JsonNode value) implements FieldOp {}

    record JsonArrayEndsWith(@NotNull JsonNode value) implements FieldOp {}

    record JsonObjectContains(@NotNull String key) implements FieldOp {}

    record JsonNull(@NotNull JsonNullKind kind) implements FieldOp {}

    default boolean isJson() {
        return this instanceof JsonPath
            || this instanceof JsonStringContains
            || this instanceof JsonStringStartsWith
            || this instanceof JsonStringEndsWith
            || this instanceof JsonArrayContains
            || this instanceof JsonArrayStartsWith
            || this instanceof JsonArrayEndsWith
            || this instanceof JsonObjectContains
            || this instanceof JsonNull;
    }
}
