package io.github.flameyossnowy.linkage.api.key;

import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.UUID;

/**
 * A primary or foreign key value.
 * <p>
 * Keys are immutable and usable as map or set elements. {@link #toString()} produces the canonical
 * text form ({@code Int(1)}, {@code BigInt(7)}, {@code String(abc)}, {@code Uuid(...)}) which
 * {@link #parse(String)} reads back.
 */
public sealed interface Key permits Key.Int, Key.BigInt, Key.Str, Key.Uuid {

    /**
     * The scalar handed to the storage layer.
     */
    @NotNull Object toDbValue();

    record Int(int value) implements Key {
        @Override
        public @NotNull Object toDbValue() {
            return value;
        }

        @Override
        public String toString() {
            return "Int(" + value + ')';
        }
    }

    record BigInt(long value) implements Key {
        @Override
        public @NotNull Object toDbValue() {
            return value;
        }

        @Override
        public String toString() {
            return "BigInt(" + value + ')';
        }
    }

    record Str(@NotNull String value) implements Key {
        @Override
        public @NotNull Object toDbValue() {
            return value;
        }

        @Override
        public String toString() {
            return "String(" + value + ')';
        }
    }

    record Uuid(@NotNull UUID value) implements Key {
        @Override
        public @NotNull Object toDbValue() {
            return value;
        }

        @Override
        public String toString() {
            return "Uuid(" + value + ')';
        }
    }

    static @NotNull Key of(int value) {
        return new Int(value);
    }

    static @NotNull Key of(long value) {
        return new BigInt(value);
    }

    static @NotNull Key of(@NotNull String value) {
        return new Str(value);
    }

    static @NotNull Key of(@NotNull UUID value) {
        return new Uuid(value);
    }

    /**
     * Typed extraction from an already decoded field value.
     *
     * @throws TypeConversionException if the value cannot act as a key
     */
    @Contract("null -> fail")
    static @NotNull Key of(@Nullable Object value) {
        if (value instanceof Key key) return key;
        return fromDbValue(value).orElseThrow(() -> new TypeConversionException(
            "Cannot use " + (value == null ? "null" : value.getClass().getSimpleName()) + " as a key"));
    }

    /**
     * Converts a raw storage scalar into a key, or empty when the value has no key representation.
     */
    static @NotNull Optional<Key> fromDbValue(@Nullable Object value) {
        if (value == null) return Optional.empty();
        if (value instanceof Integer i) return Optional.of(new Int(i));
        if (value instanceof Short s) return Optional.of(new Int(s));
        if (value instanceof Byte b) return Optional.of(new Int(b));
        if (value instanceof Long l) return Optional.of(new BigInt(l));
        if (value instanceof String s) return Optional.of(new Str(s));
        if (value instanceof UUID u) return Optional.of(new Uuid(u));
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? Optional.of(new BigInt(big.longValue())) : Optional.empty();
        }
        if (value instanceof BigDecimal decimal) {
            try {
                return Optional.of(new BigInt(decimal.longValueExact()));
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Parses the canonical text form, optionally wrapped in {@code Equals(...)}.
     * Never throws; malformed input gives an empty result.
     */
    static @NotNull Optional<Key> parse(@Nullable String text) {
        if (text == null) return Optional.empty();
        String input = text.trim();
        if (input.startsWith("Equals(") && input.endsWith(")")) {
            input = input.substring("Equals(".length(), input.length() - 1).trim();
        }

        int open = input.indexOf('(');
        if (open <= 0 || !input.endsWith(")")) return Optional.empty();

        String tag = input.substring(0, open);
        String body = input.substring(open + 1, input.length() - 1);
        try {
            return switch (tag) {
                case "Int" -> Optional.of(new Int(Integer.parseInt(body)));
                case "BigInt" -> Optional.of(new BigInt(Long.parseLong(body)));
                case "String" -> Optional.of(new Str(unquote(body)));
                case "Uuid" -> Optional.of(new Uuid(UUID.fromString(unquote(body))));
                default -> Optional.empty();
            };
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String unquote(String body) {
        if (body.length() >= 2 && body.charAt(0) == '"' && body.charAt(body.length() - 1) == '"') {
            return body.substring(1, body.length() - 1);
        }
        return body;
    }
}
