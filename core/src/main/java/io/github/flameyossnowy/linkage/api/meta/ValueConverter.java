package io.github.flameyossnowy.linkage.api.meta;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.linkage.api.exceptions.TypeConversionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Converts between storage scalars and the Java types declared by {@link FieldModel}s.
 * <p>
 * Drivers disagree on how they hand back integers, booleans and timestamps, so every decoded
 * value passes through {@link #fromDbValue(Object, Class)} before it reaches an entity.
 */
public final class ValueConverter {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private ValueConverter() {}

    public static @Nullable Object fromDbValue(@Nullable Object raw, @NotNull Class<?> type) {
        if (raw == null) return null;
        if (type.isInstance(raw) && !(raw instanceof String && JsonNode.class.isAssignableFrom(type))) {
            return raw;
        }

        try {
            if (type == Integer.class || type == int.class) return toInteger(raw).intValueExact();
            if (type == Long.class || type == long.class) return toInteger(raw).longValueExact();
            if (type == Short.class || type == short.class) return toInteger(raw).shortValueExact();
            if (type == Double.class || type == double.class) return toNumber(raw).doubleValue();
            if (type == Float.class || type == float.class) return toNumber(raw).floatValue();
            if (type == BigDecimal.class) return new BigDecimal(raw.toString());
            if (type == BigInteger.class) return new BigInteger(raw.toString());
            if (type == Boolean.class || type == boolean.class) return toBoolean(raw);
            if (type == String.class) return raw.toString();
            if (type == UUID.class) return UUID.fromString(raw.toString());
            if (type == Instant.class) return toInstant(raw);
            if (type == LocalDateTime.class) return LocalDateTime.ofInstant(toInstant(raw), ZoneOffset.UTC);
            if (type == LocalDate.class) return LocalDate.parse(raw.toString());
            if (JsonNode.class.isAssignableFrom(type)) return MAPPER.readTree(raw.toString());
            if (type.isEnum()) return toEnum(raw, type);
        } catch (JsonProcessingException | IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
            throw new TypeConversionException("Cannot convert " + raw + " to " + type.getSimpleName(), e);
        }

        throw new TypeConversionException("Cannot convert " + raw.getClass().getSimpleName() + " to " + type.getSimpleName());
    }

    /**
     * Converts a Java value to what the storage layer binds as a statement parameter.
     */
    public static @Nullable Object toDbValue(@Nullable Object value) {
        if (value == null) return null;
        if (value instanceof JsonNode node) return node.toString();
        if (value instanceof Enum<?> constant) return constant.name();
        if (value instanceof UUID uuid) return uuid.toString();
        if (value instanceof Instant instant) return instant.toEpochMilli();
        if (value instanceof LocalDateTime time) return time.toInstant(ZoneOffset.UTC).toEpochMilli();
        if (value instanceof LocalDate date) return date.toString();
        return value;
    }

    private static Number toNumber(Object raw) {
        if (raw instanceof Number number) return number;
        if (raw instanceof Boolean bool) return bool ? 1 : 0;
        return new BigDecimal(raw.toString());
    }

    /**
     * Drops any fraction. Range checks are left to the caller's {@code *ValueExact} call.
     */
    private static BigInteger toInteger(Object raw) {
        if (raw instanceof BigInteger integer) return integer;
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return BigInteger.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof BigDecimal decimal) return decimal.toBigInteger();
        if (raw instanceof Double || raw instanceof Float) {
            return BigDecimal.valueOf(((Number) raw).doubleValue()).toBigInteger();
        }
        return new BigDecimal(toNumber(raw).toString()).toBigInteger();
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean bool) return bool;
        if (raw instanceof Number number) return number.intValue() != 0;
        String text = raw.toString();
        if ("1".equals(text) || "true".equalsIgnoreCase(text)) return true;
        if ("0".equals(text) || "false".equalsIgnoreCase(text)) return false;
        throw new IllegalArgumentException("Not a boolean: " + text);
    }

    private static Instant toInstant(Object raw) {
        if (raw instanceof Timestamp timestamp) return timestamp.toInstant();
        if (raw instanceof java.util.Date date) return date.toInstant();
        if (raw instanceof Number number) return Instant.ofEpochMilli(number.longValue());
        String text = raw.toString();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        return Instant.parse(text);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object toEnum(Object raw, Class<?> type) {
        Object[] constants = type.getEnumConstants();
        if (raw instanceof Number number) {
            int ordinal = toInteger(number).intValueExact();
            if (ordinal < 0 || ordinal >= constants.length) {
                throw new TypeConversionException("No " + type.getSimpleName() + " constant with ordinal " + number);
            }
            return constants[ordinal];
        }
        return Enum.valueOf((Class) type, raw.toString());
    }
}
