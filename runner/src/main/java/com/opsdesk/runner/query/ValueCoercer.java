package com.opsdesk.runner.query;

import com.opsdesk.runner.command.CommandException;
import org.springframework.core.convert.ConversionException;
import org.springframework.core.convert.support.DefaultConversionService;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Converts query literals to the Java type of the attribute they are
 * compared with. Temporal values are interpreted in the runner's zone.
 */
final class ValueCoercer {

    private final ZoneId zone;

    ValueCoercer(ZoneId zone) {
        this.zone = zone;
    }

    Object coerce(Object value, Class<?> target, String field) {
        if (value == null) return null;
        Class<?> type = box(target);
        if (type.isInstance(value)) return value;
        try {
            if (Number.class.isAssignableFrom(type)) return toNumber(value, type);
            if (type == String.class)                return String.valueOf(value);
            if (type == Boolean.class)               return toBoolean(value);
            if (type.isEnum())                       return toEnum(value, type);
            if (type == LocalDate.class)             return toLocalDate(value);
            if (type == LocalDateTime.class)         return toLocalDateTime(value);
            if (type == Instant.class)               return toInstant(value);
            if (type == OffsetDateTime.class)        return toInstant(value).atZone(zone).toOffsetDateTime();
            if (type == ZonedDateTime.class)         return toInstant(value).atZone(zone);
            Object converted = DefaultConversionService.getSharedInstance().convert(value, type);
            if (converted != null) return converted;
        } catch (IllegalArgumentException | DateTimeParseException | ConversionException | ArithmeticException e) {
            throw mismatch(value, type, field, e);
        }
        throw mismatch(value, type, field, null);
    }

    LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate d)      return d;
        if (value instanceof LocalDateTime dt) return dt.toLocalDate();
        if (value instanceof Instant i)        return i.atZone(zone).toLocalDate();
        String text = String.valueOf(value).strip();
        return text.length() > 10 ? toLocalDateTime(text).toLocalDate() : LocalDate.parse(text);
    }

    LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime dt) return dt;
        if (value instanceof LocalDate d)      return d.atStartOfDay();
        if (value instanceof Instant i)        return LocalDateTime.ofInstant(i, zone);
        String text = String.valueOf(value).strip();
        if (text.length() <= 10) return LocalDate.parse(text).atStartOfDay();
        if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
            return LocalDateTime.ofInstant(OffsetDateTime.parse(text).toInstant(), zone);
        }
        return LocalDateTime.parse(text.replace(' ', 'T'));
    }

    Instant toInstant(Object value) {
        if (value instanceof Instant i) return i;
        return toLocalDateTime(value).atZone(zone).toInstant();
    }

    private static Object toNumber(Object value, Class<?> type) {
        BigDecimal n = value instanceof Number num
                ? new BigDecimal(num.toString())
                : new BigDecimal(String.valueOf(value).strip());
        if (type == Long.class)       return n.longValueExact();
        if (type == Integer.class)    return n.intValueExact();
        if (type == Short.class)      return n.shortValueExact();
        if (type == Byte.class)       return n.byteValueExact();
        if (type == Double.class)     return n.doubleValue();
        if (type == Float.class)      return n.floatValue();
        if (type == BigInteger.class) return n.toBigIntegerExact();
        return n;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Number n) return n.intValue() != 0;
        String text = String.valueOf(value).strip().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "1", "yes"  -> Boolean.TRUE;
            case "false", "0", "no"  -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("not a boolean: " + value);
        };
    }

    private static Object toEnum(Object value, Class<?> type) {
        String text = String.valueOf(value).strip();
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(text)) return constant;
        }
        throw new IllegalArgumentException("no constant " + text);
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class)     return Integer.class;
        if (type == long.class)    return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class)  return Double.class;
        if (type == float.class)   return Float.class;
        if (type == short.class)   return Short.class;
        if (type == byte.class)    return Byte.class;
        if (type == char.class)    return Character.class;
        return type;
    }

    private static CommandException mismatch(Object value, Class<?> type, String field, Exception cause) {
        String message = "Cannot compare field '" + field + "' (" + type.getSimpleName() + ") with " + describe(value);
        return cause == null
                ? new CommandException(CommandException.Kind.EXECUTION_ERROR, message)
                : new CommandException(CommandException.Kind.EXECUTION_ERROR, message, cause);
    }

    private static String describe(Object value) {
        return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
    }
}
