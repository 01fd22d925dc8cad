package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.ir.FieldFormat;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Formats resolved field values. Values of a type a format does not apply to are
 * rendered as their plain string form; null and empty values always render empty.
 * The result is not escaped.
 */
public final class ValueFormatter {

    private static final String CURRENCY_SYMBOL = "$";

    private ValueFormatter() {}

    /**
     * @param value The resolved value. Can be null.
     * @param format The format, or null for the raw value.
     * @param decimalPlaces Overrides the format's default precision. Can be null.
     * @return The formatted text.
     */
    public static String format(Object value, FieldFormat format, Integer decimalPlaces) {
        if (value == null || "".equals(value)) {
            return "";
        }
        if (format == null) {
            return raw(value);
        }
        int places = decimalPlaces != null ? decimalPlaces : format.defaultDecimalPlaces();
        switch (format) {
            case NUMBER: {
                BigDecimal number = decimal(value);
                return number == null ? raw(value) : number.setScale(places, RoundingMode.HALF_UP).toPlainString();
            }
            case CURRENCY: {
                BigDecimal number = decimal(value);
                return number == null ? raw(value)
                        : CURRENCY_SYMBOL + number.setScale(places, RoundingMode.HALF_UP).toPlainString();
            }
            case PERCENT: {
                BigDecimal number = decimal(value);
                return number == null ? raw(value)
                        : number.movePointRight(2).setScale(places, RoundingMode.HALF_UP).toPlainString() + "%";
            }
            case DATE:
                return date(value);
            case DATETIME:
                return dateTime(value);
            default:
                return raw(value);
        }
    }

    private static String raw(Object value) {
        if (value instanceof Double d && !d.isNaN() && !d.isInfinite()) {
            return BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof Float f && !f.isNaN() && !f.isInfinite()) {
            return new BigDecimal(f.toString()).toPlainString();
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        return String.valueOf(value);
    }

    private static BigDecimal decimal(Object value) {
        if (value instanceof BigDecimal d) return d;
        if (value instanceof BigInteger i) return new BigDecimal(i);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double d && !d.isNaN() && !d.isInfinite()) return BigDecimal.valueOf(d);
        if (value instanceof Float f && !f.isNaN() && !f.isInfinite()) return new BigDecimal(f.toString());
        return null;
    }

    private static String date(Object value) {
        if (value instanceof LocalDate d) return d.format(DateTimeFormatter.ISO_LOCAL_DATE);
        if (value instanceof LocalDateTime dt) return dt.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        if (value instanceof OffsetDateTime dt) return dt.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        if (value instanceof ZonedDateTime dt) return dt.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        if (value instanceof Instant i) return i.atOffset(ZoneOffset.UTC).toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        return raw(value);
    }

    private static String dateTime(Object value) {
        if (value instanceof LocalDateTime dt) return wallClock(dt);
        if (value instanceof OffsetDateTime dt) return wallClock(dt.toLocalDateTime()) + offset(dt.getOffset());
        if (value instanceof ZonedDateTime dt) return wallClock(dt.toLocalDateTime()) + offset(dt.getOffset());
        if (value instanceof Instant i) return wallClock(LocalDateTime.ofInstant(i, ZoneOffset.UTC)) + "Z";
        return raw(value);
    }

    private static String wallClock(LocalDateTime dt) {
        return dt.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE) + " "
                + dt.toLocalTime().format(DateTimeFormatter.ISO_LOCAL_TIME);
    }

    private static String offset(ZoneOffset offset) {
        return ZoneOffset.UTC.equals(offset) ? "Z" : offset.getId();
    }
}
