package io.github.yok.dwloader.util;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Conversions between the values DBUnit and JDBC drivers hand back and the Java types used by the
 * transform and temporal code. Drivers differ in what they return for the same column type
 * (BIGINT as {@code Long} or {@code BigInteger}, DATE as {@code java.sql.Date} or
 * {@code LocalDate}).
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcValues {

    private JdbcValues() {}

    /**
     * Converts a numeric value to {@code Long}.
     *
     * @param value value from a result set, may be {@code null}
     * @return long value, or {@code null}
     * @throws IllegalArgumentException if the value is not numeric
     */
    public static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Not an integral value: " + value, e);
        }
    }

    /**
     * Converts a numeric value to {@code BigDecimal}.
     *
     * @param value value from a result set, may be {@code null}
     * @return decimal value, or {@code null}
     */
    public static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString().trim());
    }

    /**
     * Converts a date-like value to {@code LocalDate}.
     *
     * @param value {@link Date}, {@link Timestamp}, {@link LocalDate}, {@link LocalDateTime} or an
     *        ISO string
     * @return local date, or {@code null}
     */
    public static LocalDate toLocalDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        return LocalDate.parse(value.toString().trim().substring(0, 10));
    }

    /**
     * Converts a boolean-like value ({@code Boolean}, number, {@code "true"}/{@code "1"}).
     *
     * @param value value from a result set
     * @return boolean value, or {@code null}
     */
    public static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        String text = value.toString().trim();
        return "true".equalsIgnoreCase(text) || "1".equals(text);
    }

    /**
     * Converts a local date to the JDBC type written through DBUnit.
     *
     * @param date local date
     * @return SQL date, or {@code null}
     */
    public static Date toSqlDate(LocalDate date) {
        return date == null ? null : Date.valueOf(date);
    }

    /**
     * Returns the text form used to compare column values across reads.
     *
     * @param value column value
     * @return string form, or {@code null}
     */
    public static String asText(Object value) {
        return Objects.toString(value, null);
    }
}
