package io.github.yok.dwloader.transform;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Field-level cleansing rules shared by the silver transforms. Every function is total: a value
 * that cannot be converted yields {@code null} (or the stated default) instead of an exception.
 *
 * @author Yasuharu.Okawauchi
 */
public final class CleanseFunctions {

    private static final DateTimeFormatter ISO =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter COMPACT =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private CleanseFunctions() {}

    /**
     * Trims a value; blank becomes {@code null}.
     *
     * @param value raw value
     * @return trimmed text or {@code null}
     */
    public static String clean(Object value) {
        return value == null ? null : StringUtils.trimToNull(value.toString());
    }

    /**
     * Parses an integral value.
     *
     * @param value raw value
     * @return integer, or {@code null} when blank or not an integer
     */
    public static Integer toInteger(Object value) {
        String text = clean(value);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    /**
     * Parses an integral value, defaulting to zero.
     *
     * @param value raw value
     * @return integer, 0 when blank or invalid
     */
    public static int toIntegerOrZero(Object value) {
        Integer parsed = toInteger(value);
        return parsed == null ? 0 : parsed;
    }

    /**
     * Parses a decimal value, defaulting to zero.
     *
     * @param value raw value
     * @return decimal, {@link BigDecimal#ZERO} when blank or invalid
     */
    public static BigDecimal toDecimalOrZero(Object value) {
        String text = clean(value);
        if (text == null) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /**
     * Parses a {@code yyyy-MM-dd} date.
     *
     * @param value raw value
     * @return date, or {@code null} when blank or invalid
     */
    public static LocalDate isoDate(Object value) {
        return parse(clean(value), ISO);
    }

    /**
     * Parses a {@code yyyy-MM-dd} date only when the trimmed value has exactly 10 characters.
     *
     * @param value raw value
     * @return date, or {@code null}
     */
    public static LocalDate isoDateStrictLength(Object value) {
        String text = clean(value);
        return text != null && text.length() == 10 ? parse(text, ISO) : null;
    }

    /**
     * Parses a {@code yyyyMMdd} date only when the trimmed value has exactly 8 characters.
     *
     * @param value raw value such as {@code 20201231}; {@code 0} and other short values give null
     * @return date, or {@code null}
     */
    public static LocalDate compactDate(Object value) {
        String text = clean(value);
        return text != null && text.length() == 8 ? parse(text, COMPACT) : null;
    }

    /**
     * Expands a code through a lookup (trimmed, case-insensitive).
     *
     * @param value raw code
     * @param codes upper-case code to expansion
     * @param otherwise result for blank or unknown codes
     * @return expansion
     */
    public static String expand(Object value, Map<String, String> codes, String otherwise) {
        String text = clean(value);
        if (text == null) {
            return otherwise;
        }
        return codes.getOrDefault(text.toUpperCase(Locale.ROOT), otherwise);
    }

    /**
     * Converts {@code Yes}/{@code No}.
     *
     * @param value raw value
     * @return {@code TRUE}, {@code FALSE}, or {@code null} for anything else
     */
    public static Boolean yesNo(Object value) {
        String text = clean(value);
        if ("Yes".equals(text)) {
            return Boolean.TRUE;
        }
        if ("No".equals(text)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static LocalDate parse(String text, DateTimeFormatter formatter) {
        if (text == null) {
            return null;
        }
        try {
            return LocalDate.parse(text, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
