package io.github.yok.dwloader.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class JdbcValuesTest {

    @Test
    void toLong_正常ケース_数値と文字列_Longに変換されること() {
        assertEquals(5L, JdbcValues.toLong(5));
        assertEquals(7L, JdbcValues.toLong(new BigDecimal("7")));
        assertEquals(11000L, JdbcValues.toLong(" 11000 "));
        assertNull(JdbcValues.toLong(""));
        assertNull(JdbcValues.toLong(null));
    }

    @Test
    void toLong_異常ケース_数値でない文字列_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> JdbcValues.toLong("abc"));
    }

    @Test
    void toLocalDate_正常ケース_各種日付型_LocalDateに変換されること() {
        LocalDate day = LocalDate.of(2020, 7, 1);

        assertEquals(day, JdbcValues.toLocalDate(Date.valueOf(day)));
        assertEquals(day, JdbcValues.toLocalDate(Timestamp.valueOf(day.atTime(10, 0))));
        assertEquals(day, JdbcValues.toLocalDate(day.atStartOfDay()));
        assertEquals(day, JdbcValues.toLocalDate("2020-07-01 00:00:00"));
        assertEquals(day, JdbcValues.toLocalDate(day));
        assertNull(JdbcValues.toLocalDate(null));
    }

    @Test
    void toBoolean_正常ケース_真偽値と数値と文字列_Booleanに変換されること() {
        assertTrue(JdbcValues.toBoolean(Boolean.TRUE));
        assertTrue(JdbcValues.toBoolean(1));
        assertTrue(JdbcValues.toBoolean("TRUE"));
        assertFalse(JdbcValues.toBoolean("0"));
        assertNull(JdbcValues.toBoolean(null));
    }

    @Test
    void toDecimal_正常ケース_数値と文字列_BigDecimalに変換されること() {
        assertEquals(new BigDecimal("3578"), JdbcValues.toDecimal("3578"));
        assertEquals(new BigDecimal("1.5"), JdbcValues.toDecimal(new BigDecimal("1.5")));
        assertNull(JdbcValues.toDecimal(null));
    }

    @Test
    void asText_正常ケース_nullと値_文字列またはnullが返ること() {
        assertNull(JdbcValues.asText(null));
        assertEquals("12", JdbcValues.asText(12));
        assertNull(JdbcValues.toSqlDate(null));
        assertEquals(Date.valueOf("2020-07-01"),
                JdbcValues.toSqlDate(LocalDateTime.of(2020, 7, 1, 0, 0).toLocalDate()));
    }
}
