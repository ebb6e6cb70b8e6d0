package io.github.yok.dwloader.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Time helpers for the run ledger. Timestamps are kept at microsecond precision, the precision of
 * the ledger's {@code DATETIME(6)} columns, and elapsed time is stored as decimal seconds.
 *
 * @author Yasuharu.Okawauchi
 */
public final class Durations {

    // Fractional digits of duration_sec DECIMAL(10,4)
    public static final int SECONDS_SCALE = 4;

    private Durations() {}

    /**
     * Truncates a timestamp to the precision the ledger columns store.
     *
     * @param time timestamp
     * @return timestamp truncated to microseconds
     */
    public static LocalDateTime toStoredPrecision(LocalDateTime time) {
        return time.truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Returns the seconds elapsed between two timestamps.
     *
     * @param start start time
     * @param end end time
     * @return elapsed seconds with four fractional digits, never negative
     */
    public static BigDecimal secondsBetween(LocalDateTime start, LocalDateTime end) {
        Duration elapsed = Duration.between(start, end);
        if (elapsed.isNegative()) {
            return BigDecimal.ZERO.setScale(SECONDS_SCALE);
        }
        return BigDecimal.valueOf(elapsed.getSeconds())
                .add(BigDecimal.valueOf(elapsed.getNano(), 9))
                .setScale(SECONDS_SCALE, RoundingMode.HALF_UP);
    }
}
