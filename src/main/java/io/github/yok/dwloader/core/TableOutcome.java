package io.github.yok.dwloader.core;

import io.github.yok.dwloader.ledger.UnitStatus;
import io.github.yok.dwloader.util.Durations;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one load unit within a run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class TableOutcome {

    // Unit (table) name
    String name;

    UnitStatus status;

    LocalDateTime startTime;

    LocalDateTime endTime;

    // Counts; empty unless the unit succeeded
    @Builder.Default
    UnitResult result = UnitResult.empty();

    // Simple class name of the failure
    String errorType;

    String message;

    public boolean isFailed() {
        return status == UnitStatus.ERROR;
    }

    /**
     * Returns the elapsed seconds of the unit.
     *
     * @return duration in seconds with four fractional digits, 0 when a bound is missing
     */
    public BigDecimal getDurationSec() {
        if (startTime == null || endTime == null) {
            return BigDecimal.ZERO.setScale(Durations.SECONDS_SCALE);
        }
        return Durations.secondsBetween(startTime, endTime);
    }
}
