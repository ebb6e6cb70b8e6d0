package io.github.yok.dwloader.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the run table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class RunRecord {
    long runId;
    String processName;
    LocalDateTime startTime;
    // null while in progress
    LocalDateTime endTime;
    BigDecimal durationSec;
    RunStatus status;
    String message;
}
