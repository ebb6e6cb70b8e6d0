package io.github.yok.dwloader.ledger;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the table-run table: the outcome of one unit of a run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class TableRunRecord {
    long runId;
    String tableName;
    LocalDateTime startTime;
    LocalDateTime endTime;
    BigDecimal durationSec;
    UnitStatus status;
    long rowsRead;
    long rowsInserted;
    long rowsUpdated;
    long rowsUnchanged;
    long rowsSkipped;
    // Simple class name of the failure, null on success
    String errorType;
    String message;
}
