package io.github.yok.dwloader.ledger;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Filter of {@link RunLedger#find(RunQuery)}. Unset fields do not filter.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class RunQuery {
    String processName;
    RunStatus status;
    // Inclusive lower bound of the start time
    LocalDateTime startedFrom;
    // Exclusive upper bound of the start time
    LocalDateTime startedBefore;
    @Builder.Default
    int limit = 100;

    /**
     * Returns a query matching every run (newest first, up to the default limit).
     *
     * @return unfiltered query
     */
    public static RunQuery all() {
        return RunQuery.builder().build();
    }
}
