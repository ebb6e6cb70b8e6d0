package io.github.yok.dwloader.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.dwloader.config.FaultPolicy;
import io.github.yok.dwloader.ledger.RunStatus;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Result of one orchestrated run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RunSummary {

    // null when the run record could not be written
    Long runId;

    String processName;

    RunStatus status;

    ImmutableList<TableOutcome> outcomes;

    // Ledger message: null on success
    String message;

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(TableOutcome::isFailed) || status == RunStatus.ERROR;
    }

    /**
     * Returns the names of the failed units.
     *
     * @return failed unit names in run order
     */
    public List<String> failedTables() {
        return outcomes.stream().filter(TableOutcome::isFailed).map(TableOutcome::getName)
                .collect(Collectors.toList());
    }

    /**
     * Returns the process exit code of this run.
     *
     * @param policy fault policy the run was executed with
     * @return 1 when a unit failed under {@link FaultPolicy#ABORT_ON_ERROR}, otherwise 0
     */
    public int exitCode(FaultPolicy policy) {
        return hasFailures() && policy == FaultPolicy.ABORT_ON_ERROR ? 1 : 0;
    }
}
