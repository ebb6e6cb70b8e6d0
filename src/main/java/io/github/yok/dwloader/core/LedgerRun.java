package io.github.yok.dwloader.core;

import io.github.yok.dwloader.ledger.RunLedger;
import io.github.yok.dwloader.ledger.RunStatus;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger handle of one run. Ledger failures are logged and never propagate, so they cannot abort
 * the load; {@link #finish} writes the terminal status at most once.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class LedgerRun {

    private final RunLedger ledger;
    private final String processName;

    // null when the run record could not be created
    private final Long runId;

    private boolean finished;

    private LedgerRun(RunLedger ledger, String processName, Long runId) {
        this.ledger = ledger;
        this.processName = processName;
        this.runId = runId;
    }

    /**
     * Creates the run record.
     *
     * @param ledger run ledger
     * @param processName process name
     * @return handle; without a run id if the ledger write failed
     */
    static LedgerRun start(RunLedger ledger, String processName) {
        try {
            return new LedgerRun(ledger, processName, ledger.start(processName));
        } catch (RuntimeException e) {
            log.error("Ledger: failed to start run for [{}]; continuing without a run record",
                    processName, e);
            return new LedgerRun(ledger, processName, null);
        }
    }

    Long runId() {
        return runId;
    }

    void recordTable(TableOutcome outcome) {
        if (runId == null) {
            return;
        }
        try {
            ledger.recordTable(runId, outcome);
        } catch (RuntimeException e) {
            log.error("Ledger: failed to record table [{}] of run {}: {} ({})", outcome.getName(),
                    runId, outcome.getStatus().getLabel(), outcome.getMessage(), e);
        }
    }

    void finish(RunStatus status, String message) {
        if (finished) {
            log.warn("Ledger: run {} of [{}] already finished; ignoring {}", runId, processName,
                    status.getLabel());
            return;
        }
        finished = true;
        if (runId == null) {
            log.error("Ledger: run of [{}] ended with {} but has no run record: {}", processName,
                    status.getLabel(), message);
            return;
        }
        try {
            ledger.finish(runId, status, message);
        } catch (RuntimeException e) {
            log.error("Ledger: failed to finish run {} of [{}] with {}: {}", runId, processName,
                    status.getLabel(), message, e);
        }
    }
}
