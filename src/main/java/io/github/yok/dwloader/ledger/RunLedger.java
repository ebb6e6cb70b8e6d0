package io.github.yok.dwloader.ledger;

import io.github.yok.dwloader.core.TableOutcome;
import java.util.List;

/**
 * Append-only audit log of pipeline runs.
 *
 * <p>
 * A run is created {@link RunStatus#IN_PROGRESS} and moves exactly once to a terminal status.
 * Records are never deleted by the pipeline. A run whose process died stays in progress.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface RunLedger {

    /**
     * Creates an in-progress run record.
     *
     * @param processName name of the process
     * @return identifier of the new run
     * @throws LedgerException if the record cannot be written
     */
    long start(String processName);

    /**
     * Moves a run to its terminal status, setting end time and duration.
     *
     * @param runId run identifier
     * @param status terminal status
     * @param message message, typically set on error; may be {@code null}
     * @throws LedgerException if the run is unknown, already finished, or cannot be written
     * @throws IllegalArgumentException if {@code status} is not terminal
     */
    void finish(long runId, RunStatus status, String message);

    /**
     * Appends the outcome of one unit to a run.
     *
     * @param runId run identifier
     * @param outcome unit outcome
     * @throws LedgerException if the record cannot be written
     */
    void recordTable(long runId, TableOutcome outcome);

    /**
     * Finds runs, newest first.
     *
     * @param query filter
     * @return matching runs
     * @throws LedgerException if the ledger cannot be read
     */
    List<RunRecord> find(RunQuery query);

    /**
     * Returns the unit records of a run in the order they were written.
     *
     * @param runId run identifier
     * @return unit records
     * @throws LedgerException if the ledger cannot be read
     */
    List<TableRunRecord> findTables(long runId);
}
