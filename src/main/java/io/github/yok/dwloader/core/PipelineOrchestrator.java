package io.github.yok.dwloader.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.dwloader.config.FaultPolicy;
import io.github.yok.dwloader.db.ConnectionProvider;
import io.github.yok.dwloader.ledger.RunLedger;
import io.github.yok.dwloader.ledger.RunStatus;
import io.github.yok.dwloader.ledger.UnitStatus;
import io.github.yok.dwloader.util.Durations;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Runs a list of load units in order, each in its own transaction, and brackets the run with the
 * run ledger.
 *
 * <p>
 * <strong>Per unit:</strong> open a connection, disable auto-commit, execute, commit. Any failure
 * rolls the unit back (so a target is never left half-merged), is written to the ledger, and then
 * either the next unit runs ({@link FaultPolicy#CONTINUE_ON_ERROR}) or the remaining units are
 * recorded as skipped ({@link FaultPolicy#ABORT_ON_ERROR}). Units committed before a failure stay
 * committed.
 * </p>
 *
 * <p>
 * The terminal ledger transition is written in a {@code finally} block, so a run that started ends
 * as Success or Error unless the process itself dies.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PipelineOrchestrator {

    private final RunLedger ledger;
    private final ConnectionProvider connections;
    private final FaultPolicy policy;
    private final Clock clock;

    /**
     * Creates an orchestrator.
     *
     * @param ledger run ledger
     * @param connections source of unit connections
     * @param policy behavior after a failed unit
     */
    public PipelineOrchestrator(RunLedger ledger, ConnectionProvider connections,
            FaultPolicy policy) {
        this(ledger, connections, policy, Clock.systemDefaultZone());
    }

    PipelineOrchestrator(RunLedger ledger, ConnectionProvider connections, FaultPolicy policy,
            Clock clock) {
        this.ledger = ledger;
        this.connections = connections;
        this.policy = policy;
        this.clock = clock;
    }

    public FaultPolicy getPolicy() {
        return policy;
    }

    /**
     * Executes a run.
     *
     * @param processName process name recorded in the ledger
     * @param units units in execution order
     * @return run summary
     */
    public RunSummary run(String processName, List<LoadUnit> units) {
        log.info("=== {} started (units={}, policy={}) ===", processName, units.size(), policy);
        LedgerRun run = LedgerRun.start(ledger, processName);
        List<TableOutcome> outcomes = new ArrayList<>();
        RunStatus status = RunStatus.ERROR;
        String message = null;
        Throwable fatal = null;
        try {
            boolean aborted = false;
            for (LoadUnit unit : units) {
                TableOutcome outcome = aborted ? skipped(unit) : execute(unit);
                outcomes.add(outcome);
                run.recordTable(outcome);
                if (outcome.isFailed() && policy == FaultPolicy.ABORT_ON_ERROR) {
                    log.warn("Aborting {} after failure of [{}]", processName, unit.name());
                    aborted = true;
                }
            }
            message = failureMessage(outcomes);
            status = message == null ? RunStatus.SUCCESS : RunStatus.ERROR;
        } catch (RuntimeException | Error e) {
            fatal = e;
            message = "Run interrupted: " + ExceptionUtils.getRootCauseMessage(e);
            throw e;
        } finally {
            run.finish(status, message);
            if (fatal == null) {
                logSummary(processName, outcomes);
            }
        }
        log.info("=== {} finished: {} ===", processName, status.getLabel());
        return new RunSummary(run.runId(), processName, status, ImmutableList.copyOf(outcomes),
                message);
    }

    private TableOutcome execute(LoadUnit unit) {
        LocalDateTime start = now();
        log.info("[{}] started", unit.name());
        try (Connection jdbc = connections.open()) {
            jdbc.setAutoCommit(false);
            try {
                UnitResult result = unit.execute(jdbc);
                jdbc.commit();
                log.info("[{}] Transaction committed", unit.name());
                return TableOutcome.builder().name(unit.name()).status(UnitStatus.SUCCESS)
                        .startTime(start).endTime(now()).result(result).build();
            } catch (Exception e) {
                rollback(jdbc, unit.name());
                throw e;
            }
        } catch (Exception e) {
            log.error("[{}] failed: {}", unit.name(), e.getMessage(), e);
            return TableOutcome.builder().name(unit.name()).status(UnitStatus.ERROR)
                    .startTime(start).endTime(now()).errorType(e.getClass().getSimpleName())
                    .message(describe(e)).build();
        }
    }

    private void rollback(Connection jdbc, String name) {
        try {
            jdbc.rollback();
            log.warn("[{}] Transaction rolled back due to error.", name);
        } catch (SQLException rollbackEx) {
            log.warn("[{}] Rollback failed: {}", name, rollbackEx.getMessage(), rollbackEx);
        }
    }

    private TableOutcome skipped(LoadUnit unit) {
        LocalDateTime now = now();
        log.info("[{}] skipped", unit.name());
        return TableOutcome.builder().name(unit.name()).status(UnitStatus.SKIPPED).startTime(now)
                .endTime(now).message("Skipped after an earlier failure").build();
    }

    /**
     * Builds the ledger message of a run: the first failure followed by every failed unit.
     *
     * @param outcomes outcomes in run order
     * @return message, or {@code null} when every unit succeeded
     */
    static String failureMessage(List<TableOutcome> outcomes) {
        List<String> failed = new ArrayList<>();
        TableOutcome first = null;
        for (TableOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                failed.add(outcome.getName());
                if (first == null) {
                    first = outcome;
                }
            }
        }
        if (first == null) {
            return null;
        }
        return first.getName() + ": " + first.getErrorType() + ": " + first.getMessage()
                + " | failed tables: " + failed;
    }

    private static String describe(Exception e) {
        return StringUtils.defaultIfBlank(e.getMessage(), ExceptionUtils.getRootCauseMessage(e));
    }

    private LocalDateTime now() {
        return Durations.toStoredPrecision(LocalDateTime.now(clock));
    }

    /**
     * Outputs a consolidated log of the unit results.
     */
    private void logSummary(String processName, List<TableOutcome> outcomes) {
        log.info("===== Summary: {} =====", processName);
        int maxNameLen = outcomes.stream().mapToInt(o -> o.getName().length()).max().orElse(0);
        String fmt = "  Table[%-" + Math.max(1, maxNameLen)
                + "s] %-7s read=%d inserted=%d updated=%d unchanged=%d skipped=%d";
        for (TableOutcome o : outcomes) {
            UnitResult r = o.getResult();
            log.info(String.format(fmt, o.getName(), o.getStatus().getLabel(), r.getRowsRead(),
                    r.getInserted(), r.getUpdated(), r.getUnchanged(), r.getSkipped()));
        }
    }
}
