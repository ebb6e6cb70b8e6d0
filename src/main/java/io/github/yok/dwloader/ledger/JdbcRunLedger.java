package io.github.yok.dwloader.ledger;

import io.github.yok.dwloader.core.TableOutcome;
import io.github.yok.dwloader.db.ConnectionProvider;
import io.github.yok.dwloader.util.Durations;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link RunLedger} stored in two tables of the warehouse database.
 *
 * <pre>
 * etl_log(log_id, process_name, start_time, end_time, duration_sec, status, log_message)
 * etl_table_log(log_id, table_name, start_time, end_time, duration_sec, status, rows_read,
 *               rows_inserted, rows_updated, rows_unchanged, rows_skipped, error_type, log_message)
 * </pre>
 *
 * <p>
 * Every call opens its own connection in auto-commit mode, so ledger rows survive the rollback of
 * the unit they describe. The terminal transition is a conditional update on
 * {@code status = 'In Progress'}, so at most one finish of a run can succeed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcRunLedger implements RunLedger {

    // Longest message stored in log_message
    static final int MAX_MESSAGE_LENGTH = 2000;

    private final ConnectionProvider connections;
    private final String runTable;
    private final String tableRunTable;
    private final Clock clock;

    /**
     * Creates a ledger.
     *
     * @param connections source of auto-commit connections
     * @param schema schema of the ledger tables; blank uses the connection default
     * @param runTable run table name
     * @param tableRunTable table-run table name
     */
    public JdbcRunLedger(ConnectionProvider connections, String schema, String runTable,
            String tableRunTable) {
        this(connections, schema, runTable, tableRunTable, Clock.systemDefaultZone());
    }

    JdbcRunLedger(ConnectionProvider connections, String schema, String runTable,
            String tableRunTable, Clock clock) {
        this.connections = connections;
        String prefix = StringUtils.isBlank(schema) ? "" : schema.trim() + ".";
        this.runTable = prefix + runTable;
        this.tableRunTable = prefix + tableRunTable;
        this.clock = clock;
    }

    @Override
    public long start(String processName) {
        String sql = "INSERT INTO " + runTable
                + " (process_name, start_time, status) VALUES (?, ?, ?)";
        try (Connection conn = open();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, processName);
            ps.setTimestamp(2, Timestamp.valueOf(now()));
            ps.setString(3, RunStatus.IN_PROGRESS.getLabel());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new LedgerException("No run id generated for " + processName);
                }
                long runId = keys.getLong(1);
                log.info("Run[{}] started: {}", runId, processName);
                return runId;
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to start run for " + processName, e);
        }
    }

    @Override
    public void finish(long runId, RunStatus status, String message) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        try (Connection conn = open()) {
            LocalDateTime started;
            RunStatus current;
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT start_time, status FROM " + runTable + " WHERE log_id = ?")) {
                ps.setLong(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new LedgerException("Unknown run: " + runId);
                    }
                    started = rs.getTimestamp(1).toLocalDateTime();
                    current = RunStatus.fromLabel(rs.getString(2));
                }
            }
            if (current.isTerminal()) {
                throw new LedgerException(
                        "Run " + runId + " is already finished with status " + current.getLabel());
            }

            LocalDateTime ended = now();
            if (!ended.isAfter(started)) {
                // end_time stays strictly after start_time at the stored precision
                ended = started.plus(1, ChronoUnit.MICROS);
            }
            try (PreparedStatement ps = conn.prepareStatement("UPDATE " + runTable
                    + " SET end_time = ?, duration_sec = ?, status = ?, log_message = ?"
                    + " WHERE log_id = ? AND status = ?")) {
                ps.setTimestamp(1, Timestamp.valueOf(ended));
                ps.setBigDecimal(2, Durations.secondsBetween(started, ended));
                ps.setString(3, status.getLabel());
                ps.setString(4, truncate(message));
                ps.setLong(5, runId);
                ps.setString(6, RunStatus.IN_PROGRESS.getLabel());
                if (ps.executeUpdate() != 1) {
                    throw new LedgerException("Run " + runId + " was finished concurrently");
                }
            }
            log.info("Run[{}] finished: {}", runId, status.getLabel());
        } catch (SQLException e) {
            throw new LedgerException("Failed to finish run " + runId, e);
        }
    }

    @Override
    public void recordTable(long runId, TableOutcome outcome) {
        String sql = "INSERT INTO " + tableRunTable
                + " (log_id, table_name, start_time, end_time, duration_sec, status, rows_read,"
                + " rows_inserted, rows_updated, rows_unchanged, rows_skipped, error_type,"
                + " log_message) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = open(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, runId);
            ps.setString(2, outcome.getName());
            ps.setTimestamp(3, toTimestamp(outcome.getStartTime()));
            ps.setTimestamp(4, toTimestamp(outcome.getEndTime()));
            ps.setBigDecimal(5, outcome.getDurationSec());
            ps.setString(6, outcome.getStatus().getLabel());
            ps.setLong(7, outcome.getResult().getRowsRead());
            ps.setLong(8, outcome.getResult().getInserted());
            ps.setLong(9, outcome.getResult().getUpdated());
            ps.setLong(10, outcome.getResult().getUnchanged());
            ps.setLong(11, outcome.getResult().getSkipped());
            ps.setString(12, outcome.getErrorType());
            ps.setString(13, truncate(outcome.getMessage()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerException(
                    "Failed to record table " + outcome.getName() + " of run " + runId, e);
        }
    }

    @Override
    public List<RunRecord> find(RunQuery query) {
        StringBuilder sql = new StringBuilder("SELECT log_id, process_name, start_time, end_time,"
                + " duration_sec, status, log_message FROM " + runTable + " WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (StringUtils.isNotBlank(query.getProcessName())) {
            sql.append(" AND process_name = ?");
            params.add(query.getProcessName());
        }
        if (query.getStatus() != null) {
            sql.append(" AND status = ?");
            params.add(query.getStatus().getLabel());
        }
        if (query.getStartedFrom() != null) {
            sql.append(" AND start_time >= ?");
            params.add(Timestamp.valueOf(query.getStartedFrom()));
        }
        if (query.getStartedBefore() != null) {
            sql.append(" AND start_time < ?");
            params.add(Timestamp.valueOf(query.getStartedBefore()));
        }
        sql.append(" ORDER BY start_time DESC, log_id DESC");

        try (Connection conn = open();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            if (query.getLimit() > 0) {
                ps.setMaxRows(query.getLimit());
            }
            List<RunRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(RunRecord.builder().runId(rs.getLong("log_id"))
                            .processName(rs.getString("process_name"))
                            .startTime(toLocal(rs.getTimestamp("start_time")))
                            .endTime(toLocal(rs.getTimestamp("end_time")))
                            .durationSec(rs.getBigDecimal("duration_sec"))
                            .status(RunStatus.fromLabel(rs.getString("status")))
                            .message(rs.getString("log_message")).build());
                }
            }
            return records;
        } catch (SQLException e) {
            throw new LedgerException("Failed to read runs", e);
        }
    }

    @Override
    public List<TableRunRecord> findTables(long runId) {
        String sql = "SELECT log_id, table_name, start_time, end_time, duration_sec, status,"
                + " rows_read, rows_inserted, rows_updated, rows_unchanged, rows_skipped,"
                + " error_type, log_message FROM " + tableRunTable
                + " WHERE log_id = ? ORDER BY table_log_id";
        try (Connection conn = open(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, runId);
            List<TableRunRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(TableRunRecord.builder().runId(rs.getLong("log_id"))
                            .tableName(rs.getString("table_name"))
                            .startTime(toLocal(rs.getTimestamp("start_time")))
                            .endTime(toLocal(rs.getTimestamp("end_time")))
                            .durationSec(rs.getBigDecimal("duration_sec"))
                            .status(UnitStatus.fromLabel(rs.getString("status")))
                            .rowsRead(rs.getLong("rows_read"))
                            .rowsInserted(rs.getLong("rows_inserted"))
                            .rowsUpdated(rs.getLong("rows_updated"))
                            .rowsUnchanged(rs.getLong("rows_unchanged"))
                            .rowsSkipped(rs.getLong("rows_skipped"))
                            .errorType(rs.getString("error_type"))
                            .message(rs.getString("log_message")).build());
                }
            }
            return records;
        } catch (SQLException e) {
            throw new LedgerException("Failed to read table records of run " + runId, e);
        }
    }

    private Connection open() throws SQLException {
        Connection conn = connections.open();
        conn.setAutoCommit(true);
        return conn;
    }

    private LocalDateTime now() {
        return Durations.toStoredPrecision(LocalDateTime.now(clock));
    }

    private static String truncate(String message) {
        return message == null ? null : StringUtils.abbreviate(message, MAX_MESSAGE_LENGTH);
    }

    private static Timestamp toTimestamp(LocalDateTime time) {
        return time == null ? null : Timestamp.valueOf(time);
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
