package io.github.yok.dwloader.core;

import io.github.yok.dwloader.util.JdbcValues;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;

/**
 * Upserts the rows of a landing table into its conformed target by business key.
 *
 * <p>
 * <strong>Contract:</strong>
 * </p>
 * <ul>
 * <li>Landing rows are read in line-number order (file order).</li>
 * <li>Rows with a {@code null} or blank key column are skipped without error.</li>
 * <li>Duplicate keys in landing: the last row in file order wins.</li>
 * <li>Absent key: inserted with both audit timestamps set to now.</li>
 * <li>Present key with a changed non-key column: non-key columns and the updated-at timestamp are
 * overwritten; the created-at timestamp is kept.</li>
 * <li>Present key with identical non-key columns: untouched.</li>
 * <li>Target rows absent from landing are never deleted.</li>
 * <li>Keys are compared as exact text: {@code AW001} and {@code aw001} are two keys. The target's
 * key columns must use an exact collation (on MySQL {@code utf8mb4_0900_bin}), otherwise two such
 * keys collide on the primary key.</li>
 * </ul>
 *
 * <p>
 * Merged columns are the target columns also present in landing, minus the line-number and audit
 * columns. The DBUnit connection must expose the business key as primary key of the target (see
 * {@code DbUnitConnectionFactory#keyFilter}). The engine never commits.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MergeEngine {

    private final String lineNumberColumn;
    private final String createdAtColumn;
    private final String updatedAtColumn;
    private final Clock clock;
    private final OperationExecutor operationExecutor;

    /**
     * Creates an engine with default DBUnit operations.
     *
     * @param lineNumberColumn landing line-number column
     * @param createdAtColumn target created-at column
     * @param updatedAtColumn target updated-at column
     */
    public MergeEngine(String lineNumberColumn, String createdAtColumn, String updatedAtColumn) {
        this(lineNumberColumn, createdAtColumn, updatedAtColumn, Clock.systemDefaultZone(),
                OperationExecutor.dbUnit());
    }

    MergeEngine(String lineNumberColumn, String createdAtColumn, String updatedAtColumn,
            Clock clock, OperationExecutor operationExecutor) {
        this.lineNumberColumn = lineNumberColumn;
        this.createdAtColumn = createdAtColumn;
        this.updatedAtColumn = updatedAtColumn;
        this.clock = clock;
        this.operationExecutor = operationExecutor;
    }

    /**
     * Merges landing into target.
     *
     * @param conn DBUnit connection bound to the schema of both tables
     * @param landingTable landing table
     * @param targetTable conformed target table
     * @param businessKeyColumns ordered business key
     * @return row counts
     * @throws MergeException if a key column is missing, the target key does not match, or a write
     *         fails (including unique constraint violations)
     */
    public MergeResult merge(IDatabaseConnection conn, String landingTable, String targetTable,
            List<String> businessKeyColumns) throws MergeException {
        if (businessKeyColumns == null || businessKeyColumns.isEmpty()) {
            throw new MergeException("No business key given for " + targetTable);
        }
        try {
            ITableMetaData landingMeta = conn.createDataSet().getTableMetaData(landingTable);
            ITableMetaData targetMeta = conn.createDataSet().getTableMetaData(targetTable);

            Set<String> landingNames = names(landingMeta.getColumns());
            if (!landingNames.contains(upper(lineNumberColumn))) {
                throw new MergeException(
                        "Landing table " + landingTable + " has no " + lineNumberColumn + " column");
            }
            for (String key : businessKeyColumns) {
                if (!landingNames.contains(upper(key))
                        || !names(targetMeta.getColumns()).contains(upper(key))) {
                    throw new MergeException("Business key column " + key
                            + " is missing in " + landingTable + " or " + targetTable);
                }
            }
            Set<String> declaredKeys = names(targetMeta.getPrimaryKeys());
            Set<String> wantedKeys =
                    businessKeyColumns.stream().map(MergeEngine::upper).collect(Collectors.toSet());
            if (!declaredKeys.equals(wantedKeys)) {
                throw new MergeException("Key of " + targetTable + " is " + declaredKeys
                        + " but the business key is " + wantedKeys);
            }

            List<Column> merged = new ArrayList<>();
            Column createdAt = null;
            Column updatedAt = null;
            for (Column column : targetMeta.getColumns()) {
                String name = column.getColumnName();
                if (name.equalsIgnoreCase(createdAtColumn)) {
                    createdAt = column;
                } else if (name.equalsIgnoreCase(updatedAtColumn)) {
                    updatedAt = column;
                } else if (!name.equalsIgnoreCase(lineNumberColumn)
                        && landingNames.contains(upper(name))) {
                    merged.add(column);
                }
            }

            return apply(conn, landingTable, targetMeta.getTableName(), businessKeyColumns, merged,
                    createdAt, updatedAt);
        } catch (MergeException e) {
            throw e;
        } catch (Exception e) {
            Optional<SQLException> violation = constraintViolation(e);
            if (violation.isPresent()) {
                throw new MergeException("Constraint violated while merging " + landingTable
                        + " into " + targetTable + ": " + violation.get().getMessage(), e);
            }
            throw new MergeException("Failed to merge " + landingTable + " into " + targetTable
                    + ": " + ExceptionUtils.getRootCauseMessage(e), e);
        }
    }

    private MergeResult apply(IDatabaseConnection conn, String landingTable, String targetTable,
            List<String> keys, List<Column> merged, Column createdAt, Column updatedAt)
            throws Exception {
        String columnList = merged.stream().map(Column::getColumnName)
                .collect(Collectors.joining(", "));

        // 1) Winning landing row per key, in file order
        ITable landing = conn.createQueryTable(landingTable, "SELECT " + columnList + ", "
                + lineNumberColumn + " FROM " + qualify(conn, landingTable) + " ORDER BY "
                + lineNumberColumn);
        Map<List<String>, Object[]> winners = new LinkedHashMap<>();
        int skipped = 0;
        int superseded = 0;
        for (int row = 0; row < landing.getRowCount(); row++) {
            List<String> key = keyOf(landing, row, keys);
            if (key == null) {
                skipped++;
                continue;
            }
            Object[] values = new Object[merged.size()];
            for (int c = 0; c < merged.size(); c++) {
                values[c] = landing.getValue(row, merged.get(c).getColumnName());
            }
            if (winners.remove(key) != null) {
                superseded++;
            }
            winners.put(key, values);
        }

        // 2) Current target state of the merged columns
        ITable target = conn.createQueryTable(targetTable,
                "SELECT " + columnList + " FROM " + qualify(conn, targetTable));
        Map<List<String>, Object[]> existing = new HashMap<>();
        for (int row = 0; row < target.getRowCount(); row++) {
            Object[] values = new Object[merged.size()];
            for (int c = 0; c < merged.size(); c++) {
                values[c] = target.getValue(row, merged.get(c).getColumnName());
            }
            List<String> key = keyOf(target, row, keys);
            if (key != null) {
                existing.put(key, values);
            }
        }

        // 3) Split into inserts and updates
        Timestamp now = Timestamp.from(clock.instant());
        List<Column> insertColumns = new ArrayList<>(merged);
        List<Column> updateColumns = new ArrayList<>(merged);
        if (createdAt != null) {
            insertColumns.add(createdAt);
        }
        if (updatedAt != null) {
            insertColumns.add(updatedAt);
            updateColumns.add(updatedAt);
        }
        DefaultTable inserts = new DefaultTable(targetTable, insertColumns.toArray(new Column[0]));
        DefaultTable updates = new DefaultTable(targetTable, updateColumns.toArray(new Column[0]));
        int unchanged = 0;
        for (Map.Entry<List<String>, Object[]> winner : winners.entrySet()) {
            Object[] current = existing.get(winner.getKey());
            Object[] values = winner.getValue();
            if (current == null) {
                inserts.addRow(withAudit(values, insertColumns.size(), now));
            } else if (differs(current, values)) {
                updates.addRow(withAudit(values, updateColumns.size(), now));
            } else {
                unchanged++;
            }
        }

        // 4) Write
        if (inserts.getRowCount() > 0) {
            operationExecutor.insert(conn, new DefaultDataSet(inserts));
        }
        if (updates.getRowCount() > 0) {
            operationExecutor.update(conn, new DefaultDataSet(updates));
        }

        MergeResult result = new MergeResult(inserts.getRowCount(), updates.getRowCount(),
                unchanged, skipped, superseded);
        log.info("Table[{}] merged | inserted={} updated={} unchanged={} skipped={} superseded={}",
                targetTable, result.getInserted(), result.getUpdated(), result.getUnchanged(),
                result.getSkipped(), result.getSuperseded());
        return result;
    }

    private static Object[] withAudit(Object[] values, int width, Timestamp now) {
        Object[] row = new Object[width];
        System.arraycopy(values, 0, row, 0, values.length);
        for (int i = values.length; i < width; i++) {
            row[i] = now;
        }
        return row;
    }

    private static boolean differs(Object[] current, Object[] incoming) {
        for (int i = 0; i < current.length; i++) {
            if (!Objects.equals(JdbcValues.asText(current[i]), JdbcValues.asText(incoming[i]))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the key of a row, or {@code null} when a key column is null or blank.
     */
    private static List<String> keyOf(ITable table, int row, List<String> keys)
            throws DataSetException {
        List<String> key = new ArrayList<>(keys.size());
        for (String column : keys) {
            String value = JdbcValues.asText(table.getValue(row, column));
            if (StringUtils.isBlank(value)) {
                return null;
            }
            key.add(value);
        }
        return key;
    }

    private static String qualify(IDatabaseConnection conn, String table) {
        return StringUtils.isBlank(conn.getSchema()) ? table : conn.getSchema() + "." + table;
    }

    private static Set<String> names(Column[] columns) {
        return Arrays.stream(columns).map(c -> upper(c.getColumnName()))
                .collect(Collectors.toSet());
    }

    private static String upper(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    /**
     * Finds an integrity constraint violation (SQLSTATE class 23) in the cause chain.
     */
    static Optional<SQLException> constraintViolation(Throwable e) {
        return ExceptionUtils.getThrowableList(e).stream()
                .filter(SQLException.class::isInstance).map(SQLException.class::cast)
                .filter(s -> s.getSQLState() != null && s.getSQLState().startsWith("23"))
                .findFirst();
    }
}
