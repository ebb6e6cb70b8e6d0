package io.github.yok.dwloader.core;

import io.github.yok.dwloader.db.DbUnitConnectionFactory;
import io.github.yok.dwloader.transform.TransformDefinition;
import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.ITableMetaData;

/**
 * Silver unit of one table: read the bronze table, cleanse every row, and replace the content of
 * the silver table (DBUnit CLEAN_INSERT) in the caller's transaction.
 *
 * <p>
 * Rows rejected by the transform and rows whose silver key was already written are counted as
 * skipped. Bronze rows are read in creation order and, for rows captured by the same merge, in
 * raw key order, so the winner of a key collision does not depend on the database's row order.
 * For example {@code AW001} wins over {@code NASAW001} when both cleanse to {@code AW001}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SilverTableUnit implements LoadUnit {

    private final TransformDefinition definition;
    private final String bronzeSchema;
    private final String silverSchema;
    private final DbUnitConnectionFactory connectionFactory;
    private final String createdAtColumn;
    private final String updatedAtColumn;
    private final Clock clock;
    private final OperationExecutor operationExecutor;

    /**
     * Creates a unit.
     *
     * @param definition transform and tables
     * @param bronzeSchema schema read from
     * @param silverSchema schema written to
     * @param connectionFactory DBUnit connection factory
     * @param createdAtColumn audit column set on every written row
     * @param updatedAtColumn audit column set on every written row
     */
    public SilverTableUnit(TransformDefinition definition, String bronzeSchema,
            String silverSchema, DbUnitConnectionFactory connectionFactory,
            String createdAtColumn, String updatedAtColumn) {
        this(definition, bronzeSchema, silverSchema, connectionFactory, createdAtColumn,
                updatedAtColumn, Clock.systemDefaultZone(), OperationExecutor.dbUnit());
    }

    SilverTableUnit(TransformDefinition definition, String bronzeSchema, String silverSchema,
            DbUnitConnectionFactory connectionFactory, String createdAtColumn,
            String updatedAtColumn, Clock clock, OperationExecutor operationExecutor) {
        this.definition = definition;
        this.bronzeSchema = bronzeSchema;
        this.silverSchema = silverSchema;
        this.connectionFactory = connectionFactory;
        this.createdAtColumn = createdAtColumn;
        this.updatedAtColumn = updatedAtColumn;
        this.clock = clock;
        this.operationExecutor = operationExecutor;
    }

    @Override
    public String name() {
        return definition.getTargetTable();
    }

    @Override
    public UnitResult execute(Connection jdbc) throws Exception {
        IDatabaseConnection conn = connectionFactory.create(jdbc, silverSchema);
        List<Map<String, Object>> source = TableRows.query(conn, definition.getSourceTable(),
                "SELECT * FROM " + bronzeSchema + "." + definition.getSourceTable() + " ORDER BY "
                        + createdAtColumn + ", " + String.join(", ", definition.getKeyColumns()));

        Timestamp now = Timestamp.from(clock.instant());
        Set<List<Object>> written = new HashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        int dropped = 0;
        int duplicates = 0;
        for (Map<String, Object> row : source) {
            Optional<Map<String, Object>> cleansed = definition.getTransform().apply(row);
            if (cleansed.isEmpty()) {
                dropped++;
                continue;
            }
            Map<String, Object> out = cleansed.get();
            List<Object> key = definition.getKeyColumns().stream().map(out::get)
                    .collect(Collectors.toList());
            if (!written.add(key)) {
                duplicates++;
                continue;
            }
            out.put(createdAtColumn.toLowerCase(Locale.ROOT), now);
            out.put(updatedAtColumn.toLowerCase(Locale.ROOT), now);
            rows.add(out);
        }
        if (duplicates > 0) {
            log.warn("Table[{}] {} row(s) dropped for a duplicate key {}",
                    definition.getTargetTable(), duplicates, definition.getKeyColumns());
        }

        ITableMetaData meta = conn.createDataSet().getTableMetaData(definition.getTargetTable());
        operationExecutor.cleanInsert(conn, new DefaultDataSet(TableRows.toTable(meta, rows)));
        log.info("Table[{}] silver refreshed | read={} written={} dropped={} duplicates={}",
                definition.getTargetTable(), source.size(), rows.size(), dropped, duplicates);
        return UnitResult.builder().rowsRead(source.size()).inserted(rows.size())
                .skipped((long) dropped + duplicates).build();
    }
}
