package io.github.yok.dwloader.core;

import io.github.yok.dwloader.parser.CsvSourceParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.ITableMetaData;

/**
 * Bulk loader that appends the records of a source extract to a landing table.
 *
 * <p>
 * Fields map positionally onto the landing columns in table order, skipping the line-number
 * column, which receives the physical record number of the row. Missing trailing fields become
 * {@code null}; surplus fields are ignored; values are stored verbatim. Rows are written in chunks
 * with DBUnit INSERT. The loader never commits: the caller owns the transaction, so a failure
 * leaves nothing behind once the caller rolls back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvBulkLoader {

    private final CsvSourceParser parser;

    // Landing column receiving the record number
    private final String lineNumberColumn;

    // Rows buffered per INSERT
    private final int chunkSize;

    private final OperationExecutor operationExecutor;

    /**
     * Creates a loader with default DBUnit operations.
     *
     * @param lineNumberColumn landing column receiving the record number
     * @param chunkSize rows buffered per INSERT
     */
    public CsvBulkLoader(String lineNumberColumn, int chunkSize) {
        this(new CsvSourceParser(), lineNumberColumn, chunkSize, OperationExecutor.dbUnit());
    }

    CsvBulkLoader(CsvSourceParser parser, String lineNumberColumn, int chunkSize,
            OperationExecutor operationExecutor) {
        this.parser = parser;
        this.lineNumberColumn = lineNumberColumn;
        this.chunkSize = Math.max(1, chunkSize);
        this.operationExecutor = operationExecutor;
    }

    /**
     * Loads a source extract into a landing table.
     *
     * @param source source extract
     * @param format CSV contract
     * @param conn DBUnit connection bound to the landing schema
     * @param landingTable landing table
     * @return number of rows appended
     * @throws LoadException if the file is missing or unreadable, the CSV is malformed, or the
     *         landing table is unusable
     */
    public int load(Path source, SourceFormat format, IDatabaseConnection conn,
            String landingTable) throws LoadException {
        if (!Files.isRegularFile(source)) {
            throw new LoadException("Source file not found: " + source);
        }
        if (!Files.isReadable(source)) {
            throw new LoadException("Source file is not readable: " + source);
        }

        Column[] columns = landingColumns(conn, landingTable);
        int lineIdx = -1;
        List<Integer> dataIdx = new ArrayList<>();
        for (int i = 0; i < columns.length; i++) {
            if (columns[i].getColumnName().equalsIgnoreCase(lineNumberColumn)) {
                lineIdx = i;
            } else {
                dataIdx.add(i);
            }
        }
        if (lineIdx < 0) {
            throw new LoadException("Landing table " + landingTable + " has no "
                    + lineNumberColumn + " column");
        }

        String tableName = landingTable;
        int lineNo = lineIdx;
        DefaultTable[] chunk = {new DefaultTable(tableName, columns)};
        int[] loaded = {0};
        try {
            parser.parse(source, format, (recordNumber, fields) -> {
                Object[] row = new Object[columns.length];
                for (int f = 0; f < dataIdx.size(); f++) {
                    row[dataIdx.get(f)] = f < fields.size() ? fields.get(f) : null;
                }
                row[lineNo] = recordNumber;
                chunk[0].addRow(row);
                loaded[0]++;
                if (chunk[0].getRowCount() >= chunkSize) {
                    operationExecutor.insert(conn, new DefaultDataSet(chunk[0]));
                    chunk[0] = new DefaultTable(tableName, columns);
                }
            });
            if (chunk[0].getRowCount() > 0) {
                operationExecutor.insert(conn, new DefaultDataSet(chunk[0]));
            }
        } catch (IOException e) {
            throw new LoadException("Failed to read " + source + ": " + e.getMessage(), e);
        } catch (Exception e) {
            throw new LoadException(
                    "Failed to load " + source + " into " + landingTable + ": " + e.getMessage(), e);
        }
        log.info("Table[{}] loaded rows={} from {}", landingTable, loaded[0], source.getFileName());
        return loaded[0];
    }

    private Column[] landingColumns(IDatabaseConnection conn, String landingTable)
            throws LoadException {
        try {
            ITableMetaData meta = conn.createDataSet().getTableMetaData(landingTable);
            return meta.getColumns();
        } catch (DataSetException | SQLException e) {
            throw new LoadException("Landing table not available: " + landingTable, e);
        }
    }
}
