package io.github.yok.dwloader.core;

import io.github.yok.dwloader.util.JdbcValues;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;

/**
 * Moves rows between DBUnit tables and lower-case keyed maps.
 *
 * @author Yasuharu.Okawauchi
 */
final class TableRows {

    private TableRows() {}

    /**
     * Runs a query and returns its rows keyed by lower-case column name.
     *
     * @param conn DBUnit connection
     * @param resultName name of the query table
     * @param sql query
     * @return rows in result order
     * @throws Exception if the query fails
     */
    static List<Map<String, Object>> query(IDatabaseConnection conn, String resultName,
            String sql) throws Exception {
        ITable table = conn.createQueryTable(resultName, sql);
        Column[] columns = table.getTableMetaData().getColumns();
        List<Map<String, Object>> rows = new ArrayList<>(table.getRowCount());
        for (int row = 0; row < table.getRowCount(); row++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Column column : columns) {
                values.put(column.getColumnName().toLowerCase(Locale.ROOT),
                        table.getValue(row, column.getColumnName()));
            }
            rows.add(values);
        }
        return rows;
    }

    /**
     * Builds a DBUnit table with the columns of {@code meta} from lower-case keyed rows. Columns
     * absent from a row are written as {@code null}; {@link LocalDate} values become SQL dates.
     *
     * @param meta target table metadata
     * @param rows rows keyed by lower-case column name
     * @return table ready for a DBUnit operation
     * @throws DataSetException if the metadata cannot be read
     */
    static DefaultTable toTable(ITableMetaData meta, List<Map<String, Object>> rows)
            throws DataSetException {
        Column[] columns = meta.getColumns();
        DefaultTable table = new DefaultTable(meta.getTableName(), columns);
        for (Map<String, Object> values : rows) {
            Object[] row = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                Object value = values.get(columns[i].getColumnName().toLowerCase(Locale.ROOT));
                row[i] = value instanceof LocalDate ? JdbcValues.toSqlDate((LocalDate) value)
                        : value;
            }
            table.addRow(row);
        }
        return table;
    }
}
