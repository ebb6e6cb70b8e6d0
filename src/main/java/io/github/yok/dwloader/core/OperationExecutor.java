package io.github.yok.dwloader.core;

import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.IDataSet;
import org.dbunit.operation.DatabaseOperation;

/**
 * Abstraction for the DBUnit write operations used by the load units (replaceable in tests).
 *
 * @author Yasuharu.Okawauchi
 */
public interface OperationExecutor {

    /**
     * Executes DBUnit CLEAN_INSERT.
     *
     * @param connection DBUnit connection
     * @param dataSet dataset to write
     * @throws Exception execution failure
     */
    void cleanInsert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

    /**
     * Executes DBUnit DELETE_ALL.
     *
     * @param connection DBUnit connection
     * @param dataSet dataset whose tables are emptied
     * @throws Exception execution failure
     */
    void deleteAll(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

    /**
     * Executes DBUnit UPDATE.
     *
     * @param connection DBUnit connection
     * @param dataSet dataset to write
     * @throws Exception execution failure
     */
    void update(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

    /**
     * Executes DBUnit INSERT.
     *
     * @param connection DBUnit connection
     * @param dataSet dataset to write
     * @throws Exception execution failure
     */
    void insert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

    /**
     * Returns the executor that runs the real DBUnit operations.
     *
     * @return default executor
     */
    static OperationExecutor dbUnit() {
        return new OperationExecutor() {
            @Override
            public void cleanInsert(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.CLEAN_INSERT.execute(connection, dataSet);
            }

            @Override
            public void deleteAll(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.DELETE_ALL.execute(connection, dataSet);
            }

            @Override
            public void update(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.UPDATE.execute(connection, dataSet);
            }

            @Override
            public void insert(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.INSERT.execute(connection, dataSet);
            }
        };
    }
}
