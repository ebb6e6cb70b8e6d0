package io.github.yok.dwloader.core;

import io.github.yok.dwloader.db.DbUnitConnectionFactory;
import java.sql.Connection;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.IDataSet;

/**
 * Bronze unit of one table: clear the landing table, bulk load the extract into it, and merge it
 * into the bronze table. All three steps share the caller's transaction.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BronzeTableUnit implements LoadUnit {

    private final TableSpec spec;
    private final DbUnitConnectionFactory connectionFactory;
    private final CsvBulkLoader loader;
    private final MergeEngine mergeEngine;
    private final OperationExecutor operationExecutor;

    /**
     * Creates a unit.
     *
     * @param spec table definition
     * @param connectionFactory DBUnit connection factory
     * @param loader bulk loader
     * @param mergeEngine merge engine
     */
    public BronzeTableUnit(TableSpec spec, DbUnitConnectionFactory connectionFactory,
            CsvBulkLoader loader, MergeEngine mergeEngine) {
        this(spec, connectionFactory, loader, mergeEngine, OperationExecutor.dbUnit());
    }

    BronzeTableUnit(TableSpec spec, DbUnitConnectionFactory connectionFactory,
            CsvBulkLoader loader, MergeEngine mergeEngine, OperationExecutor operationExecutor) {
        this.spec = spec;
        this.connectionFactory = connectionFactory;
        this.loader = loader;
        this.mergeEngine = mergeEngine;
        this.operationExecutor = operationExecutor;
    }

    @Override
    public String name() {
        return spec.getName();
    }

    @Override
    public UnitResult execute(Connection jdbc) throws Exception {
        IDatabaseConnection conn = connectionFactory.create(jdbc, spec.getSchema(),
                DbUnitConnectionFactory.keyFilter(spec.getBusinessKeyColumns()));

        IDataSet landing;
        try {
            landing = conn.createDataSet(new String[] {spec.getLandingTable()});
            landing.getTableMetaData(spec.getLandingTable());
        } catch (DataSetException e) {
            throw new LoadException("Landing table not available: " + spec.getLandingTable(), e);
        }
        operationExecutor.deleteAll(conn, landing);
        log.info("Table[{}] landing cleared", spec.getLandingTable());

        int loaded = loader.load(spec.getSourcePath(), spec.getFormat(), conn,
                spec.getLandingTable());
        MergeResult merged = mergeEngine.merge(conn, spec.getLandingTable(),
                spec.getTargetTable(), spec.getBusinessKeyColumns());
        return UnitResult.of(loaded, merged);
    }
}
