package io.github.yok.dwloader.db;

import io.github.yok.dwloader.config.DataTypeFactoryMode;
import io.github.yok.dwloader.config.DbUnitConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlMetadataHandler;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.springframework.stereotype.Component;

/**
 * Factory class that centrally applies application-wide settings to DBUnit's
 * {@link DatabaseConfig}.
 *
 * <p>
 * Bundles the data type factory of the warehouse database, the identifier escape pattern, allowance
 * of empty fields (landing tables keep empty source fields as {@code ""}), batched statement
 * execution, and batch size.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitConfigFactory {

    // Properties class that externalizes DBUnit settings
    private final DbUnitConfigProperties props;

    /**
     * No-args constructor using a {@link DbUnitConfigProperties} instance with default values.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies application-wide settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param mode database product of the warehouse
     */
    public void configure(DatabaseConfig cfg, DataTypeFactoryMode mode) {
        // 1) Set the data type factory
        IDataTypeFactory dataTypeFactory = dataTypeFactory(mode);
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dataTypeFactory);
        log.debug("DBUnit: DataTypeFactory set to {}", dataTypeFactory.getClass().getSimpleName());

        // 2) Escape identifiers (backticks on MySQL, double quotes elsewhere)
        String escape = mode == DataTypeFactoryMode.MYSQL ? "`?`" : "\"?\"";
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, escape);
        log.debug("DBUnit: escape pattern = {}", escape);

        if (mode == DataTypeFactoryMode.MYSQL) {
            cfg.setProperty(DatabaseConfig.PROPERTY_METADATA_HANDLER, new MySqlMetadataHandler());
        }
        if (mode == DataTypeFactoryMode.H2) {
            // H2 2.x reports user tables as BASE TABLE
            cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE,
                    new String[] {"TABLE", "BASE TABLE"});
        }

        // 3) Configure whether to allow empty fields ("")
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, props.isAllowEmptyFields());
        log.debug("DBUnit: allow empty fields = {}", props.isAllowEmptyFields());

        // 4) Configure whether to enable batched statements execution
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        log.debug("DBUnit: batched statements enabled = {}", props.isBatchedStatements());

        // 5) Configure batch size
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: batch size = {}", props.getBatchSize());
    }

    /**
     * Returns the number of source records written per DBUnit operation by the bulk loader.
     *
     * @return chunk size, at least 1
     */
    public int loadChunkSize() {
        return Math.max(1, props.getLoadChunkSize());
    }

    private IDataTypeFactory dataTypeFactory(DataTypeFactoryMode mode) {
        switch (mode) {
            case MYSQL:
                return new MySqlDataTypeFactory();
            case POSTGRESQL:
                return new PostgresqlDataTypeFactory();
            case H2:
            default:
                return new H2DataTypeFactory();
        }
    }
}
