package io.github.yok.dwloader.db;

import io.github.yok.dwloader.config.ConnectionConfig;
import io.github.yok.dwloader.config.DataTypeFactoryMode;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.filter.IColumnFilter;
import org.springframework.stereotype.Component;

/**
 * Creates DBUnit connections bound to one warehouse schema.
 *
 * <p>
 * The database product is resolved from {@code warehouse.connection.driver-class} first and the
 * JDBC URL as a fallback; it selects the DBUnit data type factory and escape pattern applied by
 * {@link DbUnitConfigFactory}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbUnitConnectionFactory {

    private final ConnectionConfig connectionConfig;

    // Applies common settings to DBUnit's DatabaseConfig
    private final DbUnitConfigFactory configFactory;

    /**
     * Wraps a JDBC connection for one schema.
     *
     * @param jdbc open JDBC connection; its lifecycle stays with the caller
     * @param schema schema the DBUnit operations write to
     * @return configured DBUnit connection
     * @throws DatabaseUnitException if the schema cannot be validated
     */
    public IDatabaseConnection create(Connection jdbc, String schema)
            throws DatabaseUnitException {
        return create(jdbc, schema, null);
    }

    /**
     * Wraps a JDBC connection for one schema, overriding primary keys with the given filter.
     *
     * @param jdbc open JDBC connection; its lifecycle stays with the caller
     * @param schema schema the DBUnit operations write to
     * @param primaryKeyFilter key columns used by UPDATE; {@code null} keeps the database keys
     * @return configured DBUnit connection
     * @throws DatabaseUnitException if the schema cannot be selected or validated
     */
    public IDatabaseConnection create(Connection jdbc, String schema,
            IColumnFilter primaryKeyFilter) throws DatabaseUnitException {
        DataTypeFactoryMode mode = resolveMode();
        useSchema(jdbc, schema, mode);
        DatabaseConnection conn = new DatabaseConnection(jdbc, schema);
        DatabaseConfig cfg = conn.getConfig();
        configFactory.configure(cfg, mode);
        if (primaryKeyFilter != null) {
            cfg.setProperty(DatabaseConfig.PROPERTY_PRIMARY_KEY_FILTER, primaryKeyFilter);
        }
        return conn;
    }

    /**
     * Makes {@code schema} the current schema of the connection. DBUnit writes unqualified table
     * names, so they must resolve in the target schema.
     */
    private static void useSchema(Connection jdbc, String schema, DataTypeFactoryMode mode)
            throws DatabaseUnitException {
        try {
            switch (mode) {
                case MYSQL:
                    // MySQL exposes databases as catalogs
                    jdbc.setCatalog(schema);
                    break;
                case H2:
                    // Unquoted so H2 folds the name like the DDL did
                    try (Statement st = jdbc.createStatement()) {
                        st.execute("SET SCHEMA " + schema);
                    }
                    break;
                default:
                    jdbc.setSchema(schema);
            }
        } catch (SQLException e) {
            throw new DatabaseUnitException("Cannot switch to schema " + schema, e);
        }
    }

    /**
     * Builds a primary key filter that accepts the given columns (case-insensitive).
     *
     * @param keyColumns business key columns
     * @return column filter
     */
    public static IColumnFilter keyFilter(List<String> keyColumns) {
        Set<String> keys = keyColumns.stream().map(k -> k.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return (tableName, column) -> keys
                .contains(column.getColumnName().toUpperCase(Locale.ROOT));
    }

    /**
     * Resolves the database product of the configured connection.
     *
     * @return resolved product
     * @throws IllegalArgumentException if the product cannot be determined
     */
    public DataTypeFactoryMode resolveMode() {
        ConnectionConfig.Entry entry = connectionConfig.getConnection();
        DataTypeFactoryMode fromDriverClass = resolveModeFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }
        DataTypeFactoryMode fromUrl = resolveModeFromJdbcUrl(entry.getUrl());
        if (fromUrl != null) {
            return fromUrl;
        }
        throw new IllegalArgumentException("Unsupported database dialect (driver-class="
                + entry.getDriverClass() + ", url=" + entry.getUrl() + ")");
    }

    private DataTypeFactoryMode resolveModeFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)) {
            return DataTypeFactoryMode.MYSQL;
        }
        if ("org.postgresql.driver".equals(normalized)) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if ("org.h2.driver".equals(normalized)) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    private DataTypeFactoryMode resolveModeFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:mysql:")) {
            return DataTypeFactoryMode.MYSQL;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    private String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
