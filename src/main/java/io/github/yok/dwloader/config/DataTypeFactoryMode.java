package io.github.yok.dwloader.config;

/**
 * Enumerates supported database dialect types used internally by DBUnit-related components.
 *
 * <p>
 * Each constant represents a database product for selecting a data type factory and the
 * identifier escape pattern.
 * </p>
 *
 * <ul>
 * <li>MYSQL: MySQL (the production warehouse)</li>
 * <li>POSTGRESQL: PostgreSQL</li>
 * <li>H2: H2 (tests and local runs)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataTypeFactoryMode {
    // Use the DataTypeFactory for MySQL
    MYSQL,
    // Use the DataTypeFactory for PostgreSQL
    POSTGRESQL,
    // Use the DataTypeFactory for H2
    H2
}
