package io.github.yok.dwloader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that manages the warehouse connection and layer schemas loaded from the
 * {@code warehouse} section of {@code application.yml}.
 *
 * <pre>
 * warehouse:
 *   connection:
 *     url: jdbc:mysql://localhost:3306/dw_bronze?databaseTerm=SCHEMA
 *     user: etl_user
 *     password: secret
 *     driverClass: com.mysql.cj.jdbc.Driver
 *   schemas:
 *     bronze: dw_bronze
 *     silver: dw_silver
 *     gold: dw_gold
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "warehouse")
@Data
public class ConnectionConfig {

    /**
     * Connection to the warehouse database.
     */
    private Entry connection = new Entry();

    /**
     * Schema (database) name of each warehouse layer.
     */
    private Schemas schemas = new Schemas();

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // JDBC connection URL (e.g., jdbc:mysql://localhost:3306/dw_bronze)
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name (e.g., com.mysql.cj.jdbc.Driver)
        private String driverClass;
    }

    /**
     * Layer schema names.
     */
    @Data
    public static class Schemas {
        // Raw capture layer (landing and merged tables, run ledger)
        private String bronze = "dw_bronze";
        // Cleansed and typed layer
        private String silver = "dw_silver";
        // Dimensional model layer
        private String gold = "dw_gold";
    }
}
