package io.github.yok.dwloader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Location of the run ledger tables ({@code ledger.*}).
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerConfig {

    // Schema of the ledger tables; blank means the bronze schema
    private String schema;

    // One row per run
    private String runTable = "etl_log";

    // One row per unit of a run
    private String tableRunTable = "etl_table_log";
}
