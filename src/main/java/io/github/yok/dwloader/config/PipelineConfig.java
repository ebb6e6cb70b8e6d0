package io.github.yok.dwloader.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class bound to the {@code pipeline} section of {@code application.yml}.
 *
 * <pre>
 * pipeline:
 *   fault-policy: CONTINUE_ON_ERROR
 *   landing-prefix: stg_
 *   csv:
 *     delimiter: ","
 *     header-rows-to-skip: 1
 *   tables:
 *     - name: crm_cust_info
 *       business-key-columns: [cst_id]
 *       source-file: source_crm/cust_info.csv
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineConfig {

    // Ledger process name of each layer run
    private String bronzeProcessName = "Load Bronze Layer";
    private String silverProcessName = "Load Silver Layer";
    private String goldProcessName = "Load Gold Layer";

    // What to do with the remaining units after a unit failed
    private FaultPolicy faultPolicy = FaultPolicy.CONTINUE_ON_ERROR;

    // Prefix of the landing table of each bronze table (stg_crm_cust_info)
    private String landingPrefix = "stg_";

    // Landing column that receives the physical record number of the source row
    private String lineNumberColumn = "src_line_no";

    // Audit columns of conformed tables
    private String createdAtColumn = "meta_created_at";
    private String updatedAtColumn = "meta_updated_at";

    // Default CSV contract shared by all tables
    private Csv csv = new Csv();

    // Bronze tables in load order
    private List<Table> tables = new ArrayList<>();

    /**
     * CSV contract of a source extract.
     */
    @Data
    public static class Csv {
        private String delimiter = ",";
        // Empty disables quoting
        private String quoteChar = "\"";
        private String lineTerminator = "\r\n";
        private int headerRowsToSkip = 1;
        private String charset = "UTF-8";
    }

    /**
     * One bronze table.
     */
    @Data
    public static class Table {
        // Bronze table name; the landing table is landing-prefix + name
        private String name;
        // Ordered business key of the bronze table
        private List<String> businessKeyColumns = new ArrayList<>();
        // Source extract, relative to data-path or absolute
        private String sourceFile;
        // Per-table CSV contract; null falls back to pipeline.csv
        private Csv csv;
    }
}
