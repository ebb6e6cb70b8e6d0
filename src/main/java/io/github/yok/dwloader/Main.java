package io.github.yok.dwloader;

import io.github.yok.dwloader.config.ConnectionConfig;
import io.github.yok.dwloader.config.DbUnitConfigProperties;
import io.github.yok.dwloader.config.FaultPolicy;
import io.github.yok.dwloader.config.GoldConfig;
import io.github.yok.dwloader.config.LedgerConfig;
import io.github.yok.dwloader.config.PathsConfig;
import io.github.yok.dwloader.config.PipelineConfig;
import io.github.yok.dwloader.config.TableSpecResolver;
import io.github.yok.dwloader.core.PipelineOrchestrator;
import io.github.yok.dwloader.core.RunSummary;
import io.github.yok.dwloader.core.TableSpec;
import io.github.yok.dwloader.core.WarehousePipeline;
import io.github.yok.dwloader.db.ConnectionProvider;
import io.github.yok.dwloader.db.DbUnitConfigFactory;
import io.github.yok.dwloader.db.DbUnitConnectionFactory;
import io.github.yok.dwloader.ledger.JdbcRunLedger;
import io.github.yok.dwloader.ledger.RunLedger;
import io.github.yok.dwloader.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options and runs the requested warehouse layers through
 * {@link WarehousePipeline}.
 * </p>
 *
 * <ul>
 * <li>{@code --layer bronze|silver|gold|all} or {@code -L ...}: layer to run (default
 * {@code all}). {@code all} runs bronze, silver and gold in order and stops at the first layer
 * whose exit code is not zero.</li>
 * <li>{@code --tables a,b} or {@code -t a,b}: restrict the bronze and silver layers to these
 * tables.</li>
 * <li>{@code --policy continue|abort} or {@code -p ...}: override {@code pipeline.fault-policy}.</li>
 * </ul>
 *
 * <p>
 * The process exit code is provided through {@link ExitCodeGenerator}: 0 on success or when
 * failures were tolerated under {@code continue}, 1 when a unit failed under {@code abort}, 2 for
 * invalid arguments or configuration.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PipelineConfig
 * @see ConnectionConfig
 * @see TableSpecResolver
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class, PipelineConfig.class,
        LedgerConfig.class, GoldConfig.class, DbUnitConfigProperties.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_INVALID_USAGE = 2;

    private final ConnectionConfig connectionConfig;
    private final PipelineConfig pipelineConfig;
    private final LedgerConfig ledgerConfig;
    private final GoldConfig goldConfig;
    private final TableSpecResolver tableSpecResolver;
    private final DbUnitConnectionFactory connectionFactory;
    private final DbUnitConfigFactory dbUnitConfigFactory;
    private final ConnectionProvider connectionProvider;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the run's exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * Runs the application and closes its context.
     *
     * @param args command-line arguments
     * @return exit code collected from the {@link ExitCodeGenerator} beans
     */
    static int launch(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        return SpringApplication.exit(app.run(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String layer = "all";
        List<String> tables = new ArrayList<>();
        FaultPolicy policy = pipelineConfig.getFaultPolicy();
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--layer":
                    case "-L":
                        layer = i + 1 < args.length ? args[++i].trim().toLowerCase(Locale.ROOT)
                                : "";
                        break;
                    case "--tables":
                    case "-t":
                        if (i + 1 < args.length) {
                            tables = Arrays.stream(args[++i].split(",")).map(String::trim)
                                    .filter(StringUtils::isNotEmpty).collect(Collectors.toList());
                        }
                        break;
                    case "--policy":
                    case "-p":
                        policy = FaultPolicy.fromCliValue(i + 1 < args.length ? args[++i] : null);
                        break;
                    default:
                        log.warn("Unknown argument: {}", args[i]);
                }
            }
            if (!Arrays.asList("bronze", "silver", "gold", "all").contains(layer)) {
                throw new IllegalArgumentException(
                        "Unknown layer: '" + layer + "' (expected bronze, silver, gold or all)");
            }
        } catch (IllegalArgumentException e) {
            exitCode = EXIT_INVALID_USAGE;
            ErrorHandler.errorAndExit("Invalid arguments: " + e.getMessage());
            return;
        }

        log.info("Layer: {}, Tables: {}, Policy: {}", layer, tables.isEmpty() ? "all" : tables,
                policy);

        try {
            List<TableSpec> specs = "silver".equals(layer) || "gold".equals(layer) ? List.of()
                    : tableSpecResolver.resolve(tables);
            WarehousePipeline pipeline = createPipeline(policy);

            if ("bronze".equals(layer) || "all".equals(layer)) {
                exitCode = report(pipeline.runBronze(specs), policy);
            }
            if (exitCode == 0 && ("silver".equals(layer) || "all".equals(layer))) {
                exitCode = report(pipeline.runSilver(tables), policy);
            }
            if (exitCode == 0 && ("gold".equals(layer) || "all".equals(layer))) {
                exitCode = report(pipeline.runGold(), policy);
            }
        } catch (IllegalArgumentException e) {
            exitCode = EXIT_INVALID_USAGE;
            ErrorHandler.errorAndExit("Invalid configuration: " + e.getMessage(), e);
        } catch (Exception e) {
            exitCode = 1;
            log.error("Fatal error occurred (layer={}): {}", layer, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    /**
     * Assembles the ledger, orchestrator and pipeline for one invocation.
     *
     * @param policy effective fault policy
     * @return pipeline
     */
    WarehousePipeline createPipeline(FaultPolicy policy) {
        String ledgerSchema = StringUtils.defaultIfBlank(ledgerConfig.getSchema(),
                connectionConfig.getSchemas().getBronze());
        RunLedger ledger = new JdbcRunLedger(connectionProvider, ledgerSchema,
                ledgerConfig.getRunTable(), ledgerConfig.getTableRunTable());
        PipelineOrchestrator orchestrator =
                new PipelineOrchestrator(ledger, connectionProvider, policy);
        return new WarehousePipeline(orchestrator, connectionFactory, pipelineConfig,
                connectionConfig.getSchemas(), goldConfig, dbUnitConfigFactory.loadChunkSize());
    }

    private int report(RunSummary summary, FaultPolicy policy) {
        if (summary.hasFailures()) {
            String message = summary.getProcessName() + " finished with failures: "
                    + summary.failedTables() + " | " + summary.getMessage();
            log.warn(message);
            System.err.println("WARN: " + message);
        }
        return summary.exitCode(policy);
    }
}
