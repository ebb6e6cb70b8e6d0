package io.github.yok.dwloader.core;

import com.google.common.collect.Sets;
import io.github.yok.dwloader.config.ConnectionConfig;
import io.github.yok.dwloader.config.GoldConfig;
import io.github.yok.dwloader.config.PipelineConfig;
import io.github.yok.dwloader.db.DbUnitConnectionFactory;
import io.github.yok.dwloader.transform.StandardTransforms;
import io.github.yok.dwloader.transform.TransformDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles the load units of each warehouse layer and runs them through the
 * {@link PipelineOrchestrator}: one run per layer, one unit per table (one unit for the whole gold
 * model).
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class WarehousePipeline {

    private final PipelineOrchestrator orchestrator;
    private final DbUnitConnectionFactory connectionFactory;
    private final PipelineConfig pipelineConfig;
    private final ConnectionConfig.Schemas schemas;
    private final GoldConfig goldConfig;
    private final CsvBulkLoader loader;
    private final MergeEngine mergeEngine;

    /**
     * Creates a pipeline.
     *
     * @param orchestrator orchestrator executing the runs
     * @param connectionFactory DBUnit connection factory
     * @param pipelineConfig process names and column conventions
     * @param schemas layer schemas
     * @param goldConfig gold build settings
     * @param loadChunkSize rows per bulk-load INSERT
     */
    public WarehousePipeline(PipelineOrchestrator orchestrator,
            DbUnitConnectionFactory connectionFactory, PipelineConfig pipelineConfig,
            ConnectionConfig.Schemas schemas, GoldConfig goldConfig, int loadChunkSize) {
        this.orchestrator = orchestrator;
        this.connectionFactory = connectionFactory;
        this.pipelineConfig = pipelineConfig;
        this.schemas = schemas;
        this.goldConfig = goldConfig;
        this.loader = new CsvBulkLoader(pipelineConfig.getLineNumberColumn(), loadChunkSize);
        this.mergeEngine = new MergeEngine(pipelineConfig.getLineNumberColumn(),
                pipelineConfig.getCreatedAtColumn(), pipelineConfig.getUpdatedAtColumn());
    }

    /**
     * Loads the bronze layer.
     *
     * @param specs tables to load, in order
     * @return run summary
     */
    public RunSummary runBronze(List<TableSpec> specs) {
        List<LoadUnit> units = new ArrayList<>();
        for (TableSpec spec : specs) {
            units.add(new BronzeTableUnit(spec, connectionFactory, loader, mergeEngine));
        }
        return orchestrator.run(pipelineConfig.getBronzeProcessName(), units);
    }

    /**
     * Refreshes the silver layer.
     *
     * @param tables tables to refresh (case-insensitive); empty refreshes all
     * @return run summary
     * @throws IllegalArgumentException if a table has no silver transform
     */
    public RunSummary runSilver(List<String> tables) {
        Set<String> wanted = tables.stream().map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<TransformDefinition> definitions = StandardTransforms.all();
        Set<String> known = definitions.stream().map(TransformDefinition::getTargetTable)
                .collect(Collectors.toSet());
        Set<String> unknown = Sets.difference(wanted, known);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("No silver transform for table(s): " + unknown);
        }
        List<LoadUnit> units = new ArrayList<>();
        for (TransformDefinition definition : definitions) {
            if (wanted.isEmpty() || wanted.contains(definition.getTargetTable())) {
                units.add(new SilverTableUnit(definition, schemas.getBronze(), schemas.getSilver(),
                        connectionFactory, pipelineConfig.getCreatedAtColumn(),
                        pipelineConfig.getUpdatedAtColumn()));
            }
        }
        return orchestrator.run(pipelineConfig.getSilverProcessName(), units);
    }

    /**
     * Rebuilds the gold model.
     *
     * @return run summary
     */
    public RunSummary runGold() {
        LoadUnit unit = new GoldModelUnit(schemas.getSilver(), schemas.getGold(),
                connectionFactory, goldConfig.getUnresolvedPolicy(),
                goldConfig.getUnknownMemberKey(), pipelineConfig.getCreatedAtColumn());
        return orchestrator.run(pipelineConfig.getGoldProcessName(), List.of(unit));
    }
}
