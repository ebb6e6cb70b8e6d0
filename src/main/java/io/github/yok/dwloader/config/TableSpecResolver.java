package io.github.yok.dwloader.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.dwloader.core.SourceFormat;
import io.github.yok.dwloader.core.TableSpec;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Builds the immutable {@link TableSpec} list from {@link PipelineConfig}, {@link PathsConfig} and
 * {@link ConnectionConfig}.
 *
 * <p>
 * Invalid table settings fail here, before any run is started.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableSpecResolver {

    private final PipelineConfig pipelineConfig;
    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;

    /**
     * Resolves the configured tables.
     *
     * @param selected table names to keep (case-insensitive); {@code null} or empty keeps all
     * @return table definitions in configuration order
     * @throws IllegalArgumentException if a table setting is invalid or a selected name is unknown
     */
    public List<TableSpec> resolve(List<String> selected) {
        Set<String> wanted = new LinkedHashSet<>();
        if (selected != null) {
            selected.stream().filter(StringUtils::isNotBlank)
                    .map(s -> s.trim().toLowerCase(Locale.ROOT)).forEach(wanted::add);
        }

        Set<String> known = pipelineConfig.getTables().stream()
                .map(t -> StringUtils.trimToEmpty(t.getName()).toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<String> unknown =
                wanted.stream().filter(w -> !known.contains(w)).collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown table(s): " + unknown);
        }

        List<TableSpec> specs = new ArrayList<>();
        for (PipelineConfig.Table table : pipelineConfig.getTables()) {
            String name = StringUtils.trimToEmpty(table.getName());
            if (!wanted.isEmpty() && !wanted.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            specs.add(toSpec(table));
        }
        log.debug("Resolved {} table definition(s): {}", specs.size(),
                specs.stream().map(TableSpec::getName).collect(Collectors.toList()));
        return specs;
    }

    private TableSpec toSpec(PipelineConfig.Table table) {
        String name = table.getName();
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "pipeline.tables[].name is blank");
        Preconditions.checkArgument(
                table.getBusinessKeyColumns() != null && !table.getBusinessKeyColumns().isEmpty()
                        && table.getBusinessKeyColumns().stream().allMatch(StringUtils::isNotBlank),
                "Table %s: business-key-columns must list at least one column", name);

        PipelineConfig.Csv csv = table.getCsv() != null ? table.getCsv() : pipelineConfig.getCsv();
        return TableSpec.builder().name(name.trim())
                .schema(connectionConfig.getSchemas().getBronze())
                .landingTable(pipelineConfig.getLandingPrefix() + name.trim())
                .targetTable(name.trim())
                .businessKeyColumns(table.getBusinessKeyColumns().stream().map(String::trim)
                        .collect(ImmutableList.toImmutableList()))
                .sourcePath(pathsConfig.resolveSource(table.getSourceFile()))
                .format(toFormat(name, csv)).build();
    }

    /**
     * Converts a configured CSV contract.
     *
     * @param name table name for messages
     * @param csv configured contract
     * @return validated format
     */
    static SourceFormat toFormat(String name, PipelineConfig.Csv csv) {
        Preconditions.checkArgument(csv.getDelimiter() != null && csv.getDelimiter().length() == 1,
                "Table %s: delimiter must be exactly one character", name);
        Preconditions.checkArgument(csv.getQuoteChar() == null || csv.getQuoteChar().length() <= 1,
                "Table %s: quote-char must be at most one character", name);
        String terminator = csv.getLineTerminator();
        Preconditions.checkArgument(
                "\r\n".equals(terminator) || "\n".equals(terminator) || "\r".equals(terminator),
                "Table %s: line-terminator must be CRLF, LF or CR", name);
        Preconditions.checkArgument(csv.getHeaderRowsToSkip() >= 0,
                "Table %s: header-rows-to-skip must not be negative", name);

        Character quote = StringUtils.isEmpty(csv.getQuoteChar()) ? null
                : csv.getQuoteChar().charAt(0);
        return SourceFormat.builder().delimiter(csv.getDelimiter().charAt(0)).quoteChar(quote)
                .lineTerminator(terminator).headerRowsToSkip(csv.getHeaderRowsToSkip())
                .charset(Charset.forName(csv.getCharset())).build();
    }
}
