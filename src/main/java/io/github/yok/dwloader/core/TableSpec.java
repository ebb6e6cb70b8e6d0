package io.github.yok.dwloader.core;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of one bronze table: where its extract lives, how it is formatted, which
 * landing table receives it, and which business key identifies its rows.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class TableSpec {

    // Logical table name (also the unit name in the run ledger)
    String name;

    // Schema holding both the landing and the target table
    String schema;

    // Landing table (unqualified)
    String landingTable;

    // Bronze table (unqualified)
    String targetTable;

    // Ordered business key columns of the target table
    ImmutableList<String> businessKeyColumns;

    // Absolute path of the source extract
    Path sourcePath;

    SourceFormat format;
}
