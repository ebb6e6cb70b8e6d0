package io.github.yok.dwloader.transform;

import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * Binds a {@link RowTransform} to its bronze source and silver target.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TransformDefinition {

    // Bronze table read by the transform (also the unit name)
    String sourceTable;

    // Silver table written by the transform
    String targetTable;

    // Unique key of the silver table, named as in bronze; later rows with an already written key
    // are dropped
    ImmutableList<String> keyColumns;

    RowTransform transform;
}
