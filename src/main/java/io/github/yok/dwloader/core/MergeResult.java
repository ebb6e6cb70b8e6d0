package io.github.yok.dwloader.core;

import lombok.Value;

/**
 * Row counts of one merge.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class MergeResult {

    // Keys absent from the target
    int inserted;

    // Keys present in the target with at least one changed non-key column
    int updated;

    // Keys present in the target with identical non-key columns
    int unchanged;

    // Landing rows with a null or blank key column
    int skipped;

    // Landing rows replaced by a later row with the same key
    int superseded;

    /**
     * Returns the number of landing rows examined.
     *
     * @return total landing rows
     */
    public int landingRows() {
        return inserted + updated + unchanged + skipped + superseded;
    }
}
