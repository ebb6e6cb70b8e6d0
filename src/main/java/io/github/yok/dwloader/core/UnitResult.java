package io.github.yok.dwloader.core;

import lombok.Builder;
import lombok.Value;

/**
 * Row counts reported by a successful load unit.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class UnitResult {
    long rowsRead;
    long inserted;
    long updated;
    long unchanged;
    long skipped;

    /**
     * Result of a unit that did not touch any row.
     *
     * @return empty result
     */
    public static UnitResult empty() {
        return UnitResult.builder().build();
    }

    /**
     * Result of a bronze unit: rows loaded into landing and what the merge did with them.
     *
     * @param loaded rows appended to landing
     * @param merge merge counts
     * @return combined result
     */
    public static UnitResult of(int loaded, MergeResult merge) {
        return UnitResult.builder().rowsRead(loaded).inserted(merge.getInserted())
                .updated(merge.getUpdated()).unchanged(merge.getUnchanged())
                .skipped((long) merge.getSkipped() + merge.getSuperseded()).build();
    }
}
