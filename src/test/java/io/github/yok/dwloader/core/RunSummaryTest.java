package io.github.yok.dwloader.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.google.common.collect.ImmutableList;
import io.github.yok.dwloader.config.FaultPolicy;
import io.github.yok.dwloader.ledger.RunStatus;
import io.github.yok.dwloader.ledger.UnitStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunSummaryTest {

    private static TableOutcome outcome(String name, UnitStatus status) {
        return TableOutcome.builder().name(name).status(status).build();
    }

    @Test
    void exitCode_正常ケース_失敗なし_いずれのポリシーでも0であること() {
        RunSummary summary = new RunSummary(1L, "Load Bronze", RunStatus.SUCCESS,
                ImmutableList.of(outcome("a", UnitStatus.SUCCESS)), null);

        assertFalse(summary.hasFailures());
        assertEquals(0, summary.exitCode(FaultPolicy.ABORT_ON_ERROR));
        assertEquals(0, summary.exitCode(FaultPolicy.CONTINUE_ON_ERROR));
    }

    @Test
    void exitCode_正常ケース_失敗あり_中断ポリシーのみ1であること() {
        RunSummary summary = new RunSummary(1L, "Load Bronze", RunStatus.ERROR,
                ImmutableList.of(outcome("a", UnitStatus.SUCCESS),
                        outcome("b", UnitStatus.ERROR), outcome("c", UnitStatus.SKIPPED)),
                "b: LoadException: x | failed tables: [b]");

        assertTrue(summary.hasFailures());
        assertEquals(List.of("b"), summary.failedTables());
        assertEquals(1, summary.exitCode(FaultPolicy.ABORT_ON_ERROR));
        assertEquals(0, summary.exitCode(FaultPolicy.CONTINUE_ON_ERROR));
    }

    @Test
    void hasFailures_正常ケース_ユニット失敗なしでもエラー状態_trueが返ること() {
        RunSummary summary =
                new RunSummary(null, "Load Gold", RunStatus.ERROR, ImmutableList.of(), "boom");

        assertTrue(summary.hasFailures());
        assertTrue(summary.failedTables().isEmpty());
    }

    @Test
    void getDurationSec_正常ケース_開始終了あり_経過秒が返ること() {
        LocalDateTime start = LocalDateTime.of(2025, 10, 19, 9, 0, 0);
        TableOutcome outcome = TableOutcome.builder().name("a").status(UnitStatus.SUCCESS)
                .startTime(start).endTime(start.plusSeconds(75)).build();

        assertEquals(new BigDecimal("75.0000"), outcome.getDurationSec());
        assertFalse(outcome.isFailed());
    }

    @Test
    void of_正常ケース_マージ結果_スキップに上書き件数が合算されること() {
        UnitResult result = UnitResult.of(6, new MergeResult(2, 1, 1, 1, 1));

        assertEquals(6L, result.getRowsRead());
        assertEquals(2L, result.getInserted());
        assertEquals(1L, result.getUpdated());
        assertEquals(1L, result.getUnchanged());
        assertEquals(2L, result.getSkipped());
    }
}
