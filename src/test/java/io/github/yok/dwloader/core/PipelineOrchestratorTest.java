package io.github.yok.dwloader.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.dwloader.config.FaultPolicy;
import io.github.yok.dwloader.db.ConnectionProvider;
import io.github.yok.dwloader.ledger.LedgerException;
import io.github.yok.dwloader.ledger.RunLedger;
import io.github.yok.dwloader.ledger.RunStatus;
import io.github.yok.dwloader.ledger.UnitStatus;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class PipelineOrchestratorTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2025-10-19T00:00:00Z"), ZoneOffset.UTC);

    private RunLedger ledger;
    private ConnectionProvider connections;
    private List<Connection> opened;

    @BeforeEach
    void setup() throws Exception {
        ledger = mock(RunLedger.class);
        when(ledger.start(anyString())).thenReturn(7L);
        opened = new ArrayList<>();
        connections = () -> {
            Connection jdbc = mock(Connection.class);
            opened.add(jdbc);
            return jdbc;
        };
    }

    /**
     * 固定結果を返す、または例外を送出する試験用ユニットです。
     */
    private static final class StubUnit implements LoadUnit {
        private final String name;
        private final Exception failure;
        private int executions;

        StubUnit(String name, Exception failure) {
            this.name = name;
            this.failure = failure;
        }

        static StubUnit ok(String name) {
            return new StubUnit(name, null);
        }

        static StubUnit failing(String name, Exception failure) {
            return new StubUnit(name, failure);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public UnitResult execute(Connection jdbc) throws Exception {
            executions++;
            if (failure != null) {
                throw failure;
            }
            return UnitResult.builder().rowsRead(2).inserted(2).build();
        }
    }

    private PipelineOrchestrator orchestrator(FaultPolicy policy) {
        return new PipelineOrchestrator(ledger, connections, policy, CLOCK);
    }

    @Test
    void run_正常ケース_全ユニット成功_成功で終了しコミットされること() throws Exception {
        RunSummary summary = orchestrator(FaultPolicy.CONTINUE_ON_ERROR).run("Load Bronze",
                List.of(StubUnit.ok("A"), StubUnit.ok("B")));

        assertEquals(RunStatus.SUCCESS, summary.getStatus());
        assertEquals(7L, summary.getRunId());
        assertFalse(summary.hasFailures());
        assertNull(summary.getMessage());
        assertEquals(0, summary.exitCode(FaultPolicy.ABORT_ON_ERROR));
        assertEquals(2, opened.size());
        for (Connection jdbc : opened) {
            verify(jdbc).setAutoCommit(false);
            verify(jdbc).commit();
            verify(jdbc, never()).rollback();
            verify(jdbc).close();
        }
        verify(ledger, times(2)).recordTable(eq(7L), any(TableOutcome.class));
        verify(ledger).finish(7L, RunStatus.SUCCESS, null);
    }

    @Test
    void run_正常ケース_継続ポリシー_失敗ユニット後も実行が続くこと() throws Exception {
        StubUnit c = StubUnit.ok("C");
        RunSummary summary = orchestrator(FaultPolicy.CONTINUE_ON_ERROR).run("Load Bronze",
                List.of(StubUnit.ok("A"), StubUnit.failing("B", new LoadException("bad file")),
                        c));

        assertEquals(1, c.executions);
        assertEquals(RunStatus.ERROR, summary.getStatus());
        assertEquals(List.of("B"), summary.failedTables());
        assertEquals(UnitStatus.SUCCESS, summary.getOutcomes().get(2).getStatus());
        assertEquals(0, summary.exitCode(FaultPolicy.CONTINUE_ON_ERROR));
        verify(opened.get(1)).rollback();
        verify(opened.get(1), never()).commit();
        verify(ledger).finish(7L, RunStatus.ERROR, "B: LoadException: bad file | failed tables: [B]");
    }

    @Test
    void run_正常ケース_中断ポリシー_残りのユニットがスキップとして記録されること() throws Exception {
        StubUnit c = StubUnit.ok("C");
        RunSummary summary = orchestrator(FaultPolicy.ABORT_ON_ERROR).run("Load Bronze",
                List.of(StubUnit.ok("A"), StubUnit.failing("B", new LoadException("bad file")),
                        c));

        assertEquals(0, c.executions);
        assertEquals(3, summary.getOutcomes().size());
        assertEquals(UnitStatus.SUCCESS, summary.getOutcomes().get(0).getStatus());
        assertEquals(UnitStatus.ERROR, summary.getOutcomes().get(1).getStatus());
        assertEquals(UnitStatus.SKIPPED, summary.getOutcomes().get(2).getStatus());
        assertEquals(1, summary.exitCode(FaultPolicy.ABORT_ON_ERROR));
        assertEquals(2, opened.size());

        ArgumentCaptor<TableOutcome> captor = ArgumentCaptor.forClass(TableOutcome.class);
        verify(ledger, times(3)).recordTable(eq(7L), captor.capture());
        assertEquals("C", captor.getAllValues().get(2).getName());
        assertEquals(UnitStatus.SKIPPED, captor.getAllValues().get(2).getStatus());
        verify(ledger).finish(eq(7L), eq(RunStatus.ERROR), startsWith("B: LoadException"));
    }

    @Test
    void run_異常ケース_接続取得失敗_ユニット失敗として記録されること() {
        ConnectionProvider broken = () -> {
            throw new SQLException("connection refused");
        };
        RunSummary summary = new PipelineOrchestrator(ledger, broken,
                FaultPolicy.CONTINUE_ON_ERROR, CLOCK).run("Load Silver",
                        List.of(StubUnit.ok("A")));

        TableOutcome outcome = summary.getOutcomes().get(0);
        assertTrue(outcome.isFailed());
        assertEquals("SQLException", outcome.getErrorType());
        assertEquals("connection refused", outcome.getMessage());
    }

    @Test
    void run_正常ケース_台帳障害_ロードは継続されること() {
        when(ledger.start(anyString())).thenThrow(new LedgerException("ledger down"));

        RunSummary summary = orchestrator(FaultPolicy.ABORT_ON_ERROR).run("Load Bronze",
                List.of(StubUnit.ok("A")));

        assertNull(summary.getRunId());
        assertEquals(RunStatus.SUCCESS, summary.getStatus());
        verify(ledger, never()).recordTable(anyLong(), any());
        verify(ledger, never()).finish(anyLong(), any(), any());
    }

    @Test
    void run_正常ケース_明細記録失敗_後続ユニットと終了記録が行われること() {
        doThrow(new LedgerException("insert failed")).when(ledger).recordTable(eq(7L),
                any(TableOutcome.class));

        RunSummary summary = orchestrator(FaultPolicy.CONTINUE_ON_ERROR).run("Load Bronze",
                List.of(StubUnit.ok("A"), StubUnit.ok("B")));

        assertEquals(2, summary.getOutcomes().size());
        verify(ledger).finish(7L, RunStatus.SUCCESS, null);
    }

    @Test
    void run_異常ケース_実行時エラー_エラーで一度だけ終了記録され再送出されること() {
        LoadUnit exploding = new LoadUnit() {
            @Override
            public String name() {
                throw new IllegalStateException("boom");
            }

            @Override
            public UnitResult execute(Connection jdbc) {
                return UnitResult.empty();
            }
        };

        assertThrows(IllegalStateException.class,
                () -> orchestrator(FaultPolicy.CONTINUE_ON_ERROR).run("Load Gold",
                        List.of(exploding)));
        verify(ledger, times(1)).finish(eq(7L), eq(RunStatus.ERROR),
                eq("Run interrupted: IllegalStateException: boom"));
    }

    @Test
    void run_正常ケース_ユニットなし_成功で終了すること() {
        RunSummary summary =
                orchestrator(FaultPolicy.ABORT_ON_ERROR).run("Load Gold", List.of());

        assertEquals(RunStatus.SUCCESS, summary.getStatus());
        verify(ledger).finish(7L, RunStatus.SUCCESS, null);
        verify(ledger, never()).recordTable(anyLong(), any());
    }

    @Test
    void failureMessage_正常ケース_成功のみ_nullが返ること() {
        TableOutcome ok = TableOutcome.builder().name("A").status(UnitStatus.SUCCESS).build();

        assertNull(PipelineOrchestrator.failureMessage(List.of(ok)));
    }

    @Test
    void failureMessage_正常ケース_複数失敗_先頭の失敗と全失敗テーブルが含まれること() {
        TableOutcome a = TableOutcome.builder().name("A").status(UnitStatus.ERROR)
                .errorType("MergeException").message("duplicate").build();
        TableOutcome b = TableOutcome.builder().name("B").status(UnitStatus.SUCCESS).build();
        TableOutcome c = TableOutcome.builder().name("C").status(UnitStatus.ERROR)
                .errorType("LoadException").message("missing").build();

        assertEquals("A: MergeException: duplicate | failed tables: [A, C]",
                PipelineOrchestrator.failureMessage(List.of(a, b, c)));
    }

    @Test
    void getDurationSec_正常ケース_境界なし_0が返ること() {
        TableOutcome outcome = TableOutcome.builder().name("A").status(UnitStatus.SKIPPED)
                .build();

        assertEquals(new BigDecimal("0.0000"), outcome.getDurationSec());
        assertEquals(0L, outcome.getResult().getInserted());
        assertNull(outcome.getErrorType());
    }
}
