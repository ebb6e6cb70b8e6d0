package io.github.yok.dwloader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import com.google.common.collect.ImmutableList;
import io.github.yok.dwloader.config.ConnectionConfig;
import io.github.yok.dwloader.config.FaultPolicy;
import io.github.yok.dwloader.config.GoldConfig;
import io.github.yok.dwloader.config.LedgerConfig;
import io.github.yok.dwloader.config.PipelineConfig;
import io.github.yok.dwloader.config.TableSpecResolver;
import io.github.yok.dwloader.core.RunSummary;
import io.github.yok.dwloader.core.TableOutcome;
import io.github.yok.dwloader.core.TableSpec;
import io.github.yok.dwloader.core.WarehousePipeline;
import io.github.yok.dwloader.db.ConnectionProvider;
import io.github.yok.dwloader.db.DbUnitConfigFactory;
import io.github.yok.dwloader.db.DbUnitConnectionFactory;
import io.github.yok.dwloader.ledger.RunStatus;
import io.github.yok.dwloader.ledger.UnitStatus;
import io.github.yok.dwloader.util.ErrorHandler;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private PipelineConfig pipelineConfig;
    private TableSpecResolver resolver;
    private WarehousePipeline pipeline;
    private List<TableSpec> specs;
    private Main main;

    @BeforeEach
    void setup() {
        pipelineConfig = new PipelineConfig();
        resolver = mock(TableSpecResolver.class);
        pipeline = mock(WarehousePipeline.class);
        specs = List.of(mock(TableSpec.class));
        when(resolver.resolve(anyList())).thenReturn(specs);
        when(pipeline.runBronze(anyList())).thenReturn(success("Load Bronze Layer"));
        when(pipeline.runSilver(anyList())).thenReturn(success("Load Silver Layer"));
        when(pipeline.runGold()).thenReturn(success("Load Gold Layer"));

        Main sut = new Main(new ConnectionConfig(), pipelineConfig, new LedgerConfig(),
                new GoldConfig(), resolver, mock(DbUnitConnectionFactory.class),
                new DbUnitConfigFactory(), mock(ConnectionProvider.class));
        main = spy(sut);
        doReturn(pipeline).when(main).createPipeline(any(FaultPolicy.class));
        ErrorHandler.disableExitForCurrentThread();
    }

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    private static RunSummary success(String process) {
        return new RunSummary(1L, process, RunStatus.SUCCESS, ImmutableList.of(
                TableOutcome.builder().name("t").status(UnitStatus.SUCCESS).build()), null);
    }

    private static RunSummary failure(String process) {
        return new RunSummary(2L, process, RunStatus.ERROR,
                ImmutableList.of(TableOutcome.builder().name("crm_prd_info")
                        .status(UnitStatus.ERROR).errorType("LoadException")
                        .message("Source file not found").build()),
                "crm_prd_info: LoadException: Source file not found | failed tables: [crm_prd_info]");
    }

    @Test
    void launch_正常ケース_SpringApplicationが起動され終了コードが返ること() {
        ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
        ExitCodeGenerator generator = () -> 1;
        when(context.getBeansOfType(ExitCodeGenerator.class))
                .thenReturn(Map.of("main", generator));
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(context);
                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(Main.class, sources[0]);
                })) {

            int code = Main.launch(new String[] {"--layer", "gold"});

            assertEquals(1, code);
            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--layer"), eq("gold"));
            verify(context).close();
        }
    }

    @Test
    void run_正常ケース_引数なし_全レイヤーが順に実行されること() {
        main.run();

        verify(resolver).resolve(List.of());
        verify(pipeline).runBronze(specs);
        verify(pipeline).runSilver(List.of());
        verify(pipeline).runGold();
        verify(main).createPipeline(FaultPolicy.CONTINUE_ON_ERROR);
        assertEquals(0, main.getExitCode());
    }

    @Test
    void run_正常ケース_silverレイヤーとテーブル指定_silverのみ実行されること() {
        main.run("-L", "SILVER", "-t", "erp_loc_a101, crm_cust_info");

        verify(pipeline).runSilver(List.of("erp_loc_a101", "crm_cust_info"));
        verify(pipeline, never()).runBronze(anyList());
        verify(pipeline, never()).runGold();
        verifyNoInteractions(resolver);
    }

    @Test
    void run_正常ケース_goldレイヤー_goldのみ実行されること() {
        main.run("--layer", "gold");

        verify(pipeline).runGold();
        verify(pipeline, never()).runSilver(anyList());
        verifyNoInteractions(resolver);
    }

    @Test
    void run_異常ケース_中断ポリシーで失敗_終了コード1で後続レイヤーが実行されないこと() {
        when(pipeline.runBronze(anyList())).thenReturn(failure("Load Bronze Layer"));

        main.run("--policy", "abort");

        assertEquals(1, main.getExitCode());
        verify(main).createPipeline(FaultPolicy.ABORT_ON_ERROR);
        verify(pipeline, never()).runSilver(anyList());
        verify(pipeline, never()).runGold();
    }

    @Test
    void run_正常ケース_継続ポリシーで失敗_終了コード0で後続レイヤーが実行されること() {
        when(pipeline.runBronze(anyList())).thenReturn(failure("Load Bronze Layer"));

        main.run("-p", "continue");

        assertEquals(0, main.getExitCode());
        verify(pipeline).runSilver(List.of());
        verify(pipeline).runGold();
    }

    @Test
    void run_正常ケース_設定の中断ポリシー_引数なしで適用されること() {
        pipelineConfig.setFaultPolicy(FaultPolicy.ABORT_ON_ERROR);
        when(pipeline.runSilver(anyList())).thenReturn(failure("Load Silver Layer"));

        main.run();

        assertEquals(1, main.getExitCode());
        verify(pipeline, never()).runGold();
    }

    @Test
    void run_異常ケース_未知のレイヤー_終了コード2でErrorHandlerが呼ばれること() {
        ErrorHandler.restoreExitForCurrentThread();
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("--layer", "platinum");

            mocked.verify(() -> ErrorHandler
                    .errorAndExit(startsWith("Invalid arguments: Unknown layer: 'platinum'")));
        }
        assertEquals(Main.EXIT_INVALID_USAGE, main.getExitCode());
        verifyNoInteractions(pipeline);
    }

    @Test
    void run_異常ケース_未知のポリシー_例外が送出され終了コード2となること() {
        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> main.run("-p", "retry"));

        assertEquals("Invalid arguments: Unknown fault policy: retry", ex.getMessage());
        assertEquals(Main.EXIT_INVALID_USAGE, main.getExitCode());
    }

    @Test
    void run_異常ケース_未知のテーブル_設定エラーとして終了コード2となること() {
        when(resolver.resolve(anyList()))
                .thenThrow(new IllegalArgumentException("Unknown table(s): [nope]"));

        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> main.run("-t", "nope"));

        assertEquals("Invalid configuration: Unknown table(s): [nope]", ex.getMessage());
        assertEquals(Main.EXIT_INVALID_USAGE, main.getExitCode());
    }

    @Test
    void run_異常ケース_予期しない例外_終了コード1となること() {
        when(pipeline.runGold()).thenThrow(new IllegalStateException("ledger exploded"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> main.run());

        assertEquals("Fatal error: ledger exploded", ex.getMessage());
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_正常ケース_未知の引数_警告のみで処理継続すること() {
        main.run("--unknown");

        verify(pipeline).runGold();
        assertEquals(0, main.getExitCode());
    }

    @Test
    void createPipeline_正常ケース_設定から組み立てられること() {
        Main sut = new Main(new ConnectionConfig(), pipelineConfig, new LedgerConfig(),
                new GoldConfig(), resolver, mock(DbUnitConnectionFactory.class),
                new DbUnitConfigFactory(), mock(ConnectionProvider.class));

        assertNotNull(sut.createPipeline(FaultPolicy.ABORT_ON_ERROR));
    }
}
