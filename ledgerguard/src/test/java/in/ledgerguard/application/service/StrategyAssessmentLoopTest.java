package in.ledgerguard.application.service;

import in.ledgerguard.application.port.input.PositionLifecycleService;
import in.ledgerguard.application.port.output.SignalSource;
import in.ledgerguard.config.StrategyCatalog;
import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.common.CloseResult;
import in.ledgerguard.domain.common.ErrorCategory;
import in.ledgerguard.domain.common.OpenResult;
import in.ledgerguard.domain.signal.ExitDecision;
import in.ledgerguard.domain.signal.SignalType;
import in.ledgerguard.domain.signal.TradingSignal;
import in.ledgerguard.domain.trade.ExitReason;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import in.ledgerguard.domain.trade.TradeUpdate;
import in.ledgerguard.infrastructure.exchange.PaperExchangeGateway;
import in.ledgerguard.infrastructure.persistence.JsonFileLedgerRepository;
import in.ledgerguard.support.Fixtures;
import in.ledgerguard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Assessment decisions with a mocked lifecycle service and signal source.
 */
@ExtendWith(MockitoExtension.class)
class StrategyAssessmentLoopTest {

    private static final BigDecimal MARK = new BigDecimal("100");

    @Mock
    private PositionLifecycleService lifecycle;

    @Mock
    private SignalSource signals;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StrategyConfig config;
    private PositionSlotRegistry registry;
    private TradeLedgerStore ledger;
    private PaperExchangeGateway gateway;
    private StrategyAssessmentLoop loop;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-05T10:00:00Z");
        config = Fixtures.strategy("btc-trend", "BTCUSDT");
        StrategyCatalog catalog = new StrategyCatalog(List.of(config), Duration.ofMinutes(5));
        registry = new PositionSlotRegistry(catalog, clock);
        ledger = Fixtures.ledger(new JsonFileLedgerRepository(
            tempDir.resolve("ledger.json"), tempDir.resolve("archive.json"), clock),
            new Fixtures.RecordingNotifier(), clock);
        ledger.load();
        gateway = new PaperExchangeGateway(clock);
        gateway.setMarkPrice("BTCUSDT", MARK);

        loop = new StrategyAssessmentLoop(catalog, lifecycle, signals, registry, ledger,
            Fixtures.exchangeCalls(gateway));
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    private TradeRecord openPosition() {
        TradeRecord pending = TradeRecord.pending("t-1", "btc-trend", "BTCUSDT", PositionSide.LONG,
            BigDecimal.TEN, MARK, 10, new BigDecimal("100"), null, null, clock.instant());
        ledger.put(pending);
        registry.tryAcquire("btc-trend", "t-1");
        return ledger.update("t-1", TradeUpdate.builder().status(TradeStatus.OPEN).build()).record();
    }

    @Test
    void testNothingHappensDuringShutdown() {
        when(lifecycle.isAcceptingSignals()).thenReturn(false);

        loop.tick(config);

        verifyNoInteractions(signals);
        verify(lifecycle, never()).openPosition(anyString(), any());
    }

    @Test
    void testFlatStrategyOpensOnSignal() {
        TradingSignal signal = TradingSignal.of(SignalType.BUY, "BTCUSDT", MARK);
        when(lifecycle.isAcceptingSignals()).thenReturn(true);
        when(signals.nextSignal(config)).thenReturn(Optional.of(signal));
        when(lifecycle.openPosition("btc-trend", signal)).thenReturn(OpenResult.failed(
            OpenResult.Outcome.ORDER_REJECTED, null, ErrorCategory.TRANSIENT, "rejected"));

        loop.tick(config);

        verify(lifecycle).openPosition("btc-trend", signal);
    }

    @Test
    void testCoolingDownStrategyIsNotAsked() {
        when(lifecycle.isAcceptingSignals()).thenReturn(true);
        registry.tryAcquire("btc-trend", "old");
        registry.release("btc-trend", "old");

        loop.tick(config);

        verify(signals, never()).nextSignal(any());
    }

    @Test
    void testOpenPositionExitsOnDecision() {
        TradeRecord open = openPosition();
        when(lifecycle.isAcceptingSignals()).thenReturn(true);
        when(lifecycle.checkFailsafe("btc-trend", MARK)).thenReturn(Optional.empty());
        when(signals.evaluateExit(eq(config), any(TradeRecord.class), eq(MARK)))
            .thenReturn(Optional.of(ExitDecision.of(ExitReason.TAKE_PROFIT)));
        when(lifecycle.closePosition("btc-trend", "take-profit", MARK)).thenReturn(CloseResult.closed(open));

        loop.tick(config);

        verify(lifecycle).closePosition("btc-trend", "take-profit", MARK);
        verify(signals, never()).nextSignal(any());
    }

    @Test
    void testFailsafeCloseSkipsExitEvaluation() {
        TradeRecord open = openPosition();
        when(lifecycle.isAcceptingSignals()).thenReturn(true);
        when(lifecycle.checkFailsafe("btc-trend", MARK)).thenReturn(Optional.of(CloseResult.closed(open)));

        loop.tick(config);

        verify(signals, never()).evaluateExit(any(), any(), any());
        verify(lifecycle, never()).closePosition(anyString(), anyString(), any());
    }

    @Test
    void testNoMarkPriceSkipsExitAssessment() {
        openPosition();
        gateway.setMarkPrice("BTCUSDT", null);
        when(lifecycle.isAcceptingSignals()).thenReturn(true);

        loop.tick(config);

        verify(lifecycle, never()).checkFailsafe(anyString(), any());
        verifyNoInteractions(signals);
    }
}
