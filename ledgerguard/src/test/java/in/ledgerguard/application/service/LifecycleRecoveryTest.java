package in.ledgerguard.application.service;

import in.ledgerguard.application.monitoring.AlertService;
import in.ledgerguard.domain.exchange.OrderRequest;
import in.ledgerguard.domain.exchange.OrderSide;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import in.ledgerguard.domain.trade.TradeUpdate;
import in.ledgerguard.infrastructure.exchange.PaperExchangeGateway;
import in.ledgerguard.infrastructure.persistence.JsonFileLedgerRepository;
import in.ledgerguard.support.Fixtures;
import in.ledgerguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Startup recovery against a file-backed ledger and the paper exchange.
 */
class LifecycleRecoveryTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private TradeLedgerStore ledger;
    private PositionSlotRegistry registry;
    private PaperExchangeGateway gateway;
    private AlertService alertService;
    private LifecycleRecovery recovery;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-05T10:00:00Z");
        ledger = Fixtures.ledger(new JsonFileLedgerRepository(
            tempDir.resolve("ledger.json"), tempDir.resolve("archive.json"), clock),
            new Fixtures.RecordingNotifier(), clock);
        ledger.load();
        registry = new PositionSlotRegistry(strategy -> Duration.ofMinutes(5), clock);
        gateway = new PaperExchangeGateway(clock);
        gateway.setMarkPrice("BTCUSDT", new BigDecimal("100"));
        gateway.setFillMode(PaperExchangeGateway.FillMode.HOLD);
        alertService = mock(AlertService.class);

        PendingOrderResolver resolver = new PendingOrderResolver(ledger, registry,
            Fixtures.exchangeCalls(gateway), clock);
        recovery = new LifecycleRecovery(ledger, registry, resolver, alertService);
    }

    private TradeRecord pendingWithOrder(String tradeId, String strategy, boolean placeOrder) {
        TradeRecord record = TradeRecord.pending(tradeId, strategy, "BTCUSDT", PositionSide.LONG,
            BigDecimal.ONE, new BigDecimal("100"), 10, BigDecimal.TEN, null, null, clock.instant());
        ledger.put(record);
        if (!placeOrder) {
            return record;
        }
        String ref = gateway.placeOrder(new OrderRequest(tradeId, "BTCUSDT", OrderSide.BUY,
            BigDecimal.ONE, false, null)).join();
        return ledger.update(tradeId, TradeUpdate.builder().exchangeOrderRef(ref).build()).record();
    }

    @Test
    void testResolvesPendingAndRebuildsSlots() {
        TradeRecord filled = pendingWithOrder("t-filled", "s-a", true);
        TradeRecord rejected = pendingWithOrder("t-rejected", "s-b", true);
        pendingWithOrder("t-no-ref", "s-c", false);
        gateway.fillHeldOrder(filled.exchangeOrderRef());
        gateway.rejectHeldOrder(rejected.exchangeOrderRef());

        LifecycleRecovery.RecoveryReport report = recovery.recover();

        assertEquals(1, report.pendingPromoted());
        assertEquals(1, report.pendingRejected());
        assertEquals(1, report.pendingUnresolved());
        assertTrue(report.duplicateStrategies().isEmpty());
        assertEquals(2, report.occupiedSlots());

        assertEquals(TradeStatus.OPEN, ledger.get("t-filled").orElseThrow().status());
        TradeRecord closed = ledger.get("t-rejected").orElseThrow();
        assertEquals(TradeStatus.CLOSED, closed.status());
        assertEquals("order rejected", closed.exitReason());
        assertEquals(TradeStatus.PENDING, ledger.get("t-no-ref").orElseThrow().status());

        assertEquals("t-filled", registry.holder("s-a").orElseThrow());
        assertTrue(registry.holder("s-b").isEmpty());
        assertEquals("t-no-ref", registry.holder("s-c").orElseThrow());
        verifyNoInteractions(alertService);
    }

    @Test
    void testDuplicateActiveRecordsRaiseCriticalAlert() {
        pendingWithOrder("t-old", "s-a", false);
        clock.advance(Duration.ofMinutes(1));
        ledger.put(TradeRecord.ghostAdopted("t-ghost", "s-a", "BTCUSDT", PositionSide.LONG,
            BigDecimal.ONE, new BigDecimal("100"), 10, BigDecimal.TEN, clock.instant()));

        LifecycleRecovery.RecoveryReport report = recovery.recover();

        assertEquals(List.of("s-a"), report.duplicateStrategies());
        assertEquals("t-ghost", registry.holder("s-a").orElseThrow(), "Newest keeps the slot");
        verify(alertService).sendCriticalAlert(eq("DUPLICATE_ACTIVE_POSITIONS"), anyString());
    }

    @Test
    void testUnreachableExchangeLeavesPendingUnresolved() {
        pendingWithOrder("t-1", "s-a", true);
        gateway.setUnavailable(true);

        LifecycleRecovery.RecoveryReport report = recovery.recover();

        assertEquals(1, report.pendingUnresolved());
        assertEquals(TradeStatus.PENDING, ledger.get("t-1").orElseThrow().status());
        assertEquals("t-1", registry.holder("s-a").orElseThrow());
    }
}
