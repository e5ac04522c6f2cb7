package in.ledgerguard.application.service;

import in.ledgerguard.application.monitoring.AlertService;
import in.ledgerguard.application.port.output.LedgerRepository;
import in.ledgerguard.domain.anomaly.AnomalyEventType;
import in.ledgerguard.domain.common.InvariantViolationException;
import in.ledgerguard.domain.common.LedgerWriteException;
import in.ledgerguard.domain.trade.LedgerWrite;
import in.ledgerguard.domain.trade.MatchTolerance;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import in.ledgerguard.domain.trade.TradeUpdate;
import in.ledgerguard.domain.trade.WriteOutcome;
import in.ledgerguard.infrastructure.metrics.LedgerMetrics;
import in.ledgerguard.infrastructure.persistence.JsonFileLedgerRepository;
import in.ledgerguard.infrastructure.persistence.LedgerStorageException;
import in.ledgerguard.support.Fixtures;
import in.ledgerguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TradeLedgerStore.
 *
 * Tests:
 * - Verified writes with read-back
 * - Emergency minimal-schema fallback
 * - Idempotent and invalid updates
 * - Tolerant lookup, stale sweep and archival against a file-backed ledger
 */
@ExtendWith(MockitoExtension.class)
class TradeLedgerStoreTest {

    @Mock
    private LedgerRepository repository;

    @Mock
    private AlertService alertService;

    @Mock
    private LedgerMetrics metrics;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private Fixtures.RecordingNotifier notifier;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-05T10:00:00Z");
        notifier = new Fixtures.RecordingNotifier();
    }

    private TradeLedgerStore mockedStore() {
        return new TradeLedgerStore(repository, Fixtures.fastRetry(3), MatchTolerance.DEFAULT,
            notifier, alertService, metrics, clock);
    }

    private TradeLedgerStore fileStore() {
        JsonFileLedgerRepository repo = new JsonFileLedgerRepository(
            tempDir.resolve("ledger.json"), tempDir.resolve("archive.json"), clock);
        TradeLedgerStore store = Fixtures.ledger(repo, notifier, clock);
        store.load();
        return store;
    }

    private TradeRecord pending(String tradeId, String quantity, String price, Instant entryTime) {
        return TradeRecord.pending(tradeId, "btc-trend", "BTCUSDT", PositionSide.LONG,
            new BigDecimal(quantity), new BigDecimal(price), 10,
            new BigDecimal(quantity).multiply(new BigDecimal(price)).divide(BigDecimal.TEN),
            null, null, entryTime);
    }

    // ═══════════════════════════════════════════════════════════════
    // Write path
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testVerifiedWrite() {
        TradeRecord record = pending("t-1", "1", "100", clock.instant());
        when(repository.read("t-1")).thenReturn(Optional.of(record));

        LedgerWrite write = mockedStore().put(record);

        assertEquals(WriteOutcome.VERIFIED, write.outcome());
        verify(repository, times(1)).write(record);
        verify(metrics).recordLedgerWrite(eq(WriteOutcome.VERIFIED), any(Duration.class));
        verifyNoInteractions(alertService);
    }

    @Test
    void testReadBackMismatchFallsBackToMinimalRecord() {
        TradeRecord record = pending("t-1", "1", "100", clock.instant());
        TradeRecord corrupted = pending("t-1", "2", "100", clock.instant());
        when(repository.read("t-1")).thenReturn(Optional.of(corrupted));

        TradeLedgerStore store = mockedStore();
        LedgerWrite write = store.put(record);

        assertEquals(WriteOutcome.EMERGENCY, write.outcome());
        verify(repository, times(3)).write(record);
        verify(repository).write(argThat(TradeRecord::isMinimal));
        verify(alertService).sendCriticalAlert(eq("LEDGER_EMERGENCY_WRITE"), anyString());
        verify(metrics).recordLedgerWrite(eq(WriteOutcome.EMERGENCY), any(Duration.class));
        assertTrue(store.get("t-1").isPresent(), "In-memory copy keeps the full record");
    }

    @Test
    void testFailedEmergencyWriteRaises() {
        TradeRecord record = pending("t-1", "1", "100", clock.instant());
        doThrow(new LedgerStorageException("disk full", new IOException("ENOSPC")))
            .when(repository).write(any(TradeRecord.class));

        TradeLedgerStore store = mockedStore();
        LedgerWriteException e = assertThrows(LedgerWriteException.class, () -> store.put(record));

        assertEquals("t-1", e.getTradeId());
        verify(repository, times(4)).write(any(TradeRecord.class));
        verify(metrics).recordLedgerWriteFailure();
        verify(alertService).sendCriticalAlert(eq("LEDGER_WRITE_FAILED"), anyString());
        assertTrue(store.get("t-1").isEmpty(), "Nothing durable, nothing in memory");
    }

    @Test
    void testLoadFailureStartsEmpty() {
        when(repository.loadAll()).thenThrow(new LedgerStorageException("unreadable", new IOException("bad")));

        TradeLedgerStore store = mockedStore();
        store.load();

        assertTrue(store.all().isEmpty());
        verify(alertService).sendCriticalAlert(eq("LEDGER_LOAD_FAILED"), anyString());
    }

    // ═══════════════════════════════════════════════════════════════
    // File-backed behavior
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testPutSurvivesReload() {
        TradeLedgerStore store = fileStore();
        store.put(pending("t-1", "0.5", "50000", clock.instant()));

        TradeLedgerStore reloaded = fileStore();
        TradeRecord record = reloaded.get("t-1").orElseThrow();
        assertEquals(TradeStatus.PENDING, record.status());
        assertEquals(0, new BigDecimal("50000").compareTo(record.entryPrice()));
        assertNotNull(reloaded.lastUpdated());
    }

    @Test
    void testDuplicatePutIsIdempotentButConflictIsRejected() {
        TradeLedgerStore store = fileStore();
        TradeRecord record = pending("t-1", "1", "100", clock.instant());
        store.put(record);

        assertEquals(WriteOutcome.VERIFIED, store.put(record).outcome());
        assertThrows(InvariantViolationException.class,
            () -> store.put(pending("t-1", "2", "100", clock.instant())));
    }

    @Test
    void testUpdateIsIdempotent() {
        TradeLedgerStore store = fileStore();
        store.put(pending("t-1", "1", "100", clock.instant()));
        TradeUpdate open = TradeUpdate.builder().status(TradeStatus.OPEN).exchangeOrderRef("ORD-1").build();

        TradeRecord first = store.update("t-1", open).record();
        clock.advance(Duration.ofSeconds(5));
        Instant updatedBefore = store.lastUpdated();
        TradeRecord second = store.update("t-1", open).record();

        assertTrue(first.sameContentAs(second));
        assertEquals(updatedBefore, store.lastUpdated(), "No-op update writes nothing");
    }

    @Test
    void testUpdateRejectsBackwardTransitionAndUnknownId() {
        TradeLedgerStore store = fileStore();
        store.put(pending("t-1", "1", "100", clock.instant()));
        store.update("t-1", TradeUpdate.builder().status(TradeStatus.CLOSED).build());

        assertThrows(InvariantViolationException.class,
            () -> store.update("t-1", TradeUpdate.builder().status(TradeStatus.OPEN).build()));
        assertThrows(InvariantViolationException.class,
            () -> store.update("missing", TradeUpdate.builder().status(TradeStatus.OPEN).build()));
    }

    @Test
    void testFindWithinToleranceNewestFirst() {
        TradeLedgerStore store = fileStore();
        store.put(pending("older", "1.000", "50000", clock.instant()));
        clock.advance(Duration.ofMinutes(1));
        store.put(pending("newer", "1.005", "50300", clock.instant()));
        store.put(pending("far", "1.5", "50000", clock.instant()));

        List<TradeRecord> found = store.find("btc-trend", "BTCUSDT", PositionSide.LONG,
            new BigDecimal("1.0"), new BigDecimal("50100"));

        assertEquals(List.of("newer", "older"), found.stream().map(TradeRecord::tradeId).toList());
        assertTrue(store.find("btc-trend", "BTCUSDT", PositionSide.SHORT, null, null).isEmpty());
    }

    @Test
    void testSweepStaleClosesOldOpenRecords() {
        TradeLedgerStore store = fileStore();
        store.put(pending("old", "1", "100", clock.instant()));
        store.update("old", TradeUpdate.builder().status(TradeStatus.OPEN).build());
        clock.advance(Duration.ofHours(30));
        store.put(pending("fresh", "1", "100", clock.instant()));
        store.update("fresh", TradeUpdate.builder().status(TradeStatus.OPEN).build());

        List<TradeRecord> swept = store.sweepStale(Duration.ofHours(24));

        assertEquals(1, swept.size());
        TradeRecord closed = store.get("old").orElseThrow();
        assertEquals(TradeStatus.CLOSED, closed.status());
        assertEquals("stale-auto-closed", closed.exitReason());
        assertEquals(0, BigDecimal.ZERO.compareTo(closed.pnlAbsolute()));
        assertEquals(Duration.ofHours(30), closed.duration());
        assertEquals(TradeStatus.OPEN, store.get("fresh").orElseThrow().status());
        assertEquals(1, notifier.count(AnomalyEventType.STALE_CLOSED));
    }

    @Test
    void testArchiveMovesOnlyExpiredClosedRecords() {
        TradeLedgerStore store = fileStore();
        store.put(pending("expired", "1", "100", clock.instant()));
        store.update("expired", TradeUpdate.builder().status(TradeStatus.CLOSED).exitTime(clock.instant()).build());
        clock.advance(Duration.ofDays(40));
        store.put(pending("recent", "1", "100", clock.instant()));
        store.update("recent", TradeUpdate.builder().status(TradeStatus.CLOSED).exitTime(clock.instant()).build());
        store.put(pending("active", "1", "100", clock.instant()));

        int moved = store.archiveClosedBefore(clock.instant().minus(Duration.ofDays(30)));

        assertEquals(1, moved);
        assertTrue(store.get("expired").isEmpty());
        assertTrue(store.get("recent").isPresent());
        assertTrue(store.get("active").isPresent());
        assertTrue(fileStore().get("expired").isEmpty(), "Archived records are gone after reload");
    }
}
