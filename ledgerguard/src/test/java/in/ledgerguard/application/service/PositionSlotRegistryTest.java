package in.ledgerguard.application.service;

import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PositionSlotRegistry.
 *
 * Tests:
 * - One holder per strategy
 * - Cooldown after release
 * - Adoption ignoring cooldown
 * - Rebuild from ledger records
 */
class PositionSlotRegistryTest {

    private MutableClock clock;
    private PositionSlotRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-05T10:00:00Z");
        registry = new PositionSlotRegistry(strategy -> Duration.ofMinutes(5), clock);
    }

    @Test
    void testSecondAcquireFails() {
        assertTrue(registry.tryAcquire("btc-trend", "t-1"));
        assertFalse(registry.tryAcquire("btc-trend", "t-2"));
        assertTrue(registry.tryAcquire("eth-reversion", "t-3"), "Other strategies are independent");

        assertEquals("t-1", registry.holder("btc-trend").orElseThrow());
    }

    @Test
    void testReleaseStartsCooldown() {
        registry.tryAcquire("btc-trend", "t-1");
        assertTrue(registry.release("btc-trend", "t-1"));

        assertFalse(registry.isOccupied("btc-trend"));
        assertTrue(registry.isBlocked("btc-trend"));
        assertFalse(registry.tryAcquire("btc-trend", "t-2"));

        clock.advance(Duration.ofMinutes(5));
        assertFalse(registry.isBlocked("btc-trend"));
        assertTrue(registry.tryAcquire("btc-trend", "t-2"));
    }

    @Test
    void testReleaseByOtherTradeIsIgnored() {
        registry.tryAcquire("btc-trend", "t-1");

        assertFalse(registry.release("btc-trend", "t-other"));
        assertEquals("t-1", registry.holder("btc-trend").orElseThrow());
    }

    @Test
    void testAbandonSkipsCooldown() {
        registry.tryAcquire("btc-trend", "t-1");
        registry.abandon("btc-trend", "t-1");

        assertFalse(registry.isBlocked("btc-trend"));
        assertTrue(registry.tryAcquire("btc-trend", "t-2"));
    }

    @Test
    void testOccupyIgnoresCooldownButNotHolder() {
        registry.tryAcquire("btc-trend", "t-1");
        registry.release("btc-trend");
        assertTrue(registry.isBlocked("btc-trend"));

        assertTrue(registry.occupy("btc-trend", "ghost-1"));
        assertFalse(registry.occupy("btc-trend", "ghost-2"));
        assertTrue(registry.occupy("btc-trend", "ghost-1"), "Same holder is idempotent");
    }

    @Test
    void testConcurrentAcquireHasOneWinner() throws InterruptedException {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            String tradeId = "t-" + i;
            pool.submit(() -> {
                start.await();
                if (registry.tryAcquire("btc-trend", tradeId)) {
                    winners.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, winners.get());
    }

    @Test
    void testRebuildKeepsNewestActiveRecord() {
        Instant t0 = clock.instant();
        TradeRecord older = TradeRecord.pending("old", "btc-trend", "BTCUSDT", PositionSide.LONG,
            BigDecimal.ONE, BigDecimal.TEN, 5, BigDecimal.ONE, null, null, t0.minusSeconds(60));
        TradeRecord newer = TradeRecord.ghostAdopted("new", "btc-trend", "BTCUSDT", PositionSide.LONG,
            BigDecimal.ONE, BigDecimal.TEN, 5, BigDecimal.ONE, t0);
        TradeRecord eth = TradeRecord.pending("eth", "eth-reversion", "ETHUSDT", PositionSide.SHORT,
            BigDecimal.ONE, BigDecimal.TEN, 3, BigDecimal.ONE, null, null, t0);

        registry.tryAcquire("sol-breakout", "stale");
        registry.rebuild(List.of(newer, eth, older));

        assertEquals("new", registry.holder("btc-trend").orElseThrow());
        assertEquals("eth", registry.holder("eth-reversion").orElseThrow());
        assertTrue(registry.holder("sol-breakout").isEmpty(), "Rebuild replaces previous slots");

        PositionSlotRegistry.RegistryStats stats = registry.stats();
        assertEquals(2, stats.occupiedSlots());
        assertEquals(0, stats.coolingDown());
    }
}
