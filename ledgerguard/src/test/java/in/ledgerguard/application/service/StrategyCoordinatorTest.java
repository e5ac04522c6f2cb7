package in.ledgerguard.application.service;

import in.ledgerguard.domain.common.InvariantViolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StrategyCoordinatorTest {

    private final StrategyCoordinator coordinator = new StrategyCoordinator(4);

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    void testTasksForOneStrategyRunInOrder() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            int n = i;
            futures.add(coordinator.execute("btc-trend", () -> seen.add(n)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        for (int i = 0; i < 100; i++) {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    void testTasksForOneStrategyNeverOverlap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(coordinator.execute("btc-trend", () -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                Thread.onSpinWait();
                inFlight.decrementAndGet();
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertEquals(1, maxInFlight.get());
    }

    @Test
    void testCallReturnsResult() {
        assertEquals("ok", coordinator.call("btc-trend", () -> "ok"));
    }

    @Test
    void testCallRethrowsRuntimeExceptionUnchanged() {
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> coordinator.call("btc-trend", () -> {
                throw new InvariantViolationException("boom");
            }));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void testNestedCallOnSamePartitionRunsInline() {
        String result = coordinator.call("btc-trend",
            () -> coordinator.call("btc-trend", () -> "nested"));

        assertEquals("nested", result);
    }

    @Test
    void testRejectsAfterShutdown() {
        coordinator.shutdown();

        assertTrue(coordinator.isShutdown());
        assertThrows(RejectedExecutionException.class, () -> coordinator.call("btc-trend", () -> "late"));
    }
}
