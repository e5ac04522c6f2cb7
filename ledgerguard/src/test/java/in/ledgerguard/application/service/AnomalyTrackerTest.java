package in.ledgerguard.application.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyTrackerTest {

    private final AnomalyTracker tracker = new AnomalyTracker();

    @Test
    void testReportOncePerKey() {
        String key = AnomalyTracker.ghostKey("BTCUSDT:LONG");

        assertTrue(tracker.report(key));
        assertFalse(tracker.report(key));
        assertTrue(tracker.isReported(key));
    }

    @Test
    void testClearAbsentOnlyTouchesPrefix() {
        String orphan = AnomalyTracker.orphanKey("t-1");
        String ghost = AnomalyTracker.ghostKey("BTCUSDT:LONG");
        String drift = AnomalyTracker.driftKey("ETHUSDT:SHORT");
        tracker.report(orphan);
        tracker.report(ghost);
        tracker.report(drift);

        List<String> cleared = tracker.clearAbsent(AnomalyTracker.GHOST_PREFIX, Set.of());

        assertEquals(List.of(ghost), cleared);
        assertTrue(tracker.isReported(orphan));
        assertTrue(tracker.isReported(drift));
        assertEquals(2, tracker.size());
    }

    @Test
    void testObservedKeysStayReported() {
        String ghost = AnomalyTracker.ghostKey("BTCUSDT:LONG");
        tracker.report(ghost);

        assertTrue(tracker.clearAbsent(AnomalyTracker.GHOST_PREFIX, Set.of(ghost)).isEmpty());
        assertFalse(tracker.report(ghost));
    }

    @Test
    void testClearedKeyCanBeReportedAgain() {
        String orphan = AnomalyTracker.orphanKey("t-1");
        tracker.report(orphan);
        tracker.clearAbsent(AnomalyTracker.ORPHAN_PREFIX, Set.of());

        assertTrue(tracker.report(orphan));
    }
}
