package in.ledgerguard.application.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one reconciliation cycle.
 *
 * @param startedAt         Cycle start
 * @param duration          Wall time
 * @param skipped           True when the live snapshot could not be fetched
 * @param deadlineExceeded  True when later steps were cut short by the cycle deadline
 * @param livePositions     Positions in the snapshot
 * @param pendingResolved   PENDING records promoted or closed from their order status
 * @param orphansHealed     Ledger positions closed because the exchange no longer has them
 * @param ghostsDetected    Live positions no active record claims
 * @param ghostsAdopted     Ghosts recorded as GHOST_ADOPTED
 * @param driftDetected     Claimed positions whose quantity disagrees with the ledger
 * @param backfilled        Adopted records matched to their opening fill
 * @param clearedKeys       Anomaly keys that cleared this cycle
 * @param failures          Items that threw and were skipped
 */
public record ReconciliationReport(
        Instant startedAt,
        Duration duration,
        boolean skipped,
        boolean deadlineExceeded,
        int livePositions,
        int pendingResolved,
        int orphansHealed,
        int ghostsDetected,
        int ghostsAdopted,
        int driftDetected,
        int backfilled,
        List<String> clearedKeys,
        int failures) {

    public ReconciliationReport {
        clearedKeys = List.copyOf(clearedKeys);
    }

    public static ReconciliationReport skipped(Instant startedAt, Duration duration) {
        return new ReconciliationReport(startedAt, duration, true, false, 0, 0, 0, 0, 0, 0, 0, List.of(), 0);
    }
}
