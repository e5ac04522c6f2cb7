package in.ledgerguard.infrastructure.metrics;

import in.ledgerguard.domain.anomaly.AnomalyEventType;
import in.ledgerguard.domain.trade.WriteOutcome;

import java.time.Duration;

/**
 * Engine metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Ledger write outcomes (verified vs emergency) and latency
 * - Positions opened, rejected and closed per strategy
 * - Anomalies by type
 * - Reconciliation cycle duration and skips
 */
public interface LedgerMetrics {

    /**
     * Record a ledger write that became durable.
     *
     * @param outcome VERIFIED or EMERGENCY
     * @param latency Time including read-back and retries
     */
    void recordLedgerWrite(WriteOutcome outcome, Duration latency);

    /**
     * Record a ledger write that failed even in emergency mode.
     */
    void recordLedgerWriteFailure();

    void recordPositionOpened(String strategy);

    /**
     * @param reason Rejection outcome, e.g. REJECTED_SLOT_OCCUPIED
     */
    void recordOpenRejected(String strategy, String reason);

    void recordPositionClosed(String strategy, String exitReason);

    void recordAnomaly(AnomalyEventType type);

    /**
     * @param duration Cycle wall time
     * @param skipped  True when the snapshot could not be fetched
     */
    void recordReconcileCycle(Duration duration, boolean skipped);

    void recordOrphanHealed(String exitReason);

    void recordGhostAdopted(String strategy);

    void updateActivePositions(int count);

    void recordExchangeCallFailure(String operation);
}
