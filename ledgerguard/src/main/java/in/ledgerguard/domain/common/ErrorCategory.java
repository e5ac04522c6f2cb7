package in.ledgerguard.domain.common;

/**
 * Failure categories shared by exceptions and operation results.
 */
public enum ErrorCategory {
    /**
     * Exchange timeouts, network errors, store I/O.
     * Retried with backoff, escalated after exhaustion.
     */
    TRANSIENT,

    /**
     * Duplicate open, unknown trade id, backward transition, missing intent record.
     * Fatal to the operation, never bypassed.
     */
    INVARIANT_VIOLATION,

    /**
     * Ledger and exchange disagree (orphan, ghost, stale).
     * Auto-healed where possible and always reported.
     */
    DRIFT_ANOMALY
}
