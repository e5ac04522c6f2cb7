package in.ledgerguard.domain.trade;

/**
 * How a ledger write was made durable.
 */
public enum WriteOutcome {
    /** Full record written and confirmed by read-back. */
    VERIFIED,
    /** Verification kept failing; only the minimal schema was persisted. */
    EMERGENCY
}
