package in.ledgerguard.domain.trade;

/**
 * Controller-side lifecycle state of a strategy's current position.
 * CLOSING is transient and never persisted.
 */
public enum LifecycleState {
    NONE,
    PENDING,
    OPEN,
    CLOSING,
    CLOSED
}
