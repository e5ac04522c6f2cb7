package in.ledgerguard.domain.monitoring;

/**
 * Alert severity levels
 */
public enum AlertLevel {
    /**
     * CRITICAL - Immediate action required
     * Examples: ledger write lost, emergency write used
     */
    CRITICAL,

    /**
     * HIGH - Money-relevant drift
     * Examples: orphan closed, ghost position adopted
     */
    HIGH,

    /**
     * MEDIUM - Review and monitor
     * Examples: stale trade auto-closed
     */
    MEDIUM,

    /**
     * INFO - Anomaly cleared, recovery summary
     */
    INFO
}
