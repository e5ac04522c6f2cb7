package in.ledgerguard.domain.anomaly;

public enum AnomalyEventType {
    ORPHAN_DETECTED,
    ORPHAN_CLEARED,
    GHOST_DETECTED,
    GHOST_CLEARED,
    STALE_CLOSED;

    public boolean isCleared() {
        return this == ORPHAN_CLEARED || this == GHOST_CLEARED;
    }
}
