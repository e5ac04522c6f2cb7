package in.ledgerguard.domain.trade;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Persisted status of a trade record.
 *
 * STATE MACHINE:
 * <pre>
 * PENDING ──► OPEN ──► CLOSED
 *    │                   ▲
 *    ├──► CLOSED         │
 *    └──► ORPHANED       │
 * GHOST_ADOPTED ──► OPEN ┘
 * GHOST_ADOPTED ──► CLOSED
 * </pre>
 * CLOSED and ORPHANED are terminal.
 */
public enum TradeStatus {
    PENDING,
    OPEN,
    CLOSED,
    ORPHANED,
    GHOST_ADOPTED;

    private static final Map<TradeStatus, Set<TradeStatus>> ALLOWED = Map.of(
        PENDING, EnumSet.of(OPEN, CLOSED, ORPHANED),
        OPEN, EnumSet.of(CLOSED),
        GHOST_ADOPTED, EnumSet.of(OPEN, CLOSED),
        CLOSED, EnumSet.noneOf(TradeStatus.class),
        ORPHANED, EnumSet.noneOf(TradeStatus.class)
    );

    /**
     * True for statuses that occupy a strategy's position slot.
     */
    public boolean isActive() {
        return this == PENDING || this == OPEN || this == GHOST_ADOPTED;
    }

    public boolean isTerminal() {
        return this == CLOSED || this == ORPHANED;
    }

    /**
     * Check whether a transition to {@code next} is allowed.
     * Re-applying the current status is always allowed (idempotent update).
     */
    public boolean canTransitionTo(TradeStatus next) {
        return this == next || ALLOWED.get(this).contains(next);
    }
}
