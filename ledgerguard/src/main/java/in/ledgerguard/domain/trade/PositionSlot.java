package in.ledgerguard.domain.trade;

import java.time.Instant;

/**
 * In-memory slot of one strategy: at most one active trade, then a cooldown.
 *
 * @param strategyName  Strategy owning the slot
 * @param tradeId       Trade holding the slot, null when empty
 * @param openedAt      When the current trade took the slot
 * @param cooldownUntil End of the cooldown started by the last release
 */
public record PositionSlot(String strategyName, String tradeId, Instant openedAt, Instant cooldownUntil) {

    public static PositionSlot occupied(String strategyName, String tradeId, Instant openedAt) {
        return new PositionSlot(strategyName, tradeId, openedAt, null);
    }

    public static PositionSlot released(String strategyName, Instant cooldownUntil) {
        return new PositionSlot(strategyName, null, null, cooldownUntil);
    }

    public boolean isOccupied() {
        return tradeId != null;
    }

    public boolean isCoolingDown(Instant now) {
        return !isOccupied() && cooldownUntil != null && now.isBefore(cooldownUntil);
    }
}
