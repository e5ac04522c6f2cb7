package in.ledgerguard.application.service;

import in.ledgerguard.config.StrategyCatalog;
import in.ledgerguard.domain.trade.PositionSlot;
import in.ledgerguard.domain.trade.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * PositionSlotRegistry - at most one active position per strategy.
 *
 * STRUCTURE:
 * - Map&lt;strategy, PositionSlot&gt;; a slot is either occupied by one trade id,
 *   or empty with an optional cooldown deadline
 *
 * THREAD-SAFETY:
 * Every mutation is a single ConcurrentHashMap.compute on the strategy key,
 * so acquisition is atomic per strategy without a global lock.
 *
 * LIFECYCLE:
 * 1. Rebuilt on startup from the ledger's active records
 * 2. tryAcquire before the PENDING write
 * 3. release after the CLOSED write, starting the cooldown
 */
public final class PositionSlotRegistry {
    private static final Logger log = LoggerFactory.getLogger(PositionSlotRegistry.class);

    private final Map<String, PositionSlot> slots = new ConcurrentHashMap<>();
    private final Function<String, Duration> cooldownLookup;
    private final Clock clock;

    public PositionSlotRegistry(StrategyCatalog strategies, Clock clock) {
        this(strategies::cooldownFor, clock);
    }

    public PositionSlotRegistry(Function<String, Duration> cooldownLookup, Clock clock) {
        this.cooldownLookup = cooldownLookup;
        this.clock = clock;
    }

    /**
     * Take the strategy's slot for {@code tradeId}.
     *
     * @return false when the slot is occupied or cooling down
     */
    public boolean tryAcquire(String strategy, String tradeId) {
        Instant now = clock.instant();
        boolean[] acquired = {false};
        slots.compute(strategy, (key, current) -> {
            if (current != null && (current.isOccupied() || current.isCoolingDown(now))) {
                return current;
            }
            acquired[0] = true;
            return PositionSlot.occupied(key, tradeId, now);
        });

        if (acquired[0]) {
            log.debug("Slot acquired: {} -> {}", strategy, tradeId);
        } else {
            log.debug("Slot busy for {}: {}", strategy, slots.get(strategy));
        }
        return acquired[0];
    }

    /**
     * Take an empty slot regardless of cooldown. Used by ghost adoption and recovery.
     *
     * @return false when another trade holds the slot
     */
    public boolean occupy(String strategy, String tradeId) {
        Instant now = clock.instant();
        boolean[] occupied = {false};
        slots.compute(strategy, (key, current) -> {
            if (current != null && current.isOccupied()) {
                occupied[0] = tradeId.equals(current.tradeId());
                return current;
            }
            occupied[0] = true;
            return PositionSlot.occupied(key, tradeId, now);
        });
        return occupied[0];
    }

    /**
     * Free the slot and start the strategy's cooldown.
     *
     * @return true if a trade was released
     */
    public boolean release(String strategy) {
        return releaseIf(strategy, null);
    }

    /**
     * Free the slot only if {@code tradeId} holds it.
     */
    public boolean release(String strategy, String tradeId) {
        return releaseIf(strategy, tradeId);
    }

    /**
     * Free the slot without a cooldown. Used when an attempt ends before anything was written.
     */
    public void abandon(String strategy, String tradeId) {
        slots.computeIfPresent(strategy, (key, current) ->
            tradeId.equals(current.tradeId()) ? null : current);
    }

    private boolean releaseIf(String strategy, String tradeId) {
        Instant cooldownUntil = clock.instant().plus(cooldownLookup.apply(strategy));
        boolean[] released = {false};
        slots.computeIfPresent(strategy, (key, current) -> {
            if (!current.isOccupied() || (tradeId != null && !tradeId.equals(current.tradeId()))) {
                return current;
            }
            released[0] = true;
            return PositionSlot.released(key, cooldownUntil);
        });

        if (released[0]) {
            log.info("Slot released: {} (cooldown until {})", strategy, cooldownUntil);
        }
        return released[0];
    }

    /**
     * True while the strategy is cooling down after a release.
     */
    public boolean isBlocked(String strategy) {
        PositionSlot slot = slots.get(strategy);
        return slot != null && slot.isCoolingDown(clock.instant());
    }

    public boolean isOccupied(String strategy) {
        PositionSlot slot = slots.get(strategy);
        return slot != null && slot.isOccupied();
    }

    public Optional<PositionSlot> slot(String strategy) {
        return Optional.ofNullable(slots.get(strategy));
    }

    /**
     * Trade id holding the strategy's slot.
     */
    public Optional<String> holder(String strategy) {
        return slot(strategy).filter(PositionSlot::isOccupied).map(PositionSlot::tradeId);
    }

    /**
     * Replace all slots with the given active records. When a strategy has several,
     * the newest one keeps the slot.
     */
    public void rebuild(Collection<TradeRecord> activeRecords) {
        Map<String, TradeRecord> newest = new LinkedHashMap<>();
        activeRecords.stream()
            .filter(TradeRecord::isActive)
            .sorted(Comparator.comparing(TradeRecord::entryTime, Comparator.nullsFirst(Comparator.naturalOrder())))
            .forEach(r -> {
                TradeRecord previous = newest.put(r.strategyName(), r);
                if (previous != null) {
                    log.error("Strategy {} has more than one active record: {} and {}; newest keeps the slot",
                        r.strategyName(), previous.tradeId(), r.tradeId());
                }
            });

        slots.clear();
        Instant now = clock.instant();
        newest.forEach((strategy, record) ->
            slots.put(strategy, PositionSlot.occupied(strategy, record.tradeId(),
                record.entryTime() != null ? record.entryTime() : now)));

        log.info("PositionSlotRegistry rebuilt: {} occupied slots", slots.size());
    }

    public RegistryStats stats() {
        Instant now = clock.instant();
        int occupied = 0;
        int coolingDown = 0;
        for (PositionSlot slot : slots.values()) {
            if (slot.isOccupied()) occupied++;
            else if (slot.isCoolingDown(now)) coolingDown++;
        }
        return new RegistryStats(slots.size(), occupied, coolingDown);
    }

    /**
     * Registry statistics for monitoring.
     */
    public record RegistryStats(int trackedStrategies, int occupiedSlots, int coolingDown) {}
}
