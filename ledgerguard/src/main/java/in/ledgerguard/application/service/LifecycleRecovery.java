package in.ledgerguard.application.service;

import in.ledgerguard.application.monitoring.AlertService;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Startup recovery, run after the ledger is loaded and swept and before any scheduler starts.
 *
 * 1. Resolve PENDING records that carry an order ref from the exchange's order status
 * 2. Check the single-position invariant across active records
 * 3. Rebuild the slot registry from what is still active
 */
public final class LifecycleRecovery {
    private static final Logger log = LoggerFactory.getLogger(LifecycleRecovery.class);

    private final TradeLedgerStore ledger;
    private final PositionSlotRegistry registry;
    private final PendingOrderResolver resolver;
    private final AlertService alertService;

    public LifecycleRecovery(TradeLedgerStore ledger, PositionSlotRegistry registry,
                             PendingOrderResolver resolver, AlertService alertService) {
        this.ledger = ledger;
        this.registry = registry;
        this.resolver = resolver;
        this.alertService = alertService;
    }

    public RecoveryReport recover() {
        int promoted = 0;
        int rejected = 0;
        int unresolved = 0;

        for (TradeRecord pending : ledger.findByStatus(TradeStatus.PENDING)) {
            try {
                switch (resolver.resolve(pending)) {
                    case PROMOTED -> promoted++;
                    case REJECTED -> rejected++;
                    default -> unresolved++;
                }
            } catch (Exception e) {
                unresolved++;
                log.error("Failed to resolve pending trade {} during recovery: {}", pending.tradeId(), e.getMessage());
            }
        }

        List<TradeRecord> active = ledger.activeRecords();
        Map<String, Long> perStrategy = active.stream()
            .collect(Collectors.groupingBy(TradeRecord::strategyName, Collectors.counting()));
        List<String> duplicates = perStrategy.entrySet().stream()
            .filter(e -> e.getValue() > 1)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
        if (!duplicates.isEmpty()) {
            alertService.sendCriticalAlert("DUPLICATE_ACTIVE_POSITIONS",
                "Strategies with more than one active record: " + duplicates
                    + ". Newest keeps the slot, the rest are left for reconciliation.");
        }

        registry.rebuild(active);

        RecoveryReport report = new RecoveryReport(promoted, rejected, unresolved, duplicates,
            registry.stats().occupiedSlots());
        log.info("Lifecycle recovery: promoted={}, rejected={}, unresolved={}, duplicates={}, occupied={}",
            promoted, rejected, unresolved, duplicates.size(), report.occupiedSlots());
        return report;
    }

    /**
     * @param pendingPromoted   PENDING records found filled and moved to OPEN
     * @param pendingRejected   PENDING records found rejected and closed
     * @param pendingUnresolved PENDING records left for reconciliation
     * @param duplicateStrategies Strategies holding more than one active record
     * @param occupiedSlots     Slots occupied after the rebuild
     */
    public record RecoveryReport(int pendingPromoted,
                                 int pendingRejected,
                                 int pendingUnresolved,
                                 List<String> duplicateStrategies,
                                 int occupiedSlots) {
    }
}
