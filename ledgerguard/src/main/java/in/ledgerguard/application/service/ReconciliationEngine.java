package in.ledgerguard.application.service;

import in.ledgerguard.application.port.output.AnomalyNotifier;
import in.ledgerguard.config.StrategyCatalog;
import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.anomaly.AnomalyEvent;
import in.ledgerguard.domain.anomaly.AnomalyEventType;
import in.ledgerguard.domain.common.LedgerGuardException;
import in.ledgerguard.domain.exchange.ExchangeFill;
import in.ledgerguard.domain.exchange.LivePosition;
import in.ledgerguard.domain.exchange.OrderState;
import in.ledgerguard.domain.exchange.OrderStatusReport;
import in.ledgerguard.domain.exchange.ReconciliationSnapshot;
import in.ledgerguard.domain.trade.ExitReason;
import in.ledgerguard.domain.trade.MatchTolerance;
import in.ledgerguard.domain.trade.Pnl;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import in.ledgerguard.domain.trade.TradeUpdate;
import in.ledgerguard.infrastructure.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Reconciles the ledger with the exchange's live positions.
 *
 * CYCLE:
 * 1. Snapshot live positions (skip the cycle if unavailable)
 * 2. Resolve PENDING records past the grace period from their order status
 * 3. Orphans: ledger says open, exchange has nothing (suppressed during startup grace)
 * 4. Ghosts: exchange has a position no record claims; quantity drift on claimed ones
 * 5. Backfill order refs of adopted positions from recent fills
 * 6. Clear anomaly keys no longer observed
 *
 * Every ledger mutation runs on the owning strategy's coordinator partition.
 * Cycles run on a single thread with a fixed delay, so they never overlap.
 */
public final class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    /**
     * Timing settings.
     *
     * @param interval          Delay between cycles
     * @param cycleDeadline     Budget for one cycle; later steps are skipped once it passes
     * @param pendingGrace      PENDING records younger than this are left to the controller
     * @param fillsLookback     Upper bound of the fill search window
     * @param attributionWindow How far back ghost attribution looks for candidate records
     * @param startupGrace      Orphan detection is suppressed this long after construction
     */
    public record Settings(Duration interval,
                           Duration cycleDeadline,
                           Duration pendingGrace,
                           Duration fillsLookback,
                           Duration attributionWindow,
                           Duration startupGrace) {
        public static final Settings DEFAULT = new Settings(
            Duration.ofSeconds(30), Duration.ofSeconds(20), Duration.ofMinutes(2),
            Duration.ofHours(24), Duration.ofHours(1), Duration.ofMinutes(3));
    }

    private final TradeLedgerStore ledger;
    private final PositionSlotRegistry registry;
    private final ExchangeCalls exchange;
    private final StrategyCoordinator coordinator;
    private final StrategyCatalog strategies;
    private final PendingOrderResolver resolver;
    private final BotTradeWindow botTradeWindow;
    private final AnomalyTracker tracker;
    private final AnomalyNotifier notifier;
    private final LedgerMetrics metrics;
    private final MatchTolerance tolerance;
    private final Settings settings;
    private final Clock clock;
    private final Instant startupGraceUntil;
    private final ScheduledExecutorService scheduler;

    private final AtomicLong totalCycles = new AtomicLong();
    private final AtomicLong skippedCycles = new AtomicLong();
    private final AtomicLong totalPendingResolved = new AtomicLong();
    private final AtomicLong totalOrphansHealed = new AtomicLong();
    private final AtomicLong totalGhostsAdopted = new AtomicLong();
    private final AtomicLong totalFailures = new AtomicLong();
    private volatile Instant lastRunAt = null;
    private volatile Duration lastDuration = Duration.ZERO;

    public ReconciliationEngine(TradeLedgerStore ledger,
                                PositionSlotRegistry registry,
                                ExchangeCalls exchange,
                                StrategyCoordinator coordinator,
                                StrategyCatalog strategies,
                                PendingOrderResolver resolver,
                                BotTradeWindow botTradeWindow,
                                AnomalyTracker tracker,
                                AnomalyNotifier notifier,
                                LedgerMetrics metrics,
                                MatchTolerance tolerance,
                                Settings settings,
                                Clock clock) {
        this.ledger = ledger;
        this.registry = registry;
        this.exchange = exchange;
        this.coordinator = coordinator;
        this.strategies = strategies;
        this.resolver = resolver;
        this.botTradeWindow = botTradeWindow;
        this.tracker = tracker;
        this.notifier = notifier;
        this.metrics = metrics;
        this.tolerance = tolerance;
        this.settings = settings;
        this.clock = clock;
        this.startupGraceUntil = clock.instant().plus(settings.startupGrace());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
            r -> new Thread(r, "reconciliation-engine"));
    }

    public void start() {
        long period = settings.interval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runScheduledCycle, period, period, TimeUnit.MILLISECONDS);
        log.info("Reconciliation engine started: interval={}s, deadline={}s, startup grace until {}",
            settings.interval().toSeconds(), settings.cycleDeadline().toSeconds(), startupGraceUntil);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Reconciliation engine stopped");
    }

    private void runScheduledCycle() {
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Reconciliation cycle failed", e);
        }
    }

    /**
     * Run one full cycle now. Called by the scheduler; public for startup and tests.
     */
    public ReconciliationReport runCycle() {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + settings.cycleDeadline().toNanos();

        ReconciliationSnapshot snapshot;
        try {
            snapshot = new ReconciliationSnapshot(exchange.livePositions(), clock.instant());
        } catch (LedgerGuardException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            log.warn("Reconciliation skipped, live positions unavailable: {}", e.getMessage());
            totalCycles.incrementAndGet();
            skippedCycles.incrementAndGet();
            lastRunAt = startedAt;
            lastDuration = elapsed;
            metrics.recordReconcileCycle(elapsed, true);
            return ReconciliationReport.skipped(startedAt, elapsed);
        }

        Cycle cycle = new Cycle(deadlineNanos);

        resolveStalePending(cycle);

        boolean orphansChecked = false;
        if (clock.instant().isBefore(startupGraceUntil)) {
            log.debug("Orphan detection suppressed until {}", startupGraceUntil);
        } else if (!cycle.pastDeadline()) {
            healOrphans(snapshot, cycle);
            orphansChecked = true;
        }

        if (!cycle.pastDeadline()) {
            detectGhosts(snapshot, cycle);
        }
        if (!cycle.pastDeadline()) {
            backfillAdopted(cycle);
        }

        List<String> cleared = new ArrayList<>();
        if (!cycle.deadlineExceeded) {
            if (orphansChecked) {
                cleared.addAll(clear(AnomalyTracker.ORPHAN_PREFIX, cycle.observedOrphans, AnomalyEventType.ORPHAN_CLEARED));
            }
            cleared.addAll(clear(AnomalyTracker.GHOST_PREFIX, cycle.observedGhosts, AnomalyEventType.GHOST_CLEARED));
            cleared.addAll(clear(AnomalyTracker.DRIFT_PREFIX, cycle.observedDrift, AnomalyEventType.GHOST_CLEARED));
        } else {
            log.warn("Reconciliation cycle exceeded its {}ms deadline, remaining steps skipped",
                settings.cycleDeadline().toMillis());
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        ReconciliationReport report = new ReconciliationReport(
            startedAt, elapsed, false, cycle.deadlineExceeded, snapshot.positions().size(),
            cycle.pendingResolved, cycle.orphansHealed, cycle.ghostsDetected, cycle.ghostsAdopted,
            cycle.driftDetected, cycle.backfilled, cleared, cycle.failures);

        totalCycles.incrementAndGet();
        totalPendingResolved.addAndGet(cycle.pendingResolved);
        totalOrphansHealed.addAndGet(cycle.orphansHealed);
        totalGhostsAdopted.addAndGet(cycle.ghostsAdopted);
        totalFailures.addAndGet(cycle.failures);
        lastRunAt = startedAt;
        lastDuration = elapsed;
        metrics.recordReconcileCycle(elapsed, false);
        metrics.updateActivePositions(ledger.activeRecords().size());

        if (cycle.hasChanges() || !cleared.isEmpty()) {
            log.info("Reconciliation complete: live={}, pending={}, orphans={}, ghosts={}/{} adopted, drift={}, "
                    + "backfilled={}, cleared={}, failures={}, elapsed={}ms",
                report.livePositions(), report.pendingResolved(), report.orphansHealed(),
                report.ghostsDetected(), report.ghostsAdopted(), report.driftDetected(),
                report.backfilled(), cleared.size(), report.failures(), elapsed.toMillis());
        } else {
            log.debug("Reconciliation complete: no changes, elapsed={}ms", elapsed.toMillis());
        }
        return report;
    }

    // ========================================================================
    // PENDING RESOLUTION
    // ========================================================================

    private void resolveStalePending(Cycle cycle) {
        Instant graceCutoff = clock.instant().minus(settings.pendingGrace());
        for (TradeRecord pending : ledger.findByStatus(TradeStatus.PENDING)) {
            if (cycle.pastDeadline()) {
                return;
            }
            if (pending.exchangeOrderRef() == null || isWithinGrace(pending, graceCutoff)) {
                continue;
            }
            try {
                PendingOrderResolver.Resolution resolution = coordinator.call(pending.strategyName(),
                    () -> ledger.get(pending.tradeId())
                        .map(resolver::resolve)
                        .orElse(PendingOrderResolver.Resolution.STILL_PENDING));
                if (resolution == PendingOrderResolver.Resolution.PROMOTED
                        || resolution == PendingOrderResolver.Resolution.REJECTED) {
                    cycle.pendingResolved++;
                }
            } catch (Exception e) {
                cycle.failures++;
                log.error("Failed to resolve pending trade {}: {}", pending.tradeId(), e.getMessage());
            }
        }
    }

    // ========================================================================
    // ORPHANS
    // ========================================================================

    private void healOrphans(ReconciliationSnapshot snapshot, Cycle cycle) {
        Instant graceCutoff = clock.instant().minus(settings.pendingGrace());
        for (TradeRecord record : ledger.activeRecords()) {
            if (cycle.pastDeadline()) {
                return;
            }
            if (snapshot.hasPosition(record.symbol(), record.side())) {
                continue;
            }
            if (record.status() == TradeStatus.PENDING && isWithinGrace(record, graceCutoff)) {
                continue;
            }
            cycle.observedOrphans.add(AnomalyTracker.orphanKey(record.tradeId()));
            try {
                boolean healed = coordinator.call(record.strategyName(), () -> healOrphan(record.tradeId()));
                if (healed) {
                    cycle.orphansHealed++;
                }
            } catch (Exception e) {
                cycle.failures++;
                log.error("Failed to heal orphan {}: {}", record.tradeId(), e.getMessage());
            }
        }
    }

    private boolean healOrphan(String tradeId) {
        Optional<TradeRecord> current = ledger.get(tradeId);
        if (current.isEmpty() || !current.get().isActive()) {
            return false;
        }
        TradeRecord record = current.get();

        if (record.status() == TradeStatus.PENDING) {
            OrderStatusReport status = record.exchangeOrderRef() != null
                ? exchange.orderStatus(record.exchangeOrderRef())
                : null;
            if (status != null && status.state() == OrderState.REJECTED) {
                resolver.closeUnfilled(record, ExitReason.ORDER_REJECTED.label());
                return true;
            }
            if (status == null || status.state() != OrderState.FILLED) {
                return markOrphaned(record, status);
            }
            record = resolver.promote(record, status);
        }

        return closeOrphan(record);
    }

    /**
     * PENDING entry that never filled and has no position: ORPHANED, kept for ghost attribution.
     */
    private boolean markOrphaned(TradeRecord record, OrderStatusReport status) {
        if (status != null && record.exchangeOrderRef() != null) {
            try {
                exchange.cancelOrder(record.exchangeOrderRef());
            } catch (LedgerGuardException e) {
                log.warn("Cancel of orphaned order {} failed: {}", record.exchangeOrderRef(), e.getMessage());
            }
        }

        Instant now = clock.instant();
        String reason = ExitReason.ORPHAN_UNRESOLVED.label();
        ledger.update(record.tradeId(), TradeUpdate.builder()
            .status(TradeStatus.ORPHANED)
            .exitTime(now)
            .exitReason(reason)
            .pnlAbsolute(BigDecimal.ZERO)
            .pnlPercentage(BigDecimal.ZERO)
            .duration(durationSince(record.entryTime(), now))
            .build());
        registry.release(record.strategyName(), record.tradeId());
        metrics.recordOrphanHealed(reason);

        report(AnomalyTracker.orphanKey(record.tradeId()), AnomalyEventType.ORPHAN_DETECTED, record,
            String.format("Pending trade %s never filled and has no live position, marked ORPHANED", record.tradeId()),
            builder -> builder.detail("order_ref", record.exchangeOrderRef())
                .detail("order_state", status != null ? status.state() : null));
        log.warn("Trade {} [{}] ORPHANED: entry order never filled", record.tradeId(), record.strategyName());
        return true;
    }

    /**
     * Close an OPEN or GHOST_ADOPTED record whose position is gone, from the closing fill when one exists.
     */
    private boolean closeOrphan(TradeRecord record) {
        Instant now = clock.instant();
        Optional<ExchangeFill> exitFill = findClosingFill(record, now);

        BigDecimal exitPrice;
        Instant exitTime;
        Pnl pnl;
        String reason;
        if (exitFill.isPresent()) {
            exitPrice = exitFill.get().price();
            exitTime = exitFill.get().time();
            pnl = PnlCalculator.compute(record, exitPrice);
            reason = ExitReason.ORPHAN_RECOVERED.label();
        } else {
            Optional<BigDecimal> mark = markPrice(record.symbol());
            exitPrice = mark.orElse(record.entryPrice());
            exitTime = now;
            pnl = mark.isPresent() ? PnlCalculator.compute(record, exitPrice) : Pnl.ZERO;
            reason = ExitReason.ORPHAN_UNRESOLVED.label();
        }

        ledger.update(record.tradeId(), TradeUpdate.builder()
            .status(TradeStatus.CLOSED)
            .exitTime(exitTime)
            .exitPrice(exitPrice)
            .exitReason(reason)
            .pnlAbsolute(pnl.absolute())
            .pnlPercentage(pnl.percentage())
            .duration(durationSince(record.entryTime(), exitTime))
            .build());
        registry.release(record.strategyName(), record.tradeId());
        metrics.recordOrphanHealed(reason);
        metrics.recordPositionClosed(record.strategyName(), reason);

        String fillId = exitFill.map(ExchangeFill::fillId).orElse(null);
        report(AnomalyTracker.orphanKey(record.tradeId()), AnomalyEventType.ORPHAN_DETECTED, record,
            String.format("Trade %s has no live position, closed %s @ %s pnl=%s",
                record.tradeId(), reason, exitPrice, pnl.absolute()),
            builder -> builder.detail("exit_reason", reason)
                .detail("exit_price", exitPrice)
                .detail("pnl_absolute", pnl.absolute())
                .detail("fill_id", fillId));
        log.warn("Orphan {} [{}] closed: {} @ {} pnl={}",
            record.tradeId(), record.strategyName(), reason, exitPrice, pnl.absolute());
        return true;
    }

    private Optional<ExchangeFill> findClosingFill(TradeRecord record, Instant now) {
        Duration window = settings.fillsLookback();
        if (record.entryTime() != null) {
            Duration sinceEntry = Duration.between(record.entryTime(), now);
            if (sinceEntry.compareTo(window) < 0) {
                window = sinceEntry.isNegative() ? Duration.ZERO : sinceEntry;
            }
        }

        return exchange.recentFills(record.symbol(), window).stream()
            .filter(f -> f.side() == record.side().closingOrderSide())
            .filter(f -> record.entryTime() == null || !f.time().isBefore(record.entryTime()))
            .max(Comparator.comparing(ExchangeFill::time));
    }

    private Optional<BigDecimal> markPrice(String symbol) {
        try {
            return exchange.markPrice(symbol);
        } catch (LedgerGuardException e) {
            log.warn("Mark price for {} unavailable: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    // ========================================================================
    // GHOSTS AND DRIFT
    // ========================================================================

    private void detectGhosts(ReconciliationSnapshot snapshot, Cycle cycle) {
        List<TradeRecord> active = ledger.activeRecords();

        for (LivePosition position : snapshot.positions()) {
            if (cycle.pastDeadline()) {
                return;
            }
            List<TradeRecord> claims = active.stream()
                .filter(r -> r.symbol().equals(position.symbol()) && r.side() == position.side())
                .toList();

            try {
                if (claims.isEmpty()) {
                    String key = AnomalyTracker.ghostKey(position.key());
                    cycle.observedGhosts.add(key);
                    if (botTradeWindow.isProtected(position.symbol())) {
                        log.debug("Unclaimed position {} inside bot-trade window, skipped", position.key());
                        continue;
                    }
                    cycle.ghostsDetected++;
                    if (handleGhost(position)) {
                        cycle.ghostsAdopted++;
                    }
                } else {
                    checkDrift(position, claims, cycle);
                }
            } catch (Exception e) {
                cycle.failures++;
                log.error("Failed to reconcile live position {}: {}", position.key(), e.getMessage());
            }
        }
    }

    private boolean handleGhost(LivePosition position) {
        Optional<TradeRecord> candidate = attribute(position);
        String strategy = candidate.map(TradeRecord::strategyName).orElse(StrategyCatalog.UNATTRIBUTED);

        Optional<TradeRecord> adopted = coordinator.call(strategy, () -> adopt(strategy, position));
        String key = AnomalyTracker.ghostKey(position.key());

        if (adopted.isPresent()) {
            TradeRecord record = adopted.get();
            report(key, AnomalyEventType.GHOST_DETECTED, record,
                String.format("Untracked %s position %s %s adopted as %s for %s",
                    position.symbol(), position.side(), position.quantity(), record.tradeId(), strategy),
                builder -> builder.detail("adopted", true)
                    .detail("quantity", position.quantity())
                    .detail("entry_price", position.entryPrice())
                    .detail("attributed_from", candidate.map(TradeRecord::tradeId).orElse(null)));
            log.warn("Ghost {} adopted as {} [{}]", position.key(), record.tradeId(), strategy);
            return true;
        }

        if (tracker.report(key)) {
            notifier.notify(AnomalyEvent.builder(AnomalyEventType.GHOST_DETECTED, key)
                .strategy(strategy)
                .symbol(position.symbol())
                .message(String.format("Untracked %s position %s %s not adopted: %s already holds a position",
                    position.symbol(), position.side(), position.quantity(), strategy))
                .detail("adopted", false)
                .detail("quantity", position.quantity())
                .detail("entry_price", position.entryPrice())
                .occurredAt(clock.instant())
                .build());
        }
        log.warn("Ghost {} not adopted, slot of {} is occupied", position.key(), strategy);
        return false;
    }

    /**
     * Newest recent PENDING, ORPHANED or failed-open record of a strategy trading the symbol
     * that matches the position within tolerance.
     */
    private Optional<TradeRecord> attribute(LivePosition position) {
        Instant since = clock.instant().minus(settings.attributionWindow());
        List<TradeRecord> candidates = new ArrayList<>();
        for (StrategyConfig config : strategies.forSymbol(position.symbol())) {
            ledger.find(config.name(), position.symbol(), position.side(), position.quantity(), position.entryPrice())
                .stream()
                .filter(this::isAttributionCandidate)
                .filter(r -> r.entryTime() != null && !r.entryTime().isBefore(since))
                .forEach(candidates::add);
        }
        return candidates.stream().max(Comparator.comparing(TradeRecord::entryTime));
    }

    private boolean isAttributionCandidate(TradeRecord record) {
        if (record.status() == TradeStatus.PENDING || record.status() == TradeStatus.ORPHANED) {
            return true;
        }
        return record.status() == TradeStatus.CLOSED
            && (ExitReason.CONFIRMATION_TIMEOUT.label().equals(record.exitReason())
                || ExitReason.ORDER_REJECTED.label().equals(record.exitReason()));
    }

    private Optional<TradeRecord> adopt(String strategy, LivePosition position) {
        if (registry.isOccupied(strategy)) {
            return Optional.empty();
        }
        int leverage = strategies.leverageFor(strategy);
        TradeRecord record = TradeRecord.ghostAdopted(UUID.randomUUID().toString(), strategy,
            position.symbol(), position.side(), position.quantity(), position.entryPrice(), leverage,
            PnlCalculator.marginUsed(position.quantity(), position.entryPrice(), leverage),
            clock.instant());
        ledger.put(record);
        registry.occupy(strategy, record.tradeId());
        metrics.recordGhostAdopted(strategy);
        return Optional.of(record);
    }

    private void checkDrift(LivePosition position, List<TradeRecord> claims, Cycle cycle) {
        BigDecimal claimed = BigDecimal.ZERO;
        for (TradeRecord claim : claims) {
            if (claim.quantity() == null) {
                return;
            }
            claimed = claimed.add(claim.quantity());
        }
        if (tolerance.quantityMatches(claimed, position.quantity())) {
            return;
        }

        String key = AnomalyTracker.driftKey(position.key());
        cycle.observedDrift.add(key);
        cycle.driftDetected++;
        if (tracker.report(key)) {
            TradeRecord first = claims.get(0);
            notifier.notify(AnomalyEvent.builder(AnomalyEventType.GHOST_DETECTED, key)
                .strategy(first.strategyName())
                .symbol(position.symbol())
                .tradeId(first.tradeId())
                .message(String.format("Live %s quantity %s differs from ledger quantity %s across %d record(s)",
                    position.key(), position.quantity(), claimed, claims.size()))
                .detail("live_quantity", position.quantity())
                .detail("ledger_quantity", claimed)
                .detail("records", claims.size())
                .occurredAt(clock.instant())
                .build());
            log.warn("Quantity drift on {}: live={}, ledger={}", position.key(), position.quantity(), claimed);
        }
    }

    // ========================================================================
    // BACKFILL
    // ========================================================================

    private void backfillAdopted(Cycle cycle) {
        for (TradeRecord record : ledger.findByStatus(TradeStatus.GHOST_ADOPTED)) {
            if (cycle.pastDeadline()) {
                return;
            }
            if (record.exchangeOrderRef() != null) {
                continue;
            }
            try {
                Optional<ExchangeFill> fill = exchange.recentFills(record.symbol(), settings.fillsLookback()).stream()
                    .filter(f -> f.side() == record.side().openingOrderSide())
                    .filter(f -> tolerance.quantityMatches(f.quantity(), record.quantity()))
                    .filter(f -> record.entryTime() == null || !f.time().isAfter(record.entryTime()))
                    .max(Comparator.comparing(ExchangeFill::time));
                if (fill.isEmpty()) {
                    continue;
                }
                boolean updated = coordinator.call(record.strategyName(), () -> {
                    Optional<TradeRecord> current = ledger.get(record.tradeId());
                    if (current.isEmpty() || current.get().status() != TradeStatus.GHOST_ADOPTED) {
                        return false;
                    }
                    ledger.update(record.tradeId(), TradeUpdate.builder()
                        .status(TradeStatus.OPEN)
                        .exchangeOrderRef(fill.get().orderRef())
                        .build());
                    return true;
                });
                if (updated) {
                    cycle.backfilled++;
                    log.info("Adopted trade {} matched to order {} from fill {}",
                        record.tradeId(), fill.get().orderRef(), fill.get().fillId());
                }
            } catch (Exception e) {
                cycle.failures++;
                log.error("Failed to backfill adopted trade {}: {}", record.tradeId(), e.getMessage());
            }
        }
    }

    // ========================================================================
    // REPORTING
    // ========================================================================

    private void report(String key, AnomalyEventType type, TradeRecord record, String message,
                        UnaryOperator<AnomalyEvent.Builder> details) {
        if (!tracker.report(key)) {
            return;
        }
        AnomalyEvent.Builder builder = AnomalyEvent.builder(type, key)
            .strategy(record.strategyName())
            .symbol(record.symbol())
            .tradeId(record.tradeId())
            .message(message)
            .occurredAt(clock.instant());
        notifier.notify(details.apply(builder).build());
    }

    private List<String> clear(String prefix, Set<String> observed, AnomalyEventType type) {
        List<String> cleared = tracker.clearAbsent(prefix, observed);
        for (String key : cleared) {
            notifier.notify(AnomalyEvent.builder(type, key)
                .message("Condition no longer observed: " + key)
                .occurredAt(clock.instant())
                .build());
            log.info("Anomaly cleared: {}", key);
        }
        return cleared;
    }

    private boolean isWithinGrace(TradeRecord record, Instant graceCutoff) {
        return record.entryTime() != null && record.entryTime().isAfter(graceCutoff);
    }

    private static Duration durationSince(Instant from, Instant to) {
        return from != null ? Duration.between(from, to) : Duration.ZERO;
    }

    public ReconcileMetrics getMetrics() {
        return new ReconcileMetrics(
            lastRunAt,
            lastDuration,
            totalCycles.get(),
            skippedCycles.get(),
            totalPendingResolved.get(),
            totalOrphansHealed.get(),
            totalGhostsAdopted.get(),
            totalFailures.get(),
            tracker.size()
        );
    }

    /**
     * Running totals since construction.
     */
    public record ReconcileMetrics(
        Instant lastRunAt,
        Duration lastDuration,
        long totalCycles,
        long skippedCycles,
        long pendingResolved,
        long orphansHealed,
        long ghostsAdopted,
        long failures,
        int openAnomalies
    ) {}

    private static final class Cycle {
        private final long deadlineNanos;
        private final Set<String> observedOrphans = new HashSet<>();
        private final Set<String> observedGhosts = new HashSet<>();
        private final Set<String> observedDrift = new HashSet<>();
        private boolean deadlineExceeded = false;
        private int pendingResolved;
        private int orphansHealed;
        private int ghostsDetected;
        private int ghostsAdopted;
        private int driftDetected;
        private int backfilled;
        private int failures;

        private Cycle(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
        }

        private boolean pastDeadline() {
            if (!deadlineExceeded && System.nanoTime() > deadlineNanos) {
                deadlineExceeded = true;
            }
            return deadlineExceeded;
        }

        private boolean hasChanges() {
            return pendingResolved + orphansHealed + ghostsDetected + driftDetected + backfilled + failures > 0;
        }
    }
}
