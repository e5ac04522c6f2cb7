package in.ledgerguard.application.service;

import in.ledgerguard.application.monitoring.AlertService;
import in.ledgerguard.application.port.output.AnomalyNotifier;
import in.ledgerguard.application.port.output.LedgerRepository;
import in.ledgerguard.domain.anomaly.AnomalyEvent;
import in.ledgerguard.domain.anomaly.AnomalyEventType;
import in.ledgerguard.domain.common.InvariantViolationException;
import in.ledgerguard.domain.common.LedgerGuardException;
import in.ledgerguard.domain.common.LedgerWriteException;
import in.ledgerguard.domain.trade.ExitReason;
import in.ledgerguard.domain.trade.LedgerWrite;
import in.ledgerguard.domain.trade.MatchTolerance;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import in.ledgerguard.domain.trade.TradeUpdate;
import in.ledgerguard.domain.trade.WriteOutcome;
import in.ledgerguard.infrastructure.common.RetryPolicy;
import in.ledgerguard.infrastructure.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TradeLedgerStore - durable source of truth for trade records.
 *
 * WRITE PATH:
 * 1. Write the full record to the repository
 * 2. Read it back from durable storage and compare field by field
 * 3. On mismatch or error, retry with backoff (RetryPolicy)
 * 4. After exhaustion, persist the minimal schema (EMERGENCY) and raise a CRITICAL alert
 * 5. If even that fails, throw LedgerWriteException
 *
 * The store keeps every active record in memory; reads never hit the repository.
 * Callers serialize mutations per strategy through {@link StrategyCoordinator}.
 */
public final class TradeLedgerStore {
    private static final Logger log = LoggerFactory.getLogger(TradeLedgerStore.class);

    private static final Comparator<TradeRecord> NEWEST_FIRST =
        Comparator.comparing(TradeRecord::entryTime, Comparator.nullsLast(Comparator.reverseOrder()));

    private final LedgerRepository repository;
    private final RetryPolicy writeRetry;
    private final MatchTolerance tolerance;
    private final AnomalyNotifier notifier;
    private final AlertService alertService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    private final Map<String, TradeRecord> records = new ConcurrentHashMap<>();
    private volatile Instant lastUpdated;

    public TradeLedgerStore(LedgerRepository repository,
                            RetryPolicy writeRetry,
                            MatchTolerance tolerance,
                            AnomalyNotifier notifier,
                            AlertService alertService,
                            LedgerMetrics metrics,
                            Clock clock) {
        this.repository = repository;
        this.writeRetry = writeRetry;
        this.tolerance = tolerance;
        this.notifier = notifier;
        this.alertService = alertService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Load all records from the repository. A store that cannot be read starts empty.
     */
    public void load() {
        records.clear();
        try {
            records.putAll(repository.loadAll());
            lastUpdated = repository.lastUpdated();
            log.info("Ledger ready: {} records ({} active), last_updated={}",
                records.size(), activeRecords().size(), lastUpdated);
        } catch (LedgerGuardException e) {
            records.clear();
            log.error("Ledger could not be loaded, starting empty: {}", e.getMessage(), e);
            alertService.sendCriticalAlert("LEDGER_LOAD_FAILED", "Ledger could not be loaded: " + e.getMessage());
        }
    }

    /**
     * Insert a new record.
     *
     * @throws InvariantViolationException if the trade id is already used by a different record
     * @throws LedgerWriteException if the record could not be persisted at all
     */
    public LedgerWrite put(TradeRecord record) {
        TradeRecord existing = records.get(record.tradeId());
        if (existing != null) {
            if (existing.sameContentAs(record)) {
                return new LedgerWrite(existing, WriteOutcome.VERIFIED);
            }
            throw new InvariantViolationException("Trade id already used: " + record.tradeId());
        }

        WriteOutcome outcome = persist(record);
        records.put(record.tradeId(), record);
        return new LedgerWrite(record, outcome);
    }

    /**
     * Apply a partial update. Re-applying identical fields is a no-op.
     *
     * @throws InvariantViolationException for unknown ids, backward transitions or immutable-field changes
     * @throws LedgerWriteException if the record could not be persisted at all
     */
    public LedgerWrite update(String tradeId, TradeUpdate update) {
        TradeRecord current = records.get(tradeId);
        if (current == null) {
            throw new InvariantViolationException("Unknown trade id: " + tradeId);
        }

        TradeRecord next = update.applyTo(current);
        if (next.sameContentAs(current)) {
            log.debug("Update for {} changes nothing: {}", tradeId, update);
            return new LedgerWrite(current, WriteOutcome.VERIFIED);
        }

        WriteOutcome outcome = persist(next);
        records.put(tradeId, next);
        if (current.status() != next.status()) {
            log.info("Trade {} [{}] {} -> {}", tradeId, next.strategyName(), current.status(), next.status());
        }
        return new LedgerWrite(next, outcome);
    }

    private WriteOutcome persist(TradeRecord record) {
        long start = System.nanoTime();
        RetryPolicy policy = writeRetry.fresh();

        while (policy.shouldRetry()) {
            try {
                repository.write(record);
                Optional<TradeRecord> readBack = repository.read(record.tradeId());
                if (readBack.isPresent() && readBack.get().sameContentAs(record)) {
                    policy.recordSuccess();
                    lastUpdated = clock.instant();
                    metrics.recordLedgerWrite(WriteOutcome.VERIFIED, Duration.ofNanos(System.nanoTime() - start));
                    return WriteOutcome.VERIFIED;
                }
                log.warn("Read-back of trade {} does not match what was written", record.tradeId());
            } catch (RuntimeException e) {
                log.warn("Ledger write of trade {} failed: {}", record.tradeId(), e.getMessage());
            }

            policy.recordFailure();
            try {
                policy.pause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        return emergencyWrite(record, start);
    }

    private WriteOutcome emergencyWrite(TradeRecord record, long start) {
        log.error("[LEDGER-EMERGENCY] Verified write of trade {} failed, writing minimal record", record.tradeId());
        try {
            repository.write(record.minimal());
        } catch (RuntimeException e) {
            metrics.recordLedgerWriteFailure();
            alertService.sendCriticalAlert("LEDGER_WRITE_FAILED",
                "Trade " + record.tradeId() + " could not be persisted: " + e.getMessage());
            throw new LedgerWriteException(record.tradeId(),
                "Emergency write failed for trade " + record.tradeId(), e);
        }

        lastUpdated = clock.instant();
        metrics.recordLedgerWrite(WriteOutcome.EMERGENCY, Duration.ofNanos(System.nanoTime() - start));
        alertService.sendCriticalAlert("LEDGER_EMERGENCY_WRITE",
            "Trade " + record.tradeId() + " persisted with minimal schema, status " + record.status());
        return WriteOutcome.EMERGENCY;
    }

    public Optional<TradeRecord> get(String tradeId) {
        return Optional.ofNullable(records.get(tradeId));
    }

    /**
     * Tolerant lookup: strategy, symbol and side match exactly; quantity and entry price
     * within {@code max(value * relative, floor)}. A null price skips the price check.
     *
     * @return matching records, newest first
     */
    public List<TradeRecord> find(String strategy, String symbol, PositionSide side,
                                  BigDecimal quantity, BigDecimal entryPrice) {
        return records.values().stream()
            .filter(r -> r.strategyName().equals(strategy))
            .filter(r -> r.symbol().equals(symbol))
            .filter(r -> r.side() == side)
            .filter(r -> quantity == null || tolerance.quantityMatches(r.quantity(), quantity))
            .filter(r -> entryPrice == null || tolerance.priceMatches(r.entryPrice(), entryPrice))
            .sorted(NEWEST_FIRST)
            .toList();
    }

    public List<TradeRecord> findByStatus(TradeStatus... statuses) {
        Set<TradeStatus> wanted = EnumSet.noneOf(TradeStatus.class);
        wanted.addAll(Arrays.asList(statuses));
        return records.values().stream()
            .filter(r -> wanted.contains(r.status()))
            .sorted(NEWEST_FIRST)
            .toList();
    }

    public List<TradeRecord> activeRecords() {
        return findByStatus(TradeStatus.PENDING, TradeStatus.OPEN, TradeStatus.GHOST_ADOPTED);
    }

    public List<TradeRecord> activeFor(String strategy) {
        return activeRecords().stream()
            .filter(r -> r.strategyName().equals(strategy))
            .toList();
    }

    public Collection<TradeRecord> all() {
        return List.copyOf(records.values());
    }

    public Instant lastUpdated() {
        return lastUpdated;
    }

    /**
     * Close every OPEN record older than {@code threshold}: the position was almost
     * certainly closed on the exchange while nobody was watching.
     *
     * @return records that were closed
     */
    public List<TradeRecord> sweepStale(Duration threshold) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(threshold);
        List<TradeRecord> swept = new ArrayList<>();

        for (TradeRecord record : findByStatus(TradeStatus.OPEN)) {
            if (record.entryTime() == null || !record.entryTime().isBefore(cutoff)) {
                continue;
            }
            try {
                TradeRecord closed = update(record.tradeId(), TradeUpdate.builder()
                    .status(TradeStatus.CLOSED)
                    .exitTime(now)
                    .exitPrice(record.entryPrice())
                    .exitReason(ExitReason.STALE_AUTO_CLOSED.label())
                    .pnlAbsolute(BigDecimal.ZERO)
                    .pnlPercentage(BigDecimal.ZERO)
                    .duration(Duration.between(record.entryTime(), now))
                    .build()).record();
                swept.add(closed);

                notifier.notify(AnomalyEvent.builder(AnomalyEventType.STALE_CLOSED, "stale:" + record.tradeId())
                    .strategy(record.strategyName())
                    .symbol(record.symbol())
                    .tradeId(record.tradeId())
                    .message(String.format("Stale trade %s opened %s auto-closed with zero PnL",
                        record.tradeId(), record.entryTime()))
                    .detail("entry_time", record.entryTime())
                    .occurredAt(now)
                    .build());
            } catch (LedgerGuardException e) {
                log.error("Failed to close stale trade {}: {}", record.tradeId(), e.getMessage());
            }
        }

        if (!swept.isEmpty()) {
            log.warn("Stale sweep closed {} records older than {}", swept.size(), threshold);
        }
        return swept;
    }

    /**
     * Move CLOSED records whose exit is older than {@code cutoff} to the archive.
     *
     * @return number of records archived
     */
    public int archiveClosedBefore(Instant cutoff) {
        List<TradeRecord> expired = records.values().stream()
            .filter(r -> r.status() == TradeStatus.CLOSED)
            .filter(r -> r.exitTime() != null && r.exitTime().isBefore(cutoff))
            .toList();
        if (expired.isEmpty()) {
            return 0;
        }

        int moved = repository.archive(expired);
        expired.forEach(r -> records.remove(r.tradeId()));
        lastUpdated = clock.instant();
        log.info("Archived {} closed records older than {}", expired.size(), cutoff);
        return moved;
    }
}
