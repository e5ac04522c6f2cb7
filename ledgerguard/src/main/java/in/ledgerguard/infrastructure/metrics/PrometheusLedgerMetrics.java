package in.ledgerguard.infrastructure.metrics;

import in.ledgerguard.domain.anomaly.AnomalyEventType;
import in.ledgerguard.domain.trade.WriteOutcome;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of LedgerMetrics.
 *
 * Key Metrics:
 * - ledger_writes_total{outcome} - verified / emergency / failed writes
 * - ledger_write_latency_seconds - write latency including read-back
 * - positions_opened_total{strategy}, positions_rejected_total{strategy, reason}
 * - positions_closed_total{strategy, reason}
 * - anomalies_total{type}
 * - reconcile_cycle_seconds, reconcile_cycles_total{result}
 * - active_positions
 *
 * Usage:
 * <pre>
 * PrometheusLedgerMetrics metrics = new PrometheusLedgerMetrics();
 * Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusLedgerMetrics implements LedgerMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusLedgerMetrics.class);

    private final CollectorRegistry registry;

    // Ledger
    private final Counter ledgerWrites;
    private final Histogram ledgerWriteLatency;

    // Lifecycle
    private final Counter positionsOpened;
    private final Counter positionsRejected;
    private final Counter positionsClosed;
    private final Gauge activePositions;

    // Reconciliation
    private final Counter anomalies;
    private final Histogram reconcileCycleDuration;
    private final Counter reconcileCycles;
    private final Counter orphansHealed;
    private final Counter ghostsAdopted;

    // Exchange
    private final Counter exchangeCallFailures;

    public PrometheusLedgerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLedgerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ledgerWrites = Counter.build()
            .name("ledger_writes_total")
            .help("Total number of ledger writes by outcome")
            .labelNames("outcome")
            .register(registry);

        this.ledgerWriteLatency = Histogram.build()
            .name("ledger_write_latency_seconds")
            .help("Ledger write latency including read-back verification")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.positionsOpened = Counter.build()
            .name("positions_opened_total")
            .help("Total number of positions opened")
            .labelNames("strategy")
            .register(registry);

        this.positionsRejected = Counter.build()
            .name("positions_rejected_total")
            .help("Total number of open attempts that did not produce a position")
            .labelNames("strategy", "reason")
            .register(registry);

        this.positionsClosed = Counter.build()
            .name("positions_closed_total")
            .help("Total number of positions closed")
            .labelNames("strategy", "reason")
            .register(registry);

        this.activePositions = Gauge.build()
            .name("active_positions")
            .help("Number of occupied position slots")
            .register(registry);

        this.anomalies = Counter.build()
            .name("anomalies_total")
            .help("Total number of anomaly events")
            .labelNames("type")
            .register(registry);

        this.reconcileCycleDuration = Histogram.build()
            .name("reconcile_cycle_seconds")
            .help("Reconciliation cycle duration in seconds")
            .buckets(0.01, 0.1, 0.5, 1.0, 5.0, 10.0, 20.0)
            .register(registry);

        this.reconcileCycles = Counter.build()
            .name("reconcile_cycles_total")
            .help("Total number of reconciliation cycles")
            .labelNames("result")
            .register(registry);

        this.orphansHealed = Counter.build()
            .name("orphans_healed_total")
            .help("Total number of orphan records healed")
            .labelNames("reason")
            .register(registry);

        this.ghostsAdopted = Counter.build()
            .name("ghosts_adopted_total")
            .help("Total number of ghost positions adopted")
            .labelNames("strategy")
            .register(registry);

        this.exchangeCallFailures = Counter.build()
            .name("exchange_call_failures_total")
            .help("Total number of exchange calls that failed after retries")
            .labelNames("operation")
            .register(registry);

        log.info("Prometheus ledger metrics initialized");
    }

    @Override
    public void recordLedgerWrite(WriteOutcome outcome, Duration latency) {
        ledgerWrites.labels(outcome.name().toLowerCase()).inc();
        ledgerWriteLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordLedgerWriteFailure() {
        ledgerWrites.labels("failed").inc();
    }

    @Override
    public void recordPositionOpened(String strategy) {
        positionsOpened.labels(strategy).inc();
    }

    @Override
    public void recordOpenRejected(String strategy, String reason) {
        positionsRejected.labels(strategy, reason).inc();
    }

    @Override
    public void recordPositionClosed(String strategy, String exitReason) {
        positionsClosed.labels(strategy, exitReason).inc();
    }

    @Override
    public void recordAnomaly(AnomalyEventType type) {
        anomalies.labels(type.name()).inc();
    }

    @Override
    public void recordReconcileCycle(Duration duration, boolean skipped) {
        reconcileCycles.labels(skipped ? "skipped" : "completed").inc();
        if (!skipped) {
            reconcileCycleDuration.observe(duration.toNanos() / 1_000_000_000.0);
        }
    }

    @Override
    public void recordOrphanHealed(String exitReason) {
        orphansHealed.labels(exitReason).inc();
    }

    @Override
    public void recordGhostAdopted(String strategy) {
        ghostsAdopted.labels(strategy).inc();
    }

    @Override
    public void updateActivePositions(int count) {
        activePositions.set(count);
    }

    @Override
    public void recordExchangeCallFailure(String operation) {
        exchangeCallFailures.labels(operation).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
