package in.ledgerguard.support;

import in.ledgerguard.application.monitoring.AlertService;
import in.ledgerguard.application.port.output.AnomalyNotifier;
import in.ledgerguard.application.port.output.LedgerRepository;
import in.ledgerguard.application.service.ExchangeCalls;
import in.ledgerguard.application.service.TradeLedgerStore;
import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.anomaly.AnomalyEvent;
import in.ledgerguard.domain.anomaly.AnomalyEventType;
import in.ledgerguard.domain.trade.MatchTolerance;
import in.ledgerguard.application.port.output.ExchangeGateway;
import in.ledgerguard.infrastructure.common.RetryPolicy;
import in.ledgerguard.infrastructure.metrics.PrometheusLedgerMetrics;
import io.prometheus.client.CollectorRegistry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared builders for service tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static RetryPolicy fastRetry(int attempts) {
        return RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .multiplier(2.0)
            .maxAttempts(attempts)
            .build();
    }

    public static PrometheusLedgerMetrics metrics() {
        return new PrometheusLedgerMetrics(new CollectorRegistry());
    }

    public static TradeLedgerStore ledger(LedgerRepository repository, AnomalyNotifier notifier, Clock clock) {
        return new TradeLedgerStore(repository, fastRetry(3), MatchTolerance.DEFAULT,
            notifier, new AlertService(), metrics(), clock);
    }

    public static ExchangeCalls exchangeCalls(ExchangeGateway gateway) {
        return new ExchangeCalls(gateway, fastRetry(2), Duration.ofSeconds(2), metrics());
    }

    /**
     * Strategy trading {@code symbol} with margin 100, leverage 10, cooldown 5 minutes.
     */
    public static StrategyConfig strategy(String name, String symbol) {
        return new StrategyConfig(name, symbol, new BigDecimal("100"), 10, new BigDecimal("10"),
            Duration.ofMinutes(5), Duration.ofSeconds(30), new BigDecimal("0.001"));
    }

    /**
     * Notifier that keeps every event for assertions.
     */
    public static final class RecordingNotifier implements AnomalyNotifier {
        private final List<AnomalyEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void notify(AnomalyEvent event) {
            events.add(event);
        }

        public List<AnomalyEvent> events() {
            return List.copyOf(events);
        }

        public long count(AnomalyEventType type) {
            return events.stream().filter(e -> e.type() == type).count();
        }

        public void clear() {
            events.clear();
        }
    }
}
