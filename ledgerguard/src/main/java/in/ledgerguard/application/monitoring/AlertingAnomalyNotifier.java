package in.ledgerguard.application.monitoring;

import in.ledgerguard.application.port.output.AnomalyNotifier;
import in.ledgerguard.domain.anomaly.AnomalyEvent;
import in.ledgerguard.domain.monitoring.Alert;
import in.ledgerguard.domain.monitoring.AlertLevel;
import in.ledgerguard.infrastructure.metrics.LedgerMetrics;

/**
 * Default anomaly notifier: counts the event and turns it into a leveled alert.
 *
 * ORPHAN_DETECTED / GHOST_DETECTED -> HIGH
 * STALE_CLOSED                     -> MEDIUM
 * *_CLEARED                        -> INFO
 */
public final class AlertingAnomalyNotifier implements AnomalyNotifier {
    private final AlertService alertService;
    private final LedgerMetrics metrics;

    public AlertingAnomalyNotifier(AlertService alertService, LedgerMetrics metrics) {
        this.alertService = alertService;
        this.metrics = metrics;
    }

    @Override
    public void notify(AnomalyEvent event) {
        metrics.recordAnomaly(event.type());

        Alert.Builder alert = Alert.builder()
            .alertType(event.type().name())
            .level(levelOf(event))
            .message(event.message())
            .raisedAt(event.occurredAt())
            .anomalyKey(event.key())
            .strategy(event.strategy())
            .detail("symbol", event.symbol())
            .detail("trade_id", event.tradeId())
            .details(event.details());

        alertService.sendAlert(alert.build());
    }

    static AlertLevel levelOf(AnomalyEvent event) {
        return switch (event.type()) {
            case ORPHAN_DETECTED, GHOST_DETECTED -> AlertLevel.HIGH;
            case STALE_CLOSED -> AlertLevel.MEDIUM;
            case ORPHAN_CLEARED, GHOST_CLEARED -> AlertLevel.INFO;
        };
    }
}
