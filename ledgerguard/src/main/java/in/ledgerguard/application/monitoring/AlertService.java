package in.ledgerguard.application.monitoring;

import in.ledgerguard.domain.monitoring.Alert;
import in.ledgerguard.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Alert notification service.
 *
 * Logs leveled alerts to SLF4J. External transports subscribe through the
 * anomaly notifier port, not here.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    /**
     * Log an alert at the SLF4J level matching its severity.
     */
    public void sendAlert(Alert alert) {
        String subject = alert.isAnomaly()
            ? alert.getAlertType() + " " + alert.getAnomalyKey()
            : alert.getAlertType();
        switch (alert.getLevel()) {
            case CRITICAL:
                log.error("[ALERT-CRITICAL] {} - {}", subject, alert.getMessage());
                break;
            case HIGH:
                log.warn("[ALERT-HIGH] {} - {}", subject, alert.getMessage());
                break;
            case MEDIUM:
                log.warn("[ALERT-MEDIUM] {} - {}", subject, alert.getMessage());
                break;
            case INFO:
                log.info("[ALERT-INFO] {} - {}", subject, alert.getMessage());
                break;
        }

        Map<String, Object> details = alert.getDetails();
        if (!details.isEmpty()) {
            log.debug("[ALERT-DETAILS] {} at {}: {}", alert.getAlertType(), alert.getRaisedAt(), details);
        }
    }

    public void sendCriticalAlert(String alertType, String message) {
        sendAlert(Alert.system(alertType, AlertLevel.CRITICAL, message));
    }

    public void sendHighAlert(String alertType, String message) {
        sendAlert(Alert.system(alertType, AlertLevel.HIGH, message));
    }

    public void sendInfoAlert(String alertType, String message) {
        sendAlert(Alert.system(alertType, AlertLevel.INFO, message));
    }
}
