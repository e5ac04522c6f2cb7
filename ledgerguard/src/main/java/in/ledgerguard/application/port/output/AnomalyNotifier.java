package in.ledgerguard.application.port.output;

import in.ledgerguard.domain.anomaly.AnomalyEvent;

/**
 * Receives drift anomalies. Transports (chat, mail, pager) live behind this port.
 */
public interface AnomalyNotifier {

    void notify(AnomalyEvent event);
}
