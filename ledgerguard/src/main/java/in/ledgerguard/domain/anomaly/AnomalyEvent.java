package in.ledgerguard.domain.anomaly;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drift anomaly raised by the ledger store or the reconciliation engine.
 *
 * @param type       Event type
 * @param key        Deduplication key ({@code orphan:<id>}, {@code ghost:<symbol>:<side>}, ...)
 * @param strategy   Strategy concerned (may be null for unattributed positions)
 * @param symbol     Symbol concerned
 * @param tradeId    Trade concerned (may be null)
 * @param message    Human readable description
 * @param details    Extra fields for the notifier
 * @param occurredAt Detection time
 */
public record AnomalyEvent(
        AnomalyEventType type,
        String key,
        String strategy,
        String symbol,
        String tradeId,
        String message,
        Map<String, Object> details,
        Instant occurredAt) {

    public AnomalyEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static Builder builder(AnomalyEventType type, String key) {
        return new Builder(type, key);
    }

    public static class Builder {
        private final AnomalyEventType type;
        private final String key;
        private String strategy;
        private String symbol;
        private String tradeId;
        private String message = "";
        private final Map<String, Object> details = new LinkedHashMap<>();
        private Instant occurredAt = Instant.now();

        private Builder(AnomalyEventType type, String key) {
            this.type = type;
            this.key = key;
        }

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder tradeId(String tradeId) {
            this.tradeId = tradeId;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder detail(String name, Object value) {
            if (value != null) {
                this.details.put(name, value);
            }
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public AnomalyEvent build() {
            return new AnomalyEvent(type, key, strategy, symbol, tradeId, message, details, occurredAt);
        }
    }
}
