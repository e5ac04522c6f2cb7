package in.ledgerguard.domain.monitoring;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leveled operator alert.
 *
 * Anomaly alerts carry the anomaly key and the owning strategy; system alerts
 * (ledger write failures, recovery summaries) carry neither.
 */
public final class Alert {
    private final String alertType;
    private final AlertLevel level;
    private final String message;
    private final Instant raisedAt;
    private final String anomalyKey;
    private final String strategy;
    private final Map<String, Object> details;

    private Alert(Builder b) {
        this.alertType = b.alertType;
        this.level = b.level;
        this.message = b.message;
        this.raisedAt = b.raisedAt != null ? b.raisedAt : Instant.now();
        this.anomalyKey = b.anomalyKey;
        this.strategy = b.strategy;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(b.details));
    }

    public String getAlertType() { return alertType; }
    public AlertLevel getLevel() { return level; }
    public String getMessage() { return message; }
    public Instant getRaisedAt() { return raisedAt; }
    public String getAnomalyKey() { return anomalyKey; }
    public String getStrategy() { return strategy; }

    /**
     * Context for the alert. Includes the anomaly key and strategy when set.
     */
    public Map<String, Object> getDetails() {
        Map<String, Object> all = new LinkedHashMap<>();
        if (anomalyKey != null) all.put("key", anomalyKey);
        if (strategy != null) all.put("strategy", strategy);
        all.putAll(details);
        return all;
    }

    public boolean isAnomaly() {
        return anomalyKey != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Alert system(String alertType, AlertLevel level, String message) {
        return builder().alertType(alertType).level(level).message(message).build();
    }

    public static final class Builder {
        private String alertType;
        private AlertLevel level;
        private String message;
        private Instant raisedAt;
        private String anomalyKey;
        private String strategy;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder() {}

        public Builder alertType(String alertType) { this.alertType = alertType; return this; }
        public Builder level(AlertLevel level) { this.level = level; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder raisedAt(Instant raisedAt) { this.raisedAt = raisedAt; return this; }
        public Builder anomalyKey(String anomalyKey) { this.anomalyKey = anomalyKey; return this; }
        public Builder strategy(String strategy) { this.strategy = strategy; return this; }

        public Builder detail(String key, Object value) {
            if (value != null) details.put(key, value);
            return this;
        }

        public Builder details(Map<String, ?> more) {
            more.forEach(this::detail);
            return this;
        }

        public Alert build() {
            if (alertType == null || level == null || message == null) {
                throw new IllegalStateException("alertType, level and message are required");
            }
            return new Alert(this);
        }
    }

    @Override
    public String toString() {
        return anomalyKey == null
            ? String.format("[%s] %s: %s", level, alertType, message)
            : String.format("[%s] %s %s: %s", level, alertType, anomalyKey, message);
    }
}
