package in.ledgerguard.infrastructure.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.ledgerguard.domain.trade.TradeRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson setup shared by the ledger backends: snake_case, ISO-8601 instants and durations.
 */
public final class LedgerJson {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * On-disk layout: {@code {"trades": {<trade_id>: {...}}, "last_updated": "..."}}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LedgerDocument(
            @JsonProperty("trades") Map<String, TradeRecord> trades,
            @JsonProperty("last_updated") Instant lastUpdated) {

        public LedgerDocument {
            trades = trades == null ? new LinkedHashMap<>() : new LinkedHashMap<>(trades);
        }

        public static LedgerDocument empty() {
            return new LedgerDocument(new LinkedHashMap<>(), null);
        }
    }

    private LedgerJson() {}
}
