package in.ledgerguard.domain.signal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Entry signal produced by an external strategy.
 *
 * @param signalType BUY opens a LONG, SELL opens a SHORT
 * @param entryPrice Reference entry price used for sizing
 * @param stopLoss   Optional stop-loss price
 * @param takeProfit Optional take-profit price
 * @param confidence Strategy confidence, informational
 * @param reason     Free text from the strategy
 * @param symbol     Symbol; null means the strategy's configured symbol
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradingSignal(
        @JsonProperty("signal_type") SignalType signalType,
        @JsonProperty("entry_price") BigDecimal entryPrice,
        @JsonProperty("stop_loss") BigDecimal stopLoss,
        @JsonProperty("take_profit") BigDecimal takeProfit,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("reason") String reason,
        @JsonProperty("symbol") String symbol) {

    public TradingSignal {
        Objects.requireNonNull(signalType, "signalType");
        Objects.requireNonNull(entryPrice, "entryPrice");
        if (entryPrice.signum() <= 0) {
            throw new IllegalArgumentException("Entry price must be positive: " + entryPrice);
        }
    }

    public static TradingSignal of(SignalType type, String symbol, BigDecimal entryPrice) {
        return new TradingSignal(type, entryPrice, null, null, 1.0, "", symbol);
    }
}
