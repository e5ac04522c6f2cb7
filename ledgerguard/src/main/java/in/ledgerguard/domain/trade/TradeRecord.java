package in.ledgerguard.domain.trade;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * TradeRecord - one persisted record per attempted position.
 *
 * Immutable value; all changes go through {@link TradeUpdate} applied by the ledger
 * store so the read-back verification applies uniformly.
 *
 * Numeric fields are nullable only for minimal-schema emergency records.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradeRecord(
        @JsonProperty("trade_id") String tradeId,
        @JsonProperty("strategy_name") String strategyName,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("side") PositionSide side,

        // Entry
        @JsonProperty("quantity") BigDecimal quantity,
        @JsonProperty("entry_price") BigDecimal entryPrice,
        @JsonProperty("leverage") Integer leverage,
        @JsonProperty("margin_used") BigDecimal marginUsed,
        @JsonProperty("stop_loss") BigDecimal stopLoss,
        @JsonProperty("take_profit") BigDecimal takeProfit,

        @JsonProperty("status") TradeStatus status,
        @JsonProperty("entry_time") Instant entryTime,

        // Exit
        @JsonProperty("exit_time") Instant exitTime,
        @JsonProperty("exit_price") BigDecimal exitPrice,
        @JsonProperty("exit_reason") String exitReason,
        @JsonProperty("pnl_absolute") BigDecimal pnlAbsolute,
        @JsonProperty("pnl_percentage") BigDecimal pnlPercentage,
        @JsonProperty("duration") Duration duration,

        @JsonProperty("exchange_order_ref") String exchangeOrderRef) {

    public TradeRecord {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(strategyName, "strategyName");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Create the durable intent record written before any order call.
     */
    public static TradeRecord pending(String tradeId, String strategyName, String symbol, PositionSide side,
                                      BigDecimal quantity, BigDecimal entryPrice, int leverage,
                                      BigDecimal marginUsed, BigDecimal stopLoss, BigDecimal takeProfit,
                                      Instant entryTime) {
        return new TradeRecord(tradeId, strategyName, symbol, side,
            quantity, entryPrice, leverage, marginUsed, stopLoss, takeProfit,
            TradeStatus.PENDING, entryTime,
            null, null, null, null, null, null,
            null);
    }

    /**
     * Create a record for an exchange position nobody knowingly opened.
     */
    public static TradeRecord ghostAdopted(String tradeId, String strategyName, String symbol, PositionSide side,
                                           BigDecimal quantity, BigDecimal entryPrice, int leverage,
                                           BigDecimal marginUsed, Instant adoptedAt) {
        return new TradeRecord(tradeId, strategyName, symbol, side,
            quantity, entryPrice, leverage, marginUsed, null, null,
            TradeStatus.GHOST_ADOPTED, adoptedAt,
            null, null, null, null, null, null,
            null);
    }

    @JsonIgnore
    public boolean isActive() {
        return status.isActive();
    }

    @JsonIgnore
    public boolean isMinimal() {
        return quantity == null || entryPrice == null;
    }

    /**
     * Minimal-schema copy used for emergency writes: status plus identifying fields only.
     */
    public TradeRecord minimal() {
        return new TradeRecord(tradeId, strategyName, symbol, side,
            null, null, null, null, null, null,
            status, entryTime,
            null, null, exitReason, null, null, null,
            exchangeOrderRef);
    }

    /**
     * Field-by-field comparison that treats decimals by numeric value,
     * so 100.50 and 100.5 compare equal after a storage round trip.
     */
    public boolean sameContentAs(TradeRecord other) {
        if (other == null) return false;
        return tradeId.equals(other.tradeId)
            && strategyName.equals(other.strategyName)
            && symbol.equals(other.symbol)
            && side == other.side
            && status == other.status
            && sameNumber(quantity, other.quantity)
            && sameNumber(entryPrice, other.entryPrice)
            && Objects.equals(leverage, other.leverage)
            && sameNumber(marginUsed, other.marginUsed)
            && sameNumber(stopLoss, other.stopLoss)
            && sameNumber(takeProfit, other.takeProfit)
            && Objects.equals(entryTime, other.entryTime)
            && Objects.equals(exitTime, other.exitTime)
            && sameNumber(exitPrice, other.exitPrice)
            && Objects.equals(exitReason, other.exitReason)
            && sameNumber(pnlAbsolute, other.pnlAbsolute)
            && sameNumber(pnlPercentage, other.pnlPercentage)
            && Objects.equals(duration, other.duration)
            && Objects.equals(exchangeOrderRef, other.exchangeOrderRef);
    }

    private static boolean sameNumber(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return a == b;
        return a.compareTo(b) == 0;
    }
}
