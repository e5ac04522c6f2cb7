package in.ledgerguard.domain.trade;

import in.ledgerguard.domain.common.InvariantViolationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partial set of fields applied to a {@link TradeRecord} by the ledger store.
 *
 * Null fields are left untouched. Applying the same update twice yields the same record.
 */
public final class TradeUpdate {
    private final TradeStatus status;
    private final BigDecimal quantity;
    private final BigDecimal entryPrice;
    private final BigDecimal marginUsed;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final String exchangeOrderRef;
    private final Instant exitTime;
    private final BigDecimal exitPrice;
    private final String exitReason;
    private final BigDecimal pnlAbsolute;
    private final BigDecimal pnlPercentage;
    private final Duration duration;

    private TradeUpdate(Builder b) {
        this.status = b.status;
        this.quantity = b.quantity;
        this.entryPrice = b.entryPrice;
        this.marginUsed = b.marginUsed;
        this.stopLoss = b.stopLoss;
        this.takeProfit = b.takeProfit;
        this.exchangeOrderRef = b.exchangeOrderRef;
        this.exitTime = b.exitTime;
        this.exitPrice = b.exitPrice;
        this.exitReason = b.exitReason;
        this.pnlAbsolute = b.pnlAbsolute;
        this.pnlPercentage = b.pnlPercentage;
        this.duration = b.duration;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TradeStatus status() {
        return status;
    }

    /**
     * Apply this update to {@code current}.
     *
     * @throws InvariantViolationException on a backward status transition, or when
     *         quantity / entry price / margin change after the record left PENDING
     */
    public TradeRecord applyTo(TradeRecord current) {
        TradeStatus nextStatus = status != null ? status : current.status();
        if (!current.status().canTransitionTo(nextStatus)) {
            throw new InvariantViolationException(String.format(
                "Trade %s cannot transition %s -> %s", current.tradeId(), current.status(), nextStatus));
        }

        if (current.status() != TradeStatus.PENDING) {
            List<String> changed = new ArrayList<>();
            if (changes(quantity, current.quantity())) changed.add("quantity");
            if (changes(entryPrice, current.entryPrice())) changed.add("entry_price");
            if (changes(marginUsed, current.marginUsed())) changed.add("margin_used");
            if (!changed.isEmpty()) {
                throw new InvariantViolationException(String.format(
                    "Trade %s is %s; immutable fields cannot change: %s",
                    current.tradeId(), current.status(), changed));
            }
        }

        return new TradeRecord(
            current.tradeId(), current.strategyName(), current.symbol(), current.side(),
            pick(quantity, current.quantity()),
            pick(entryPrice, current.entryPrice()),
            current.leverage(),
            pick(marginUsed, current.marginUsed()),
            pick(stopLoss, current.stopLoss()),
            pick(takeProfit, current.takeProfit()),
            nextStatus,
            current.entryTime(),
            pick(exitTime, current.exitTime()),
            pick(exitPrice, current.exitPrice()),
            pick(exitReason, current.exitReason()),
            pick(pnlAbsolute, current.pnlAbsolute()),
            pick(pnlPercentage, current.pnlPercentage()),
            pick(duration, current.duration()),
            pick(exchangeOrderRef, current.exchangeOrderRef()));
    }

    private static boolean changes(BigDecimal next, BigDecimal current) {
        if (next == null) return false;
        return current == null || next.compareTo(current) != 0;
    }

    private static <T> T pick(T next, T current) {
        return next != null ? next : current;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TradeUpdate{");
        if (status != null) sb.append("status=").append(status).append(' ');
        if (quantity != null) sb.append("quantity=").append(quantity).append(' ');
        if (entryPrice != null) sb.append("entryPrice=").append(entryPrice).append(' ');
        if (exchangeOrderRef != null) sb.append("ref=").append(exchangeOrderRef).append(' ');
        if (exitReason != null) sb.append("exitReason=").append(exitReason).append(' ');
        if (pnlAbsolute != null) sb.append("pnl=").append(pnlAbsolute).append(' ');
        return sb.toString().trim() + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TradeUpdate that)) return false;
        return status == that.status
            && Objects.equals(quantity, that.quantity)
            && Objects.equals(entryPrice, that.entryPrice)
            && Objects.equals(marginUsed, that.marginUsed)
            && Objects.equals(stopLoss, that.stopLoss)
            && Objects.equals(takeProfit, that.takeProfit)
            && Objects.equals(exchangeOrderRef, that.exchangeOrderRef)
            && Objects.equals(exitTime, that.exitTime)
            && Objects.equals(exitPrice, that.exitPrice)
            && Objects.equals(exitReason, that.exitReason)
            && Objects.equals(pnlAbsolute, that.pnlAbsolute)
            && Objects.equals(pnlPercentage, that.pnlPercentage)
            && Objects.equals(duration, that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, quantity, entryPrice, marginUsed, exchangeOrderRef, exitTime, exitReason);
    }

    public static class Builder {
        private TradeStatus status;
        private BigDecimal quantity;
        private BigDecimal entryPrice;
        private BigDecimal marginUsed;
        private BigDecimal stopLoss;
        private BigDecimal takeProfit;
        private String exchangeOrderRef;
        private Instant exitTime;
        private BigDecimal exitPrice;
        private String exitReason;
        private BigDecimal pnlAbsolute;
        private BigDecimal pnlPercentage;
        private Duration duration;

        public Builder status(TradeStatus status) {
            this.status = status;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder entryPrice(BigDecimal entryPrice) {
            this.entryPrice = entryPrice;
            return this;
        }

        public Builder marginUsed(BigDecimal marginUsed) {
            this.marginUsed = marginUsed;
            return this;
        }

        public Builder stopLoss(BigDecimal stopLoss) {
            this.stopLoss = stopLoss;
            return this;
        }

        public Builder takeProfit(BigDecimal takeProfit) {
            this.takeProfit = takeProfit;
            return this;
        }

        public Builder exchangeOrderRef(String exchangeOrderRef) {
            this.exchangeOrderRef = exchangeOrderRef;
            return this;
        }

        public Builder exitTime(Instant exitTime) {
            this.exitTime = exitTime;
            return this;
        }

        public Builder exitPrice(BigDecimal exitPrice) {
            this.exitPrice = exitPrice;
            return this;
        }

        public Builder exitReason(String exitReason) {
            this.exitReason = exitReason;
            return this;
        }

        public Builder pnlAbsolute(BigDecimal pnlAbsolute) {
            this.pnlAbsolute = pnlAbsolute;
            return this;
        }

        public Builder pnlPercentage(BigDecimal pnlPercentage) {
            this.pnlPercentage = pnlPercentage;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public TradeUpdate build() {
            return new TradeUpdate(this);
        }
    }
}
