package in.ledgerguard.application.service;

import in.ledgerguard.domain.common.LedgerGuardException;
import in.ledgerguard.domain.exchange.OrderStatusReport;
import in.ledgerguard.domain.trade.ExitReason;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import in.ledgerguard.domain.trade.TradeUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Moves PENDING records forward from the exchange's view of their entry order.
 *
 * FILLED   -> OPEN with fill price, fill quantity and recomputed margin
 * REJECTED -> CLOSED "order rejected", slot released
 * PENDING  -> left alone
 *
 * Shared by the controller (confirmation), startup recovery and reconciliation.
 */
public final class PendingOrderResolver {
    private static final Logger log = LoggerFactory.getLogger(PendingOrderResolver.class);

    public enum Resolution {
        PROMOTED,
        REJECTED,
        STILL_PENDING,
        NO_ORDER_REF,
        EXCHANGE_UNAVAILABLE
    }

    private final TradeLedgerStore ledger;
    private final PositionSlotRegistry registry;
    private final ExchangeCalls exchange;
    private final Clock clock;

    public PendingOrderResolver(TradeLedgerStore ledger, PositionSlotRegistry registry,
                                ExchangeCalls exchange, Clock clock) {
        this.ledger = ledger;
        this.registry = registry;
        this.exchange = exchange;
        this.clock = clock;
    }

    /**
     * Query the entry order of a PENDING record and apply the result.
     */
    public Resolution resolve(TradeRecord pending) {
        if (pending.status() != TradeStatus.PENDING) {
            return Resolution.STILL_PENDING;
        }
        if (pending.exchangeOrderRef() == null) {
            return Resolution.NO_ORDER_REF;
        }

        OrderStatusReport status;
        try {
            status = exchange.orderStatus(pending.exchangeOrderRef());
        } catch (LedgerGuardException e) {
            log.warn("Cannot query order {} of trade {}: {}",
                pending.exchangeOrderRef(), pending.tradeId(), e.getMessage());
            return Resolution.EXCHANGE_UNAVAILABLE;
        }

        return switch (status.state()) {
            case FILLED -> {
                promote(pending, status);
                yield Resolution.PROMOTED;
            }
            case REJECTED -> {
                closeUnfilled(pending, ExitReason.ORDER_REJECTED.label());
                yield Resolution.REJECTED;
            }
            case PENDING -> Resolution.STILL_PENDING;
        };
    }

    /**
     * PENDING -> OPEN from a fill report. Price and quantity fall back to the intent values.
     */
    public TradeRecord promote(TradeRecord pending, OrderStatusReport fill) {
        BigDecimal price = fill.averagePrice() != null && fill.averagePrice().signum() > 0
            ? fill.averagePrice() : pending.entryPrice();
        BigDecimal quantity = fill.filledQuantity() != null && fill.filledQuantity().signum() > 0
            ? fill.filledQuantity() : pending.quantity();
        int leverage = pending.leverage() != null ? pending.leverage() : 1;
        String ref = fill.orderRef() != null ? fill.orderRef() : pending.exchangeOrderRef();

        TradeRecord open = ledger.update(pending.tradeId(), TradeUpdate.builder()
            .status(TradeStatus.OPEN)
            .entryPrice(price)
            .quantity(quantity)
            .marginUsed(PnlCalculator.marginUsed(quantity, price, leverage))
            .exchangeOrderRef(ref)
            .build()).record();

        log.info("Trade {} [{}] filled: {} {} @ {} (ref {})",
            open.tradeId(), open.strategyName(), open.side(), quantity, price, ref);
        return open;
    }

    /**
     * PENDING -> CLOSED for an entry order that never filled, then release the slot.
     */
    public TradeRecord closeUnfilled(TradeRecord pending, String reason) {
        Instant now = clock.instant();
        TradeRecord closed = ledger.update(pending.tradeId(), TradeUpdate.builder()
            .status(TradeStatus.CLOSED)
            .exitTime(now)
            .exitReason(reason)
            .pnlAbsolute(BigDecimal.ZERO)
            .pnlPercentage(BigDecimal.ZERO)
            .duration(pending.entryTime() != null ? Duration.between(pending.entryTime(), now) : Duration.ZERO)
            .build()).record();

        registry.release(pending.strategyName(), pending.tradeId());
        log.info("Trade {} [{}] closed without fill: {}", pending.tradeId(), pending.strategyName(), reason);
        return closed;
    }
}
