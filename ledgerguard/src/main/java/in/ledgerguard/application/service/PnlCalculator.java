package in.ledgerguard.application.service;

import in.ledgerguard.domain.trade.Pnl;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.TradeRecord;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * PnL and margin arithmetic shared by closes, the failsafe and orphan healing.
 *
 * LONG:  (exit - entry) * quantity
 * SHORT: (entry - exit) * quantity
 * Percentage is relative to margin used. Missing inputs yield zero.
 */
public final class PnlCalculator {
    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static Pnl compute(TradeRecord record, BigDecimal exitPrice) {
        return compute(record.side(), record.entryPrice(), exitPrice, record.quantity(), record.marginUsed());
    }

    public static Pnl compute(PositionSide side, BigDecimal entryPrice, BigDecimal exitPrice,
                              BigDecimal quantity, BigDecimal marginUsed) {
        if (side == null || entryPrice == null || exitPrice == null || quantity == null) {
            return Pnl.ZERO;
        }
        BigDecimal diff = side == PositionSide.LONG
            ? exitPrice.subtract(entryPrice)
            : entryPrice.subtract(exitPrice);
        BigDecimal absolute = diff.multiply(quantity, MC).setScale(8, RoundingMode.HALF_UP);

        BigDecimal percentage = BigDecimal.ZERO;
        if (marginUsed != null && marginUsed.signum() > 0) {
            percentage = absolute.divide(marginUsed, MC).multiply(HUNDRED).setScale(4, RoundingMode.HALF_UP);
        }
        return new Pnl(absolute, percentage);
    }

    /**
     * Capital committed by a position: entry notional divided by leverage.
     */
    public static BigDecimal marginUsed(BigDecimal quantity, BigDecimal price, int leverage) {
        if (quantity == null || price == null) {
            return null;
        }
        int lev = Math.max(1, leverage);
        return quantity.multiply(price, MC).divide(BigDecimal.valueOf(lev), MC).setScale(8, RoundingMode.HALF_UP);
    }

    private PnlCalculator() {}
}
