package in.ledgerguard.domain.trade;

import java.math.BigDecimal;

/**
 * Realized or estimated profit and loss of a position.
 *
 * @param absolute   Side-aware price difference times quantity
 * @param percentage Absolute PnL relative to margin used, in percent
 */
public record Pnl(BigDecimal absolute, BigDecimal percentage) {
    public static final Pnl ZERO = new Pnl(BigDecimal.ZERO, BigDecimal.ZERO);

    public boolean isLoss() {
        return absolute.signum() < 0;
    }
}
