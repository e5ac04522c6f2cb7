package in.ledgerguard.domain.exchange;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Market order submitted through the exchange gateway.
 *
 * @param clientOrderRef Caller-chosen reference; the trade id for opening orders
 * @param symbol         Exchange symbol
 * @param side           BUY or SELL
 * @param quantity       Order quantity (positive)
 * @param reduceOnly     True for closing orders
 * @param referencePrice Price the decision was taken at (may be null)
 */
public record OrderRequest(
        String clientOrderRef,
        String symbol,
        OrderSide side,
        BigDecimal quantity,
        boolean reduceOnly,
        BigDecimal referencePrice) {

    public OrderRequest {
        Objects.requireNonNull(clientOrderRef, "clientOrderRef");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(quantity, "quantity");
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
    }
}
