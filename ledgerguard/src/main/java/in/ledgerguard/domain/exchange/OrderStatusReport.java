package in.ledgerguard.domain.exchange;

import java.math.BigDecimal;

/**
 * Order status returned by the exchange.
 *
 * @param orderRef       Exchange order reference
 * @param state          PENDING, FILLED or REJECTED
 * @param averagePrice   Average fill price (null until filled)
 * @param filledQuantity Filled quantity (null or zero until filled)
 */
public record OrderStatusReport(String orderRef, OrderState state, BigDecimal averagePrice, BigDecimal filledQuantity) {

    public static OrderStatusReport pending(String orderRef) {
        return new OrderStatusReport(orderRef, OrderState.PENDING, null, null);
    }

    public static OrderStatusReport rejected(String orderRef) {
        return new OrderStatusReport(orderRef, OrderState.REJECTED, null, null);
    }

    public static OrderStatusReport filled(String orderRef, BigDecimal averagePrice, BigDecimal filledQuantity) {
        return new OrderStatusReport(orderRef, OrderState.FILLED, averagePrice, filledQuantity);
    }
}
