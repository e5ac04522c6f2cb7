package in.ledgerguard.domain.trade;

import com.fasterxml.jackson.annotation.JsonCreator;
import in.ledgerguard.domain.exchange.OrderSide;

/**
 * Direction of a leveraged position.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /**
     * Parse a side label. Accepts LONG/SHORT as well as the order-side aliases BUY/SELL.
     *
     * @param value Side label (case-insensitive)
     * @return Position side
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static PositionSide parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side must not be null");
        }
        return switch (value.trim().toUpperCase()) {
            case "LONG", "BUY" -> LONG;
            case "SHORT", "SELL" -> SHORT;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }

    /**
     * Order side that opens a position in this direction.
     */
    public OrderSide openingOrderSide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    /**
     * Order side that reduces or closes a position in this direction.
     */
    public OrderSide closingOrderSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}
