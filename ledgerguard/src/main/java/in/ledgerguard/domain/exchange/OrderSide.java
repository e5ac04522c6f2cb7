package in.ledgerguard.domain.exchange;

/**
 * Exchange order side.
 */
public enum OrderSide {
    BUY,
    SELL
}
