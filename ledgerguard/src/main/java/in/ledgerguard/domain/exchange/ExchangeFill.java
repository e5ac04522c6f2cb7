package in.ledgerguard.domain.exchange;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Executed fill reported by the exchange.
 */
public record ExchangeFill(
        String fillId,
        String orderRef,
        String symbol,
        OrderSide side,
        BigDecimal quantity,
        BigDecimal price,
        Instant time) {
}
