package in.ledgerguard.domain.exchange;

import in.ledgerguard.domain.trade.PositionSide;

import java.math.BigDecimal;

/**
 * Position currently held on the exchange.
 */
public record LivePosition(String symbol, PositionSide side, BigDecimal quantity, BigDecimal entryPrice) {

    /**
     * Key used to pair live positions with ledger records: {@code symbol:side}.
     */
    public String key() {
        return symbol + ":" + side;
    }
}
