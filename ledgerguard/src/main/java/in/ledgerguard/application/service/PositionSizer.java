package in.ledgerguard.application.service;

import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.signal.TradingSignal;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Computes the order quantity for an entry signal.
 */
@FunctionalInterface
public interface PositionSizer {

    /**
     * @return quantity to order; zero or negative means the signal cannot be traded
     */
    BigDecimal size(StrategyConfig strategy, TradingSignal signal);

    /**
     * {@code margin * leverage / entryPrice}, rounded down to the strategy's quantity step.
     */
    static PositionSizer marginTimesLeverage() {
        return (strategy, signal) -> {
            BigDecimal notional = strategy.margin().multiply(BigDecimal.valueOf(strategy.leverage()));
            BigDecimal raw = notional.divide(signal.entryPrice(), MathContext.DECIMAL64);
            BigDecimal step = strategy.quantityStep();
            return raw.divide(step, 0, RoundingMode.DOWN).multiply(step);
        };
    }
}
