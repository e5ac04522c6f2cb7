package in.ledgerguard.application.port.output;

import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.signal.ExitDecision;
import in.ledgerguard.domain.signal.TradingSignal;
import in.ledgerguard.domain.trade.TradeRecord;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Strategy logic plugged into the assessment loop.
 */
public interface SignalSource {

    /**
     * Entry signal for a flat strategy, if any.
     */
    Optional<TradingSignal> nextSignal(StrategyConfig strategy);

    /**
     * Exit decision for a strategy holding {@code position} at {@code currentPrice}.
     */
    Optional<ExitDecision> evaluateExit(StrategyConfig strategy, TradeRecord position, BigDecimal currentPrice);
}
