package in.ledgerguard.infrastructure.signal;

import in.ledgerguard.application.port.output.SignalSource;
import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.signal.ExitDecision;
import in.ledgerguard.domain.signal.TradingSignal;
import in.ledgerguard.domain.trade.ExitReason;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Signal source fed by external producers.
 *
 * Entry signals and exit requests queue per strategy and are consumed by the assessment loop.
 * Positions also exit on their recorded stop-loss or take-profit.
 */
public final class QueuedSignalSource implements SignalSource {
    private static final Logger log = LoggerFactory.getLogger(QueuedSignalSource.class);

    private final Map<String, Queue<TradingSignal>> entries = new ConcurrentHashMap<>();
    private final Map<String, Queue<ExitDecision>> exits = new ConcurrentHashMap<>();

    public void submitEntry(String strategy, TradingSignal signal) {
        entries.computeIfAbsent(strategy, k -> new ConcurrentLinkedQueue<>()).add(signal);
        log.debug("Entry signal queued for {}: {} {} @ {}",
            strategy, signal.signalType(), signal.symbol(), signal.entryPrice());
    }

    public void submitExit(String strategy, ExitDecision decision) {
        exits.computeIfAbsent(strategy, k -> new ConcurrentLinkedQueue<>()).add(decision);
        log.debug("Exit request queued for {}: {}", strategy, decision.reason());
    }

    @Override
    public Optional<TradingSignal> nextSignal(StrategyConfig strategy) {
        Queue<TradingSignal> queue = entries.get(strategy.name());
        return queue == null ? Optional.empty() : Optional.ofNullable(queue.poll());
    }

    @Override
    public Optional<ExitDecision> evaluateExit(StrategyConfig strategy, TradeRecord position, BigDecimal currentPrice) {
        Queue<ExitDecision> queue = exits.get(strategy.name());
        ExitDecision requested = queue == null ? null : queue.poll();
        if (requested != null) {
            return Optional.of(requested);
        }
        if (currentPrice == null) {
            return Optional.empty();
        }

        boolean isLong = position.side() == PositionSide.LONG;
        if (position.stopLoss() != null) {
            int cmp = currentPrice.compareTo(position.stopLoss());
            if (isLong ? cmp <= 0 : cmp >= 0) {
                return Optional.of(ExitDecision.of(ExitReason.STOP_LOSS, "price " + currentPrice));
            }
        }
        if (position.takeProfit() != null) {
            int cmp = currentPrice.compareTo(position.takeProfit());
            if (isLong ? cmp >= 0 : cmp <= 0) {
                return Optional.of(ExitDecision.of(ExitReason.TAKE_PROFIT, "price " + currentPrice));
            }
        }
        return Optional.empty();
    }

    public int pendingEntries(String strategy) {
        Queue<TradingSignal> queue = entries.get(strategy);
        return queue == null ? 0 : queue.size();
    }
}
