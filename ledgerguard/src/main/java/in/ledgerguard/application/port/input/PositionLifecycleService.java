package in.ledgerguard.application.port.input;

import in.ledgerguard.domain.common.CloseResult;
import in.ledgerguard.domain.common.OpenResult;
import in.ledgerguard.domain.signal.TradingSignal;
import in.ledgerguard.domain.trade.LifecycleState;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Position lifecycle use cases, one position per strategy at a time.
 */
public interface PositionLifecycleService {

    /**
     * Open a position for {@code strategy} from an entry signal.
     * Never places an order unless the slot was acquired and the intent record is durable.
     */
    OpenResult openPosition(String strategy, TradingSignal signal);

    /**
     * Close the strategy's open position with a reduce-only order.
     *
     * @param reason         Exit reason stored on the record
     * @param referencePrice Exit price used when the fill price is unknown
     */
    CloseResult closePosition(String strategy, String reason, BigDecimal referencePrice);

    /**
     * Force a close when the loss at {@code currentPrice} reaches the strategy's limit.
     *
     * @return the close result when the failsafe fired
     */
    Optional<CloseResult> checkFailsafe(String strategy, BigDecimal currentPrice);

    LifecycleState state(String strategy);

    /**
     * Stop accepting new signals. Closes still go through.
     */
    void beginShutdown();

    boolean isAcceptingSignals();
}
