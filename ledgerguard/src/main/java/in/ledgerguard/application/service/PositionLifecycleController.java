package in.ledgerguard.application.service;

import in.ledgerguard.application.port.input.PositionLifecycleService;
import in.ledgerguard.config.StrategyCatalog;
import in.ledgerguard.config.StrategyConfig;
import in.ledgerguard.domain.common.CloseResult;
import in.ledgerguard.domain.common.ErrorCategory;
import in.ledgerguard.domain.common.LedgerGuardException;
import in.ledgerguard.domain.common.OpenResult;
import in.ledgerguard.domain.exchange.OrderRequest;
import in.ledgerguard.domain.exchange.OrderState;
import in.ledgerguard.domain.exchange.OrderStatusReport;
import in.ledgerguard.domain.signal.TradingSignal;
import in.ledgerguard.domain.trade.ExitReason;
import in.ledgerguard.domain.trade.LifecycleState;
import in.ledgerguard.domain.trade.Pnl;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.domain.trade.PositionSlot;
import in.ledgerguard.domain.trade.TradeRecord;
import in.ledgerguard.domain.trade.TradeStatus;
import in.ledgerguard.domain.trade.TradeUpdate;
import in.ledgerguard.infrastructure.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * PositionLifecycleController - drives each strategy's position through its states.
 *
 * STATE MACHINE (per strategy):
 * <pre>
 * NONE ──► PENDING ──► OPEN ──► CLOSING ──► CLOSED (cooldown) ──► NONE
 *             │
 *             └──► NONE (rejected / confirmation timeout)
 * </pre>
 *
 * ORDERING GUARANTEES:
 * - Slot acquired before anything is written
 * - PENDING record durable before the order is placed
 * - Record CLOSED before the slot is released
 *
 * All work for a strategy runs on its {@link StrategyCoordinator} partition.
 */
public final class PositionLifecycleController implements PositionLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(PositionLifecycleController.class);

    /**
     * Confirmation polling settings.
     */
    public record Settings(Duration confirmTimeout, Duration pollInterval) {
        public static final Settings DEFAULT = new Settings(Duration.ofSeconds(10), Duration.ofMillis(250));
    }

    private final TradeLedgerStore ledger;
    private final PositionSlotRegistry registry;
    private final ExchangeCalls exchange;
    private final StrategyCoordinator coordinator;
    private final StrategyCatalog strategies;
    private final PositionSizer sizer;
    private final PendingOrderResolver resolver;
    private final BotTradeWindow botTradeWindow;
    private final LedgerMetrics metrics;
    private final Settings settings;
    private final Clock clock;

    private final Set<String> closing = ConcurrentHashMap.newKeySet();
    private volatile boolean shuttingDown = false;

    public PositionLifecycleController(TradeLedgerStore ledger,
                                       PositionSlotRegistry registry,
                                       ExchangeCalls exchange,
                                       StrategyCoordinator coordinator,
                                       StrategyCatalog strategies,
                                       PositionSizer sizer,
                                       PendingOrderResolver resolver,
                                       BotTradeWindow botTradeWindow,
                                       LedgerMetrics metrics,
                                       Settings settings,
                                       Clock clock) {
        this.ledger = ledger;
        this.registry = registry;
        this.exchange = exchange;
        this.coordinator = coordinator;
        this.strategies = strategies;
        this.sizer = sizer;
        this.resolver = resolver;
        this.botTradeWindow = botTradeWindow;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    // ========================================================================
    // OPEN
    // ========================================================================

    @Override
    public OpenResult openPosition(String strategy, TradingSignal signal) {
        if (shuttingDown) {
            return rejectShuttingDown(strategy);
        }
        try {
            return coordinator.call(strategy, () -> doOpen(strategy, signal));
        } catch (RejectedExecutionException e) {
            return rejectShuttingDown(strategy);
        }
    }

    private OpenResult doOpen(String strategy, TradingSignal signal) {
        if (shuttingDown) {
            return rejectShuttingDown(strategy);
        }

        StrategyConfig config = strategies.find(strategy).orElse(null);
        if (config == null) {
            return reject(strategy, OpenResult.Outcome.REJECTED_UNKNOWN_STRATEGY, ErrorCategory.INVARIANT_VIOLATION,
                "Unknown strategy: " + strategy);
        }
        String symbol = signal.symbol() != null ? signal.symbol() : config.symbol();
        if (!symbol.equals(config.symbol())) {
            return reject(strategy, OpenResult.Outcome.REJECTED_INVALID_SIGNAL, ErrorCategory.INVARIANT_VIOLATION,
                "Signal symbol " + symbol + " does not match strategy symbol " + config.symbol());
        }

        // 1. Slot: rejected here means no order is ever placed
        String tradeId = UUID.randomUUID().toString();
        if (!registry.tryAcquire(strategy, tradeId)) {
            if (registry.isBlocked(strategy)) {
                return reject(strategy, OpenResult.Outcome.REJECTED_COOLDOWN, ErrorCategory.TRANSIENT,
                    "Strategy " + strategy + " is cooling down");
            }
            return reject(strategy, OpenResult.Outcome.REJECTED_SLOT_OCCUPIED, ErrorCategory.INVARIANT_VIOLATION,
                "Strategy " + strategy + " already holds position " + registry.holder(strategy).orElse("?"));
        }

        // 2. Size
        BigDecimal quantity;
        try {
            quantity = sizer.size(config, signal);
        } catch (RuntimeException e) {
            log.warn("[OPEN] Sizing failed for {}: {}", strategy, e.getMessage());
            quantity = null;
        }
        if (quantity == null || quantity.signum() <= 0) {
            registry.abandon(strategy, tradeId);
            return reject(strategy, OpenResult.Outcome.REJECTED_INVALID_SIGNAL, ErrorCategory.INVARIANT_VIOLATION,
                "Signal sized to non-positive quantity: " + quantity);
        }

        // 3. Durable intent
        PositionSide side = signal.signalType().positionSide();
        TradeRecord intent = TradeRecord.pending(tradeId, strategy, symbol, side,
            quantity, signal.entryPrice(), config.leverage(),
            PnlCalculator.marginUsed(quantity, signal.entryPrice(), config.leverage()),
            signal.stopLoss(), signal.takeProfit(), clock.instant());
        try {
            ledger.put(intent);
        } catch (LedgerGuardException e) {
            registry.release(strategy, tradeId);
            log.error("[OPEN] Intent write failed for {} {}: {}", strategy, tradeId, e.getMessage());
            metrics.recordOpenRejected(strategy, OpenResult.Outcome.INTENT_WRITE_FAILED.name());
            return OpenResult.failed(OpenResult.Outcome.INTENT_WRITE_FAILED, null, ErrorCategory.TRANSIENT,
                "Intent record could not be written: " + e.getMessage());
        }
        log.info("[OPEN] {} {} PENDING: {} {} {} @ {}", strategy, tradeId, side, quantity, symbol, signal.entryPrice());

        // 4. Order
        OrderRequest order = new OrderRequest(tradeId, symbol, side.openingOrderSide(), quantity, false,
            signal.entryPrice());
        String orderRef;
        try {
            orderRef = exchange.placeOrder(order);
        } catch (LedgerGuardException e) {
            log.warn("[OPEN] placeOrder failed for {} {}: {}", strategy, tradeId, e.getMessage());
            return abortOpen(intent, OpenResult.Outcome.ORDER_REJECTED, ExitReason.ORDER_REJECTED,
                "Order placement failed: " + e.getMessage());
        }
        TradeRecord pending = recordOrderRef(intent, orderRef);

        // 5. Confirmation
        OrderStatusReport status = awaitConfirmation(orderRef);
        if (status != null && status.state() == OrderState.FILLED) {
            try {
                TradeRecord open = resolver.promote(pending, status);
                botTradeWindow.register(symbol);
                metrics.recordPositionOpened(strategy);
                log.info("[OPEN] {} {} OPEN @ {}", strategy, tradeId, open.entryPrice());
                return OpenResult.opened(open);
            } catch (LedgerGuardException e) {
                // Position is live; the record stays PENDING with its ref and the slot stays taken
                log.error("[OPEN] {} {} filled but OPEN could not be recorded: {}", strategy, tradeId, e.getMessage());
                botTradeWindow.register(symbol);
                return OpenResult.failed(OpenResult.Outcome.INTENT_WRITE_FAILED, pending, ErrorCategory.TRANSIENT,
                    "Fill could not be recorded: " + e.getMessage());
            }
        }
        if (status != null && status.state() == OrderState.REJECTED) {
            return abortOpen(pending, OpenResult.Outcome.ORDER_REJECTED, ExitReason.ORDER_REJECTED,
                "Order " + orderRef + " rejected");
        }

        cancelQuietly(orderRef);
        return abortOpen(pending, OpenResult.Outcome.CONFIRMATION_TIMEOUT, ExitReason.CONFIRMATION_TIMEOUT,
            "Order " + orderRef + " not confirmed within " + settings.confirmTimeout().toMillis() + "ms");
    }

    private TradeRecord recordOrderRef(TradeRecord intent, String orderRef) {
        try {
            return ledger.update(intent.tradeId(), TradeUpdate.builder().exchangeOrderRef(orderRef).build()).record();
        } catch (LedgerGuardException e) {
            log.error("[OPEN] Could not record order ref {} on {}: {}", orderRef, intent.tradeId(), e.getMessage());
            return intent;
        }
    }

    private OpenResult abortOpen(TradeRecord pending, OpenResult.Outcome outcome, ExitReason reason, String message) {
        metrics.recordOpenRejected(pending.strategyName(), outcome.name());
        try {
            TradeRecord closed = resolver.closeUnfilled(pending, reason.label());
            log.warn("[OPEN] {} {} aborted: {}", pending.strategyName(), pending.tradeId(), message);
            return OpenResult.failed(outcome, closed, ErrorCategory.TRANSIENT, message);
        } catch (LedgerGuardException e) {
            // Slot stays taken so nothing else opens while the PENDING record is unresolved
            log.error("[OPEN] {} {} aborted but could not be closed, left PENDING for reconciliation: {}",
                pending.strategyName(), pending.tradeId(), e.getMessage());
            return OpenResult.failed(outcome, pending, ErrorCategory.TRANSIENT, message);
        }
    }

    private OpenResult reject(String strategy, OpenResult.Outcome outcome, ErrorCategory category, String message) {
        log.info("[OPEN] {} rejected: {}", strategy, message);
        metrics.recordOpenRejected(strategy, outcome.name());
        return OpenResult.failed(outcome, null, category, message);
    }

    private OpenResult rejectShuttingDown(String strategy) {
        return reject(strategy, OpenResult.Outcome.REJECTED_SHUTTING_DOWN, ErrorCategory.TRANSIENT,
            "Engine is shutting down");
    }

    // ========================================================================
    // CLOSE
    // ========================================================================

    @Override
    public CloseResult closePosition(String strategy, String reason, BigDecimal referencePrice) {
        try {
            return coordinator.call(strategy, () -> doClose(strategy, reason, referencePrice));
        } catch (RejectedExecutionException e) {
            return CloseResult.failed(CloseResult.Outcome.CLOSE_ORDER_FAILED, null, ErrorCategory.TRANSIENT,
                "Engine is shut down");
        }
    }

    private CloseResult doClose(String strategy, String reason, BigDecimal referencePrice) {
        Optional<TradeRecord> active = openRecord(strategy);
        if (active.isEmpty()) {
            return CloseResult.failed(CloseResult.Outcome.NO_OPEN_POSITION, null, ErrorCategory.INVARIANT_VIOLATION,
                "Strategy " + strategy + " has no open position");
        }
        TradeRecord record = active.get();

        closing.add(strategy);
        try {
            OrderRequest order = new OrderRequest(record.tradeId() + "-close-" + clock.millis(),
                record.symbol(), record.side().closingOrderSide(), record.quantity(), true, referencePrice);

            String orderRef;
            try {
                orderRef = exchange.placeOrder(order);
            } catch (LedgerGuardException e) {
                log.error("[CLOSE] {} {} close order failed, position stays OPEN: {}",
                    strategy, record.tradeId(), e.getMessage());
                return CloseResult.failed(CloseResult.Outcome.CLOSE_ORDER_FAILED, record, ErrorCategory.TRANSIENT,
                    "Close order failed: " + e.getMessage());
            }

            OrderStatusReport status = awaitConfirmation(orderRef);
            if (status == null || status.state() != OrderState.FILLED) {
                if (status == null) {
                    cancelQuietly(orderRef);
                }
                log.error("[CLOSE] {} {} close order {} not filled ({}), position stays OPEN",
                    strategy, record.tradeId(), orderRef, status == null ? "timeout" : status.state());
                return CloseResult.failed(CloseResult.Outcome.CLOSE_ORDER_FAILED, record, ErrorCategory.TRANSIENT,
                    "Close order " + orderRef + " not filled");
            }

            BigDecimal exitPrice = status.averagePrice() != null && status.averagePrice().signum() > 0
                ? status.averagePrice()
                : referencePrice != null ? referencePrice : record.entryPrice();
            return finalizeClose(record, exitPrice, reason);
        } finally {
            closing.remove(strategy);
        }
    }

    private CloseResult finalizeClose(TradeRecord record, BigDecimal exitPrice, String reason) {
        Instant now = clock.instant();
        Pnl pnl = PnlCalculator.compute(record, exitPrice);

        TradeRecord closed;
        try {
            closed = ledger.update(record.tradeId(), TradeUpdate.builder()
                .status(TradeStatus.CLOSED)
                .exitTime(now)
                .exitPrice(exitPrice)
                .exitReason(reason)
                .pnlAbsolute(pnl.absolute())
                .pnlPercentage(pnl.percentage())
                .duration(record.entryTime() != null ? Duration.between(record.entryTime(), now) : Duration.ZERO)
                .build()).record();
        } catch (LedgerGuardException e) {
            log.error("[CLOSE] {} {} closed on exchange but not in ledger: {}",
                record.strategyName(), record.tradeId(), e.getMessage());
            return CloseResult.failed(CloseResult.Outcome.LEDGER_WRITE_FAILED, record, ErrorCategory.TRANSIENT,
                "Close could not be recorded: " + e.getMessage());
        }

        registry.release(record.strategyName(), record.tradeId());
        botTradeWindow.register(record.symbol());
        metrics.recordPositionClosed(record.strategyName(), reason);
        log.info("[CLOSE] {} {} CLOSED @ {} ({}): pnl={} ({}%)",
            record.strategyName(), record.tradeId(), exitPrice, reason, pnl.absolute(), pnl.percentage());
        return CloseResult.closed(closed);
    }

    // ========================================================================
    // FAILSAFE
    // ========================================================================

    @Override
    public Optional<CloseResult> checkFailsafe(String strategy, BigDecimal currentPrice) {
        if (currentPrice == null) {
            return Optional.empty();
        }
        return coordinator.call(strategy, () -> {
            Optional<TradeRecord> active = openRecord(strategy);
            if (active.isEmpty()) {
                return Optional.empty();
            }
            TradeRecord record = active.get();
            BigDecimal maxLossPct = strategies.find(strategy)
                .map(StrategyConfig::maxLossPct)
                .orElse(StrategyConfig.DEFAULT_MAX_LOSS_PCT);

            Pnl pnl = PnlCalculator.compute(record, currentPrice);
            if (!pnl.isLoss() || pnl.percentage().negate().compareTo(maxLossPct) < 0) {
                return Optional.empty();
            }

            log.warn("[FAILSAFE] {} {} loss {}% >= {}% of margin at {}, forcing close",
                strategy, record.tradeId(), pnl.percentage().negate(), maxLossPct, currentPrice);
            return Optional.of(doClose(strategy, ExitReason.MAX_LOSS_FAILSAFE.label(), currentPrice));
        });
    }

    // ========================================================================
    // STATE
    // ========================================================================

    @Override
    public LifecycleState state(String strategy) {
        if (closing.contains(strategy)) {
            return LifecycleState.CLOSING;
        }
        Optional<PositionSlot> slot = registry.slot(strategy);
        if (slot.isPresent() && slot.get().isOccupied()) {
            return ledger.get(slot.get().tradeId())
                .filter(r -> r.status() == TradeStatus.PENDING)
                .map(r -> LifecycleState.PENDING)
                .orElse(LifecycleState.OPEN);
        }
        if (slot.isPresent() && slot.get().isCoolingDown(clock.instant())) {
            return LifecycleState.CLOSED;
        }
        return LifecycleState.NONE;
    }

    @Override
    public void beginShutdown() {
        shuttingDown = true;
        log.info("Position lifecycle controller no longer accepts signals");
    }

    @Override
    public boolean isAcceptingSignals() {
        return !shuttingDown;
    }

    /**
     * OPEN or GHOST_ADOPTED record holding the strategy's slot.
     */
    private Optional<TradeRecord> openRecord(String strategy) {
        return registry.holder(strategy)
            .flatMap(ledger::get)
            .filter(r -> r.status() == TradeStatus.OPEN || r.status() == TradeStatus.GHOST_ADOPTED);
    }

    private OrderStatusReport awaitConfirmation(String orderRef) {
        long deadline = System.nanoTime() + settings.confirmTimeout().toNanos();
        while (true) {
            try {
                OrderStatusReport status = exchange.pollOrderStatus(orderRef);
                if (status.state().isFinal()) {
                    return status;
                }
            } catch (LedgerGuardException e) {
                log.debug("Status poll for {} failed: {}", orderRef, e.getMessage());
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            try {
                Thread.sleep(Math.max(1, Math.min(settings.pollInterval().toMillis(), remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
    }

    private void cancelQuietly(String orderRef) {
        try {
            exchange.cancelOrder(orderRef);
        } catch (LedgerGuardException e) {
            log.warn("Cancel of order {} failed: {}", orderRef, e.getMessage());
        }
    }
}
