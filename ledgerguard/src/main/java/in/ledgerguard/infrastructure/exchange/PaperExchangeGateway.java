package in.ledgerguard.infrastructure.exchange;

import in.ledgerguard.application.port.output.ExchangeGateway;
import in.ledgerguard.domain.exchange.ExchangeFill;
import in.ledgerguard.domain.exchange.LivePosition;
import in.ledgerguard.domain.exchange.OrderRequest;
import in.ledgerguard.domain.exchange.OrderSide;
import in.ledgerguard.domain.exchange.OrderState;
import in.ledgerguard.domain.exchange.OrderStatusReport;
import in.ledgerguard.domain.trade.PositionSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory simulated exchange for paper mode and tests.
 *
 * Market orders fill at the mark price (or the request's reference price when no mark is set)
 * and net into one position per symbol and side. Reduce-only orders shrink the position they close.
 * Orders with the same client ref are placed once.
 */
public final class PaperExchangeGateway implements ExchangeGateway {
    private static final Logger log = LoggerFactory.getLogger(PaperExchangeGateway.class);

    public enum FillMode {
        /** Fill immediately */
        FILL,
        /** Reject immediately */
        REJECT,
        /** Leave PENDING until {@link #fillHeldOrder} or {@link #rejectHeldOrder} */
        HOLD
    }

    private final Clock clock;
    private final AtomicLong orderSeq = new AtomicLong();
    private final AtomicLong fillSeq = new AtomicLong();

    private final Map<String, BigDecimal> marks = new HashMap<>();
    private final Map<String, LivePosition> positions = new LinkedHashMap<>();
    private final Map<String, PaperOrder> orders = new HashMap<>();
    private final Map<String, String> refsByClientRef = new HashMap<>();
    private final List<ExchangeFill> fills = new ArrayList<>();

    private FillMode fillMode = FillMode.FILL;
    private boolean unavailable = false;

    public PaperExchangeGateway(Clock clock) {
        this.clock = clock;
    }

    // ========================================================================
    // ExchangeGateway
    // ========================================================================

    @Override
    public synchronized CompletableFuture<String> placeOrder(OrderRequest request) {
        if (unavailable) {
            return unavailableFuture("placeOrder");
        }
        String existing = refsByClientRef.get(request.clientOrderRef());
        if (existing != null) {
            log.debug("[PAPER] Duplicate client ref {} -> {}", request.clientOrderRef(), existing);
            return CompletableFuture.completedFuture(existing);
        }

        String orderRef = "PAPER-" + orderSeq.incrementAndGet();
        PaperOrder order = new PaperOrder(orderRef, request);
        orders.put(orderRef, order);
        refsByClientRef.put(request.clientOrderRef(), orderRef);

        switch (fillMode) {
            case FILL -> execute(order);
            case REJECT -> order.state = OrderState.REJECTED;
            case HOLD -> order.state = OrderState.PENDING;
        }
        log.info("[PAPER] Order {} {} {} {} reduceOnly={} -> {}", orderRef, request.side(), request.quantity(),
            request.symbol(), request.reduceOnly(), order.state);
        return CompletableFuture.completedFuture(orderRef);
    }

    @Override
    public synchronized CompletableFuture<Void> cancelOrder(String orderRef) {
        if (unavailable) {
            return unavailableFuture("cancelOrder");
        }
        PaperOrder order = orders.get(orderRef);
        if (order != null && order.state == OrderState.PENDING) {
            order.state = OrderState.REJECTED;
            log.info("[PAPER] Order {} cancelled", orderRef);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<OrderStatusReport> getOrderStatus(String orderRef) {
        if (unavailable) {
            return unavailableFuture("getOrderStatus");
        }
        PaperOrder order = orders.get(orderRef);
        if (order == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown order: " + orderRef));
        }
        return CompletableFuture.completedFuture(order.report());
    }

    @Override
    public synchronized CompletableFuture<List<LivePosition>> getLivePositions() {
        if (unavailable) {
            return unavailableFuture("getLivePositions");
        }
        return CompletableFuture.completedFuture(List.copyOf(positions.values()));
    }

    @Override
    public synchronized CompletableFuture<List<ExchangeFill>> getRecentFills(String symbol, Duration window) {
        if (unavailable) {
            return unavailableFuture("getRecentFills");
        }
        Instant since = clock.instant().minus(window);
        List<ExchangeFill> recent = fills.stream()
            .filter(f -> f.symbol().equals(symbol))
            .filter(f -> !f.time().isBefore(since))
            .toList();
        return CompletableFuture.completedFuture(recent);
    }

    @Override
    public synchronized CompletableFuture<Optional<BigDecimal>> getMarkPrice(String symbol) {
        if (unavailable) {
            return unavailableFuture("getMarkPrice");
        }
        return CompletableFuture.completedFuture(Optional.ofNullable(marks.get(symbol)));
    }

    // ========================================================================
    // Simulation controls
    // ========================================================================

    public synchronized void setMarkPrice(String symbol, BigDecimal price) {
        marks.put(symbol, price);
    }

    public synchronized void setFillMode(FillMode mode) {
        this.fillMode = mode;
    }

    public synchronized void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * Put a position on the exchange without any order (a manual trade, or one the ledger missed).
     */
    public synchronized void injectPosition(String symbol, PositionSide side, BigDecimal quantity, BigDecimal entryPrice) {
        LivePosition position = new LivePosition(symbol, side, quantity, entryPrice);
        positions.put(position.key(), position);
    }

    /**
     * Drop a position without a fill, as if it was liquidated out of view.
     */
    public synchronized void removePosition(String symbol, PositionSide side) {
        positions.remove(symbol + ":" + side);
    }

    /**
     * Record a fill without touching positions.
     */
    public synchronized void recordFill(String orderRef, String symbol, OrderSide side,
                                        BigDecimal quantity, BigDecimal price, Instant time) {
        fills.add(new ExchangeFill("FILL-" + fillSeq.incrementAndGet(), orderRef, symbol, side, quantity, price, time));
    }

    public synchronized void fillHeldOrder(String orderRef) {
        PaperOrder order = orders.get(orderRef);
        if (order != null && order.state == OrderState.PENDING) {
            execute(order);
        }
    }

    public synchronized void rejectHeldOrder(String orderRef) {
        PaperOrder order = orders.get(orderRef);
        if (order != null && order.state == OrderState.PENDING) {
            order.state = OrderState.REJECTED;
        }
    }

    public synchronized int orderCount() {
        return orders.size();
    }

    public synchronized Optional<LivePosition> position(String symbol, PositionSide side) {
        return Optional.ofNullable(positions.get(symbol + ":" + side));
    }

    // ========================================================================
    // Matching
    // ========================================================================

    private void execute(PaperOrder order) {
        OrderRequest request = order.request;
        BigDecimal price = marks.getOrDefault(request.symbol(), request.referencePrice());
        if (price == null || price.signum() <= 0) {
            order.state = OrderState.REJECTED;
            log.warn("[PAPER] Order {} rejected: no price for {}", order.orderRef, request.symbol());
            return;
        }

        PositionSide target = request.side() == OrderSide.BUY ? PositionSide.LONG : PositionSide.SHORT;
        if (request.reduceOnly()) {
            PositionSide closing = target == PositionSide.LONG ? PositionSide.SHORT : PositionSide.LONG;
            if (!reduce(request.symbol(), closing, request.quantity())) {
                order.state = OrderState.REJECTED;
                log.warn("[PAPER] Reduce-only order {} rejected: no {} position on {}",
                    order.orderRef, closing, request.symbol());
                return;
            }
        } else {
            add(request.symbol(), target, request.quantity(), price);
        }

        order.state = OrderState.FILLED;
        order.averagePrice = price;
        order.filledQuantity = request.quantity();
        recordFill(order.orderRef, request.symbol(), request.side(), request.quantity(), price, clock.instant());
    }

    private void add(String symbol, PositionSide side, BigDecimal quantity, BigDecimal price) {
        String key = symbol + ":" + side;
        LivePosition current = positions.get(key);
        if (current == null) {
            positions.put(key, new LivePosition(symbol, side, quantity, price));
            return;
        }
        BigDecimal total = current.quantity().add(quantity);
        BigDecimal avg = current.quantity().multiply(current.entryPrice())
            .add(quantity.multiply(price))
            .divide(total, 8, RoundingMode.HALF_UP);
        positions.put(key, new LivePosition(symbol, side, total, avg));
    }

    private boolean reduce(String symbol, PositionSide side, BigDecimal quantity) {
        String key = symbol + ":" + side;
        LivePosition current = positions.get(key);
        if (current == null) {
            return false;
        }
        BigDecimal remaining = current.quantity().subtract(quantity);
        if (remaining.signum() <= 0) {
            positions.remove(key);
        } else {
            positions.put(key, new LivePosition(symbol, side, remaining, current.entryPrice()));
        }
        return true;
    }

    private static <T> CompletableFuture<T> unavailableFuture(String operation) {
        return CompletableFuture.failedFuture(new IllegalStateException("Paper exchange unavailable: " + operation));
    }

    private static final class PaperOrder {
        private final String orderRef;
        private final OrderRequest request;
        private OrderState state = OrderState.PENDING;
        private BigDecimal averagePrice;
        private BigDecimal filledQuantity;

        private PaperOrder(String orderRef, OrderRequest request) {
            this.orderRef = orderRef;
            this.request = request;
        }

        private OrderStatusReport report() {
            return switch (state) {
                case FILLED -> OrderStatusReport.filled(orderRef, averagePrice, filledQuantity);
                case REJECTED -> OrderStatusReport.rejected(orderRef);
                case PENDING -> OrderStatusReport.pending(orderRef);
            };
        }
    }
}
