package in.ledgerguard.application.service;

import in.ledgerguard.application.port.output.ExchangeGateway;
import in.ledgerguard.domain.common.ExchangeUnavailableException;
import in.ledgerguard.domain.exchange.ExchangeFill;
import in.ledgerguard.domain.exchange.LivePosition;
import in.ledgerguard.domain.exchange.OrderRequest;
import in.ledgerguard.domain.exchange.OrderStatusReport;
import in.ledgerguard.infrastructure.common.RetryPolicy;
import in.ledgerguard.infrastructure.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Blocking, bounded access to the {@link ExchangeGateway}.
 *
 * Every call has a timeout. Idempotent reads are retried with backoff; order
 * placement is attempted exactly once. Failures surface as
 * {@link ExchangeUnavailableException}.
 */
public final class ExchangeCalls {
    private static final Logger log = LoggerFactory.getLogger(ExchangeCalls.class);

    private final ExchangeGateway gateway;
    private final RetryPolicy readRetry;
    private final Duration callTimeout;
    private final LedgerMetrics metrics;

    public ExchangeCalls(ExchangeGateway gateway, RetryPolicy readRetry, Duration callTimeout, LedgerMetrics metrics) {
        this.gateway = gateway;
        this.readRetry = readRetry;
        this.callTimeout = callTimeout;
        this.metrics = metrics;
    }

    /**
     * Place an order. Never retried: a lost acknowledgement could otherwise double the position.
     */
    public String placeOrder(OrderRequest request) {
        return once("placeOrder", () -> gateway.placeOrder(request));
    }

    public void cancelOrder(String orderRef) {
        withRetry("cancelOrder", () -> gateway.cancelOrder(orderRef));
    }

    public OrderStatusReport orderStatus(String orderRef) {
        return withRetry("getOrderStatus", () -> gateway.getOrderStatus(orderRef));
    }

    /**
     * Single status query, used inside confirmation polling loops.
     */
    public OrderStatusReport pollOrderStatus(String orderRef) {
        return once("getOrderStatus", () -> gateway.getOrderStatus(orderRef));
    }

    public List<LivePosition> livePositions() {
        return withRetry("getLivePositions", gateway::getLivePositions);
    }

    public List<ExchangeFill> recentFills(String symbol, Duration window) {
        return withRetry("getRecentFills", () -> gateway.getRecentFills(symbol, window));
    }

    public Optional<BigDecimal> markPrice(String symbol) {
        return withRetry("getMarkPrice", () -> gateway.getMarkPrice(symbol));
    }

    private <T> T withRetry(String operation, Supplier<CompletableFuture<T>> call) {
        RetryPolicy policy = readRetry.fresh();
        ExchangeUnavailableException last = null;
        while (policy.shouldRetry()) {
            try {
                T result = await(operation, call.get());
                policy.recordSuccess();
                return result;
            } catch (ExchangeUnavailableException e) {
                last = e;
                policy.recordFailure();
                log.warn("Exchange {} failed (attempt {}/{}): {}",
                    operation, policy.getAttemptCount(), policy.getMaxAttempts(), e.getMessage());
                try {
                    policy.pause();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        metrics.recordExchangeCallFailure(operation);
        throw new ExchangeUnavailableException(operation,
            "Exchange " + operation + " failed after " + policy.getAttemptCount() + " attempts", last);
    }

    private <T> T once(String operation, Supplier<CompletableFuture<T>> call) {
        try {
            return await(operation, call.get());
        } catch (ExchangeUnavailableException e) {
            metrics.recordExchangeCallFailure(operation);
            throw e;
        }
    }

    private <T> T await(String operation, CompletableFuture<T> future) {
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExchangeUnavailableException(operation,
                "Exchange " + operation + " timed out after " + callTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExchangeUnavailableException(operation,
                "Exchange " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeUnavailableException(operation, "Interrupted during " + operation, e);
        } catch (RuntimeException e) {
            throw new ExchangeUnavailableException(operation,
                "Exchange " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
