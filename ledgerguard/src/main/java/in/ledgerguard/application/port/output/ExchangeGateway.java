package in.ledgerguard.application.port.output;

import in.ledgerguard.domain.exchange.ExchangeFill;
import in.ledgerguard.domain.exchange.LivePosition;
import in.ledgerguard.domain.exchange.OrderRequest;
import in.ledgerguard.domain.exchange.OrderStatusReport;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Consumer-side view of the exchange. The exchange is the authority on whether a position exists.
 *
 * All calls are asynchronous; failures complete the future exceptionally.
 */
public interface ExchangeGateway {

    /**
     * Submit a market order.
     *
     * @return exchange order reference
     */
    CompletableFuture<String> placeOrder(OrderRequest request);

    CompletableFuture<Void> cancelOrder(String orderRef);

    CompletableFuture<OrderStatusReport> getOrderStatus(String orderRef);

    CompletableFuture<List<LivePosition>> getLivePositions();

    /**
     * Fills for {@code symbol} executed within {@code window} of now, oldest first.
     */
    CompletableFuture<List<ExchangeFill>> getRecentFills(String symbol, Duration window);

    /**
     * Current mark price, empty when the exchange has none for the symbol.
     */
    CompletableFuture<Optional<BigDecimal>> getMarkPrice(String symbol);
}
