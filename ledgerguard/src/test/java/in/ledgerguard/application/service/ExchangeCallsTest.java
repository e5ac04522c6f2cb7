package in.ledgerguard.application.service;

import in.ledgerguard.application.port.output.ExchangeGateway;
import in.ledgerguard.domain.common.ErrorCategory;
import in.ledgerguard.domain.common.ExchangeUnavailableException;
import in.ledgerguard.domain.exchange.LivePosition;
import in.ledgerguard.domain.exchange.OrderRequest;
import in.ledgerguard.domain.exchange.OrderSide;
import in.ledgerguard.domain.trade.PositionSide;
import in.ledgerguard.infrastructure.metrics.LedgerMetrics;
import in.ledgerguard.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Retry, timeout and error mapping around the exchange gateway.
 */
@ExtendWith(MockitoExtension.class)
class ExchangeCallsTest {

    @Mock
    private ExchangeGateway gateway;

    @Mock
    private LedgerMetrics metrics;

    private ExchangeCalls calls;

    @BeforeEach
    void setUp() {
        calls = new ExchangeCalls(gateway, Fixtures.fastRetry(3), Duration.ofMillis(200), metrics);
    }

    private static <T> CompletableFuture<T> failed(String message) {
        return CompletableFuture.failedFuture(new IllegalStateException(message));
    }

    @Test
    void testReadsAreRetriedUntilSuccess() {
        List<LivePosition> positions = List.of(
            new LivePosition("BTCUSDT", PositionSide.LONG, BigDecimal.ONE, new BigDecimal("100")));
        when(gateway.getLivePositions())
            .thenReturn(failed("503"))
            .thenReturn(CompletableFuture.completedFuture(positions));

        assertEquals(positions, calls.livePositions());
        verify(gateway, times(2)).getLivePositions();
        verifyNoInteractions(metrics);
    }

    @Test
    void testReadsGiveUpAfterMaxAttempts() {
        when(gateway.getLivePositions()).thenReturn(failed("503"));

        ExchangeUnavailableException e = assertThrows(ExchangeUnavailableException.class, calls::livePositions);

        assertEquals("getLivePositions", e.getOperation());
        assertEquals(ErrorCategory.TRANSIENT, e.getCategory());
        verify(gateway, times(3)).getLivePositions();
        verify(metrics).recordExchangeCallFailure("getLivePositions");
    }

    @Test
    void testPlaceOrderIsNeverRetried() {
        when(gateway.placeOrder(any())).thenReturn(failed("connection reset"));
        OrderRequest request = new OrderRequest("t-1", "BTCUSDT", OrderSide.BUY, BigDecimal.ONE, false, null);

        assertThrows(ExchangeUnavailableException.class, () -> calls.placeOrder(request));

        verify(gateway, times(1)).placeOrder(request);
        verify(metrics).recordExchangeCallFailure("placeOrder");
    }

    @Test
    void testSlowCallTimesOut() {
        when(gateway.getMarkPrice("BTCUSDT")).thenReturn(new CompletableFuture<>());

        ExchangeUnavailableException e = assertThrows(ExchangeUnavailableException.class,
            () -> calls.markPrice("BTCUSDT"));

        assertTrue(e.getMessage().contains("getMarkPrice"));
        verify(gateway, times(3)).getMarkPrice("BTCUSDT");
    }

    @Test
    void testGatewayThrowingDirectlyIsMapped() {
        when(gateway.getOrderStatus("PAPER-1")).thenThrow(new IllegalArgumentException("bad ref"));

        assertThrows(ExchangeUnavailableException.class, () -> calls.pollOrderStatus("PAPER-1"));
        verify(gateway, times(1)).getOrderStatus("PAPER-1");
    }
}
