package in.ledgerguard.infrastructure.metrics;

import in.ledgerguard.domain.anomaly.AnomalyEventType;
import in.ledgerguard.domain.trade.WriteOutcome;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the /metrics and /health endpoints.
 *
 * Tests:
 * - Prometheus text format and ledger metric names
 * - Recorded values appear in the export
 * - Health status code follows the engine state
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19102;
    private Undertow server;
    private PrometheusLedgerMetrics metrics;
    private HttpClient httpClient;
    private final AtomicBoolean running = new AtomicBoolean(true);

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusLedgerMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
                .addExactPath("/health", new HealthHandler(running::get, () -> {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("active_positions", 2);
                    details.put("ledger_last_updated", Instant.parse("2026-01-05T10:00:00Z"));
                    return details;
                })))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointServesPrometheusText() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.startsWith("text/plain"), "Prometheus text format, got " + contentType);
        assertTrue(response.body().contains("# TYPE ledger_write_latency_seconds histogram"));
        assertTrue(response.body().contains("# TYPE active_positions gauge"));
    }

    @Test
    public void testRecordedValuesAreExported() throws Exception {
        metrics.recordLedgerWrite(WriteOutcome.VERIFIED, Duration.ofMillis(3));
        metrics.recordLedgerWrite(WriteOutcome.EMERGENCY, Duration.ofMillis(40));
        metrics.recordPositionOpened("btc-trend");
        metrics.recordAnomaly(AnomalyEventType.GHOST_DETECTED);
        metrics.recordReconcileCycle(Duration.ofMillis(120), false);
        metrics.recordReconcileCycle(Duration.ZERO, true);
        metrics.updateActivePositions(2);

        String body = get("/metrics").body();

        assertTrue(body.contains("ledger_writes_total{outcome=\"verified\",} 1.0"), body);
        assertTrue(body.contains("ledger_writes_total{outcome=\"emergency\",} 1.0"));
        assertTrue(body.contains("positions_opened_total{strategy=\"btc-trend\",} 1.0"));
        assertTrue(body.contains("anomalies_total{type=\"GHOST_DETECTED\",} 1.0"));
        assertTrue(body.contains("reconcile_cycles_total{result=\"skipped\",} 1.0"));
        assertTrue(body.contains("reconcile_cycle_seconds_count 1.0"));
        assertTrue(body.contains("active_positions 2.0"));
    }

    @Test
    public void testNameFilterLimitsFamilies() throws Exception {
        metrics.recordLedgerWrite(WriteOutcome.VERIFIED, Duration.ofMillis(3));
        metrics.updateActivePositions(1);

        String body = get("/metrics?name%5B%5D=active_positions").body();

        assertTrue(body.contains("active_positions 1.0"), body);
        assertFalse(body.contains("ledger_writes_total"));
    }

    @Test
    public void testHealthFollowsEngineState() throws Exception {
        HttpResponse<String> up = get("/health");
        assertEquals(200, up.statusCode());
        assertTrue(up.body().contains("\"status\":\"UP\""), up.body());
        assertTrue(up.body().contains("\"active_positions\":2"));
        assertTrue(up.body().contains("2026-01-05T10:00:00Z"), "Instants are ISO strings");

        running.set(false);
        HttpResponse<String> down = get("/health");
        assertEquals(503, down.statusCode());
        assertTrue(down.body().contains("\"status\":\"DOWN\""));
    }
}
