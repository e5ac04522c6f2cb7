package in.ledgerguard.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * HTTP handler for the Prometheus /metrics endpoint.
 *
 * Supports the scraper's {@code name[]} query parameter to export a subset
 * of families, e.g. {@code /metrics?name[]=ledger_writes_total}.
 *
 * Example output:
 * <pre>
 * # HELP ledger_writes_total Total number of ledger writes by outcome
 * # TYPE ledger_writes_total counter
 * ledger_writes_total{outcome="verified"} 42.0
 * ledger_writes_total{outcome="emergency"} 1.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        try {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);

            Set<String> names = requestedNames(exchange);
            Writer writer = new StringWriter();
            TextFormat.write004(writer, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));
            String body = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(body);

            log.debug("[PrometheusMetricsHandler] Served metrics ({} bytes)", body.length());

        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
