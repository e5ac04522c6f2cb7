package in.ledgerguard.infrastructure.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * HTTP handler for /health: 200 with a JSON status body while the engine runs, 503 otherwise.
 */
public class HealthHandler implements HttpHandler {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private final BooleanSupplier healthy;
    private final Supplier<Map<String, Object>> details;

    public HealthHandler(BooleanSupplier healthy, Supplier<Map<String, Object>> details) {
        this.healthy = healthy;
        this.details = details;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        boolean up = healthy.getAsBoolean();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", up ? "UP" : "DOWN");
        body.putAll(details.get());

        exchange.setStatusCode(up ? 200 : 503);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(MAPPER.writeValueAsString(body));
    }
}
