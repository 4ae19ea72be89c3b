package in.tradepulse.infrastructure.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradepulse.infrastructure.exchange.common.ConnectionState;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * Embedded Undertow server exposing GET /metrics (Prometheus text format)
 * and GET /health (JSON connection status).
 *
 * /health answers 200 unless the connector has given up (503).
 */
public final class MonitoringServer {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final Undertow server;
    private final int port;
    private final ObjectMapper objectMapper;
    private final Supplier<ConnectionState> connectionState;

    public MonitoringServer(int port, String host, CollectorRegistry registry,
                            ObjectMapper objectMapper, Supplier<ConnectionState> connectionState) {
        this.port = port;
        this.objectMapper = objectMapper;
        this.connectionState = connectionState;

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(registry))
            .get("/health", this::health);

        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes)
            .build();
    }

    public void start() {
        server.start();
        log.info("[MONITORING] Listening on port {} (/metrics, /health)", port);
    }

    public void stop() {
        server.stop();
        log.info("[MONITORING] Stopped");
    }

    void health(HttpServerExchange exchange) throws Exception {
        ConnectionState state = connectionState.get();

        ObjectNode body = objectMapper.createObjectNode();
        body.put("status", state == ConnectionState.CONNECTED ? "ok" : "degraded");
        body.put("connection", state.name());
        body.put("ts", Instant.now().toString());

        exchange.setStatusCode(state.isTerminal() ? 503 : 200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(objectMapper.writeValueAsString(body));
    }
}
