package in.tradepulse.infrastructure.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradepulse.infrastructure.exchange.common.ConnectionState;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the monitoring server.
 *
 * Tests:
 * - /metrics exposes Prometheus text format
 * - Recorded metrics are exported
 * - /health reflects the connection state
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTED);

    private MonitoringServer server;
    private PrometheusStreamMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusStreamMetrics(new CollectorRegistry());

        server = new MonitoringServer(TEST_PORT, "localhost", metrics.getRegistry(), objectMapper, state::get);
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
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode(), "Metrics endpoint should return 200 OK");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.startsWith("text/plain"), "Content-Type should be text/plain for Prometheus");
    }

    @Test
    public void testRecordedMetricsExported() throws Exception {
        metrics.recordSignal("EMA", "BUY");
        metrics.recordDroppedEvent("ticks");
        metrics.recordOrder("BUY", true, Duration.ofMillis(40));
        metrics.setConnected(true);

        String body = get("/metrics").body();

        assertTrue(body.contains("signals_total"), "Should export signal counter");
        assertTrue(body.contains("action=\"BUY\""), "Should include labels");
        assertTrue(body.contains("events_dropped_total"));
        assertTrue(body.contains("order_latency_seconds_bucket"));
        assertTrue(body.contains("stream_connected 1.0"));
    }

    @Test
    public void testMetricValues() {
        metrics.recordSignal("COMBINED", "SELL");
        metrics.recordSignal("COMBINED", "SELL");
        metrics.recordTradeSkipped("COOLDOWN");

        CollectorRegistry registry = metrics.getRegistry();
        assertEquals(2.0, registry.getSampleValue("signals_total",
            new String[]{"strategy", "action"}, new String[]{"COMBINED", "SELL"}));
        assertEquals(1.0, registry.getSampleValue("trades_skipped_total",
            new String[]{"reason"}, new String[]{"COOLDOWN"}));
    }

    @Test
    public void testHealthReportsConnectionState() throws Exception {
        HttpResponse<String> ok = get("/health");
        assertEquals(200, ok.statusCode());
        JsonNode json = objectMapper.readTree(ok.body());
        assertEquals("ok", json.get("status").asText());
        assertEquals("CONNECTED", json.get("connection").asText());

        state.set(ConnectionState.BACKING_OFF);
        HttpResponse<String> degraded = get("/health");
        assertEquals(200, degraded.statusCode());
        assertEquals("degraded", objectMapper.readTree(degraded.body()).get("status").asText());

        state.set(ConnectionState.FAILED);
        assertEquals(503, get("/health").statusCode(), "Exhausted connector is unhealthy");
    }

    @Test
    public void testNameFilterRestrictsOutput() throws Exception {
        metrics.setConnected(true);
        metrics.recordDroppedEvent("ticks");

        String body = get("/metrics?name%5B%5D=stream_connected").body();

        assertTrue(body.contains("stream_connected 1.0"));
        assertFalse(body.contains("events_dropped_total"), "Unrequested families are left out");
    }

    @Test
    public void testUnknownPath() throws Exception {
        assertEquals(404, get("/nope").statusCode());
    }
}
