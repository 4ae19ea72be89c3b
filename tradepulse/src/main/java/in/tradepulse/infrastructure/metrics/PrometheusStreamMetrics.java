package in.tradepulse.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of StreamMetrics.
 *
 * Key Metrics:
 * - stream_connection_events_total{event}
 * - stream_connected (1=open, 0=down)
 * - stream_frames_total{kind}
 * - stream_decode_errors_total, stream_exchange_errors_total
 * - stream_clock_skew_seconds
 * - bars_closed_total{source}
 * - signals_total{strategy, action}, strategy_faults_total{strategy}
 * - events_dropped_total{channel}
 * - orders_total{side, status}, order_latency_seconds, trades_skipped_total{reason}
 */
public class PrometheusStreamMetrics implements StreamMetrics {

    private final CollectorRegistry registry;

    private final Counter connectionEventCounter;
    private final Gauge connectionStatus;
    private final Counter frameCounter;
    private final Counter decodeErrorCounter;
    private final Counter exchangeErrorCounter;
    private final Histogram clockSkew;
    private final Counter barCounter;
    private final Counter signalCounter;
    private final Counter strategyFaultCounter;
    private final Counter droppedEventCounter;
    private final Counter orderCounter;
    private final Histogram orderLatency;
    private final Counter tradeSkippedCounter;

    public PrometheusStreamMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connectionEventCounter = Counter.build()
            .name("stream_connection_events_total")
            .help("Exchange stream connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.connectionStatus = Gauge.build()
            .name("stream_connected")
            .help("Exchange stream status (1=open, 0=down)")
            .register(registry);

        this.frameCounter = Counter.build()
            .name("stream_frames_total")
            .help("Inbound WebSocket frames by decoded kind")
            .labelNames("kind")
            .register(registry);

        this.decodeErrorCounter = Counter.build()
            .name("stream_decode_errors_total")
            .help("Frames that could not be decoded")
            .register(registry);

        this.exchangeErrorCounter = Counter.build()
            .name("stream_exchange_errors_total")
            .help("Error events reported by the exchange")
            .register(registry);

        this.clockSkew = Histogram.build()
            .name("stream_clock_skew_seconds")
            .help("Exchange/local clock skew above threshold")
            .buckets(5, 10, 30, 60, 300)
            .register(registry);

        this.barCounter = Counter.build()
            .name("bars_closed_total")
            .help("Completed bars")
            .labelNames("source")
            .register(registry);

        this.signalCounter = Counter.build()
            .name("signals_total")
            .help("Published trading signals")
            .labelNames("strategy", "action")
            .register(registry);

        this.strategyFaultCounter = Counter.build()
            .name("strategy_faults_total")
            .help("Bar evaluations that threw")
            .labelNames("strategy")
            .register(registry);

        this.droppedEventCounter = Counter.build()
            .name("events_dropped_total")
            .help("Events dropped by lossy channels")
            .labelNames("channel")
            .register(registry);

        this.orderCounter = Counter.build()
            .name("orders_total")
            .help("Orders sent to the execution gateway")
            .labelNames("side", "status")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("order_latency_seconds")
            .help("Execution gateway response time in seconds")
            .buckets(0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.tradeSkippedCounter = Counter.build()
            .name("trades_skipped_total")
            .help("Signals not acted on by the execution boundary")
            .labelNames("reason")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordConnectionEvent(String event) {
        connectionEventCounter.labels(event).inc();
    }

    @Override
    public void setConnected(boolean connected) {
        connectionStatus.set(connected ? 1 : 0);
    }

    @Override
    public void recordFrame(String kind) {
        frameCounter.labels(kind).inc();
    }

    @Override
    public void recordDecodeError() {
        decodeErrorCounter.inc();
    }

    @Override
    public void recordExchangeError() {
        exchangeErrorCounter.inc();
    }

    @Override
    public void recordClockSkew(Duration skew) {
        clockSkew.observe(skew.toMillis() / 1000.0);
    }

    @Override
    public void recordBarClosed(String source) {
        barCounter.labels(source).inc();
    }

    @Override
    public void recordSignal(String strategy, String action) {
        signalCounter.labels(strategy, action).inc();
    }

    @Override
    public void recordStrategyFault(String strategy) {
        strategyFaultCounter.labels(strategy).inc();
    }

    @Override
    public void recordDroppedEvent(String channel) {
        droppedEventCounter.labels(channel).inc();
    }

    @Override
    public void recordOrder(String side, boolean success, Duration latency) {
        orderCounter.labels(side, success ? "success" : "failure").inc();
        orderLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordTradeSkipped(String reason) {
        tradeSkippedCounter.labels(reason).inc();
    }
}
