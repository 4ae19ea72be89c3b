package in.tradepulse.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradepulse.config.BotConfig;
import in.tradepulse.infrastructure.exchange.OkxFrameDecoder;
import in.tradepulse.infrastructure.exchange.OkxMarketDataConnector;
import in.tradepulse.infrastructure.exchange.ReconnectExhaustedException;
import in.tradepulse.infrastructure.exchange.common.ConnectionState;
import in.tradepulse.infrastructure.metrics.MonitoringServer;
import in.tradepulse.infrastructure.metrics.PrometheusStreamMetrics;
import in.tradepulse.service.MarketDataCache;
import in.tradepulse.service.MarketDataPipeline;
import in.tradepulse.service.core.EventBus;
import in.tradepulse.service.execution.ExecutionGateway;
import in.tradepulse.service.execution.PaperExecutionGateway;
import in.tradepulse.service.execution.SignalExecutionOrchestrator;
import in.tradepulse.service.execution.SignalJournalListener;
import in.tradepulse.service.signal.SignalStateMachine;
import in.tradepulse.service.signal.SignalStrategy;
import in.tradepulse.service.signal.StrategyFactory;
import in.tradepulse.service.signal.TradingState;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires connector → pipeline → state machine → event bus → execution, and
 * owns their lifecycle.
 */
public final class SignalEngine {
    private static final Logger log = LoggerFactory.getLogger(SignalEngine.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG = 1;
    public static final int EXIT_RECONNECT_EXHAUSTED = 2;

    private final BotConfig config;
    private final PrometheusStreamMetrics metrics;
    private final EventBus eventBus;
    private final SignalStateMachine stateMachine;
    private final MarketDataPipeline pipeline;
    private final OkxMarketDataConnector connector;
    private final SignalExecutionOrchestrator orchestrator;
    private final SignalJournalListener journal;
    private final MonitoringServer monitoringServer;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SignalEngine(BotConfig config, Clock clock, CollectorRegistry registry) {
        this(config, clock, registry, null);
    }

    /**
     * @param gateway execution gateway, or null for paper execution
     */
    public SignalEngine(BotConfig config, Clock clock, CollectorRegistry registry, ExecutionGateway gateway) {
        this.config = config;
        ObjectMapper objectMapper = new ObjectMapper();
        this.metrics = new PrometheusStreamMetrics(registry);
        this.eventBus = new EventBus(config.eventQueueCapacity(), metrics);

        MarketDataCache marketDataCache = new MarketDataCache();
        SignalStrategy strategy = StrategyFactory.create(config);
        TradingState state = new TradingState(config.maxPriceHistory(), config.maxOhlcHistory());
        this.stateMachine = new SignalStateMachine(
            state, strategy, config.timeframe().label(), eventBus.signals()::publish, metrics, clock);
        this.pipeline = new MarketDataPipeline(config, clock, stateMachine, marketDataCache, eventBus, metrics);
        this.connector = new OkxMarketDataConnector(
            config, new OkxFrameDecoder(objectMapper), eventBus, pipeline, metrics, clock);

        ExecutionGateway executionGateway = gateway != null ? gateway : new PaperExecutionGateway(marketDataCache);
        this.orchestrator = new SignalExecutionOrchestrator(
            executionGateway, config.tradingPair(), config.tradeSize(), config.tradeCooldown(), metrics, clock);
        this.journal = new SignalJournalListener(objectMapper);

        this.monitoringServer = config.metricsPort() > 0
            ? new MonitoringServer(config.metricsPort(), "0.0.0.0", registry, objectMapper, connector::getState)
            : null;
    }

    /**
     * Subscribe downstream consumers, start monitoring and open the exchange stream.
     */
    public void start() {
        log.info("[ENGINE] Trading {} on {} with {} strategy ({} bars from {})",
            config.tradingPair(), config.timeframe(), config.strategy(), config.timeframe(), config.barSource());

        eventBus.signals().subscribe("journal", journal::onSignal);
        eventBus.signals().subscribe("execution", orchestrator::onSignal);
        eventBus.alerts().subscribe("alert-log", warning ->
            log.warn("[ENGINE] Clock skew alert: {}ms on {}", warning.skew().toMillis(), warning.symbol()));

        if (monitoringServer != null) {
            monitoringServer.start();
        }

        orchestrator.initializeLeverage(config.leverage(), config.tradeMode());
        connector.connect();
    }

    /**
     * Completes when the connector terminates: normally after {@link #shutdown()},
     * exceptionally if reconnecting was given up.
     */
    public CompletableFuture<Void> awaitTermination() {
        return connector.awaitTermination();
    }

    /**
     * Block until the engine stops and map the outcome to a process exit code.
     */
    public int awaitExitCode() {
        try {
            awaitTermination().join();
            return EXIT_OK;
        } catch (CompletionException e) {
            return exitCodeFor(e.getCause());
        } finally {
            shutdown();
        }
    }

    static int exitCodeFor(Throwable failure) {
        if (failure instanceof ReconnectExhaustedException) {
            log.error("[ENGINE] {}", failure.getMessage());
            return EXIT_RECONNECT_EXHAUSTED;
        }
        log.error("[ENGINE] Stopped on unexpected failure", failure);
        return EXIT_CONFIG;
    }

    /**
     * Stop everything this engine started. Safe to call more than once.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("[ENGINE] Shutting down...");
        connector.shutdown();
        eventBus.close();
        if (monitoringServer != null) {
            monitoringServer.stop();
        }
        log.info("[ENGINE] Stopped");
    }

    public ConnectionState connectionState() {
        return connector.getState();
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public MarketDataPipeline pipeline() {
        return pipeline;
    }

    public SignalStateMachine stateMachine() {
        return stateMachine;
    }
}
