package in.tradepulse.infrastructure.exchange;

import in.tradepulse.config.BotConfig;
import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.ClockSkewWarning;
import in.tradepulse.domain.data.Tick;
import in.tradepulse.domain.data.Timeframe;
import in.tradepulse.infrastructure.exchange.common.ConnectionState;
import in.tradepulse.infrastructure.exchange.common.HeartbeatManager;
import in.tradepulse.infrastructure.exchange.common.ReconnectionPolicy;
import in.tradepulse.infrastructure.metrics.StreamMetrics;
import in.tradepulse.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OKX public WebSocket connector for one instrument.
 *
 * Subscribes to the tickers channel and the candle channel of the configured
 * timeframe. Decoded ticks and candle snapshots are published on the event
 * bus and handed synchronously to the {@link MarketDataListener}.
 *
 * Resilience:
 * - heartbeat "ping" every pingInterval; no "pong" within pongTimeout, or no
 *   frame at all for staleFeedTimeout, is handled as a dropped connection
 * - dropped connections reconnect with exponential backoff; the attempt
 *   counter resets once the exchange acknowledges a subscription
 * - when attempts are exhausted the connector moves to FAILED and
 *   {@link #awaitTermination()} completes with {@link ReconnectExhaustedException}
 *
 * Every physical connection gets a generation number; callbacks from an
 * older generation are ignored.
 */
public final class OkxMarketDataConnector {
    private static final Logger log = LoggerFactory.getLogger(OkxMarketDataConnector.class);

    static final String EXCHANGE = "OKX";
    private static final String PING = "ping";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

    private final String url;
    private final String instId;
    private final Timeframe timeframe;
    private final Duration clockSkewThreshold;
    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Duration staleFeedTimeout;

    private final OkxFrameDecoder decoder;
    private final ReconnectionPolicy reconnectionPolicy;
    private final EventBus eventBus;
    private final MarketDataListener listener;
    private final StreamMetrics metrics;
    private final Clock clock;
    private final HttpClient httpClient;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "okx-connector");
        t.setDaemon(true);
        return t;
    });

    private final AtomicReference<WebSocket> wsRef = new AtomicReference<>(null);
    private final AtomicLong generation = new AtomicLong(0);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Instant lastFrameAt;
    private volatile HeartbeatManager heartbeat;
    private volatile ScheduledFuture<?> reconnectTask;
    // Tail of the current connection's outbound frames; the JDK client allows one pending text send
    private final Object sendLock = new Object();
    private CompletableFuture<WebSocket> lastSend = CompletableFuture.completedFuture(null);
    private volatile boolean started = false;
    private volatile boolean shuttingDown = false;

    public OkxMarketDataConnector(BotConfig config, OkxFrameDecoder decoder, EventBus eventBus,
                                  MarketDataListener listener, StreamMetrics metrics, Clock clock) {
        this.url = config.wsUrl();
        this.instId = config.tradingPair();
        this.timeframe = config.timeframe();
        this.clockSkewThreshold = config.timeSyncThreshold();
        this.pingInterval = config.pingInterval();
        this.pongTimeout = config.pongTimeout();
        this.staleFeedTimeout = config.staleFeedTimeout();
        this.decoder = decoder;
        this.reconnectionPolicy = ReconnectionPolicy.from(config);
        this.eventBus = eventBus;
        this.listener = listener;
        this.metrics = metrics;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .build();

        log.info("[OKX WS] Created for {} {} ({})", instId, timeframe, url);
    }

    /**
     * Open the first connection. Later connections are opened by the reconnect loop.
     *
     * @return completes when the first WebSocket handshake succeeds; a failed
     *         handshake completes it exceptionally and schedules a reconnect
     */
    public synchronized CompletableFuture<WebSocket> connect() {
        if (started) {
            throw new IllegalStateException("Connector already started");
        }
        started = true;
        return openConnection(generation.get());
    }

    /**
     * Completes normally after {@link #shutdown()}, exceptionally with
     * {@link ReconnectExhaustedException} once reconnecting has been given up.
     */
    public CompletableFuture<Void> awaitTermination() {
        return termination;
    }

    public ConnectionState getState() {
        return state;
    }

    public int getReconnectAttempts() {
        return reconnectionPolicy.getAttemptCount();
    }

    /**
     * Close the transport, cancel any pending reconnect and stop all timers.
     */
    public void shutdown() {
        WebSocket ws;
        synchronized (this) {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            generation.incrementAndGet();

            ScheduledFuture<?> pending = reconnectTask;
            if (pending != null) {
                pending.cancel(false);
                reconnectTask = null;
            }
            stopHeartbeat();
            ws = wsRef.getAndSet(null);
        }

        if (ws != null) {
            closeQuietly(ws);
        }

        scheduler.shutdownNow();
        if (!state.isTerminal()) {
            state = ConnectionState.DISCONNECTED;
        }
        metrics.setConnected(false);
        termination.complete(null);
        log.info("[OKX WS] Shut down");
    }

    private CompletableFuture<WebSocket> openConnection(long gen) {
        if (gen != generation.get() || shuttingDown) {
            return CompletableFuture.failedFuture(
                new ExchangeConnectionException(EXCHANGE, instId, "Connection attempt superseded"));
        }

        state = ConnectionState.CONNECTING;
        log.info("[OKX WS] Connecting to {} (attempt after {} failure(s))", url, reconnectionPolicy.getAttemptCount());

        CompletableFuture<WebSocket> opened = httpClient.newWebSocketBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .buildAsync(URI.create(url), new OkxListener(gen));

        return opened.whenComplete((ws, error) -> {
            if (error != null) {
                handleDisconnect(gen, "Connect failed: " + error.getMessage(), error);
            }
        });
    }

    private void onOpen(long gen, WebSocket ws) {
        synchronized (this) {
            if (gen != generation.get() || shuttingDown) {
                ws.abort();
                return;
            }
            wsRef.set(ws);
            state = ConnectionState.CONNECTED;
            lastFrameAt = clock.instant();
        }

        synchronized (sendLock) {
            lastSend = CompletableFuture.completedFuture(ws);
        }
        log.info("[OKX WS] Connected");
        metrics.setConnected(true);
        metrics.recordConnectionEvent("CONNECTED");

        send(gen, ws, decoder.subscribeRequest(OkxFrameDecoder.TICKERS_CHANNEL, instId));
        send(gen, ws, decoder.subscribeRequest(timeframe.candleChannel(), instId));

        startHeartbeat(gen);
    }

    /**
     * Handle one complete text frame.
     */
    void handleText(String raw) {
        Instant receivedAt = clock.instant();
        lastFrameAt = receivedAt;

        OkxFrame frame;
        try {
            frame = decoder.decode(raw, receivedAt);
        } catch (FrameDecodeException e) {
            log.warn("[OKX WS] Skipping undecodable frame: {} ({})", e.getMessage(), e.getFrame());
            metrics.recordDecodeError();
            return;
        }
        metrics.recordFrame(frame.kind().name());

        switch (frame.kind()) {
            case PONG -> {
                HeartbeatManager hb = heartbeat;
                if (hb != null) {
                    hb.recordPong();
                }
            }
            case SUBSCRIBED -> {
                log.info("[OKX WS] Subscribed to {} {}", frame.channel(), instId);
                reconnectionPolicy.recordSuccess();
                metrics.recordConnectionEvent("SUBSCRIBED");
            }
            case ERROR -> {
                log.warn("[OKX WS] Exchange error: {}", frame.message());
                metrics.recordExchangeError();
            }
            case TICKERS -> {
                for (Tick tick : frame.ticks()) {
                    dispatchTick(tick);
                }
            }
            case CANDLES -> {
                for (BarUpdate update : frame.barUpdates()) {
                    dispatchBarUpdate(update);
                }
            }
            case IGNORED -> log.debug("[OKX WS] Ignoring frame on channel {}", frame.channel());
        }
    }

    private void dispatchTick(Tick tick) {
        checkClockSkew(tick);
        eventBus.ticks().publish(tick);
        try {
            listener.onTick(tick);
        } catch (RuntimeException e) {
            log.error("[OKX WS] Tick listener failed for {}: {}", tick.symbol(), e.getMessage(), e);
        }
    }

    private void dispatchBarUpdate(BarUpdate update) {
        eventBus.barUpdates().publish(update);
        try {
            listener.onBarUpdate(update);
        } catch (RuntimeException e) {
            log.error("[OKX WS] Candle listener failed for {}: {}", update.openTime(), e.getMessage(), e);
        }
    }

    private void checkClockSkew(Tick tick) {
        Duration skew = tick.clockSkew();
        if (skew.compareTo(clockSkewThreshold) <= 0) {
            return;
        }
        log.warn("[OKX WS] Clock skew {}ms exceeds {}ms (exchange {}, local {})",
            skew.toMillis(), clockSkewThreshold.toMillis(), tick.exchangeTimestamp(), tick.localTimestamp());
        metrics.recordClockSkew(skew);
        eventBus.alerts().publish(ClockSkewWarning.of(tick, clockSkewThreshold));
    }

    private void startHeartbeat(long gen) {
        HeartbeatManager hb = new HeartbeatManager(
            EXCHANGE + "-" + instId,
            pingInterval,
            pongTimeout,
            () -> sendPing(gen),
            healthy -> {
                if (!healthy) {
                    submit(() -> handleDisconnect(gen, "Heartbeat lost", null));
                }
            }
        );
        heartbeat = hb;
        hb.start();
    }

    /**
     * Queue a text frame behind any send still in progress on this connection.
     * A failed send is treated as a dropped connection.
     */
    private CompletableFuture<WebSocket> send(long gen, WebSocket ws, String text) {
        CompletableFuture<WebSocket> next;
        synchronized (sendLock) {
            next = lastSend.thenCompose(previous -> ws.sendText(text, true));
            lastSend = next;
        }
        next.whenComplete((sent, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
                submit(() -> handleDisconnect(gen, "Send failed: " + cause.getMessage(), cause));
            }
        });
        return next;
    }

    private void sendPing(long gen) {
        Instant lastFrame = lastFrameAt;
        if (lastFrame != null) {
            Duration silence = Duration.between(lastFrame, clock.instant());
            if (silence.compareTo(staleFeedTimeout) > 0) {
                throw new ExchangeConnectionException(EXCHANGE, instId,
                    "Stale feed: no frame for " + silence.toMillis() + "ms");
            }
        }
        WebSocket ws = wsRef.get();
        if (ws == null) {
            throw new ExchangeConnectionException(EXCHANGE, instId, "Socket not open");
        }
        send(gen, ws, PING);
    }

    private void stopHeartbeat() {
        HeartbeatManager hb = heartbeat;
        heartbeat = null;
        if (hb != null) {
            hb.stop();
        }
    }

    /**
     * Tear down the connection of generation {@code gen} and schedule the next attempt.
     */
    private void handleDisconnect(long gen, String reason, Throwable cause) {
        WebSocket ws;
        Duration delay;
        synchronized (this) {
            if (gen != generation.get() || shuttingDown || state.isTerminal()) {
                return;
            }
            long nextGen = generation.incrementAndGet();

            stopHeartbeat();
            ws = wsRef.getAndSet(null);

            metrics.setConnected(false);
            metrics.recordConnectionEvent("DISCONNECTED");
            reconnectionPolicy.recordFailure();

            if (!reconnectionPolicy.shouldRetry()) {
                state = ConnectionState.FAILED;
                delay = null;
            } else {
                state = ConnectionState.BACKING_OFF;
                delay = reconnectionPolicy.getNextDelay();
                reconnectTask = scheduler.schedule(() -> {
                    openConnection(nextGen);
                }, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        if (ws != null) {
            ws.abort();
        }

        if (delay == null) {
            log.error("[OKX WS] {} - giving up after {} reconnect attempts", reason, reconnectionPolicy.getMaxAttempts());
            metrics.recordConnectionEvent("FAILED");
            scheduler.shutdown();
            termination.completeExceptionally(
                new ReconnectExhaustedException(url, reconnectionPolicy.getMaxAttempts(), cause));
            return;
        }

        log.warn("[OKX WS] {} - retry #{} in {}ms", reason, reconnectionPolicy.getAttemptCount(), delay.toMillis());
        metrics.recordConnectionEvent("RECONNECT_SCHEDULED");
    }

    private void submit(Runnable task) {
        try {
            scheduler.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("[OKX WS] Scheduler stopped, dropping task");
        }
    }

    private void closeQuietly(WebSocket ws) {
        try {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown")
                .get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.debug("[OKX WS] Close handshake did not complete: {}", e.getMessage());
        } finally {
            ws.abort();
        }
    }

    /**
     * Per-connection WebSocket callbacks.
     */
    private final class OkxListener implements WebSocket.Listener {
        private final long gen;
        private final StringBuilder buf = new StringBuilder();

        OkxListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            OkxMarketDataConnector.this.onOpen(gen, webSocket);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                if (gen == generation.get()) {
                    handleText(msg);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            HeartbeatManager hb = heartbeat;
            if (hb != null && gen == generation.get()) {
                hb.recordPong();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            handleDisconnect(gen, "Closed by exchange: " + statusCode + " " + reason, null);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            handleDisconnect(gen, "WebSocket error: " + error.getMessage(), error);
        }
    }
}
