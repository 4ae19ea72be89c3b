package in.tradepulse.infrastructure.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.tradepulse.config.BotConfig;
import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.ClockSkewWarning;
import in.tradepulse.domain.data.Tick;
import in.tradepulse.infrastructure.exchange.common.ConnectionState;
import in.tradepulse.infrastructure.metrics.StreamMetrics;
import in.tradepulse.service.core.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OkxMarketDataConnector.
 *
 * Tests:
 * - Frame routing to the listener and the event bus
 * - Clock skew alerts
 * - Undecodable frames
 * - Reconnect exhaustion against a closed port
 * - Shutdown during backoff
 */
@ExtendWith(MockitoExtension.class)
class OkxMarketDataConnectorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final String CLOSED_PORT_URL = "ws://127.0.0.1:1/ws/v5/public";

    @Mock
    private MarketDataListener listener;

    @Mock
    private StreamMetrics metrics;

    private EventBus eventBus;
    private OkxMarketDataConnector connector;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(64, metrics);
    }

    @AfterEach
    void tearDown() {
        if (connector != null) {
            connector.shutdown();
        }
        eventBus.close();
    }

    private OkxMarketDataConnector connector(BotConfig config) {
        connector = new OkxMarketDataConnector(config, new OkxFrameDecoder(new ObjectMapper()), eventBus,
            listener, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
        return connector;
    }

    private static String tickerFrame(Instant ts) {
        return "{\"arg\":{\"channel\":\"tickers\",\"instId\":\"BTC-USDT-SWAP\"},"
            + "\"data\":[{\"instId\":\"BTC-USDT-SWAP\",\"last\":\"43000\",\"vol24h\":\"10\",\"ts\":\""
            + ts.toEpochMilli() + "\"}]}";
    }

    @Test
    void testTickerForwardedToListenerAndBus() throws InterruptedException {
        OkxMarketDataConnector connector = connector(BotConfig.defaults());
        CountDownLatch published = new CountDownLatch(1);
        eventBus.ticks().subscribe("test", tick -> published.countDown());

        connector.handleText(tickerFrame(NOW));

        ArgumentCaptor<Tick> captor = ArgumentCaptor.forClass(Tick.class);
        verify(listener).onTick(captor.capture());
        assertEquals(new BigDecimal("43000"), captor.getValue().price());
        assertEquals(NOW, captor.getValue().localTimestamp());
        assertTrue(published.await(2, TimeUnit.SECONDS), "Tick should reach the bus");
        verify(metrics).recordFrame("TICKERS");
        verify(metrics, never()).recordClockSkew(any());
    }

    @Test
    void testCandleForwardedToListener() {
        OkxMarketDataConnector connector = connector(BotConfig.defaults());

        connector.handleText("{\"arg\":{\"channel\":\"candle30m\",\"instId\":\"BTC-USDT-SWAP\"},\"data\":["
            + "[\"1704103200000\",\"100\",\"110\",\"90\",\"105\",\"12\",\"0\",\"0\",\"1\"]]}");

        ArgumentCaptor<BarUpdate> captor = ArgumentCaptor.forClass(BarUpdate.class);
        verify(listener).onBarUpdate(captor.capture());
        assertTrue(captor.getValue().isConfirmed());
    }

    @Test
    void testClockSkewRaisesAlertAndKeepsTick() throws InterruptedException {
        OkxMarketDataConnector connector = connector(BotConfig.defaults());
        CountDownLatch alerted = new CountDownLatch(1);
        AtomicReference<ClockSkewWarning> warning = new AtomicReference<>();
        eventBus.alerts().subscribe("test", w -> {
            warning.set(w);
            alerted.countDown();
        });

        connector.handleText(tickerFrame(NOW.minusSeconds(10)));

        assertTrue(alerted.await(2, TimeUnit.SECONDS), "Skew beyond 5s should raise an alert");
        assertEquals(Duration.ofSeconds(10), warning.get().skew());
        verify(metrics).recordClockSkew(Duration.ofSeconds(10));
        verify(listener).onTick(any());
    }

    @Test
    void testUndecodableFrameSkipped() {
        OkxMarketDataConnector connector = connector(BotConfig.defaults());

        assertDoesNotThrow(() -> connector.handleText("{\"arg\":{\"channel\":\"tickers\"},\"data\":[{\"last\":\"x\"}]}"));

        verify(metrics).recordDecodeError();
        verifyNoInteractions(listener);
        assertEquals(ConnectionState.DISCONNECTED, connector.getState());
    }

    @Test
    void testListenerFailureDoesNotPropagate() {
        OkxMarketDataConnector connector = connector(BotConfig.defaults());
        doThrow(new IllegalStateException("listener bug")).when(listener).onTick(any());

        assertDoesNotThrow(() -> connector.handleText(tickerFrame(NOW)));
    }

    @Test
    void testErrorFrameCounted() {
        OkxMarketDataConnector connector = connector(BotConfig.defaults());

        connector.handleText("{\"event\":\"error\",\"code\":\"60018\",\"msg\":\"doesn't exist\"}");

        verify(metrics).recordExchangeError();
    }

    @Test
    void testReconnectExhaustion() {
        BotConfig config = BotConfig.defaults().withReconnect(CLOSED_PORT_URL, Duration.ofMillis(10), 1.0, 2);
        OkxMarketDataConnector connector = connector(config);

        connector.connect();

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> connector.awaitTermination().get(20, TimeUnit.SECONDS));
        ReconnectExhaustedException cause = assertInstanceOf(ReconnectExhaustedException.class, e.getCause());
        assertEquals(2, cause.getAttempts());
        assertEquals(ConnectionState.FAILED, connector.getState());
        assertThrows(IllegalStateException.class, connector::connect, "Connector is single-use");
    }

    @Test
    void testShutdownDuringBackoffCompletesNormally() throws Exception {
        BotConfig config = BotConfig.defaults().withReconnect(CLOSED_PORT_URL, Duration.ofSeconds(60), 1.5, 5);
        OkxMarketDataConnector connector = connector(config);

        CompletableFuture<?> first = connector.connect();
        assertThrows(ExecutionException.class, () -> first.get(10, TimeUnit.SECONDS));

        long deadline = System.currentTimeMillis() + 5000;
        while (connector.getState() != ConnectionState.BACKING_OFF && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(ConnectionState.BACKING_OFF, connector.getState());
        assertEquals(1, connector.getReconnectAttempts());

        connector.shutdown();

        assertNull(connector.awaitTermination().get(1, TimeUnit.SECONDS));
        assertEquals(ConnectionState.DISCONNECTED, connector.getState());
        assertDoesNotThrow(connector::shutdown, "Shutdown is idempotent");
    }
}
