package in.tradepulse.bootstrap;

import in.tradepulse.config.BotConfig;
import in.tradepulse.domain.data.Tick;
import in.tradepulse.domain.signal.Signal;
import in.tradepulse.domain.signal.SignalAction;
import in.tradepulse.domain.signal.StrategyType;
import in.tradepulse.infrastructure.exchange.ReconnectExhaustedException;
import in.tradepulse.infrastructure.exchange.common.ConnectionState;
import in.tradepulse.testutil.MutableClock;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.math.BigDecimal;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SignalEngineTest {

    private static final String CLOSED_PORT_URL = "ws://127.0.0.1:1/ws/v5/public";

    @Test
    void testExitCodes() {
        assertEquals(SignalEngine.EXIT_RECONNECT_EXHAUSTED,
            SignalEngine.exitCodeFor(new ReconnectExhaustedException(CLOSED_PORT_URL, 3, new ConnectException())));
        assertEquals(SignalEngine.EXIT_CONFIG, SignalEngine.exitCodeFor(new IllegalStateException("bug")));
    }

    @Test
    @Timeout(30)
    void testReconnectExhaustionExitsWithCodeTwo() {
        BotConfig config = BotConfig.defaults().withReconnect(CLOSED_PORT_URL, Duration.ofMillis(10), 1.0, 1);
        SignalEngine engine = new SignalEngine(config, MutableClock.at("2024-01-01T00:00:00Z"), new CollectorRegistry());

        engine.start();

        assertEquals(SignalEngine.EXIT_RECONNECT_EXHAUSTED, engine.awaitExitCode());
        assertEquals(ConnectionState.FAILED, engine.connectionState());
    }

    @Test
    void testSignalsReachSubscribers() throws InterruptedException {
        BotConfig config = BotConfig.defaults()
            .withStrategy(StrategyType.EMA)
            .withEmaPeriods(2, 3);
        MutableClock clock = MutableClock.at("2024-01-01T00:01:00Z");
        SignalEngine engine = new SignalEngine(config, clock, new CollectorRegistry());
        try {
            CountDownLatch received = new CountDownLatch(1);
            AtomicReference<Signal> signal = new AtomicReference<>();
            engine.eventBus().signals().subscribe("test", s -> {
                signal.set(s);
                received.countDown();
            });

            double[] prices = {100, 100, 100, 100, 90, 80};
            for (int i = 0; i < prices.length; i++) {
                clock.set(Instant.parse("2024-01-01T00:01:00Z").plus(Duration.ofMinutes(30L * i)));
                engine.pipeline().onTick(new Tick(config.tradingPair(), BigDecimal.valueOf(prices[i]),
                    BigDecimal.ZERO, clock.instant(), clock.instant()));
            }

            assertTrue(received.await(2, TimeUnit.SECONDS));
            assertEquals(SignalAction.SELL, signal.get().action());
            assertEquals("EMA", signal.get().strategyTag());
        } finally {
            engine.shutdown();
        }
    }
}
