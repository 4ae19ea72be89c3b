package in.tradepulse.infrastructure.exchange.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatManagerTest {

    private HeartbeatManager heartbeat;
    private final List<String> sentFrames = new CopyOnWriteArrayList<>();
    private final List<Boolean> healthChanges = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
    }

    private HeartbeatManager okxHeartbeat(long intervalMs, long timeoutMs) {
        return okxHeartbeat(intervalMs, timeoutMs, () -> sentFrames.add("ping"), healthChanges::add);
    }

    private HeartbeatManager okxHeartbeat(long intervalMs, long timeoutMs, Runnable ping, Consumer<Boolean> onHealth) {
        heartbeat = new HeartbeatManager("OKX", Duration.ofMillis(intervalMs), Duration.ofMillis(timeoutMs), ping, onHealth);
        return heartbeat;
    }

    @Test
    void nothingIsSentBeforeStart() {
        okxHeartbeat(1000, 2000);

        assertTrue(sentFrames.isEmpty());
        assertNull(heartbeat.getTimeSinceLastPong());
        assertFalse(heartbeat.isRunning());
    }

    @Test
    void sendsTextPingOnEveryInterval() throws InterruptedException {
        CountDownLatch threePings = new CountDownLatch(3);
        okxHeartbeat(100, 5000, () -> {
            sentFrames.add("ping");
            threePings.countDown();
        }, healthChanges::add);

        heartbeat.start();

        assertTrue(threePings.await(1, TimeUnit.SECONDS));
        assertTrue(sentFrames.stream().allMatch("ping"::equals));
        assertTrue(heartbeat.isRunning());
    }

    @Test
    void pongsArrivingInTimeKeepConnectionHealthy() throws InterruptedException {
        okxHeartbeat(100, 400);
        heartbeat.start();

        for (int i = 0; i < 5; i++) {
            Thread.sleep(150);
            heartbeat.recordPong();
        }

        assertTrue(heartbeat.isHealthy());
        assertTrue(healthChanges.isEmpty(), "Health never changed");
    }

    @Test
    void missingPongReportsUnhealthyOnce() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        okxHeartbeat(100, 300, () -> {}, healthy -> {
            healthChanges.add(healthy);
            if (!healthy) {
                unhealthy.countDown();
            }
        });

        heartbeat.start();

        assertTrue(unhealthy.await(2, TimeUnit.SECONDS));
        assertFalse(heartbeat.isHealthy());
        Thread.sleep(300);
        assertEquals(List.of(false), healthChanges);
    }

    @Test
    void lateAnswerRestoresHealth() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        CountDownLatch recovered = new CountDownLatch(1);
        okxHeartbeat(100, 300, () -> {}, healthy -> {
            healthChanges.add(healthy);
            (healthy ? recovered : unhealthy).countDown();
        });

        heartbeat.start();
        assertTrue(unhealthy.await(2, TimeUnit.SECONDS));

        heartbeat.recordPong();

        assertTrue(recovered.await(1, TimeUnit.SECONDS));
        assertEquals(List.of(false, true), healthChanges);
    }

    @Test
    void stalePingCheckThrowingMarksUnhealthy() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        okxHeartbeat(100, 5000, () -> {
            throw new IllegalStateException("No market data for 90s");
        }, healthy -> {
            if (!healthy) {
                unhealthy.countDown();
            }
        });

        heartbeat.start();

        assertTrue(unhealthy.await(1, TimeUnit.SECONDS));
    }

    @Test
    void pongAgeIsTrackedAndExpires() throws InterruptedException {
        okxHeartbeat(10_000, 200);
        heartbeat.start();

        heartbeat.recordPong();
        assertTrue(heartbeat.isHealthy());

        Thread.sleep(300);

        assertTrue(heartbeat.getTimeSinceLastPong().toMillis() >= 300);
        assertFalse(heartbeat.isHealthy());
    }

    @Test
    void stopBeforeStartIsHarmless() {
        okxHeartbeat(1000, 2000);

        assertDoesNotThrow(() -> heartbeat.stop());
        assertFalse(heartbeat.isRunning());
    }

    @Test
    void repeatedStartKeepsOneScheduleAndStopHaltsIt() throws InterruptedException {
        AtomicInteger pings = new AtomicInteger();
        okxHeartbeat(100, 5000, pings::incrementAndGet, healthChanges::add);

        heartbeat.start();
        heartbeat.start();
        Thread.sleep(350);
        heartbeat.stop();

        int sent = pings.get();
        assertTrue(sent >= 2 && sent <= 4, "One schedule only, got " + sent);
        assertFalse(heartbeat.isRunning());

        Thread.sleep(300);
        assertEquals(sent, pings.get());
    }
}
