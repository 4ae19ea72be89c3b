package in.tradepulse.infrastructure.exchange.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Heartbeat manager for keeping the exchange WebSocket alive.
 *
 * Sends a ping every {@code pingInterval} and expects a pong within
 * {@code timeout}. A missed pong, or a ping function that throws, flips the
 * connection to unhealthy and notifies the health callback. The callback is
 * only invoked when health actually changes.
 *
 * One instance serves one physical connection; after {@link #stop()} it
 * cannot be restarted.
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String connectionName;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Consumer<Boolean> healthCallback;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pingTask;
    private volatile ScheduledFuture<?> timeoutTask;
    private volatile Instant startedAt;
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    public HeartbeatManager(String connectionName,
                           Duration pingInterval, Duration timeout,
                           Runnable pingFunction,
                           Consumer<Boolean> healthCallback) {
        this.connectionName = connectionName;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.healthCallback = healthCallback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Heartbeat-" + connectionName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start sending periodic pings.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat manager already running", connectionName);
            return;
        }

        log.info("[{}] Starting heartbeat manager (ping interval: {}ms, timeout: {}ms)",
            connectionName, pingInterval.toMillis(), timeout.toMillis());

        running = true;
        healthy = true;
        startedAt = Instant.now();

        pingTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sendPing();
            } catch (Exception e) {
                log.error("[{}] Failed to send ping", connectionName, e);
                markUnhealthy();
            }
        }, pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop pinging and cancel timeout checks. Shuts the heartbeat thread down.
     */
    public synchronized void stop() {
        if (!running) {
            scheduler.shutdownNow();
            return;
        }

        log.info("[{}] Stopping heartbeat manager", connectionName);
        running = false;

        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }

        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Record receipt of a pong. Resets the timeout and marks the connection healthy.
     */
    public synchronized void recordPong() {
        lastPongTime = Instant.now();

        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }

        if (!healthy) {
            log.info("[{}] Connection recovered, marking as healthy", connectionName);
            markHealthy();
        }
    }

    /**
     * @return true if running, not marked unhealthy, and last pong (or start) is within timeout
     */
    public boolean isHealthy() {
        return healthy && isWithinTimeout();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return Duration since last pong, or null if no pong received
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return null;
        }
        return Duration.between(lastPong, Instant.now());
    }

    private void sendPing() {
        if (!running) {
            return;
        }

        log.debug("[{}] Sending ping", connectionName);

        try {
            pingFunction.run();
        } catch (Exception e) {
            log.warn("[{}] Ping failed: {}", connectionName, e.getMessage());
            markUnhealthy();
            return;
        }

        scheduleTimeoutCheck();
    }

    private synchronized void scheduleTimeoutCheck() {
        if (timeoutTask != null && !timeoutTask.isDone()) {
            // Still waiting for an earlier pong; keep the original deadline
            return;
        }

        timeoutTask = scheduler.schedule(() -> {
            if (isWithinTimeout()) {
                return;
            }

            log.warn("[{}] Heartbeat timeout - no pong received for {}ms",
                connectionName, timeout.toMillis());
            markUnhealthy();

        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isWithinTimeout() {
        Instant reference = lastPongTime != null ? lastPongTime : startedAt;
        if (reference == null) {
            return false;
        }
        return Duration.between(reference, Instant.now()).compareTo(timeout) < 0;
    }

    private void markHealthy() {
        if (healthy) {
            return;
        }

        healthy = true;
        notifyHealth(true);
    }

    private void markUnhealthy() {
        if (!healthy) {
            return;
        }

        healthy = false;
        notifyHealth(false);
    }

    private void notifyHealth(boolean isHealthy) {
        if (healthCallback == null) {
            return;
        }
        try {
            healthCallback.accept(isHealthy);
        } catch (Exception e) {
            log.error("[{}] Health callback threw exception", connectionName, e);
        }
    }
}
