package in.tradepulse.infrastructure.exchange.common;

import in.tradepulse.config.BotConfig;

import java.time.Duration;

/**
 * Reconnection policy with exponential backoff for the exchange stream.
 *
 * After the n-th consecutive failure the delay before reconnecting is
 * initialDelay × multiplier^(n-1), capped at maxDelay. The failure after
 * maxAttempts opens the circuit and no further retry is allowed.
 *
 * Usage:
 * <pre>
 * policy.recordFailure();
 * if (policy.shouldRetry()) {
 *     scheduler.schedule(this::connect, policy.getNextDelay().toMillis(), MILLISECONDS);
 * }
 * // once the exchange acknowledges a subscription:
 * policy.recordSuccess();
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                              double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Check if another reconnect attempt should be made.
     *
     * @return true if retry should be attempted, false if circuit is open
     */
    public synchronized boolean shouldRetry() {
        return !circuitOpen;
    }

    /**
     * Delay before the next reconnect attempt, based on failures recorded so far.
     *
     * @return Duration to wait; initialDelay when no failure has been recorded
     */
    public synchronized Duration getNextDelay() {
        int exponent = Math.max(0, attemptCount - 1);
        double delayMillis = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        return Duration.ofMillis((long) Math.min(delayMillis, (double) maxDelay.toMillis()));
    }

    /**
     * Record a dropped or failed connection.
     */
    public synchronized void recordFailure() {
        attemptCount++;

        if (attemptCount > maxAttempts) {
            circuitOpen = true;
        }
    }

    /**
     * Record a healthy connection (subscription acknowledged).
     * Resets all counters and closes the circuit.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        circuitOpen = false;
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return Number of failures since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy from the connector settings in {@code config}.
     */
    public static ReconnectionPolicy from(BotConfig config) {
        return builder()
            .initialDelay(config.initialReconnectDelay())
            .maxDelay(config.maxReconnectDelay())
            .multiplier(config.reconnectMultiplier())
            .maxAttempts(config.maxReconnectAttempts())
            .build();
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 1.5;
        private int maxAttempts = 10;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
