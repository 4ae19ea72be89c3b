package in.tradepulse.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics for the market data stream, signal engine and execution boundary.
 *
 * Implementations can publish to Prometheus or any other backend.
 */
public interface StreamMetrics {

    /**
     * Record a connection lifecycle event.
     *
     * @param event CONNECTED, SUBSCRIBED, DISCONNECTED, RECONNECT_SCHEDULED, FAILED
     */
    void recordConnectionEvent(String event);

    /**
     * @param connected whether the exchange stream is currently open
     */
    void setConnected(boolean connected);

    /**
     * Record one inbound frame.
     *
     * @param kind decoded frame kind (TICKERS, CANDLES, PONG, ...)
     */
    void recordFrame(String kind);

    /**
     * Record a frame that could not be decoded.
     */
    void recordDecodeError();

    /**
     * Record an error event reported by the exchange.
     */
    void recordExchangeError();

    /**
     * Record a clock skew above threshold.
     *
     * @param skew absolute exchange/local clock difference
     */
    void recordClockSkew(Duration skew);

    /**
     * Record a completed bar.
     *
     * @param source TICKS or EXCHANGE_CANDLES
     */
    void recordBarClosed(String source);

    /**
     * Record a published signal.
     *
     * @param strategy strategy tag
     * @param action BUY or SELL
     */
    void recordSignal(String strategy, String action);

    /**
     * Record a strategy evaluation that threw.
     */
    void recordStrategyFault(String strategy);

    /**
     * Record an event dropped by a lossy channel.
     *
     * @param channel channel name
     */
    void recordDroppedEvent(String channel);

    /**
     * Record an order attempt at the execution boundary.
     *
     * @param side BUY or SELL
     * @param success whether the gateway accepted the order
     * @param latency time until the gateway answered
     */
    void recordOrder(String side, boolean success, Duration latency);

    /**
     * Record a signal the execution boundary did not act on.
     *
     * @param reason COOLDOWN or IN_FLIGHT
     */
    void recordTradeSkipped(String reason);
}
