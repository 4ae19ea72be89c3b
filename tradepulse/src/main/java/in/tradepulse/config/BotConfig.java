package in.tradepulse.config;

import in.tradepulse.domain.data.Timeframe;
import in.tradepulse.domain.signal.StrategyType;
import in.tradepulse.service.candle.BarSource;
import in.tradepulse.util.Env;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.function.Function;

/**
 * Immutable runtime configuration, read once at startup.
 */
public record BotConfig(
    String tradingPair,
    Timeframe timeframe,
    StrategyType strategy,
    BarSource barSource,

    int emaShortPeriod,
    int emaLongPeriod,
    int bbLength,
    BigDecimal bbDeviation,
    int stPeriod,
    BigDecimal stMultiplier,
    int fractalPeriod,
    int maxPriceHistory,
    int maxOhlcHistory,

    String wsUrl,
    Duration initialReconnectDelay,
    double reconnectMultiplier,
    int maxReconnectAttempts,
    Duration maxReconnectDelay,
    Duration timeSyncThreshold,
    Duration pingInterval,
    Duration pongTimeout,
    Duration staleFeedTimeout,

    int eventQueueCapacity,

    BigDecimal tradeSize,
    Duration tradeCooldown,
    int leverage,
    String tradeMode,

    int metricsPort
) {
    public static final String DEFAULT_TRADING_PAIR = "BTC-USDT-SWAP";
    public static final String DEFAULT_TIMEFRAME = "30m";
    public static final String DEFAULT_WS_URL = "wss://ws.okx.com:8443/ws/v5/public";

    /**
     * Read configuration from environment variables (falling back to system properties).
     *
     * @throws ConfigurationException if a value is present but malformed
     */
    public static BotConfig fromEnv() {
        return new BotConfig(
            Env.get("TRADING_PAIR", DEFAULT_TRADING_PAIR),
            parse("TIMEFRAME", Env.get("TIMEFRAME", DEFAULT_TIMEFRAME), Timeframe::parse),
            parse("STRATEGY", Env.get("STRATEGY", "COMBINED"), StrategyType::fromString),
            parse("BAR_SOURCE", Env.get("BAR_SOURCE", "TICKS"), BarSource::fromString),

            Env.getInt("EMA_SHORT_PERIOD", 9),
            Env.getInt("EMA_LONG_PERIOD", 21),
            Env.getInt("BB_LENGTH", 20),
            Env.getDecimal("BB_DEVIATION", new BigDecimal("2.0")),
            Env.getInt("ST_PERIOD", 10),
            Env.getDecimal("ST_MULTIPLIER", new BigDecimal("3.0")),
            Env.getInt("TLBB_FRACTALS_PERIOD", 15),
            Env.getInt("MAX_PRICE_HISTORY", 1000),
            Env.getInt("MAX_OHLC_HISTORY", 500),

            Env.get("OKX_WS_URL", DEFAULT_WS_URL),
            Duration.ofMillis(Env.getLong("INITIAL_RECONNECT_DELAY", 1000)),
            Env.getDouble("RECONNECT_MULTIPLIER", 1.5),
            Env.getInt("MAX_RECONNECT_ATTEMPTS", 10),
            Duration.ofMillis(Env.getLong("MAX_RECONNECT_DELAY", 300_000)),
            Duration.ofMillis(Env.getLong("TIME_SYNC_THRESHOLD", 5000)),
            Duration.ofMillis(Env.getLong("PING_INTERVAL_MS", 15_000)),
            Duration.ofMillis(Env.getLong("PONG_TIMEOUT_MS", 30_000)),
            Duration.ofMillis(Env.getLong("STALE_FEED_MS", 120_000)),

            Env.getInt("EVENT_QUEUE_CAPACITY", 1024),

            Env.getDecimal("TRADE_SIZE", new BigDecimal("0.001")),
            Duration.ofMillis(Env.getLong("TRADE_COOLDOWN", 60_000)),
            Env.getInt("LEVERAGE", 5),
            Env.get("TRADE_MODE", "cross"),

            Env.getInt("METRICS_PORT", 0)
        );
    }

    /**
     * Built-in defaults, independent of the process environment.
     */
    public static BotConfig defaults() {
        return new BotConfig(
            DEFAULT_TRADING_PAIR,
            Timeframe.parse(DEFAULT_TIMEFRAME),
            StrategyType.COMBINED,
            BarSource.TICKS,
            9, 21, 20, new BigDecimal("2.0"), 10, new BigDecimal("3.0"), 15, 1000, 500,
            DEFAULT_WS_URL,
            Duration.ofMillis(1000), 1.5, 10, Duration.ofMillis(300_000),
            Duration.ofMillis(5000),
            Duration.ofMillis(15_000), Duration.ofMillis(30_000), Duration.ofMillis(120_000),
            1024,
            new BigDecimal("0.001"), Duration.ofMillis(60_000), 5, "cross",
            0
        );
    }

    public BotConfig withStrategy(StrategyType strategy) {
        return new BotConfig(tradingPair, timeframe, strategy, barSource,
            emaShortPeriod, emaLongPeriod, bbLength, bbDeviation, stPeriod, stMultiplier,
            fractalPeriod, maxPriceHistory, maxOhlcHistory,
            wsUrl, initialReconnectDelay, reconnectMultiplier, maxReconnectAttempts, maxReconnectDelay,
            timeSyncThreshold, pingInterval, pongTimeout, staleFeedTimeout,
            eventQueueCapacity, tradeSize, tradeCooldown, leverage, tradeMode, metricsPort);
    }

    public BotConfig withBarSource(BarSource barSource) {
        return new BotConfig(tradingPair, timeframe, strategy, barSource,
            emaShortPeriod, emaLongPeriod, bbLength, bbDeviation, stPeriod, stMultiplier,
            fractalPeriod, maxPriceHistory, maxOhlcHistory,
            wsUrl, initialReconnectDelay, reconnectMultiplier, maxReconnectAttempts, maxReconnectDelay,
            timeSyncThreshold, pingInterval, pongTimeout, staleFeedTimeout,
            eventQueueCapacity, tradeSize, tradeCooldown, leverage, tradeMode, metricsPort);
    }

    public BotConfig withEmaPeriods(int shortPeriod, int longPeriod) {
        return new BotConfig(tradingPair, timeframe, strategy, barSource,
            shortPeriod, longPeriod, bbLength, bbDeviation, stPeriod, stMultiplier,
            fractalPeriod, maxPriceHistory, maxOhlcHistory,
            wsUrl, initialReconnectDelay, reconnectMultiplier, maxReconnectAttempts, maxReconnectDelay,
            timeSyncThreshold, pingInterval, pongTimeout, staleFeedTimeout,
            eventQueueCapacity, tradeSize, tradeCooldown, leverage, tradeMode, metricsPort);
    }

    public BotConfig withHistoryCapacity(int priceHistory, int ohlcHistory) {
        return new BotConfig(tradingPair, timeframe, strategy, barSource,
            emaShortPeriod, emaLongPeriod, bbLength, bbDeviation, stPeriod, stMultiplier,
            fractalPeriod, priceHistory, ohlcHistory,
            wsUrl, initialReconnectDelay, reconnectMultiplier, maxReconnectAttempts, maxReconnectDelay,
            timeSyncThreshold, pingInterval, pongTimeout, staleFeedTimeout,
            eventQueueCapacity, tradeSize, tradeCooldown, leverage, tradeMode, metricsPort);
    }

    public BotConfig withReconnect(String wsUrl, Duration initialDelay, double multiplier, int maxAttempts) {
        return new BotConfig(tradingPair, timeframe, strategy, barSource,
            emaShortPeriod, emaLongPeriod, bbLength, bbDeviation, stPeriod, stMultiplier,
            fractalPeriod, maxPriceHistory, maxOhlcHistory,
            wsUrl, initialDelay, multiplier, maxAttempts, maxReconnectDelay,
            timeSyncThreshold, pingInterval, pongTimeout, staleFeedTimeout,
            eventQueueCapacity, tradeSize, tradeCooldown, leverage, tradeMode, metricsPort);
    }

    public BotConfig withHeartbeat(Duration pingInterval, Duration pongTimeout, Duration staleFeedTimeout) {
        return new BotConfig(tradingPair, timeframe, strategy, barSource,
            emaShortPeriod, emaLongPeriod, bbLength, bbDeviation, stPeriod, stMultiplier,
            fractalPeriod, maxPriceHistory, maxOhlcHistory,
            wsUrl, initialReconnectDelay, reconnectMultiplier, maxReconnectAttempts, maxReconnectDelay,
            timeSyncThreshold, pingInterval, pongTimeout, staleFeedTimeout,
            eventQueueCapacity, tradeSize, tradeCooldown, leverage, tradeMode, metricsPort);
    }

    /**
     * Minimum closes the EMA strategy needs: one more than the long period,
     * so the previous bar's EMAs exist too.
     */
    public int emaLookback() {
        return emaLongPeriod + 1;
    }

    /**
     * Minimum bars the combined strategy needs.
     */
    public int combinedLookback() {
        return Math.max(stPeriod + 2, Math.max(fractalPeriod, bbLength));
    }

    private static <T> T parse(String key, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key, e.getMessage(), e);
        }
    }
}
