package in.tradepulse.bootstrap;

import in.tradepulse.config.BotConfig;
import in.tradepulse.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Startup configuration validator.
 *
 * Hard gate: runs before any connection is opened. The first violation
 * throws ConfigurationException and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws ConfigurationException if configuration is invalid
     */
    public static void validate(BotConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        requireNonBlank("TRADING_PAIR", config.tradingPair());

        String url = config.wsUrl();
        if (url == null || !(url.startsWith("wss://") || url.startsWith("ws://"))) {
            throw new ConfigurationException("OKX_WS_URL", "Must be a ws:// or wss:// URL: " + url);
        }

        // Indicators
        requirePositive("EMA_SHORT_PERIOD", config.emaShortPeriod());
        requirePositive("EMA_LONG_PERIOD", config.emaLongPeriod());
        if (config.emaShortPeriod() >= config.emaLongPeriod()) {
            throw new ConfigurationException("EMA_SHORT_PERIOD",
                "Must be less than EMA_LONG_PERIOD (" + config.emaShortPeriod() + " >= " + config.emaLongPeriod() + ")");
        }
        requirePositive("BB_LENGTH", config.bbLength());
        requirePositive("BB_DEVIATION", config.bbDeviation());
        requirePositive("ST_PERIOD", config.stPeriod());
        requirePositive("ST_MULTIPLIER", config.stMultiplier());
        if (config.fractalPeriod() < 3) {
            throw new ConfigurationException("TLBB_FRACTALS_PERIOD", "Must be at least 3: " + config.fractalPeriod());
        }
        log.info("✓ Indicator parameters valid");

        // History must hold what the strategies look back over
        if (config.maxPriceHistory() < config.emaLookback()) {
            throw new ConfigurationException("MAX_PRICE_HISTORY",
                "Must hold at least " + config.emaLookback() + " closes (EMA_LONG_PERIOD + 1), got " + config.maxPriceHistory());
        }
        if (config.maxOhlcHistory() < config.combinedLookback()) {
            throw new ConfigurationException("MAX_OHLC_HISTORY",
                "Must hold at least " + config.combinedLookback() + " bars, got " + config.maxOhlcHistory());
        }
        log.info("✓ History capacity {} closes / {} bars", config.maxPriceHistory(), config.maxOhlcHistory());

        // Connection
        requirePositive("INITIAL_RECONNECT_DELAY", config.initialReconnectDelay());
        requirePositive("MAX_RECONNECT_DELAY", config.maxReconnectDelay());
        if (config.initialReconnectDelay().compareTo(config.maxReconnectDelay()) > 0) {
            throw new ConfigurationException("INITIAL_RECONNECT_DELAY", "Cannot exceed MAX_RECONNECT_DELAY");
        }
        if (config.reconnectMultiplier() < 1.0) {
            throw new ConfigurationException("RECONNECT_MULTIPLIER", "Must be at least 1.0: " + config.reconnectMultiplier());
        }
        requirePositive("MAX_RECONNECT_ATTEMPTS", config.maxReconnectAttempts());
        requirePositive("TIME_SYNC_THRESHOLD", config.timeSyncThreshold());
        requirePositive("PING_INTERVAL_MS", config.pingInterval());
        requirePositive("PONG_TIMEOUT_MS", config.pongTimeout());
        requirePositive("STALE_FEED_MS", config.staleFeedTimeout());
        log.info("✓ Connection settings valid");

        requirePositive("EVENT_QUEUE_CAPACITY", config.eventQueueCapacity());

        // Execution
        requirePositive("TRADE_SIZE", config.tradeSize());
        if (config.tradeCooldown().isNegative()) {
            throw new ConfigurationException("TRADE_COOLDOWN", "Cannot be negative");
        }
        requirePositive("LEVERAGE", config.leverage());
        if (!"cross".equals(config.tradeMode()) && !"isolated".equals(config.tradeMode())) {
            throw new ConfigurationException("TRADE_MODE", "Expected cross or isolated, got " + config.tradeMode());
        }

        if (config.metricsPort() < 0 || config.metricsPort() > 65535) {
            throw new ConfigurationException("METRICS_PORT", "Out of range: " + config.metricsPort());
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void requireNonBlank(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(key, "Is required");
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigurationException(key, "Must be positive: " + value);
        }
    }

    private static void requirePositive(String key, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new ConfigurationException(key, "Must be positive: " + value);
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException(key, "Must be positive: " + value);
        }
    }

    private StartupConfigValidator() {}
}
