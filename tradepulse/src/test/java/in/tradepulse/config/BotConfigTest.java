package in.tradepulse.config;

import in.tradepulse.domain.data.Timeframe;
import in.tradepulse.domain.signal.StrategyType;
import in.tradepulse.service.candle.BarSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BotConfig loading through system properties (the fallback after environment variables).
 */
class BotConfigTest {

    private static final List<String> KEYS = List.of(
        "TIMEFRAME", "STRATEGY", "BAR_SOURCE", "EMA_SHORT_PERIOD", "EMA_LONG_PERIOD",
        "BB_DEVIATION", "INITIAL_RECONNECT_DELAY", "RECONNECT_MULTIPLIER", "TRADE_MODE");

    @AfterEach
    void tearDown() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void testReadsOverrides() {
        System.setProperty("TIMEFRAME", "1h");
        System.setProperty("STRATEGY", "ema");
        System.setProperty("BAR_SOURCE", "exchange_candles");
        System.setProperty("EMA_SHORT_PERIOD", "5");
        System.setProperty("EMA_LONG_PERIOD", " 13 ");
        System.setProperty("BB_DEVIATION", "2.5");
        System.setProperty("INITIAL_RECONNECT_DELAY", "250");
        System.setProperty("RECONNECT_MULTIPLIER", "2");

        BotConfig config = BotConfig.fromEnv();

        assertEquals(Timeframe.parse("1h"), config.timeframe());
        assertEquals(StrategyType.EMA, config.strategy());
        assertEquals(BarSource.EXCHANGE_CANDLES, config.barSource());
        assertEquals(5, config.emaShortPeriod());
        assertEquals(13, config.emaLongPeriod(), "Values are trimmed");
        assertEquals(new BigDecimal("2.5"), config.bbDeviation());
        assertEquals(Duration.ofMillis(250), config.initialReconnectDelay());
        assertEquals(2.0, config.reconnectMultiplier());
        assertEquals(14, config.emaLookback());
    }

    @Test
    void testMalformedNumberNamesTheKey() {
        System.setProperty("EMA_SHORT_PERIOD", "nine");

        ConfigurationException e = assertThrows(ConfigurationException.class, BotConfig::fromEnv);

        assertEquals("EMA_SHORT_PERIOD", e.getKey());
        assertTrue(e.getMessage().contains("nine"));
    }

    @Test
    void testMalformedEnumsAndTimeframes() {
        System.setProperty("TIMEFRAME", "7x");
        assertEquals("TIMEFRAME", assertThrows(ConfigurationException.class, BotConfig::fromEnv).getKey());
        System.clearProperty("TIMEFRAME");

        System.setProperty("STRATEGY", "MACD");
        assertEquals("STRATEGY", assertThrows(ConfigurationException.class, BotConfig::fromEnv).getKey());
        System.clearProperty("STRATEGY");

        System.setProperty("BAR_SOURCE", "trades");
        assertEquals("BAR_SOURCE", assertThrows(ConfigurationException.class, BotConfig::fromEnv).getKey());
    }

    @Test
    void testDefaults() {
        BotConfig config = BotConfig.defaults();

        assertEquals(BotConfig.DEFAULT_TRADING_PAIR, config.tradingPair());
        assertEquals(Duration.ofMinutes(30), config.timeframe().duration());
        assertEquals(StrategyType.COMBINED, config.strategy());
        assertEquals(1.5, config.reconnectMultiplier());
        assertEquals(Math.max(10 + 2, Math.max(15, 20)), config.combinedLookback());
    }

    @Test
    void testCopyHelpers() {
        BotConfig config = BotConfig.defaults()
            .withEmaPeriods(3, 8)
            .withHistoryCapacity(40, 30)
            .withReconnect("ws://localhost:9/ws", Duration.ofMillis(5), 1.0, 2);

        assertEquals(3, config.emaShortPeriod());
        assertEquals(8, config.emaLongPeriod());
        assertEquals(40, config.maxPriceHistory());
        assertEquals(30, config.maxOhlcHistory());
        assertEquals("ws://localhost:9/ws", config.wsUrl());
        assertEquals(2, config.maxReconnectAttempts());
        assertEquals(BotConfig.DEFAULT_TRADING_PAIR, config.tradingPair(), "Other fields are kept");
    }
}
