package in.tradepulse.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of the latest traded price per symbol.
 */
public final class MarketDataCache {
    private static final Logger log = LoggerFactory.getLogger(MarketDataCache.class);

    private final ConcurrentHashMap<String, TickData> latestTicks = new ConcurrentHashMap<>();

    public void updateTick(String symbol, BigDecimal lastPrice, Instant timestamp) {
        latestTicks.put(symbol, new TickData(lastPrice, timestamp));
        log.trace("Updated tick cache: {} = {} @ {}", symbol, lastPrice, timestamp);
    }

    public Optional<TickData> getLatestTick(String symbol) {
        return Optional.ofNullable(latestTicks.get(symbol));
    }

    public Optional<BigDecimal> getLastPrice(String symbol) {
        return getLatestTick(symbol).map(TickData::lastPrice);
    }

    public record TickData(BigDecimal lastPrice, Instant timestamp) {}
}
