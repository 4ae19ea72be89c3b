package in.tradepulse.service;

import in.tradepulse.config.BotConfig;
import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.Tick;
import in.tradepulse.infrastructure.exchange.MarketDataListener;
import in.tradepulse.infrastructure.metrics.StreamMetrics;
import in.tradepulse.service.candle.BarAggregator;
import in.tradepulse.service.candle.BarSource;
import in.tradepulse.service.core.EventBus;
import in.tradepulse.service.signal.SignalStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Synchronous path from decoded market data to signals:
 * tick or candle → bar aggregator → completed bar → bars channel + signal state machine.
 *
 * Only the configured bar source feeds the aggregator; the other input is ignored.
 */
public final class MarketDataPipeline implements MarketDataListener {
    private static final Logger log = LoggerFactory.getLogger(MarketDataPipeline.class);

    private final String symbol;
    private final BarSource barSource;
    private final BarAggregator aggregator;
    private final SignalStateMachine stateMachine;
    private final MarketDataCache marketDataCache;
    private final EventBus eventBus;
    private final StreamMetrics metrics;

    public MarketDataPipeline(BotConfig config, Clock clock, SignalStateMachine stateMachine,
                              MarketDataCache marketDataCache, EventBus eventBus, StreamMetrics metrics) {
        this.symbol = config.tradingPair();
        this.barSource = config.barSource();
        this.stateMachine = stateMachine;
        this.marketDataCache = marketDataCache;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.aggregator = new BarAggregator(symbol, config.timeframe(), clock, this::onBarClosed);
    }

    @Override
    public void onTick(Tick tick) {
        if (tick.symbol() != null && !symbol.equals(tick.symbol())) {
            log.debug("[PIPELINE] Ignoring tick for {}", tick.symbol());
            return;
        }
        marketDataCache.updateTick(symbol, tick.price(), tick.exchangeTimestamp());
        if (barSource == BarSource.TICKS) {
            aggregator.onTick(tick);
        }
    }

    @Override
    public void onBarUpdate(BarUpdate update) {
        if (barSource == BarSource.EXCHANGE_CANDLES) {
            aggregator.onBarUpdate(update);
        }
    }

    void onBarClosed(Bar bar) {
        metrics.recordBarClosed(barSource.name());
        eventBus.bars().publish(bar);
        stateMachine.onBar(bar);
    }

    public BarAggregator aggregator() {
        return aggregator;
    }
}
