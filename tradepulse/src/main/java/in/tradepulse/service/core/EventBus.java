package in.tradepulse.service.core;

import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.ClockSkewWarning;
import in.tradepulse.domain.data.Tick;
import in.tradepulse.domain.signal.Signal;
import in.tradepulse.infrastructure.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process event distribution.
 *
 * Market data channels are lossy: under pressure a subscriber sees the
 * latest ticks, not all of them. Bars, signals and alerts are lossless.
 */
public final class EventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final EventChannel<Tick> ticks;
    private final EventChannel<BarUpdate> barUpdates;
    private final EventChannel<Bar> bars;
    private final EventChannel<Signal> signals;
    private final EventChannel<ClockSkewWarning> alerts;

    public EventBus(int queueCapacity, StreamMetrics metrics) {
        this.ticks = new EventChannel<>("ticks", EventChannel.Delivery.LOSSY, queueCapacity, metrics);
        this.barUpdates = new EventChannel<>("barUpdates", EventChannel.Delivery.LOSSY, queueCapacity, metrics);
        this.bars = new EventChannel<>("bars", EventChannel.Delivery.LOSSLESS, queueCapacity, metrics);
        this.signals = new EventChannel<>("signals", EventChannel.Delivery.LOSSLESS, queueCapacity, metrics);
        this.alerts = new EventChannel<>("alerts", EventChannel.Delivery.LOSSLESS, queueCapacity, metrics);
    }

    public EventChannel<Tick> ticks() {
        return ticks;
    }

    public EventChannel<BarUpdate> barUpdates() {
        return barUpdates;
    }

    public EventChannel<Bar> bars() {
        return bars;
    }

    public EventChannel<Signal> signals() {
        return signals;
    }

    public EventChannel<ClockSkewWarning> alerts() {
        return alerts;
    }

    /**
     * Stop all dispatchers.
     */
    @Override
    public void close() {
        ticks.close();
        barUpdates.close();
        bars.close();
        signals.close();
        alerts.close();
        log.info("[EVENT BUS] Closed");
    }
}
