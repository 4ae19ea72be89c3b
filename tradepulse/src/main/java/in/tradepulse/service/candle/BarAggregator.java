package in.tradepulse.service.candle;

import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.data.BarUpdate;
import in.tradepulse.domain.data.Tick;
import in.tradepulse.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * BarAggregator - Build fixed-interval bars for one instrument.
 *
 * Two inputs, one per bar source:
 * - {@link #onTick(Tick)}: bars are built locally. Bar boundaries follow the
 *   local clock, aligned to epoch multiples of the timeframe. Volume counts
 *   the ticks folded in after the one that opened the bar.
 * - {@link #onBarUpdate(BarUpdate)}: bars come from the exchange candle
 *   channel. The newest unconfirmed snapshot is held until it is confirmed
 *   or superseded by a newer openTime.
 *
 * Emitted bars have strictly increasing openTime. A gap spanning several
 * boundaries closes only the stale bar; the skipped intervals are not
 * filled in.
 */
public final class BarAggregator {
    private static final Logger log = LoggerFactory.getLogger(BarAggregator.class);

    private final String symbol;
    private final Timeframe timeframe;
    private final Clock clock;
    private final Consumer<Bar> barListener;

    private PartialBar partial;
    private BarUpdate pending;
    private Instant lastEmittedOpenTime;

    public BarAggregator(String symbol, Timeframe timeframe, Clock clock, Consumer<Bar> barListener) {
        this.symbol = symbol;
        this.timeframe = timeframe;
        this.clock = clock;
        this.barListener = barListener;
    }

    /**
     * Fold a tick into the in-progress bar, closing it first if its interval has elapsed.
     */
    public synchronized void onTick(Tick tick) {
        BigDecimal price = tick.price();
        Instant now = clock.instant();

        if (partial == null) {
            partial = new PartialBar(timeframe.floor(now), price);
            log.debug("[AGGREGATOR] {} opened {} bar at {}", symbol, timeframe, partial.openTime);
            return;
        }

        Instant boundary = partial.openTime.plus(timeframe.duration());
        if (!now.isBefore(boundary)) {
            checkGap(boundary, now);
            Bar completed = partial.freeze(timeframe);
            partial = new PartialBar(boundary, price);
            emit(completed);
            return;
        }

        partial.high = partial.high.max(price);
        partial.low = partial.low.min(price);
        partial.close = price;
        partial.volume = partial.volume.add(BigDecimal.ONE);
    }

    /**
     * Accept an exchange candle snapshot.
     */
    public synchronized void onBarUpdate(BarUpdate update) {
        Instant openTime = update.openTime();

        if (!timeframe.isAligned(openTime)) {
            log.warn("[AGGREGATOR] {} rejecting candle with openTime {} not aligned to {}", symbol, openTime, timeframe);
            return;
        }
        if (lastEmittedOpenTime != null && !openTime.isAfter(lastEmittedOpenTime)) {
            log.debug("[AGGREGATOR] {} dropping candle {} (last emitted {})", symbol, openTime, lastEmittedOpenTime);
            return;
        }

        if (pending != null) {
            if (openTime.isBefore(pending.openTime())) {
                log.debug("[AGGREGATOR] {} dropping out-of-order candle {} (pending {})", symbol, openTime, pending.openTime());
                return;
            }
            if (openTime.isAfter(pending.openTime())) {
                // A newer interval started; the pending one will not change again
                BarUpdate superseded = pending;
                pending = null;
                emit(superseded.toBar(timeframe));
            }
        }

        if (update.isConfirmed()) {
            pending = null;
            emit(update.toBar(timeframe));
        } else {
            pending = update;
        }
    }

    /**
     * Snapshot of the in-progress bar, marked incomplete.
     */
    public synchronized Optional<Bar> currentBar() {
        if (partial == null) {
            return Optional.empty();
        }
        return Optional.of(partial.snapshot(timeframe));
    }

    public synchronized Optional<Instant> lastEmittedOpenTime() {
        return Optional.ofNullable(lastEmittedOpenTime);
    }

    public Timeframe timeframe() {
        return timeframe;
    }

    private void checkGap(Instant boundary, Instant now) {
        Instant expectedClose = boundary.plus(timeframe.duration());
        if (!now.isBefore(expectedClose)) {
            long skipped = (now.toEpochMilli() - boundary.toEpochMilli()) / timeframe.millis();
            log.info("[AGGREGATOR] Gap detected for {} {}: {} interval(s) without ticks since {}",
                symbol, timeframe, skipped, boundary);
        }
    }

    private void emit(Bar bar) {
        if (lastEmittedOpenTime != null && !bar.openTime().isAfter(lastEmittedOpenTime)) {
            log.warn("[AGGREGATOR] {} suppressing bar {} (last emitted {})", symbol, bar.openTime(), lastEmittedOpenTime);
            return;
        }
        lastEmittedOpenTime = bar.openTime();
        log.debug("[AGGREGATOR] Closed {} bar: {} @ {} close={}", timeframe, symbol, bar.openTime(), bar.close());
        barListener.accept(bar);
    }

    /**
     * Mutable bar under construction.
     */
    private static final class PartialBar {
        final Instant openTime;
        final BigDecimal open;
        BigDecimal high;
        BigDecimal low;
        BigDecimal close;
        BigDecimal volume;

        PartialBar(Instant openTime, BigDecimal price) {
            this.openTime = openTime;
            this.open = price;
            this.high = price;
            this.low = price;
            this.close = price;
            this.volume = BigDecimal.ZERO;
        }

        Bar freeze(Timeframe timeframe) {
            return new Bar(openTime, openTime.plus(timeframe.duration()), open, high, low, close, volume, true);
        }

        Bar snapshot(Timeframe timeframe) {
            return new Bar(openTime, openTime.plus(timeframe.duration()), open, high, low, close, volume, false);
        }
    }
}
