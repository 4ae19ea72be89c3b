package in.tradepulse.service.signal;

import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.data.BoundedSeries;
import in.tradepulse.domain.signal.PositionBias;
import in.tradepulse.domain.signal.SignalAction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Mutable state of the signal engine for one stream.
 *
 * Owned by the {@link SignalStateMachine} and only touched from the thread
 * that delivers completed bars.
 */
public final class TradingState {

    private final BoundedSeries<BigDecimal> closeHistory;
    private final BoundedSeries<Bar> barHistory;
    private Instant lastAppendedOpenTime;
    private SignalAction lastAction = SignalAction.HOLD;
    private PositionBias bias = PositionBias.FLAT;

    public TradingState(int maxPriceHistory, int maxBarHistory) {
        this.closeHistory = new BoundedSeries<>(maxPriceHistory);
        this.barHistory = new BoundedSeries<>(maxBarHistory);
    }

    /**
     * Append a completed bar to both histories.
     *
     * @return false (nothing appended) if the bar is not newer than the last one
     */
    public boolean appendBar(Bar bar) {
        if (lastAppendedOpenTime != null && !bar.openTime().isAfter(lastAppendedOpenTime)) {
            return false;
        }
        closeHistory.add(bar.close());
        barHistory.add(bar);
        lastAppendedOpenTime = bar.openTime();
        return true;
    }

    /**
     * Record a published signal and the position bias it moves to.
     */
    public void recordPublished(SignalAction action, PositionBias newBias) {
        this.lastAction = action;
        this.bias = newBias;
    }

    public List<BigDecimal> closes() {
        return closeHistory.snapshot();
    }

    public List<Bar> bars() {
        return barHistory.snapshot();
    }

    public int barCount() {
        return barHistory.size();
    }

    public Bar lastBar() {
        return barHistory.last();
    }

    public Instant lastAppendedOpenTime() {
        return lastAppendedOpenTime;
    }

    public SignalAction lastAction() {
        return lastAction;
    }

    public PositionBias bias() {
        return bias;
    }
}
