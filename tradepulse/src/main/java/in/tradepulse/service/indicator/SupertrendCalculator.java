package in.tradepulse.service.indicator;

import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.indicator.SupertrendSnapshot;
import in.tradepulse.domain.indicator.TrendDirection;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Supertrend - ATR band trend follower.
 *
 * Basic bands for a bar are median ± multiplier × ATR(period). The trend flips
 * UP when the latest close is above the preceding bar's upper band and DOWN
 * when it is below the preceding bar's lower band; otherwise the previous
 * trend is carried forward.
 *
 * The previous trend is the only state this calculator keeps. One instance
 * must be fed the bar history of one stream, in order.
 */
public class SupertrendCalculator {

    private final int period;
    private final BigDecimal multiplier;
    private TrendDirection previousTrend;

    public SupertrendCalculator(int period, BigDecimal multiplier) {
        this(period, multiplier, TrendDirection.UP);
    }

    public SupertrendCalculator(int period, BigDecimal multiplier, TrendDirection initialTrend) {
        if (period <= 0) {
            throw new IllegalArgumentException("Supertrend period must be positive: " + period);
        }
        if (multiplier == null || multiplier.signum() <= 0) {
            throw new IllegalArgumentException("Supertrend multiplier must be positive");
        }
        this.period = period;
        this.multiplier = multiplier;
        this.previousTrend = initialTrend;
    }

    /**
     * Compute the Supertrend for the latest bar and update the trend memo.
     *
     * @param bars Bars oldest first; needs at least period + 2
     * @return snapshot, or empty (memo untouched) if insufficient data
     */
    public Optional<SupertrendSnapshot> calculate(List<Bar> bars) {
        if (bars == null || bars.size() < minimumBars()) {
            return Optional.empty();
        }

        List<Bar> previousBars = bars.subList(0, bars.size() - 1);
        BigDecimal atrNow = ATRCalculator.averageTrueRange(bars, period).orElseThrow();
        BigDecimal atrPrev = ATRCalculator.averageTrueRange(previousBars, period).orElseThrow();

        Bar last = bars.get(bars.size() - 1);
        Bar prev = bars.get(bars.size() - 2);

        BigDecimal upperNow = upperBand(last, atrNow);
        BigDecimal lowerNow = lowerBand(last, atrNow);
        BigDecimal upperPrev = upperBand(prev, atrPrev);
        BigDecimal lowerPrev = lowerBand(prev, atrPrev);

        BigDecimal close = last.close();
        TrendDirection trend;
        if (close.compareTo(upperPrev) > 0) {
            trend = TrendDirection.UP;
        } else if (close.compareTo(lowerPrev) < 0) {
            trend = TrendDirection.DOWN;
        } else {
            trend = previousTrend;
        }
        previousTrend = trend;

        return Optional.of(new SupertrendSnapshot(trend, atrNow, upperNow, lowerNow));
    }

    public int minimumBars() {
        return period + 2;
    }

    public TrendDirection previousTrend() {
        return previousTrend;
    }

    private BigDecimal upperBand(Bar bar, BigDecimal atr) {
        return bar.median().add(multiplier.multiply(atr)).setScale(MovingAverages.SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal lowerBand(Bar bar, BigDecimal atr) {
        return bar.median().subtract(multiplier.multiply(atr)).setScale(MovingAverages.SCALE, RoundingMode.HALF_UP);
    }
}
