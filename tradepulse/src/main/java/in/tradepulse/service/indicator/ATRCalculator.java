package in.tradepulse.service.indicator;

import in.tradepulse.domain.data.Bar;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * ATR Calculator - Average True Range from bar data.
 *
 * Calculation Method:
 * - True Range: TR = max(H-L, |H-PC|, |L-PC|)
 * - ATR = simple mean of TR over the trailing {@code period} bars
 *
 * Each TR needs the previous bar's close, so {@code period + 1} bars are required.
 */
public final class ATRCalculator {

    /**
     * Average true range over the trailing {@code period} bars.
     *
     * @param bars   Bars in chronological order (oldest first)
     * @param period ATR period (typically 10 or 14)
     * @return ATR value, or empty if insufficient data
     */
    public static Optional<BigDecimal> averageTrueRange(List<Bar> bars, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }
        if (!hasSufficientData(bars, period)) {
            return Optional.empty();
        }

        BigDecimal sumTR = BigDecimal.ZERO;
        for (int i = bars.size() - period; i < bars.size(); i++) {
            sumTR = sumTR.add(trueRange(bars.get(i), bars.get(i - 1)));
        }

        return Optional.of(sumTR.divide(BigDecimal.valueOf(period), MovingAverages.SCALE, RoundingMode.HALF_UP));
    }

    /**
     * True Range for a bar.
     *
     * TR = max(H - L, |H - PC|, |L - PC|)
     *
     * @param current  Current bar
     * @param previous Previous bar (supplies PC)
     * @return True Range value
     */
    public static BigDecimal trueRange(Bar current, Bar previous) {
        if (current == null || previous == null) {
            throw new IllegalArgumentException("Bars cannot be null");
        }

        BigDecimal high = current.high();
        BigDecimal low = current.low();
        BigDecimal prevClose = previous.close();

        BigDecimal highLow = high.subtract(low);
        BigDecimal highPrevClose = high.subtract(prevClose).abs();
        BigDecimal lowPrevClose = low.subtract(prevClose).abs();

        return highLow.max(highPrevClose).max(lowPrevClose);
    }

    public static boolean hasSufficientData(List<Bar> bars, int period) {
        return bars != null && bars.size() >= period + 1;
    }

    private ATRCalculator() {}
}
