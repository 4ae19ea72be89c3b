package in.tradepulse.service.indicator;

import in.tradepulse.domain.data.Bar;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moving averages and dispersion over a price series.
 *
 * All methods are stateless and never modify the list they are given.
 * Each returns Optional.empty() when the series is shorter than the
 * requested length.
 */
public final class MovingAverages {

    static final int SCALE = 8;
    private static final MathContext SQRT_MC = new MathContext(20, RoundingMode.HALF_UP);

    /**
     * Simple moving average of the trailing {@code length} values.
     */
    public static Optional<BigDecimal> sma(List<BigDecimal> series, int length) {
        requirePositive(length);
        if (series == null || series.size() < length) {
            return Optional.empty();
        }
        return Optional.of(mean(series, series.size() - length, length));
    }

    /**
     * Exponential moving average over the whole series.
     *
     * Smoothing factor 2 / (length + 1), seeded with the SMA of the first
     * {@code length} values.
     */
    public static Optional<BigDecimal> ema(List<BigDecimal> series, int length) {
        requirePositive(length);
        if (series == null || series.size() < length) {
            return Optional.empty();
        }

        BigDecimal alpha = BigDecimal.valueOf(2)
            .divide(BigDecimal.valueOf(length + 1L), SCALE + 4, RoundingMode.HALF_UP);

        BigDecimal ema = mean(series, 0, length);
        for (int i = length; i < series.size(); i++) {
            // ema = ema + alpha * (price - ema)
            ema = series.get(i).subtract(ema).multiply(alpha).add(ema)
                .setScale(SCALE, RoundingMode.HALF_UP);
        }
        return Optional.of(ema);
    }

    /**
     * Population standard deviation of the trailing {@code length} values.
     */
    public static Optional<BigDecimal> stdDev(List<BigDecimal> series, int length) {
        requirePositive(length);
        if (series == null || series.size() < length) {
            return Optional.empty();
        }

        int start = series.size() - length;
        BigDecimal mean = mean(series, start, length);

        BigDecimal sumSq = BigDecimal.ZERO;
        for (int i = start; i < series.size(); i++) {
            BigDecimal diff = series.get(i).subtract(mean);
            sumSq = sumSq.add(diff.multiply(diff));
        }

        BigDecimal variance = sumSq.divide(BigDecimal.valueOf(length), SCALE * 2, RoundingMode.HALF_UP);
        return Optional.of(variance.sqrt(SQRT_MC).setScale(SCALE, RoundingMode.HALF_UP));
    }

    /**
     * Close prices of the given bars, oldest first.
     */
    public static List<BigDecimal> closes(List<Bar> bars) {
        List<BigDecimal> closes = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            closes.add(bar.close());
        }
        return closes;
    }

    private static BigDecimal mean(List<BigDecimal> series, int start, int length) {
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = start; i < start + length; i++) {
            sum = sum.add(series.get(i));
        }
        return sum.divide(BigDecimal.valueOf(length), SCALE, RoundingMode.HALF_UP);
    }

    private static void requirePositive(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Length must be positive: " + length);
        }
    }

    private MovingAverages() {}
}
