package in.tradepulse.service.indicator;

import in.tradepulse.domain.data.Bar;
import in.tradepulse.domain.indicator.BollingerBands;
import in.tradepulse.domain.indicator.FractalTrend;
import in.tradepulse.domain.indicator.FractalTrendSnapshot;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Fractal trend detector.
 *
 * The midpoint bar of the trailing {@code fractalPeriod}-wide window is a high
 * fractal if its high is strictly above every other high in the window, and a
 * low fractal if its low is strictly below every other low.
 *
 * Classification score:
 *   +1 low fractal (support formed), -1 high fractal (resistance formed),
 *   +1 close above Bollinger middle, -1 close below it.
 *   +2 STRONGLY_BULLISH ... -2 STRONGLY_BEARISH.
 */
public class FractalTrendDetector {

    private final int fractalPeriod;
    private final int bollingerLength;
    private final BigDecimal bollingerDeviation;

    public FractalTrendDetector(int fractalPeriod, int bollingerLength, BigDecimal bollingerDeviation) {
        if (fractalPeriod < 3) {
            throw new IllegalArgumentException("Fractal period must be at least 3: " + fractalPeriod);
        }
        this.fractalPeriod = fractalPeriod;
        this.bollingerLength = bollingerLength;
        this.bollingerDeviation = bollingerDeviation;
    }

    /**
     * Classify the trend at the latest bar.
     *
     * @param bars Bars oldest first
     * @return snapshot, or empty if insufficient data
     */
    public Optional<FractalTrendSnapshot> detect(List<Bar> bars) {
        if (bars == null || bars.size() < minimumBars()) {
            return Optional.empty();
        }

        List<Bar> window = bars.subList(bars.size() - fractalPeriod, bars.size());
        int mid = fractalPeriod / 2;
        boolean highFractal = isHighFractal(window, mid);
        boolean lowFractal = isLowFractal(window, mid);

        Optional<BollingerBands> bands = BollingerCalculator.calculate(
            MovingAverages.closes(bars), bollingerLength, bollingerDeviation);
        if (bands.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal close = bars.get(bars.size() - 1).close();
        int score = 0;
        if (lowFractal) score++;
        if (highFractal) score--;
        int vsMiddle = close.compareTo(bands.get().middle());
        if (vsMiddle > 0) score++;
        if (vsMiddle < 0) score--;

        Bar pivot = window.get(mid);
        return Optional.of(new FractalTrendSnapshot(
            highFractal,
            lowFractal,
            pivot.high(),
            pivot.low(),
            bands.get(),
            FractalTrend.fromScore(score)
        ));
    }

    public int minimumBars() {
        return Math.max(fractalPeriod, bollingerLength);
    }

    static boolean isHighFractal(List<Bar> window, int mid) {
        BigDecimal pivot = window.get(mid).high();
        for (int i = 0; i < window.size(); i++) {
            if (i == mid) continue;
            if (pivot.compareTo(window.get(i).high()) <= 0) return false;
        }
        return true;
    }

    static boolean isLowFractal(List<Bar> window, int mid) {
        BigDecimal pivot = window.get(mid).low();
        for (int i = 0; i < window.size(); i++) {
            if (i == mid) continue;
            if (pivot.compareTo(window.get(i).low()) >= 0) return false;
        }
        return true;
    }
}
