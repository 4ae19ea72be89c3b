package in.tradepulse.service.indicator;

import in.tradepulse.domain.indicator.BollingerBands;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Bollinger Bands: SMA(length) ± deviation × StdDev(length).
 */
public final class BollingerCalculator {

    public static Optional<BollingerBands> calculate(List<BigDecimal> series, int length, BigDecimal deviation) {
        Optional<BigDecimal> sma = MovingAverages.sma(series, length);
        Optional<BigDecimal> sd = MovingAverages.stdDev(series, length);
        if (sma.isEmpty() || sd.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal middle = sma.get();
        BigDecimal offset = sd.get().multiply(deviation).setScale(MovingAverages.SCALE, RoundingMode.HALF_UP);

        return Optional.of(new BollingerBands(middle.add(offset), middle, middle.subtract(offset)));
    }

    private BollingerCalculator() {}
}
