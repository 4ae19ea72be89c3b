package in.tradepulse.domain.indicator;

import java.math.BigDecimal;

/**
 * Supertrend result for the latest bar.
 */
public record SupertrendSnapshot(
    TrendDirection trend,
    BigDecimal atr,
    BigDecimal upperBand,
    BigDecimal lowerBand
) {
    public boolean isUp() {
        return trend == TrendDirection.UP;
    }

    public boolean isDown() {
        return trend == TrendDirection.DOWN;
    }
}
