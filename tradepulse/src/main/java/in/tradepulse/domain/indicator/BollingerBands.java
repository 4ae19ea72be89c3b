package in.tradepulse.domain.indicator;

import java.math.BigDecimal;

/**
 * Bollinger Bands: middle = SMA, upper/lower = SMA ± deviation × StdDev.
 */
public record BollingerBands(
    BigDecimal upper,
    BigDecimal middle,
    BigDecimal lower
) {}
