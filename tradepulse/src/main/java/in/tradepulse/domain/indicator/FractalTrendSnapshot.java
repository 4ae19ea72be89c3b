package in.tradepulse.domain.indicator;

import java.math.BigDecimal;

/**
 * Fractal detection over the trailing window plus its Bollinger context.
 *
 * pivotHigh / pivotLow are the midpoint bar's high and low.
 */
public record FractalTrendSnapshot(
    boolean highFractal,
    boolean lowFractal,
    BigDecimal pivotHigh,
    BigDecimal pivotLow,
    BollingerBands bands,
    FractalTrend trend
) {}
