package in.tradepulse.domain.data;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * OHLCV bar for one timeframe interval.
 *
 * openTime is always aligned to the timeframe; closeTime = openTime + timeframe.
 * Instances are immutable; the aggregator freezes its in-progress bar into one of these.
 */
public record Bar(
    Instant openTime,
    Instant closeTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    boolean complete
) {
    private static final MathContext MC = new MathContext(10, RoundingMode.HALF_UP);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Midpoint of the bar's range: (high + low) / 2.
     */
    public BigDecimal median() {
        return high.add(low).divide(TWO, MC);
    }
}
