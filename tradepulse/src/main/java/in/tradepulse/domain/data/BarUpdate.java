package in.tradepulse.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Candle snapshot pushed by the exchange on the candle channel.
 *
 * The exchange re-sends the same openTime while the bar is forming.
 * confirmed is null when the frame did not carry a confirmation flag.
 */
public record BarUpdate(
    Instant openTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    Boolean confirmed
) {
    public boolean isConfirmed() {
        return Boolean.TRUE.equals(confirmed);
    }

    public Bar toBar(Timeframe timeframe) {
        return new Bar(openTime, openTime.plus(timeframe.duration()), open, high, low, close, volume, true);
    }
}
