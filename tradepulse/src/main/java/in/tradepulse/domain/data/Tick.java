package in.tradepulse.domain.data;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Real-time ticker update for the traded instrument.
 *
 * exchangeTimestamp is the server time reported in the frame,
 * localTimestamp is the wall-clock time the frame was decoded.
 */
public record Tick(
    String symbol,
    BigDecimal price,
    BigDecimal volume,
    Instant exchangeTimestamp,
    Instant localTimestamp
) {
    /**
     * Absolute difference between exchange and local clocks for this tick.
     */
    public Duration clockSkew() {
        return Duration.between(exchangeTimestamp, localTimestamp).abs();
    }
}
