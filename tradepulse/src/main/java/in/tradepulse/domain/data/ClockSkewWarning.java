package in.tradepulse.domain.data;

import java.time.Duration;
import java.time.Instant;

/**
 * Raised when an exchange timestamp drifts from the local clock by more than
 * the configured threshold. Informational; the tick is still processed.
 */
public record ClockSkewWarning(
    String symbol,
    Duration skew,
    Duration threshold,
    Instant exchangeTimestamp,
    Instant localTimestamp
) {
    public static ClockSkewWarning of(Tick tick, Duration threshold) {
        return new ClockSkewWarning(
            tick.symbol(),
            tick.clockSkew(),
            threshold,
            tick.exchangeTimestamp(),
            tick.localTimestamp()
        );
    }
}
