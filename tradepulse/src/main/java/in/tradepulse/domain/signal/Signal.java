package in.tradepulse.domain.signal;

import in.tradepulse.domain.data.Bar;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Directional trading signal, published once per state transition.
 */
public record Signal(
    SignalAction action,
    BigDecimal price,
    Instant timestamp,
    String strategyTag,
    String timeframe,
    Map<String, Object> supportingIndicators,
    Bar bar
) {
    public Signal {
        supportingIndicators = supportingIndicators == null ? Map.of() : Map.copyOf(supportingIndicators);
    }
}
