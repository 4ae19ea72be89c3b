package in.tradepulse.domain.signal;

import java.util.Locale;

/**
 * Strategy selector. Chosen once at startup.
 */
public enum StrategyType {
    /** EMA short/long crossover. */
    EMA,

    /** Supertrend combined with fractal/Bollinger trend classification. */
    COMBINED;

    public static StrategyType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Strategy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown strategy: " + value + " (expected EMA or COMBINED)");
        }
    }
}
