package in.tradepulse.service.candle;

import java.util.Locale;

/**
 * Where completed bars come from.
 */
public enum BarSource {
    /** Bars are built locally from ticker updates. */
    TICKS,

    /** Bars are taken from the exchange candle channel. */
    EXCHANGE_CANDLES;

    public static BarSource fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Bar source is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown bar source: " + value + " (expected TICKS or EXCHANGE_CANDLES)");
        }
    }
}
