package in.tradepulse.domain.data;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bar duration parsed from a compact label such as "30m", "4h" or "1d".
 */
public final class Timeframe {
    private static final Pattern LABEL = Pattern.compile("(\\d+)([mhd])", Pattern.CASE_INSENSITIVE);

    private final String label;
    private final int amount;
    private final char unit;
    private final Duration duration;

    private Timeframe(String label, int amount, char unit, Duration duration) {
        this.label = label;
        this.amount = amount;
        this.unit = unit;
        this.duration = duration;
    }

    /**
     * Parse a timeframe label.
     *
     * @param label e.g. "1m", "30m", "1h", "1d"
     * @throws IllegalArgumentException if the label is malformed or zero-length
     */
    public static Timeframe parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Timeframe label is required");
        }
        Matcher m = LABEL.matcher(label.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid timeframe: " + label);
        }
        int amount = Integer.parseInt(m.group(1));
        if (amount <= 0) {
            throw new IllegalArgumentException("Timeframe must be positive: " + label);
        }
        char unit = Character.toLowerCase(m.group(2).charAt(0));
        Duration duration = switch (unit) {
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Invalid timeframe unit: " + label);
        };
        return new Timeframe(amount + String.valueOf(unit), amount, unit, duration);
    }

    public Duration duration() {
        return duration;
    }

    public long millis() {
        return duration.toMillis();
    }

    public String label() {
        return label;
    }

    /**
     * Start of the interval containing the given instant (epoch-aligned).
     */
    public Instant floor(Instant instant) {
        long ms = instant.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(ms, millis()) * millis());
    }

    public boolean isAligned(Instant instant) {
        return Math.floorMod(instant.toEpochMilli(), millis()) == 0;
    }

    /**
     * OKX candle channel name, e.g. candle30m, candle1H, candle1D.
     */
    public String candleChannel() {
        String suffix = unit == 'm' ? "m" : String.valueOf(unit).toUpperCase(Locale.ROOT);
        return "candle" + amount + suffix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return duration.equals(((Timeframe) o).duration);
    }

    @Override
    public int hashCode() {
        return duration.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
