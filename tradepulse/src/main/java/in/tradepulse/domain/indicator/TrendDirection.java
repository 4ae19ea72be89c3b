package in.tradepulse.domain.indicator;

/**
 * Supertrend direction.
 */
public enum TrendDirection {
    UP,
    DOWN
}
