package in.tradepulse.domain.indicator;

/**
 * Trend classification from fractal position and Bollinger middle band.
 */
public enum FractalTrend {
    STRONGLY_BULLISH(2),
    BULLISH(1),
    NEUTRAL(0),
    BEARISH(-1),
    STRONGLY_BEARISH(-2);

    private final int score;

    FractalTrend(int score) {
        this.score = score;
    }

    public boolean isBullish() {
        return score > 0;
    }

    public boolean isBearish() {
        return score < 0;
    }

    /**
     * Map a score in [-2, 2] to its classification. Out-of-range scores are clamped.
     */
    public static FractalTrend fromScore(int score) {
        if (score >= 2) return STRONGLY_BULLISH;
        if (score <= -2) return STRONGLY_BEARISH;
        return switch (score) {
            case 1 -> BULLISH;
            case -1 -> BEARISH;
            default -> NEUTRAL;
        };
    }
}
