package in.tradepulse.domain.indicator;

import java.math.BigDecimal;

/**
 * Short/long EMA pair for the current and the preceding bar.
 */
public record EmaCrossSnapshot(
    BigDecimal shortNow,
    BigDecimal longNow,
    BigDecimal shortPrev,
    BigDecimal longPrev
) {
    public boolean isBullishCross() {
        return shortPrev.compareTo(longPrev) <= 0 && shortNow.compareTo(longNow) > 0;
    }

    public boolean isBearishCross() {
        return shortPrev.compareTo(longPrev) >= 0 && shortNow.compareTo(longNow) < 0;
    }
}
