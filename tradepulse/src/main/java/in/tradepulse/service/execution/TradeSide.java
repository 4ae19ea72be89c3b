package in.tradepulse.service.execution;

import in.tradepulse.domain.signal.SignalAction;

/**
 * Order side.
 */
public enum TradeSide {
    BUY,
    SELL;

    public static TradeSide fromAction(SignalAction action) {
        return switch (action) {
            case BUY -> BUY;
            case SELL -> SELL;
            case HOLD -> throw new IllegalArgumentException("HOLD has no order side");
        };
    }
}
