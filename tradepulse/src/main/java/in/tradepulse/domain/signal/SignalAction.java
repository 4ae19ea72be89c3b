package in.tradepulse.domain.signal;

/**
 * Signal action.
 */
public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    public boolean isDirectional() {
        return this != HOLD;
    }
}
