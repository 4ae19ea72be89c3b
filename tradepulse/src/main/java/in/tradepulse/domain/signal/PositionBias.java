package in.tradepulse.domain.signal;

/**
 * Current position bias tracked by the signal state machine.
 */
public enum PositionBias {
    FLAT,
    LONG,
    SHORT
}
