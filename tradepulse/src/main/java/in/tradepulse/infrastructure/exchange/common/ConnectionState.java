package in.tradepulse.infrastructure.exchange.common;

/**
 * Lifecycle of the exchange stream connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Waiting out the reconnect delay. */
    BACKING_OFF,
    /** Reconnect attempts exhausted. Terminal. */
    FAILED;

    public boolean isTerminal() {
        return this == FAILED;
    }
}
