package in.tradepulse.infrastructure.exchange;

/**
 * All reconnect attempts failed. Fatal: the process exits with code 2.
 */
public class ReconnectExhaustedException extends RuntimeException {

    private final int attempts;

    public ReconnectExhaustedException(String url, int attempts, Throwable lastFailure) {
        super(String.format("Giving up on %s after %d failed reconnect attempts", url, attempts), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
