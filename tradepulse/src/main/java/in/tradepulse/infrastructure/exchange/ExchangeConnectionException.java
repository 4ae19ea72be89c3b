package in.tradepulse.infrastructure.exchange;

/**
 * Exception thrown when the exchange stream cannot be opened or drops.
 * Triggers reconnect with backoff.
 */
public class ExchangeConnectionException extends RuntimeException {

    private final String exchange;
    private final String instrument;

    public ExchangeConnectionException(String exchange, String instrument, String message) {
        super(String.format("[%s:%s] %s", exchange, instrument, message));
        this.exchange = exchange;
        this.instrument = instrument;
    }

    public ExchangeConnectionException(String exchange, String instrument, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", exchange, instrument, message), cause);
        this.exchange = exchange;
        this.instrument = instrument;
    }

    public String getExchange() {
        return exchange;
    }

    public String getInstrument() {
        return instrument;
    }
}
