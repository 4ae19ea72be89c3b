package in.tradepulse.config;

/**
 * Thrown when configuration is missing, malformed or inconsistent.
 * Raised before any connection is opened; the process exits with code 1.
 */
public class ConfigurationException extends RuntimeException {

    private final String key;

    public ConfigurationException(String message) {
        super(message);
        this.key = null;
    }

    public ConfigurationException(String key, String message) {
        super(String.format("[%s] %s", key, message));
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(String.format("[%s] %s", key, message), cause);
        this.key = key;
    }

    /**
     * @return offending configuration key, or null for cross-field failures
     */
    public String getKey() {
        return key;
    }
}
