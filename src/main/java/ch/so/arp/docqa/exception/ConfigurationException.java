package ch.so.arp.docqa.exception;

/**
 * Raised when the application is started with missing credentials or invalid
 * parameters. Not retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
