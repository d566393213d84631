package ch.so.arp.docqa.exception;

/**
 * Raised when the embedding service or the generative model cannot be reached
 * or answers with something that cannot be used.
 */
public class ProviderException extends RuntimeException {

    private final String userMessage;

    public ProviderException(String message) {
        super(message);
        this.userMessage = "The AI service is temporarily unavailable. Please try again later.";
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.userMessage = "The AI service is temporarily unavailable. Please try again later.";
    }

    public String getUserMessage() {
        return userMessage;
    }
}
