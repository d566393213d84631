package ch.so.arp.docqa.exception;

/**
 * Raised when the vector store rejects a write or cannot be reached. A failed
 * write or delete leaves the store in the state it had before the call.
 */
public class StoreException extends RuntimeException {

    private final String userMessage;

    public StoreException(String message) {
        super(message);
        this.userMessage = "The document store is temporarily unavailable. Please try again.";
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        this.userMessage = "The document store is temporarily unavailable. Please try again.";
    }

    public String getUserMessage() {
        return userMessage;
    }
}
