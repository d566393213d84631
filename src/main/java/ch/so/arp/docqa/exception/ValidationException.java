package ch.so.arp.docqa.exception;

/** Bad input, rejected before any provider or store call. */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
