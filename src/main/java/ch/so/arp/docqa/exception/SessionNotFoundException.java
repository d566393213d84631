package ch.so.arp.docqa.exception;

/** Exception thrown when a chat session does not exist. */
public class SessionNotFoundException extends RuntimeException {

    private final long sessionId;

    public SessionNotFoundException(long sessionId) {
        super("Chat session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public long getSessionId() {
        return sessionId;
    }
}
