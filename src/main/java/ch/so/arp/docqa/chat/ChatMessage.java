package ch.so.arp.docqa.chat;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One turn of a chat session. Assistant messages carry the answer's
 * {@code sources} and {@code confidence} in their metadata.
 */
public record ChatMessage(long id, long sessionId, MessageRole role, String content, Map<String, Object> metadata,
        OffsetDateTime createdAt) {
}
