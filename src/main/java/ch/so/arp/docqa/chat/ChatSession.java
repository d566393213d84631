package ch.so.arp.docqa.chat;

import java.time.OffsetDateTime;

public record ChatSession(long id, String name, OffsetDateTime createdAt, OffsetDateTime updatedAt,
        int messageCount) {
}
