package ch.so.arp.docqa.chat;

import java.util.List;

public record ChatSessionDetails(ChatSession session, List<ChatMessage> messages) {
}
