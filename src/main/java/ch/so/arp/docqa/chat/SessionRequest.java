package ch.so.arp.docqa.chat;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload to create or rename a chat session.
 */
public record SessionRequest(@NotBlank @Size(max = 200) String name) {
}
