package ch.so.arp.docqa.document;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;

/**
 * JSON body for ingesting text that was extracted elsewhere.
 */
public record IngestTextRequest(@NotBlank String filename, @NotBlank String content, Map<String, Object> metadata) {
}
