package ch.so.arp.docqa.document;

import java.util.Map;

/**
 * Normalized text of an uploaded file plus file level metadata
 * ({@code file_size}, {@code file_extension}).
 */
public record ExtractedText(String text, Map<String, Object> metadata) {

    public ExtractedText {
        metadata = Map.copyOf(metadata);
    }
}
