package ch.so.arp.docqa.store;

import java.util.Map;

/**
 * Chunk staged for a write, before the store has assigned an id.
 */
public record NewChunk(String content, float[] embedding, Map<String, Object> metadata) {
}
