package ch.so.arp.docqa.document;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One logical document in the store, aggregated from its chunks.
 *
 * @param metadata the first chunk's metadata without the per chunk keys
 */
public record DocumentOverview(String filename, int chunkCount, OffsetDateTime createdAt,
        Map<String, Object> metadata) {
}
