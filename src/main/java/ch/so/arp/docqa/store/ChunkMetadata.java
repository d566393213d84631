package ch.so.arp.docqa.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reserved metadata keys written for every chunk, plus the merge rule for
 * caller supplied metadata. Callers may override every default except
 * {@link #FILENAME}, which identifies the logical document.
 */
public final class ChunkMetadata {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkMetadata.class);

    public static final String FILENAME = "filename";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String TOTAL_CHUNKS = "total_chunks";
    public static final String CHUNK_SIZE = "chunk_size";
    public static final String TOKEN_COUNT = "token_count";

    /**
     * Keys that describe a single chunk and carry no meaning for the document
     * as a whole.
     */
    public static final Set<String> PER_CHUNK_KEYS = Set.of(CHUNK_INDEX, TOTAL_CHUNKS, CHUNK_SIZE, TOKEN_COUNT);

    private ChunkMetadata() {
    }

    public static Map<String, Object> forChunk(String filename, int chunkIndex, int totalChunks, String content,
            int tokenCount, Map<String, Object> extraMetadata) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FILENAME, filename);
        metadata.put(CHUNK_INDEX, chunkIndex);
        metadata.put(TOTAL_CHUNKS, totalChunks);
        metadata.put(CHUNK_SIZE, content.length());
        metadata.put(TOKEN_COUNT, tokenCount);
        if (extraMetadata != null) {
            extraMetadata.forEach((key, value) -> {
                if (FILENAME.equals(key)) {
                    if (!filename.equals(value)) {
                        LOGGER.warn("Ignoring metadata override of '{}' for document {}", FILENAME, filename);
                    }
                    return;
                }
                metadata.put(key, value);
            });
        }
        return metadata;
    }

    /**
     * Returns the metadata without the per chunk keys, suitable to describe the
     * logical document a chunk belongs to.
     */
    public static Map<String, Object> documentLevel(Map<String, Object> chunkMetadata) {
        Map<String, Object> metadata = new LinkedHashMap<>(chunkMetadata);
        metadata.keySet().removeAll(PER_CHUNK_KEYS);
        return Collections.unmodifiableMap(metadata);
    }
}
