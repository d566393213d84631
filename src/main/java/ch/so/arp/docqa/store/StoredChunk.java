package ch.so.arp.docqa.store;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A chunk as persisted by a {@link VectorStore}. Chunks are never edited; the
 * unit of mutation is the logical document identified by {@link #filename()}.
 */
public record StoredChunk(
        long id,
        String content,
        float[] embedding,
        Map<String, Object> metadata,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    public StoredChunk {
        embedding = embedding == null ? null : embedding.clone();
    }

    /**
     * @return a copy of the stored vector
     */
    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    public String filename() {
        Object filename = metadata.get(ChunkMetadata.FILENAME);
        return filename == null ? "" : filename.toString();
    }

    public int chunkIndex() {
        Object index = metadata.get(ChunkMetadata.CHUNK_INDEX);
        return index instanceof Number number ? number.intValue() : Integer.MAX_VALUE;
    }
}
