package ch.so.arp.docqa.store;

import java.util.List;
import java.util.Map;

/**
 * Persists chunk content, metadata and embedding and executes similarity
 * queries. All embeddings held by one store instance have the same
 * dimensionality; writes and deletes are visible to the next read.
 */
public interface VectorStore {

    /**
     * Write a single chunk as one atomic record.
     *
     * @param content   the chunk text, must not be blank
     * @param embedding the embedding, must match {@link #dimensions()}
     * @param metadata  chunk metadata, must contain {@link ChunkMetadata#FILENAME}
     * @return the id assigned by the store
     * @throws ch.so.arp.docqa.exception.StoreException on constraint violations or
     *                                                  connectivity failures
     */
    long write(String content, float[] embedding, Map<String, Object> metadata);

    /**
     * Replace every chunk of {@code filename} with {@code chunks} in one
     * transaction. Either all new chunks become visible or the previous state
     * is kept.
     *
     * @return the ids of the new chunks in input order
     */
    List<Long> writeDocument(String filename, List<NewChunk> chunks);

    /**
     * Find the chunks most similar to the query embedding.
     *
     * @param queryEmbedding      the embedded question
     * @param limit               the maximum amount of hits
     * @param similarityThreshold hits must have a similarity strictly greater
     *                            than this value
     * @return hits by descending similarity, ties by ascending id
     */
    List<ScoredChunk> search(float[] queryEmbedding, int limit, double similarityThreshold);

    /**
     * @return the number of deleted chunks, {@code 0} if the filename is unknown
     */
    int deleteByFilename(String filename);

    int deleteAll();

    /**
     * @return every chunk ordered by id
     */
    List<StoredChunk> listAll();

    /**
     * @return the chunks of one document ordered by chunk index
     */
    List<StoredChunk> findByFilename(String filename);

    long count();

    int dimensions();
}
