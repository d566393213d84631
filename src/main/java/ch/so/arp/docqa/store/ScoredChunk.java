package ch.so.arp.docqa.store;

/**
 * Search hit returned by {@link VectorStore#search(float[], int, double)}. The
 * similarity is {@code 1 - cosine distance}.
 */
public record ScoredChunk(StoredChunk chunk, double similarity) {

    public String filename() {
        return chunk.filename();
    }

    public String content() {
        return chunk.content();
    }
}
