package ch.so.arp.docqa.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Strategy abstraction used to compute embeddings for chunks and questions.
 * Implementations can either call a remote embedding API or provide
 * deterministic placeholders that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws ch.so.arp.docqa.exception.ProviderException if the provider fails
     */
    float[] embed(String text);

    /**
     * Create one embedding per input text, preserving the input order.
     * Implementations backed by a remote API should send the texts in as few
     * calls as possible.
     *
     * @param texts the texts to embed
     * @return the embeddings in input order
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embed(text));
        }
        return embeddings;
    }

    /**
     * @return the dimensionality of every vector this provider returns
     */
    int dimensions();
}
