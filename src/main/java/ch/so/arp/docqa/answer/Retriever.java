package ch.so.arp.docqa.answer;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import ch.so.arp.docqa.config.RagProperties;
import ch.so.arp.docqa.embedding.EmbeddingProvider;
import ch.so.arp.docqa.exception.ValidationException;
import ch.so.arp.docqa.store.ScoredChunk;
import ch.so.arp.docqa.store.VectorStore;

/**
 * Embeds a question and fetches the most similar chunks from the
 * {@link VectorStore}. The store's ranking is returned unchanged.
 */
@Service
public class Retriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(Retriever.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final int defaultTopK;
    private final double defaultSimilarityThreshold;

    public Retriever(EmbeddingProvider embeddingProvider, VectorStore vectorStore, RagProperties properties) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider must not be null");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore must not be null");
        this.defaultTopK = properties.getRetrieval().getTopK();
        this.defaultSimilarityThreshold = properties.getRetrieval().getSimilarityThreshold();
    }

    public RetrievalResult retrieve(String question) {
        return retrieve(question, null, null);
    }

    /**
     * @param topK                maximum number of chunks, the configured default
     *                            when {@code null}
     * @param similarityThreshold minimum similarity (exclusive), the configured
     *                            default when {@code null}
     */
    public RetrievalResult retrieve(String question, Integer topK, Double similarityThreshold) {
        if (!StringUtils.hasText(question)) {
            throw new ValidationException("Question must not be blank");
        }
        int limit = topK != null ? topK : defaultTopK;
        double threshold = similarityThreshold != null ? similarityThreshold : defaultSimilarityThreshold;
        if (limit < 1) {
            throw new ValidationException("topK must be at least 1");
        }
        if (threshold < 0.0 || threshold > 1.0 || Double.isNaN(threshold)) {
            throw new ValidationException("similarityThreshold must be between 0 and 1");
        }

        float[] queryEmbedding = embeddingProvider.embed(question);
        List<ScoredChunk> hits = vectorStore.search(queryEmbedding, limit, threshold);
        LOGGER.debug("Retrieved {} chunks (topK={}, threshold={})", hits.size(), limit, threshold);
        return RetrievalResult.of(hits);
    }
}
