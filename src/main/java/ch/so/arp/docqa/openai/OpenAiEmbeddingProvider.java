package ch.so.arp.docqa.openai;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.docqa.embedding.EmbeddingProvider;
import ch.so.arp.docqa.exception.ProviderException;

/**
 * {@link EmbeddingProvider} calling the OpenAI {@code /embeddings} endpoint.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final OpenAiHttpClient client;
    private final int dimensions;

    public OpenAiEmbeddingProvider(OpenAiHttpClient client, int dimensions) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        for (String text : texts) {
            if (text == null) {
                throw new IllegalArgumentException("texts must not contain null");
            }
        }
        int batchSize = Math.max(1, client.properties().getEmbeddingBatchSize());
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
            embeddings.addAll(embedBatch(batch));
        }
        LOGGER.debug("Embedded {} texts with model {}", texts.size(), client.properties().getEmbeddingModel());
        return embeddings;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private List<float[]> embedBatch(List<String> batch) {
        ObjectNode body = client.newBody();
        body.put("model", client.properties().getEmbeddingModel());
        ArrayNode input = body.putArray("input");
        batch.forEach(input::add);

        JsonNode data = client.post("/embeddings", body).path("data");
        if (!data.isArray() || data.size() != batch.size()) {
            throw new ProviderException("Embeddings response contains " + data.size() + " vectors for "
                    + batch.size() + " inputs");
        }
        float[][] ordered = new float[batch.size()][];
        for (JsonNode item : data) {
            int index = item.path("index").asInt(-1);
            if (index < 0 || index >= ordered.length || ordered[index] != null) {
                throw new ProviderException("Embeddings response has an invalid index: " + index);
            }
            ordered[index] = toVector(item.path("embedding"));
        }
        return Arrays.asList(ordered);
    }

    private float[] toVector(JsonNode embedding) {
        if (!embedding.isArray() || embedding.size() != dimensions) {
            throw new ProviderException("Expected an embedding with " + dimensions + " dimensions but got "
                    + embedding.size());
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = embedding.get(i);
            if (!value.isNumber()) {
                throw new ProviderException("Embedding contains a non numeric value");
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }
}
