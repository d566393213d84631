package ch.so.arp.docqa.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding provider for local development and tests. Words are lower-cased,
 * cut to their first {@value #STEM_LENGTH} characters and hashed into one of
 * {@code dimensions} signed buckets; the counts are scaled to a unit vector.
 * Texts that share words therefore score high against each other, while equal
 * texts always map to equal vectors.
 */
public class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    static final int STEM_LENGTH = 6;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private final int dimensions;

    public DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        List<String> terms = terms(text);
        if (terms.isEmpty()) {
            // punctuation-only or empty text still gets a stable unit vector
            terms = List.of(text.strip());
        }

        double[] counts = new double[dimensions];
        for (String term : terms) {
            byte[] digest = sha256(term);
            int bucket = Math.floorMod(bucketHash(digest), dimensions);
            counts[bucket] += (digest[4] & 0x01) == 0 ? 1.0d : -1.0d;
        }

        double norm = 0.0d;
        for (double count : counts) {
            norm += count * count;
        }
        norm = Math.sqrt(norm);
        float[] vector = new float[dimensions];
        if (norm == 0.0d) {
            // signed collisions cancelled out completely
            vector[Math.floorMod(bucketHash(sha256(text)), dimensions)] = 1.0f;
            return vector;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (counts[i] / norm);
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    static List<String> terms(String text) {
        List<String> terms = new ArrayList<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.codePointCount(0, word.length()) > STEM_LENGTH) {
                word = word.substring(0, word.offsetByCodePoints(0, STEM_LENGTH));
            }
            terms.add(word);
        }
        return terms;
    }

    private byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private static int bucketHash(byte[] digest) {
        return ((digest[0] & 0xFF) << 24) | ((digest[1] & 0xFF) << 16) | ((digest[2] & 0xFF) << 8)
                | (digest[3] & 0xFF);
    }
}
