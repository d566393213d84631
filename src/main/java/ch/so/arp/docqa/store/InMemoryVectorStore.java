package ch.so.arp.docqa.store;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.docqa.exception.StoreException;

/**
 * Vector store kept in memory for local development and tests. Similarity is
 * computed with the cosine measure over all stored chunks.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::similarity).reversed()
            .thenComparingLong(hit -> hit.chunk().id());

    private final int dimensions;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<Long, StoredChunk> chunks = new TreeMap<>();
    private long nextId = 1;

    public InMemoryVectorStore(int dimensions, Clock clock) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        this.clock = clock;
    }

    @Override
    public long write(String content, float[] embedding, Map<String, Object> metadata) {
        validate(content, embedding, metadata);
        lock.writeLock().lock();
        try {
            return insert(content, embedding, metadata);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Long> writeDocument(String filename, List<NewChunk> newChunks) {
        for (NewChunk chunk : newChunks) {
            validate(chunk.content(), chunk.embedding(), chunk.metadata());
            if (!filename.equals(String.valueOf(chunk.metadata().get(ChunkMetadata.FILENAME)))) {
                throw new StoreException("Chunk metadata does not belong to document " + filename);
            }
        }
        lock.writeLock().lock();
        try {
            int removed = removeFilename(filename);
            List<Long> ids = new ArrayList<>(newChunks.size());
            for (NewChunk chunk : newChunks) {
                ids.add(insert(chunk.content(), chunk.embedding(), chunk.metadata()));
            }
            LOGGER.debug("Replaced {} chunks of {} with {} new chunks", removed, filename, ids.size());
            return ids;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ScoredChunk> search(float[] queryEmbedding, int limit, double similarityThreshold) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (queryEmbedding == null || queryEmbedding.length != dimensions) {
            throw new StoreException("Query embedding must have " + dimensions + " dimensions");
        }
        lock.readLock().lock();
        try {
            List<ScoredChunk> hits = new ArrayList<>();
            for (StoredChunk chunk : chunks.values()) {
                double similarity = cosineSimilarity(queryEmbedding, chunk.embedding());
                if (similarity > similarityThreshold) {
                    hits.add(new ScoredChunk(chunk, similarity));
                }
            }
            hits.sort(RANKING);
            return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int deleteByFilename(String filename) {
        lock.writeLock().lock();
        try {
            return removeFilename(filename);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteAll() {
        lock.writeLock().lock();
        try {
            int removed = chunks.size();
            chunks.clear();
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoredChunk> listAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(chunks.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StoredChunk> findByFilename(String filename) {
        lock.readLock().lock();
        try {
            return chunks.values().stream()
                    .filter(chunk -> chunk.filename().equals(filename))
                    .sorted(Comparator.comparingInt(StoredChunk::chunkIndex).thenComparingLong(StoredChunk::id))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return chunks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    // caller holds the write lock
    private long insert(String content, float[] embedding, Map<String, Object> metadata) {
        long id = nextId++;
        OffsetDateTime now = OffsetDateTime.now(clock);
        chunks.put(id, new StoredChunk(id, content, embedding,
                Collections.unmodifiableMap(new LinkedHashMap<>(metadata)), now, now));
        return id;
    }

    private int removeFilename(String filename) {
        int before = chunks.size();
        chunks.values().removeIf(chunk -> chunk.filename().equals(filename));
        return before - chunks.size();
    }

    private void validate(String content, float[] embedding, Map<String, Object> metadata) {
        if (content == null || content.isBlank()) {
            throw new StoreException("Chunk content must not be blank");
        }
        if (embedding == null || embedding.length != dimensions) {
            throw new StoreException("Embedding must have " + dimensions + " dimensions");
        }
        if (metadata == null || metadata.get(ChunkMetadata.FILENAME) == null) {
            throw new StoreException("Chunk metadata must contain '" + ChunkMetadata.FILENAME + "'");
        }
    }

    static double cosineSimilarity(float[] left, float[] right) {
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}
