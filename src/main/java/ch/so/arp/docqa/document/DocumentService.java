package ch.so.arp.docqa.document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import ch.so.arp.docqa.embedding.EmbeddingProvider;
import ch.so.arp.docqa.exception.ProviderException;
import ch.so.arp.docqa.exception.ValidationException;
import ch.so.arp.docqa.store.ChunkMetadata;
import ch.so.arp.docqa.store.NewChunk;
import ch.so.arp.docqa.store.StoredChunk;
import ch.so.arp.docqa.store.VectorStore;

/**
 * Ingests, lists and deletes logical documents. A document is chunked and
 * embedded first; only then are its chunks written, replacing any previous
 * version of the same filename in one transaction.
 */
@Service
public class DocumentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentService.class);

    private static final int LOCK_STRIPES = 32;

    private final TextChunker chunker;
    private final TextExtractor extractor;
    private final TokenCounter tokenCounter;
    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final ReentrantLock[] filenameLocks = new ReentrantLock[LOCK_STRIPES];

    public DocumentService(TextChunker chunker, TextExtractor extractor, TokenCounter tokenCounter,
            EmbeddingProvider embeddingProvider, VectorStore vectorStore) {
        this.chunker = Objects.requireNonNull(chunker, "chunker must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter must not be null");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider must not be null");
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore must not be null");
        for (int i = 0; i < filenameLocks.length; i++) {
            filenameLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Extract the text of an uploaded file and ingest it with the file metadata.
     */
    public IngestResult ingestFile(byte[] content, String filename) {
        ExtractedText extracted = extractor.extract(content, filename);
        return ingest(extracted.text(), filename, extracted.metadata());
    }

    public IngestResult ingest(String content, String filename, Map<String, Object> extraMetadata) {
        if (!StringUtils.hasText(filename)) {
            throw new ValidationException("Filename must not be blank");
        }
        String documentName = filename.strip();
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("Document " + documentName + " has no text content");
        }

        List<String> chunks = chunker.chunk(content);
        List<float[]> embeddings = embeddingProvider.embedAll(chunks);
        if (embeddings.size() != chunks.size()) {
            throw new ProviderException("Received " + embeddings.size() + " embeddings for " + chunks.size()
                    + " chunks");
        }

        List<NewChunk> staged = new ArrayList<>(chunks.size());
        int totalTokens = 0;
        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            int tokens = tokenCounter.count(chunk);
            totalTokens += tokens;
            staged.add(new NewChunk(chunk, embeddings.get(i),
                    ChunkMetadata.forChunk(documentName, i, chunks.size(), chunk, tokens, extraMetadata)));
        }

        ReentrantLock lock = lockFor(documentName);
        lock.lock();
        try {
            vectorStore.writeDocument(documentName, staged);
        } finally {
            lock.unlock();
        }
        LOGGER.info("Stored document {} as {} chunks ({} tokens)", documentName, staged.size(), totalTokens);
        return IngestResult.stored(documentName, staged.size(), totalTokens);
    }

    /**
     * One entry per filename in the order the documents were first stored.
     */
    public List<DocumentOverview> listDocuments() {
        Map<String, List<StoredChunk>> byFilename = new LinkedHashMap<>();
        for (StoredChunk chunk : vectorStore.listAll()) {
            byFilename.computeIfAbsent(chunk.filename(), key -> new ArrayList<>()).add(chunk);
        }
        List<DocumentOverview> documents = new ArrayList<>(byFilename.size());
        byFilename.forEach((filename, chunks) -> {
            StoredChunk first = chunks.get(0);
            documents.add(new DocumentOverview(filename, chunks.size(), first.createdAt(),
                    ChunkMetadata.documentLevel(first.metadata())));
        });
        return documents;
    }

    /**
     * @return {@code true} when chunks were removed, {@code false} when the
     *         filename was unknown
     */
    public boolean delete(String filename) {
        if (!StringUtils.hasText(filename)) {
            throw new ValidationException("Filename must not be blank");
        }
        String documentName = filename.strip();
        int removed;
        ReentrantLock lock = lockFor(documentName);
        lock.lock();
        try {
            removed = vectorStore.deleteByFilename(documentName);
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            LOGGER.info("Deleted document {} ({} chunks)", documentName, removed);
        }
        return removed > 0;
    }

    public int deleteAll() {
        int locked = 0;
        try {
            for (ReentrantLock lock : filenameLocks) {
                lock.lock();
                locked++;
            }
            int removed = vectorStore.deleteAll();
            LOGGER.info("Deleted all documents ({} chunks)", removed);
            return removed;
        } finally {
            for (int i = 0; i < locked; i++) {
                filenameLocks[i].unlock();
            }
        }
    }

    private ReentrantLock lockFor(String filename) {
        return filenameLocks[Math.floorMod(filename.hashCode(), LOCK_STRIPES)];
    }
}
