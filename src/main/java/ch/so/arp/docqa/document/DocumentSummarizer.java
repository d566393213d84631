package ch.so.arp.docqa.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.docqa.answer.LlmClient;
import ch.so.arp.docqa.config.RagProperties;
import ch.so.arp.docqa.exception.ProviderException;
import ch.so.arp.docqa.store.StoredChunk;
import ch.so.arp.docqa.store.VectorStore;

/**
 * Summarizes a stored document in two steps: every text window is summarized
 * on its own, then the partial summaries are combined into one.
 */
@Service
public class DocumentSummarizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentSummarizer.class);

    private static final String SUMMARY_PROMPT = """
            Write a concise summary of the following:


            "%s"


            CONCISE SUMMARY:""";

    private final VectorStore vectorStore;
    private final LlmClient llmClient;
    private final TextChunker windowSplitter;

    public DocumentSummarizer(VectorStore vectorStore, LlmClient llmClient, RagProperties properties) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore must not be null");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
        this.windowSplitter = new TextChunker(properties.getSummary().getWindowSize(),
                properties.getSummary().getWindowOverlap());
    }

    public DocumentSummary summarize(String filename) {
        List<StoredChunk> chunks = vectorStore.findByFilename(filename);
        if (chunks.isEmpty()) {
            return DocumentSummary.failed(filename, "No content found for document: " + filename);
        }
        String fullText = chunks.stream().map(StoredChunk::content).collect(Collectors.joining("\n\n"));
        List<String> windows = windowSplitter.chunk(fullText);

        try {
            List<String> partialSummaries = new ArrayList<>(windows.size());
            for (String window : windows) {
                partialSummaries.add(llmClient.complete(SUMMARY_PROMPT.formatted(window)));
            }
            String summary = partialSummaries.size() == 1
                    ? partialSummaries.get(0)
                    : llmClient.complete(SUMMARY_PROMPT.formatted(String.join("\n\n", partialSummaries)));
            LOGGER.info("Summarized document {} from {} windows", filename, windows.size());
            return new DocumentSummary(filename, summary, true, partialSummaries);
        } catch (ProviderException ex) {
            LOGGER.warn("Summarizing document {} failed: {}", filename, ex.getMessage());
            return DocumentSummary.failed(filename, "Error generating summary: " + ex.getMessage());
        }
    }
}
