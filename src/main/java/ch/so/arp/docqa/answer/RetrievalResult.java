package ch.so.arp.docqa.answer;

import java.util.List;

import ch.so.arp.docqa.store.ScoredChunk;

/**
 * Outcome of a retrieval. An empty hit list is reported through
 * {@link Status#NO_RELEVANT_CONTEXT}, not through an exception.
 */
public record RetrievalResult(Status status, List<ScoredChunk> chunks) {

    public enum Status {
        FOUND,
        NO_RELEVANT_CONTEXT
    }

    public RetrievalResult {
        chunks = List.copyOf(chunks);
    }

    public static RetrievalResult of(List<ScoredChunk> chunks) {
        return new RetrievalResult(chunks.isEmpty() ? Status.NO_RELEVANT_CONTEXT : Status.FOUND, chunks);
    }

    public boolean hasContext() {
        return status == Status.FOUND;
    }
}
