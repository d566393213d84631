package ch.so.arp.docqa.document;

/**
 * Outcome of a successful ingestion. Failures are reported as exceptions.
 */
public record IngestResult(String filename, int chunksCreated, int totalTokens, boolean success) {

    public static IngestResult stored(String filename, int chunksCreated, int totalTokens) {
        return new IngestResult(filename, chunksCreated, totalTokens, true);
    }
}
