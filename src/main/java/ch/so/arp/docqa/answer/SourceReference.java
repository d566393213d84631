package ch.so.arp.docqa.answer;

/**
 * Chunk that contributed to an answer.
 */
public record SourceReference(String filename, String excerpt, double similarity) {
}
