package ch.so.arp.docqa.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import ch.so.arp.docqa.exception.ConfigurationException;

/**
 * Splits text into overlapping chunks of bounded length. The text is split on
 * the coarsest separator it contains (paragraph, line, word, character), each
 * piece keeping its leading separator. Pieces below the chunk size are merged
 * greedily; larger pieces are split again with the next finer separator.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;

    public static final int DEFAULT_CHUNK_OVERLAP = 200;

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;

    public TextChunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP);
    }

    public TextChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("Chunk size must be positive, got " + chunkSize);
        }
        if (chunkOverlap < 0) {
            throw new ConfigurationException("Chunk overlap must not be negative, got " + chunkOverlap);
        }
        if (chunkOverlap >= chunkSize) {
            throw new ConfigurationException(
                    "Chunk overlap (" + chunkOverlap + ") must be smaller than chunk size (" + chunkSize + ")");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    /**
     * @return trimmed, non-empty chunks of at most {@link #getChunkSize()}
     *         characters; an empty list for blank input
     */
    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return split(text, SEPARATORS);
    }

    private List<String> split(String text, List<String> separators) {
        String separator = separators.get(separators.size() - 1);
        List<String> finerSeparators = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                finerSeparators = separators.subList(i + 1, separators.size());
                break;
            }
        }

        List<String> chunks = new ArrayList<>();
        List<String> mergeable = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                mergeable.add(piece);
                continue;
            }
            if (!mergeable.isEmpty()) {
                chunks.addAll(merge(mergeable));
                mergeable = new ArrayList<>();
            }
            if (finerSeparators.isEmpty()) {
                addTrimmed(chunks, piece);
            } else {
                chunks.addAll(split(piece, finerSeparators));
            }
        }
        if (!mergeable.isEmpty()) {
            chunks.addAll(merge(mergeable));
        }
        return chunks;
    }

    /**
     * Pieces after the first start with the separator they were split on. An
     * empty separator splits into code points, or into single {@code char}s
     * when a surrogate pair would not fit into a chunk of size one.
     */
    private List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            if (chunkSize < 2) {
                text.chars().forEach(c -> pieces.add(String.valueOf((char) c)));
            } else {
                text.codePoints().forEach(codePoint -> pieces.add(new String(Character.toChars(codePoint))));
            }
            return pieces;
        }
        int start = 0;
        int next = text.indexOf(separator);
        while (next >= 0) {
            if (next > start) {
                pieces.add(text.substring(start, next));
            }
            start = next;
            next = text.indexOf(separator, start + separator.length());
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }

    private List<String> merge(List<String> pieces) {
        List<String> chunks = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int length = piece.length();
            if (total + length > chunkSize && !window.isEmpty()) {
                addTrimmed(chunks, String.join("", window));
                // keep at most chunkOverlap characters and leave room for the next piece
                while (total > chunkOverlap || (total + length > chunkSize && total > 0)) {
                    total -= window.removeFirst().length();
                }
            }
            window.addLast(piece);
            total += length;
        }
        addTrimmed(chunks, String.join("", window));
        return chunks;
    }

    private static void addTrimmed(List<String> chunks, String chunk) {
        String trimmed = chunk.strip();
        if (!trimmed.isEmpty()) {
            chunks.add(trimmed);
        }
    }
}
