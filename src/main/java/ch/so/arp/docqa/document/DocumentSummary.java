package ch.so.arp.docqa.document;

import java.util.List;

/**
 * Summary of one stored document.
 *
 * @param intermediateSteps the partial summaries of the individual text windows
 */
public record DocumentSummary(String filename, String summary, boolean success, List<String> intermediateSteps) {

    public DocumentSummary {
        intermediateSteps = List.copyOf(intermediateSteps);
    }

    static DocumentSummary failed(String filename, String message) {
        return new DocumentSummary(filename, message, false, List.of());
    }
}
