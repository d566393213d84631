package ch.so.arp.docqa.answer;

import java.util.List;

/**
 * Answer to a question together with the chunks it was derived from.
 *
 * @param answer     the generated or fixed answer text
 * @param sources    the chunks used as context, in retrieval order
 * @param confidence mean similarity of the sources, a heuristic in {@code [0,1]}
 * @param error      diagnostic message when the answer is degraded, otherwise
 *                   {@code null}
 */
public record Answer(String answer, List<SourceReference> sources, double confidence, String error) {

    public static final String NO_INFORMATION =
            "I couldn't find any relevant information to answer your question.";

    public static final String PROCESSING_ERROR = "I encountered an error while processing your question.";

    public Answer {
        sources = List.copyOf(sources);
    }

    public static Answer noRelevantInformation() {
        return new Answer(NO_INFORMATION, List.of(), 0.0, null);
    }

    public static Answer failed(String error) {
        return new Answer(PROCESSING_ERROR, List.of(), 0.0, error);
    }
}
