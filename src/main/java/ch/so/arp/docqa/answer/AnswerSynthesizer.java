package ch.so.arp.docqa.answer;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.docqa.config.RagProperties;
import ch.so.arp.docqa.store.ScoredChunk;

/**
 * Turns a question and the retrieved chunks into an {@link Answer}. The model
 * is asked to answer from the supplied context only.
 */
@Service
public class AnswerSynthesizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final String CONTEXT_MARKER = "Context:";

    private static final String PROMPT_TEMPLATE = """
            You are a helpful assistant that answers questions based on the provided context.
            Use only the information from the context to answer the question.
            If the context doesn't contain enough information to answer the question, \
            say "I don't have enough information to answer this question."

            %s
            %s

            Question: %s

            Answer:""";

    private final LlmClient llmClient;
    private final int excerptLength;

    public AnswerSynthesizer(LlmClient llmClient, RagProperties properties) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
        this.excerptLength = properties.getAnswer().getExcerptLength();
    }

    public Answer synthesize(String question, RetrievalResult retrieval) {
        if (!retrieval.hasContext()) {
            return Answer.noRelevantInformation();
        }
        return synthesize(question, retrieval.chunks());
    }

    public Answer synthesize(String question, List<ScoredChunk> retrieved) {
        if (retrieved.isEmpty()) {
            return Answer.noRelevantInformation();
        }

        String context = retrieved.stream().map(ScoredChunk::content).collect(Collectors.joining("\n\n"));
        String answerText;
        try {
            answerText = llmClient.complete(buildPrompt(question, context));
        } catch (RuntimeException ex) {
            LOGGER.warn("Answer generation failed, returning degraded answer: {}", ex.getMessage());
            return Answer.failed(ex.getMessage());
        }

        List<SourceReference> sources = new ArrayList<>(retrieved.size());
        for (ScoredChunk hit : retrieved) {
            sources.add(new SourceReference(hit.filename(), excerpt(hit.content()), hit.similarity()));
        }
        return new Answer(answerText, sources, confidence(retrieved), null);
    }

    String buildPrompt(String question, String context) {
        return PROMPT_TEMPLATE.formatted(CONTEXT_MARKER, context, question);
    }

    private String excerpt(String content) {
        if (content.length() <= excerptLength) {
            return content;
        }
        return content.substring(0, excerptLength) + "...";
    }

    /**
     * Arithmetic mean of the similarities in decimal arithmetic, clamped to
     * {@code [0,1]}.
     */
    static double confidence(List<ScoredChunk> retrieved) {
        if (retrieved.isEmpty()) {
            return 0.0;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (ScoredChunk hit : retrieved) {
            sum = sum.add(BigDecimal.valueOf(hit.similarity()));
        }
        double mean = sum.divide(BigDecimal.valueOf(retrieved.size()), MathContext.DECIMAL64).doubleValue();
        return Math.max(0.0, Math.min(1.0, mean));
    }
}
