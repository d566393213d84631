package ch.so.arp.docqa.answer;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Send a single prompt and return the generated text.
     *
     * @param prompt the complete prompt including any context
     * @return the model output, never blank
     * @throws ch.so.arp.docqa.exception.ProviderException if the model cannot be
     *                                                     reached or answers with
     *                                                     an error
     */
    String complete(String prompt);
}
