package ch.so.arp.docqa.answer;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted.
 */
public class MockLlmClient implements LlmClient {

    @Override
    public String complete(String prompt) {
        int contextStart = prompt.indexOf(AnswerSynthesizer.CONTEXT_MARKER);
        String echo = contextStart >= 0
                ? prompt.substring(contextStart + AnswerSynthesizer.CONTEXT_MARKER.length()).strip()
                : prompt.strip();
        if (echo.length() > 200) {
            echo = echo.substring(0, 200) + "...";
        }
        return "[mocked answer] Provide an API key to reach the real OpenAI service. Prompt excerpt: " + echo;
    }
}
