package ch.so.arp.docqa.openai;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.docqa.answer.LlmClient;
import ch.so.arp.docqa.exception.ProviderException;

/**
 * {@link LlmClient} backed by the OpenAI {@code /chat/completions} endpoint.
 */
public class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiHttpClient client;

    public OpenAiLlmClient(OpenAiHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        LOGGER.info("Using OpenAI chat model {} at {}", client.properties().getChatModel(),
                client.properties().getBaseUrl());
    }

    @Override
    public String complete(String prompt) {
        ObjectNode body = client.newBody();
        body.put("model", client.properties().getChatModel());
        body.put("temperature", client.properties().getTemperature());
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);

        JsonNode content = client.post("/chat/completions", body).at("/choices/0/message/content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new ProviderException("Chat completion response contains no message content");
        }
        return content.asText().strip();
    }
}
