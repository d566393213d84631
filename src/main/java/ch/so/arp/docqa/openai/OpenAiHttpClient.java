package ch.so.arp.docqa.openai;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.docqa.exception.ConfigurationException;
import ch.so.arp.docqa.exception.ProviderException;

/**
 * Thin JSON over HTTP client for the OpenAI REST API shared by the embedding
 * and chat adapters. Every failure surfaces as a {@link ProviderException}.
 */
public class OpenAiHttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OpenAiClientProperties properties;
    private final String apiKey;

    public OpenAiHttpClient(HttpClient httpClient, ObjectMapper objectMapper, OpenAiClientProperties properties) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new ConfigurationException(
                    "An OpenAI API key is required when rag.mock-openai=false (rag.openai.api-key or OPENAI_API_KEY)");
        }
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new ConfigurationException("rag.openai.base-url must not be blank");
        }
        this.apiKey = properties.getApiKey();
    }

    ObjectNode newBody() {
        return objectMapper.createObjectNode();
    }

    OpenAiClientProperties properties() {
        return properties;
    }

    /**
     * POST the body to {@code baseUrl + path} and return the parsed response.
     */
    JsonNode post(String path, ObjectNode body) {
        URI uri = URI.create(stripTrailingSlash(properties.getBaseUrl()) + path);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(uri)
                    .timeout(properties.getRequestTimeout())
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body),
                            StandardCharsets.UTF_8))
                    .build();
        } catch (JsonProcessingException ex) {
            throw new ProviderException("Failed to serialize request for " + path, ex);
        }

        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ProviderException("Request to " + path + " failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Request to " + path + " was interrupted", ex);
        }
        LOGGER.debug("POST {} returned {} in {} ms", path, response.statusCode(),
                (System.nanoTime() - start) / 1_000_000);

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ProviderException("OpenAI " + path + " returned HTTP " + response.statusCode() + ": "
                    + abbreviate(response.body()));
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new ProviderException("OpenAI " + path + " returned malformed JSON", ex);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
