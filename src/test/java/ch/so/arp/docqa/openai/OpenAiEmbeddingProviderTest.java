package ch.so.arp.docqa.openai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.docqa.exception.ProviderException;

class OpenAiEmbeddingProviderTest {

    private HttpClient httpClient;
    private OpenAiClientProperties properties;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        properties = new OpenAiClientProperties();
        properties.setApiKey("test-key");
        properties.setBaseUrl("https://example.com/v1/");
    }

    @Test
    void ordersVectorsByResponseIndex() throws Exception {
        respondWith(200, """
                {"data": [
                  {"index": 1, "embedding": [0.0, 1.0]},
                  {"index": 0, "embedding": [1.0, 0.0]}
                ]}
                """);
        OpenAiEmbeddingProvider provider = provider(2);

        List<float[]> vectors = provider.embedAll(List.of("first", "second"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(1.0f, 0.0f);
        assertThat(vectors.get(1)).containsExactly(0.0f, 1.0f);

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo("https://example.com/v1/embeddings");
        assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer test-key");
    }

    @Test
    void splitsLargeInputsIntoBatches() throws Exception {
        properties.setEmbeddingBatchSize(1);
        respondWith(200, """
                {"data": [{"index": 0, "embedding": [0.5, 0.5]}]}
                """);
        OpenAiEmbeddingProvider provider = provider(2);

        List<float[]> vectors = provider.embedAll(List.of("a", "b", "c"));

        assertThat(vectors).hasSize(3);
        verify(httpClient, times(3)).send(any(), any());
    }

    @Test
    void skipsRequestForEmptyInput() {
        assertThat(provider(2).embedAll(List.of())).isEmpty();
        verifyNoInteractions(httpClient);
    }

    @Test
    void failsOnErrorStatus() throws Exception {
        respondWith(429, "{\"error\": {\"message\": \"Rate limit reached\"}}");
        OpenAiEmbeddingProvider provider = provider(2);

        assertThatThrownBy(() -> provider.embed("question"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("429");
    }

    @Test
    void failsOnDimensionMismatch() throws Exception {
        respondWith(200, """
                {"data": [{"index": 0, "embedding": [0.1, 0.2, 0.3]}]}
                """);
        OpenAiEmbeddingProvider provider = provider(2);

        assertThatThrownBy(() -> provider.embed("question"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("2 dimensions");
    }

    @Test
    void failsOnCountMismatch() throws Exception {
        respondWith(200, """
                {"data": [{"index": 0, "embedding": [0.1, 0.2]}]}
                """);
        OpenAiEmbeddingProvider provider = provider(2);

        assertThatThrownBy(() -> provider.embedAll(List.of("a", "b"))).isInstanceOf(ProviderException.class);
    }

    @Test
    void wrapsIoFailures() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());
        OpenAiEmbeddingProvider provider = provider(2);

        assertThatThrownBy(() -> provider.embed("question"))
                .isInstanceOf(ProviderException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    private OpenAiEmbeddingProvider provider(int dimensions) {
        return new OpenAiEmbeddingProvider(new OpenAiHttpClient(httpClient, new ObjectMapper(), properties),
                dimensions);
    }

    @SuppressWarnings("unchecked")
    private void respondWith(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(), any());
    }
}
