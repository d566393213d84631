package ch.so.arp.docqa.config;

import java.net.http.HttpClient;
import java.time.Clock;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.docqa.answer.LlmClient;
import ch.so.arp.docqa.answer.MockLlmClient;
import ch.so.arp.docqa.document.TextChunker;
import ch.so.arp.docqa.document.TextExtractor;
import ch.so.arp.docqa.document.TokenCounter;
import ch.so.arp.docqa.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.docqa.embedding.EmbeddingProvider;
import ch.so.arp.docqa.openai.OpenAiClientProperties;
import ch.so.arp.docqa.openai.OpenAiEmbeddingProvider;
import ch.so.arp.docqa.openai.OpenAiHttpClient;
import ch.so.arp.docqa.openai.OpenAiLlmClient;
import ch.so.arp.docqa.store.InMemoryVectorStore;
import ch.so.arp.docqa.store.PostgresVectorStore;
import ch.so.arp.docqa.store.VectorStore;

/**
 * Central configuration wiring the pipeline components together. It exposes
 * toggles that decide whether mocked or real infrastructure components should
 * be used.
 */
@Configuration
@EnableConfigurationProperties({ RagProperties.class, OpenAiClientProperties.class })
public class RagConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TextChunker textChunker(RagProperties properties) {
        return new TextChunker(properties.getChunking().getSize(), properties.getChunking().getOverlap());
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenCounter tokenCounter() {
        return new TokenCounter();
    }

    @Bean
    public TextExtractor textExtractor(RagProperties properties) {
        return new TextExtractor(properties.getUpload().getMaxFileSize().toBytes());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(RagProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbedding().getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public OpenAiHttpClient openAiHttpClient(OpenAiClientProperties properties,
            ObjectProvider<ObjectMapper> objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        return new OpenAiHttpClient(httpClient, objectMapper.getIfAvailable(ObjectMapper::new), properties);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiHttpClient openAiHttpClient) {
        return new OpenAiLlmClient(openAiHttpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiHttpClient openAiHttpClient, RagProperties properties) {
        return new OpenAiEmbeddingProvider(openAiHttpClient, properties.getEmbedding().getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorStore inMemoryVectorStore(RagProperties properties, Clock clock) {
        return new InMemoryVectorStore(properties.getEmbedding().getDimensions(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-vector-store", havingValue = "false")
    public VectorStore postgresVectorStore(JdbcClient jdbcClient, PlatformTransactionManager transactionManager,
            ObjectProvider<ObjectMapper> objectMapper, RagProperties properties, Clock clock) {
        return new PostgresVectorStore(jdbcClient, new TransactionTemplate(transactionManager),
                objectMapper.getIfAvailable(ObjectMapper::new), properties.getEmbedding().getDimensions(), clock);
    }
}
