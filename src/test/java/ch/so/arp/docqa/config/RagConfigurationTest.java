package ch.so.arp.docqa.config;

import static org.assertj.core.api.Assertions.assertThat;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.docqa.answer.LlmClient;
import ch.so.arp.docqa.answer.MockLlmClient;
import ch.so.arp.docqa.document.TextChunker;
import ch.so.arp.docqa.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.docqa.embedding.EmbeddingProvider;
import ch.so.arp.docqa.exception.ConfigurationException;
import ch.so.arp.docqa.openai.OpenAiClientProperties;
import ch.so.arp.docqa.openai.OpenAiEmbeddingProvider;
import ch.so.arp.docqa.openai.OpenAiLlmClient;
import ch.so.arp.docqa.store.InMemoryVectorStore;
import ch.so.arp.docqa.store.PostgresVectorStore;
import ch.so.arp.docqa.store.VectorStore;

class RagConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(RagConfiguration.class, InfrastructureConfiguration.class);

    @Test
    void usesMocksByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(LlmClient.class);
            assertThat(context).getBean(LlmClient.class).isInstanceOf(MockLlmClient.class);
            assertThat(context).hasSingleBean(EmbeddingProvider.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(DeterministicEmbeddingProvider.class);
            assertThat(context).hasSingleBean(VectorStore.class);
            assertThat(context).getBean(VectorStore.class).isInstanceOf(InMemoryVectorStore.class);
            assertThat(context.getBean(VectorStore.class).dimensions()).isEqualTo(1536);

            TextChunker chunker = context.getBean(TextChunker.class);
            assertThat(chunker.getChunkSize()).isEqualTo(1000);
            assertThat(chunker.getChunkOverlap()).isEqualTo(200);
        });
    }

    @Test
    void createsRealBeansWhenMocksDisabled() {
        contextRunner
                .withPropertyValues(
                        "rag.mock-openai=false",
                        "rag.mock-vector-store=false",
                        "rag.openai.api-key=test-key",
                        "rag.openai.base-url=https://example.com/v1",
                        "rag.openai.chat-model=gpt-4o",
                        "rag.embedding.dimensions=3")
                .run(context -> {
                    assertThat(context).hasSingleBean(LlmClient.class);
                    assertThat(context).getBean(LlmClient.class).isInstanceOf(OpenAiLlmClient.class);
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(OpenAiEmbeddingProvider.class);
                    assertThat(context.getBean(EmbeddingProvider.class).dimensions()).isEqualTo(3);
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getChatModel()).isEqualTo("gpt-4o");
                    assertThat(properties.getEmbeddingModel()).isEqualTo("text-embedding-3-small");

                    assertThat(context).hasSingleBean(VectorStore.class);
                    assertThat(context).getBean(VectorStore.class).isInstanceOf(PostgresVectorStore.class);
                });
    }

    @Test
    void fallsBackToEnvironmentApiKey() {
        contextRunner
                .withPropertyValues("rag.mock-openai=false", "OPENAI_API_KEY=env-key")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(OpenAiClientProperties.class).getApiKey()).isEqualTo("env-key");
                });
    }

    @Test
    void failsAtStartupWithoutApiKey() {
        contextRunner
                .withPropertyValues("rag.mock-openai=false", "OPENAI_API_KEY=")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause().isInstanceOf(ConfigurationException.class);
                });
    }

    @Test
    void rejectsOverlapNotSmallerThanChunkSize() {
        contextRunner
                .withPropertyValues("rag.chunking.size=100", "rag.chunking.overlap=100")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(ConfigurationException.class)
                            .hasMessageContaining("must be smaller than chunk size");
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class InfrastructureConfiguration {

        @Bean
        JdbcClient jdbcClient(DataSource dataSource) {
            return JdbcClient.create(dataSource);
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        DataSource dataSource() {
            DriverManagerDataSource dataSource = new DriverManagerDataSource();
            dataSource.setDriverClassName("org.h2.Driver");
            dataSource.setUrl("jdbc:h2:mem:test;MODE=PostgreSQL");
            dataSource.setUsername("sa");
            dataSource.setPassword("");
            return dataSource;
        }
    }
}
