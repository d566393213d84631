package ch.so.arp.docqa.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.arp.docqa.config.RagProperties;
import ch.so.arp.docqa.embedding.DeterministicEmbeddingProvider;
import ch.so.arp.docqa.embedding.EmbeddingProvider;
import ch.so.arp.docqa.exception.ProviderException;
import ch.so.arp.docqa.exception.ValidationException;
import ch.so.arp.docqa.store.InMemoryVectorStore;
import ch.so.arp.docqa.store.ScoredChunk;
import ch.so.arp.docqa.store.VectorStore;

class RetrieverTest {

    private final DeterministicEmbeddingProvider embeddingProvider = new DeterministicEmbeddingProvider(8);
    private final InMemoryVectorStore vectorStore = new InMemoryVectorStore(8, Clock.systemUTC());
    private final Retriever retriever = new Retriever(embeddingProvider, vectorStore, new RagProperties());

    @Test
    void reportsNoRelevantContextForEmptyStore() {
        RetrievalResult result = retriever.retrieve("Where may I build?");

        assertThat(result.status()).isEqualTo(RetrievalResult.Status.NO_RELEVANT_CONTEXT);
        assertThat(result.chunks()).isEmpty();
        assertThat(result.hasContext()).isFalse();
    }

    @Test
    void findsChunkWithIdenticalEmbedding() {
        String text = "Buildings may be at most three storeys high.";
        vectorStore.write(text, embeddingProvider.embed(text), Map.of("filename", "rules.txt"));
        vectorStore.write("unrelated", embeddingProvider.embed("unrelated"), Map.of("filename", "other.txt"));

        RetrievalResult result = retriever.retrieve(text, 1, 0.99);

        assertThat(result.status()).isEqualTo(RetrievalResult.Status.FOUND);
        assertThat(result.chunks()).singleElement().satisfies(hit -> {
            assertThat(hit.content()).isEqualTo(text);
            assertThat(hit.filename()).isEqualTo("rules.txt");
        });
    }

    @Test
    void findsParaphrasedQuestionWithDefaultSettings() {
        DeterministicEmbeddingProvider provider = new DeterministicEmbeddingProvider(1536);
        InMemoryVectorStore store = new InMemoryVectorStore(1536, Clock.systemUTC());
        String text = "The city council approved the new zoning plan for the harbour district.";
        store.write(text, provider.embed(text), Map.of("filename", "minutes.txt"));

        RetrievalResult result = new Retriever(provider, store, new RagProperties())
                .retrieve("What did the city council approve for the harbour district?");

        assertThat(result.status()).isEqualTo(RetrievalResult.Status.FOUND);
        assertThat(result.chunks()).extracting(ScoredChunk::filename).containsExactly("minutes.txt");
    }

    @Test
    void validatesArgumentsBeforeEmbedding() {
        EmbeddingProvider provider = mock(EmbeddingProvider.class);
        Retriever guarded = new Retriever(provider, vectorStore, new RagProperties());

        assertThatThrownBy(() -> guarded.retrieve(" ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> guarded.retrieve("q", 0, 0.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> guarded.retrieve("q", 5, 1.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> guarded.retrieve("q", 5, -0.1)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(provider);
    }

    @Test
    void propagatesProviderFailures() {
        EmbeddingProvider provider = mock(EmbeddingProvider.class);
        when(provider.embed(any())).thenThrow(new ProviderException("embedding service down"));
        VectorStore store = mock(VectorStore.class);
        Retriever failing = new Retriever(provider, store, new RagProperties());

        assertThatThrownBy(() -> failing.retrieve("question")).isInstanceOf(ProviderException.class);
        verifyNoInteractions(store);
    }
}
