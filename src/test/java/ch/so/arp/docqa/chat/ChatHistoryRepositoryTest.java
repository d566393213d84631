package ch.so.arp.docqa.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.docqa.exception.SessionNotFoundException;

class ChatHistoryRepositoryTest {

    private final TickingClock clock = new TickingClock(Instant.parse("2024-03-01T10:00:00Z"));
    private ChatHistoryRepository repository;
    private JdbcClient jdbcClient;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        new ResourceDatabasePopulator(new ClassPathResource("db/schema-chat-h2.sql")).execute(dataSource);
        jdbcClient = JdbcClient.create(dataSource);
        repository = new ChatHistoryRepository(jdbcClient,
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)), new ObjectMapper(), clock);
    }

    @Test
    void createsAndFindsSession() {
        ChatSession created = repository.createSession("Zoning questions");

        assertThat(repository.findSession(created.id())).hasValueSatisfying(session -> {
            assertThat(session.name()).isEqualTo("Zoning questions");
            assertThat(session.messageCount()).isZero();
            assertThat(session.createdAt().toInstant()).isEqualTo(created.createdAt().toInstant());
        });
        assertThat(repository.findSession(created.id() + 100)).isEmpty();
    }

    @Test
    void storesMessagesWithMetadataAndTouchesSession() {
        ChatSession session = repository.createSession("Session");

        repository.addMessage(session.id(), MessageRole.USER, "How high?", Map.of());
        repository.addMessage(session.id(), MessageRole.ASSISTANT, "Three storeys.",
                Map.of("confidence", 0.8, "sources", List.of(Map.of("filename", "rules.pdf"))));

        List<ChatMessage> messages = repository.findMessages(session.id());
        assertThat(messages).extracting(ChatMessage::role).containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(messages.get(1).metadata()).containsEntry("confidence", 0.8);
        assertThat(messages.get(1).metadata().get("sources"))
                .asInstanceOf(InstanceOfAssertFactories.LIST)
                .hasSize(1);

        ChatSession touched = repository.findSession(session.id()).orElseThrow();
        assertThat(touched.messageCount()).isEqualTo(2);
        assertThat(touched.updatedAt().toInstant()).isAfter(session.updatedAt().toInstant());
    }

    @Test
    void rejectsMessageForUnknownSession() {
        assertThatThrownBy(() -> repository.addMessage(42, MessageRole.USER, "Hello?", Map.of()))
                .isInstanceOf(SessionNotFoundException.class);
        assertThat(jdbcClient.sql("SELECT count(*) FROM chat_messages").query(Long.class).single()).isZero();
    }

    @Test
    void listsRecentlyUpdatedSessionsFirst() {
        ChatSession first = repository.createSession("First");
        ChatSession second = repository.createSession("Second");
        repository.addMessage(first.id(), MessageRole.USER, "Bump", Map.of());

        assertThat(repository.findAllSessions()).extracting(ChatSession::id).containsExactly(first.id(), second.id());
    }

    @Test
    void renamesAndDeletesSessionWithMessages() {
        ChatSession session = repository.createSession("Old name");
        repository.addMessage(session.id(), MessageRole.USER, "Question", Map.of());

        assertThat(repository.renameSession(session.id(), "New name")).isTrue();
        assertThat(repository.findSession(session.id())).get().extracting(ChatSession::name).isEqualTo("New name");

        assertThat(repository.deleteSession(session.id())).isTrue();
        assertThat(repository.deleteSession(session.id())).isFalse();
        assertThat(repository.renameSession(session.id(), "Gone")).isFalse();
        assertThat(repository.findMessages(session.id())).isEmpty();
    }

    /**
     * Advances one second on every read so that successive writes get distinct
     * timestamps.
     */
    private static final class TickingClock extends Clock {

        private Instant now;

        private TickingClock(Instant start) {
            this.now = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            now = now.plus(Duration.ofSeconds(1));
            return now;
        }
    }
}
