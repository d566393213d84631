package ch.so.arp.docqa.chat;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.docqa.exception.SessionNotFoundException;
import ch.so.arp.docqa.exception.StoreException;

/**
 * JDBC access to the {@code chat_sessions} and {@code chat_messages} tables.
 */
@Repository
public class ChatHistoryRepository {

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String SESSION_SQL = """
            SELECT s.id, s.name, s.created_at, s.updated_at, COUNT(m.id) AS message_count
            FROM chat_sessions s
            LEFT JOIN chat_messages m ON m.session_id = s.id
            """;

    private static final String SESSION_GROUPING = " GROUP BY s.id, s.name, s.created_at, s.updated_at";

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChatHistoryRepository(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate,
                "transactionTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ChatSession createSession(String name) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcClient.sql("INSERT INTO chat_sessions (name, created_at, updated_at) VALUES (:name, :now, :now)")
                    .param("name", name)
                    .param("now", now)
                    .update(keyHolder, "id");
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to create chat session", ex);
        }
        return new ChatSession(generatedId(keyHolder), name, now, now, 0);
    }

    /**
     * @return all sessions, most recently updated first
     */
    public List<ChatSession> findAllSessions() {
        try {
            return jdbcClient.sql(SESSION_SQL + SESSION_GROUPING + " ORDER BY s.updated_at DESC, s.id DESC")
                    .query(SessionRowMapper.INSTANCE)
                    .list();
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to list chat sessions", ex);
        }
    }

    public Optional<ChatSession> findSession(long sessionId) {
        try {
            return jdbcClient.sql(SESSION_SQL + " WHERE s.id = :id" + SESSION_GROUPING)
                    .param("id", sessionId)
                    .query(SessionRowMapper.INSTANCE)
                    .optional();
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to load chat session " + sessionId, ex);
        }
    }

    /**
     * @return {@code false} when the session does not exist
     */
    public boolean renameSession(long sessionId, String name) {
        try {
            return jdbcClient.sql("UPDATE chat_sessions SET name = :name, updated_at = :now WHERE id = :id")
                    .param("name", name)
                    .param("now", OffsetDateTime.now(clock))
                    .param("id", sessionId)
                    .update() > 0;
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to rename chat session " + sessionId, ex);
        }
    }

    /**
     * Delete a session together with its messages.
     *
     * @return {@code false} when the session does not exist
     */
    public boolean deleteSession(long sessionId) {
        try {
            Boolean deleted = transactionTemplate.execute(status -> {
                jdbcClient.sql("DELETE FROM chat_messages WHERE session_id = :id").param("id", sessionId).update();
                return jdbcClient.sql("DELETE FROM chat_sessions WHERE id = :id").param("id", sessionId)
                        .update() > 0;
            });
            return Boolean.TRUE.equals(deleted);
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to delete chat session " + sessionId, ex);
        }
    }

    /**
     * Append a message and refresh the session's {@code updated_at}.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public ChatMessage addMessage(long sessionId, MessageRole role, String content, Map<String, Object> metadata) {
        String metadataJson = toJson(metadata);
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            Long messageId = transactionTemplate.execute(status -> {
                int touched = jdbcClient.sql("UPDATE chat_sessions SET updated_at = :now WHERE id = :id")
                        .param("now", now)
                        .param("id", sessionId)
                        .update();
                if (touched == 0) {
                    throw new SessionNotFoundException(sessionId);
                }
                KeyHolder keyHolder = new GeneratedKeyHolder();
                jdbcClient.sql("""
                        INSERT INTO chat_messages (session_id, role, content, metadata, created_at)
                        VALUES (:sessionId, :role, :content, :metadata, :now)
                        """)
                        .param("sessionId", sessionId)
                        .param("role", role.value())
                        .param("content", content)
                        .param("metadata", metadataJson)
                        .param("now", now)
                        .update(keyHolder, "id");
                return generatedId(keyHolder);
            });
            return new ChatMessage(Objects.requireNonNull(messageId), sessionId, role, content,
                    Collections.unmodifiableMap(new LinkedHashMap<>(metadata)), now);
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to store chat message for session " + sessionId, ex);
        }
    }

    /**
     * @return the messages of a session in insertion order
     */
    public List<ChatMessage> findMessages(long sessionId) {
        try {
            return jdbcClient.sql("""
                    SELECT id, session_id, role, content, metadata, created_at
                    FROM chat_messages
                    WHERE session_id = :id
                    ORDER BY id
                    """)
                    .param("id", sessionId)
                    .query(new MessageRowMapper())
                    .list();
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to load messages of chat session " + sessionId, ex);
        }
    }

    private long generatedId(KeyHolder keyHolder) {
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new StoreException("Database did not return a generated id");
        }
        return key.longValue();
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new StoreException("Message metadata is not serializable", ex);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(json, METADATA_TYPE));
        } catch (JsonProcessingException ex) {
            throw new StoreException("Stored message metadata is not valid JSON", ex);
        }
    }

    private enum SessionRowMapper implements RowMapper<ChatSession> {
        INSTANCE;

        @Override
        public ChatSession mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ChatSession(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("updated_at", OffsetDateTime.class),
                    rs.getInt("message_count"));
        }
    }

    private final class MessageRowMapper implements RowMapper<ChatMessage> {

        @Override
        public ChatMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ChatMessage(
                    rs.getLong("id"),
                    rs.getLong("session_id"),
                    MessageRole.fromValue(rs.getString("role")),
                    rs.getString("content"),
                    fromJson(rs.getString("metadata")),
                    rs.getObject("created_at", OffsetDateTime.class));
        }
    }
}
