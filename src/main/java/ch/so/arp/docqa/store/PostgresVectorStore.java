package ch.so.arp.docqa.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.docqa.exception.StoreException;

/**
 * {@link VectorStore} backed by PostgreSQL with the pgvector extension. The
 * table layout lives in {@code db/schema-postgresql.sql}.
 */
public class PostgresVectorStore implements VectorStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresVectorStore.class);

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS = """
            id, content, metadata::text AS metadata, embedding::text AS embedding, created_at, updated_at
            """;

    private static final String INSERT_SQL = """
            INSERT INTO document_chunks (filename, content, metadata, embedding, created_at, updated_at)
            VALUES (:filename, :content, :metadata::jsonb, :embedding::vector, :now, :now)
            RETURNING id
            """;

    static final String SEARCH_SQL = "SELECT " + COLUMNS.strip() + """
            , 1 - (embedding <=> :embedding::vector) AS similarity
            FROM document_chunks
            WHERE 1 - (embedding <=> :embedding::vector) > :threshold
            ORDER BY embedding <=> :embedding::vector, id
            LIMIT :limit
            """;

    private static final String LIST_ALL_SQL = "SELECT " + COLUMNS.strip() + """

            FROM document_chunks
            ORDER BY id
            """;

    static final String FIND_BY_FILENAME_SQL = "SELECT " + COLUMNS.strip() + """

            FROM document_chunks
            WHERE filename = :filename
            ORDER BY CASE WHEN jsonb_typeof(metadata->'chunk_index') = 'number'
                THEN (metadata->>'chunk_index')::numeric END NULLS LAST, id
            """;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final int dimensions;
    private final Clock clock;
    private final RowMapper<StoredChunk> chunkRowMapper = new ChunkRowMapper();

    public PostgresVectorStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper, int dimensions, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate,
                "transactionTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public long write(String content, float[] embedding, Map<String, Object> metadata) {
        validate(content, embedding, metadata);
        try {
            return insert(content, embedding, metadata, OffsetDateTime.now(clock));
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to write chunk", ex);
        }
    }

    @Override
    public List<Long> writeDocument(String filename, List<NewChunk> chunks) {
        for (NewChunk chunk : chunks) {
            validate(chunk.content(), chunk.embedding(), chunk.metadata());
            if (!filename.equals(String.valueOf(chunk.metadata().get(ChunkMetadata.FILENAME)))) {
                throw new StoreException("Chunk metadata does not belong to document " + filename);
            }
        }
        try {
            List<Long> ids = transactionTemplate.execute(status -> {
                OffsetDateTime now = OffsetDateTime.now(clock);
                int removed = deleteRows(filename);
                List<Long> inserted = new ArrayList<>(chunks.size());
                for (NewChunk chunk : chunks) {
                    inserted.add(insert(chunk.content(), chunk.embedding(), chunk.metadata(), now));
                }
                LOGGER.debug("Replaced {} chunks of {} with {} new chunks", removed, filename, inserted.size());
                return inserted;
            });
            return ids == null ? List.of() : ids;
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to write document " + filename, ex);
        }
    }

    @Override
    public List<ScoredChunk> search(float[] queryEmbedding, int limit, double similarityThreshold) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (queryEmbedding == null || queryEmbedding.length != dimensions) {
            throw new StoreException("Query embedding must have " + dimensions + " dimensions");
        }
        try {
            return jdbcClient.sql(SEARCH_SQL)
                    .param("embedding", PgVectors.toLiteral(queryEmbedding))
                    .param("threshold", similarityThreshold)
                    .param("limit", limit)
                    .query((rs, rowNum) -> new ScoredChunk(chunkRowMapper.mapRow(rs, rowNum),
                            rs.getDouble("similarity")))
                    .list();
        } catch (DataAccessException ex) {
            throw new StoreException("Similarity search failed", ex);
        }
    }

    @Override
    public int deleteByFilename(String filename) {
        try {
            Integer removed = transactionTemplate.execute(status -> deleteRows(filename));
            return removed == null ? 0 : removed;
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to delete document " + filename, ex);
        }
    }

    @Override
    public int deleteAll() {
        try {
            Integer removed = transactionTemplate.execute(status -> jdbcClient.sql("DELETE FROM document_chunks")
                    .update());
            return removed == null ? 0 : removed;
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to delete all documents", ex);
        }
    }

    @Override
    public List<StoredChunk> listAll() {
        try {
            return jdbcClient.sql(LIST_ALL_SQL).query(chunkRowMapper).list();
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to list chunks", ex);
        }
    }

    @Override
    public List<StoredChunk> findByFilename(String filename) {
        try {
            return jdbcClient.sql(FIND_BY_FILENAME_SQL)
                    .param("filename", filename)
                    .query(chunkRowMapper)
                    .list();
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to load document " + filename, ex);
        }
    }

    @Override
    public long count() {
        try {
            return jdbcClient.sql("SELECT count(*) FROM document_chunks").query(Long.class).single();
        } catch (DataAccessException ex) {
            throw new StoreException("Failed to count chunks", ex);
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private long insert(String content, float[] embedding, Map<String, Object> metadata, OffsetDateTime now) {
        return jdbcClient.sql(INSERT_SQL)
                .param("filename", metadata.get(ChunkMetadata.FILENAME).toString())
                .param("content", content)
                .param("metadata", toJson(metadata))
                .param("embedding", PgVectors.toLiteral(embedding))
                .param("now", now)
                .query(Long.class)
                .single();
    }

    private int deleteRows(String filename) {
        return jdbcClient.sql("DELETE FROM document_chunks WHERE filename = :filename")
                .param("filename", filename)
                .update();
    }

    private void validate(String content, float[] embedding, Map<String, Object> metadata) {
        if (content == null || content.isBlank()) {
            throw new StoreException("Chunk content must not be blank");
        }
        if (embedding == null || embedding.length != dimensions) {
            throw new StoreException("Embedding must have " + dimensions + " dimensions");
        }
        if (metadata == null || metadata.get(ChunkMetadata.FILENAME) == null) {
            throw new StoreException("Chunk metadata must contain '" + ChunkMetadata.FILENAME + "'");
        }
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new StoreException("Chunk metadata is not serializable", ex);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(json, METADATA_TYPE));
        } catch (JsonProcessingException ex) {
            throw new StoreException("Stored chunk metadata is not valid JSON", ex);
        }
    }

    private final class ChunkRowMapper implements RowMapper<StoredChunk> {

        @Override
        public StoredChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new StoredChunk(
                    rs.getLong("id"),
                    rs.getString("content"),
                    PgVectors.parse(rs.getString("embedding")),
                    fromJson(rs.getString("metadata")),
                    rs.getObject("created_at", OffsetDateTime.class),
                    rs.getObject("updated_at", OffsetDateTime.class));
        }
    }
}
