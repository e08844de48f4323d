package ch.so.arp.assistant.knowledge;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational {@link KnowledgeStore}. Documents and chunks are written in a
 * single transaction; chunk keywords are stored as a comma separated list.
 */
class JdbcKnowledgeStore implements KnowledgeStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcKnowledgeStore.class);

    private static final String INSERT_DOCUMENT_SQL = """
            INSERT INTO knowledge_documents
              (community, name, format, size_bytes, location, chunk_count, total_chars, uploaded_by, status,
               created_at, updated_at)
            VALUES
              (:community, :name, :format, :sizeBytes, :location, :chunkCount, :totalChars, :uploadedBy, :status,
               :now, :now)
            """;

    private static final String INSERT_CHUNK_SQL = """
            INSERT INTO knowledge_chunks (document_id, community, chunk_index, content, keywords, char_count)
            VALUES (:documentId, :community, :chunkIndex, :content, :keywords, :charCount)
            """;

    private static final String SELECT_DOCUMENT_COLUMNS = """
            SELECT id, community, name, format, size_bytes, location, chunk_count, total_chars, uploaded_by, status,
                   created_at, updated_at
            FROM knowledge_documents
            """;

    private static final String LIST_CHUNKS_SQL = """
            SELECT c.id, c.document_id, d.name AS document_name, c.community, c.chunk_index, c.content, c.keywords,
                   c.char_count
            FROM knowledge_chunks c
            JOIN knowledge_documents d ON d.id = c.document_id
            WHERE c.community = :community AND d.status = :status
            ORDER BY c.id
            """;

    private static final String KEYWORD_SEPARATOR = ",";

    private final NamedParameterJdbcOperations jdbcOperations;
    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final KeywordExtractor keywordExtractor;
    private final Clock clock;

    JdbcKnowledgeStore(NamedParameterJdbcOperations jdbcOperations, TransactionTemplate transactionTemplate,
            KeywordExtractor keywordExtractor, Clock clock) {
        this.jdbcOperations = Objects.requireNonNull(jdbcOperations, "jdbcOperations");
        this.jdbcClient = JdbcClient.create(jdbcOperations);
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.keywordExtractor = Objects.requireNonNull(keywordExtractor, "keywordExtractor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long storeDocument(DocumentUpload upload, List<String> chunks) {
        Objects.requireNonNull(upload, "upload");
        long totalChars = chunks.stream().mapToLong(String::length).sum();
        Long documentId = transactionTemplate.execute(status -> {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcClient.sql(INSERT_DOCUMENT_SQL)
                    .param("community", upload.community())
                    .param("name", upload.name())
                    .param("format", upload.format().extension())
                    .param("sizeBytes", upload.sizeBytes())
                    .param("location", upload.location())
                    .param("chunkCount", chunks.size())
                    .param("totalChars", totalChars)
                    .param("uploadedBy", upload.uploadedBy())
                    .param("status", DocumentStatus.ACTIVE.columnValue())
                    .param("now", toTimestamp(clock.instant()))
                    .update(keyHolder, "id");
            long id = Objects.requireNonNull(keyHolder.getKey(), "generated document id").longValue();
            insertChunks(id, upload.community(), chunks);
            return id;
        });
        LOGGER.info("Stored document {} '{}' for community {} with {} chunks ({} chars)", documentId, upload.name(),
                upload.community(), chunks.size(), totalChars);
        return Objects.requireNonNull(documentId, "documentId");
    }

    private void insertChunks(long documentId, String community, List<String> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = new SqlParameterSource[chunks.size()];
        for (int index = 0; index < chunks.size(); index++) {
            String content = chunks.get(index);
            batch[index] = new MapSqlParameterSource()
                    .addValue("documentId", documentId)
                    .addValue("community", community)
                    .addValue("chunkIndex", index)
                    .addValue("content", content)
                    .addValue("keywords", String.join(KEYWORD_SEPARATOR, keywordExtractor.extract(content)))
                    .addValue("charCount", content.length());
        }
        jdbcOperations.batchUpdate(INSERT_CHUNK_SQL, batch);
    }

    @Override
    public void deleteDocument(long documentId) {
        transactionTemplate.executeWithoutResult(status -> {
            int updated = jdbcClient.sql("""
                    UPDATE knowledge_documents SET status = :deleted, updated_at = :now
                    WHERE id = :id AND status = :active
                    """)
                    .param("deleted", DocumentStatus.DELETED.columnValue())
                    .param("active", DocumentStatus.ACTIVE.columnValue())
                    .param("now", toTimestamp(clock.instant()))
                    .param("id", documentId)
                    .update();
            int removedChunks = jdbcClient.sql("DELETE FROM knowledge_chunks WHERE document_id = :id")
                    .param("id", documentId)
                    .update();
            if (updated > 0 || removedChunks > 0) {
                LOGGER.info("Deleted document {} and {} chunks", documentId, removedChunks);
            } else {
                LOGGER.debug("Document {} was already deleted or does not exist", documentId);
            }
        });
    }

    @Override
    public boolean hasKnowledge(String community) {
        Long count = jdbcClient.sql("""
                SELECT COUNT(*) FROM knowledge_documents WHERE community = :community AND status = :status
                """)
                .param("community", community)
                .param("status", DocumentStatus.ACTIVE.columnValue())
                .query(Long.class)
                .single();
        return count != null && count > 0;
    }

    @Override
    public List<KnowledgeChunk> listChunks(String community) {
        return jdbcClient.sql(LIST_CHUNKS_SQL)
                .param("community", community)
                .param("status", DocumentStatus.ACTIVE.columnValue())
                .query(ChunkRowMapper.INSTANCE)
                .list();
    }

    @Override
    public List<KnowledgeDocument> listDocuments(String community) {
        return jdbcClient.sql(SELECT_DOCUMENT_COLUMNS + " WHERE community = :community AND status = :status ORDER BY id")
                .param("community", community)
                .param("status", DocumentStatus.ACTIVE.columnValue())
                .query(DocumentRowMapper.INSTANCE)
                .list();
    }

    @Override
    public Optional<KnowledgeDocument> findDocument(long documentId) {
        return jdbcClient.sql(SELECT_DOCUMENT_COLUMNS + " WHERE id = :id")
                .param("id", documentId)
                .query(DocumentRowMapper.INSTANCE)
                .optional();
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private enum ChunkRowMapper implements RowMapper<KnowledgeChunk> {
        INSTANCE;

        @Override
        public KnowledgeChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            String keywords = rs.getString("keywords");
            return new KnowledgeChunk(
                    rs.getLong("id"),
                    rs.getLong("document_id"),
                    rs.getString("document_name"),
                    rs.getString("community"),
                    rs.getInt("chunk_index"),
                    rs.getString("content"),
                    keywords == null || keywords.isBlank() ? List.of()
                            : Arrays.asList(keywords.split(KEYWORD_SEPARATOR)),
                    rs.getInt("char_count"));
        }
    }

    private enum DocumentRowMapper implements RowMapper<KnowledgeDocument> {
        INSTANCE;

        @Override
        public KnowledgeDocument mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new KnowledgeDocument(
                    rs.getLong("id"),
                    rs.getString("community"),
                    rs.getString("name"),
                    DocumentFormat.fromExtension(rs.getString("format")),
                    rs.getLong("size_bytes"),
                    rs.getString("location"),
                    rs.getInt("chunk_count"),
                    rs.getLong("total_chars"),
                    rs.getLong("uploaded_by"),
                    DocumentStatus.fromColumnValue(rs.getString("status")),
                    toInstant(rs, "created_at"),
                    toInstant(rs, "updated_at"));
        }
    }
}
