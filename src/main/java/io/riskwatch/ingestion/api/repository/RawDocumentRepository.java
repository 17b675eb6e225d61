package io.riskwatch.ingestion.api.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.riskwatch.ingestion.api.model.DocumentStatus;
import io.riskwatch.ingestion.api.model.RawDocument;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQL access to the {@code raw_docs} landing-zone table. Status transitions are single statements.
 */
@Repository
public class RawDocumentRepository {

    private static final TypeReference<LinkedHashMap<String, Object>> META_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
            "raw_id, source, payload, meta, retries, status, fetched_at, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<RawDocument> rowMapper = this::mapRow;

    public RawDocumentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Plain insert. A primary-key collision surfaces as {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void insert(RawDocument document) {
        jdbcTemplate.update(
                "INSERT INTO raw_docs (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                document.rawId(),
                document.source(),
                document.payload(),
                writeMeta(document.meta()),
                document.retries(),
                document.status().dbValue(),
                Timestamp.from(document.fetchedAt()),
                Timestamp.from(document.createdAt()),
                Timestamp.from(document.updatedAt())
        );
    }

    public Optional<RawDocument> findById(String rawId) {
        List<RawDocument> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM raw_docs WHERE raw_id = ?", rowMapper, rawId);
        return rows.stream().findFirst();
    }

    public int markParsed(String rawId, Instant now) {
        return jdbcTemplate.update(
                "UPDATE raw_docs SET status = 'parsed', updated_at = ? WHERE raw_id = ? AND status IN ('pending', 'error')",
                Timestamp.from(now), rawId);
    }

    /**
     * Increments retries and ratchets status in one statement; right-hand sides see the pre-update row.
     */
    public int markError(String rawId, int maxRetries, Instant now) {
        return jdbcTemplate.update("""
                UPDATE raw_docs
                   SET retries = retries + 1,
                       status = CASE
                                    WHEN status = 'dlq' THEN 'dlq'
                                    WHEN retries + 1 >= ? THEN 'dlq'
                                    ELSE 'error'
                                END,
                       updated_at = ?
                 WHERE raw_id = ? AND status <> 'parsed'
                """, maxRetries, Timestamp.from(now), rawId);
    }

    public List<RawDocument> findByStatus(DocumentStatus status, int limit) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM raw_docs WHERE status = ? ORDER BY fetched_at, raw_id LIMIT ?",
                rowMapper, status.dbValue(), limit);
    }

    public int deleteParsedFetchedBefore(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM raw_docs WHERE status = 'parsed' AND fetched_at < ?", Timestamp.from(cutoff));
    }

    public Map<DocumentStatus, Long> countByStatus() {
        Map<DocumentStatus, Long> counts = new EnumMap<>(DocumentStatus.class);
        for (DocumentStatus status : DocumentStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query("SELECT status, COUNT(*) AS total FROM raw_docs GROUP BY status", (RowCallbackHandler) rs ->
                counts.put(DocumentStatus.fromDb(rs.getString("status")), rs.getLong("total")));
        return counts;
    }

    private RawDocument mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new RawDocument(
                rs.getString("raw_id"),
                rs.getString("source"),
                rs.getBytes("payload"),
                readMeta(rs.getString("meta")),
                rs.getInt("retries"),
                DocumentStatus.fromDb(rs.getString("status")),
                rs.getTimestamp("fetched_at").toInstant(),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
        );
    }

    private String writeMeta(Map<String, Object> meta) {
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize document meta", e);
        }
    }

    private Map<String, Object> readMeta(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, META_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize document meta", e);
        }
    }
}
