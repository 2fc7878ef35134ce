package com.eainde.literature.store;

import com.eainde.literature.model.Document;
import com.eainde.literature.model.DocumentStats;
import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.model.Stage;
import com.eainde.literature.model.StageStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Documents table access. Every write touches one document row.
 */
@Log4j2
@Repository
public class DocumentRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Document> rowMapper = this::mapRow;

    public DocumentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    // =========================================================================
    //  Queries
    // =========================================================================

    public Optional<Document> findById(long id) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                    "SELECT * FROM documents WHERE id = ?", rowMapper, id));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    public Optional<Document> findByHash(String fileHash) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                    "SELECT * FROM documents WHERE file_hash = ?", rowMapper, fileHash));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    public List<Document> findAll() {
        return jdbcTemplate.query("SELECT * FROM documents ORDER BY id", rowMapper);
    }

    public List<Document> findReviewed() {
        return jdbcTemplate.query("SELECT * FROM documents WHERE reviewed_at IS NOT NULL ORDER BY id", rowMapper);
    }

    public DocumentStats stats() {
        Long documents = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM documents", Long.class);
        Long records = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM records WHERE deleted_by_user = 0", Long.class);
        Long reviewed = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM documents WHERE reviewed_at IS NOT NULL", Long.class);
        return new DocumentStats(nvl(documents), nvl(records), nvl(reviewed));
    }

    // =========================================================================
    //  Writes
    // =========================================================================

    /**
     * Inserts a newly seen document and returns its surrogate id.
     */
    public long insert(Document document) {
        String sql = """
                INSERT INTO documents (file_name, file_path, file_hash, file_size, upload_timestamp)
                VALUES (?, ?, ?, ?, ?)
                """;
        Long id = jdbcTemplate.execute((Connection conn) -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, document.fileName());
                ps.setString(2, document.filePath());
                ps.setString(3, document.fileHash());
                setNullableLong(ps, 4, document.fileSize());
                ps.setString(5, toText(document.uploadTimestamp() != null ? document.uploadTimestamp() : Instant.now()));
                ps.executeUpdate();
            }
            return lastInsertId(conn);
        });
        log.info("Registered document {} as id {}", document.fileName(), id);
        return id;
    }

    public void updateStatus(long documentId, Stage stage, StageStatus status) {
        jdbcTemplate.update("UPDATE documents SET " + stage.statusColumn() + " = ? WHERE id = ?",
                status.toColumnValue(), documentId);
    }

    /**
     * Clears the given stages' statuses in one statement.
     */
    public void resetStatuses(long documentId, Collection<Stage> stages) {
        if (stages.isEmpty()) return;
        String assignments = stages.stream()
                .map(s -> s.statusColumn() + " = NULL")
                .collect(Collectors.joining(", "));
        jdbcTemplate.update("UPDATE documents SET " + assignments + " WHERE id = ?", documentId);
    }

    public void saveOcrResult(long documentId, String content, String imagesJson, String provider) {
        jdbcTemplate.update("""
                UPDATE documents
                SET document_content = ?, ocr_images = ?, ocr_provider = ?
                WHERE id = ?
                """, content, imagesJson, provider, documentId);
    }

    /**
     * Stores the OCR quality audit as JSON; null clears an audit of earlier OCR text.
     */
    public void saveOcrAudit(long documentId, String auditJson) {
        jdbcTemplate.update("UPDATE documents SET ocr_audit = ? WHERE id = ?", auditJson, documentId);
    }

    /**
     * Saves metadata; a non-null new value replaces the stored one, a null keeps it.
     */
    public void saveMetadata(long documentId, PublicationMetadata metadata, String llmModel, String attemptLog) {
        String sql = """
                UPDATE documents SET
                    title = COALESCE(?, title),
                    first_author_lastname = COALESCE(?, first_author_lastname),
                    authors = COALESCE(?, authors),
                    publication_year = COALESCE(?, publication_year),
                    doi = COALESCE(?, doi),
                    journal = COALESCE(?, journal),
                    volume = COALESCE(?, volume),
                    issue = COALESCE(?, issue),
                    pages = COALESCE(?, pages),
                    issn = COALESCE(?, issn),
                    publisher = COALESCE(?, publisher),
                    bibliography = COALESCE(?, bibliography),
                    language = COALESCE(?, language),
                    metadata_llm_model = ?,
                    metadata_log = ?
                WHERE id = ?
                """;
        jdbcTemplate.update(sql, ps -> {
            ps.setString(1, metadata.title());
            ps.setString(2, metadata.firstAuthorLastname());
            ps.setString(3, toJson(metadata.authors()));
            if (metadata.publicationYear() != null) {
                ps.setInt(4, metadata.publicationYear());
            } else {
                ps.setNull(4, Types.INTEGER);
            }
            ps.setString(5, metadata.doi());
            ps.setString(6, metadata.journal());
            ps.setString(7, metadata.volume());
            ps.setString(8, metadata.issue());
            ps.setString(9, metadata.pages());
            ps.setString(10, metadata.issn());
            ps.setString(11, metadata.publisher());
            ps.setString(12, toJson(metadata.bibliography()));
            ps.setString(13, metadata.language());
            ps.setString(14, llmModel);
            ps.setString(15, attemptLog);
            ps.setLong(16, documentId);
        });
    }

    public void saveExtractionInfo(long documentId, int recordsExtracted, String llmModel, String attemptLog) {
        jdbcTemplate.update("""
                UPDATE documents
                SET records_extracted = ?, extraction_llm_model = ?, extraction_log = ?
                WHERE id = ?
                """, recordsExtracted, llmModel, attemptLog, documentId);
    }

    public void saveRefinementInfo(long documentId, String llmModel, String attemptLog) {
        jdbcTemplate.update("""
                UPDATE documents
                SET refinement_llm_model = ?, refinement_log = ?
                WHERE id = ?
                """, llmModel, attemptLog, documentId);
    }

    public void markReviewed(long documentId, Instant reviewedAt) {
        jdbcTemplate.update("UPDATE documents SET reviewed_at = ? WHERE id = ?", toText(reviewedAt), documentId);
    }

    // =========================================================================
    //  Mapping
    // =========================================================================

    private Document mapRow(ResultSet rs, int rowNum) throws SQLException {
        PublicationMetadata metadata = PublicationMetadata.builder()
                .title(rs.getString("title"))
                .firstAuthorLastname(rs.getString("first_author_lastname"))
                .authors(fromJson(rs.getString("authors")))
                .publicationYear(getNullableInt(rs, "publication_year"))
                .doi(rs.getString("doi"))
                .journal(rs.getString("journal"))
                .volume(rs.getString("volume"))
                .issue(rs.getString("issue"))
                .pages(rs.getString("pages"))
                .issn(rs.getString("issn"))
                .publisher(rs.getString("publisher"))
                .bibliography(fromJson(rs.getString("bibliography")))
                .language(rs.getString("language"))
                .build();

        return Document.builder()
                .id(rs.getLong("id"))
                .fileName(rs.getString("file_name"))
                .filePath(rs.getString("file_path"))
                .fileHash(rs.getString("file_hash"))
                .fileSize(getNullableLong(rs, "file_size"))
                .uploadTimestamp(parseInstant(rs.getString("upload_timestamp")))
                .documentContent(rs.getString("document_content"))
                .ocrImages(rs.getString("ocr_images"))
                .ocrProvider(rs.getString("ocr_provider"))
                .ocrAudit(rs.getString("ocr_audit"))
                .metadata(metadata)
                .ocrStatus(StageStatus.fromColumnValue(rs.getString("ocr_status")))
                .metadataStatus(StageStatus.fromColumnValue(rs.getString("metadata_status")))
                .extractionStatus(StageStatus.fromColumnValue(rs.getString("extraction_status")))
                .refinementStatus(StageStatus.fromColumnValue(rs.getString("refinement_status")))
                .metadataLlmModel(rs.getString("metadata_llm_model"))
                .extractionLlmModel(rs.getString("extraction_llm_model"))
                .refinementLlmModel(rs.getString("refinement_llm_model"))
                .recordsExtracted(getNullableInt(rs, "records_extracted"))
                .reviewedAt(parseInstant(rs.getString("reviewed_at")))
                .build();
    }

    static long lastInsertId(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    static Instant parseInstant(String text) {
        return text != null && !text.isBlank() ? Instant.parse(text) : null;
    }

    static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }

    private String toJson(List<String> values) {
        if (values == null || values.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise string list", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Stored list is not a JSON array, keeping it as a single entry: {}", e.getOriginalMessage());
            return List.of(json);
        }
    }

    private static long nvl(Long value) {
        return value != null ? value : 0L;
    }
}
