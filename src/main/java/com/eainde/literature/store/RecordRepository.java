package com.eainde.literature.store;

import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.schema.SchemaField;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.eainde.literature.store.DocumentRepository.lastInsertId;
import static com.eainde.literature.store.DocumentRepository.parseInstant;
import static com.eainde.literature.store.DocumentRepository.toText;

/**
 * Records table access. Column names come from the active {@link RecordSchema},
 * which only admits identifier-safe names.
 *
 * <p>Automated writes are split by intent: {@link #insert} for extraction, and
 * {@link #updateUnprotected} for refinement, which never touches rows a reviewer
 * edited or deleted. Reviewer writes go through {@link #applyReviewChanges} and
 * {@link #softDelete}.</p>
 */
@Repository
public class RecordRepository {

    private final JdbcTemplate jdbcTemplate;
    private final RecordSchema schema;
    private final RowMapper<ExtractedRecord> rowMapper = this::mapRow;

    public RecordRepository(JdbcTemplate jdbcTemplate, RecordSchema schema) {
        this.jdbcTemplate = jdbcTemplate;
        this.schema = schema;
    }

    // =========================================================================
    //  Queries
    // =========================================================================

    /**
     * All rows of a document, soft-deleted and human-edited ones included.
     */
    public List<ExtractedRecord> findByDocument(long documentId) {
        return jdbcTemplate.query("SELECT * FROM records WHERE document_id = ? ORDER BY id", rowMapper, documentId);
    }

    public List<ExtractedRecord> findActiveByDocument(long documentId) {
        return jdbcTemplate.query(
                "SELECT * FROM records WHERE document_id = ? AND deleted_by_user = 0 ORDER BY id",
                rowMapper, documentId);
    }

    public int countActive(long documentId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM records WHERE document_id = ? AND deleted_by_user = 0",
                Integer.class, documentId);
        return count != null ? count : 0;
    }

    // =========================================================================
    //  Writes
    // =========================================================================

    /**
     * Inserts a new row and returns it with its surrogate id.
     */
    public ExtractedRecord insert(ExtractedRecord record) {
        List<String> columns = new ArrayList<>(List.of("document_id", "record_id"));
        columns.addAll(schema.fieldNames());
        columns.addAll(List.of("extraction_timestamp", "llm_model", "prompt_hash",
                "added_by_user", "deleted_by_user", "human_edited"));

        String sql = "INSERT INTO records (" + String.join(", ", columns) + ") VALUES ("
                + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";

        Long id = jdbcTemplate.execute((Connection conn) -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int i = 1;
                ps.setLong(i++, record.documentId());
                ps.setString(i++, record.recordId());
                for (SchemaField field : schema.fields().values()) {
                    ps.setObject(i++, field.toColumnValue(record.field(field.name())));
                }
                ps.setString(i++, toText(record.extractionTimestamp()));
                ps.setString(i++, record.llmModel());
                ps.setString(i++, record.promptHash());
                ps.setInt(i++, record.addedByUser() ? 1 : 0);
                ps.setInt(i++, record.deletedByUser() ? 1 : 0);
                ps.setInt(i, record.humanEdited() ? 1 : 0);
                ps.executeUpdate();
            }
            return lastInsertId(conn);
        });
        return record.toBuilder().id(id).build();
    }

    /**
     * Updates schema fields of the row matched by business key, unless a reviewer
     * edited or deleted it.
     *
     * @return number of rows updated (0 when unmatched or protected)
     */
    public int updateUnprotected(long documentId, String recordId, Map<String, JsonNode> values) {
        Map<String, Object> columnValues = toColumnValues(values);
        if (columnValues.isEmpty()) return 0;

        String assignments = columnValues.keySet().stream()
                .map(c -> c + " = ?")
                .collect(Collectors.joining(", "));
        List<Object> args = new ArrayList<>(columnValues.values());
        args.add(documentId);
        args.add(recordId);
        return jdbcTemplate.update("UPDATE records SET " + assignments
                + " WHERE document_id = ? AND record_id = ? AND human_edited = 0 AND deleted_by_user = 0",
                args.toArray());
    }

    /**
     * Applies reviewer changes by surrogate id and flags the row as human-edited.
     * {@code newRecordId} may be null to keep the business key.
     */
    public void applyReviewChanges(long id, String newRecordId, Map<String, JsonNode> values) {
        Map<String, Object> columnValues = new LinkedHashMap<>();
        if (newRecordId != null) {
            columnValues.put("record_id", newRecordId);
        }
        values.forEach((name, value) -> {
            SchemaField field = schema.field(name);
            if (field != null) columnValues.put(name, field.toColumnValue(value));
        });

        StringBuilder sql = new StringBuilder("UPDATE records SET human_edited = 1");
        columnValues.keySet().forEach(c -> sql.append(", ").append(c).append(" = ?"));
        sql.append(" WHERE id = ?");
        List<Object> args = new ArrayList<>(columnValues.values());
        args.add(id);
        jdbcTemplate.update(sql.toString(), args.toArray());
    }

    public void softDelete(long id) {
        jdbcTemplate.update("UPDATE records SET deleted_by_user = 1 WHERE id = ?", id);
    }

    // =========================================================================
    //  Mapping
    // =========================================================================

    private Map<String, Object> toColumnValues(Map<String, JsonNode> values) {
        Map<String, Object> columnValues = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            SchemaField field = schema.field(name);
            if (field != null) columnValues.put(name, field.toColumnValue(value));
        });
        return columnValues;
    }

    private ExtractedRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        for (SchemaField field : schema.fields().values()) {
            fields.put(field.name(), field.fromColumnValue(rs.getObject(field.name())));
        }
        return ExtractedRecord.builder()
                .id(rs.getLong("id"))
                .documentId(rs.getLong("document_id"))
                .recordId(rs.getString("record_id"))
                .fields(fields)
                .addedByUser(rs.getInt("added_by_user") != 0)
                .deletedByUser(rs.getInt("deleted_by_user") != 0)
                .humanEdited(rs.getInt("human_edited") != 0)
                .llmModel(rs.getString("llm_model"))
                .promptHash(rs.getString("prompt_hash"))
                .extractionTimestamp(parseInstant(rs.getString("extraction_timestamp")))
                .build();
    }
}
