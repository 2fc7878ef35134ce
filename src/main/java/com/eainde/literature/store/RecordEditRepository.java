package com.eainde.literature.store;

import com.eainde.literature.model.RecordEdit;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.eainde.literature.store.DocumentRepository.parseInstant;
import static com.eainde.literature.store.DocumentRepository.toText;

/**
 * Append-only audit log of reviewer edits.
 */
@Repository
public class RecordEditRepository {

    private static final RowMapper<RecordEdit> ROW_MAPPER = (rs, rowNum) -> new RecordEdit(
            rs.getLong("id"),
            rs.getLong("document_id"),
            rs.getLong("record_id"),
            rs.getString("column_name"),
            rs.getString("original_value"),
            rs.getString("new_value"),
            parseInstant(rs.getString("edited_at")));

    private final JdbcTemplate jdbcTemplate;

    public RecordEditRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void append(RecordEdit edit) {
        jdbcTemplate.update("""
                INSERT INTO record_edits (document_id, record_id, column_name, original_value, new_value, edited_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                edit.documentId(), edit.recordId(), edit.columnName(),
                edit.originalValue(), edit.newValue(), toText(edit.editedAt()));
    }

    public List<RecordEdit> findByDocument(long documentId) {
        return jdbcTemplate.query(
                "SELECT * FROM record_edits WHERE document_id = ? ORDER BY id", ROW_MAPPER, documentId);
    }
}
