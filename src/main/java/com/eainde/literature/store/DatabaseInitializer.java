package com.eainde.literature.store;

import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.schema.SchemaField;
import jakarta.annotation.PostConstruct;
import lombok.extern.log4j.Log4j2;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates the pipeline tables. The {@code records} table gets one column per
 * schema field; fields missing from an existing table are added as nullable columns.
 */
@Log4j2
@Component
public class DatabaseInitializer {

    private final JdbcTemplate jdbcTemplate;
    private final RecordSchema schema;

    public DatabaseInitializer(JdbcTemplate jdbcTemplate, RecordSchema schema) {
        this.jdbcTemplate = jdbcTemplate;
        this.schema = schema;
    }

    @PostConstruct
    public void initialize() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS documents (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    file_name TEXT NOT NULL,
                    file_path TEXT,
                    file_hash TEXT NOT NULL UNIQUE,
                    file_size INTEGER,
                    upload_timestamp TEXT NOT NULL,
                    title TEXT,
                    first_author_lastname TEXT,
                    authors TEXT,
                    publication_year INTEGER,
                    doi TEXT,
                    journal TEXT,
                    volume TEXT,
                    issue TEXT,
                    pages TEXT,
                    issn TEXT,
                    publisher TEXT,
                    bibliography TEXT,
                    language TEXT,
                    document_content TEXT,
                    ocr_images TEXT,
                    ocr_provider TEXT,
                    ocr_audit TEXT,
                    ocr_status TEXT,
                    metadata_status TEXT,
                    extraction_status TEXT,
                    refinement_status TEXT,
                    metadata_llm_model TEXT,
                    metadata_log TEXT,
                    extraction_llm_model TEXT,
                    extraction_log TEXT,
                    refinement_llm_model TEXT,
                    refinement_log TEXT,
                    records_extracted INTEGER NOT NULL DEFAULT 0,
                    reviewed_at TEXT
                )
                """);
        if (!existingColumns("documents").contains("ocr_audit")) {
            log.warn("Documents table lacks 'ocr_audit'; adding it as a nullable column");
            jdbcTemplate.execute("ALTER TABLE documents ADD COLUMN ocr_audit TEXT");
        }

        createRecordsTable();

        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS record_edits (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    document_id INTEGER NOT NULL REFERENCES documents(id),
                    record_id INTEGER NOT NULL REFERENCES records(id),
                    column_name TEXT NOT NULL,
                    original_value TEXT,
                    new_value TEXT,
                    edited_at TEXT NOT NULL
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_record_edits_document ON record_edits(document_id)");

        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS stage_executions (
                    execution_id TEXT PRIMARY KEY,
                    document_id INTEGER NOT NULL,
                    stage TEXT NOT NULL,
                    status TEXT NOT NULL,
                    model_used TEXT,
                    attempt_log TEXT,
                    error_message TEXT,
                    started_at TEXT NOT NULL,
                    completed_at TEXT,
                    duration_ms INTEGER
                )
                """);
        log.info("Database initialised ({} record schema columns)", schema.size());
    }

    private void createRecordsTable() {
        String schemaColumns = schema.fields().values().stream()
                .map(f -> "    " + f.name() + " " + f.type().columnType() + ",\n")
                .collect(Collectors.joining());

        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS records (\n"
                + "    id INTEGER PRIMARY KEY AUTOINCREMENT,\n"
                + "    document_id INTEGER NOT NULL REFERENCES documents(id),\n"
                + "    record_id TEXT NOT NULL,\n"
                + schemaColumns
                + "    extraction_timestamp TEXT,\n"
                + "    llm_model TEXT,\n"
                + "    prompt_hash TEXT,\n"
                + "    added_by_user INTEGER NOT NULL DEFAULT 0,\n"
                + "    deleted_by_user INTEGER NOT NULL DEFAULT 0,\n"
                + "    human_edited INTEGER NOT NULL DEFAULT 0\n"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_records_document ON records(document_id)");

        Set<String> existing = new HashSet<>(existingColumns("records"));
        for (SchemaField field : schema.fields().values()) {
            if (!existing.contains(field.name())) {
                log.warn("Records table lacks schema field '{}'; adding it as a nullable column", field.name());
                jdbcTemplate.execute("ALTER TABLE records ADD COLUMN " + field.name() + " " + field.type().columnType());
            }
        }
    }

    List<String> existingColumns(String table) {
        return jdbcTemplate.query("PRAGMA table_info(" + table + ")", (rs, rowNum) -> rs.getString("name"));
    }
}
