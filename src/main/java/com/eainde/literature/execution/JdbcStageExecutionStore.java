package com.eainde.literature.execution;

import com.eainde.literature.model.Stage;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists stage execution records for debugging and observability.
 */
@Component
public class JdbcStageExecutionStore {

    private final DataSource dataSource;

    public JdbcStageExecutionStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Inserts a new execution record with RUNNING status when a stage starts.
     */
    public void insertRunning(StageExecutionRecord record) {
        String sql = """
            INSERT INTO stage_executions
                (execution_id, document_id, stage, status, started_at)
            VALUES (?, ?, ?, 'RUNNING', ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.executionId());
            ps.setLong(2, record.documentId());
            ps.setString(3, record.stage().name());
            ps.setString(4, record.startedAt().toString());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert stage execution record", e);
        }
    }

    /**
     * Updates an execution record to SUCCESS when the stage completes.
     */
    public void markSuccess(String executionId, String modelUsed, String attemptLog,
                            Instant startedAt, Instant completedAt) {
        String sql = """
            UPDATE stage_executions
            SET status = 'SUCCESS',
                model_used = ?,
                attempt_log = ?,
                completed_at = ?,
                duration_ms = ?
            WHERE execution_id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, modelUsed);
            ps.setString(2, attemptLog);
            ps.setString(3, completedAt.toString());
            ps.setLong(4, Duration.between(startedAt, completedAt).toMillis());
            ps.setString(5, executionId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark stage execution as SUCCESS", e);
        }
    }

    /**
     * Updates an execution record to FAILED when the stage throws or times out.
     */
    public void markFailed(String executionId, String errorMessage, Instant startedAt, Instant completedAt) {
        String sql = """
            UPDATE stage_executions
            SET status = 'FAILED',
                error_message = ?,
                completed_at = ?,
                duration_ms = ?
            WHERE execution_id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, errorMessage);
            ps.setString(2, completedAt.toString());
            ps.setLong(3, Duration.between(startedAt, completedAt).toMillis());
            ps.setString(4, executionId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark stage execution as FAILED", e);
        }
    }

    /**
     * Retrieves all execution records for a document, oldest first.
     */
    public List<StageExecutionRecord> findByDocument(long documentId) {
        String sql = """
            SELECT execution_id, document_id, stage, status, model_used, attempt_log,
                   error_message, started_at, completed_at, duration_ms
            FROM stage_executions
            WHERE document_id = ?
            ORDER BY started_at, rowid
            """;

        List<StageExecutionRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, documentId);

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query stage executions", e);
        }
    }

    /**
     * Finds executions left RUNNING longer than the threshold, e.g. by a killed worker.
     */
    public List<StageExecutionRecord> findStuckExecutions(Duration threshold) {
        String sql = """
            SELECT execution_id, document_id, stage, status, model_used, attempt_log,
                   error_message, started_at, completed_at, duration_ms
            FROM stage_executions
            WHERE status = 'RUNNING' AND started_at < ?
            ORDER BY started_at
            """;

        List<StageExecutionRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, Instant.now().minus(threshold).toString());

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query stuck stage executions", e);
        }
    }

    private StageExecutionRecord mapRow(ResultSet rs) throws SQLException {
        String completedAt = rs.getString("completed_at");
        return new StageExecutionRecord(
                rs.getString("execution_id"),
                rs.getLong("document_id"),
                Stage.valueOf(rs.getString("stage")),
                rs.getString("status"),
                rs.getString("model_used"),
                rs.getString("attempt_log"),
                rs.getString("error_message"),
                Instant.parse(rs.getString("started_at")),
                completedAt != null ? Instant.parse(completedAt) : null,
                rs.getLong("duration_ms")
        );
    }
}
