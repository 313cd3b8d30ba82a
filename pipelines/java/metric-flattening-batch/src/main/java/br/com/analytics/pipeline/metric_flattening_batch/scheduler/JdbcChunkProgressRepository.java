package br.com.analytics.pipeline.metric_flattening_batch.scheduler;

import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkProgress;
import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkState;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Chunk progress kept in the batch metadata database next to the Spring Batch tables. Writes
 * commit in their own transaction so that a failed chunk stays recorded after the step
 * transaction rolls back.
 */
@Slf4j
public class JdbcChunkProgressRepository implements ChunkProgressRepository {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcChunkProgressRepository(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void initializeSchema() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS metric_flattening_chunk_progress (
                    run_key VARCHAR(512) NOT NULL,
                    chunk_index INT NOT NULL,
                    window_start TIMESTAMP NOT NULL,
                    window_end TIMESTAMP NOT NULL,
                    state VARCHAR(16) NOT NULL,
                    source_rows BIGINT NOT NULL,
                    output_rows BIGINT NOT NULL,
                    error_message VARCHAR(2000),
                    updated_at TIMESTAMP NOT NULL,
                    PRIMARY KEY (run_key, chunk_index)
                )
                """);
    }

    @Override
    public void save(ChunkProgress progress) {
        String update = """
                UPDATE metric_flattening_chunk_progress
                SET window_start = ?, window_end = ?, state = ?, source_rows = ?, output_rows = ?,
                    error_message = ?, updated_at = ?
                WHERE run_key = ? AND chunk_index = ?
                """;
        String insert = """
                INSERT INTO metric_flattening_chunk_progress (
                    run_key, chunk_index, window_start, window_end, state,
                    source_rows, output_rows, error_message, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Timestamp start = Timestamp.from(progress.window().start());
        Timestamp end = Timestamp.from(progress.window().end());
        Timestamp updatedAt = Timestamp.from(progress.updatedAt());
        String error = truncateError(progress.errorMessage());

        try {
            transactionTemplate.executeWithoutResult(status -> {
                int updated = jdbcTemplate.update(update,
                        start, end, progress.state().name(), progress.sourceRows(), progress.outputRows(),
                        error, updatedAt, progress.runKey(), progress.chunkIndex());
                if (updated == 0) {
                    jdbcTemplate.update(insert,
                            progress.runKey(), progress.chunkIndex(), start, end, progress.state().name(),
                            progress.sourceRows(), progress.outputRows(), error, updatedAt);
                }
            });
        } catch (Exception e) {
            log.error("Failed to save progress of chunk {} for run {}", progress.chunkIndex(), progress.runKey(), e);
            throw new RuntimeException("Failed to save chunk progress", e);
        }
    }

    @Override
    public Optional<ChunkProgress> find(String runKey, int chunkIndex) {
        String sql = """
                SELECT run_key, chunk_index, window_start, window_end, state,
                       source_rows, output_rows, error_message, updated_at
                FROM metric_flattening_chunk_progress
                WHERE run_key = ? AND chunk_index = ?
                """;
        List<ChunkProgress> rows = jdbcTemplate.query(sql, new ChunkProgressRowMapper(), runKey, chunkIndex);
        return rows.stream().findFirst();
    }

    @Override
    public List<ChunkProgress> findAll(String runKey) {
        String sql = """
                SELECT run_key, chunk_index, window_start, window_end, state,
                       source_rows, output_rows, error_message, updated_at
                FROM metric_flattening_chunk_progress
                WHERE run_key = ?
                ORDER BY chunk_index
                """;
        return jdbcTemplate.query(sql, new ChunkProgressRowMapper(), runKey);
    }

    @Override
    public void deleteFrom(String runKey, int fromIndex) {
        Integer deleted = transactionTemplate.execute(status -> jdbcTemplate.update(
                "DELETE FROM metric_flattening_chunk_progress WHERE run_key = ? AND chunk_index >= ?",
                runKey, fromIndex));
        log.debug("Removed progress of {} chunks from index {} for run {}", deleted, fromIndex, runKey);
    }

    private static String truncateError(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }

    private static class ChunkProgressRowMapper implements RowMapper<ChunkProgress> {
        @Override
        public ChunkProgress mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ChunkProgress(
                    rs.getString("run_key"),
                    rs.getInt("chunk_index"),
                    new TimeWindow(rs.getTimestamp("window_start").toInstant(), rs.getTimestamp("window_end").toInstant()),
                    ChunkState.valueOf(rs.getString("state")),
                    rs.getLong("source_rows"),
                    rs.getLong("output_rows"),
                    rs.getString("error_message"),
                    rs.getTimestamp("updated_at").toInstant()
            );
        }
    }
}
