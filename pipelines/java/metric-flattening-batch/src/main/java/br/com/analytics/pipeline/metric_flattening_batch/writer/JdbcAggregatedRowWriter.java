package br.com.analytics.pipeline.metric_flattening_batch.writer;

import br.com.analytics.pipeline.metric_flattening_batch.exception.WriteFailureException;
import br.com.analytics.pipeline.metric_flattening_batch.model.AggregatedRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceColumns;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import br.com.analytics.pipeline.metric_flattening_batch.schema.SchemaPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes flattened rows into the fixed-column target table. The insert statement is built once
 * from the {@link SchemaPlan}; every row must carry exactly the planned number of slots.
 */
@Slf4j
public class JdbcAggregatedRowWriter implements AggregatedRowWriter {

    private final String targetTable;
    private final SchemaPlan plan;
    private final JdbcTemplate jdbcTemplate;
    private final JdbcBatchItemWriter<AggregatedRow> delegateWriter;

    public JdbcAggregatedRowWriter(DataSource targetDataSource, JdbcTemplate jdbcTemplate, String targetTable, SchemaPlan plan) {
        this.targetTable = targetTable;
        this.plan = plan;
        this.jdbcTemplate = jdbcTemplate;
        this.delegateWriter = createDelegateWriter(targetDataSource);
    }

    private JdbcBatchItemWriter<AggregatedRow> createDelegateWriter(DataSource dataSource) {
        List<String> columns = insertColumns();
        String sqlInsert = "INSERT INTO " + targetTable + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";

        return new JdbcBatchItemWriterBuilder<AggregatedRow>()
                .dataSource(dataSource)
                .sql(sqlInsert)
                .itemPreparedStatementSetter(this::bindRow)
                .assertUpdates(false)
                .build();
    }

    List<String> insertColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(SourceColumns.TIMESTAMP);
        columns.add(SourceColumns.CUSTOMER_ID);
        columns.add(SourceColumns.CLIENT_ID);
        columns.add(SourceColumns.SESSION_ID);
        columns.addAll(SourceColumns.DESCRIPTIVE);
        columns.addAll(plan.metricColumns());
        return columns;
    }

    private void bindRow(AggregatedRow row, PreparedStatement ps) throws SQLException {
        if (row.intSlotCount() != plan.intColumnCount() || row.floatSlotCount() != plan.floatColumnCount()) {
            throw new IllegalArgumentException("Row " + row.key() + " has " + row.intSlotCount() + " int and "
                    + row.floatSlotCount() + " float slots, table has " + plan.intColumnCount() + " and "
                    + plan.floatColumnCount());
        }
        int index = 1;
        ps.setTimestamp(index++, Timestamp.from(row.key().minuteBucket()));
        ps.setInt(index++, row.key().customerId());
        ps.setString(index++, row.key().clientId());
        ps.setString(index++, row.key().sessionId());
        for (String column : SourceColumns.DESCRIPTIVE) {
            ps.setObject(index++, row.descriptiveColumns().get(column));
        }
        for (int slot = 0; slot < row.intSlotCount(); slot++) {
            ps.setInt(index++, row.intSlot(slot));
        }
        for (int slot = 0; slot < row.floatSlotCount(); slot++) {
            ps.setFloat(index++, row.floatSlot(slot));
        }
    }

    @Override
    public void write(List<AggregatedRow> rows) {
        if (rows.isEmpty()) {
            log.info("No new aggregation to write to {}", targetTable);
            return;
        }
        log.info("Inserting {} rows into {}", rows.size(), targetTable);
        try {
            delegateWriter.write(new Chunk<>(rows));
        } catch (Exception e) {
            log.error("Failed to insert batch of {} rows into {}", rows.size(), targetTable, e);
            throw new WriteFailureException("Failed to insert batch of " + rows.size() + " rows into " + targetTable, e);
        }
        log.info("Successfully inserted {} rows", rows.size());
    }

    @Override
    public void deleteRange(TimeWindow window, List<Integer> customerIds) {
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(targetTable)
                .append(" WHERE ").append(SourceColumns.TIMESTAMP).append(" >= ?")
                .append(" AND ").append(SourceColumns.TIMESTAMP).append(" < ?");
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(window.start()));
        args.add(Timestamp.from(window.end()));
        if (!customerIds.isEmpty()) {
            sql.append(" AND ").append(SourceColumns.CUSTOMER_ID).append(" IN (")
                    .append(String.join(",", Collections.nCopies(customerIds.size(), "?")))
                    .append(")");
            args.addAll(customerIds);
        }

        try {
            int deleted = jdbcTemplate.update(sql.toString(), args.toArray());
            log.info("Cleared {} for {} before replay ({} rows reported)", targetTable, window, deleted);
        } catch (DataAccessException e) {
            log.error("Failed to clear {} for {}", targetTable, window, e);
            throw new WriteFailureException("Failed to clear " + targetTable + " for " + window, e);
        }
    }

    @Override
    public void truncate() {
        log.info("Truncating destination table {} for fresh data load", targetTable);
        try {
            jdbcTemplate.execute("TRUNCATE TABLE " + targetTable);
        } catch (DataAccessException e) {
            log.error("Failed to truncate {}", targetTable, e);
            throw new WriteFailureException("Failed to truncate " + targetTable, e);
        }
    }
}
