package br.com.analytics.pipeline.metric_flattening_batch.reader;

import br.com.analytics.pipeline.metric_flattening_batch.exception.MalformedRowException;
import br.com.analytics.pipeline.metric_flattening_batch.exception.SourceReadTimeoutException;
import br.com.analytics.pipeline.metric_flattening_batch.exception.SourceUnavailableException;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceColumns;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the map-column source table through JDBC, pushing the time range and customer
 * predicates down to the store.
 */
@Slf4j
public class JdbcSourceRowReader implements SourceRowReader {

    private final JdbcTemplate jdbcTemplate;
    private final String sourceTable;
    private final SourceRowRowMapper rowMapper = new SourceRowRowMapper();

    public JdbcSourceRowReader(JdbcTemplate jdbcTemplate, String sourceTable) {
        this.jdbcTemplate = jdbcTemplate;
        this.sourceTable = sourceTable;
    }

    @Override
    public void read(SourceQuery query, SourceRowCallback callback) {
        String sql = buildSql(query);
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(query.window().start()));
        args.add(Timestamp.from(query.window().end()));
        args.addAll(query.customerIds());

        int[] rowNum = {0};
        RowCallbackHandler handler = resultSet -> {
            SourceRow row;
            try {
                row = rowMapper.mapRow(resultSet, rowNum[0]++);
            } catch (MalformedRowException e) {
                callback.onMalformedRow(e);
                return;
            }
            callback.onRow(row);
        };

        try {
            jdbcTemplate.query(sql, handler, args.toArray());
        } catch (QueryTimeoutException e) {
            log.error("Timed out reading {} for {}", sourceTable, query.window(), e);
            throw new SourceReadTimeoutException("Timed out reading " + sourceTable + " for " + query.window(), e);
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.error("Source table {} unavailable for {}", sourceTable, query.window(), e);
            throw new SourceUnavailableException("Source table " + sourceTable + " unavailable", e);
        }
        log.debug("Read {} rows from {} for {} customers {}", rowNum[0], sourceTable, query.window(), query.customerIds());
    }

    String buildSql(SourceQuery query) {
        List<String> columns = new ArrayList<>();
        columns.add(SourceColumns.TIMESTAMP);
        columns.add(SourceColumns.CUSTOMER_ID);
        columns.add(SourceColumns.CLIENT_ID);
        columns.add(SourceColumns.SESSION_ID);
        columns.add(SourceColumns.FLOW_ID);
        columns.addAll(SourceColumns.DESCRIPTIVE);
        for (MetricKind kind : MetricKind.values()) {
            for (int group = 1; group <= SourceRow.GROUP_COUNT; group++) {
                columns.add(kind.sourceGroupColumn(group));
            }
        }

        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(String.join(", ", columns))
                .append(" FROM ").append(sourceTable)
                .append(" WHERE ").append(SourceColumns.TIMESTAMP).append(" >= ?")
                .append(" AND ").append(SourceColumns.TIMESTAMP).append(" < ?");
        if (!query.customerIds().isEmpty()) {
            sql.append(" AND ").append(SourceColumns.CUSTOMER_ID).append(" IN (")
                    .append(String.join(",", Collections.nCopies(query.customerIds().size(), "?")))
                    .append(")");
        }
        return sql.toString();
    }
}
