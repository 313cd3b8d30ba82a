package br.com.analytics.pipeline.metric_flattening_batch.reader;

import br.com.analytics.pipeline.metric_flattening_batch.exception.MalformedRowException;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceColumns;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SourceRowRowMapper implements RowMapper<SourceRow> {

    @Override
    public SourceRow mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        Map<String, Object> descriptive = new LinkedHashMap<>();
        for (String column : SourceColumns.DESCRIPTIVE) {
            descriptive.put(column, resultSet.getObject(column));
        }

        Timestamp timestamp = resultSet.getTimestamp(SourceColumns.TIMESTAMP);
        int customerId = resultSet.getInt(SourceColumns.CUSTOMER_ID);
        return new SourceRow(
                timestamp == null ? null : timestamp.toInstant(),
                customerId,
                resultSet.getString(SourceColumns.CLIENT_ID),
                resultSet.getString(SourceColumns.SESSION_ID),
                resultSet.getString(SourceColumns.FLOW_ID),
                descriptive,
                readGroups(resultSet, MetricKind.INT, rowNum),
                readGroups(resultSet, MetricKind.FLOAT, rowNum)
        );
    }

    private List<Map<String, Number>> readGroups(ResultSet resultSet, MetricKind kind, int rowNum) throws SQLException {
        List<Map<String, Number>> groups = new ArrayList<>(SourceRow.GROUP_COUNT);
        for (int group = 1; group <= SourceRow.GROUP_COUNT; group++) {
            String column = kind.sourceGroupColumn(group);
            groups.add(toMetricMap(resultSet.getObject(column), kind, column, rowNum));
        }
        return groups;
    }

    static Map<String, Number> toMetricMap(Object value, MetricKind kind, String column, int rowNum) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new MalformedRowException("Row " + rowNum + ": column " + column
                    + " is not a map but " + value.getClass().getName());
        }
        Map<String, Number> metrics = new LinkedHashMap<>(raw.size() * 2);
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new MalformedRowException("Row " + rowNum + ": column " + column + " has key " + entry.getKey());
            }
            metrics.put(key, toNumber(entry.getValue(), kind, column, key, rowNum));
        }
        return metrics;
    }

    private static Number toNumber(Object value, MetricKind kind, String column, String key, int rowNum) {
        if (value instanceof Number number) {
            return number;
        }
        if (!(value instanceof String text)) {
            throw new MalformedRowException("Row " + rowNum + ": " + column + "['" + key + "'] is not numeric: " + value);
        }
        try {
            return kind == MetricKind.INT ? (Number) Long.valueOf(text.trim()) : (Number) Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRowException("Row " + rowNum + ": " + column + "['" + key + "'] is not numeric: " + value);
        }
    }
}
