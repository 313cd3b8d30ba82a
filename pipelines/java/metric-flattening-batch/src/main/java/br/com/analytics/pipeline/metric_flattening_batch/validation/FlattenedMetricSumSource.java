package br.com.analytics.pipeline.metric_flattening_batch.validation;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceColumns;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;

@RequiredArgsConstructor
public class FlattenedMetricSumSource implements MetricSumSource {

    private final JdbcTemplate jdbcTemplate;
    private final String targetTable;
    private final KeyCatalog catalog;

    @Override
    public MetricSum sum(ProbeSpec probe, TimeWindow window) {
        String column = catalog.columnFor(probe.kind(), probe.metricKey());
        if (column == null) {
            throw new IllegalArgumentException(probe.kind() + " metric '" + probe.metricKey() + "' is not in the key catalog");
        }

        String sql = "SELECT sum(" + column + ") AS metric_sum, countIf(" + column + " != 0) AS row_count"
                + " FROM " + targetTable
                + " WHERE " + SourceColumns.CUSTOMER_ID + " = ?"
                + " AND " + SourceColumns.TIMESTAMP + " >= ?"
                + " AND " + SourceColumns.TIMESTAMP + " < ?";

        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> new MetricSum(
                probe.kind() == MetricKind.INT ? (Number) rs.getLong("metric_sum") : (Number) rs.getDouble("metric_sum"),
                rs.getLong("row_count")
        ), probe.customerId(), Timestamp.from(window.start()), Timestamp.from(window.end()));
    }
}
