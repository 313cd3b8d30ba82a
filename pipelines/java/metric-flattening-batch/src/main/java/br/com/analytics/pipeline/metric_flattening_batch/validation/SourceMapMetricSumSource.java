package br.com.analytics.pipeline.metric_flattening_batch.validation;

import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceColumns;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

@RequiredArgsConstructor
public class SourceMapMetricSumSource implements MetricSumSource {

    private final JdbcTemplate jdbcTemplate;
    private final String sourceTable;

    @Override
    public MetricSum sum(ProbeSpec probe, TimeWindow window) {
        List<String> lookups = new ArrayList<>();
        List<String> contains = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        for (int group = 1; group <= SourceRow.GROUP_COUNT; group++) {
            lookups.add(probe.kind().sourceGroupColumn(group) + "[?]");
            args.add(probe.metricKey());
        }
        for (int group = 1; group <= SourceRow.GROUP_COUNT; group++) {
            contains.add("mapContains(" + probe.kind().sourceGroupColumn(group) + ", ?)");
        }

        StringBuilder sql = new StringBuilder()
                .append("SELECT sum(").append(String.join(" + ", lookups)).append(") AS metric_sum, count() AS row_count")
                .append(" FROM ").append(sourceTable)
                .append(" WHERE ").append(SourceColumns.CUSTOMER_ID).append(" = ?")
                .append(" AND ").append(SourceColumns.TIMESTAMP).append(" >= ?")
                .append(" AND ").append(SourceColumns.TIMESTAMP).append(" < ?")
                .append(" AND (").append(String.join(" OR ", contains)).append(")");
        args.add(probe.customerId());
        args.add(Timestamp.from(window.start()));
        args.add(Timestamp.from(window.end()));
        for (int group = 1; group <= SourceRow.GROUP_COUNT; group++) {
            args.add(probe.metricKey());
        }
        if (probe.flowId() != null) {
            sql.append(" AND ").append(SourceColumns.FLOW_ID).append(" = ?");
            args.add(probe.flowId());
        }

        return jdbcTemplate.queryForObject(sql.toString(), (rs, rowNum) -> new MetricSum(
                probe.kind() == MetricKind.INT ? (Number) rs.getLong("metric_sum") : (Number) rs.getDouble("metric_sum"),
                rs.getLong("row_count")
        ), args.toArray());
    }
}
