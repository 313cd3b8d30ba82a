package br.com.analytics.pipeline.metric_flattening_batch.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One raw row of the map-column source table. Each row carries {@link #GROUP_COUNT} integer
 * and {@link #GROUP_COUNT} float metric maps.
 */
public record SourceRow(
        Instant timestamp,
        Integer customerId,
        String clientId,
        String sessionId,
        String flowId,
        Map<String, Object> descriptiveColumns,
        List<Map<String, Number>> intGroups,
        List<Map<String, Number>> floatGroups
) {

    public static final int GROUP_COUNT = 15;

    public List<Map<String, Number>> groups(MetricKind kind) {
        return kind == MetricKind.INT ? intGroups : floatGroups;
    }
}
