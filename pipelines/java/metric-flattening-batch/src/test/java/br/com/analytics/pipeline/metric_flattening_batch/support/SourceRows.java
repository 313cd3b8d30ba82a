package br.com.analytics.pipeline.metric_flattening_batch.support;

import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds source rows for tests. Metrics go to group 1 unless a group is given.
 */
public final class SourceRows {

    private final Instant timestamp;
    private final Integer customerId;
    private final String clientId;
    private final String sessionId;
    private String flowId = "flow-1";
    private final Map<String, Object> descriptive = new LinkedHashMap<>();
    private final List<Map<String, Number>> intGroups = emptyGroups();
    private final List<Map<String, Number>> floatGroups = emptyGroups();

    private SourceRows(Instant timestamp, Integer customerId, String clientId, String sessionId) {
        this.timestamp = timestamp;
        this.customerId = customerId;
        this.clientId = clientId;
        this.sessionId = sessionId;
    }

    public static SourceRows row(String timestamp, int customerId, String clientId, String sessionId) {
        return new SourceRows(Instant.parse(timestamp), customerId, clientId, sessionId);
    }

    public SourceRows flow(String flowId) {
        this.flowId = flowId;
        return this;
    }

    public SourceRows descriptive(String column, Object value) {
        descriptive.put(column, value);
        return this;
    }

    public SourceRows intMetric(String key, Number value) {
        return intMetric(1, key, value);
    }

    public SourceRows intMetric(int group, String key, Number value) {
        intGroups.get(group - 1).put(key, value);
        return this;
    }

    public SourceRows floatMetric(String key, Number value) {
        return floatMetric(1, key, value);
    }

    public SourceRows floatMetric(int group, String key, Number value) {
        floatGroups.get(group - 1).put(key, value);
        return this;
    }

    public SourceRow build() {
        return new SourceRow(timestamp, customerId, clientId, sessionId, flowId, descriptive,
                copy(intGroups), copy(floatGroups));
    }

    private static List<Map<String, Number>> emptyGroups() {
        List<Map<String, Number>> groups = new ArrayList<>(SourceRow.GROUP_COUNT);
        for (int i = 0; i < SourceRow.GROUP_COUNT; i++) {
            groups.add(new LinkedHashMap<>());
        }
        return groups;
    }

    private static List<Map<String, Number>> copy(List<Map<String, Number>> groups) {
        List<Map<String, Number>> copy = new ArrayList<>(groups.size());
        for (Map<String, Number> group : groups) {
            copy.add(new LinkedHashMap<>(group));
        }
        return copy;
    }
}
