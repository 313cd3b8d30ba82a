package br.com.analytics.pipeline.metric_flattening_batch.validation;

import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;

/**
 * A metric to compare between both schemas. {@code flowId} optionally narrows the map-column side
 * to the flow the metric belongs to.
 */
public record ProbeSpec(
        Integer customerId,
        String metricKey,
        MetricKind kind,
        String flowId
) {
}
