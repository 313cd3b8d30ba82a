package br.com.analytics.pipeline.metric_flattening_batch.validation;

public record MetricSum(
        Number sum,
        long rowCount
) {
}
