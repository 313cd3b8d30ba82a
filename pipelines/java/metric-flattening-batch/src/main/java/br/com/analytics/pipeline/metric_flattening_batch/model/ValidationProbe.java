package br.com.analytics.pipeline.metric_flattening_batch.model;

/**
 * Outcome of comparing one metric's sum between the map-column and the flattened table.
 */
public record ValidationProbe(
        Integer customerId,
        String metricKey,
        MetricKind kind,
        Number expectedSum,
        Number observedSum,
        long sourceRowCount,
        long targetRowCount,
        boolean passed,
        String errorMessage
) {

    public Double difference() {
        if (expectedSum == null || observedSum == null) {
            return null;
        }
        return Math.abs(expectedSum.doubleValue() - observedSum.doubleValue());
    }
}
