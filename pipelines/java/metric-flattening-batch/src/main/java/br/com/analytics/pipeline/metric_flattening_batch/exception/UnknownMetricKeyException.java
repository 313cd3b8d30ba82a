package br.com.analytics.pipeline.metric_flattening_batch.exception;

import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;

/**
 * A metric key met during transformation is missing from the key catalog, which means the
 * discovery window did not cover the transformation window.
 */
public class UnknownMetricKeyException extends MetricFlatteningException {

    private final MetricKind kind;
    private final String metricKey;
    private final Integer customerId;

    public UnknownMetricKeyException(MetricKind kind, String metricKey, Integer customerId) {
        super("Unknown " + kind + " metric key '" + metricKey + "' for customer " + customerId
                + "; re-run key discovery over a window covering the transformation range");
        this.kind = kind;
        this.metricKey = metricKey;
        this.customerId = customerId;
    }

    public MetricKind getKind() {
        return kind;
    }

    public String getMetricKey() {
        return metricKey;
    }

    public Integer getCustomerId() {
        return customerId;
    }
}
