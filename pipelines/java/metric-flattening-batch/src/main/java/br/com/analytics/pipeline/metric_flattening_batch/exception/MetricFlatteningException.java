package br.com.analytics.pipeline.metric_flattening_batch.exception;

public class MetricFlatteningException extends RuntimeException {

    public MetricFlatteningException(String message) {
        super(message);
    }

    public MetricFlatteningException(String message, Throwable cause) {
        super(message, cause);
    }
}
