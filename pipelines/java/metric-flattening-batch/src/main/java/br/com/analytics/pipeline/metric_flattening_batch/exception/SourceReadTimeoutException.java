package br.com.analytics.pipeline.metric_flattening_batch.exception;

public class SourceReadTimeoutException extends MetricFlatteningException {

    public SourceReadTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
