package br.com.analytics.pipeline.metric_flattening_batch.exception;

public class WriteFailureException extends MetricFlatteningException {

    public WriteFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
