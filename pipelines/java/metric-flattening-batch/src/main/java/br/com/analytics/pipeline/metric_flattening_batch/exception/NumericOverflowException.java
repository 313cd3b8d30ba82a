package br.com.analytics.pipeline.metric_flattening_batch.exception;

public class NumericOverflowException extends MetricFlatteningException {

    public NumericOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
