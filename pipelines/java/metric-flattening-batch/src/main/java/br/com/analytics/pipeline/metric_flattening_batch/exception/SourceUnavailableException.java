package br.com.analytics.pipeline.metric_flattening_batch.exception;

/**
 * The source store could not be reached. Transient: callers may retry the whole chunk read.
 */
public class SourceUnavailableException extends MetricFlatteningException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
