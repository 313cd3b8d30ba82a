package br.com.analytics.pipeline.metric_flattening_batch.exception;

public class InvalidCatalogException extends MetricFlatteningException {

    public InvalidCatalogException(String message) {
        super(message);
    }

    public InvalidCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
