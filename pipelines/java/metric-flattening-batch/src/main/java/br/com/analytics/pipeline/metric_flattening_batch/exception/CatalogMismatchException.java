package br.com.analytics.pipeline.metric_flattening_batch.exception;

public class CatalogMismatchException extends MetricFlatteningException {

    public CatalogMismatchException(String message) {
        super(message);
    }
}
