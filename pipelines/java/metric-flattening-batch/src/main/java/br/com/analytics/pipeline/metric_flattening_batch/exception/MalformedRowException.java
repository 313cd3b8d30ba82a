package br.com.analytics.pipeline.metric_flattening_batch.exception;

public class MalformedRowException extends MetricFlatteningException {

    public MalformedRowException(String message) {
        super(message);
    }
}
