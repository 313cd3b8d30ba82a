package br.com.analytics.pipeline.metric_flattening_batch.reader;

import br.com.analytics.pipeline.metric_flattening_batch.exception.MalformedRowException;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;

@FunctionalInterface
public interface SourceRowCallback {

    void onRow(SourceRow row);

    default void onMalformedRow(MalformedRowException exception) {
        throw exception;
    }
}
