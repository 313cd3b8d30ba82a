package br.com.analytics.pipeline.metric_flattening_batch.reader;

/**
 * Streams raw map-column rows matching a {@link SourceQuery}.
 */
public interface SourceRowReader {

    void read(SourceQuery query, SourceRowCallback callback);
}
