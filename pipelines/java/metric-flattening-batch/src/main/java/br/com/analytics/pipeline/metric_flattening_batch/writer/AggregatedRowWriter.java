package br.com.analytics.pipeline.metric_flattening_batch.writer;

import br.com.analytics.pipeline.metric_flattening_batch.model.AggregatedRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;

import java.util.List;

/**
 * Target side of the transformation. Implementations write one chunk's rows as a single batch
 * and can clear a chunk's range so the chunk can be replayed without double counting.
 */
public interface AggregatedRowWriter {

    void write(List<AggregatedRow> rows);

    /**
     * Removes previously written rows whose minute bucket falls in {@code window}. An empty
     * customer list removes rows of every customer.
     */
    void deleteRange(TimeWindow window, List<Integer> customerIds);

    void truncate();
}
