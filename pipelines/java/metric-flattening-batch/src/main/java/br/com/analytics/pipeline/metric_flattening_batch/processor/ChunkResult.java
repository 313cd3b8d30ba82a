package br.com.analytics.pipeline.metric_flattening_batch.processor;

import br.com.analytics.pipeline.metric_flattening_batch.model.AggregatedRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeChunk;

import java.util.List;

public record ChunkResult(
        TimeChunk chunk,
        List<AggregatedRow> rows,
        long sourceRowCount
) {

    public ChunkResult {
        rows = List.copyOf(rows);
    }

    /**
     * Source rows per output row, 0 when the chunk produced nothing.
     */
    public double compressionFactor() {
        return rows.isEmpty() ? 0.0 : (double) sourceRowCount / rows.size();
    }
}
