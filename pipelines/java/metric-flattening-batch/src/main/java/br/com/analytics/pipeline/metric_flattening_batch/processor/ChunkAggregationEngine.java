package br.com.analytics.pipeline.metric_flattening_batch.processor;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeChunk;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceQuery;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceRowReader;
import br.com.analytics.pipeline.metric_flattening_batch.writer.AggregatedRowWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Transforms one chunk: reads its rows, aggregates them in memory and writes the result as a
 * single batch. A failure while aggregating leaves the target untouched.
 */
@Slf4j
public class ChunkAggregationEngine {

    private final SourceRowReader reader;
    private final AggregatedRowWriter writer;

    public ChunkAggregationEngine(SourceRowReader reader, AggregatedRowWriter writer) {
        this.reader = reader;
        this.writer = writer;
    }

    public ChunkResult aggregate(TimeChunk chunk, KeyCatalog catalog, List<Integer> customerIds) {
        MetricAggregationProcessor processor = new MetricAggregationProcessor(catalog, chunk.window());
        reader.read(new SourceQuery(chunk.window(), customerIds), processor::process);

        long sourceRows = processor.getSourceRowCount();
        ChunkResult result = new ChunkResult(chunk, processor.drain(), sourceRows);
        if (result.rows().isEmpty()) {
            log.info("  Compression for {}: {} raw -> 0 aggregated rows (N/A)", chunk, sourceRows);
        } else {
            log.info("  Compression for {}: {} raw -> {} aggregated rows ({}x)",
                    chunk, sourceRows, result.rows().size(), String.format("%.2f", result.compressionFactor()));
        }
        return result;
    }

    public void write(ChunkResult result) {
        if (result.rows().isEmpty()) {
            log.info("  No data found for {}", result.chunk());
            return;
        }
        writer.write(result.rows());
    }

    public ChunkResult transform(TimeChunk chunk, KeyCatalog catalog, List<Integer> customerIds) {
        ChunkResult result = aggregate(chunk, catalog, customerIds);
        write(result);
        return result;
    }
}
