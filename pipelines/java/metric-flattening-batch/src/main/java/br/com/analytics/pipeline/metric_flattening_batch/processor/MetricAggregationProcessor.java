package br.com.analytics.pipeline.metric_flattening_batch.processor;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.exception.UnknownMetricKeyException;
import br.com.analytics.pipeline.metric_flattening_batch.model.AggregatedRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.AggregationKey;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the source rows of one chunk by {@link AggregationKey} and sums every metric into
 * its catalog slot. Nothing is emitted per item; {@link #drain()} returns the finished rows
 * once the chunk has been consumed.
 */
public class MetricAggregationProcessor implements ItemProcessor<SourceRow, AggregatedRow> {

    private final KeyCatalog catalog;
    private final TimeWindow window;
    private final Map<AggregationKey, AggregationAccumulator> aggregatedData = new HashMap<>();
    private long sourceRowCount;

    public MetricAggregationProcessor(KeyCatalog catalog, TimeWindow window) {
        this.catalog = catalog;
        this.window = window;
    }

    @Override
    public AggregatedRow process(SourceRow row) {
        if (row.timestamp() == null || !window.contains(row.timestamp())) {
            throw new IllegalArgumentException("Row at " + row.timestamp() + " is outside chunk window " + window);
        }

        AggregationKey key = AggregationKey.of(row);
        AggregationAccumulator accumulator = aggregatedData.computeIfAbsent(key, k -> createAccumulator(k, row));
        accumulator.countRow();
        sourceRowCount++;

        for (Map<String, Number> group : row.intGroups()) {
            if (group == null) {
                continue;
            }
            for (Map.Entry<String, Number> metric : group.entrySet()) {
                accumulator.addInt(slotOf(MetricKind.INT, metric.getKey(), row), metric.getKey(), metric.getValue());
            }
        }
        for (Map<String, Number> group : row.floatGroups()) {
            if (group == null) {
                continue;
            }
            for (Map.Entry<String, Number> metric : group.entrySet()) {
                accumulator.addFloat(slotOf(MetricKind.FLOAT, metric.getKey(), row), metric.getValue());
            }
        }
        return null;
    }

    private AggregationAccumulator createAccumulator(AggregationKey key, SourceRow row) {
        return new AggregationAccumulator(key, row.descriptiveColumns(),
                catalog.size(MetricKind.INT), catalog.size(MetricKind.FLOAT));
    }

    private int slotOf(MetricKind kind, String metricKey, SourceRow row) {
        int slot = catalog.slotOf(kind, metricKey);
        if (slot < 0) {
            throw new UnknownMetricKeyException(kind, metricKey, row.customerId());
        }
        return slot;
    }

    public int getGroupCount() {
        return aggregatedData.size();
    }

    public long getSourceRowCount() {
        return sourceRowCount;
    }

    /**
     * Finalizes every group into an immutable row, ordered by aggregation key, and resets the processor.
     */
    public List<AggregatedRow> drain() {
        List<AggregationKey> keys = new ArrayList<>(aggregatedData.keySet());
        keys.sort(null);
        List<AggregatedRow> rows = new ArrayList<>(keys.size());
        for (AggregationKey key : keys) {
            rows.add(aggregatedData.get(key).finish());
        }
        aggregatedData.clear();
        sourceRowCount = 0;
        return rows;
    }
}
