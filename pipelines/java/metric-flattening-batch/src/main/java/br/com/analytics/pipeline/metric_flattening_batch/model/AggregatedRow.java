package br.com.analytics.pipeline.metric_flattening_batch.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One flattened output row: the aggregation identity, the descriptive columns of the first
 * source row seen for it and the summed metric slots.
 */
public final class AggregatedRow {

    private final AggregationKey key;
    private final Map<String, Object> descriptiveColumns;
    private final int[] intSlots;
    private final float[] floatSlots;
    private final long sourceRowCount;

    public AggregatedRow(AggregationKey key, Map<String, Object> descriptiveColumns,
                         int[] intSlots, float[] floatSlots, long sourceRowCount) {
        this.key = Objects.requireNonNull(key, "key");
        this.descriptiveColumns = Collections.unmodifiableMap(new LinkedHashMap<>(descriptiveColumns));
        this.intSlots = intSlots.clone();
        this.floatSlots = floatSlots.clone();
        this.sourceRowCount = sourceRowCount;
    }

    public AggregationKey key() {
        return key;
    }

    public Map<String, Object> descriptiveColumns() {
        return descriptiveColumns;
    }

    public int intSlot(int slot) {
        return intSlots[slot];
    }

    public float floatSlot(int slot) {
        return floatSlots[slot];
    }

    public int[] intSlots() {
        return intSlots.clone();
    }

    public float[] floatSlots() {
        return floatSlots.clone();
    }

    public int intSlotCount() {
        return intSlots.length;
    }

    public int floatSlotCount() {
        return floatSlots.length;
    }

    public long sourceRowCount() {
        return sourceRowCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregatedRow that = (AggregatedRow) o;
        return sourceRowCount == that.sourceRowCount
                && key.equals(that.key)
                && descriptiveColumns.equals(that.descriptiveColumns)
                && Arrays.equals(intSlots, that.intSlots)
                && Arrays.equals(floatSlots, that.floatSlots);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(key, descriptiveColumns, sourceRowCount);
        result = 31 * result + Arrays.hashCode(intSlots);
        result = 31 * result + Arrays.hashCode(floatSlots);
        return result;
    }

    @Override
    public String toString() {
        return "AggregatedRow{" + key
                + ", rows=" + sourceRowCount
                + ", int=" + Arrays.toString(intSlots)
                + ", float=" + Arrays.toString(floatSlots) + "}";
    }
}
