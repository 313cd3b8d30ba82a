package br.com.analytics.pipeline.metric_flattening_batch.processor;

import br.com.analytics.pipeline.metric_flattening_batch.exception.NumericOverflowException;
import br.com.analytics.pipeline.metric_flattening_batch.model.AggregatedRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.AggregationKey;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Mutable, in-progress sums of one aggregation group.
 */
class AggregationAccumulator {

    private final AggregationKey key;
    private final Map<String, Object> descriptiveColumns;
    private final int[] intSlots;
    private final float[] floatSlots;
    private long sourceRowCount;

    AggregationAccumulator(AggregationKey key, Map<String, Object> descriptiveColumns, int intSlotCount, int floatSlotCount) {
        this.key = key;
        this.descriptiveColumns = descriptiveColumns;
        this.intSlots = new int[intSlotCount];
        this.floatSlots = new float[floatSlotCount];
    }

    void countRow() {
        sourceRowCount++;
    }

    void addInt(int slot, String metricKey, Number value) {
        try {
            intSlots[slot] = Math.addExact(intSlots[slot], toInt(value));
        } catch (ArithmeticException e) {
            throw new NumericOverflowException("Int32 overflow summing '" + metricKey + "' (+" + value + " onto "
                    + intSlots[slot] + ") for customer " + key.customerId() + " client " + key.clientId()
                    + " at " + key.minuteBucket(), e);
        }
    }

    void addFloat(int slot, Number value) {
        floatSlots[slot] += value.floatValue();
    }

    AggregatedRow finish() {
        return new AggregatedRow(key, descriptiveColumns, intSlots, floatSlots, sourceRowCount);
    }

    private static int toInt(Number value) {
        if (value instanceof BigInteger big) {
            return big.intValueExact();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.intValueExact();
        }
        return Math.toIntExact(value.longValue());
    }
}
