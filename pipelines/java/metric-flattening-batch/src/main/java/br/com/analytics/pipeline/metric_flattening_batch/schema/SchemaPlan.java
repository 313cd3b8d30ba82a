package br.com.analytics.pipeline.metric_flattening_batch.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed metric column layout of the flattened table: {@code int1..intN} then {@code float1..floatM}.
 */
public record SchemaPlan(
        List<String> intColumns,
        List<String> floatColumns
) {

    public SchemaPlan {
        intColumns = List.copyOf(intColumns);
        floatColumns = List.copyOf(floatColumns);
    }

    public int intColumnCount() {
        return intColumns.size();
    }

    public int floatColumnCount() {
        return floatColumns.size();
    }

    public List<String> metricColumns() {
        List<String> columns = new ArrayList<>(intColumns.size() + floatColumns.size());
        columns.addAll(intColumns);
        columns.addAll(floatColumns);
        return columns;
    }
}
