package br.com.analytics.pipeline.metric_flattening_batch.schema;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.exception.InvalidCatalogException;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class SchemaPlanner {

    public SchemaPlan plan(KeyCatalog catalog) {
        return new SchemaPlan(columns(catalog, MetricKind.INT), columns(catalog, MetricKind.FLOAT));
    }

    private List<String> columns(KeyCatalog catalog, MetricKind kind) {
        List<String> keys = catalog.keys(kind);
        Set<String> seen = new HashSet<>();
        List<String> columns = new ArrayList<>(keys.size());
        for (int slot = 0; slot < keys.size(); slot++) {
            if (!seen.add(keys.get(slot))) {
                throw new InvalidCatalogException("Duplicate " + kind + " key '" + keys.get(slot) + "' in key catalog");
            }
            columns.add(kind.columnName(slot));
        }
        return columns;
    }
}
