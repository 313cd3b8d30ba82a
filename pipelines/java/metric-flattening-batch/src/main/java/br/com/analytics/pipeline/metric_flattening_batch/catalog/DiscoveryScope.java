package br.com.analytics.pipeline.metric_flattening_batch.catalog;

import br.com.analytics.pipeline.metric_flattening_batch.exception.CatalogMismatchException;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;

import java.util.List;
import java.util.Objects;

/**
 * What a key catalog was discovered from. An empty customer list means every customer of the
 * source table.
 */
public record DiscoveryScope(
        String sourceTable,
        TimeWindow window,
        List<Integer> customerIds
) {

    public DiscoveryScope {
        Objects.requireNonNull(sourceTable, "sourceTable");
        Objects.requireNonNull(window, "window");
        customerIds = customerIds == null ? List.of() : customerIds.stream().distinct().sorted().toList();
    }

    public boolean coversAllCustomers() {
        return customerIds.isEmpty();
    }

    /**
     * Fails unless a catalog discovered for this scope may drive a transformation over {@code required}.
     */
    public void requireCovers(DiscoveryScope required) {
        if (!sourceTable.equals(required.sourceTable())) {
            throw new CatalogMismatchException("Key catalog was built from table " + sourceTable
                    + " but the run reads " + required.sourceTable());
        }
        if (!window.covers(required.window())) {
            throw new CatalogMismatchException("Key catalog discovery window " + window
                    + " does not cover the transformation window " + required.window());
        }
        if (coversAllCustomers()) {
            return;
        }
        if (required.coversAllCustomers() || !customerIds.containsAll(required.customerIds())) {
            throw new CatalogMismatchException("Key catalog was discovered for customers " + customerIds
                    + " but the run covers " + (required.coversAllCustomers() ? "all customers" : required.customerIds()));
        }
    }
}
