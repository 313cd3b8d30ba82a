package br.com.analytics.pipeline.metric_flattening_batch.reader;

import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;

import java.util.List;

/**
 * Predicates pushed down to the source store. An empty customer list reads every customer.
 */
public record SourceQuery(
        TimeWindow window,
        List<Integer> customerIds
) {

    public SourceQuery {
        customerIds = customerIds == null ? List.of() : List.copyOf(customerIds);
    }

    public static SourceQuery forCustomer(TimeWindow window, Integer customerId) {
        return new SourceQuery(window, List.of(customerId));
    }

    public static SourceQuery allCustomers(TimeWindow window) {
        return new SourceQuery(window, List.of());
    }
}
