package br.com.analytics.pipeline.metric_flattening_batch.support;

import br.com.analytics.pipeline.metric_flattening_batch.exception.SourceUnavailableException;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceQuery;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceRowCallback;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceRowReader;

import java.util.ArrayList;
import java.util.List;

public class InMemorySourceRowReader implements SourceRowReader {

    private final List<SourceRow> rows = new ArrayList<>();
    private final List<SourceQuery> queries = new ArrayList<>();
    private int failuresBeforeSuccess;

    public InMemorySourceRowReader(List<SourceRow> rows) {
        this.rows.addAll(rows);
    }

    public void add(SourceRow row) {
        rows.add(row);
    }

    /**
     * The next {@code count} reads fail as if the source were down.
     */
    public void failNextReads(int count) {
        this.failuresBeforeSuccess = count;
    }

    public List<SourceQuery> getQueries() {
        return queries;
    }

    @Override
    public void read(SourceQuery query, SourceRowCallback callback) {
        queries.add(query);
        if (failuresBeforeSuccess > 0) {
            failuresBeforeSuccess--;
            throw new SourceUnavailableException("source down", new RuntimeException("connection refused"));
        }
        for (SourceRow row : rows) {
            boolean inWindow = row.timestamp() != null && query.window().contains(row.timestamp());
            boolean customerMatches = query.customerIds().isEmpty() || query.customerIds().contains(row.customerId());
            if (inWindow && customerMatches) {
                callback.onRow(row);
            }
        }
    }
}
