package br.com.analytics.pipeline.metric_flattening_batch.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;

public record AggregationKey(
        Integer customerId,
        String clientId,
        String sessionId,
        Instant minuteBucket
) implements Comparable<AggregationKey> {

    private static final Comparator<AggregationKey> ORDER = Comparator
            .comparing(AggregationKey::customerId)
            .thenComparing(AggregationKey::clientId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AggregationKey::sessionId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AggregationKey::minuteBucket);

    public static AggregationKey of(SourceRow row) {
        return new AggregationKey(
                row.customerId(),
                row.clientId(),
                row.sessionId(),
                row.timestamp().truncatedTo(ChronoUnit.MINUTES)
        );
    }

    @Override
    public int compareTo(AggregationKey other) {
        return ORDER.compare(this, other);
    }
}
