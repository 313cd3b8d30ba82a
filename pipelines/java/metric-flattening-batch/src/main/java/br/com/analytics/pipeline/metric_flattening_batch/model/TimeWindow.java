package br.com.analytics.pipeline.metric_flattening_batch.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} over source timestamps.
 */
public record TimeWindow(
        Instant start,
        Instant end
) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start " + start + " must be before end " + end);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean covers(TimeWindow other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
