package br.com.analytics.pipeline.metric_flattening_batch.model;

public record TimeChunk(
        int index,
        TimeWindow window
) {

    @Override
    public String toString() {
        return "chunk " + index + " " + window;
    }
}
