package br.com.analytics.pipeline.metric_flattening_batch.model;

public enum ChunkState {

    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(ChunkState next) {
        return switch (next) {
            case PENDING -> true;
            case IN_PROGRESS -> this == PENDING;
            case COMPLETED, FAILED -> this == IN_PROGRESS;
        };
    }
}
