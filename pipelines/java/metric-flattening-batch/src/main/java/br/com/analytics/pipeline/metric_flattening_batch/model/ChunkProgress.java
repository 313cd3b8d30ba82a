package br.com.analytics.pipeline.metric_flattening_batch.model;

import java.time.Instant;

public record ChunkProgress(
        String runKey,
        int chunkIndex,
        TimeWindow window,
        ChunkState state,
        long sourceRows,
        long outputRows,
        String errorMessage,
        Instant updatedAt
) {
}
