package br.com.analytics.pipeline.metric_flattening_batch.scheduler;

import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkProgress;

import java.util.List;
import java.util.Optional;

public interface ChunkProgressRepository {

    void save(ChunkProgress progress);

    Optional<ChunkProgress> find(String runKey, int chunkIndex);

    List<ChunkProgress> findAll(String runKey);

    void deleteFrom(String runKey, int fromIndex);
}
