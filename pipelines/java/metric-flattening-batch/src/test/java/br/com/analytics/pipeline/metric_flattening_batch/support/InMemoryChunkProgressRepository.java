package br.com.analytics.pipeline.metric_flattening_batch.support;

import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkProgress;
import br.com.analytics.pipeline.metric_flattening_batch.scheduler.ChunkProgressRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class InMemoryChunkProgressRepository implements ChunkProgressRepository {

    private final Map<String, ChunkProgress> progress = new TreeMap<>();

    @Override
    public void save(ChunkProgress chunkProgress) {
        progress.put(id(chunkProgress.runKey(), chunkProgress.chunkIndex()), chunkProgress);
    }

    @Override
    public Optional<ChunkProgress> find(String runKey, int chunkIndex) {
        return Optional.ofNullable(progress.get(id(runKey, chunkIndex)));
    }

    @Override
    public List<ChunkProgress> findAll(String runKey) {
        List<ChunkProgress> all = new ArrayList<>();
        for (ChunkProgress p : progress.values()) {
            if (p.runKey().equals(runKey)) {
                all.add(p);
            }
        }
        all.sort(Comparator.comparingInt(ChunkProgress::chunkIndex));
        return all;
    }

    @Override
    public void deleteFrom(String runKey, int fromIndex) {
        progress.values().removeIf(p -> p.runKey().equals(runKey) && p.chunkIndex() >= fromIndex);
    }

    private static String id(String runKey, int chunkIndex) {
        return runKey + "#" + chunkIndex;
    }
}
