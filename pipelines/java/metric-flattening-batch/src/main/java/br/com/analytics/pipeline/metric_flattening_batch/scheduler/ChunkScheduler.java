package br.com.analytics.pipeline.metric_flattening_batch.scheduler;

import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkProgress;
import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkState;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeChunk;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the transformation window into contiguous chunks of a fixed width (the last one is
 * clipped to the window end) and moves chunks through their states, persisting every change.
 */
@Slf4j
public class ChunkScheduler {

    private final TimeWindow window;
    private final Duration chunkWidth;
    private final ChunkProgressRepository progressRepository;
    private final String runKey;
    private final Clock clock;
    private final int totalChunks;

    public ChunkScheduler(TimeWindow window, Duration chunkWidth, ChunkProgressRepository progressRepository,
                          String runKey, Clock clock) {
        if (chunkWidth.isZero() || chunkWidth.isNegative()) {
            throw new IllegalArgumentException("Chunk width must be positive, got " + chunkWidth);
        }
        if (!chunkWidth.truncatedTo(ChronoUnit.MINUTES).equals(chunkWidth)) {
            throw new IllegalArgumentException("Chunk width must be a whole number of minutes, got " + chunkWidth);
        }
        requireMinuteAligned("start", window.start());
        requireMinuteAligned("end", window.end());
        this.window = window;
        this.chunkWidth = chunkWidth;
        this.progressRepository = progressRepository;
        this.runKey = runKey;
        this.clock = clock;

        long windowNanos = window.length().toNanos();
        long widthNanos = chunkWidth.toNanos();
        long chunks = (windowNanos + widthNanos - 1) / widthNanos;
        this.totalChunks = Math.toIntExact(chunks);
    }

    // a minute bucket must never straddle two chunks
    private static void requireMinuteAligned(String name, Instant instant) {
        if (!instant.truncatedTo(ChronoUnit.MINUTES).equals(instant)) {
            throw new IllegalArgumentException("Window " + name + " must fall on a whole minute, got " + instant);
        }
    }

    public static String runKey(String targetTable, TimeWindow window, Duration chunkWidth) {
        return targetTable + "|" + window.start() + "|" + window.end() + "|" + chunkWidth;
    }

    public String getRunKey() {
        return runKey;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public int totalChunks() {
        return totalChunks;
    }

    public TimeChunk chunk(int index) {
        if (index < 0 || index >= totalChunks) {
            throw new IndexOutOfBoundsException("Chunk index " + index + " outside 0.." + (totalChunks - 1));
        }
        Instant start = window.start().plus(chunkWidth.multipliedBy(index));
        Instant end = start.plus(chunkWidth);
        if (end.isAfter(window.end())) {
            end = window.end();
        }
        return new TimeChunk(index, new TimeWindow(start, end));
    }

    public List<TimeChunk> chunksFrom(int startIndex) {
        List<TimeChunk> chunks = new ArrayList<>(Math.max(0, totalChunks - startIndex));
        for (int index = startIndex; index < totalChunks; index++) {
            chunks.add(chunk(index));
        }
        return chunks;
    }

    /**
     * Where a run starts. An explicit index is trusted as is; otherwise the cursor is the lowest
     * chunk not yet completed, or {@link #totalChunks()} when every chunk is done.
     */
    public int resumeIndex(Integer startFromChunk) {
        if (startFromChunk != null) {
            if (startFromChunk < 0 || startFromChunk > totalChunks) {
                throw new IllegalArgumentException("start-from-chunk " + startFromChunk + " outside 0.." + totalChunks);
            }
            return startFromChunk;
        }
        for (int index = 0; index < totalChunks; index++) {
            if (state(index) != ChunkState.COMPLETED) {
                return index;
            }
        }
        return totalChunks;
    }

    public ChunkState state(int index) {
        return progressRepository.find(runKey, index)
                .map(ChunkProgress::state)
                .orElse(ChunkState.PENDING);
    }

    public void resetFrom(int fromIndex) {
        progressRepository.deleteFrom(runKey, fromIndex);
    }

    public void markInProgress(TimeChunk chunk) {
        transition(chunk, ChunkState.IN_PROGRESS, 0, 0, null);
    }

    public void markCompleted(TimeChunk chunk, long sourceRows, long outputRows) {
        transition(chunk, ChunkState.COMPLETED, sourceRows, outputRows, null);
    }

    public void markFailed(TimeChunk chunk, String errorMessage) {
        transition(chunk, ChunkState.FAILED, 0, 0, errorMessage);
    }

    private void transition(TimeChunk chunk, ChunkState next, long sourceRows, long outputRows, String errorMessage) {
        ChunkState current = state(chunk.index());
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Chunk " + chunk.index() + " cannot move from " + current + " to " + next);
        }
        progressRepository.save(new ChunkProgress(runKey, chunk.index(), chunk.window(), next,
                sourceRows, outputRows, errorMessage, clock.instant()));
        log.debug("Chunk {} {} -> {}", chunk.index(), current, next);
    }
}
