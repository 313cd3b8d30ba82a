package br.com.analytics.pipeline.metric_flattening_batch.tasklet;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalogStore;
import br.com.analytics.pipeline.metric_flattening_batch.config.MetricFlatteningProperties;
import br.com.analytics.pipeline.metric_flattening_batch.exception.SourceUnavailableException;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeChunk;
import br.com.analytics.pipeline.metric_flattening_batch.processor.ChunkAggregationEngine;
import br.com.analytics.pipeline.metric_flattening_batch.processor.ChunkResult;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceRowReader;
import br.com.analytics.pipeline.metric_flattening_batch.scheduler.ChunkProgressRepository;
import br.com.analytics.pipeline.metric_flattening_batch.scheduler.ChunkScheduler;
import br.com.analytics.pipeline.metric_flattening_batch.schema.SchemaPlan;
import br.com.analytics.pipeline.metric_flattening_batch.schema.SchemaPlanner;
import br.com.analytics.pipeline.metric_flattening_batch.writer.AggregatedRowWriter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.time.Clock;
import java.util.function.Function;

/**
 * Transforms the window one chunk per invocation, in ascending order. Each chunk is aggregated in
 * memory, written as a single batch and only then marked completed, so a restart resumes at the
 * first chunk that did not complete.
 */
@Slf4j
public class ChunkTransformationTasklet implements Tasklet {

    private final KeyCatalogStore store;
    private final SchemaPlanner planner;
    private final SourceRowReader reader;
    private final Function<SchemaPlan, AggregatedRowWriter> writerFactory;
    private final ChunkProgressRepository progressRepository;
    private final MetricFlatteningProperties properties;
    private final Clock clock;

    private TransformationRun run;

    public ChunkTransformationTasklet(KeyCatalogStore store, SchemaPlanner planner, SourceRowReader reader,
                                      Function<SchemaPlan, AggregatedRowWriter> writerFactory,
                                      ChunkProgressRepository progressRepository,
                                      MetricFlatteningProperties properties, Clock clock) {
        this.store = store;
        this.planner = planner;
        this.reader = reader;
        this.writerFactory = writerFactory;
        this.progressRepository = progressRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        if (!properties.getTransformation().isEnabled()) {
            log.info("Transformation disabled");
            return RepeatStatus.FINISHED;
        }

        if (run == null) {
            run = startRun();
        }
        if (run.nextIndex >= run.scheduler.totalChunks()) {
            finishRun();
            return RepeatStatus.FINISHED;
        }

        TimeChunk chunk = run.scheduler.chunk(run.nextIndex);
        try {
            transformChunk(chunk);
        } catch (RuntimeException e) {
            run = null;
            throw e;
        }
        run.nextIndex++;

        if (run.nextIndex < run.scheduler.totalChunks()) {
            return RepeatStatus.CONTINUABLE;
        }
        finishRun();
        return RepeatStatus.FINISHED;
    }

    private TransformationRun startRun() {
        MetricFlatteningProperties.Transformation transformation = properties.getTransformation();
        KeyCatalog catalog = store.load(properties.transformationScope());
        AggregatedRowWriter writer = writerFactory.apply(planner.plan(catalog));

        String runKey = ChunkScheduler.runKey(properties.getTargetTable(), properties.transformationWindow(),
                transformation.getChunkWidth());
        ChunkScheduler scheduler = new ChunkScheduler(properties.transformationWindow(),
                transformation.getChunkWidth(), progressRepository, runKey, clock);

        int startIndex;
        if (transformation.isTruncateTarget()) {
            if (transformation.getStartFromChunk() != null && transformation.getStartFromChunk() != 0) {
                log.warn("Ignoring start chunk {} because the target is truncated", transformation.getStartFromChunk());
            }
            log.warn("Truncating {} before transformation", properties.getTargetTable());
            writer.truncate();
            startIndex = 0;
        } else {
            startIndex = scheduler.resumeIndex(transformation.getStartFromChunk());
        }
        scheduler.resetFrom(startIndex);

        log.info("Transforming {} in {} chunks of {} (run {}), starting at chunk {}",
                scheduler.getWindow(), scheduler.totalChunks(), transformation.getChunkWidth(), runKey, startIndex);
        return new TransformationRun(catalog, writer, new ChunkAggregationEngine(reader, writer), scheduler,
                !transformation.isTruncateTarget(), startIndex);
    }

    private void transformChunk(TimeChunk chunk) {
        ChunkScheduler scheduler = run.scheduler;
        log.info("Processing chunk {}/{}: {}", chunk.index() + 1, scheduler.totalChunks(), chunk.window());
        scheduler.markInProgress(chunk);
        try {
            ChunkResult result = aggregateWithRetry(chunk);
            if (run.clearBeforeWrite) {
                run.writer.deleteRange(chunk.window(), properties.getCustomerIds());
            }
            run.engine.write(result);
            scheduler.markCompleted(chunk, result.sourceRowCount(), result.rows().size());
            run.sourceRows += result.sourceRowCount();
            run.outputRows += result.rows().size();
            run.chunksProcessed++;
        } catch (RuntimeException e) {
            log.error("Chunk {} failed: {}", chunk.index(), e.getMessage(), e);
            scheduler.markFailed(chunk, e.getMessage());
            throw e;
        }
    }

    private ChunkResult aggregateWithRetry(TimeChunk chunk) {
        MetricFlatteningProperties.Transformation transformation = properties.getTransformation();
        long backoffMillis = transformation.getRetryBackoff().toMillis();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(transformation.getReadRetries() + 1)
                .intervalFunction(attempt -> backoffMillis * attempt)
                .retryExceptions(SourceUnavailableException.class)
                .build();
        Retry retry = Retry.of("sourceRead-chunk-" + chunk.index(), config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Source unavailable for chunk {} (attempt {}/{}), retrying in {}",
                        chunk.index(), event.getNumberOfRetryAttempts(), transformation.getReadRetries(),
                        event.getWaitInterval()));

        return Retry.decorateSupplier(retry,
                () -> run.engine.aggregate(chunk, run.catalog, properties.getCustomerIds())).get();
    }

    private void finishRun() {
        if (run.sourceRows > 0 && run.outputRows > 0) {
            log.info("Transformation complete: {} chunks, {} raw rows -> {} aggregated rows ({}x)",
                    run.chunksProcessed, run.sourceRows, run.outputRows,
                    String.format("%.2f", (double) run.sourceRows / run.outputRows));
        } else {
            log.info("Transformation complete: {} chunks, {} raw rows -> {} aggregated rows",
                    run.chunksProcessed, run.sourceRows, run.outputRows);
        }
        run = null;
    }

    private static final class TransformationRun {
        private final KeyCatalog catalog;
        private final AggregatedRowWriter writer;
        private final ChunkAggregationEngine engine;
        private final ChunkScheduler scheduler;
        private final boolean clearBeforeWrite;
        private int nextIndex;
        private long sourceRows;
        private long outputRows;
        private int chunksProcessed;

        private TransformationRun(KeyCatalog catalog, AggregatedRowWriter writer, ChunkAggregationEngine engine,
                                  ChunkScheduler scheduler, boolean clearBeforeWrite, int nextIndex) {
            this.catalog = catalog;
            this.writer = writer;
            this.engine = engine;
            this.scheduler = scheduler;
            this.clearBeforeWrite = clearBeforeWrite;
            this.nextIndex = nextIndex;
        }
    }
}
