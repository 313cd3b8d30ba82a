package br.com.analytics.pipeline.metric_flattening_batch.tasklet;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalogStore;
import br.com.analytics.pipeline.metric_flattening_batch.config.MetricFlatteningProperties;
import br.com.analytics.pipeline.metric_flattening_batch.exception.CatalogMismatchException;
import br.com.analytics.pipeline.metric_flattening_batch.exception.SourceUnavailableException;
import br.com.analytics.pipeline.metric_flattening_batch.exception.UnknownMetricKeyException;
import br.com.analytics.pipeline.metric_flattening_batch.exception.WriteFailureException;
import br.com.analytics.pipeline.metric_flattening_batch.model.AggregatedRow;
import br.com.analytics.pipeline.metric_flattening_batch.model.AggregationKey;
import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkProgress;
import br.com.analytics.pipeline.metric_flattening_batch.model.ChunkState;
import br.com.analytics.pipeline.metric_flattening_batch.model.SourceRow;
import br.com.analytics.pipeline.metric_flattening_batch.scheduler.ChunkScheduler;
import br.com.analytics.pipeline.metric_flattening_batch.schema.SchemaPlanner;
import br.com.analytics.pipeline.metric_flattening_batch.support.InMemoryAggregatedRowWriter;
import br.com.analytics.pipeline.metric_flattening_batch.support.InMemoryChunkProgressRepository;
import br.com.analytics.pipeline.metric_flattening_batch.support.InMemorySourceRowReader;
import br.com.analytics.pipeline.metric_flattening_batch.support.SourceRows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkTransformationTaskletTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-10-10T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private MetricFlatteningProperties properties;
    private KeyCatalogStore store;
    private InMemorySourceRowReader reader;
    private InMemoryAggregatedRowWriter writer;
    private InMemoryChunkProgressRepository progress;
    private ChunkTransformationTasklet tasklet;

    @BeforeEach
    void setUp() {
        properties = new MetricFlatteningProperties();
        properties.setSourceTable("metrics_map");
        properties.setTargetTable("metrics_flat");
        properties.setWindowStart(Instant.parse("2025-10-08T10:00:00Z"));
        properties.setWindowEnd(Instant.parse("2025-10-08T13:00:00Z"));
        properties.getTransformation().setChunkWidth(Duration.ofHours(1));
        properties.getTransformation().setRetryBackoff(Duration.ZERO);

        store = new KeyCatalogStore(tempDir.resolve("key_catalog.json"));
        store.save(KeyCatalog.fromDiscoveredKeys(properties.discoveryScope(), CLOCK.instant(),
                Set.of("views", "clicks"), Set.of("ttfb")));

        reader = new InMemorySourceRowReader(sourceRows());
        writer = new InMemoryAggregatedRowWriter();
        progress = new InMemoryChunkProgressRepository();
        tasklet = new ChunkTransformationTasklet(store, new SchemaPlanner(), reader, plan -> writer, progress,
                properties, CLOCK);
    }

    private static List<SourceRow> sourceRows() {
        return List.of(
                SourceRows.row("2025-10-08T10:05:01Z", 1, "c1", "s1").intMetric("views", 2).build(),
                SourceRows.row("2025-10-08T10:05:40Z", 1, "c1", "s1").intMetric("views", 3).floatMetric("ttfb", 0.5).build(),
                SourceRows.row("2025-10-08T11:15:00Z", 2, "c2", "s2").intMetric(3, "clicks", 1).build(),
                SourceRows.row("2025-10-08T11:15:10Z", 2, "c2", "s2").intMetric(4, "clicks", 1).build(),
                SourceRows.row("2025-10-08T12:59:59Z", 1, "c1", "s3").intMetric("views", 7).build()
        );
    }

    private int runToCompletion() throws Exception {
        int invocations = 0;
        RepeatStatus status;
        do {
            status = tasklet.execute(null, null);
            invocations++;
        } while (status == RepeatStatus.CONTINUABLE && invocations < 100);
        return invocations;
    }

    private String runKey() {
        return ChunkScheduler.runKey("metrics_flat", properties.transformationWindow(), Duration.ofHours(1));
    }

    @Test
    void transformsEveryChunkAndMarksItCompleted() throws Exception {
        int invocations = runToCompletion();

        assertThat(invocations).isEqualTo(3);
        assertThat(writer.getRows()).hasSize(3);
        assertThat(writer.getRows()).extracting(AggregatedRow::sourceRowCount).containsExactly(2L, 2L, 1L);
        AggregatedRow first = writer.getRows().get(0);
        assertThat(first.key()).isEqualTo(new AggregationKey(1, "c1", "s1", Instant.parse("2025-10-08T10:05:00Z")));
        assertThat(first.intSlot(1)).isEqualTo(5);
        assertThat(first.floatSlot(0)).isEqualTo(0.5f);
        assertThat(progress.findAll(runKey())).extracting(ChunkProgress::state)
                .containsOnly(ChunkState.COMPLETED).hasSize(3);
        assertThat(progress.findAll(runKey())).extracting(ChunkProgress::sourceRows).containsExactly(2L, 2L, 1L);
    }

    @Test
    void resumedRunMatchesUninterruptedRun() throws Exception {
        runToCompletion();
        List<AggregatedRow> uninterrupted = writer.getRows();

        setUp();
        writer.failOnWriteCall(2);
        assertThatThrownBy(this::runToCompletion).isInstanceOf(WriteFailureException.class);
        assertThat(progress.find(runKey(), 0).orElseThrow().state()).isEqualTo(ChunkState.COMPLETED);
        assertThat(progress.find(runKey(), 1).orElseThrow().state()).isEqualTo(ChunkState.FAILED);
        assertThat(progress.find(runKey(), 2)).isEmpty();

        int invocations = runToCompletion();

        assertThat(invocations).isEqualTo(2);
        assertThat(writer.getRows()).containsExactlyInAnyOrderElementsOf(uninterrupted);
    }

    @Test
    void replayingCompletedChunksDoesNotDuplicateRows() throws Exception {
        runToCompletion();
        List<AggregatedRow> firstRun = writer.getRows();

        properties.getTransformation().setStartFromChunk(0);
        runToCompletion();

        assertThat(writer.getRows()).containsExactlyInAnyOrderElementsOf(firstRun).hasSize(firstRun.size());
    }

    @Test
    void completedRunStartsNothingWhenRestarted() throws Exception {
        runToCompletion();
        int writesBefore = writer.getWriteCalls();

        assertThat(tasklet.execute(null, null)).isEqualTo(RepeatStatus.FINISHED);
        assertThat(writer.getWriteCalls()).isEqualTo(writesBefore);
    }

    @Test
    void unknownKeyFailsChunkAndKeepsExistingTargetRows() throws Exception {
        AggregatedRow existing = new AggregatedRow(new AggregationKey(2, "old", "old",
                Instant.parse("2025-10-08T11:30:00Z")), Map.of(), new int[2], new float[1], 1);
        writer.seed(List.of(existing));
        reader.add(SourceRows.row("2025-10-08T11:45:00Z", 2, "c2", "s2").intMetric("brand_new", 1).build());

        assertThatThrownBy(this::runToCompletion).isInstanceOf(UnknownMetricKeyException.class);

        assertThat(progress.find(runKey(), 1).orElseThrow().state()).isEqualTo(ChunkState.FAILED);
        assertThat(progress.find(runKey(), 1).orElseThrow().errorMessage()).contains("brand_new");
        assertThat(writer.getRows()).contains(existing);
    }

    @Test
    void truncateTargetClearsEverythingAndStartsAtZero() throws Exception {
        AggregatedRow stale = new AggregatedRow(new AggregationKey(9, "x", "y",
                Instant.parse("2025-10-01T00:00:00Z")), Map.of(), new int[2], new float[1], 1);
        writer.seed(List.of(stale));
        properties.getTransformation().setTruncateTarget(true);
        properties.getTransformation().setStartFromChunk(2);

        runToCompletion();

        assertThat(writer.getTruncateCalls()).isEqualTo(1);
        assertThat(writer.getRows()).doesNotContain(stale).hasSize(3);
    }

    @Test
    void retriesWhileSourceIsUnavailable() throws Exception {
        properties.getTransformation().setReadRetries(3);
        reader.failNextReads(2);

        runToCompletion();

        assertThat(writer.getRows()).hasSize(3);
        assertThat(reader.getQueries()).hasSize(5);
    }

    @Test
    void givesUpAfterConfiguredRetries() {
        properties.getTransformation().setReadRetries(1);
        reader.failNextReads(2);

        assertThatThrownBy(this::runToCompletion).isInstanceOf(SourceUnavailableException.class);
        assertThat(progress.find(runKey(), 0).orElseThrow().state()).isEqualTo(ChunkState.FAILED);
        assertThat(writer.getWriteCalls()).isZero();
    }

    @Test
    void rejectsCatalogDiscoveredForOtherCustomers() {
        properties.setCustomerIds(List.of(1));
        store.save(KeyCatalog.fromDiscoveredKeys(properties.discoveryScope(), CLOCK.instant(), Set.of("views"), Set.of()));
        properties.setCustomerIds(List.of(1, 2));

        assertThatThrownBy(this::runToCompletion).isInstanceOf(CatalogMismatchException.class);
        assertThat(reader.getQueries()).isEmpty();
    }

    @Test
    void windowStartingInsideAMinuteIsRejectedBeforeAnyWrite() {
        properties.getTransformation().setWindowStart(Instant.parse("2025-10-08T10:00:30Z"));
        properties.getTransformation().setWindowEnd(Instant.parse("2025-10-08T10:02:30Z"));
        properties.getTransformation().setChunkWidth(Duration.ofMinutes(1));
        reader.add(SourceRows.row("2025-10-08T10:01:20Z", 1, "c1", "s1").intMetric("views", 2).build());
        reader.add(SourceRows.row("2025-10-08T10:01:40Z", 1, "c1", "s1").intMetric("views", 3).build());

        assertThatThrownBy(this::runToCompletion).isInstanceOf(IllegalArgumentException.class);
        assertThat(reader.getQueries()).isEmpty();
        assertThat(writer.getWriteCalls()).isZero();
    }

    @Test
    void disabledTransformationDoesNothing() throws Exception {
        properties.getTransformation().setEnabled(false);

        assertThat(tasklet.execute(null, null)).isEqualTo(RepeatStatus.FINISHED);
        assertThat(reader.getQueries()).isEmpty();
    }
}
