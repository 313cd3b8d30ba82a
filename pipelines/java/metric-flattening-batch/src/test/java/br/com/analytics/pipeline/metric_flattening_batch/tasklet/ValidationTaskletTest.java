package br.com.analytics.pipeline.metric_flattening_batch.tasklet;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalogStore;
import br.com.analytics.pipeline.metric_flattening_batch.config.MetricFlatteningProperties;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.validation.MetricSum;
import br.com.analytics.pipeline.metric_flattening_batch.validation.MetricSumSource;
import br.com.analytics.pipeline.metric_flattening_batch.validation.ProbeSpec;
import br.com.analytics.pipeline.metric_flattening_batch.validation.ValidationReportWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationTaskletTest {

    @TempDir
    Path tempDir;

    private MetricFlatteningProperties properties;
    private KeyCatalogStore store;
    private final List<ProbeSpec> probed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new MetricFlatteningProperties();
        properties.setSourceTable("metrics_map");
        properties.setTargetTable("metrics_flat");
        properties.setCustomerIds(List.of(1));
        properties.setWindowStart(Instant.parse("2025-10-08T00:00:00Z"));
        properties.setWindowEnd(Instant.parse("2025-10-09T00:00:00Z"));
        properties.getValidation().setReportFile(tempDir.resolve("validation_results.json").toString());

        store = new KeyCatalogStore(tempDir.resolve("key_catalog.json"));
        store.save(KeyCatalog.fromDiscoveredKeys(properties.discoveryScope(), Instant.EPOCH,
                Set.of("a", "b", "c", "d"), Set.of("x")));
    }

    private ValidationTasklet tasklet(long sourceSum, long targetSum) {
        MetricSumSource source = (probe, window) -> {
            probed.add(probe);
            return new MetricSum(sourceSum, 1);
        };
        MetricSumSource target = (probe, window) -> new MetricSum(targetSum, 1);
        return new ValidationTasklet(store, source, catalog -> target, new ValidationReportWriter(Clock.systemUTC()), properties);
    }

    @Test
    void samplesCatalogKeysAndWritesReport() throws Exception {
        assertThat(tasklet(42, 42).execute(null, null)).isEqualTo(RepeatStatus.FINISHED);

        assertThat(probed).extracting(ProbeSpec::metricKey).containsExactly("a", "b", "c", "x");
        assertThat(Files.readString(tempDir.resolve("validation_results.json"))).contains("\"passed\" : 4");
    }

    @Test
    void configuredProbesReplaceSampling() {
        MetricFlatteningProperties.Probe probe = new MetricFlatteningProperties.Probe();
        probe.setCustomerId(1);
        probe.setMetricKey("d");
        probe.setKind(MetricKind.INT);
        probe.setFlowId("checkout");
        properties.getValidation().getProbes().add(probe);

        tasklet(1, 1).execute(null, null);

        assertThat(probed).containsExactly(new ProbeSpec(1, "d", MetricKind.INT, "checkout"));
    }

    @Test
    void mismatchOnlyFailsWhenConfigured() {
        assertThat(tasklet(42, 41).execute(null, null)).isEqualTo(RepeatStatus.FINISHED);

        properties.getValidation().setFailOnMismatch(true);

        assertThatThrownBy(() -> tasklet(42, 41).execute(null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Validation failed");
        assertThat(tempDir.resolve("validation_results.json")).exists();
    }

    @Test
    void disabledValidationProbesNothing() {
        properties.getValidation().setEnabled(false);

        tasklet(1, 2).execute(null, null);

        assertThat(probed).isEmpty();
    }
}
