package br.com.analytics.pipeline.metric_flattening_batch.tasklet;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalogStore;
import br.com.analytics.pipeline.metric_flattening_batch.config.MetricFlatteningProperties;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import br.com.analytics.pipeline.metric_flattening_batch.model.ValidationProbe;
import br.com.analytics.pipeline.metric_flattening_batch.validation.MetricSumSource;
import br.com.analytics.pipeline.metric_flattening_batch.validation.MetricValidator;
import br.com.analytics.pipeline.metric_flattening_batch.validation.ProbeSpec;
import br.com.analytics.pipeline.metric_flattening_batch.validation.ValidationReport;
import br.com.analytics.pipeline.metric_flattening_batch.validation.ValidationReportWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Compares per-metric sums between the map-column source and the flattened target and writes a
 * report. Mismatches only fail the step when configured to.
 */
@Slf4j
public class ValidationTasklet implements Tasklet {

    private final KeyCatalogStore store;
    private final MetricSumSource sourceSums;
    private final Function<KeyCatalog, MetricSumSource> targetSumsFactory;
    private final ValidationReportWriter reportWriter;
    private final MetricFlatteningProperties properties;

    public ValidationTasklet(KeyCatalogStore store, MetricSumSource sourceSums,
                             Function<KeyCatalog, MetricSumSource> targetSumsFactory,
                             ValidationReportWriter reportWriter, MetricFlatteningProperties properties) {
        this.store = store;
        this.sourceSums = sourceSums;
        this.targetSumsFactory = targetSumsFactory;
        this.reportWriter = reportWriter;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        MetricFlatteningProperties.Validation validation = properties.getValidation();
        if (!validation.isEnabled()) {
            log.info("Validation disabled");
            return RepeatStatus.FINISHED;
        }

        KeyCatalog catalog = store.load(properties.transformationScope());
        TimeWindow window = properties.transformationWindow();
        List<ProbeSpec> probes = probes(catalog);
        if (probes.isEmpty()) {
            log.warn("No metrics to validate");
            return RepeatStatus.FINISHED;
        }

        MetricValidator validator = new MetricValidator(sourceSums, targetSumsFactory.apply(catalog),
                validation.getRelativeTolerance());
        ValidationReport report = validator.validate(probes, window);

        for (ValidationProbe probe : report.probes()) {
            if (!probe.passed()) {
                log.warn("  FAIL {} ({}) for customer {}: expected {}, observed {}{}",
                        probe.metricKey(), probe.kind(), probe.customerId(), probe.expectedSum(), probe.observedSum(),
                        probe.errorMessage() == null ? "" : " - " + probe.errorMessage());
            }
        }
        log.info("Validation summary: {} passed, {} failed", report.passedCount(), report.failedCount());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sourceTable", properties.getSourceTable());
        metadata.put("targetTable", properties.getTargetTable());
        metadata.put("relativeTolerance", validation.getRelativeTolerance());
        reportWriter.write(report, Path.of(validation.getReportFile()), metadata);

        if (!report.allPassed() && validation.isFailOnMismatch()) {
            throw new IllegalStateException("Validation failed for " + report.failedCount()
                    + " of " + report.probes().size() + " metrics");
        }
        return RepeatStatus.FINISHED;
    }

    private List<ProbeSpec> probes(KeyCatalog catalog) {
        MetricFlatteningProperties.Validation validation = properties.getValidation();
        if (!validation.getProbes().isEmpty()) {
            return validation.getProbes().stream()
                    .map(p -> new ProbeSpec(p.getCustomerId(), p.getMetricKey(), p.getKind(), p.getFlowId()))
                    .toList();
        }
        return MetricValidator.sampleProbes(catalog, properties.getCustomerIds(), validation.getSampleSize());
    }
}
