package br.com.analytics.pipeline.metric_flattening_batch.validation;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import br.com.analytics.pipeline.metric_flattening_batch.model.ValidationProbe;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares metric sums of the map-column table with those of the flattened table. Every probe
 * runs; mismatches and query errors are recorded, never thrown.
 */
@Slf4j
public class MetricValidator {

    private final MetricSumSource sourceSums;
    private final MetricSumSource targetSums;
    private final double relativeTolerance;

    public MetricValidator(MetricSumSource sourceSums, MetricSumSource targetSums, double relativeTolerance) {
        this.sourceSums = sourceSums;
        this.targetSums = targetSums;
        this.relativeTolerance = relativeTolerance;
    }

    public ValidationReport validate(List<ProbeSpec> probes, TimeWindow window) {
        log.info("Validating {} metrics over {}", probes.size(), window);
        List<ValidationProbe> results = new ArrayList<>(probes.size());
        int index = 0;
        for (ProbeSpec probe : probes) {
            index++;
            ValidationProbe result;
            try {
                MetricSum expected = sourceSums.sum(probe, window);
                MetricSum observed = targetSums.sum(probe, window);
                result = evaluate(probe, expected, observed);
            } catch (RuntimeException e) {
                log.warn("[{}/{}] Error validating customer {} metric {}", index, probes.size(),
                        probe.customerId(), probe.metricKey(), e);
                result = new ValidationProbe(probe.customerId(), probe.metricKey(), probe.kind(),
                        null, null, 0, 0, false, e.getMessage());
            }
            if (result.passed()) {
                log.info("[{}/{}] PASSED customer {} metric {} (sum: {})", index, probes.size(),
                        probe.customerId(), probe.metricKey(), result.expectedSum());
            } else if (result.errorMessage() == null) {
                log.warn("[{}/{}] FAILED customer {} metric {} (old: {}, new: {}, diff: {})", index, probes.size(),
                        probe.customerId(), probe.metricKey(), result.expectedSum(), result.observedSum(), result.difference());
            }
            results.add(result);
        }

        ValidationReport report = new ValidationReport(window, results);
        log.info("Validation finished: {} passed, {} failed", report.passedCount(), report.failedCount());
        return report;
    }

    public ValidationProbe evaluate(ProbeSpec probe, MetricSum expected, MetricSum observed) {
        boolean passed = probe.kind() == MetricKind.INT
                ? expected.sum().longValue() == observed.sum().longValue()
                : withinTolerance(expected.sum().doubleValue(), observed.sum().doubleValue());
        return new ValidationProbe(probe.customerId(), probe.metricKey(), probe.kind(),
                expected.sum(), observed.sum(), expected.rowCount(), observed.rowCount(), passed, null);
    }

    boolean withinTolerance(double expected, double observed) {
        if (Double.compare(expected, observed) == 0) {
            return true;
        }
        double scale = Math.max(Math.abs(expected), Math.abs(observed));
        return Math.abs(expected - observed) <= relativeTolerance * scale;
    }

    /**
     * Picks the first {@code perKind} keys of each kind in catalog order for every customer.
     */
    public static List<ProbeSpec> sampleProbes(KeyCatalog catalog, List<Integer> customerIds, int perKind) {
        List<ProbeSpec> probes = new ArrayList<>();
        for (Integer customerId : customerIds) {
            for (MetricKind kind : MetricKind.values()) {
                List<String> keys = catalog.keys(kind);
                for (int i = 0; i < Math.min(perKind, keys.size()); i++) {
                    probes.add(new ProbeSpec(customerId, keys.get(i), kind, null));
                }
            }
        }
        return probes;
    }
}
