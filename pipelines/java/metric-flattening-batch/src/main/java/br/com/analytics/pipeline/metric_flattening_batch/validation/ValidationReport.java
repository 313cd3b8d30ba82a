package br.com.analytics.pipeline.metric_flattening_batch.validation;

import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import br.com.analytics.pipeline.metric_flattening_batch.model.ValidationProbe;

import java.util.List;

public record ValidationReport(
        TimeWindow window,
        List<ValidationProbe> probes
) {

    public ValidationReport {
        probes = List.copyOf(probes);
    }

    public long passedCount() {
        return probes.stream().filter(ValidationProbe::passed).count();
    }

    public long failedCount() {
        return probes.size() - passedCount();
    }

    public boolean allPassed() {
        return failedCount() == 0;
    }
}
