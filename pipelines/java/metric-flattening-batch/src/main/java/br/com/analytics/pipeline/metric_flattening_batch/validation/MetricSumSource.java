package br.com.analytics.pipeline.metric_flattening_batch.validation;

import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;

public interface MetricSumSource {

    MetricSum sum(ProbeSpec probe, TimeWindow window);
}
