package br.com.analytics.pipeline.metric_flattening_batch.tasklet;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.DiscoveryResult;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalogStore;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyDiscoverer;
import br.com.analytics.pipeline.metric_flattening_batch.config.MetricFlatteningProperties;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

/**
 * Discovers every metric key in the configured scope and persists the resulting catalog. With
 * discovery disabled the stored catalog is only checked against the scope.
 */
@Slf4j
public class KeyDiscoveryTasklet implements Tasklet {

    private final KeyDiscoverer discoverer;
    private final KeyCatalogStore store;
    private final MetricFlatteningProperties properties;

    public KeyDiscoveryTasklet(KeyDiscoverer discoverer, KeyCatalogStore store, MetricFlatteningProperties properties) {
        this.discoverer = discoverer;
        this.store = store;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        if (!properties.getDiscovery().isEnabled()) {
            KeyCatalog existing = store.load(properties.discoveryScope());
            log.info("Key discovery disabled, using existing catalog {} ({} int keys, {} float keys)",
                    store.getCatalogFile(), existing.size(MetricKind.INT), existing.size(MetricKind.FLOAT));
            return RepeatStatus.FINISHED;
        }

        DiscoveryResult result = discoverer.discover(properties.discoveryScope());
        store.save(result.catalog());
        if (result.malformedRows() > 0) {
            log.warn("Skipped {} malformed rows out of {} during key discovery",
                    result.malformedRows(), result.rowsScanned());
        }
        return RepeatStatus.FINISHED;
    }
}
