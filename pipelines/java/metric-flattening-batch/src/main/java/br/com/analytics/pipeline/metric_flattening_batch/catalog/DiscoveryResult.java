package br.com.analytics.pipeline.metric_flattening_batch.catalog;

public record DiscoveryResult(
        KeyCatalog catalog,
        long rowsScanned,
        long malformedRows
) {
}
