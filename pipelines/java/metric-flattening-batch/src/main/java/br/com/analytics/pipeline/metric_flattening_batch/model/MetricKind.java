package br.com.analytics.pipeline.metric_flattening_batch.model;

public enum MetricKind {

    INT("int", "metricIntGroup"),
    FLOAT("float", "metricFloatGroup");

    private final String columnPrefix;
    private final String sourceGroupPrefix;

    MetricKind(String columnPrefix, String sourceGroupPrefix) {
        this.columnPrefix = columnPrefix;
        this.sourceGroupPrefix = sourceGroupPrefix;
    }

    public String columnName(int slot) {
        return columnPrefix + (slot + 1);
    }

    public String sourceGroupColumn(int groupNumber) {
        return sourceGroupPrefix + groupNumber;
    }

    public String columnPrefix() {
        return columnPrefix;
    }
}
