package br.com.analytics.pipeline.metric_flattening_batch.config;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.DiscoveryScope;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;
import br.com.analytics.pipeline.metric_flattening_batch.model.TimeWindow;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "metric-flattening")
public class MetricFlatteningProperties {

    private boolean runOnStartup = true;
    private String sourceTable;
    private String targetTable;
    private List<Integer> customerIds = new ArrayList<>();

    /**
     * Discovery window; also the transformation window unless that one is set explicitly.
     */
    private Instant windowStart;
    private Instant windowEnd;

    private Duration queryTimeout = Duration.ofMinutes(5);

    private Discovery discovery = new Discovery();
    private Schema schema = new Schema();
    private Transformation transformation = new Transformation();
    private Validation validation = new Validation();

    public TimeWindow discoveryWindow() {
        return new TimeWindow(windowStart, windowEnd);
    }

    public TimeWindow transformationWindow() {
        Instant start = transformation.getWindowStart() != null ? transformation.getWindowStart() : windowStart;
        Instant end = transformation.getWindowEnd() != null ? transformation.getWindowEnd() : windowEnd;
        return new TimeWindow(start, end);
    }

    public DiscoveryScope discoveryScope() {
        return new DiscoveryScope(sourceTable, discoveryWindow(), customerIds);
    }

    public DiscoveryScope transformationScope() {
        return new DiscoveryScope(sourceTable, transformationWindow(), customerIds);
    }

    @Data
    public static class Discovery {
        private boolean enabled = true;
        private String catalogFile = "output/mappings/key_catalog.json";
    }

    @Data
    public static class Schema {
        private boolean createTable = true;
        private boolean dropBeforeCreate = false;
        private String ddlFile = "output/reports/create_table.sql";
    }

    @Data
    public static class Transformation {
        private boolean enabled = true;
        private Instant windowStart;
        private Instant windowEnd;
        private Duration chunkWidth = Duration.ofHours(1);
        private boolean truncateTarget = false;
        private Integer startFromChunk;
        private int readRetries = 3;
        private Duration retryBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Validation {
        private boolean enabled = true;
        private List<Probe> probes = new ArrayList<>();
        private int sampleSize = 3;
        private double relativeTolerance = 1e-3;
        private boolean failOnMismatch = false;
        private String reportFile = "output/reports/validation_results.json";
    }

    @Data
    public static class Probe {
        private Integer customerId;
        private String metricKey;
        private MetricKind kind = MetricKind.INT;
        private String flowId;
    }
}
