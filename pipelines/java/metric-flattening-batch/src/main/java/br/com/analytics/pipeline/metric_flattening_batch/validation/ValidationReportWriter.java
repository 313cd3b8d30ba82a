package br.com.analytics.pipeline.metric_flattening_batch.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class ValidationReportWriter {

    private final Clock clock;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public ValidationReportWriter(Clock clock) {
        this.clock = clock;
    }

    public void write(ValidationReport report, Path reportFile, Map<String, Object> metadata) {
        Map<String, Object> document = new LinkedHashMap<>();
        Map<String, Object> header = new LinkedHashMap<>(metadata);
        header.put("generatedAt", clock.instant());
        header.put("windowStart", report.window().start());
        header.put("windowEnd", report.window().end());
        header.put("totalMetrics", report.probes().size());
        header.put("passed", report.passedCount());
        header.put("failed", report.failedCount());
        document.put("metadata", header);
        document.put("results", report.probes());

        try {
            Path parent = reportFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(reportFile.toFile(), document);
        } catch (IOException e) {
            log.error("Failed to write validation report to {}", reportFile, e);
            throw new UncheckedIOException("Failed to write validation report to " + reportFile, e);
        }
        log.info("Validation results saved to {}", reportFile);
    }
}
