package br.com.analytics.pipeline.metric_flattening_batch.tasklet;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalog;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalogStore;
import br.com.analytics.pipeline.metric_flattening_batch.config.MetricFlatteningProperties;
import br.com.analytics.pipeline.metric_flattening_batch.schema.SchemaPlan;
import br.com.analytics.pipeline.metric_flattening_batch.schema.SchemaPlanner;
import br.com.analytics.pipeline.metric_flattening_batch.schema.TargetTableDdl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public class SchemaPlanningTasklet implements Tasklet {

    private final KeyCatalogStore store;
    private final SchemaPlanner planner;
    private final JdbcTemplate targetJdbcTemplate;
    private final MetricFlatteningProperties properties;

    public SchemaPlanningTasklet(KeyCatalogStore store, SchemaPlanner planner, JdbcTemplate targetJdbcTemplate,
                                 MetricFlatteningProperties properties) {
        this.store = store;
        this.planner = planner;
        this.targetJdbcTemplate = targetJdbcTemplate;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        KeyCatalog catalog = store.load(properties.transformationScope());
        SchemaPlan plan = planner.plan(catalog);
        String targetTable = properties.getTargetTable();
        String ddl = TargetTableDdl.createTable(targetTable, plan);

        MetricFlatteningProperties.Schema schema = properties.getSchema();
        if (schema.getDdlFile() != null && !schema.getDdlFile().isBlank()) {
            saveDdl(Path.of(schema.getDdlFile()), ddl);
        }

        if (!schema.isCreateTable()) {
            log.info("Table creation disabled, planned {} with {} metric columns",
                    targetTable, plan.metricColumns().size());
            return RepeatStatus.FINISHED;
        }

        if (schema.isDropBeforeCreate()) {
            log.warn("Dropping existing table {}", targetTable);
            targetJdbcTemplate.execute(TargetTableDdl.dropTable(targetTable));
        }

        try {
            targetJdbcTemplate.execute(ddl);
        } catch (DataAccessException e) {
            log.error("Failed to create table {}", targetTable, e);
            throw e;
        }
        log.info("Table {} ready with {} int and {} float columns",
                targetTable, plan.intColumnCount(), plan.floatColumnCount());
        return RepeatStatus.FINISHED;
    }

    private void saveDdl(Path ddlFile, String ddl) {
        try {
            Path parent = ddlFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(ddlFile, ddl + System.lineSeparator());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write DDL to " + ddlFile, e);
        }
        log.info("DDL saved to {}", ddlFile);
    }
}
