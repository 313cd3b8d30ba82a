package br.com.analytics.pipeline.metric_flattening_batch.config;

import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyCatalogStore;
import br.com.analytics.pipeline.metric_flattening_batch.catalog.KeyDiscoverer;
import br.com.analytics.pipeline.metric_flattening_batch.reader.JdbcSourceRowReader;
import br.com.analytics.pipeline.metric_flattening_batch.reader.SourceRowReader;
import br.com.analytics.pipeline.metric_flattening_batch.scheduler.JdbcChunkProgressRepository;
import br.com.analytics.pipeline.metric_flattening_batch.schema.SchemaPlanner;
import br.com.analytics.pipeline.metric_flattening_batch.tasklet.ChunkTransformationTasklet;
import br.com.analytics.pipeline.metric_flattening_batch.tasklet.KeyDiscoveryTasklet;
import br.com.analytics.pipeline.metric_flattening_batch.tasklet.SchemaPlanningTasklet;
import br.com.analytics.pipeline.metric_flattening_batch.tasklet.ValidationTasklet;
import br.com.analytics.pipeline.metric_flattening_batch.validation.FlattenedMetricSumSource;
import br.com.analytics.pipeline.metric_flattening_batch.validation.SourceMapMetricSumSource;
import br.com.analytics.pipeline.metric_flattening_batch.validation.ValidationReportWriter;
import br.com.analytics.pipeline.metric_flattening_batch.writer.JdbcAggregatedRowWriter;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableBatchProcessing
public class MetricFlatteningBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final MetricFlatteningProperties properties;

    public MetricFlatteningBatchConfig(JobRepository jobRepository,
                                       @Qualifier("batchTransactionManager") PlatformTransactionManager transactionManager,
                                       MetricFlatteningProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SourceRowReader sourceRowReader(@Qualifier("sourceJdbcTemplate") JdbcTemplate sourceJdbcTemplate) {
        return new JdbcSourceRowReader(sourceJdbcTemplate, properties.getSourceTable());
    }

    @Bean
    public KeyCatalogStore keyCatalogStore() {
        return new KeyCatalogStore(Path.of(properties.getDiscovery().getCatalogFile()));
    }

    @Bean
    public KeyDiscoverer keyDiscoverer(SourceRowReader sourceRowReader, Clock clock) {
        return new KeyDiscoverer(sourceRowReader, clock);
    }

    @Bean
    public SchemaPlanner schemaPlanner() {
        return new SchemaPlanner();
    }

    @Bean(initMethod = "initializeSchema")
    public JdbcChunkProgressRepository chunkProgressRepository(@Qualifier("batchJdbcTemplate") JdbcTemplate batchJdbcTemplate) {
        return new JdbcChunkProgressRepository(batchJdbcTemplate, transactionManager);
    }

    @Bean
    public KeyDiscoveryTasklet keyDiscoveryTasklet(KeyDiscoverer keyDiscoverer, KeyCatalogStore keyCatalogStore) {
        return new KeyDiscoveryTasklet(keyDiscoverer, keyCatalogStore, properties);
    }

    @Bean
    public SchemaPlanningTasklet schemaPlanningTasklet(KeyCatalogStore keyCatalogStore, SchemaPlanner schemaPlanner,
                                                       @Qualifier("targetJdbcTemplate") JdbcTemplate targetJdbcTemplate) {
        return new SchemaPlanningTasklet(keyCatalogStore, schemaPlanner, targetJdbcTemplate, properties);
    }

    @Bean
    public ChunkTransformationTasklet chunkTransformationTasklet(
            KeyCatalogStore keyCatalogStore,
            SchemaPlanner schemaPlanner,
            SourceRowReader sourceRowReader,
            JdbcChunkProgressRepository chunkProgressRepository,
            @Qualifier("targetDataSource") DataSource targetDataSource,
            @Qualifier("targetJdbcTemplate") JdbcTemplate targetJdbcTemplate,
            Clock clock
    ) {
        return new ChunkTransformationTasklet(keyCatalogStore, schemaPlanner, sourceRowReader,
                plan -> new JdbcAggregatedRowWriter(targetDataSource, targetJdbcTemplate, properties.getTargetTable(), plan),
                chunkProgressRepository, properties, clock);
    }

    @Bean
    public ValidationTasklet validationTasklet(KeyCatalogStore keyCatalogStore,
                                               @Qualifier("sourceJdbcTemplate") JdbcTemplate sourceJdbcTemplate,
                                               @Qualifier("targetJdbcTemplate") JdbcTemplate targetJdbcTemplate,
                                               Clock clock) {
        return new ValidationTasklet(keyCatalogStore,
                new SourceMapMetricSumSource(sourceJdbcTemplate, properties.getSourceTable()),
                catalog -> new FlattenedMetricSumSource(targetJdbcTemplate, properties.getTargetTable(), catalog),
                new ValidationReportWriter(clock), properties);
    }

    @Bean
    public Step keyDiscoveryStep(KeyDiscoveryTasklet keyDiscoveryTasklet) {
        return new StepBuilder("keyDiscoveryStep", jobRepository)
                .tasklet(keyDiscoveryTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step schemaPlanningStep(SchemaPlanningTasklet schemaPlanningTasklet) {
        return new StepBuilder("schemaPlanningStep", jobRepository)
                .tasklet(schemaPlanningTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step chunkTransformationStep(ChunkTransformationTasklet chunkTransformationTasklet) {
        return new StepBuilder("chunkTransformationStep", jobRepository)
                .tasklet(chunkTransformationTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step validationStep(ValidationTasklet validationTasklet) {
        return new StepBuilder("validationStep", jobRepository)
                .tasklet(validationTasklet, transactionManager)
                .build();
    }

    @Bean
    public Job metricFlatteningJob(Step keyDiscoveryStep, Step schemaPlanningStep,
                                   Step chunkTransformationStep, Step validationStep) {
        return new JobBuilder("metricFlatteningJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(keyDiscoveryStep)
                .next(schemaPlanningStep)
                .next(chunkTransformationStep)
                .next(validationStep)
                .build();
    }

}
