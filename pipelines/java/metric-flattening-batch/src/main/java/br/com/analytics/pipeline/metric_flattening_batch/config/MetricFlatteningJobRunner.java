package br.com.analytics.pipeline.metric_flattening_batch.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Launches the job once per process. Every launch gets a fresh timestamp parameter so a failed
 * run can be started again; chunk-level resume comes from the progress table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "metric-flattening", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class MetricFlatteningJobRunner implements CommandLineRunner {

    private final JobOperator jobOperator;
    private final Job metricFlatteningJob;

    @Override
    public void run(String... args) throws Exception {
        JobParameters parameters = new JobParametersBuilder()
                .addLong("launchedAt", System.currentTimeMillis())
                .toJobParameters();

        JobExecution execution = jobOperator.start(metricFlatteningJob, parameters);
        log.info("Job {} finished with status {}", metricFlatteningJob.getName(), execution.getStatus());
        if (execution.getStatus().isUnsuccessful()) {
            throw new IllegalStateException("Job " + metricFlatteningJob.getName() + " ended with " + execution.getStatus());
        }
    }
}
