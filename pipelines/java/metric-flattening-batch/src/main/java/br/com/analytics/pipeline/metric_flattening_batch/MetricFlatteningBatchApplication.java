package br.com.analytics.pipeline.metric_flattening_batch;

import br.com.analytics.pipeline.metric_flattening_batch.config.MetricFlatteningProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MetricFlatteningProperties.class)
public class MetricFlatteningBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MetricFlatteningBatchApplication.class, args)));
    }
}
