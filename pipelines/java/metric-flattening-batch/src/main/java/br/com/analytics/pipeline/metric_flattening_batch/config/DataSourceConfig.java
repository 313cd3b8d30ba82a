package br.com.analytics.pipeline.metric_flattening_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    private static final int SOURCE_FETCH_SIZE = 1000;

    @Autowired
    private Environment env;

    @Bean(name = "sourceDataSource")
    public DataSource sourceDataSource() {
        return createDataSource("source");
    }

    @Bean(name = "targetDataSource")
    public DataSource targetDataSource() {
        return createDataSource("target");
    }

    @Primary
    @Bean(name = {"batchDataSource", "dataSource"})
    public DataSource batchDataSource() {
        return createDataSource("batch");
    }

    private HikariDataSource createDataSource(String name) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName(name + "-pool");
        dataSource.setDriverClassName(env.getProperty("spring.datasource." + name + ".driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty("spring.datasource." + name + ".url"));
        dataSource.setUsername(env.getProperty("spring.datasource." + name + ".username"));
        dataSource.setPassword(env.getProperty("spring.datasource." + name + ".password"));
        return dataSource;
    }

    @Bean(name = "sourceJdbcTemplate")
    public JdbcTemplate sourceJdbcTemplate(@Qualifier("sourceDataSource") DataSource sourceDataSource,
                                           MetricFlatteningProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(sourceDataSource);
        jdbcTemplate.setFetchSize(SOURCE_FETCH_SIZE);
        jdbcTemplate.setQueryTimeout((int) properties.getQueryTimeout().toSeconds());
        return jdbcTemplate;
    }

    @Bean(name = "targetJdbcTemplate")
    public JdbcTemplate targetJdbcTemplate(@Qualifier("targetDataSource") DataSource targetDataSource,
                                           MetricFlatteningProperties properties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(targetDataSource);
        jdbcTemplate.setQueryTimeout((int) properties.getQueryTimeout().toSeconds());
        return jdbcTemplate;
    }

    @Primary
    @Bean(name = "batchJdbcTemplate")
    public JdbcTemplate batchJdbcTemplate(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new JdbcTemplate(batchDataSource);
    }

    @Primary
    @Bean(name = {"batchTransactionManager", "transactionManager"})
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

}
