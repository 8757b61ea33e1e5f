package com.di.retailetl.config;

import com.di.retailetl.util.HikariPoolFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Pool, JdbcTemplate and transaction wiring. Spring Boot's own DataSource auto-configuration is
 * excluded; the pool is built from {@link DatabaseProperties}.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Bean(destroyMethod = "close")
    public com.zaxxer.hikari.HikariDataSource dataSource(DatabaseProperties properties) {
        DbConfigSnapshot snapshot = properties.toDbConfigSnapshot();
        log.info("[DS-STARTUP] {}", snapshot);
        return HikariPoolFactory.create(snapshot);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
