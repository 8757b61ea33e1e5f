package com.di.retailetl.config;

import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.load.RetailLoadOrchestrator;
import com.di.retailetl.load.jdbc.DatabaseSchemaInitializer;
import com.di.retailetl.load.jdbc.JdbcTransactionLoader;
import com.di.retailetl.load.jdbc.JdbcWatermarkStore;
import com.di.retailetl.load.metadata.LoadRunRepository;
import com.di.retailetl.report.RunReportWriter;
import com.di.retailetl.schema.SchemaContract;
import com.di.retailetl.schema.SchemaRegistry;
import com.di.retailetl.source.CsvBatchReader;
import com.di.retailetl.source.RawBatchProvider;
import com.di.retailetl.util.PipelineMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;

/**
 * Builds the pipeline from its properties. The schema is loaded while the context starts, so a
 * malformed schema stops the application before any row is read.
 */
@Configuration
public class PipelineConfiguration {

    @Bean
    public SchemaRegistry schemaRegistry(ResourceLoader resourceLoader) {
        return new SchemaRegistry(resourceLoader);
    }

    @Bean
    public SchemaContract schemaContract(SchemaRegistry registry, RetailEtlProperties properties) {
        return registry.load(properties.getSchemaFile());
    }

    @Bean
    public CleaningRules cleaningRules(CleaningProperties properties) {
        return properties.toCleaningRules();
    }

    @Bean
    public RawBatchProvider rawBatchProvider(RetailEtlProperties properties, SchemaContract schema) {
        return new CsvBatchReader(Path.of(properties.getInputFile()), schema, properties.getCsvDelimiter());
    }

    @Bean
    public JdbcWatermarkStore watermarkStore(JdbcTemplate jdbcTemplate) {
        return new JdbcWatermarkStore(jdbcTemplate);
    }

    @Bean
    public JdbcTransactionLoader transactionLoader(JdbcTemplate jdbcTemplate, CleaningRules rules,
                                                   RetailEtlProperties properties) {
        return new JdbcTransactionLoader(jdbcTemplate, rules, properties.getTargetTable());
    }

    @Bean
    public DatabaseSchemaInitializer databaseSchemaInitializer(JdbcTemplate jdbcTemplate,
                                                               RetailEtlProperties properties) {
        return new DatabaseSchemaInitializer(jdbcTemplate, properties.getTargetTable());
    }

    @Bean
    public LoadRunRepository loadRunRepository(JdbcTemplate jdbcTemplate) {
        return new LoadRunRepository(jdbcTemplate);
    }

    @Bean
    public RunReportWriter runReportWriter(RetailEtlProperties properties) {
        return new RunReportWriter(Path.of(properties.getReportDir()));
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry) {
        return new PipelineMetrics(meterRegistry);
    }

    @Bean
    public RetailLoadOrchestrator retailLoadOrchestrator(SchemaContract schema,
                                                         CleaningRules rules,
                                                         RawBatchProvider source,
                                                         JdbcWatermarkStore watermarkStore,
                                                         JdbcTransactionLoader loader,
                                                         TransactionTemplate transactionTemplate,
                                                         LoadRunRepository runRepository,
                                                         RunReportWriter reportWriter,
                                                         PipelineMetrics metrics,
                                                         RetailEtlProperties properties) {
        return new RetailLoadOrchestrator(schema, rules, source, watermarkStore, loader,
                transactionTemplate, runRepository, reportWriter, metrics, properties.getTargetTable());
    }
}
