package br.com.analytics.pipeline.farmer_kpi_batch.config;

import br.com.analytics.pipeline.farmer_kpi_batch.reader.JdbcResponsibilitySource;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.AttributionListener;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.LoggingAttributionListener;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.ResponsibilityResolver;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.ResponsibilitySource;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.ResilientBatchInserter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(FarmerKpiProperties.class)
public class ResponsibilityConfig {

    @Bean
    public ResponsibilitySource responsibilitySource(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new JdbcResponsibilitySource(warehouseDataSource);
    }

    @Bean
    public AttributionListener attributionListener() {
        return new LoggingAttributionListener();
    }

    @Bean
    public ResponsibilityResolver responsibilityResolver(ResponsibilitySource responsibilitySource,
                                                         AttributionListener attributionListener) {
        return new ResponsibilityResolver(responsibilitySource, attributionListener);
    }

    @Bean
    public ResilientBatchInserter reportingInserter(@Qualifier("reportingDataSource") DataSource reportingDataSource,
                                                    @Qualifier("reportingTransactionManager") PlatformTransactionManager transactionManager,
                                                    FarmerKpiProperties properties) {
        return new ResilientBatchInserter(
                new JdbcTemplate(reportingDataSource),
                transactionManager,
                properties.load().batchSize(),
                properties.load().backOff());
    }
}
