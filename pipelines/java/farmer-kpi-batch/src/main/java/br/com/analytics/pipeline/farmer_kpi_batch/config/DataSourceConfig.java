package br.com.analytics.pipeline.farmer_kpi_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * The warehouse holds the {@code gammadata} source tables; the reporting database receives the {@code analysis}
 * KPI tables. Both may point at the same server.
 */
@Configuration
public class DataSourceConfig {

    @Autowired
    private Environment env;

    @Bean(name = "warehouseDataSource")
    public DataSource warehouseDataSource() {
        return hikari("spring.datasource.warehouse", "warehouse-pool");
    }

    @Primary
    @Bean(name = "reportingDataSource")
    public DataSource reportingDataSource() {
        return hikari("spring.datasource.reporting", "reporting-pool");
    }

    @Bean(name = "warehouseTransactionManager")
    public DataSourceTransactionManager warehouseTransactionManager(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Primary
    @Bean(name = {"reportingTransactionManager", "transactionManager"})
    public DataSourceTransactionManager reportingTransactionManager(@Qualifier("reportingDataSource") DataSource reportingDataSource) {
        return new DataSourceTransactionManager(reportingDataSource);
    }

    @Bean
    public DataSourceInitializer reportingSchemaInitializer(@Qualifier("reportingDataSource") DataSource reportingDataSource,
                                                            FarmerKpiProperties properties) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(reportingDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("schema/reporting-schema.sql")));
        initializer.setEnabled(properties.initializeSchema());
        return initializer;
    }

    private HikariDataSource hikari(String prefix, String poolName) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName(poolName);
        dataSource.setDriverClassName(env.getProperty(prefix + ".driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty(prefix + ".url"));
        dataSource.setUsername(env.getProperty(prefix + ".username"));
        dataSource.setPassword(env.getProperty(prefix + ".password"));
        dataSource.setMaximumPoolSize(env.getProperty(prefix + ".maximum-pool-size", Integer.class, 5));
        return dataSource;
    }
}
