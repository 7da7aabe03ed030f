package br.com.analytics.pipeline.farmer_kpi_batch.config;

import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
import br.com.analytics.pipeline.farmer_kpi_batch.model.RevenueRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.reader.RevenueRecordReaders;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.ResponsibilityResolver;
import br.com.analytics.pipeline.farmer_kpi_batch.tasklet.ClientRevenueCleanupTasklet;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.ClientRevenueWriter;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.ResilientBatchInserter;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class ClientRevenueBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final FarmerKpiProperties properties;

    public ClientRevenueBatchConfig(JobRepository jobRepository,
                                    PlatformTransactionManager transactionManager,
                                    FarmerKpiProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    @StepScope
    public JdbcCursorItemReader<RevenueRecord> clientRevenueReader(
            @Qualifier("warehouseDataSource") DataSource warehouseDataSource,
            @Value("#{jobParameters['referenceDate']}") @Nullable String referenceDate,
            @Value("#{jobParameters['monthsBack']}") @Nullable String monthsBack,
            @Value("#{jobParameters['farmerId']}") @Nullable String farmerId
    ) {
        KpiWindow window = KpiWindow.fromJobParameters(referenceDate, monthsBack, farmerId, properties.monthsBack());
        return RevenueRecordReaders.revenueRecords("clientRevenueReader", warehouseDataSource, window, 1000);
    }

    @Bean
    @JobScope
    public ClientRevenueWriter clientRevenueWriter(
            ResponsibilityResolver responsibilityResolver,
            ResilientBatchInserter reportingInserter,
            @Value("#{jobParameters['referenceDate']}") @Nullable String referenceDate,
            @Value("#{jobParameters['monthsBack']}") @Nullable String monthsBack,
            @Value("#{jobParameters['farmerId']}") @Nullable String farmerId
    ) {
        KpiWindow window = KpiWindow.fromJobParameters(referenceDate, monthsBack, farmerId, properties.monthsBack());
        return new ClientRevenueWriter(
                responsibilityResolver.snapshot(window.dateRange()),
                window,
                reportingInserter,
                properties.netCommissionFactor());
    }

    @Bean
    @JobScope
    public ClientRevenueCleanupTasklet clientRevenueCleanupTasklet(
            @Qualifier("reportingDataSource") DataSource reportingDataSource,
            @Value("#{jobParameters['farmerId']}") @Nullable String farmerId
    ) {
        KpiWindow window = KpiWindow.fromJobParameters(null, null, farmerId, properties.monthsBack());
        return new ClientRevenueCleanupTasklet(reportingDataSource, window);
    }

    @Bean
    public Step clientRevenueCleanupStep(ClientRevenueCleanupTasklet clientRevenueCleanupTasklet) {
        return new StepBuilder("clientRevenueCleanupStep", jobRepository)
                .tasklet(clientRevenueCleanupTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step clientRevenueDetailStep(JdbcCursorItemReader<RevenueRecord> clientRevenueReader,
                                        ClientRevenueWriter clientRevenueWriter) {
        return new StepBuilder("clientRevenueDetailStep", jobRepository)
                .<RevenueRecord, RevenueRecord>chunk(properties.chunkSize())
                .reader(clientRevenueReader)
                .writer(clientRevenueWriter)
                .build();
    }

    @Bean
    public Job clientRevenueJob(Step clientRevenueCleanupStep, Step clientRevenueDetailStep) {
        return new JobBuilder("clientRevenueJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(clientRevenueCleanupStep)
                .next(clientRevenueDetailStep)
                .build();
    }
}
