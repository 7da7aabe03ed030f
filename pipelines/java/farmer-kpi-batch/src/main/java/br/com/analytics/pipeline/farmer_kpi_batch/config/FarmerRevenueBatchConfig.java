package br.com.analytics.pipeline.farmer_kpi_batch.config;

import br.com.analytics.pipeline.farmer_kpi_batch.model.FarmerMonthlyRevenue;
import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
import br.com.analytics.pipeline.farmer_kpi_batch.model.RevenueRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.processor.FarmerRevenueAggregationProcessor;
import br.com.analytics.pipeline.farmer_kpi_batch.reader.RevenueRecordReaders;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.ResponsibilityResolver;
import br.com.analytics.pipeline.farmer_kpi_batch.tasklet.FarmerRevenueLoadTasklet;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.ResilientBatchInserter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
@EnableBatchProcessing
public class FarmerRevenueBatchConfig {

    private static final Logger log = LoggerFactory.getLogger(FarmerRevenueBatchConfig.class);

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final FarmerKpiProperties properties;

    public FarmerRevenueBatchConfig(JobRepository jobRepository,
                                    PlatformTransactionManager transactionManager,
                                    FarmerKpiProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    @StepScope
    public JdbcCursorItemReader<RevenueRecord> farmerRevenueReader(
            @Qualifier("warehouseDataSource") DataSource warehouseDataSource,
            @Value("#{jobParameters['referenceDate']}") @Nullable String referenceDate,
            @Value("#{jobParameters['monthsBack']}") @Nullable String monthsBack,
            @Value("#{jobParameters['farmerId']}") @Nullable String farmerId
    ) {
        KpiWindow window = KpiWindow.fromJobParameters(referenceDate, monthsBack, farmerId, properties.monthsBack());
        return RevenueRecordReaders.revenueRecords("farmerRevenueReader", warehouseDataSource, window, 1000);
    }

    @Bean
    @JobScope
    public FarmerRevenueAggregationProcessor farmerRevenueProcessor(
            ResponsibilityResolver responsibilityResolver,
            @Value("#{jobParameters['referenceDate']}") @Nullable String referenceDate,
            @Value("#{jobParameters['monthsBack']}") @Nullable String monthsBack,
            @Value("#{jobParameters['farmerId']}") @Nullable String farmerId
    ) {
        KpiWindow window = KpiWindow.fromJobParameters(referenceDate, monthsBack, farmerId, properties.monthsBack());
        log.info("Farmer revenue window {} to {} (farmer filter: {})",
                window.start(), window.endExclusive(), window.farmerId());
        return new FarmerRevenueAggregationProcessor(window, responsibilityResolver.snapshot(window.dateRange()));
    }

    @Bean
    public ItemWriter<FarmerMonthlyRevenue> farmerRevenueChunkWriter() {
        // aggregation happens in the processor, rows are loaded by farmerRevenueLoadStep
        return items -> log.debug("Chunk passed {} farmer monthly totals", items.size());
    }

    @Bean
    public FarmerRevenueLoadTasklet farmerRevenueLoadTasklet(FarmerRevenueAggregationProcessor farmerRevenueProcessor,
                                                             ResilientBatchInserter reportingInserter) {
        return new FarmerRevenueLoadTasklet(farmerRevenueProcessor, reportingInserter, properties.netCommissionFactor());
    }

    @Bean
    public Step farmerRevenueAggregationStep(
            JdbcCursorItemReader<RevenueRecord> farmerRevenueReader,
            FarmerRevenueAggregationProcessor farmerRevenueProcessor,
            ItemWriter<FarmerMonthlyRevenue> farmerRevenueChunkWriter
    ) {
        return new StepBuilder("farmerRevenueAggregationStep", jobRepository)
                .<RevenueRecord, FarmerMonthlyRevenue>chunk(properties.chunkSize())
                .reader(farmerRevenueReader)
                .processor(farmerRevenueProcessor)
                .writer(farmerRevenueChunkWriter)
                .build();
    }

    @Bean
    public Step farmerRevenueLoadStep(FarmerRevenueLoadTasklet farmerRevenueLoadTasklet) {
        return new StepBuilder("farmerRevenueLoadStep", jobRepository)
                .tasklet(farmerRevenueLoadTasklet, transactionManager)
                .build();
    }

    @Bean
    public Job farmerRevenueJob(Step farmerRevenueAggregationStep, Step farmerRevenueLoadStep) {
        return new JobBuilder("farmerRevenueJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(farmerRevenueAggregationStep)
                .next(farmerRevenueLoadStep)
                .build();
    }
}
