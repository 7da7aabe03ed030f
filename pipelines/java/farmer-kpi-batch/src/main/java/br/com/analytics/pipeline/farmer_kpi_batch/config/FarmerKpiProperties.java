package br.com.analytics.pipeline.farmer_kpi_batch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.ExponentialBackOff;

import java.math.BigDecimal;
import java.time.Duration;

@ConfigurationProperties(prefix = "farmer-kpi")
public record FarmerKpiProperties(
        @DefaultValue("farmerRevenueJob") String jobName,
        @DefaultValue("11") int monthsBack,
        @DefaultValue("0.805") BigDecimal netCommissionFactor,
        @DefaultValue("500") int chunkSize,
        @DefaultValue("false") boolean initializeSchema,
        @DefaultValue Load load
) {

    public record Load(
            @DefaultValue("1000") int batchSize,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("5s") Duration initialBackoff,
            @DefaultValue("2.0") double backoffMultiplier,
            @DefaultValue("1m") Duration maxBackoff
    ) {

        public BackOff backOff() {
            ExponentialBackOff backOff = new ExponentialBackOff(initialBackoff.toMillis(), backoffMultiplier);
            backOff.setMaxInterval(maxBackoff.toMillis());
            // the first attempt is not a retry
            backOff.setMaxAttempts(Math.max(0, maxAttempts - 1));
            return backOff;
        }
    }
}
