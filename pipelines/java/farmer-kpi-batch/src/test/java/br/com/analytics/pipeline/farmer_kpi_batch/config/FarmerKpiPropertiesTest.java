package br.com.analytics.pipeline.farmer_kpi_batch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FarmerKpiPropertiesTest {

    @Test
    @DisplayName("should allow max-attempts transactions in total")
    void backOffCountsTheFirstAttempt() {
        FarmerKpiProperties.Load load = new FarmerKpiProperties.Load(1000, 3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1));

        BackOffExecution execution = load.backOff().start();

        assertThat(execution.nextBackOff()).isEqualTo(100L);
        assertThat(execution.nextBackOff()).isEqualTo(200L);
        assertThat(execution.nextBackOff()).isEqualTo(BackOffExecution.STOP);
    }

    @Test
    @DisplayName("should cap the wait between attempts")
    void capsInterval() {
        FarmerKpiProperties.Load load = new FarmerKpiProperties.Load(1000, 5, Duration.ofMillis(400), 3.0, Duration.ofMillis(500));

        BackOffExecution execution = load.backOff().start();

        assertThat(execution.nextBackOff()).isEqualTo(400L);
        assertThat(execution.nextBackOff()).isEqualTo(500L);
    }
}
