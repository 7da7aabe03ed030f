package br.com.analytics.pipeline.farmer_kpi_batch.model;

import java.time.LocalDate;

public record AggregationKey(
        Long farmerId,
        LocalDate month
) {
}
