package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record ClientRecord(
        long clientId,
        LocalDate creationDate,
        @Nullable Long originalFarmerId
) {
}
