package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record FarmerRevenueRow(
        LocalDate referenceMonth,
        String formattedMonth,
        Long farmerId,
        @Nullable String farmerName,
        BigDecimal grossRevenue,
        BigDecimal netRevenue,
        BigDecimal grossCommission,
        BigDecimal netCommission,
        String origin,
        LocalDateTime updatedAt
) {
}
