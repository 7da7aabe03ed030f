package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record ClientRevenueRow(
        LocalDate recordDate,
        String formattedMonth,
        long clientId,
        @Nullable Long responsibleFarmerId,
        @Nullable String responsibleFarmerName,
        BigDecimal grossRevenue,
        BigDecimal netRevenue,
        BigDecimal grossCommission,
        BigDecimal netCommission,
        LocalDateTime updatedAt
) {
}
