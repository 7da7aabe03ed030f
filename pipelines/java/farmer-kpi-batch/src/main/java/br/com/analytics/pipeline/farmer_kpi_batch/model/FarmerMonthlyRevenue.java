package br.com.analytics.pipeline.farmer_kpi_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record FarmerMonthlyRevenue(
        Long farmerId,
        LocalDate month,
        BigDecimal grossRevenue,
        BigDecimal netRevenue,
        BigDecimal grossCommission,
        long recordCount
) {

    public static FarmerMonthlyRevenue empty(AggregationKey key) {
        return new FarmerMonthlyRevenue(key.farmerId(), key.month(),
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0L);
    }

    public FarmerMonthlyRevenue add(RevenueRecord record) {
        return new FarmerMonthlyRevenue(
                farmerId,
                month,
                grossRevenue.add(orZero(record.grossRevenue())),
                netRevenue.add(orZero(record.netRevenue())),
                grossCommission.add(orZero(record.grossCommission())),
                recordCount + 1
        );
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
