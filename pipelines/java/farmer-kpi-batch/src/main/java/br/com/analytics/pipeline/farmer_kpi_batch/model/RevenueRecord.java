package br.com.analytics.pipeline.farmer_kpi_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RevenueRecord(
        long clientId,
        LocalDate recordDate,
        BigDecimal grossRevenue,
        BigDecimal netRevenue,
        BigDecimal grossCommission
) implements ClientActivity {
}
