package br.com.analytics.pipeline.farmer_kpi_batch.tasklet;

import br.com.analytics.pipeline.farmer_kpi_batch.model.FarmerMonthlyRevenue;
import br.com.analytics.pipeline.farmer_kpi_batch.model.FarmerRevenueRow;
import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
import br.com.analytics.pipeline.farmer_kpi_batch.processor.FarmerRevenueAggregationProcessor;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.BatchLoadException;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.BatchLoadResult;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.ResilientBatchInserter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the aggregated farmer months into report rows and replaces {@code analysis.farmer_revenue} with them:
 * every row when the run covers all farmers, only the farmer's rows otherwise.
 */
public class FarmerRevenueLoadTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(FarmerRevenueLoadTasklet.class);

    static final String ORIGIN_HISTORICAL = "historical";
    static final String ORIGIN_CURRENT = "current";

    private static final String SQL_DELETE_ALL = "DELETE FROM analysis.farmer_revenue";
    private static final String SQL_DELETE_FARMER = "DELETE FROM analysis.farmer_revenue WHERE farmer_id = ?";

    private static final String SQL_INSERT =
            "INSERT INTO analysis.farmer_revenue (reference_month, formatted_month, farmer_id, farmer_name, " +
                    "gross_revenue, net_revenue, gross_commission, net_commission, origin, created_at, updated_at) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final FarmerRevenueAggregationProcessor processor;
    private final ResilientBatchInserter inserter;
    private final BigDecimal netCommissionFactor;

    public FarmerRevenueLoadTasklet(FarmerRevenueAggregationProcessor processor,
                                    ResilientBatchInserter inserter,
                                    BigDecimal netCommissionFactor) {
        this.processor = processor;
        this.inserter = inserter;
        this.netCommissionFactor = netCommissionFactor;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        processor.logSummary();
        KpiWindow window = processor.getWindow();
        LocalDateTime now = LocalDateTime.now();

        List<FarmerRevenueRow> rows = processor.getAggregatedData().values().stream()
                .sorted(Comparator.comparing(FarmerMonthlyRevenue::month).thenComparing(FarmerMonthlyRevenue::farmerId))
                .map(summary -> toRow(summary, window, now))
                .toList();

        if (rows.isEmpty()) {
            log.warn("No farmer revenue aggregated for {} to {}; the report table is still cleared",
                    window.start(), window.endExclusive().minusDays(1));
        }

        String deleteSql = window.hasFarmerFilter() ? SQL_DELETE_FARMER : SQL_DELETE_ALL;
        Object[] deleteArgs = window.hasFarmerFilter() ? new Object[]{window.farmerId()} : new Object[0];

        BatchLoadResult<FarmerRevenueRow> result = inserter.replace(deleteSql, deleteArgs, SQL_INSERT, rows,
                (ps, row) -> {
                    ps.setObject(1, row.referenceMonth());
                    ps.setString(2, row.formattedMonth());
                    ps.setLong(3, row.farmerId());
                    ps.setString(4, row.farmerName());
                    ps.setBigDecimal(5, row.grossRevenue());
                    ps.setBigDecimal(6, row.netRevenue());
                    ps.setBigDecimal(7, row.grossCommission());
                    ps.setBigDecimal(8, row.netCommission());
                    ps.setString(9, row.origin());
                    ps.setObject(10, row.updatedAt());
                    ps.setObject(11, row.updatedAt());
                });

        if (result.requiresResubmission()) {
            throw new BatchLoadException("Farmer revenue load did not complete; "
                    + result.pendingRows().size() + " rows require resubmission", result);
        }
        if (result.hasRejections()) {
            log.error("Farmer revenue rows rejected by the database: {}", result.rejectedRows().size());
        }
        log.info("Farmer revenue loaded for farmer {}: {} rows deleted, {} rows inserted",
                window.hasFarmerFilter() ? window.farmerId() : "ALL", result.deletedRows(), result.committedRows());
        return RepeatStatus.FINISHED;
    }

    FarmerRevenueRow toRow(FarmerMonthlyRevenue summary, KpiWindow window, LocalDateTime now) {
        BigDecimal grossCommission = round(summary.grossCommission());
        return new FarmerRevenueRow(
                summary.month(),
                KpiWindow.formatMonth(summary.month()),
                summary.farmerId(),
                processor.getTimeline().farmerName(summary.farmerId()).orElse(null),
                round(summary.grossRevenue()),
                round(summary.netRevenue()),
                grossCommission,
                round(summary.grossCommission().multiply(netCommissionFactor)),
                window.isCurrentMonth(summary.month()) ? ORIGIN_CURRENT : ORIGIN_HISTORICAL,
                now
        );
    }

    static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_EVEN);
    }
}
