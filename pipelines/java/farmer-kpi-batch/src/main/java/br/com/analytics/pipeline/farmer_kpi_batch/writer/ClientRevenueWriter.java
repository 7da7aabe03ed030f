package br.com.analytics.pipeline.farmer_kpi_batch.writer;

import br.com.analytics.pipeline.farmer_kpi_batch.model.AttributedRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRevenueRow;
import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
import br.com.analytics.pipeline.farmer_kpi_batch.model.RevenueRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.ResponsibilityTimeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends client-level revenue rows to {@code analysis.client_revenue}, each tagged with the farmer responsible
 * for the client on the record date. When the run targets one farmer, rows of clients that were under someone
 * else on that date are dropped.
 */
public class ClientRevenueWriter implements ItemWriter<RevenueRecord> {

    private static final Logger log = LoggerFactory.getLogger(ClientRevenueWriter.class);

    private static final String SQL_INSERT =
            "INSERT INTO analysis.client_revenue (record_date, formatted_month, client_id, responsible_farmer_id, " +
                    "responsible_farmer_name, gross_revenue, net_revenue, gross_commission, net_commission, updated_at) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final ResponsibilityTimeline timeline;
    private final KpiWindow window;
    private final ResilientBatchInserter inserter;
    private final BigDecimal netCommissionFactor;

    public ClientRevenueWriter(ResponsibilityTimeline timeline,
                               KpiWindow window,
                               ResilientBatchInserter inserter,
                               BigDecimal netCommissionFactor) {
        this.timeline = timeline;
        this.window = window;
        this.inserter = inserter;
        this.netCommissionFactor = netCommissionFactor;
    }

    @Override
    public void write(Chunk<? extends RevenueRecord> chunk) throws Exception {
        List<RevenueRecord> records = new ArrayList<>(chunk.getItems());
        List<RevenueRecord> kept = timeline.filterByResponsibility(records, RevenueRecord::recordDate, window.farmerId());
        if (kept.isEmpty()) {
            log.info("No client revenue rows to write in this chunk of {}", records.size());
            return;
        }

        LocalDateTime now = LocalDateTime.now();
        List<ClientRevenueRow> rows = timeline.attributeResponsibleFarmer(kept, RevenueRecord::recordDate).stream()
                .map(attributed -> toRow(attributed, now))
                .toList();

        BatchLoadResult<ClientRevenueRow> result = inserter.append(SQL_INSERT, rows, (ps, row) -> {
            ps.setObject(1, row.recordDate());
            ps.setString(2, row.formattedMonth());
            ps.setLong(3, row.clientId());
            if (row.responsibleFarmerId() == null) {
                ps.setNull(4, Types.BIGINT);
            } else {
                ps.setLong(4, row.responsibleFarmerId());
            }
            ps.setString(5, row.responsibleFarmerName());
            ps.setBigDecimal(6, row.grossRevenue());
            ps.setBigDecimal(7, row.netRevenue());
            ps.setBigDecimal(8, row.grossCommission());
            ps.setBigDecimal(9, row.netCommission());
            ps.setObject(10, row.updatedAt());
        });

        if (result.requiresResubmission()) {
            throw new BatchLoadException("Client revenue chunk did not load; "
                    + result.pendingRows().size() + " rows require resubmission", result);
        }
        if (result.hasRejections()) {
            log.error("Client revenue rows rejected by the database: {}", result.rejectedRows().size());
        }
        log.info("Client revenue rows written: {} of {} read", result.committedRows(), records.size());
    }

    private ClientRevenueRow toRow(AttributedRecord<RevenueRecord> attributed, LocalDateTime now) {
        RevenueRecord record = attributed.record();
        BigDecimal grossCommission = orZero(record.grossCommission());
        return new ClientRevenueRow(
                record.recordDate(),
                KpiWindow.formatMonth(record.recordDate()),
                record.clientId(),
                attributed.responsibleFarmerId(),
                attributed.responsibleFarmerName(),
                round(orZero(record.grossRevenue())),
                round(orZero(record.netRevenue())),
                round(grossCommission),
                round(grossCommission.multiply(netCommissionFactor)),
                now
        );
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_EVEN);
    }
}
