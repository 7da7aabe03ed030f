package br.com.analytics.pipeline.farmer_kpi_batch.reader;

import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
import br.com.analytics.pipeline.farmer_kpi_batch.model.RevenueRecord;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.batch.infrastructure.item.database.builder.JdbcCursorItemReaderBuilder;

import javax.sql.DataSource;

public final class RevenueRecordReaders {

    static final String REVENUE_RECORDS_QUERY =
            "SELECT " +
                    "rrh.client_id AS clientId, CAST(rrh.record_date AS DATE) AS recordDate, " +
                    "rrh.gross_revenue AS grossRevenue, rrh.net_revenue AS netRevenue, " +
                    "rrh.gross_commission AS grossCommission " +
                    "FROM gammadata.revenue_records_historical rrh " +
                    "WHERE rrh.record_date >= ? AND rrh.record_date < ? " +
                    "ORDER BY recordDate, clientId";

    private RevenueRecordReaders() {
    }

    /**
     * Cursor over the client-level revenue rows dated inside the window.
     */
    public static JdbcCursorItemReader<RevenueRecord> revenueRecords(String name, DataSource warehouseDataSource,
                                                                      KpiWindow window, int fetchSize) {
        return new JdbcCursorItemReaderBuilder<RevenueRecord>()
                .name(name)
                .dataSource(warehouseDataSource)
                .sql(REVENUE_RECORDS_QUERY)
                .rowMapper(new RevenueRecordRowMapper())
                .fetchSize(fetchSize)
                .queryArguments(window.start(), window.endExclusive())
                .build();
    }
}
