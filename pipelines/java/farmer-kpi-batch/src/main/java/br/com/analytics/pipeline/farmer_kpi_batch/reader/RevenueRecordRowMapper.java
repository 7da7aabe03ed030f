package br.com.analytics.pipeline.farmer_kpi_batch.reader;

import br.com.analytics.pipeline.farmer_kpi_batch.model.RevenueRecord;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

public class RevenueRecordRowMapper implements RowMapper<RevenueRecord> {

    @Override
    public RevenueRecord mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new RevenueRecord(
                resultSet.getLong("clientId"),
                resultSet.getObject("recordDate", LocalDate.class),
                resultSet.getBigDecimal("grossRevenue"),
                resultSet.getBigDecimal("netRevenue"),
                resultSet.getBigDecimal("grossCommission")
        );
    }
}
