package br.com.analytics.pipeline.farmer_kpi_batch.reader;

import br.com.analytics.pipeline.farmer_kpi_batch.model.TransferEvent;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

public class TransferEventRowMapper implements RowMapper<TransferEvent> {

    @Override
    public TransferEvent mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new TransferEvent(
                resultSet.getLong("clientId"),
                resultSet.getObject("oldFarmerId", Long.class),
                resultSet.getObject("newFarmerId", Long.class),
                resultSet.getObject("transferTime", LocalDateTime.class),
                resultSet.getString("transferType")
        );
    }
}
