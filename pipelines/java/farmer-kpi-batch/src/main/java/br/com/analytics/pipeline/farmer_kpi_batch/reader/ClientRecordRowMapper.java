package br.com.analytics.pipeline.farmer_kpi_batch.reader;

import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRecord;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

public class ClientRecordRowMapper implements RowMapper<ClientRecord> {

    @Override
    public ClientRecord mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new ClientRecord(
                resultSet.getLong("clientId"),
                resultSet.getObject("creationDate", LocalDate.class),
                resultSet.getObject("farmerId", Long.class)
        );
    }
}
