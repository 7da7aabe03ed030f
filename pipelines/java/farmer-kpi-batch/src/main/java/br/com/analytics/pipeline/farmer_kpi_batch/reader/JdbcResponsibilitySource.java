package br.com.analytics.pipeline.farmer_kpi_batch.reader;

import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.TransferEvent;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.ResponsibilitySource;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads clients, farmer transfers and farmer names from the {@code gammadata} warehouse schema.
 * Farmer ids are stored as text there and cast on the way out.
 */
public class JdbcResponsibilitySource implements ResponsibilitySource {

    static final int IN_CLAUSE_LIMIT = 1000;

    private static final String SQL_CLIENTS =
            "SELECT c.client_id AS clientId, CAST(c.creation_date AS DATE) AS creationDate, " +
                    "CAST(c.farmer_id AS BIGINT) AS farmerId " +
                    "FROM gammadata.clients c";

    private static final String SQL_TRANSFERS =
            "SELECT ct.client_id AS clientId, " +
                    "CAST(ct.old_farmer_id AS BIGINT) AS oldFarmerId, " +
                    "CAST(ct.new_farmer_id AS BIGINT) AS newFarmerId, " +
                    "ct.transfer_date AS transferTime, " +
                    "ct.transfer_type AS transferType " +
                    "FROM gammadata.client_transfers ct " +
                    "WHERE ct.transfer_type = :transferType";

    private static final String SQL_TRANSFERS_ORDER = " ORDER BY ct.client_id, ct.transfer_date";

    private static final String SQL_FARMER_NAMES =
            "SELECT e.employee_id AS employeeId, e.name AS name " +
                    "FROM gammadata.employees e WHERE e.employee_id IN (:farmerIds)";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ClientRecordRowMapper clientRowMapper = new ClientRecordRowMapper();
    private final TransferEventRowMapper transferRowMapper = new TransferEventRowMapper();

    public JdbcResponsibilitySource(DataSource warehouseDataSource) {
        this(new NamedParameterJdbcTemplate(warehouseDataSource));
    }

    public JdbcResponsibilitySource(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<ClientRecord> findClients(Collection<Long> clientIds) {
        return inPartitions(clientIds, partition -> jdbcTemplate.query(
                SQL_CLIENTS + " WHERE c.client_id IN (:clientIds)",
                new MapSqlParameterSource("clientIds", partition),
                clientRowMapper));
    }

    @Override
    public List<ClientRecord> findAllClients() {
        return jdbcTemplate.query(SQL_CLIENTS, clientRowMapper);
    }

    @Override
    public List<TransferEvent> findFarmerTransfers(long clientId) {
        return jdbcTemplate.query(
                SQL_TRANSFERS + " AND ct.client_id = :clientId" + SQL_TRANSFERS_ORDER,
                farmerTransfers().addValue("clientId", clientId),
                transferRowMapper);
    }

    @Override
    public List<TransferEvent> findFarmerTransfers(Collection<Long> clientIds, LocalDate until) {
        return inPartitions(clientIds, partition -> jdbcTemplate.query(
                SQL_TRANSFERS + " AND ct.client_id IN (:clientIds) AND ct.transfer_date < :before"
                        + SQL_TRANSFERS_ORDER,
                farmerTransfers().addValue("clientIds", partition).addValue("before", dayAfter(until)),
                transferRowMapper));
    }

    @Override
    public List<TransferEvent> findAllFarmerTransfers(LocalDate until) {
        return jdbcTemplate.query(
                SQL_TRANSFERS + " AND ct.transfer_date < :before" + SQL_TRANSFERS_ORDER,
                farmerTransfers().addValue("before", dayAfter(until)),
                transferRowMapper);
    }

    @Override
    public Map<Long, String> findFarmerNames(Collection<Long> farmerIds) {
        Map<Long, String> names = new HashMap<>();
        List<Long> all = List.copyOf(farmerIds);
        for (int from = 0; from < all.size(); from += IN_CLAUSE_LIMIT) {
            jdbcTemplate.query(
                    SQL_FARMER_NAMES,
                    new MapSqlParameterSource("farmerIds", all.subList(from, Math.min(all.size(), from + IN_CLAUSE_LIMIT))),
                    (RowCallbackHandler) resultSet -> names.put(resultSet.getLong("employeeId"), resultSet.getString("name")));
        }
        return names;
    }

    private static LocalDateTime dayAfter(LocalDate until) {
        return until.plusDays(1).atStartOfDay();
    }

    private static MapSqlParameterSource farmerTransfers() {
        return new MapSqlParameterSource("transferType", TransferEvent.FARMER_TRANSFER);
    }

    private static <T> List<T> inPartitions(Collection<Long> ids, Function<List<Long>, List<T>> query) {
        List<Long> all = List.copyOf(ids);
        List<T> results = new ArrayList<>();
        for (int from = 0; from < all.size(); from += IN_CLAUSE_LIMIT) {
            results.addAll(query.apply(all.subList(from, Math.min(all.size(), from + IN_CLAUSE_LIMIT))));
        }
        return results;
    }
}
