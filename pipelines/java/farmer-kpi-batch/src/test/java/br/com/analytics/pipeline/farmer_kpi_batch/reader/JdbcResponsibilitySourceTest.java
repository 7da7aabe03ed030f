package br.com.analytics.pipeline.farmer_kpi_batch.reader;

import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.TransferEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcResponsibilitySourceTest {

    private EmbeddedDatabase database;
    private JdbcResponsibilitySource source;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("warehouse-schema.sql")
                .build();
        JdbcTemplate jdbc = new JdbcTemplate(database);
        jdbc.update("INSERT INTO gammadata.clients (client_id, name, farmer_id, creation_date) VALUES (1, 'Acme', '10', TIMESTAMP '2023-01-01 09:30:00')");
        jdbc.update("INSERT INTO gammadata.clients (client_id, name, farmer_id, creation_date) VALUES (2, 'Beta', NULL, TIMESTAMP '2022-05-01 00:00:00')");
        jdbc.update("INSERT INTO gammadata.client_transfers (client_id, old_farmer_id, new_farmer_id, transfer_date, transfer_type) VALUES (1, '10', '20', TIMESTAMP '2023-03-15 14:00:00', 'FARMER')");
        jdbc.update("INSERT INTO gammadata.client_transfers (client_id, old_farmer_id, new_farmer_id, transfer_date, transfer_type) VALUES (1, '20', '30', TIMESTAMP '2023-09-01 08:00:00', 'FARMER')");
        jdbc.update("INSERT INTO gammadata.client_transfers (client_id, old_farmer_id, new_farmer_id, transfer_date, transfer_type) VALUES (1, '77', '88', TIMESTAMP '2023-04-01 08:00:00', 'ADVISOR')");
        jdbc.update("INSERT INTO gammadata.client_transfers (client_id, old_farmer_id, new_farmer_id, transfer_date, transfer_type) VALUES (2, NULL, '20', TIMESTAMP '2023-02-01 08:00:00', 'FARMER')");
        jdbc.update("INSERT INTO gammadata.employees (employee_id, name) VALUES (10, 'Ana')");
        jdbc.update("INSERT INTO gammadata.employees (employee_id, name) VALUES (20, 'Bruno')");
        jdbc.update("INSERT INTO gammadata.employees (employee_id, name) VALUES (30, NULL)");
        source = new JdbcResponsibilitySource(database);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("should read clients with their creation day and original farmer")
    void findsClients() {
        List<ClientRecord> clients = source.findClients(List.of(1L, 2L, 3L));

        assertThat(clients).containsExactlyInAnyOrder(
                new ClientRecord(1L, LocalDate.of(2023, 1, 1), 10L),
                new ClientRecord(2L, LocalDate.of(2022, 5, 1), null));
        assertThat(source.findAllClients()).hasSize(2);
    }

    @Test
    @DisplayName("should read only farmer transfers, oldest first")
    void findsFarmerTransfers() {
        List<TransferEvent> transfers = source.findFarmerTransfers(1L);

        assertThat(transfers).containsExactly(
                new TransferEvent(1L, 10L, 20L, LocalDateTime.of(2023, 3, 15, 14, 0), TransferEvent.FARMER_TRANSFER),
                new TransferEvent(1L, 20L, 30L, LocalDateTime.of(2023, 9, 1, 8, 0), TransferEvent.FARMER_TRANSFER));
    }

    @Test
    @DisplayName("should leave out transfers after the until date")
    void honoursUntil() {
        assertThat(source.findFarmerTransfers(List.of(1L, 2L), LocalDate.of(2023, 9, 1))).hasSize(3);
        assertThat(source.findFarmerTransfers(List.of(1L, 2L), LocalDate.of(2023, 8, 31))).hasSize(2);
        assertThat(source.findAllFarmerTransfers(LocalDate.of(2023, 3, 14)))
                .extracting(TransferEvent::clientId)
                .containsExactly(2L);
    }

    @Test
    @DisplayName("should split long id lists into several queries")
    void partitionsLongIdLists() {
        List<Long> ids = LongStream.rangeClosed(1, JdbcResponsibilitySource.IN_CLAUSE_LIMIT * 2L + 5).boxed().toList();

        assertThat(source.findClients(ids)).extracting(ClientRecord::clientId).containsExactlyInAnyOrder(1L, 2L);
        assertThat(source.findFarmerTransfers(ids, LocalDate.of(2030, 1, 1))).hasSize(3);
    }

    @Test
    @DisplayName("should read farmer names, keeping missing names as null")
    void findsFarmerNames() {
        Map<Long, String> names = source.findFarmerNames(List.of(10L, 20L, 30L, 40L));

        assertThat(names).containsEntry(10L, "Ana").containsEntry(20L, "Bruno").containsEntry(30L, null).doesNotContainKey(40L);
    }
}
