package br.com.analytics.pipeline.farmer_kpi_batch.tasklet;

import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
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

import static org.assertj.core.api.Assertions.assertThat;

class ClientRevenueCleanupTaskletTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema/reporting-schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        insertClientRow(1L, 10L);
        insertClientRow(2L, 20L);
        insertClientRow(3L, null);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("should clear the table when no farmer is given")
    void deletesAll() throws Exception {
        new ClientRevenueCleanupTasklet(database, new KpiWindow(LocalDate.of(2024, 1, 1), 11, null)).execute(null, null);

        assertThat(count()).isZero();
    }

    @Test
    @DisplayName("should only delete the given farmer's rows")
    void deletesFarmerRows() throws Exception {
        new ClientRevenueCleanupTasklet(database, new KpiWindow(LocalDate.of(2024, 1, 1), 11, 20L)).execute(null, null);

        assertThat(count()).isEqualTo(2);
    }

    private int count() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM analysis.client_revenue", Integer.class);
    }

    private void insertClientRow(long clientId, Long farmerId) {
        jdbcTemplate.update("INSERT INTO analysis.client_revenue (record_date, formatted_month, client_id, " +
                        "responsible_farmer_id, updated_at) VALUES (?, '01/2024', ?, ?, ?)",
                LocalDate.of(2024, 1, 5), clientId, farmerId, LocalDateTime.now());
    }
}
