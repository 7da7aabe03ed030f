package br.com.analytics.pipeline.farmer_kpi_batch.writer;

import br.com.analytics.pipeline.farmer_kpi_batch.processor.RevenueFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.util.backoff.FixedBackOff;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static br.com.analytics.pipeline.farmer_kpi_batch.processor.RevenueFixtures.ANA;
import static br.com.analytics.pipeline.farmer_kpi_batch.processor.RevenueFixtures.BRUNO;
import static org.assertj.core.api.Assertions.assertThat;

class ClientRevenueWriterTest {

    private static final BigDecimal NET_COMMISSION_FACTOR = new BigDecimal("0.805");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private ResilientBatchInserter inserter;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema/reporting-schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        inserter = new ResilientBatchInserter(jdbcTemplate, new DataSourceTransactionManager(database), 2,
                new FixedBackOff(0, 0));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("should write every record tagged with its responsible farmer")
    void writesAllRecords() throws Exception {
        ClientRevenueWriter writer = new ClientRevenueWriter(RevenueFixtures.timeline(), RevenueFixtures.window(null),
                inserter, NET_COMMISSION_FACTOR);

        writer.write(new Chunk<>(RevenueFixtures.ALL));

        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT client_id, responsible_farmer_id, responsible_farmer_name, formatted_month " +
                        "FROM analysis.client_revenue ORDER BY record_date, client_id");
        assertThat(rows).hasSize(5);
        assertThat(rows).extracting(row -> row.get("RESPONSIBLE_FARMER_ID"))
                .containsExactly(ANA, BRUNO, BRUNO, BRUNO, null);
        assertThat(rows).extracting(row -> row.get("RESPONSIBLE_FARMER_NAME"))
                .containsExactly("Ana", "Bruno", "Bruno", "Bruno", null);
        assertThat(rows.get(0)).containsEntry("FORMATTED_MONTH", "08/2023");
    }

    @Test
    @DisplayName("should keep only the given farmer's records")
    void filtersByFarmer() throws Exception {
        ClientRevenueWriter writer = new ClientRevenueWriter(RevenueFixtures.timeline(), RevenueFixtures.window(BRUNO),
                inserter, NET_COMMISSION_FACTOR);

        writer.write(new Chunk<>(RevenueFixtures.ALL));

        assertThat(jdbcTemplate.queryForList(
                "SELECT DISTINCT responsible_farmer_id FROM analysis.client_revenue", Long.class))
                .containsExactly(BRUNO);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT net_commission FROM analysis.client_revenue WHERE client_id = 2 AND formatted_month = '09/2023'",
                BigDecimal.class)).isEqualByComparingTo("0.91");
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM analysis.client_revenue", Integer.class))
                .isEqualTo(3);
    }

    @Test
    @DisplayName("should write nothing for an empty chunk")
    void emptyChunk() throws Exception {
        ClientRevenueWriter writer = new ClientRevenueWriter(RevenueFixtures.timeline(), RevenueFixtures.window(null),
                inserter, NET_COMMISSION_FACTOR);

        writer.write(new Chunk<>(List.of()));

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM analysis.client_revenue", Integer.class)).isZero();
    }
}
