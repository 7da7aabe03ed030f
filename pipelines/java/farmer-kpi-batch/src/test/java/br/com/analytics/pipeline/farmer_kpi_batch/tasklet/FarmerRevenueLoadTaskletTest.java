package br.com.analytics.pipeline.farmer_kpi_batch.tasklet;

import br.com.analytics.pipeline.farmer_kpi_batch.model.FarmerRevenueRow;
import br.com.analytics.pipeline.farmer_kpi_batch.processor.FarmerRevenueAggregationProcessor;
import br.com.analytics.pipeline.farmer_kpi_batch.processor.RevenueFixtures;
import br.com.analytics.pipeline.farmer_kpi_batch.writer.ResilientBatchInserter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.util.backoff.FixedBackOff;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static br.com.analytics.pipeline.farmer_kpi_batch.processor.RevenueFixtures.ANA;
import static br.com.analytics.pipeline.farmer_kpi_batch.processor.RevenueFixtures.BRUNO;
import static org.assertj.core.api.Assertions.assertThat;

class FarmerRevenueLoadTaskletTest {

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
        inserter = new ResilientBatchInserter(jdbcTemplate, new DataSourceTransactionManager(database), 100,
                new FixedBackOff(0, 0));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Nested
    @DisplayName("Row conversion")
    class RowConversion {

        @Test
        @DisplayName("should round amounts half-even, derive net commission and tag the origin")
        void convertsSummary() throws Exception {
            FarmerRevenueAggregationProcessor processor = RevenueFixtures.aggregated(null);
            FarmerRevenueLoadTasklet tasklet = new FarmerRevenueLoadTasklet(processor, inserter, NET_COMMISSION_FACTOR);
            LocalDateTime now = LocalDateTime.of(2023, 9, 20, 6, 0);

            List<FarmerRevenueRow> rows = processor.getAggregatedData().values().stream()
                    .map(summary -> tasklet.toRow(summary, processor.getWindow(), now))
                    .toList();

            FarmerRevenueRow september = rows.stream()
                    .filter(row -> row.referenceMonth().equals(LocalDate.of(2023, 9, 1)))
                    .findFirst().orElseThrow();
            assertThat(september.formattedMonth()).isEqualTo("09/2023");
            assertThat(september.farmerName()).isEqualTo("Bruno");
            assertThat(september.grossCommission()).isEqualByComparingTo("1.12");
            assertThat(september.netCommission()).isEqualByComparingTo("0.91");
            assertThat(september.origin()).isEqualTo(FarmerRevenueLoadTasklet.ORIGIN_CURRENT);

            FarmerRevenueRow anaAugust = rows.stream()
                    .filter(row -> row.farmerId().equals(ANA))
                    .findFirst().orElseThrow();
            assertThat(anaAugust.origin()).isEqualTo(FarmerRevenueLoadTasklet.ORIGIN_HISTORICAL);
            assertThat(anaAugust.netCommission()).isEqualByComparingTo("8.05");
            assertThat(anaAugust.grossRevenue().scale()).isEqualTo(2);
        }

        @Test
        @DisplayName("should round to two decimals half-even")
        void rounds() {
            assertThat(FarmerRevenueLoadTasklet.round(new BigDecimal("2.345"))).isEqualByComparingTo("2.34");
            assertThat(FarmerRevenueLoadTasklet.round(new BigDecimal("2.355"))).isEqualByComparingTo("2.36");
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @BeforeEach
        void existingReport() {
            insertReportRow(ANA);
            insertReportRow(BRUNO);
            insertReportRow(99L);
        }

        @Test
        @DisplayName("should replace the whole report when no farmer is given")
        void replacesAll() throws Exception {
            FarmerRevenueLoadTasklet tasklet =
                    new FarmerRevenueLoadTasklet(RevenueFixtures.aggregated(null), inserter, NET_COMMISSION_FACTOR);

            RepeatStatus status = tasklet.execute(null, null);

            assertThat(status).isEqualTo(RepeatStatus.FINISHED);
            assertThat(jdbcTemplate.queryForList(
                    "SELECT farmer_id FROM analysis.farmer_revenue ORDER BY reference_month, farmer_id", Long.class))
                    .containsExactly(ANA, BRUNO, BRUNO);
            Map<String, Object> september = jdbcTemplate.queryForMap(
                    "SELECT formatted_month, net_commission, origin FROM analysis.farmer_revenue WHERE reference_month = ?",
                    LocalDate.of(2023, 9, 1));
            assertThat(september).containsEntry("FORMATTED_MONTH", "09/2023").containsEntry("ORIGIN", "current");
            assertThat((BigDecimal) september.get("NET_COMMISSION")).isEqualByComparingTo("0.91");
        }

        @Test
        @DisplayName("should only replace the given farmer's rows")
        void replacesOneFarmer() throws Exception {
            FarmerRevenueLoadTasklet tasklet =
                    new FarmerRevenueLoadTasklet(RevenueFixtures.aggregated(BRUNO), inserter, NET_COMMISSION_FACTOR);

            tasklet.execute(null, null);

            assertThat(jdbcTemplate.queryForList(
                    "SELECT farmer_id FROM analysis.farmer_revenue ORDER BY farmer_id, reference_month", Long.class))
                    .containsExactly(ANA, BRUNO, BRUNO, 99L);
            assertThat(jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM analysis.farmer_revenue WHERE farmer_id = ? AND formatted_month = '01/2020'",
                    Integer.class, BRUNO)).isZero();
        }

        private void insertReportRow(long farmerId) {
            jdbcTemplate.update("INSERT INTO analysis.farmer_revenue (reference_month, formatted_month, farmer_id, " +
                            "farmer_name, gross_revenue, net_revenue, gross_commission, net_commission, origin, " +
                            "created_at, updated_at) VALUES (?, '01/2020', ?, NULL, 1, 1, 1, 1, 'historical', ?, ?)",
                    LocalDate.of(2020, 1, 1), farmerId, LocalDateTime.now(), LocalDateTime.now());
        }
    }
}
