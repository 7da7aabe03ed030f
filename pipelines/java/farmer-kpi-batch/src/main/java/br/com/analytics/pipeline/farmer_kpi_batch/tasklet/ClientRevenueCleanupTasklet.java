package br.com.analytics.pipeline.farmer_kpi_batch.tasklet;

import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

public class ClientRevenueCleanupTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(ClientRevenueCleanupTasklet.class);

    private static final String SQL_DELETE_ALL = "DELETE FROM analysis.client_revenue";
    private static final String SQL_DELETE_FARMER =
            "DELETE FROM analysis.client_revenue WHERE responsible_farmer_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final KpiWindow window;

    public ClientRevenueCleanupTasklet(DataSource reportingDataSource, KpiWindow window) {
        this.jdbcTemplate = new JdbcTemplate(reportingDataSource);
        this.window = window;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        int deleted = window.hasFarmerFilter()
                ? jdbcTemplate.update(SQL_DELETE_FARMER, window.farmerId())
                : jdbcTemplate.update(SQL_DELETE_ALL);
        log.info("Client revenue rows deleted for farmer {}: {}",
                window.hasFarmerFilter() ? window.farmerId() : "ALL", deleted);
        return RepeatStatus.FINISHED;
    }
}
