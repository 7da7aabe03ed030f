package br.com.analytics.pipeline.farmer_kpi_batch.responsibility;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

public class LoggingAttributionListener implements AttributionListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingAttributionListener.class);

    @Override
    public void inconsistentTransferLog(InconsistentTransferLogException exception) {
        log.warn("Client {} excluded from attribution: {}", exception.getClientId(), exception.getMessage());
    }

    @Override
    public void unresolved(long clientId, LocalDate date) {
        log.debug("No responsible farmer for client {} on {}", clientId, date);
    }
}
