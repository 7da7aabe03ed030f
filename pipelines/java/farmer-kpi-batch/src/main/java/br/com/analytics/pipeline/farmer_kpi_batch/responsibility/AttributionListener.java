package br.com.analytics.pipeline.farmer_kpi_batch.responsibility;

import java.time.LocalDate;

/**
 * Observer for attribution problems. Problems never abort attribution: the affected records resolve to no farmer.
 */
public interface AttributionListener {

    void inconsistentTransferLog(InconsistentTransferLogException exception);

    default void unresolved(long clientId, LocalDate date) {
    }
}
