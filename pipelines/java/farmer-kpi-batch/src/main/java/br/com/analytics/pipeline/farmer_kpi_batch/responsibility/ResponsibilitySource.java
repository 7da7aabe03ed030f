package br.com.analytics.pipeline.farmer_kpi_batch.responsibility;

import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.TransferEvent;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read access to client creation records, the farmer transfer log and farmer names.
 * Transfer lookups return farmer reassignments only, ordered by client and transfer time.
 */
public interface ResponsibilitySource {

    List<ClientRecord> findClients(Collection<Long> clientIds);

    List<ClientRecord> findAllClients();

    List<TransferEvent> findFarmerTransfers(long clientId);

    /**
     * Transfers of the given clients taking effect no later than the end of day {@code until}.
     */
    List<TransferEvent> findFarmerTransfers(Collection<Long> clientIds, LocalDate until);

    List<TransferEvent> findAllFarmerTransfers(LocalDate until);

    Map<Long, String> findFarmerNames(Collection<Long> farmerIds);
}
