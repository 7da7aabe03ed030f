package br.com.analytics.pipeline.farmer_kpi_batch.responsibility;

import br.com.analytics.pipeline.farmer_kpi_batch.model.AttributedRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientActivity;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.DateRange;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ResponsibilityInterval;
import br.com.analytics.pipeline.farmer_kpi_batch.model.TransferEvent;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Determines which farmer answered for a client at a given time, from the client's creation record and its
 * farmer transfer log.
 *
 * <p>Every call reads fresh data from the {@link ResponsibilitySource}. Jobs that resolve many records should
 * take a {@link #snapshot(DateRange)} once and query it instead.
 *
 * <p>Single-client lookups treat a source that cannot be read as missing data and resolve to no farmer.
 * Snapshots let the {@link DataAccessException} through so that the batch step fails instead of loading a report
 * with every client unattributed.
 */
public class ResponsibilityResolver {

    private static final Logger log = LoggerFactory.getLogger(ResponsibilityResolver.class);

    private final ResponsibilitySource source;
    private final AttributionListener listener;

    public ResponsibilityResolver(ResponsibilitySource source, AttributionListener listener) {
        this.source = source;
        this.listener = listener;
    }

    /**
     * Full responsibility history of one client, oldest interval first.
     *
     * @throws InconsistentTransferLogException when the client's transfer log cannot be walked into a timeline
     */
    public List<ResponsibilityInterval> buildIntervals(long clientId) {
        ClientRecord client = source.findClients(List.of(clientId)).stream().findFirst().orElse(null);
        List<TransferEvent> transfers = source.findFarmerTransfers(clientId);
        return ResponsibilityIntervalBuilder.build(clientId, client, transfers);
    }

    public Optional<Long> responsibleFarmer(long clientId, LocalDate date) {
        List<ResponsibilityInterval> intervals;
        try {
            intervals = buildIntervals(clientId);
        } catch (InconsistentTransferLogException e) {
            listener.inconsistentTransferLog(e);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Responsibility data for client {} could not be read; resolving {} to no farmer",
                    clientId, date, e);
            return Optional.empty();
        }
        return intervals.stream()
                .filter(interval -> interval.contains(date))
                .findFirst()
                .flatMap(interval -> Optional.ofNullable(interval.farmerId()));
    }

    /**
     * Keeps the records whose client was under {@code farmerId} on the date read by {@code dateField}.
     * Intervals are computed only for the clients present in {@code records} and only for the range the record
     * dates span, widened to {@code dateRange} when one is given. The range never excludes a record by itself.
     * A null farmer returns the input as is.
     */
    public <T extends ClientActivity> List<T> filterByResponsibility(List<T> records,
                                                                     Function<? super T, LocalDate> dateField,
                                                                     @Nullable Long farmerId,
                                                                     @Nullable DateRange dateRange) {
        if (farmerId == null || records.isEmpty()) {
            return records;
        }
        DateRange spanned = spannedRange(records, dateField);
        DateRange range = spanned == null ? dateRange : dateRange == null ? spanned : spanned.union(dateRange);
        if (range == null) {
            log.warn("No record dates to resolve responsibility for; {} records excluded", records.size());
            return List.of();
        }
        ResponsibilityTimeline timeline = snapshot(clientIds(records), range);
        List<T> kept = timeline.filterByResponsibility(records, dateField, farmerId);
        log.info("Records kept for farmer {}: {} of {}", farmerId, kept.size(), records.size());
        return kept;
    }

    public <T extends ClientActivity> List<AttributedRecord<T>> attributeResponsibleFarmer(List<T> records,
                                                                                          Function<? super T, LocalDate> dateField) {
        if (records.isEmpty()) {
            return List.of();
        }
        DateRange range = spannedRange(records, dateField);
        if (range == null) {
            return records.stream().map(record -> new AttributedRecord<>(record, null, null)).toList();
        }
        return snapshot(clientIds(records), range).attributeResponsibleFarmer(records, dateField);
    }

    /**
     * Snapshot of every client in the warehouse, limited to {@code range}.
     */
    public ResponsibilityTimeline snapshot(DateRange range) {
        List<ClientRecord> clients = source.findAllClients();
        List<TransferEvent> transfers = source.findAllFarmerTransfers(range.to());
        return buildSnapshot(clients, transfers, range);
    }

    public ResponsibilityTimeline snapshot(Collection<Long> clientIds, DateRange range) {
        List<ClientRecord> clients = source.findClients(clientIds);
        List<TransferEvent> transfers = source.findFarmerTransfers(clientIds, range.to());
        return buildSnapshot(clients, transfers, range);
    }

    private ResponsibilityTimeline buildSnapshot(List<ClientRecord> clients, List<TransferEvent> transfers, DateRange range) {
        Set<Long> farmerIds = new LinkedHashSet<>();
        for (ClientRecord client : clients) {
            addIfPresent(farmerIds, client.originalFarmerId());
        }
        for (TransferEvent transfer : transfers) {
            addIfPresent(farmerIds, transfer.oldFarmerId());
            addIfPresent(farmerIds, transfer.newFarmerId());
        }
        Map<Long, String> farmerNames = farmerIds.isEmpty() ? Map.of() : source.findFarmerNames(farmerIds);

        ResponsibilityTimeline timeline = ResponsibilityTimeline.build(clients, transfers, farmerNames, range, listener);
        log.info("Responsibility snapshot for {} to {}: {} clients, {} farmer transfers",
                range.from(), range.to(), timeline.clientCount(), transfers.size());
        return timeline;
    }

    private static <T extends ClientActivity> Set<Long> clientIds(List<T> records) {
        return records.stream().map(ClientActivity::clientId).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static <T> @Nullable DateRange spannedRange(List<T> records, Function<? super T, LocalDate> dateField) {
        return DateRange.spanning(records.stream().map(dateField).toList());
    }

    private static void addIfPresent(Set<Long> ids, @Nullable Long id) {
        if (id != null) {
            ids.add(id);
        }
    }
}
