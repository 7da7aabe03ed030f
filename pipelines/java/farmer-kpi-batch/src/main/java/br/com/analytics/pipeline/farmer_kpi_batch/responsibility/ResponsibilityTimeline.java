package br.com.analytics.pipeline.farmer_kpi_batch.responsibility;

import br.com.analytics.pipeline.farmer_kpi_batch.model.AttributedRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientActivity;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.DateRange;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ResponsibilityInterval;
import br.com.analytics.pipeline.farmer_kpi_batch.model.TransferEvent;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of responsibility intervals for a set of clients, built once per batch run and
 * queried in memory afterwards.
 *
 * <p>When the snapshot was built for a date range only the intervals overlapping that range are kept and
 * lookups for dates outside it resolve to no farmer.
 */
public final class ResponsibilityTimeline {

    private final Map<Long, List<ResponsibilityInterval>> intervalsByClient;
    private final Map<Long, String> farmerNames;
    private final @Nullable DateRange coverage;
    private final AttributionListener listener;

    private ResponsibilityTimeline(Map<Long, List<ResponsibilityInterval>> intervalsByClient,
                                   Map<Long, String> farmerNames,
                                   @Nullable DateRange coverage,
                                   AttributionListener listener) {
        this.intervalsByClient = intervalsByClient;
        this.farmerNames = farmerNames;
        this.coverage = coverage;
        this.listener = listener;
    }

    public static ResponsibilityTimeline build(Collection<ClientRecord> clients,
                                               Collection<TransferEvent> transfers,
                                               Map<Long, String> farmerNames,
                                               @Nullable DateRange coverage,
                                               AttributionListener listener) {
        Map<Long, ClientRecord> clientsById = new HashMap<>();
        for (ClientRecord client : clients) {
            clientsById.put(client.clientId(), client);
        }
        Map<Long, List<TransferEvent>> transfersByClient = transfers.stream()
                .collect(Collectors.groupingBy(TransferEvent::clientId));

        Set<Long> clientIds = new LinkedHashSet<>(clientsById.keySet());
        clientIds.addAll(transfersByClient.keySet());

        Map<Long, List<ResponsibilityInterval>> intervalsByClient = new HashMap<>();
        for (Long clientId : clientIds) {
            List<ResponsibilityInterval> intervals;
            try {
                intervals = ResponsibilityIntervalBuilder.build(clientId, clientsById.get(clientId),
                        transfersByClient.getOrDefault(clientId, List.of()));
            } catch (InconsistentTransferLogException e) {
                listener.inconsistentTransferLog(e);
                intervals = List.of();
            }
            if (coverage != null) {
                intervals = intervals.stream().filter(interval -> interval.overlaps(coverage)).toList();
            }
            intervalsByClient.put(clientId, intervals);
        }
        return new ResponsibilityTimeline(Map.copyOf(intervalsByClient), Map.copyOf(farmerNames), coverage, listener);
    }

    public List<ResponsibilityInterval> intervalsFor(long clientId) {
        return intervalsByClient.getOrDefault(clientId, List.of());
    }

    public Optional<Long> responsibleFarmer(long clientId, LocalDate date) {
        if (coverage != null && !coverage.contains(date)) {
            return Optional.empty();
        }
        List<ResponsibilityInterval> intervals = intervalsFor(clientId);
        LocalDateTime instant = date.atStartOfDay();
        // last interval starting on or before the instant
        int low = 0;
        int high = intervals.size() - 1;
        int candidate = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (intervals.get(mid).start().isAfter(instant)) {
                high = mid - 1;
            } else {
                candidate = mid;
                low = mid + 1;
            }
        }
        if (candidate < 0 || !intervals.get(candidate).contains(instant)) {
            return Optional.empty();
        }
        return Optional.ofNullable(intervals.get(candidate).farmerId());
    }

    public Optional<String> farmerName(@Nullable Long farmerId) {
        return farmerId == null ? Optional.empty() : Optional.ofNullable(farmerNames.get(farmerId));
    }

    public boolean isResponsible(long clientId, long farmerId, @Nullable LocalDate date) {
        return date != null && responsibleFarmer(clientId, date).filter(id -> id == farmerId).isPresent();
    }

    /**
     * Keeps the records whose client was under {@code farmerId} on the record's date, in input order.
     * A null farmer keeps everything.
     */
    public <T extends ClientActivity> List<T> filterByResponsibility(List<T> records,
                                                                     Function<? super T, LocalDate> dateField,
                                                                     @Nullable Long farmerId) {
        if (farmerId == null) {
            return records;
        }
        List<T> kept = new ArrayList<>();
        for (T record : records) {
            if (isResponsible(record.clientId(), farmerId, dateField.apply(record))) {
                kept.add(record);
            }
        }
        return kept;
    }

    public <T extends ClientActivity> List<AttributedRecord<T>> attributeResponsibleFarmer(List<T> records,
                                                                                          Function<? super T, LocalDate> dateField) {
        List<AttributedRecord<T>> attributed = new ArrayList<>(records.size());
        for (T record : records) {
            attributed.add(attribute(record, dateField.apply(record)));
        }
        return attributed;
    }

    public <T extends ClientActivity> AttributedRecord<T> attribute(T record, @Nullable LocalDate date) {
        if (date == null) {
            return new AttributedRecord<>(record, null, null);
        }
        Optional<Long> farmerId = responsibleFarmer(record.clientId(), date);
        if (farmerId.isEmpty()) {
            listener.unresolved(record.clientId(), date);
            return new AttributedRecord<>(record, null, null);
        }
        return new AttributedRecord<>(record, farmerId.get(), farmerNames.get(farmerId.get()));
    }

    public @Nullable DateRange coverage() {
        return coverage;
    }

    public int clientCount() {
        return intervalsByClient.size();
    }
}
