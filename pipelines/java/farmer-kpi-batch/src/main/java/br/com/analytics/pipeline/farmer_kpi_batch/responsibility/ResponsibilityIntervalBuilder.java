package br.com.analytics.pipeline.farmer_kpi_batch.responsibility;

import br.com.analytics.pipeline.farmer_kpi_batch.model.ClientRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.model.ResponsibilityInterval;
import br.com.analytics.pipeline.farmer_kpi_batch.model.TransferEvent;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.InconsistentTransferLogException.Violation;
import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Walks a client's farmer transfers pairwise into consecutive responsibility intervals.
 *
 * <p>With a creation record and N farmer transfers the result always holds N+1 intervals: the span before
 * the first transfer, one span per transfer up to the next one, and a final open span. Without a creation
 * record the span before the first transfer cannot be bounded and is left out.
 *
 * <p>Intervals are bounded by transfer instants. The client's history starts at the first instant of its
 * creation date.
 */
public final class ResponsibilityIntervalBuilder {

    private ResponsibilityIntervalBuilder() {
    }

    public static List<ResponsibilityInterval> build(long clientId,
                                                     @Nullable ClientRecord client,
                                                     List<TransferEvent> events) {
        List<TransferEvent> transfers = events.stream()
                .filter(TransferEvent::isFarmerReassignment)
                .filter(event -> event.clientId() == clientId)
                .sorted(Comparator.comparing(TransferEvent::transferTime))
                .toList();

        if (transfers.isEmpty()) {
            if (client == null) {
                return List.of();
            }
            return List.of(new ResponsibilityInterval(clientId, client.originalFarmerId(), createdAt(client), null));
        }

        validate(clientId, client, transfers);

        List<ResponsibilityInterval> intervals = new ArrayList<>(transfers.size() + 1);
        TransferEvent first = transfers.get(0);
        if (client != null) {
            // the log may not record the very first assignment
            Long before = first.oldFarmerId() != null ? first.oldFarmerId() : client.originalFarmerId();
            intervals.add(new ResponsibilityInterval(clientId, before, createdAt(client), first.transferTime()));
        }
        for (int i = 0; i < transfers.size(); i++) {
            TransferEvent current = transfers.get(i);
            TransferEvent next = i + 1 < transfers.size() ? transfers.get(i + 1) : null;
            intervals.add(new ResponsibilityInterval(
                    clientId,
                    current.newFarmerId(),
                    current.transferTime(),
                    next == null ? null : next.transferTime()));
        }
        return List.copyOf(intervals);
    }

    private static void validate(long clientId, @Nullable ClientRecord client, List<TransferEvent> transfers) {
        TransferEvent first = transfers.get(0);
        if (client != null && first.transferTime().isBefore(createdAt(client))) {
            throw new InconsistentTransferLogException(clientId, Violation.TRANSFER_BEFORE_CREATION, first.transferTime(),
                    "client created on " + client.creationDate());
        }
        for (int i = 1; i < transfers.size(); i++) {
            TransferEvent previous = transfers.get(i - 1);
            TransferEvent current = transfers.get(i);
            if (previous.transferTime().equals(current.transferTime())) {
                throw new InconsistentTransferLogException(clientId, Violation.DUPLICATE_TRANSFER_DATE, current.transferTime(),
                        "two farmer transfers at the same instant");
            }
            if (!Objects.equals(previous.newFarmerId(), current.oldFarmerId())) {
                throw new InconsistentTransferLogException(clientId, Violation.BROKEN_CHAIN, current.transferTime(),
                        "previous transfer assigned farmer " + previous.newFarmerId()
                                + " but this one moves the client away from farmer " + current.oldFarmerId());
            }
        }
    }

    private static LocalDateTime createdAt(ClientRecord client) {
        return client.creationDate().atStartOfDay();
    }
}
