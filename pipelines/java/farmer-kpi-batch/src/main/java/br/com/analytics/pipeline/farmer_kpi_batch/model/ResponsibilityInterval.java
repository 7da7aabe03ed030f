package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Half-open span {@code [start, end)} during which {@code farmerId} answered for a client.
 * A null end means the interval is still open; a null farmer means nobody was accountable.
 *
 * <p>A calendar date is looked up at its first instant, so a transfer taking effect during a day applies from
 * the next day on.
 */
public record ResponsibilityInterval(
        long clientId,
        @Nullable Long farmerId,
        LocalDateTime start,
        @Nullable LocalDateTime end
) {

    public boolean isOpen() {
        return end == null;
    }

    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && (end == null || instant.isBefore(end));
    }

    public boolean contains(LocalDate date) {
        return contains(date.atStartOfDay());
    }

    public boolean overlaps(DateRange range) {
        return start.isBefore(range.to().plusDays(1).atStartOfDay())
                && (end == null || end.isAfter(range.from().atStartOfDay()));
    }
}
