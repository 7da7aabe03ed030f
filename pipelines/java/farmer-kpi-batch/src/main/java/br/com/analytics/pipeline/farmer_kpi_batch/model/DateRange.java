package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;

/**
 * Closed range of calendar days, both ends inclusive.
 */
public record DateRange(
        LocalDate from,
        LocalDate to
) {

    public DateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range ends before it starts: " + from + " > " + to);
        }
    }

    public static DateRange of(LocalDate day) {
        return new DateRange(day, day);
    }

    /**
     * Smallest range holding every non-null date, or {@code null} when there is none.
     */
    public static @Nullable DateRange spanning(Collection<LocalDate> dates) {
        LocalDate min = null;
        LocalDate max = null;
        for (LocalDate date : dates) {
            if (date == null) {
                continue;
            }
            if (min == null || date.isBefore(min)) {
                min = date;
            }
            if (max == null || date.isAfter(max)) {
                max = date;
            }
        }
        return min == null ? null : new DateRange(min, max);
    }

    /**
     * Smallest range holding both ranges.
     */
    public DateRange union(DateRange other) {
        return new DateRange(
                from.isBefore(other.from) ? from : other.from,
                to.isAfter(other.to) ? to : other.to);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }
}
