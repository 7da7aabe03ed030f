package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Months covered by one KPI run: {@code monthsBack} whole months before the reference month plus the
 * reference month itself, optionally restricted to a single farmer.
 */
public record KpiWindow(
        LocalDate referenceDate,
        int monthsBack,
        @Nullable Long farmerId
) {

    public static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("MM/yyyy");

    public KpiWindow {
        if (monthsBack < 0) {
            throw new IllegalArgumentException("monthsBack must not be negative: " + monthsBack);
        }
    }

    /**
     * Builds a window from raw job parameters. Blank values fall back to today and {@code defaultMonthsBack}.
     */
    public static KpiWindow fromJobParameters(@Nullable String referenceDate,
                                              @Nullable String monthsBack,
                                              @Nullable String farmerId,
                                              int defaultMonthsBack) {
        try {
            LocalDate reference = isBlank(referenceDate) ? LocalDate.now() : LocalDate.parse(referenceDate.trim());
            int months = isBlank(monthsBack) ? defaultMonthsBack : Integer.parseInt(monthsBack.trim());
            Long farmer = isBlank(farmerId) ? null : Long.valueOf(farmerId.trim());
            return new KpiWindow(reference, months, farmer);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid KPI job parameters: referenceDate=" + referenceDate
                    + ", monthsBack=" + monthsBack + ", farmerId=" + farmerId, e);
        }
    }

    public LocalDate referenceMonth() {
        return referenceDate.withDayOfMonth(1);
    }

    public LocalDate start() {
        return referenceMonth().minusMonths(monthsBack);
    }

    public LocalDate endExclusive() {
        return referenceMonth().plusMonths(1);
    }

    public DateRange dateRange() {
        return new DateRange(start(), endExclusive().minusDays(1));
    }

    public boolean isCurrentMonth(LocalDate month) {
        return month.withDayOfMonth(1).equals(referenceMonth());
    }

    public boolean hasFarmerFilter() {
        return farmerId != null;
    }

    public static String formatMonth(LocalDate date) {
        return date.format(MONTH_FORMAT);
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
