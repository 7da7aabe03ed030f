package br.com.analytics.pipeline.farmer_kpi_batch.writer;

import java.util.List;

/**
 * Outcome of one load.
 *
 * @param deletedRows  rows removed by the load's delete statement
 * @param committedRows rows inserted and committed
 * @param rejectedRows rows of batches the database refused; they need fixing before a resubmission
 * @param pendingRows  rows never committed because retries ran out; they can be resubmitted as they are
 * @param attempts     number of transactions tried
 */
public record BatchLoadResult<T>(
        int deletedRows,
        int committedRows,
        List<T> rejectedRows,
        List<T> pendingRows,
        int attempts
) {

    public static <T> BatchLoadResult<T> abandoned(List<T> rows, int attempts) {
        return new BatchLoadResult<>(0, 0, List.of(), List.copyOf(rows), attempts);
    }

    public boolean requiresResubmission() {
        return !pendingRows.isEmpty();
    }

    public boolean hasRejections() {
        return !rejectedRows.isEmpty();
    }
}
