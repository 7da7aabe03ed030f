package br.com.analytics.pipeline.farmer_kpi_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * One entry of a client's transfer log. {@code transferTime} is the instant the reassignment takes effect.
 */
public record TransferEvent(
        long clientId,
        @Nullable Long oldFarmerId,
        @Nullable Long newFarmerId,
        LocalDateTime transferTime,
        String transferType
) {

    public static final String FARMER_TRANSFER = "FARMER";

    public boolean isFarmerReassignment() {
        return FARMER_TRANSFER.equals(transferType);
    }
}
