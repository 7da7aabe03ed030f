package br.com.analytics.pipeline.farmer_kpi_batch.responsibility;

import java.time.LocalDateTime;

/**
 * Raised when a client's farmer transfer log cannot be walked into a gap-free, overlap-free timeline.
 */
public class InconsistentTransferLogException extends RuntimeException {

    public enum Violation {
        DUPLICATE_TRANSFER_DATE,
        BROKEN_CHAIN,
        TRANSFER_BEFORE_CREATION
    }

    private final long clientId;
    private final Violation violation;
    private final LocalDateTime transferTime;

    public InconsistentTransferLogException(long clientId, Violation violation, LocalDateTime transferTime, String detail) {
        super("Inconsistent transfer log for client " + clientId + " (" + violation + " at " + transferTime + "): " + detail);
        this.clientId = clientId;
        this.violation = violation;
        this.transferTime = transferTime;
    }

    public long getClientId() {
        return clientId;
    }

    public Violation getViolation() {
        return violation;
    }

    public LocalDateTime getTransferTime() {
        return transferTime;
    }
}
