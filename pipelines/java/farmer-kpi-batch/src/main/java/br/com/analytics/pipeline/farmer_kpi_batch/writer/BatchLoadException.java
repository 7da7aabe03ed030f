package br.com.analytics.pipeline.farmer_kpi_batch.writer;

public class BatchLoadException extends RuntimeException {

    private final transient BatchLoadResult<?> result;

    public BatchLoadException(String message, BatchLoadResult<?> result, Throwable cause) {
        super(message, cause);
        this.result = result;
    }

    public BatchLoadException(String message, BatchLoadResult<?> result) {
        super(message);
        this.result = result;
    }

    public BatchLoadResult<?> getResult() {
        return result;
    }
}
