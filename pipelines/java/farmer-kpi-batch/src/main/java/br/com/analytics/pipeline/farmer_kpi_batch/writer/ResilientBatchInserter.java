package br.com.analytics.pipeline.farmer_kpi_batch.writer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts rows in batches inside a single transaction of its own.
 *
 * <p>Each batch is guarded by a savepoint: when the database refuses a batch, the transaction rolls back to the
 * savepoint, the batch is reported as rejected and the remaining batches still go in. Connectivity and other
 * transient failures abort the whole transaction, which is then retried from the start following the
 * {@link BackOff} policy. Once the policy gives up, every row is reported as pending.
 */
public class ResilientBatchInserter {

    private static final Logger log = LoggerFactory.getLogger(ResilientBatchInserter.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;
    private final BackOff backOff;

    public ResilientBatchInserter(JdbcTemplate jdbcTemplate,
                                  PlatformTransactionManager transactionManager,
                                  int batchSize,
                                  BackOff backOff) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        // commits independently of any surrounding step transaction
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.batchSize = batchSize;
        this.backOff = backOff;
    }

    public <T> BatchLoadResult<T> append(String insertSql, List<T> rows, ParameterizedPreparedStatementSetter<T> setter) {
        return load(null, new Object[0], insertSql, rows, setter);
    }

    /**
     * Runs {@code deleteSql} and then inserts {@code rows}, all in the same transaction.
     */
    public <T> BatchLoadResult<T> replace(String deleteSql, Object[] deleteArgs, String insertSql,
                                          List<T> rows, ParameterizedPreparedStatementSetter<T> setter) {
        return load(deleteSql, deleteArgs, insertSql, rows, setter);
    }

    private <T> BatchLoadResult<T> load(@Nullable String deleteSql, Object[] deleteArgs, String insertSql,
                                        List<T> rows, ParameterizedPreparedStatementSetter<T> setter) {
        BackOffExecution backOffExecution = backOff.start();
        int attempt = 0;
        while (true) {
            attempt++;
            final int currentAttempt = attempt;
            try {
                return transactionTemplate.execute(
                        status -> loadInTransaction(status, deleteSql, deleteArgs, insertSql, rows, setter, currentAttempt));
            } catch (DataAccessException | TransactionException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                long waitMillis = backOffExecution.nextBackOff();
                if (waitMillis == BackOffExecution.STOP) {
                    log.error("Load abandoned after {} attempts; {} rows require resubmission", attempt, rows.size(), e);
                    return BatchLoadResult.abandoned(rows, attempt);
                }
                log.warn("Load attempt {} failed ({}); retrying in {} ms", attempt, e.getMessage(), waitMillis);
                pause(waitMillis, rows, attempt);
            }
        }
    }

    private <T> BatchLoadResult<T> loadInTransaction(TransactionStatus status, @Nullable String deleteSql, Object[] deleteArgs,
                                                     String insertSql, List<T> rows,
                                                     ParameterizedPreparedStatementSetter<T> setter, int attempt) {
        int deleted = deleteSql == null ? 0 : jdbcTemplate.update(deleteSql, deleteArgs);
        if (deleteSql != null) {
            log.info("Rows deleted before load: {}", deleted);
        }

        int committed = 0;
        List<T> rejected = new ArrayList<>();
        for (int from = 0; from < rows.size(); from += batchSize) {
            List<T> batch = rows.subList(from, Math.min(rows.size(), from + batchSize));
            Object savepoint = status.createSavepoint();
            try {
                jdbcTemplate.batchUpdate(insertSql, batch, batch.size(), setter);
                status.releaseSavepoint(savepoint);
                committed += batch.size();
                log.info("Batch inserted: {}/{} rows", committed, rows.size());
            } catch (DataAccessException e) {
                if (isRetryable(e)) {
                    throw e;
                }
                status.rollbackToSavepoint(savepoint);
                rejected.addAll(batch);
                log.error("Batch of {} rows starting at row {} rejected: {}", batch.size(), from, e.getMessage());
            }
        }
        return new BatchLoadResult<>(deleted, committed, List.copyOf(rejected), List.of(), attempt);
    }

    /**
     * Connectivity problems: transient data access errors, and a transaction that could not be opened or
     * committed.
     */
    static boolean isRetryable(RuntimeException e) {
        return e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof CannotCreateTransactionException
                || e instanceof TransactionSystemException;
    }

    private static <T> void pause(long millis, List<T> rows, int attempt) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchLoadException("Interrupted while waiting to retry the load",
                    BatchLoadResult.abandoned(rows, attempt), e);
        }
    }
}
