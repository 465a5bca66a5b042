package com.factory.stockkeeper.service;

import com.factory.stockkeeper.exception.ConcurrencyConflictException;
import com.factory.stockkeeper.exception.ManufacturingException;
import com.factory.stockkeeper.model.DocumentSequence;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Transaction boundary for one command. Everything the callback writes commits together or
 * not at all. Lock contention, optimistic-check failures and the first-counter-of-the-day race
 * on {@link DocumentSequence} roll the attempt back and retry it through a resilience4j
 * {@link Retry}, up to the configured limit, before surfacing {@link ConcurrencyConflictException}.
 * When a transaction is already active the callback simply joins it and is not retried.
 */
@Component
@Slf4j
public class UnitOfWork {

    // H2 "concurrent update" error code
    private static final int H2_CONCURRENT_UPDATE = 90131;
    private static final String UNIQUE_VIOLATION = "23505";

    private final TransactionTemplate transactionTemplate;
    private final SettingsService settingsService;

    public UnitOfWork(PlatformTransactionManager transactionManager, SettingsService settingsService) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.settingsService = settingsService;
    }

    public <T> T execute(String command, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        Retry retry = retryFor(command);
        Supplier<T> attempt = Retry.decorateSupplier(retry,
                () -> transactionTemplate.execute(status -> work.get()));
        try {
            return attempt.get();
        } catch (RuntimeException e) {
            if (!isConcurrencyFailure(e)) {
                throw e;
            }
            int attempts = retry.getRetryConfig().getMaxAttempts();
            log.warn("{} gave up after {} attempts: {}", command, attempts, e.getMessage());
            throw new ConcurrencyConflictException(
                    command + " failed after " + attempts + " attempts because of concurrent updates", e);
        }
    }

    public void run(String command, Runnable work) {
        execute(command, () -> {
            work.run();
            return null;
        });
    }

    // Settings can change at runtime, so the policy is rebuilt per command
    private Retry retryFor(String command) {
        int maxAttempts = settingsService.getMaxRetries() + 1;
        long backoffMs = settingsService.getRetryBackoffMs();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(attempt -> backoffMs * attempt)
                .retryOnException(UnitOfWork::isConcurrencyFailure)
                .build();

        Retry retry = Retry.of(command, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} hit a concurrent update (attempt {}/{}), retrying",
                command, event.getNumberOfRetryAttempts(), maxAttempts));
        return retry;
    }

    static boolean isConcurrencyFailure(Throwable e) {
        if (e instanceof ManufacturingException) {
            return false;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConcurrencyFailureException
                    || t instanceof DuplicateKeyException
                    || t instanceof OptimisticLockException
                    || t instanceof PessimisticLockException
                    || t instanceof LockTimeoutException
                    || t instanceof org.hibernate.StaleStateException) {
                return true;
            }
            if (t instanceof ConstraintViolationException
                    && isSequenceKey(((ConstraintViolationException) t).getConstraintName())) {
                return true;
            }
            if (t instanceof SQLException) {
                SQLException sql = (SQLException) t;
                String state = sql.getSQLState();
                if (sql.getErrorCode() == H2_CONCURRENT_UPDATE || (state != null && state.startsWith("40"))) {
                    return true;
                }
                if (UNIQUE_VIOLATION.equals(state) && isSequenceKey(sql.getMessage())) {
                    return true;
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    // Only the per-day counter key can collide between two well-formed commands
    private static boolean isSequenceKey(String constraintOrMessage) {
        return constraintOrMessage != null
                && constraintOrMessage.toLowerCase(Locale.ROOT).contains(DocumentSequence.UNIQUE_KEY);
    }
}
