package com.factory.stockkeeper.service;

import com.factory.stockkeeper.exception.ConcurrencyConflictException;
import com.factory.stockkeeper.exception.InsufficientStockException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.DocumentSequence;
import jakarta.persistence.PessimisticLockException;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UnitOfWorkTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private SettingsService settingsService;

    private UnitOfWork unitOfWork;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(transactionManager.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        when(settingsService.getMaxRetries()).thenReturn(2);
        when(settingsService.getRetryBackoffMs()).thenReturn(0L);
        unitOfWork = new UnitOfWork(transactionManager, settingsService);
    }

    @Test
    void execute_retriesLockFailuresThenSucceeds() {
        AtomicInteger attempts = new AtomicInteger();

        String result = unitOfWork.execute("issue", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("row locked");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, attempts.get());
        verify(transactionManager, times(2)).rollback(any());
        verify(transactionManager, times(1)).commit(any());
    }

    @Test
    void execute_givesUpAfterMaxRetries() {
        AtomicInteger attempts = new AtomicInteger();

        ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
                () -> unitOfWork.execute("issue", () -> {
                    attempts.incrementAndGet();
                    throw new ObjectOptimisticLockingFailureException("InventoryLot", 1L);
                }));

        assertEquals(3, attempts.get());
        assertInstanceOf(ObjectOptimisticLockingFailureException.class, e.getCause());
    }

    @Test
    void execute_doesNotRetryBusinessFailures() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(ValidationException.class, () -> unitOfWork.execute("complete", () -> {
            attempts.incrementAndGet();
            throw new ValidationException("bad quantity");
        }));

        assertEquals(1, attempts.get());
        verify(transactionManager).rollback(any());
    }

    @Test
    void execute_doesNotRetryColumnViolations() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(DataIntegrityViolationException.class, () -> unitOfWork.execute("createOrder", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("could not execute statement",
                    new SQLException("Value too long for column NOTES", "22001"));
        }));

        assertEquals(1, attempts.get());
    }

    @Test
    void execute_retriesSequenceKeyRace() {
        AtomicInteger attempts = new AtomicInteger();

        String result = unitOfWork.execute("createOrder", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new DataIntegrityViolationException("could not execute statement",
                        new ConstraintViolationException("duplicate key", new SQLException("duplicate", "23505"),
                                DocumentSequence.UNIQUE_KEY));
            }
            return "MO-20260601-0001";
        });

        assertEquals("MO-20260601-0001", result);
        assertEquals(2, attempts.get());
    }

    @Test
    void isConcurrencyFailure_classifiesCauses() {
        assertTrue(UnitOfWork.isConcurrencyFailure(new DuplicateKeyException("duplicate key")));
        assertTrue(UnitOfWork.isConcurrencyFailure(
                new RuntimeException("wrapped", new PessimisticLockException("locked"))));
        assertTrue(UnitOfWork.isConcurrencyFailure(
                new RuntimeException("wrapped", new SQLException("deadlock", "40001"))));
        assertTrue(UnitOfWork.isConcurrencyFailure(
                new RuntimeException("wrapped", new SQLException("concurrent update", "HY000", 90131))));
        assertTrue(UnitOfWork.isConcurrencyFailure(new DataIntegrityViolationException("insert failed",
                new SQLException("Unique index violation: \"PUBLIC.UK_DOCUMENT_SEQUENCE_PREFIX_DAY_INDEX_1\"",
                        "23505"))));

        assertFalse(UnitOfWork.isConcurrencyFailure(new DataIntegrityViolationException("not-null column")));
        assertFalse(UnitOfWork.isConcurrencyFailure(new DataIntegrityViolationException("insert failed",
                new SQLException("Numeric value out of range", "22003"))));
        assertFalse(UnitOfWork.isConcurrencyFailure(new IllegalStateException("bug")));
        assertFalse(UnitOfWork.isConcurrencyFailure(
                new InsufficientStockException("RM-1", 1L, 1L, BigDecimal.TEN, BigDecimal.ONE)));
    }
}
