package com.example.alertengine.support;

import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.exception.ConcurrencyConflictException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConflictRetrierTest {

    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ConflictRetrier retrier;

    @BeforeEach
    void setUp() {
        AlertingProperties properties = new AlertingProperties();
        properties.getConcurrency().setMaxRetries(2);
        retrier = new ConflictRetrier(transactionManager, properties, meterRegistry);
    }

    @Test
    void replaysAfterLosingARace() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.inTransaction("intake", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new OptimisticLockingFailureException("stale row");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, attempts.get());
        assertEquals(2.0, meterRegistry.counter("alerting.conflicts", "operation", "intake").count());
        verify(transactionManager, times(2)).rollback(any());
        verify(transactionManager, times(1)).commit(any());
    }

    @Test
    void uniqueKeyViolationsAreReplayedToo() {
        AtomicInteger attempts = new AtomicInteger();

        Integer result = retrier.inTransaction("grouping", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new DataIntegrityViolationException("duplicate group");
            }
            return attempts.get();
        });

        assertEquals(2, result);
    }

    @Test
    void givesUpAfterTheConfiguredRetries() {
        AtomicInteger attempts = new AtomicInteger();

        ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
                () -> retrier.inTransaction("escalation", () -> {
                    attempts.incrementAndGet();
                    throw new OptimisticLockingFailureException("always stale");
                }));

        assertEquals(3, attempts.get());
        assertInstanceOf(OptimisticLockingFailureException.class, e.getCause());
    }

    @Test
    void otherFailuresPropagateImmediately() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> retrier.inTransaction("intake", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        }));

        assertEquals(1, attempts.get());
        assertEquals(0.0, meterRegistry.counter("alerting.conflicts", "operation", "intake").count());
    }
}
