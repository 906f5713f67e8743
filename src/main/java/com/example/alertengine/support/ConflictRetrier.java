package com.example.alertengine.support;

import com.example.alertengine.config.AlertingProperties;
import com.example.alertengine.exception.ConcurrencyConflictException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction and replays it when it loses a race
 * on a versioned row or a unique key. Each attempt starts from a fresh transaction.
 */
@Slf4j
@Component
public class ConflictRetrier {

    private final TransactionTemplate transactionTemplate;
    private final AlertingProperties properties;
    private final MeterRegistry meterRegistry;

    public ConflictRetrier(PlatformTransactionManager transactionManager,
                           AlertingProperties properties,
                           MeterRegistry meterRegistry) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public <T> T inTransaction(String operation, Supplier<T> work) {
        int maxRetries = Math.max(0, properties.getConcurrency().getMaxRetries());
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                meterRegistry.counter("alerting.conflicts", "operation", operation).increment();
                if (attempt > maxRetries) {
                    log.error("Giving up on {} after {} attempts: {}", operation, attempt, e.getMessage());
                    throw new ConcurrencyConflictException(operation, attempt, e);
                }
                log.debug("Conflict on {} (attempt {}), retrying: {}", operation, attempt, e.getMessage());
            }
        }
    }

    public void inTransaction(String operation, Runnable work) {
        inTransaction(operation, () -> {
            work.run();
            return null;
        });
    }
}
