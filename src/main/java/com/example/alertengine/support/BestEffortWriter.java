package com.example.alertengine.support;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes audit records after the surrounding transaction commits, in a transaction of
 * their own. A failed write is logged and counted but never propagates to the caller.
 */
@Slf4j
@Component
public class BestEffortWriter {

    private final TransactionTemplate requiresNew;
    private final Counter failures;

    public BestEffortWriter(PlatformTransactionManager transactionManager, MeterRegistry meterRegistry) {
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.failures = Counter.builder("alerting.audit.write_failures")
                .description("Audit records that could not be written")
                .register(meterRegistry);
    }

    public void writeAfterCommit(String what, Runnable write) {
        AfterCommit.run(() -> writeNow(what, write));
    }

    private void writeNow(String what, Runnable write) {
        try {
            requiresNew.executeWithoutResult(status -> write.run());
        } catch (RuntimeException e) {
            failures.increment();
            log.error("Failed to write {}: {}", what, e.getMessage());
        }
    }

    public double failureCount() {
        return failures.count();
    }
}
