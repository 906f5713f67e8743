package com.example.alertengine.grouping;

import com.example.alertengine.domain.AlertGroupLock;
import com.example.alertengine.repository.AlertGroupLockRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Serialises group creation per (team, group key). The lock row is created and committed
 * on its own the first time a key is seen, then locked for update inside the caller's
 * transaction until it commits.
 * <p>
 * Two callers creating the same row at once make one of them fail with a unique-key
 * violation; the caller's conflict retry then finds the committed row.
 */
@Slf4j
@Component
public class GroupKeyLocks {

    private final AlertGroupLockRepository lockRepository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public GroupKeyLocks(AlertGroupLockRepository lockRepository,
                         PlatformTransactionManager transactionManager,
                         Clock clock) {
        this.lockRepository = lockRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /** Blocks until no other transaction holds the key. Must run inside a transaction. */
    public void acquire(String teamId, String groupKey) {
        String id = AlertGroupLock.idFor(teamId, groupKey);
        if (!lockRepository.existsById(id)) {
            requiresNew.executeWithoutResult(status -> {
                if (!lockRepository.existsById(id)) {
                    log.debug("Creating group lock for '{}' (team {})", groupKey, teamId);
                    lockRepository.saveAndFlush(AlertGroupLock.builder()
                            .id(id)
                            .teamId(teamId)
                            .groupKey(groupKey)
                            .createdAt(clock.instant())
                            .build());
                }
            });
        }
        lockRepository.lockById(id)
                .orElseThrow(() -> new IllegalStateException("Group lock " + id + " missing after creation"));
    }
}
