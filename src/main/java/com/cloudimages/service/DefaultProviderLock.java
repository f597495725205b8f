package com.cloudimages.service;

import com.cloudimages.entity.ProviderDefaultLockEntity;
import com.cloudimages.exception.InternalException;
import com.cloudimages.repository.ProviderDefaultLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Serializes default-provider changes per user on a dedicated anchor row.
 *
 * Locking the provider rows alone misses rows inserted concurrently; the
 * anchor row exists before any change runs, so every change for the same
 * user waits on the same lock until the previous transaction commits.
 */
@Component
public class DefaultProviderLock {

    private static final Logger log = LoggerFactory.getLogger(DefaultProviderLock.class);

    private final ProviderDefaultLockRepository lockRepository;
    private final TransactionTemplate anchorTransaction;

    public DefaultProviderLock(ProviderDefaultLockRepository lockRepository,
            PlatformTransactionManager transactionManager) {
        this.lockRepository = lockRepository;
        this.anchorTransaction = new TransactionTemplate(transactionManager);
        this.anchorTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Locks the user's anchor row until the caller's transaction ends,
     * creating the row first if needed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(String userId) {
        if (!lockRepository.existsById(userId)) {
            createAnchor(userId);
        }
        lockRepository.lockByUserId(userId)
                .orElseThrow(() -> new InternalException("Default lock row for user " + userId + " is missing"));
    }

    private void createAnchor(String userId) {
        try {
            // committed on its own so concurrent callers can lock it right away
            anchorTransaction.executeWithoutResult(
                    status -> lockRepository.saveAndFlush(new ProviderDefaultLockEntity(userId)));
            log.debug("Created default lock row for user {}", userId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Default lock row for user {} was created concurrently", userId);
        }
    }
}
