package com.scanhub.pairing.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.scanhub.pairing.config.PairingHubProperties;
import com.scanhub.pairing.exception.PairingCommitException;
import com.scanhub.pairing.model.domain.PairingRecord;
import com.scanhub.pairing.model.enums.SyncStatus;
import com.scanhub.pairing.repository.PairingRecordRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link PairingStore} backed by the pairing_records table.
 *
 * A commit takes the product's lock stripe first and only then opens the transaction,
 * so the lock is held until the transaction has committed. Two commits for the same
 * product can therefore never both see "no prior record". The pessimistic row lock on
 * the prior record covers other writers of the same database.
 */
@Component
@Slf4j
public class JpaPairingStore implements PairingStore {

    private static final int MAX_DIAGNOSTIC_LENGTH = 1000;

    private final PairingRecordRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock[] productLocks;

    public JpaPairingStore(
            PairingRecordRepository repository,
            PlatformTransactionManager transactionManager,
            PairingHubProperties properties) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.productLocks = createStripes(properties.getCommit().getLockStripes());
    }

    /**
     * Takes no product lock. Only {@link #commitPairing} serializes it.
     */
    @Override
    @Transactional
    public Optional<PriorPairing> findAndMarkOverwritten(long product) {
        List<PairingRecord> latest = repository.findLatestForProduct(product, PageRequest.of(0, 1));
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        PairingRecord prior = latest.get(0);
        repository.markOverwritten(prior.getId());
        return Optional.of(new PriorPairing(prior.getId(), prior.getPlatform()));
    }

    /**
     * Takes no product lock. Only {@link #commitPairing} serializes it.
     */
    @Override
    @Transactional
    public long insert(NewPairing pairing) {
        PairingRecord record = PairingRecord.builder()
                .login(pairing.login())
                .platform(pairing.platform())
                .product(pairing.product())
                .scannedAt(Instant.now())
                .overwrite(false)
                .syncStatus(SyncStatus.PENDING)
                .build();
        return repository.save(record).getId();
    }

    @Override
    public CommitResult commitPairing(NewPairing pairing) {
        ReentrantLock lock = lockFor(pairing.product());
        lock.lock();
        try {
            CommitResult result = transactionTemplate.execute(status -> {
                Optional<PriorPairing> prior = findAndMarkOverwritten(pairing.product());
                long recordId = insert(pairing);
                return new CommitResult(recordId, prior);
            });
            log.debug("STORE: Committed record {} for product {} (prior={})",
                    result.recordId(), pairing.product(), result.prior().orElse(null));
            return result;
        } catch (RuntimeException e) {
            log.error("STORE: Commit for product {} rolled back: {}", pairing.product(), e.getMessage());
            throw new PairingCommitException(pairing.product(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    @Transactional
    public boolean updateStatus(long recordId, SyncStatus status, String diagnostic) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Sync status can only move to a terminal state, got " + status);
        }
        int updated = repository.transitionStatus(recordId, SyncStatus.PENDING, status, truncate(diagnostic));
        if (updated == 0) {
            log.warn("STORE: Record {} is not PENDING, status {} ignored", recordId, status);
            return false;
        }
        log.info("STORE: Sync status of record {} set to {}", recordId, status);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Integer> findLatestPlatformForIdentity(String login) {
        return repository.findFirstByLoginOrderByIdDesc(login)
                .map(PairingRecord::getPlatform);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private static String truncate(String diagnostic) {
        if (diagnostic == null || diagnostic.length() <= MAX_DIAGNOSTIC_LENGTH) {
            return diagnostic;
        }
        return diagnostic.substring(0, MAX_DIAGNOSTIC_LENGTH);
    }

    private ReentrantLock lockFor(long product) {
        return productLocks[Long.hashCode(product) & (productLocks.length - 1)];
    }

    private static ReentrantLock[] createStripes(int requested) {
        int size = Integer.highestOneBit(Math.max(1, requested));
        if (size < requested) {
            size <<= 1;
        }
        ReentrantLock[] stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
