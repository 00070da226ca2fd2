package com.scanhub.pairing.service;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.scanhub.pairing.adapter.LegacySink;
import com.scanhub.pairing.config.ReconciliationExecutorConfig;
import com.scanhub.pairing.model.enums.SyncStatus;
import com.scanhub.pairing.store.PairingStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Propagates committed pairings to the legacy system, one task per record.
 *
 * The task settles the record's sync status exactly once: SUCCESS when the legacy system
 * accepted the pair, FAILURE with a diagnostic otherwise. A task the executor refuses is
 * settled as FAILURE right away. There is no retry. Handles of
 * running tasks are kept until they finish; on shutdown the remaining ones are abandoned.
 */
@Service
@Slf4j
public class LegacyReconciliationWorker implements DisposableBean {

    static final String REJECTED_DIAGNOSTIC = "reconciliation rejected: queue full";

    private final LegacySink legacySink;
    private final PairingStore store;
    private final Executor executor;

    private final Set<CompletableFuture<SyncStatus>> inFlight = ConcurrentHashMap.newKeySet();

    public LegacyReconciliationWorker(
            LegacySink legacySink,
            PairingStore store,
            @Qualifier(ReconciliationExecutorConfig.RECONCILIATION_EXECUTOR) Executor executor) {
        this.legacySink = legacySink;
        this.store = store;
        this.executor = executor;
    }

    /**
     * Record to reconcile.
     */
    public record ReconciliationTask(long recordId, int platform, long product) {}

    /**
     * Start reconciling a record. Returns immediately.
     *
     * @return completes with the terminal status once the record is settled
     */
    public CompletableFuture<SyncStatus> submit(ReconciliationTask task) {
        CompletableFuture<SyncStatus> future;
        try {
            future = CompletableFuture.supplyAsync(() -> reconcile(task), executor);
        } catch (RejectedExecutionException e) {
            log.error("LEGACY: Reconciliation of record {} rejected by executor: {}",
                    task.recordId(), e.getMessage());
            try {
                store.updateStatus(task.recordId(), SyncStatus.FAILURE, REJECTED_DIAGNOSTIC);
            } catch (RuntimeException statusError) {
                log.error("LEGACY: Could not mark rejected record {} as FAILURE: {}",
                        task.recordId(), statusError.getMessage());
                return CompletableFuture.failedFuture(statusError);
            }
            return CompletableFuture.completedFuture(SyncStatus.FAILURE);
        }

        inFlight.add(future);
        future.whenComplete((status, error) -> {
            inFlight.remove(future);
            if (error != null) {
                log.error("LEGACY: Reconciliation of record {} did not settle: {}",
                        task.recordId(), error.getMessage());
            }
        });
        return future;
    }

    /**
     * Number of tasks started and not yet finished.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    SyncStatus reconcile(ReconciliationTask task) {
        LegacySink.SaveResult result;
        try {
            result = legacySink.attemptSave(task.platform(), task.product());
        } catch (Exception e) {
            log.error("LEGACY: Save of record {} failed: {}", task.recordId(), e.getMessage());
            result = LegacySink.SaveResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (result.success()) {
            store.updateStatus(task.recordId(), SyncStatus.SUCCESS, null);
            return SyncStatus.SUCCESS;
        }
        String diagnostic = result.message() != null ? result.message() : "Legacy system rejected the pair";
        store.updateStatus(task.recordId(), SyncStatus.FAILURE, diagnostic);
        return SyncStatus.FAILURE;
    }

    @Override
    public void destroy() {
        abandonInFlight();
    }

    /**
     * Drop the handles of unfinished tasks. Their records stay PENDING.
     *
     * @return the number of tasks abandoned
     */
    int abandonInFlight() {
        int pending = 0;
        for (CompletableFuture<SyncStatus> future : inFlight) {
            if (inFlight.remove(future)) {
                pending++;
            }
        }
        if (pending > 0) {
            log.warn("LEGACY: Abandoning {} unfinished reconciliation task(s); their records stay PENDING", pending);
        }
        return pending;
    }
}
