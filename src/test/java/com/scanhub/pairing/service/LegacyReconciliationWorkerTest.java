package com.scanhub.pairing.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.scanhub.pairing.adapter.LegacySink;
import com.scanhub.pairing.exception.LegacySinkException;
import com.scanhub.pairing.model.enums.SyncStatus;
import com.scanhub.pairing.service.LegacyReconciliationWorker.ReconciliationTask;
import com.scanhub.pairing.store.InMemoryPairingStore;
import com.scanhub.pairing.store.PairingStore.NewPairing;

@ExtendWith(MockitoExtension.class)
class LegacyReconciliationWorkerTest {

    @Mock
    private LegacySink legacySink;

    private InMemoryPairingStore store;
    private LegacyReconciliationWorker worker;
    private long recordId;

    @BeforeEach
    void setUp() {
        store = new InMemoryPairingStore();
        worker = new LegacyReconciliationWorker(legacySink, store, Runnable::run);
        recordId = store.insert(new NewPairing("alice", 4, 100L));
    }

    @Test
    @DisplayName("Should mark the record SUCCESS when the legacy system saves it")
    void testSuccess() throws Exception {
        when(legacySink.attemptSave(4, 100L)).thenReturn(LegacySink.SaveResult.saved());

        SyncStatus status = worker.submit(new ReconciliationTask(recordId, 4, 100L)).get();

        assertEquals(SyncStatus.SUCCESS, status);
        assertEquals(SyncStatus.SUCCESS, store.row(recordId).status);
        assertNull(store.row(recordId).diagnostic);
        assertEquals(0, worker.inFlightCount());
    }

    @Test
    @DisplayName("Should mark the record FAILURE with the rejection message")
    void testRejected() throws Exception {
        when(legacySink.attemptSave(4, 100L)).thenReturn(LegacySink.SaveResult.failure("platform locked"));

        SyncStatus status = worker.submit(new ReconciliationTask(recordId, 4, 100L)).get();

        assertEquals(SyncStatus.FAILURE, status);
        assertEquals(SyncStatus.FAILURE, store.row(recordId).status);
        assertEquals("platform locked", store.row(recordId).diagnostic);
    }

    @Test
    @DisplayName("Should mark the record FAILURE when the legacy system cannot be reached")
    void testFault() throws Exception {
        when(legacySink.attemptSave(4, 100L)).thenThrow(new LegacySinkException("connection refused"));

        SyncStatus status = worker.submit(new ReconciliationTask(recordId, 4, 100L)).get();

        assertEquals(SyncStatus.FAILURE, status);
        assertEquals("connection refused", store.row(recordId).diagnostic);
    }

    @Test
    @DisplayName("Should use a default diagnostic when the rejection carries no message")
    void testRejectedWithoutMessage() {
        when(legacySink.attemptSave(4, 100L)).thenReturn(LegacySink.SaveResult.failure(null));

        worker.reconcile(new ReconciliationTask(recordId, 4, 100L));

        assertNotNull(store.row(recordId).diagnostic);
    }

    @Test
    @DisplayName("Should settle a record only once")
    void testSingleTransition() {
        when(legacySink.attemptSave(4, 100L))
                .thenReturn(LegacySink.SaveResult.saved())
                .thenReturn(LegacySink.SaveResult.failure("late rejection"));

        worker.reconcile(new ReconciliationTask(recordId, 4, 100L));
        worker.reconcile(new ReconciliationTask(recordId, 4, 100L));

        assertEquals(SyncStatus.SUCCESS, store.row(recordId).status);
        assertNull(store.row(recordId).diagnostic);
    }

    @Test
    @DisplayName("Should mark the record FAILURE when the executor rejects the task")
    void testExecutorRejects() throws Exception {
        LegacyReconciliationWorker saturated = new LegacyReconciliationWorker(legacySink, store, task -> {
            throw new RejectedExecutionException("queue full");
        });

        CompletableFuture<SyncStatus> future = saturated.submit(new ReconciliationTask(recordId, 4, 100L));

        assertEquals(SyncStatus.FAILURE, future.get());
        assertEquals(SyncStatus.FAILURE, store.row(recordId).status);
        assertEquals("reconciliation rejected: queue full", store.row(recordId).diagnostic);
        assertEquals(0, saturated.inFlightCount());
        verifyNoInteractions(legacySink);
    }

    @Test
    @DisplayName("Should return before the legacy system answers and track the task until it does")
    void testFireAndForget() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(legacySink.attemptSave(4, 100L)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return LegacySink.SaveResult.saved();
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            LegacyReconciliationWorker async = new LegacyReconciliationWorker(legacySink, store, executor);

            CompletableFuture<SyncStatus> future = async.submit(new ReconciliationTask(recordId, 4, 100L));

            assertFalse(future.isDone());
            assertEquals(1, async.inFlightCount());
            assertEquals(SyncStatus.PENDING, store.row(recordId).status);

            release.countDown();
            assertEquals(SyncStatus.SUCCESS, future.get(5, TimeUnit.SECONDS));
            assertEquals(SyncStatus.SUCCESS, store.row(recordId).status);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should abandon a running task on shutdown and leave its record PENDING")
    void testDestroy() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(legacySink.attemptSave(4, 100L)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return LegacySink.SaveResult.saved();
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            LegacyReconciliationWorker async = new LegacyReconciliationWorker(legacySink, store, executor);
            async.submit(new ReconciliationTask(recordId, 4, 100L));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertEquals(1, async.inFlightCount());

            assertEquals(1, async.abandonInFlight());

            assertEquals(0, async.inFlightCount());
            assertEquals(SyncStatus.PENDING, store.row(recordId).status);
            assertEquals(0, async.abandonInFlight());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should have nothing to abandon once every task has settled")
    void testDestroyAfterSettled() throws Exception {
        when(legacySink.attemptSave(4, 100L)).thenReturn(LegacySink.SaveResult.saved());

        worker.submit(new ReconciliationTask(recordId, 4, 100L)).get();
        worker.destroy();

        assertEquals(0, worker.abandonInFlight());
        assertEquals(SyncStatus.SUCCESS, store.row(recordId).status);
    }
}
