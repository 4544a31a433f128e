package com.github.salilvnair.flowsync.broker;

import com.github.salilvnair.flowsync.config.FlowSyncConfig;
import com.github.salilvnair.flowsync.event.SyncEvent;
import com.github.salilvnair.flowsync.event.SyncEventType;
import com.github.salilvnair.flowsync.exception.FlowSyncException;
import com.github.salilvnair.flowsync.model.HistoryEntry;
import com.github.salilvnair.flowsync.model.HistoryStatus;
import com.github.salilvnair.flowsync.model.PendingRequest;
import com.github.salilvnair.flowsync.model.RequestKind;
import com.github.salilvnair.flowsync.model.RequestSpec;
import com.github.salilvnair.flowsync.model.ResolutionResult;
import com.github.salilvnair.flowsync.model.ResolutionSource;
import com.github.salilvnair.flowsync.support.FlowSyncHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.salilvnair.flowsync.support.TestConstants.ANSWER_NO;
import static com.github.salilvnair.flowsync.support.TestConstants.ANSWER_YES;
import static com.github.salilvnair.flowsync.support.TestConstants.PROCEED_QUESTION;
import static com.github.salilvnair.flowsync.support.TestConstants.QUEUED_ANSWER;
import static com.github.salilvnair.flowsync.support.TestConstants.SECOND_QUEUED_ANSWER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestBrokerTest {

    private FlowSyncHarness harness;
    private RequestBroker broker;

    @BeforeEach
    void setUp() {
        harness = new FlowSyncHarness();
        broker = harness.broker;
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void localAnswerSettlesRequestAndRecordsHistory() throws Exception {
        CompletableFuture<ResolutionResult> settlement = broker.register(question());
        String id = broker.currentRequest().map(PendingRequest::getId).orElseThrow();

        assertTrue(broker.submitLocal(id, ANSWER_YES, List.of()));

        ResolutionResult result = settlement.get(1, TimeUnit.SECONDS);
        assertEquals(ResolutionSource.LOCAL, result.source());
        assertEquals(ANSWER_YES, result.value());
        assertFalse(broker.hasPendingRequest());
        HistoryEntry entry = harness.history.entries().get(0);
        assertEquals(id, entry.id());
        assertEquals(HistoryStatus.COMPLETED, entry.status());
        assertEquals(List.of(SyncEventType.PENDING_REQUEST, SyncEventType.REQUEST_RESOLVED, SyncEventType.PROCESSING_CHANGED),
                harness.recorder.types());
    }

    @Test
    void concurrentLocalAndRemoteAnswersHaveExactlyOneWinner() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                CompletableFuture<ResolutionResult> settlement = broker.register(question());
                String id = broker.currentRequest().map(PendingRequest::getId).orElseThrow();
                CountDownLatch start = new CountDownLatch(1);
                Future<Boolean> local = pool.submit(() -> {
                    start.await();
                    return broker.submitLocal(id, ANSWER_YES, List.of());
                });
                Future<Boolean> remote = pool.submit(() -> {
                    start.await();
                    return broker.submitRemote(id, ANSWER_NO, List.of());
                });
                start.countDown();

                boolean localWon = local.get(1, TimeUnit.SECONDS);
                boolean remoteWon = remote.get(1, TimeUnit.SECONDS);
                assertTrue(localWon ^ remoteWon);
                ResolutionResult result = settlement.get(1, TimeUnit.SECONDS);
                assertEquals(localWon ? ResolutionSource.LOCAL : ResolutionSource.REMOTE, result.source());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(50, harness.recorder.ofType(SyncEventType.REQUEST_RESOLVED).size());
    }

    @Test
    void staleSubmissionIsIgnored() {
        broker.register(question());
        String id = broker.currentRequest().map(PendingRequest::getId).orElseThrow();
        broker.submitLocal(id, ANSWER_YES, List.of());

        assertFalse(broker.submitRemote(id, ANSWER_NO, List.of()));
        assertFalse(broker.submitLocal("req_unknown", ANSWER_NO, List.of()));
        assertEquals(1, harness.history.entries().size());
    }

    @Test
    void newRegistrationSupersedesPendingRequestBeforeAnnouncingItself() throws Exception {
        CompletableFuture<ResolutionResult> first = broker.register(question());
        String firstId = broker.currentRequest().map(PendingRequest::getId).orElseThrow();

        broker.register(question());

        ResolutionResult superseded = first.get(1, TimeUnit.SECONDS);
        assertEquals(ResolutionSource.SUPERSEDED, superseded.source());
        assertEquals(HistoryStatus.SUPERSEDED, harness.history.entries().get(0).status());
        assertEquals(firstId, harness.history.entries().get(0).id());
        assertEquals(List.of(SyncEventType.PENDING_REQUEST, SyncEventType.REQUEST_RESOLVED, SyncEventType.PENDING_REQUEST),
                harness.recorder.types());
    }

    @Test
    void supersededRequestDoesNotTurnOnProcessing() {
        broker.register(question());
        broker.register(question());

        assertFalse(harness.processing.isProcessing());
    }

    @Test
    void duplicateRequestIdIsRejected() {
        broker.register(RequestSpec.builder().requestId("req_fixed").kind(RequestKind.QUESTION).prompt(PROCEED_QUESTION).build());

        FlowSyncException thrown = assertThrows(FlowSyncException.class, () -> broker.register(
                RequestSpec.builder().requestId("req_fixed").kind(RequestKind.QUESTION).prompt(PROCEED_QUESTION).build()));

        assertEquals("REQUEST_CONFLICT", thrown.getErrorCode());
        assertTrue(broker.hasPendingRequest());
    }

    @Test
    void cancelSettlesWithCancelledResultOnce() throws Exception {
        CompletableFuture<ResolutionResult> settlement = broker.register(question());
        String id = broker.currentRequest().map(PendingRequest::getId).orElseThrow();

        assertTrue(broker.cancel(id, "stopped"));
        assertFalse(broker.cancel(id, "stopped"));

        ResolutionResult result = settlement.get(1, TimeUnit.SECONDS);
        assertEquals(ResolutionSource.CANCELLED, result.source());
        assertEquals("[CANCELLED: stopped]", result.value());
        assertEquals(HistoryStatus.CANCELLED, harness.history.entries().get(0).status());
        assertFalse(harness.processing.isProcessing());
    }

    @Test
    void cancellingTheFutureCancelsTheRequest() {
        CompletableFuture<ResolutionResult> settlement = broker.register(question());

        settlement.cancel(true);

        assertFalse(broker.hasPendingRequest());
        List<SyncEvent> resolved = harness.recorder.ofType(SyncEventType.REQUEST_RESOLVED);
        assertEquals(1, resolved.size());
        assertEquals(ResolutionSource.CANCELLED, resolved.get(0).payload().get("source"));
    }

    @Test
    void registrationConsumesQueuedAnswerImmediately() throws Exception {
        broker.enqueuePrompt(QUEUED_ANSWER, List.of());

        CompletableFuture<ResolutionResult> settlement = broker.register(question());

        assertTrue(settlement.isDone());
        ResolutionResult result = settlement.get();
        assertEquals(ResolutionSource.QUEUE, result.source());
        assertEquals(QUEUED_ANSWER, result.value());
        assertTrue(harness.queue.isEmpty());
        assertTrue(harness.history.entries().get(0).fromQueue());
    }

    @Test
    void pausedQueueIsNotConsumedUntilResumed() throws Exception {
        broker.setQueuePaused(true);
        broker.enqueuePrompt(QUEUED_ANSWER, List.of());
        broker.enqueuePrompt(SECOND_QUEUED_ANSWER, List.of());

        CompletableFuture<ResolutionResult> settlement = broker.register(question());
        assertFalse(settlement.isDone());
        assertFalse(broker.tryAutoConsumeFromQueue());
        assertEquals(2, harness.queue.state().items().size());

        broker.setQueuePaused(false);

        assertEquals(QUEUED_ANSWER, settlement.get(1, TimeUnit.SECONDS).value());
        assertEquals(1, harness.queue.state().items().size());
    }

    @Test
    void disabledQueueIsNeverConsumed() {
        broker.setQueueEnabled(false);
        broker.enqueuePrompt(QUEUED_ANSWER, List.of());

        CompletableFuture<ResolutionResult> settlement = broker.register(question());

        assertFalse(settlement.isDone());
        assertFalse(harness.queue.isEmpty());
    }

    @Test
    void reEnablingQueueAnswersPendingRequest() throws Exception {
        broker.setQueueEnabled(false);
        broker.enqueuePrompt(QUEUED_ANSWER, List.of());
        CompletableFuture<ResolutionResult> settlement = broker.register(question());

        broker.setQueueEnabled(true);

        ResolutionResult result = settlement.get(1, TimeUnit.SECONDS);
        assertEquals(ResolutionSource.QUEUE, result.source());
        assertEquals(QUEUED_ANSWER, result.value());
        assertTrue(harness.queue.isEmpty());
    }

    @Test
    void queueResumeRacingLocalAnswerHasExactlyOneWinner() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                broker.setQueuePaused(true);
                harness.queue.clear();
                broker.enqueuePrompt(QUEUED_ANSWER, List.of());
                CompletableFuture<ResolutionResult> settlement = broker.register(question());
                String id = broker.currentRequest().map(PendingRequest::getId).orElseThrow();
                CountDownLatch start = new CountDownLatch(1);
                Future<Boolean> local = pool.submit(() -> {
                    start.await();
                    return broker.submitLocal(id, ANSWER_YES, List.of());
                });
                Future<?> resume = pool.submit(() -> {
                    start.await();
                    broker.setQueuePaused(false);
                    return null;
                });
                start.countDown();

                boolean localWon = local.get(1, TimeUnit.SECONDS);
                resume.get(1, TimeUnit.SECONDS);
                ResolutionResult result = settlement.get(1, TimeUnit.SECONDS);
                if (localWon) {
                    assertEquals(ResolutionSource.LOCAL, result.source());
                    assertEquals(ANSWER_YES, result.value());
                    assertEquals(1, harness.queue.state().items().size());
                } else {
                    assertEquals(ResolutionSource.QUEUE, result.source());
                    assertEquals(QUEUED_ANSWER, result.value());
                    assertTrue(harness.queue.isEmpty());
                }
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(50, harness.recorder.ofType(SyncEventType.REQUEST_RESOLVED).size());
    }

    @Test
    void enqueueWhilePendingAnswersImmediately() throws Exception {
        CompletableFuture<ResolutionResult> settlement = broker.register(question());

        broker.enqueuePrompt(QUEUED_ANSWER, List.of());

        assertEquals(ResolutionSource.QUEUE, settlement.get(1, TimeUnit.SECONDS).source());
        assertTrue(harness.queue.isEmpty());
    }

    @Test
    void answerTurnsOnProcessingUntilNextRequest() {
        broker.register(question());
        String id = broker.currentRequest().map(PendingRequest::getId).orElseThrow();
        broker.submitLocal(id, ANSWER_YES, List.of());
        assertTrue(harness.processing.isProcessing());

        broker.register(question());

        assertFalse(harness.processing.isProcessing());
    }

    @Test
    void processingClearsAfterTimeout() throws Exception {
        FlowSyncConfig config = new FlowSyncConfig();
        config.getBroker().setProcessingTimeoutMs(50);
        try (FlowSyncHarness quick = new FlowSyncHarness(config)) {
            quick.broker.register(question());
            String id = quick.broker.currentRequest().map(PendingRequest::getId).orElseThrow();
            quick.broker.submitLocal(id, ANSWER_YES, List.of());

            long deadline = System.currentTimeMillis() + 2_000;
            while (quick.processing.isProcessing() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertFalse(quick.processing.isProcessing());
            List<SyncEvent> changes = quick.recorder.ofType(SyncEventType.PROCESSING_CHANGED);
            assertEquals("timeout", changes.get(changes.size() - 1).payload().get("reason"));
        }
    }

    @Test
    void submitRejectsNonHumanSources() {
        assertThrows(IllegalArgumentException.class,
                () -> broker.submit("req_x", ResolutionResult.of(ResolutionSource.QUEUE, ANSWER_YES, List.of())));
    }

    private RequestSpec question() {
        return RequestSpec.builder()
                .kind(RequestKind.QUESTION)
                .prompt(PROCEED_QUESTION)
                .build();
    }
}
