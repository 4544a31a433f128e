package com.github.salilvnair.flowsync.broker;

import com.github.salilvnair.flowsync.event.InteractionEventDispatcher;
import com.github.salilvnair.flowsync.event.SyncEvent;
import com.github.salilvnair.flowsync.exception.FlowSyncErrorCode;
import com.github.salilvnair.flowsync.exception.FlowSyncException;
import com.github.salilvnair.flowsync.history.SessionHistory;
import com.github.salilvnair.flowsync.model.AttachmentRef;
import com.github.salilvnair.flowsync.model.HistoryEntry;
import com.github.salilvnair.flowsync.model.PendingRequest;
import com.github.salilvnair.flowsync.model.QueueItem;
import com.github.salilvnair.flowsync.model.RequestKind;
import com.github.salilvnair.flowsync.model.RequestSpec;
import com.github.salilvnair.flowsync.model.ResolutionResult;
import com.github.salilvnair.flowsync.model.ResolutionSource;
import com.github.salilvnair.flowsync.queue.PromptQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Holds the one outstanding request and arbitrates which source answers it. Local,
 * remote and queue submissions all funnel through {@link #accept} on the interaction
 * executor, so exactly one of them settles a request; the rest are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestBroker {

    private static final String UPSTREAM_CANCEL_REASON = "upstream cancelled";

    private final InteractionExecutor executor;
    private final PromptQueue promptQueue;
    private final SessionHistory sessionHistory;
    private final InteractionEventDispatcher dispatcher;
    private final ProcessingIndicator processingIndicator;

    private PendingRequest current;
    private CompletableFuture<ResolutionResult> currentSettlement;

    /**
     * Registers a request, superseding any request still pending. The returned future
     * completes exactly once; cancelling it cancels the request.
     */
    public CompletableFuture<ResolutionResult> register(RequestSpec spec) {
        if (spec == null || spec.getKind() == null) {
            throw new FlowSyncException(FlowSyncErrorCode.VALIDATION_FAILED, "Request kind is required");
        }
        return executor.call(() -> registerOnWriter(spec));
    }

    private CompletableFuture<ResolutionResult> registerOnWriter(RequestSpec spec) {
        String id = spec.getRequestId() == null || spec.getRequestId().isBlank()
                ? newRequestId(spec.getKind())
                : spec.getRequestId();
        if (current != null) {
            if (current.getId().equals(id)) {
                throw new FlowSyncException(FlowSyncErrorCode.REQUEST_CONFLICT,
                        "A request with id " + id + " is already pending");
            }
            log.info("Superseding pending request id={} with new {} request id={}",
                    current.getId(), spec.getKind().wireName(), id);
            settle(ResolutionResult.superseded());
        }

        PendingRequest request = PendingRequest.builder()
                .id(id)
                .kind(spec.getKind())
                .prompt(spec.getPrompt())
                .context(spec.getContext())
                .title(spec.getTitle())
                .choices(spec.getChoices())
                .questions(spec.getQuestions())
                .createdAtNanos(System.nanoTime())
                .createdAtMillis(System.currentTimeMillis())
                .build();
        CompletableFuture<ResolutionResult> settlement = new CompletableFuture<>();
        settlement.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                cancel(id, UPSTREAM_CANCEL_REASON);
            }
        });

        current = request;
        currentSettlement = settlement;
        processingIndicator.clear();
        log.info("Registered {} request id={} choices={}", request.getKind().wireName(), id, request.getChoices().size());
        dispatcher.dispatch(SyncEvent.pendingRequest(request));
        tryAutoConsumeFromQueue();
        return settlement;
    }

    public boolean submitLocal(String requestId, String value, List<AttachmentRef> attachments) {
        return submit(requestId, ResolutionResult.of(ResolutionSource.LOCAL, value, attachments));
    }

    public boolean submitRemote(String requestId, String value, List<AttachmentRef> attachments) {
        return submit(requestId, ResolutionResult.of(ResolutionSource.REMOTE, value, attachments));
    }

    /**
     * Human answer from a local or remote surface.
     *
     * @return {@code true} when this submission settled the request
     */
    public boolean submit(String requestId, ResolutionResult result) {
        if (result == null || (result.source() != ResolutionSource.LOCAL && result.source() != ResolutionSource.REMOTE)) {
            throw new IllegalArgumentException("Human submissions must come from a local or remote surface");
        }
        return executor.call(() -> accept(requestId, result));
    }

    /**
     * Answers the pending request with the queue head when the queue is enabled,
     * not paused and non-empty.
     */
    public boolean tryAutoConsumeFromQueue() {
        return executor.call(() -> {
            if (current == null) {
                return false;
            }
            if (!promptQueue.isEnabled() || promptQueue.isPaused() || promptQueue.isEmpty()) {
                return false;
            }
            Optional<QueueItem> head = promptQueue.dequeue();
            if (head.isEmpty()) {
                return false;
            }
            QueueItem item = head.get();
            log.info("Auto-answering request id={} from queue item id={}", current.getId(), item.id());
            return accept(current.getId(), ResolutionResult.of(ResolutionSource.QUEUE, item.text(), item.attachments()));
        });
    }

    public boolean cancel(String requestId, String reason) {
        return executor.call(() -> {
            if (current == null || !current.getId().equals(requestId)) {
                log.debug("Ignoring cancel for non-current request id={}", requestId);
                return false;
            }
            log.info("Cancelling request id={} reason={}", requestId, reason);
            settle(ResolutionResult.cancelled(reason));
            return true;
        });
    }

    public Optional<String> enqueuePrompt(String text, List<AttachmentRef> attachments) {
        return executor.call(() -> {
            Optional<String> id = promptQueue.enqueue(text, attachments);
            if (id.isPresent()) {
                tryAutoConsumeFromQueue();
            }
            return id;
        });
    }

    public void setQueuePaused(boolean paused) {
        executor.run(() -> {
            promptQueue.setPaused(paused);
            if (!paused) {
                tryAutoConsumeFromQueue();
            }
        });
    }

    public void setQueueEnabled(boolean enabled) {
        executor.run(() -> {
            promptQueue.setEnabled(enabled);
            if (enabled) {
                tryAutoConsumeFromQueue();
            }
        });
    }

    public Optional<PendingRequest> currentRequest() {
        return executor.call(() -> Optional.ofNullable(current));
    }

    public boolean hasPendingRequest() {
        return executor.call(() -> current != null);
    }

    private boolean accept(String requestId, ResolutionResult result) {
        if (current == null || !current.getId().equals(requestId)) {
            log.debug("Ignoring {} submission for stale request id={}", result.source().wireName(), requestId);
            return false;
        }
        settle(result);
        return true;
    }

    private void settle(ResolutionResult result) {
        PendingRequest resolved = current;
        CompletableFuture<ResolutionResult> settlement = currentSettlement;
        current = null;
        currentSettlement = null;

        settlement.complete(result);
        HistoryEntry entry = HistoryEntry.of(resolved, result, System.currentTimeMillis());
        try {
            sessionHistory.record(entry);
        } catch (Exception e) {
            log.warn("Failed to record history for request id={} msg={}", resolved.getId(), e.getMessage());
        }
        log.info("Resolved request id={} source={}", resolved.getId(), result.source().wireName());
        dispatcher.dispatch(SyncEvent.requestResolved(resolved.getId(), result.source(), entry));
        if (result.source().answered()) {
            processingIndicator.start();
        }
    }

    private String newRequestId(RequestKind kind) {
        String prefix = kind == RequestKind.PLAN_REVIEW ? "pr_" : "req_";
        return prefix + UUID.randomUUID();
    }
}
