package com.github.salilvnair.flowsync.broker;

import com.github.salilvnair.flowsync.config.FlowSyncConfig;
import com.github.salilvnair.flowsync.event.InteractionEventDispatcher;
import com.github.salilvnair.flowsync.event.SyncEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * "Agent is working" flag shown between an answer and the agent's next request.
 * Cleared by the next registration, or by a timeout when the agent goes quiet.
 * State is owned by the interaction executor; the timer only hops back onto it.
 */
@Slf4j
@Component
public class ProcessingIndicator {

    static final String REASON_ANSWERED = "answered";
    static final String REASON_REQUEST = "request";
    static final String REASON_TIMEOUT = "timeout";

    private final InteractionExecutor executor;
    private final InteractionEventDispatcher dispatcher;
    private final long timeoutMs;
    private final ScheduledExecutorService timer;

    private boolean processing;
    private long generation;
    private ScheduledFuture<?> pendingTimeout;

    public ProcessingIndicator(InteractionExecutor executor, InteractionEventDispatcher dispatcher, FlowSyncConfig config) {
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.timeoutMs = config.getBroker().getProcessingTimeoutMs();
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "flowsync-processing-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        executor.run(() -> {
            long current = ++generation;
            cancelTimeout();
            if (!processing) {
                processing = true;
                dispatcher.dispatch(SyncEvent.processingChanged(true, REASON_ANSWERED));
            }
            if (timeoutMs > 0) {
                pendingTimeout = timer.schedule(() -> executor.execute(() -> expire(current)), timeoutMs, TimeUnit.MILLISECONDS);
            }
        });
    }

    public void clear() {
        executor.run(() -> {
            generation++;
            cancelTimeout();
            if (processing) {
                processing = false;
                dispatcher.dispatch(SyncEvent.processingChanged(false, REASON_REQUEST));
            }
        });
    }

    public boolean isProcessing() {
        return executor.call(() -> processing);
    }

    private void expire(long expectedGeneration) {
        if (expectedGeneration != generation || !processing) {
            return;
        }
        processing = false;
        pendingTimeout = null;
        log.info("Processing indicator timed out after {} ms without a new request", timeoutMs);
        dispatcher.dispatch(SyncEvent.processingChanged(false, REASON_TIMEOUT));
    }

    private void cancelTimeout() {
        if (pendingTimeout != null) {
            pendingTimeout.cancel(false);
            pendingTimeout = null;
        }
    }

    @PreDestroy
    public void shutdown() {
        timer.shutdownNow();
    }
}
