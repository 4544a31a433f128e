package com.github.salilvnair.flowsync.broker;

import com.github.salilvnair.flowsync.config.FlowSyncConfig;
import com.github.salilvnair.flowsync.exception.FlowSyncErrorCode;
import com.github.salilvnair.flowsync.exception.FlowSyncException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single writer for all broker, queue and processing state. Every mutation of that
 * state is funneled through this thread, so arbitration needs no further locking.
 * Calls made from the writer thread itself run inline.
 */
@Slf4j
@Component
public class InteractionExecutor {

    private final ExecutorService executor;
    private volatile Thread writerThread;

    public InteractionExecutor(FlowSyncConfig config) {
        String threadName = config.getBroker().getWriterThreadName();
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            writerThread = thread;
            return thread;
        });
    }

    public boolean isWriterThread() {
        return Thread.currentThread() == writerThread;
    }

    public <T> T call(Supplier<T> action) {
        if (isWriterThread()) {
            return action.get();
        }
        Future<T> future;
        try {
            future = executor.submit(action::get);
        } catch (RejectedExecutionException e) {
            throw new FlowSyncException(FlowSyncErrorCode.EXECUTOR_UNAVAILABLE);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowSyncException(FlowSyncErrorCode.INTERNAL_ERROR, "Interrupted while waiting for the interaction executor", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new FlowSyncException(FlowSyncErrorCode.INTERNAL_ERROR, "Interaction executor task failed", cause);
        }
    }

    public void run(Runnable action) {
        call(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Fire-and-forget hop onto the writer thread, used by timers.
     */
    public void execute(Runnable action) {
        try {
            executor.execute(() -> {
                try {
                    action.run();
                } catch (Exception e) {
                    log.warn("Interaction executor task failed msg={}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Interaction executor rejected task after shutdown");
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
