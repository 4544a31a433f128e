package com.github.salilvnair.flowsync.event;

import com.github.salilvnair.flowsync.model.HistoryEntry;
import com.github.salilvnair.flowsync.model.PendingRequest;
import com.github.salilvnair.flowsync.model.ResolutionSource;
import com.github.salilvnair.flowsync.queue.QueueState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A state change every surface must observe. The vocabulary is closed; use the factories.
 */
public record SyncEvent(SyncEventType type, Map<String, Object> payload) {

    public SyncEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static SyncEvent pendingRequest(PendingRequest request) {
        return new SyncEvent(SyncEventType.PENDING_REQUEST, Map.of("request", request));
    }

    public static SyncEvent requestResolved(String requestId, ResolutionSource source, HistoryEntry entry) {
        return new SyncEvent(SyncEventType.REQUEST_RESOLVED, Map.of(
                "id", requestId,
                "source", source,
                "entry", entry));
    }

    public static SyncEvent queueUpdated(QueueState state) {
        return new SyncEvent(SyncEventType.QUEUE_UPDATED, Map.of(
                "queue", state.items(),
                "queueEnabled", state.enabled(),
                "queuePaused", state.paused()));
    }

    public static SyncEvent processingChanged(boolean processing, String reason) {
        return new SyncEvent(SyncEventType.PROCESSING_CHANGED, Map.of(
                "processing", processing,
                "reason", reason == null ? "" : reason));
    }

    /**
     * Flat wire shape: {@code {type, ...payload}}.
     */
    public Map<String, Object> toMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type.wireName());
        message.putAll(payload);
        return message;
    }
}
