package com.github.salilvnair.flowsync.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.flowsync.model.HistoryEntry;
import com.github.salilvnair.flowsync.model.PendingRequest;
import com.github.salilvnair.flowsync.model.QueueItem;

import java.util.List;

/**
 * Complete interaction state sent to a client on authentication and on demand.
 * {@code pendingRequest} is serialized as an explicit {@code null} when nothing is pending.
 */
public record SyncSnapshot(
        @JsonInclude(JsonInclude.Include.ALWAYS) PendingRequest pendingRequest,
        List<QueueItem> queue,
        boolean queueEnabled,
        boolean queuePaused,
        boolean processing,
        List<HistoryEntry> history
) {

    public SyncSnapshot {
        queue = queue == null ? List.of() : List.copyOf(queue);
        history = history == null ? List.of() : List.copyOf(history);
    }
}
