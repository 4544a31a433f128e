package com.github.salilvnair.flowsync.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncEventType {
    PENDING_REQUEST("pendingRequest"),
    REQUEST_RESOLVED("requestResolved"),
    QUEUE_UPDATED("queueUpdated"),
    PROCESSING_CHANGED("processingChanged");

    private final String wireName;

    SyncEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
