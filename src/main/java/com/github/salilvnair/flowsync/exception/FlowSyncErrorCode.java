package com.github.salilvnair.flowsync.exception;

public enum FlowSyncErrorCode {

    // =========================
    // Request / arbitration errors
    // =========================
    REQUEST_CONFLICT(
            "A request with the same id is already pending",
            false
    ),

    // =========================
    // Tool input errors
    // =========================
    VALIDATION_FAILED(
            "Tool input failed validation",
            false
    ),

    // =========================
    // Sync / transport errors
    // =========================
    NOT_AUTHENTICATED(
            "Not authenticated",
            true
    ),

    MALFORMED_FRAME(
            "Malformed sync frame",
            true
    ),

    UNKNOWN_MESSAGE_TYPE(
            "Unknown message type",
            true
    ),

    // =========================
    // Executor errors
    // =========================
    EXECUTOR_UNAVAILABLE(
            "Interaction executor is shut down",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal flowsync error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    FlowSyncErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
