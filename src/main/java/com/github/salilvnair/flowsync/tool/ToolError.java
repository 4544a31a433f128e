package com.github.salilvnair.flowsync.tool;

import com.github.salilvnair.flowsync.exception.FlowSyncErrorCode;
import com.github.salilvnair.flowsync.exception.FlowSyncException;

public record ToolError(String code, String message, boolean recoverable) {

    public static ToolError of(FlowSyncErrorCode code) {
        return new ToolError(code.name(), code.defaultMessage(), code.recoverable());
    }

    public static ToolError of(FlowSyncErrorCode code, String message) {
        return new ToolError(code.name(), message, code.recoverable());
    }

    public static ToolError of(FlowSyncException exception) {
        return new ToolError(exception.getErrorCode(), exception.getMessage(), exception.isRecoverable());
    }
}
