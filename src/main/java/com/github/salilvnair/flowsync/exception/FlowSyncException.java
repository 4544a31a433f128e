package com.github.salilvnair.flowsync.exception;

import lombok.Getter;

@Getter
public class FlowSyncException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;

    public FlowSyncException(FlowSyncErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FlowSyncException(FlowSyncErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FlowSyncException(FlowSyncErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }
}
