package com.github.salilvnair.flowsync.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(boolean success, String id, String message) {

    public static OperationResponse of(boolean success) {
        return new OperationResponse(success, null, null);
    }

    public static OperationResponse withId(String id) {
        return new OperationResponse(true, id, null);
    }

    public static OperationResponse failed(String message) {
        return new OperationResponse(false, null, message);
    }
}
