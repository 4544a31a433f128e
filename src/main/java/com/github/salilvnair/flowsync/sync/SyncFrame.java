package com.github.salilvnair.flowsync.sync;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire envelope for every frame in both directions: {@code {event, data}}.
 */
public record SyncFrame(String event, JsonNode data) {

    public static final String AUTHENTICATE = "authenticate";
    public static final String AUTHENTICATED = "authenticated";
    public static final String GET_STATE = "getState";
    public static final String STATE = "state";
    public static final String MESSAGE = "message";
    public static final String ERROR = "error";
}
