package com.github.salilvnair.flowsync.sync;

import java.util.Arrays;
import java.util.Optional;

/**
 * Inbound {@code message} frame types a remote client may send.
 */
public enum ClientMessageType {
    SUBMIT_RESPONSE("submitResponse"),
    CANCEL_REQUEST("cancelRequest"),
    QUEUE_ADD("queueAdd"),
    QUEUE_EDIT("queueEdit"),
    QUEUE_REMOVE("queueRemove"),
    QUEUE_REORDER("queueReorder"),
    QUEUE_CLEAR("queueClear"),
    SET_PAUSED("setPaused"),
    SET_ENABLED("setEnabled");

    private final String wireName;

    ClientMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ClientMessageType> fromWire(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value))
                .findFirst();
    }
}
