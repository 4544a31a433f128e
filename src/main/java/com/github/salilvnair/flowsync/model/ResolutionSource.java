package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResolutionSource {

    LOCAL("local"),
    REMOTE("remote"),
    QUEUE("queue"),
    CANCELLED("cancelled"),
    SUPERSEDED("superseded");

    private final String wireName;

    ResolutionSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * {@code true} when a human (or a human-authored queue item) answered the request.
     */
    public boolean answered() {
        return this == LOCAL || this == REMOTE || this == QUEUE;
    }
}
