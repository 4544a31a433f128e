package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HistoryStatus {

    COMPLETED("completed"),
    CANCELLED("cancelled"),
    SUPERSEDED("superseded");

    private final String wireName;

    HistoryStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static HistoryStatus from(ResolutionSource source) {
        return switch (source) {
            case CANCELLED -> CANCELLED;
            case SUPERSEDED -> SUPERSEDED;
            default -> COMPLETED;
        };
    }
}
