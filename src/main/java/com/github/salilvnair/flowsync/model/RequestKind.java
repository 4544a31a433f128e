package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestKind {

    QUESTION("question"),
    APPROVAL("approval"),
    MULTI_QUESTION("multi-question"),
    PLAN_REVIEW("plan-review");

    private final String wireName;

    RequestKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
