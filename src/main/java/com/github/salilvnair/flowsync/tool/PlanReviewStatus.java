package com.github.salilvnair.flowsync.tool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum PlanReviewStatus {
    APPROVED("approved"),
    APPROVED_WITH_COMMENTS("approvedWithComments"),
    RECREATE_WITH_CHANGES("recreateWithChanges"),
    CANCELLED("cancelled");

    private final String wireName;

    PlanReviewStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<PlanReviewStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(status -> status.wireName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
