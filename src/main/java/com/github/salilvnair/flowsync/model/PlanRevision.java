package com.github.salilvnair.flowsync.model;

public record PlanRevision(
        String revisedPart,
        String revisorInstructions
) {}
