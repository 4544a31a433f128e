package com.github.salilvnair.flowsync.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.flowsync.model.PlanRevision;
import com.github.salilvnair.flowsync.model.ResolutionSource;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanReviewResult(
        String reviewId,
        PlanReviewStatus status,
        List<PlanRevision> revisions,
        ResolutionSource source,
        ToolError error
) {

    public PlanReviewResult {
        revisions = revisions == null ? List.of() : List.copyOf(revisions);
    }

    public static PlanReviewResult failed(ToolError error) {
        return new PlanReviewResult("", PlanReviewStatus.CANCELLED, List.of(), null, error);
    }
}
