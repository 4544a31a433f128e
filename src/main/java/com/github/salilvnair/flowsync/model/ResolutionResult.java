package com.github.salilvnair.flowsync.model;

import java.util.List;

public record ResolutionResult(
        ResolutionSource source,
        String value,
        List<AttachmentRef> attachments,
        List<PlanRevision> revisions
) {

    public ResolutionResult {
        value = value == null ? "" : value;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        revisions = revisions == null ? List.of() : List.copyOf(revisions);
    }

    public static ResolutionResult of(ResolutionSource source, String value, List<AttachmentRef> attachments) {
        return new ResolutionResult(source, value, attachments, List.of());
    }

    public static ResolutionResult cancelled(String reason) {
        return new ResolutionResult(ResolutionSource.CANCELLED, "[CANCELLED: " + reason + "]", List.of(), List.of());
    }

    public static ResolutionResult superseded() {
        return new ResolutionResult(ResolutionSource.SUPERSEDED, "[SUPERSEDED: a newer request replaced this one]", List.of(), List.of());
    }
}
