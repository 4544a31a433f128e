package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Completion record of one resolved request.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record HistoryEntry(
        String id,
        RequestKind kind,
        String prompt,
        String context,
        String response,
        HistoryStatus status,
        boolean fromQueue,
        long timestamp,
        List<AttachmentRef> attachments
) {

    public HistoryEntry {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static HistoryEntry of(PendingRequest request, ResolutionResult result, long timestamp) {
        return new HistoryEntry(
                request.getId(),
                request.getKind(),
                request.getPrompt(),
                request.getContext(),
                result.value(),
                HistoryStatus.from(result.source()),
                result.source() == ResolutionSource.QUEUE,
                timestamp,
                result.attachments());
    }
}
