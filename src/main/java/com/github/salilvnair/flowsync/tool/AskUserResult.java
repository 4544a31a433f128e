package com.github.salilvnair.flowsync.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.flowsync.model.AttachmentRef;
import com.github.salilvnair.flowsync.model.ResolutionSource;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AskUserResult(
        String response,
        List<AttachmentRef> attachments,
        ResolutionSource source,
        boolean queued,
        ToolError error
) {

    public AskUserResult {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static AskUserResult failed(ToolError error) {
        return new AskUserResult("", List.of(), null, false, error);
    }
}
