package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record QueueItem(
        String id,
        String text,
        List<AttachmentRef> attachments
) {

    public QueueItem {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public QueueItem withText(String newText) {
        return new QueueItem(id, newText, attachments);
    }
}
