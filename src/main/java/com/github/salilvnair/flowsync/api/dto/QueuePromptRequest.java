package com.github.salilvnair.flowsync.api.dto;

import com.github.salilvnair.flowsync.model.AttachmentRef;
import lombok.Data;

import java.util.List;

@Data
public class QueuePromptRequest {

    private String text;
    private List<AttachmentRef> attachments;
}
