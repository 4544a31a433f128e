package com.github.salilvnair.flowsync.api.dto;

import com.github.salilvnair.flowsync.model.AttachmentRef;
import com.github.salilvnair.flowsync.model.PlanRevision;
import lombok.Data;

import java.util.List;

@Data
public class SubmitResponseRequest {

    private String value;
    private List<AttachmentRef> attachments;
    private List<PlanRevision> revisions;
}
