package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The single request currently awaiting a human answer. Immutable once registered;
 * only its resolution is recorded, separately, by the broker.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class PendingRequest {
    String id;
    RequestKind kind;
    String prompt;
    String context;
    String title;
    @Singular
    List<Choice> choices;
    @Singular
    List<Question> questions;
    @JsonIgnore
    long createdAtNanos;
    long createdAtMillis;

    public boolean isApprovalQuestion() {
        return kind == RequestKind.APPROVAL;
    }
}
