package com.github.salilvnair.flowsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a tool invocation asks the broker to put in front of the human.
 * {@code requestId} is optional; the broker generates a fresh id when absent.
 */
@Value
@Builder
public class RequestSpec {
    String requestId;
    RequestKind kind;
    String prompt;
    String context;
    String title;
    @Singular
    List<Choice> choices;
    @Singular
    List<Question> questions;
}
