package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionAnswer(
        String header,
        List<String> selectedOptions,
        String freeformText
) {}
