package com.github.salilvnair.flowsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Question {
    private String header;
    private String question;
    private List<QuestionOption> options;
    private boolean multiSelect;
    private boolean allowFreeformInput;
}
