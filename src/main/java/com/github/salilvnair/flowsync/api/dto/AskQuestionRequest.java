package com.github.salilvnair.flowsync.api.dto;

import com.github.salilvnair.flowsync.model.Choice;
import lombok.Data;

import java.util.List;

@Data
public class AskQuestionRequest {

    private String question;
    private String context;
    private List<Choice> choices;
}
