package com.github.salilvnair.flowsync.api.dto;

import com.github.salilvnair.flowsync.model.Question;
import lombok.Data;

import java.util.List;

@Data
public class AskQuestionsRequest {

    private List<Question> questions;
}
