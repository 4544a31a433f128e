package com.github.salilvnair.flowsync.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.flowsync.model.QuestionAnswer;
import com.github.salilvnair.flowsync.model.ResolutionSource;

import java.util.List;

/**
 * Structured answers when the human filled the form; {@code response} always carries
 * the raw value, which is the only content for queue answers and cancellations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AskQuestionsResult(
        List<QuestionAnswer> answers,
        String response,
        ResolutionSource source,
        ToolError error
) {

    public AskQuestionsResult {
        answers = answers == null ? List.of() : List.copyOf(answers);
    }

    public static AskQuestionsResult failed(ToolError error) {
        return new AskQuestionsResult(List.of(), "", null, error);
    }
}
