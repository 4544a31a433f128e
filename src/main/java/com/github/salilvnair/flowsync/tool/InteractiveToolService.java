package com.github.salilvnair.flowsync.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.flowsync.broker.RequestBroker;
import com.github.salilvnair.flowsync.choice.ApprovalDetector;
import com.github.salilvnair.flowsync.choice.ChoiceParser;
import com.github.salilvnair.flowsync.exception.FlowSyncErrorCode;
import com.github.salilvnair.flowsync.exception.FlowSyncException;
import com.github.salilvnair.flowsync.model.Choice;
import com.github.salilvnair.flowsync.model.PlanRevision;
import com.github.salilvnair.flowsync.model.Question;
import com.github.salilvnair.flowsync.model.QuestionAnswer;
import com.github.salilvnair.flowsync.model.QuestionOption;
import com.github.salilvnair.flowsync.model.RequestKind;
import com.github.salilvnair.flowsync.model.RequestSpec;
import com.github.salilvnair.flowsync.model.ResolutionResult;
import com.github.salilvnair.flowsync.model.ResolutionSource;
import com.github.salilvnair.flowsync.queue.PromptQueue;
import com.github.salilvnair.flowsync.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * The agent-facing operations. Each call registers one request with the broker and
 * completes when a human (or the queue) answers it. Failures come back as results
 * carrying a {@link ToolError}; nothing here throws to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractiveToolService {

    static final String ATTACHMENT_ONLY_HEADER = "(User attached the following files/context without additional text)";
    static final String DEFAULT_PLAN_TITLE = "Plan Review";

    private static final int MAX_QUESTIONS = 10;
    private static final int MAX_HEADER_LENGTH = 50;
    private static final int MAX_QUESTION_LENGTH = 2000;
    private static final int MAX_OPTIONS = 20;
    private static final int MAX_OPTION_LABEL_LENGTH = 200;
    private static final int MAX_OPTION_DESCRIPTION_LENGTH = 500;
    private static final int MAX_SELECTED_OPTIONS = 20;
    private static final int MAX_FREEFORM_LENGTH = 5000;

    private final RequestBroker requestBroker;
    private final PromptQueue promptQueue;
    private final ChoiceParser choiceParser;
    private final ApprovalDetector approvalDetector;

    public CompletableFuture<AskUserResult> askQuestion(String prompt, String context, List<Choice> choices) {
        if (prompt == null || prompt.isBlank()) {
            return CompletableFuture.completedFuture(AskUserResult.failed(
                    ToolError.of(FlowSyncErrorCode.VALIDATION_FAILED, "Question is required")));
        }
        List<Choice> resolvedChoices = choiceParser.normalize(choices);
        if (resolvedChoices.isEmpty()) {
            resolvedChoices = choiceParser.choices(prompt);
        }
        RequestKind kind = resolvedChoices.isEmpty() && approvalDetector.isApprovalQuestion(prompt)
                ? RequestKind.APPROVAL
                : RequestKind.QUESTION;
        RequestSpec spec = RequestSpec.builder()
                .kind(kind)
                .prompt(prompt)
                .context(context)
                .choices(resolvedChoices)
                .build();
        boolean queued = promptQueue.isEnabled();
        try {
            return relay(requestBroker.register(spec), result -> toAskUserResult(result, queued));
        } catch (FlowSyncException e) {
            log.warn("askQuestion registration failed code={} msg={}", e.getErrorCode(), e.getMessage());
            return CompletableFuture.completedFuture(AskUserResult.failed(ToolError.of(e)));
        }
    }

    public CompletableFuture<AskQuestionsResult> askQuestions(List<Question> questions) {
        List<Question> sanitized = sanitize(questions);
        if (sanitized.isEmpty()) {
            return CompletableFuture.completedFuture(AskQuestionsResult.failed(
                    ToolError.of(FlowSyncErrorCode.VALIDATION_FAILED, "No valid questions provided")));
        }
        if (sanitized.size() == 1) {
            Question only = sanitized.get(0);
            List<Choice> choices = only.getOptions() == null ? List.of() : only.getOptions().stream()
                    .map(option -> new Choice(option.getLabel(), option.getLabel()))
                    .toList();
            return relay(askQuestion(only.getQuestion(), null, choices), result -> singleAnswer(only, result));
        }

        RequestSpec spec = RequestSpec.builder()
                .kind(RequestKind.MULTI_QUESTION)
                .prompt(combinedPrompt(sanitized))
                .questions(sanitized)
                .build();
        try {
            return relay(requestBroker.register(spec), this::toAskQuestionsResult);
        } catch (FlowSyncException e) {
            log.warn("askQuestions registration failed code={} msg={}", e.getErrorCode(), e.getMessage());
            return CompletableFuture.completedFuture(AskQuestionsResult.failed(ToolError.of(e)));
        }
    }

    public CompletableFuture<PlanReviewResult> reviewPlan(String plan, String title) {
        if (plan == null || plan.isBlank()) {
            return CompletableFuture.completedFuture(PlanReviewResult.failed(
                    ToolError.of(FlowSyncErrorCode.VALIDATION_FAILED, "Plan content is required and cannot be empty")));
        }
        String reviewId = "pr_" + UUID.randomUUID();
        RequestSpec spec = RequestSpec.builder()
                .requestId(reviewId)
                .kind(RequestKind.PLAN_REVIEW)
                .prompt(plan)
                .title(title == null || title.isBlank() ? DEFAULT_PLAN_TITLE : title.trim())
                .build();
        try {
            return relay(requestBroker.register(spec), result -> toPlanReviewResult(reviewId, result));
        } catch (FlowSyncException e) {
            log.warn("reviewPlan registration failed code={} msg={}", e.getErrorCode(), e.getMessage());
            return CompletableFuture.completedFuture(PlanReviewResult.failed(ToolError.of(e)));
        }
    }

    /**
     * Maps a settlement while keeping cancellation flowing back to it, so an abandoned
     * tool call cancels its pending request.
     */
    private static <S, T> CompletableFuture<T> relay(CompletableFuture<S> source, Function<S, T> mapper) {
        CompletableFuture<T> mapped = source.thenApply(mapper);
        mapped.whenComplete((value, error) -> {
            if (error instanceof CancellationException) {
                source.cancel(true);
            }
        });
        return mapped;
    }

    private AskUserResult toAskUserResult(ResolutionResult result, boolean queued) {
        String response = result.value();
        if (!result.attachments().isEmpty() && response.isBlank()) {
            response = ATTACHMENT_ONLY_HEADER;
        }
        return new AskUserResult(response, result.attachments(), result.source(), queued, null);
    }

    private AskQuestionsResult singleAnswer(Question question, AskUserResult result) {
        if (result.error() != null) {
            return AskQuestionsResult.failed(result.error());
        }
        if (result.source() == null || !result.source().answered()) {
            return new AskQuestionsResult(List.of(), result.response(), result.source(), null);
        }
        boolean matchesOption = question.getOptions() != null && question.getOptions().stream()
                .anyMatch(option -> Objects.equals(option.getLabel(), result.response()));
        QuestionAnswer answer = matchesOption
                ? new QuestionAnswer(question.getHeader(), List.of(result.response()), null)
                : new QuestionAnswer(question.getHeader(), List.of(), result.response());
        return new AskQuestionsResult(List.of(answer), result.response(), result.source(), null);
    }

    private AskQuestionsResult toAskQuestionsResult(ResolutionResult result) {
        List<QuestionAnswer> answers = result.source().answered() ? parseAnswers(result.value()) : List.of();
        return new AskQuestionsResult(answers, result.value(), result.source(), null);
    }

    private PlanReviewResult toPlanReviewResult(String reviewId, ResolutionResult result) {
        if (!result.source().answered()) {
            return new PlanReviewResult(reviewId, PlanReviewStatus.CANCELLED, List.of(), result.source(), null);
        }
        return PlanReviewStatus.fromWire(result.value())
                .map(status -> new PlanReviewResult(reviewId, status, result.revisions(), result.source(), null))
                .orElseGet(() -> {
                    // free text (typically a queued prompt) is treated as revision instructions
                    List<PlanRevision> revisions = new ArrayList<>(result.revisions());
                    if (!result.value().isBlank()) {
                        revisions.add(new PlanRevision("", result.value()));
                    }
                    return new PlanReviewResult(reviewId, PlanReviewStatus.RECREATE_WITH_CHANGES, revisions, result.source(), null);
                });
    }

    static List<QuestionAnswer> parseAnswers(String value) {
        JsonNode answers = JsonUtil.parseOrNull(value).path("answers");
        if (!answers.isArray()) {
            return List.of();
        }
        List<QuestionAnswer> parsed = new ArrayList<>();
        for (JsonNode answer : answers) {
            String header = JsonUtil.text(answer, "header");
            if (header == null) {
                header = JsonUtil.text(answer, "question");
            }
            JsonNode selectedNode = answer.has("selectedOptions") ? answer.get("selectedOptions") : answer.get("selected");
            List<String> selected = new ArrayList<>();
            if (selectedNode != null && selectedNode.isArray()) {
                for (JsonNode option : selectedNode) {
                    if (selected.size() < MAX_SELECTED_OPTIONS) {
                        selected.add(truncate(option.asText(), MAX_OPTION_DESCRIPTION_LENGTH));
                    }
                }
            }
            String freeform = JsonUtil.text(answer, "freeformText");
            parsed.add(new QuestionAnswer(
                    header == null ? "Unknown" : truncate(header, 100),
                    selected,
                    freeform == null ? null : truncate(freeform, MAX_FREEFORM_LENGTH)));
        }
        return parsed;
    }

    static List<Question> sanitize(List<Question> questions) {
        if (questions == null) {
            return List.of();
        }
        return questions.stream()
                .filter(Objects::nonNull)
                .limit(MAX_QUESTIONS)
                .map(InteractiveToolService::sanitize)
                .toList();
    }

    private static Question sanitize(Question question) {
        String header = question.getHeader() == null || question.getHeader().isBlank() ? "Question" : question.getHeader();
        List<QuestionOption> options = question.getOptions() == null ? null : question.getOptions().stream()
                .filter(Objects::nonNull)
                .limit(MAX_OPTIONS)
                .map(option -> QuestionOption.builder()
                        .label(truncate(option.getLabel() == null ? "" : option.getLabel(), MAX_OPTION_LABEL_LENGTH))
                        .description(option.getDescription() == null ? null : truncate(option.getDescription(), MAX_OPTION_DESCRIPTION_LENGTH))
                        .recommended(option.isRecommended())
                        .build())
                .toList();
        return Question.builder()
                .header(truncate(header, MAX_HEADER_LENGTH))
                .question(truncate(question.getQuestion() == null ? "" : question.getQuestion(), MAX_QUESTION_LENGTH))
                .options(options)
                .multiSelect(question.isMultiSelect())
                .allowFreeformInput(question.isAllowFreeformInput())
                .build();
    }

    static String combinedPrompt(List<Question> questions) {
        StringBuilder prompt = new StringBuilder();
        for (int i = 0; i < questions.size(); i++) {
            if (i > 0) {
                prompt.append('\n');
            }
            Question question = questions.get(i);
            prompt.append(i + 1).append(". [").append(question.getHeader()).append("] ").append(question.getQuestion());
        }
        return prompt.toString();
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }
}
