package com.github.salilvnair.flowsync.api.controller;

import com.github.salilvnair.flowsync.api.dto.AskQuestionRequest;
import com.github.salilvnair.flowsync.api.dto.AskQuestionsRequest;
import com.github.salilvnair.flowsync.api.dto.OperationResponse;
import com.github.salilvnair.flowsync.api.dto.PlanReviewRequest;
import com.github.salilvnair.flowsync.api.dto.SubmitResponseRequest;
import com.github.salilvnair.flowsync.broker.RequestBroker;
import com.github.salilvnair.flowsync.model.ResolutionResult;
import com.github.salilvnair.flowsync.model.ResolutionSource;
import com.github.salilvnair.flowsync.sync.SyncHub;
import com.github.salilvnair.flowsync.sync.SyncSnapshot;
import com.github.salilvnair.flowsync.tool.AskQuestionsResult;
import com.github.salilvnair.flowsync.tool.AskUserResult;
import com.github.salilvnair.flowsync.tool.InteractiveToolService;
import com.github.salilvnair.flowsync.tool.PlanReviewResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.concurrent.CompletableFuture;

/**
 * Agent-facing tool endpoints plus the local surface's submit/cancel. Tool calls stay
 * open until answered; a dropped HTTP call cancels its request.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/flowsync")
@RequiredArgsConstructor
public class InteractionController {

    private static final long NO_TIMEOUT = 0L;

    private final InteractiveToolService toolService;
    private final RequestBroker requestBroker;
    private final SyncHub syncHub;

    @PostMapping("/ask")
    public DeferredResult<AskUserResult> ask(@RequestBody AskQuestionRequest request) {
        return bind(toolService.askQuestion(request.getQuestion(), request.getContext(), request.getChoices()));
    }

    @PostMapping("/ask-questions")
    public DeferredResult<AskQuestionsResult> askQuestions(@RequestBody AskQuestionsRequest request) {
        return bind(toolService.askQuestions(request.getQuestions()));
    }

    @PostMapping("/plan-review")
    public DeferredResult<PlanReviewResult> planReview(@RequestBody PlanReviewRequest request) {
        return bind(toolService.reviewPlan(request.getPlan(), request.getTitle()));
    }

    @PostMapping("/requests/{id}/respond")
    public OperationResponse respond(@PathVariable("id") String id, @RequestBody SubmitResponseRequest request) {
        boolean accepted = requestBroker.submit(id, new ResolutionResult(
                ResolutionSource.LOCAL,
                request.getValue(),
                request.getAttachments(),
                request.getRevisions()));
        return accepted ? OperationResponse.of(true) : OperationResponse.failed("Request is no longer pending");
    }

    @PostMapping("/requests/{id}/cancel")
    public OperationResponse cancel(@PathVariable("id") String id,
                                    @RequestParam(name = "reason", defaultValue = "cancelled by user") String reason) {
        return OperationResponse.of(requestBroker.cancel(id, reason));
    }

    @GetMapping("/state")
    public SyncSnapshot state() {
        return syncHub.getFullState();
    }

    private <T> DeferredResult<T> bind(CompletableFuture<T> future) {
        DeferredResult<T> deferred = new DeferredResult<>(NO_TIMEOUT);
        future.whenComplete((result, error) -> {
            if (error != null) {
                deferred.setErrorResult(error);
            } else {
                deferred.setResult(result);
            }
        });
        Runnable cancelUpstream = () -> {
            if (!future.isDone()) {
                log.info("HTTP tool call ended before an answer arrived; cancelling request");
                future.cancel(true);
            }
        };
        deferred.onTimeout(cancelUpstream);
        deferred.onError(error -> cancelUpstream.run());
        return deferred;
    }
}
