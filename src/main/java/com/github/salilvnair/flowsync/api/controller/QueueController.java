package com.github.salilvnair.flowsync.api.controller;

import com.github.salilvnair.flowsync.api.dto.OperationResponse;
import com.github.salilvnair.flowsync.api.dto.QueuePromptRequest;
import com.github.salilvnair.flowsync.api.dto.QueueReorderRequest;
import com.github.salilvnair.flowsync.broker.RequestBroker;
import com.github.salilvnair.flowsync.queue.PromptQueue;
import com.github.salilvnair.flowsync.queue.QueueState;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/flowsync/queue")
@RequiredArgsConstructor
public class QueueController {

    private final PromptQueue promptQueue;
    private final RequestBroker requestBroker;

    @GetMapping
    public QueueState queue() {
        return promptQueue.state();
    }

    @PostMapping
    public OperationResponse add(@RequestBody QueuePromptRequest request) {
        return requestBroker.enqueuePrompt(request.getText(), request.getAttachments())
                .map(OperationResponse::withId)
                .orElseGet(() -> OperationResponse.failed("Prompt is empty or too long"));
    }

    @PutMapping("/{id}")
    public OperationResponse edit(@PathVariable("id") String id, @RequestBody QueuePromptRequest request) {
        return OperationResponse.of(promptQueue.edit(id, request.getText()));
    }

    @DeleteMapping("/{id}")
    public OperationResponse remove(@PathVariable("id") String id) {
        return OperationResponse.of(promptQueue.remove(id));
    }

    @PostMapping("/reorder")
    public OperationResponse reorder(@RequestBody QueueReorderRequest request) {
        return OperationResponse.of(promptQueue.reorder(request.getFromIndex(), request.getToIndex()));
    }

    @DeleteMapping
    public OperationResponse clear() {
        promptQueue.clear();
        return OperationResponse.of(true);
    }

    @PostMapping("/pause")
    public OperationResponse pause() {
        requestBroker.setQueuePaused(true);
        return OperationResponse.of(true);
    }

    @PostMapping("/resume")
    public OperationResponse resume() {
        requestBroker.setQueuePaused(false);
        return OperationResponse.of(true);
    }

    @PostMapping("/enabled")
    public OperationResponse enable(@RequestParam("value") boolean value) {
        requestBroker.setQueueEnabled(value);
        return OperationResponse.of(true);
    }
}
