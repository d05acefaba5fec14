/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.apiflow.rest;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.control.ExecutionControlService;
import org.fireflyframework.apiflow.core.ExecutionSubmitter;
import org.fireflyframework.apiflow.exception.ExecutionConflictException;
import org.fireflyframework.apiflow.exception.ExecutionNotFoundException;
import org.fireflyframework.apiflow.exception.InvalidExecutionStateException;
import org.fireflyframework.apiflow.exception.StoreConsistencyException;
import org.fireflyframework.apiflow.exception.WorkflowNotActiveException;
import org.fireflyframework.apiflow.exception.WorkflowNotFoundException;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionProgress;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.rest.dto.ExecutionActionRequest;
import org.fireflyframework.apiflow.rest.dto.ExecutionStatusResponse;
import org.fireflyframework.apiflow.rest.dto.SubmitExecutionRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller for workflow executions.
 * <p>
 * This controller is a thin layer over {@link ExecutionSubmitter} and
 * {@link ExecutionControlService}. Errors map to status codes:
 * <ul>
 *   <li>unknown execution or workflow: 404</li>
 *   <li>action not allowed in the current state, inactive workflow: 400</li>
 *   <li>action on a terminal execution, lost concurrent update: 409</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("${firefly.apiflow.api.base-path:/api/v1/apiflow}")
public class ExecutionController {

    private final ExecutionSubmitter submitter;
    private final ExecutionControlService controlService;

    public ExecutionController(ExecutionSubmitter submitter, ExecutionControlService controlService) {
        this.submitter = submitter;
        this.controlService = controlService;
    }

    /**
     * Submits a new execution of a workflow.
     */
    @PostMapping("/workflows/{workflowId}/executions")
    public Mono<ResponseEntity<ExecutionStatusResponse>> submit(
            @PathVariable String workflowId,
            @Valid @RequestBody(required = false) SubmitExecutionRequest request) {

        if (request == null) {
            request = new SubmitExecutionRequest();
        }
        log.info("Submitting execution via API: workflowId={}, userId={}", workflowId, request.getUserId());

        return submitter.submit(workflowId, request.getUserId(), request.getParameters(), request.getMaxAttempts())
                .map(execution -> ResponseEntity.status(HttpStatus.CREATED).body(ExecutionStatusResponse.from(execution)))
                .onErrorResume(WorkflowNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()))
                .onErrorResume(WorkflowNotActiveException.class, e ->
                        Mono.just(ResponseEntity.badRequest().build()));
    }

    /**
     * Gets the last committed state of an execution.
     */
    @GetMapping("/executions/{executionId}")
    public Mono<ResponseEntity<ExecutionStatusResponse>> getStatus(@PathVariable String executionId) {
        return toResponse(controlService.getStatus(executionId));
    }

    @GetMapping("/executions/{executionId}/progress")
    public Mono<ResponseEntity<ExecutionProgress>> getProgress(@PathVariable String executionId) {
        return controlService.getProgress(executionId)
                .map(ResponseEntity::ok)
                .onErrorResume(ExecutionNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()));
    }

    @GetMapping("/executions/{executionId}/logs")
    public Mono<ResponseEntity<List<ExecutionLog>>> getLogs(@PathVariable String executionId) {
        return controlService.getLogs(executionId)
                .collectList()
                .map(ResponseEntity::ok)
                .onErrorResume(ExecutionNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()));
    }

    /**
     * Pauses an execution. The step in flight, if any, finishes first.
     */
    @PostMapping("/executions/{executionId}/pause")
    public Mono<ResponseEntity<ExecutionStatusResponse>> pause(
            @PathVariable String executionId,
            @RequestBody(required = false) ExecutionActionRequest request) {

        String actorId = actorOf(request);
        log.info("Pausing execution via API: executionId={}, actorId={}", executionId, actorId);
        return toResponse(controlService.pause(executionId, actorId));
    }

    /**
     * Resumes a paused execution from its current step.
     */
    @PostMapping("/executions/{executionId}/resume")
    public Mono<ResponseEntity<ExecutionStatusResponse>> resume(
            @PathVariable String executionId,
            @RequestBody(required = false) ExecutionActionRequest request) {

        String actorId = actorOf(request);
        log.info("Resuming execution via API: executionId={}, actorId={}", executionId, actorId);
        return toResponse(controlService.resume(executionId, actorId));
    }

    @PostMapping("/executions/{executionId}/cancel")
    public Mono<ResponseEntity<ExecutionStatusResponse>> cancel(
            @PathVariable String executionId,
            @RequestBody(required = false) ExecutionActionRequest request) {

        String actorId = actorOf(request);
        log.info("Cancelling execution via API: executionId={}, actorId={}", executionId, actorId);
        return toResponse(controlService.cancel(executionId, actorId));
    }

    private Mono<ResponseEntity<ExecutionStatusResponse>> toResponse(Mono<WorkflowExecution> action) {
        return action
                .map(execution -> ResponseEntity.ok(ExecutionStatusResponse.from(execution)))
                .onErrorResume(ExecutionNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()))
                .onErrorResume(ExecutionConflictException.class, e ->
                        Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).build()))
                .onErrorResume(InvalidExecutionStateException.class, e ->
                        Mono.just(ResponseEntity.badRequest().build()))
                .onErrorResume(StoreConsistencyException.class, e ->
                        Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).build()));
    }

    private static String actorOf(ExecutionActionRequest request) {
        return request != null && request.getActorId() != null ? request.getActorId() : "api";
    }
}
