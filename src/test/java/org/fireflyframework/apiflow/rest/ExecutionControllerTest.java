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

import org.fireflyframework.apiflow.TestWorkflows;
import org.fireflyframework.apiflow.control.ExecutionControlService;
import org.fireflyframework.apiflow.core.ExecutionSubmitter;
import org.fireflyframework.apiflow.exception.ExecutionConflictException;
import org.fireflyframework.apiflow.exception.ExecutionNotFoundException;
import org.fireflyframework.apiflow.exception.InvalidExecutionStateException;
import org.fireflyframework.apiflow.exception.StoreConsistencyException;
import org.fireflyframework.apiflow.exception.WorkflowNotActiveException;
import org.fireflyframework.apiflow.exception.WorkflowNotFoundException;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.LogLevel;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.model.WorkflowStatus;
import org.fireflyframework.apiflow.rest.dto.ExecutionActionRequest;
import org.fireflyframework.apiflow.rest.dto.ExecutionStatusResponse;
import org.fireflyframework.apiflow.rest.dto.SubmitExecutionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ExecutionController}.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionControllerTest {

    private static final String EXECUTION_ID = "exec-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ExecutionSubmitter submitter;

    @Mock
    private ExecutionControlService controlService;

    private ExecutionController controller;

    @BeforeEach
    void setUp() {
        controller = new ExecutionController(submitter, controlService);
    }

    private static WorkflowExecution pending() {
        return WorkflowExecution.pending(EXECUTION_ID, TestWorkflows.activeWithSteps(2), "user-1", Map.of(),
                3, "job-1", "workflow-execution", NOW);
    }

    // ========================================================================
    // Submit
    // ========================================================================

    @Nested
    @DisplayName("submit")
    class SubmitTests {

        @Test
        @DisplayName("should return 201 with the pending execution")
        void submit_created() {
            SubmitExecutionRequest request = new SubmitExecutionRequest("user-1", Map.of("customerId", 42), 5);
            when(submitter.submit(TestWorkflows.WORKFLOW_ID, "user-1", Map.of("customerId", 42), 5))
                    .thenReturn(Mono.just(pending()));

            StepVerifier.create(controller.submit(TestWorkflows.WORKFLOW_ID, request))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
                        ExecutionStatusResponse body = response.getBody();
                        assertThat(body.getExecutionId()).isEqualTo(EXECUTION_ID);
                        assertThat(body.getStatus()).isEqualTo(ExecutionStatus.PENDING);
                        assertThat(body.getTotalSteps()).isEqualTo(2);
                        assertThat(body.getMaxAttempts()).isEqualTo(3);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should accept a missing body")
        void submit_withoutBody() {
            when(submitter.submit(eq(TestWorkflows.WORKFLOW_ID), isNull(), any(), isNull()))
                    .thenReturn(Mono.just(pending()));

            StepVerifier.create(controller.submit(TestWorkflows.WORKFLOW_ID, null))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 404 for an unknown workflow")
        void submit_unknownWorkflow() {
            when(submitter.submit(eq("wf-missing"), any(), any(), any()))
                    .thenReturn(Mono.error(new WorkflowNotFoundException("wf-missing")));

            StepVerifier.create(controller.submit("wf-missing", new SubmitExecutionRequest()))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 400 for an inactive workflow")
        void submit_inactiveWorkflow() {
            when(submitter.submit(eq("wf-draft"), any(), any(), any()))
                    .thenReturn(Mono.error(new WorkflowNotActiveException("wf-draft", WorkflowStatus.DRAFT)));

            StepVerifier.create(controller.submit("wf-draft", new SubmitExecutionRequest()))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                    .verifyComplete();
        }
    }

    // ========================================================================
    // Control actions
    // ========================================================================

    @Nested
    @DisplayName("control actions")
    class ControlActionTests {

        @Test
        @DisplayName("should pause with the requesting actor")
        void pause_ok() {
            WorkflowExecution paused = pending().pause("ops", NOW);
            when(controlService.pause(EXECUTION_ID, "ops")).thenReturn(Mono.just(paused));

            StepVerifier.create(controller.pause(EXECUTION_ID, new ExecutionActionRequest("ops")))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(response.getBody().getStatus()).isEqualTo(ExecutionStatus.PAUSED);
                        assertThat(response.getBody().getPausedBy()).isEqualTo("ops");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should default the actor when no body is sent")
        void resume_defaultActor() {
            when(controlService.resume(EXECUTION_ID, "api")).thenReturn(Mono.just(pending()));

            StepVerifier.create(controller.resume(EXECUTION_ID, null))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK))
                    .verifyComplete();

            verify(controlService).resume(EXECUTION_ID, "api");
        }

        @Test
        @DisplayName("should return 409 when cancelling a terminal execution")
        void cancel_terminal() {
            when(controlService.cancel(EXECUTION_ID, "ops")).thenReturn(Mono.error(
                    new ExecutionConflictException(EXECUTION_ID, ExecutionStatus.COMPLETED, "cancel")));

            StepVerifier.create(controller.cancel(EXECUTION_ID, new ExecutionActionRequest("ops")))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 400 for an action the state does not allow")
        void resume_notPaused() {
            when(controlService.resume(EXECUTION_ID, "ops")).thenReturn(Mono.error(
                    new InvalidExecutionStateException(EXECUTION_ID, ExecutionStatus.RUNNING, "resume")));

            StepVerifier.create(controller.resume(EXECUTION_ID, new ExecutionActionRequest("ops")))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 409 when concurrent updates keep winning")
        void pause_lostUpdates() {
            when(controlService.pause(EXECUTION_ID, "ops"))
                    .thenReturn(Mono.error(new StoreConsistencyException(EXECUTION_ID, 4)));

            StepVerifier.create(controller.pause(EXECUTION_ID, new ExecutionActionRequest("ops")))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT))
                    .verifyComplete();
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("should return the execution status")
        void getStatus_ok() {
            when(controlService.getStatus(EXECUTION_ID)).thenReturn(Mono.just(pending()));

            StepVerifier.create(controller.getStatus(EXECUTION_ID))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(response.getBody().getWorkflowId()).isEqualTo(TestWorkflows.WORKFLOW_ID);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 404 for an unknown execution")
        void getStatus_notFound() {
            when(controlService.getStatus("missing")).thenReturn(Mono.error(new ExecutionNotFoundException("missing")));

            StepVerifier.create(controller.getStatus("missing"))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return the progress snapshot")
        void getProgress_ok() {
            when(controlService.getProgress(EXECUTION_ID)).thenReturn(Mono.just(pending().progress(NOW)));

            StepVerifier.create(controller.getProgress(EXECUTION_ID))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(response.getBody().percentComplete()).isZero();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should collect the execution log")
        void getLogs_ok() {
            ExecutionLog entry = ExecutionLog.builder()
                    .executionId(EXECUTION_ID)
                    .level(LogLevel.INFO)
                    .message("Execution submitted")
                    .timestamp(NOW)
                    .build();
            when(controlService.getLogs(EXECUTION_ID)).thenReturn(Flux.just(entry));

            StepVerifier.create(controller.getLogs(EXECUTION_ID))
                    .assertNext(response -> assertThat(response.getBody()).containsExactly(entry))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 404 for logs of an unknown execution")
        void getLogs_notFound() {
            when(controlService.getLogs("missing")).thenReturn(Flux.error(new ExecutionNotFoundException("missing")));

            StepVerifier.create(controller.getLogs("missing"))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                    .verifyComplete();
        }
    }
}
