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

package org.fireflyframework.apiflow.rest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.StepResult;
import org.fireflyframework.apiflow.model.WorkflowExecution;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for execution status queries and control actions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStatusResponse {

    private String executionId;
    private String workflowId;
    private String userId;
    private ExecutionStatus status;
    private Integer currentStep;
    private int totalSteps;
    private int completedSteps;
    private int failedSteps;
    private int attemptCount;
    private int maxAttempts;
    private Instant retryAfter;
    private List<StepResultDto> stepResults;
    private Object result;
    private String error;
    private Long executionTime;
    private Instant pausedAt;
    private String pausedBy;
    private Instant resumedAt;
    private String resumedBy;
    private Instant cancelledAt;
    private String cancelledBy;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public static ExecutionStatusResponse from(WorkflowExecution execution) {
        return ExecutionStatusResponse.builder()
                .executionId(execution.id())
                .workflowId(execution.workflowId())
                .userId(execution.userId())
                .status(execution.status())
                .currentStep(execution.currentStep())
                .totalSteps(execution.totalSteps())
                .completedSteps(execution.completedSteps())
                .failedSteps(execution.failedSteps())
                .attemptCount(execution.retryState().attemptCount())
                .maxAttempts(execution.retryState().maxAttempts())
                .retryAfter(execution.retryState().retryAfter())
                .stepResults(execution.stepResults().stream()
                        .map(StepResultDto::from)
                        .toList())
                .result(execution.result())
                .error(execution.error())
                .executionTime(execution.executionTime())
                .pausedAt(execution.pausedAt())
                .pausedBy(execution.pausedBy())
                .resumedAt(execution.resumedAt())
                .resumedBy(execution.resumedBy())
                .cancelledAt(execution.cancelledAt())
                .cancelledBy(execution.cancelledBy())
                .createdAt(execution.createdAt())
                .startedAt(execution.startedAt())
                .completedAt(execution.completedAt())
                .build();
    }

    /**
     * Step attempt DTO.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StepResultDto {
        private int stepOrder;
        private String stepName;
        private int attempt;
        private String status;
        private Object output;
        private String errorType;
        private String errorMessage;
        private Boolean retryable;
        private Integer statusCode;
        private Instant startedAt;
        private Instant finishedAt;
        private long durationMs;

        public static StepResultDto from(StepResult result) {
            StepResultDtoBuilder builder = StepResultDto.builder()
                    .stepOrder(result.stepOrder())
                    .stepName(result.stepName())
                    .attempt(result.attempt())
                    .status(result.status().name())
                    .output(result.output())
                    .startedAt(result.startedAt())
                    .finishedAt(result.finishedAt())
                    .durationMs(result.duration().toMillis());
            if (result.error() != null) {
                builder.errorType(result.error().type().name())
                        .errorMessage(result.error().message())
                        .retryable(result.error().retryable())
                        .statusCode(result.error().statusCode());
            }
            return builder.build();
        }
    }
}
