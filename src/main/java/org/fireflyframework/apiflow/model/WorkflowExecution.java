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

package org.fireflyframework.apiflow.model;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One run of a {@link Workflow}, the aggregate the coordinator and the control
 * service mutate.
 * <p>
 * Instances are immutable; every transition returns a copy. The {@code version}
 * is owned by the store and drives compare-and-swap updates.
 */
@Builder(toBuilder = true)
public record WorkflowExecution(
        String id,
        String workflowId,
        String userId,
        ExecutionStatus status,
        Integer currentStep,
        int totalSteps,
        int completedSteps,
        int failedSteps,
        RetryState retryState,
        String queueJobId,
        String queueName,
        Instant pausedAt,
        String pausedBy,
        Instant resumedAt,
        String resumedBy,
        Instant cancelledAt,
        String cancelledBy,
        Map<String, Object> parameters,
        ExecutionPlan plan,
        List<StepResult> stepResults,
        Object result,
        String error,
        Long executionTime,
        Instant startedAt,
        Instant completedAt,
        Instant createdAt,
        Instant updatedAt,
        long version
) {

    public WorkflowExecution {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(workflowId, "workflowId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        if (retryState == null) {
            retryState = RetryState.initial(RetryState.DEFAULT_MAX_ATTEMPTS);
        }
        if (parameters == null) {
            parameters = Map.of();
        }
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
        if (completedSteps < 0 || failedSteps < 0) {
            throw new IllegalStateException("Step counters cannot be negative for execution " + id);
        }
        if (completedSteps + failedSteps > totalSteps) {
            throw new IllegalStateException("completedSteps + failedSteps exceeds totalSteps for execution " + id);
        }
        if (currentStep != null && (currentStep < completedSteps || currentStep > totalSteps)) {
            throw new IllegalStateException("currentStep " + currentStep + " out of range for execution " + id);
        }
    }

    /**
     * Creates a new PENDING execution.
     *
     * @param id the execution id
     * @param workflow the workflow to run
     * @param userId the submitting user
     * @param parameters input parameters available to templates and conditions
     * @param maxAttempts attempts allowed per step
     * @param queueJobId the job that will deliver this execution
     * @param queueName the queue the job is placed on
     * @param now creation time
     * @return the new execution
     */
    public static WorkflowExecution pending(String id, Workflow workflow, String userId,
                                            Map<String, Object> parameters, int maxAttempts,
                                            String queueJobId, String queueName, Instant now) {
        return WorkflowExecution.builder()
                .id(id)
                .workflowId(workflow.id())
                .userId(userId)
                .status(ExecutionStatus.PENDING)
                .totalSteps(workflow.toPlan().size())
                .retryState(RetryState.initial(maxAttempts))
                .queueJobId(queueJobId)
                .queueName(queueName)
                .parameters(parameters)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    // ==================== Coordinator transitions ====================

    /**
     * Moves a PENDING or RETRYING execution to RUNNING under the delivered job.
     * The plan is captured on the first start and kept afterwards.
     */
    public WorkflowExecution start(ExecutionPlan snapshot, String jobId, Instant now) {
        ExecutionPlan effectivePlan = plan != null ? plan : snapshot;
        return toBuilder()
                .status(ExecutionStatus.RUNNING)
                .plan(effectivePlan)
                .totalSteps(effectivePlan.size())
                .currentStep(currentStep != null ? currentStep : 0)
                .queueJobId(jobId)
                .retryState(retryState.clearRetryAfter())
                .startedAt(startedAt != null ? startedAt : now)
                .updatedAt(now)
                .build();
    }

    /**
     * Records a successful attempt of the current step and advances.
     */
    public WorkflowExecution recordStepSucceeded(StepResult stepResult, Instant now) {
        return advance(stepResult, completedSteps + 1, now);
    }

    /**
     * Records a skipped step and advances. Skipped steps count as neither completed nor failed.
     */
    public WorkflowExecution recordStepSkipped(StepResult stepResult, Instant now) {
        return advance(stepResult, completedSteps, now);
    }

    private WorkflowExecution advance(StepResult stepResult, int newCompleted, Instant now) {
        int position = requireCurrentStep();
        if (position >= totalSteps) {
            throw new IllegalStateException("Cannot advance execution " + id + " past step " + totalSteps);
        }
        int newFailed = retryState.attemptCount() > 0 ? failedSteps - 1 : failedSteps;
        return toBuilder()
                .stepResults(append(stepResult))
                .completedSteps(newCompleted)
                .failedSteps(newFailed)
                .currentStep(position + 1)
                .retryState(retryState.reset())
                .updatedAt(now)
                .build();
    }

    /**
     * Records a failed attempt of the current step without changing the status.
     * The first failure of a step counts it in {@code failedSteps}.
     */
    public WorkflowExecution recordStepFailed(StepResult stepResult, Instant now) {
        requireCurrentStep();
        int newFailed = retryState.attemptCount() == 0 ? failedSteps + 1 : failedSteps;
        return toBuilder()
                .stepResults(append(stepResult))
                .failedSteps(newFailed)
                .retryState(retryState.recordFailure())
                .updatedAt(now)
                .build();
    }

    /**
     * Schedules a retry of the current step, to be delivered by {@code jobId} at {@code retryAfter}.
     */
    public WorkflowExecution scheduleRetry(Instant retryAfter, String jobId, Instant now) {
        return toBuilder()
                .status(ExecutionStatus.RETRYING)
                .retryState(retryState.retryAt(retryAfter))
                .queueJobId(jobId)
                .updatedAt(now)
                .build();
    }

    /**
     * Finalizes the execution as FAILED.
     */
    public WorkflowExecution fail(String errorMessage, Instant now) {
        return terminal(ExecutionStatus.FAILED, now).toBuilder()
                .result(null)
                .error(errorMessage)
                .build();
    }

    /**
     * Finalizes the execution as COMPLETED once every step has run.
     */
    public WorkflowExecution complete(Object finalResult, Instant now) {
        int position = requireCurrentStep();
        if (position != totalSteps) {
            throw new IllegalStateException("Cannot complete execution " + id + " at step "
                    + position + " of " + totalSteps);
        }
        return terminal(ExecutionStatus.COMPLETED, now).toBuilder()
                .result(finalResult)
                .error(null)
                .build();
    }

    /**
     * Sets when the current step may be retried without changing the status, used when a
     * retry is decided while the execution is paused.
     */
    public WorkflowExecution retryNotBefore(Instant retryAfter, Instant now) {
        return toBuilder()
                .retryState(retryState.retryAt(retryAfter))
                .updatedAt(now)
                .build();
    }

    /**
     * Drops the outstanding job reference once its worker has exited.
     */
    public WorkflowExecution releaseJob(Instant now) {
        return toBuilder()
                .queueJobId(null)
                .updatedAt(now)
                .build();
    }

    /**
     * Attaches a job to an execution that has none.
     */
    public WorkflowExecution assignJob(String jobId, String queue, Instant now) {
        return toBuilder()
                .queueJobId(jobId)
                .queueName(queue)
                .updatedAt(now)
                .build();
    }

    // ==================== Control transitions ====================

    public WorkflowExecution pause(String actorId, Instant now) {
        requireStatus(status.canPause(), "pause");
        return toBuilder()
                .status(ExecutionStatus.PAUSED)
                .pausedAt(now)
                .pausedBy(actorId)
                .updatedAt(now)
                .build();
    }

    /**
     * Moves a PAUSED execution back to PENDING under a new job, continuing from {@code currentStep}.
     * A pending retry delay is kept, so the step is not picked up before it is due.
     */
    public WorkflowExecution resume(String actorId, String jobId, Instant now) {
        requireStatus(status.canResume(), "resume");
        return toBuilder()
                .status(ExecutionStatus.PENDING)
                .resumedAt(now)
                .resumedBy(actorId)
                .queueJobId(jobId)
                .updatedAt(now)
                .build();
    }

    public WorkflowExecution cancel(String actorId, Instant now) {
        requireStatus(!status.isTerminal(), "cancel");
        return terminal(ExecutionStatus.CANCELLED, now).toBuilder()
                .cancelledAt(now)
                .cancelledBy(actorId)
                .build();
    }

    // ==================== Queries ====================

    /**
     * Gets the step at {@code currentStep}.
     */
    public WorkflowStep currentPlanStep() {
        if (plan == null) {
            throw new IllegalStateException("Execution " + id + " has no plan yet");
        }
        return plan.step(requireCurrentStep());
    }

    public boolean hasRemainingSteps() {
        return currentStep != null && currentStep < totalSteps;
    }

    /**
     * Gets all attempts recorded for the step with the given order.
     */
    public List<StepResult> resultsForStep(int stepOrder) {
        return stepResults.stream()
                .filter(r -> r.stepOrder() == stepOrder)
                .toList();
    }

    public ExecutionProgress progress(Instant now) {
        long elapsed;
        if (executionTime != null) {
            elapsed = executionTime;
        } else if (startedAt != null) {
            elapsed = Math.max(0, Duration.between(startedAt, now).toMillis());
        } else {
            elapsed = 0;
        }

        int percent;
        if (status == ExecutionStatus.COMPLETED) {
            percent = 100;
        } else if (totalSteps == 0) {
            percent = 0;
        } else {
            int position = currentStep != null ? currentStep : completedSteps;
            percent = (int) Math.min(100, (position * 100L) / totalSteps);
        }

        Long remaining = null;
        if (!status.isTerminal() && currentStep != null && currentStep > 0 && elapsed > 0) {
            remaining = (elapsed / currentStep) * (totalSteps - currentStep);
        }

        return new ExecutionProgress(id, status, currentStep, totalSteps, completedSteps,
                failedSteps, percent, elapsed, remaining);
    }

    public WorkflowExecution withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    // ==================== Helpers ====================

    private WorkflowExecution terminal(ExecutionStatus terminalStatus, Instant now) {
        return toBuilder()
                .status(terminalStatus)
                .currentStep(null)
                .queueJobId(null)
                .retryState(retryState.clearRetryAfter())
                .executionTime(startedAt != null ? Math.max(0, Duration.between(startedAt, now).toMillis()) : null)
                .completedAt(now)
                .updatedAt(now)
                .build();
    }

    private int requireCurrentStep() {
        if (currentStep == null) {
            throw new IllegalStateException("Execution " + id + " has no current step");
        }
        return currentStep;
    }

    private void requireStatus(boolean allowed, String action) {
        if (!allowed) {
            throw new IllegalStateException("Cannot " + action + " execution " + id + " in status: " + status);
        }
    }

    private List<StepResult> append(StepResult stepResult) {
        List<StepResult> results = new ArrayList<>(stepResults);
        results.add(stepResult);
        return results;
    }
}
