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

package org.fireflyframework.apiflow.core;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.condition.ConditionEvaluationException;
import org.fireflyframework.apiflow.condition.ConditionEvaluator;
import org.fireflyframework.apiflow.exception.StoreConsistencyException;
import org.fireflyframework.apiflow.metrics.ExecutionMetrics;
import org.fireflyframework.apiflow.model.ExecutionContext;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionPlan;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.LogLevel;
import org.fireflyframework.apiflow.model.RetryState;
import org.fireflyframework.apiflow.model.StepError;
import org.fireflyframework.apiflow.model.StepErrorType;
import org.fireflyframework.apiflow.model.StepResult;
import org.fireflyframework.apiflow.model.StepResultStatus;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.model.WorkflowStep;
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.queue.QueueDelivery;
import org.fireflyframework.apiflow.retry.RetryBackoffPolicy;
import org.fireflyframework.apiflow.retry.RetryDecision;
import org.fireflyframework.apiflow.runner.StepOutcome;
import org.fireflyframework.apiflow.runner.StepRunner;
import org.fireflyframework.apiflow.store.ExecutionStore;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives an execution through its state machine for one queue delivery.
 * <p>
 * On each delivery the execution is re-read from the store and checked against the
 * delivered job: a job that is no longer the execution's outstanding job, or an
 * execution that is no longer PENDING, RUNNING or RETRYING, is a no-op. Otherwise
 * the remaining steps run one at a time in plan order. Every transition is written
 * with a compare-and-swap on the version read before it, and the state is re-read
 * before each further step so a concurrent pause or cancel takes effect between steps.
 * <p>
 * Step errors never escape this class: they are recorded in the step results and fed
 * to the {@link RetryBackoffPolicy}. A lost compare-and-swap that cannot be reconciled
 * yields {@link DeliveryOutcome.Action#ABANDON}.
 */
@Slf4j
public class ExecutionCoordinator {

    private final ExecutionStore store;
    private final StepRunner stepRunner;
    private final ConditionEvaluator conditionEvaluator;
    private final RetryBackoffPolicy retryPolicy;
    private final ExecutionQueue queue;
    @Nullable
    private final ExecutionMetrics metrics;
    private final Duration defaultStepTimeout;
    private final Clock clock;

    public ExecutionCoordinator(ExecutionStore store,
                                StepRunner stepRunner,
                                ConditionEvaluator conditionEvaluator,
                                RetryBackoffPolicy retryPolicy,
                                ExecutionQueue queue,
                                @Nullable ExecutionMetrics metrics,
                                Duration defaultStepTimeout,
                                Clock clock) {
        this.store = store;
        this.stepRunner = stepRunner;
        this.conditionEvaluator = conditionEvaluator;
        this.retryPolicy = retryPolicy;
        this.queue = queue;
        this.metrics = metrics;
        this.defaultStepTimeout = defaultStepTimeout;
        this.clock = clock;
    }

    /**
     * Handles one delivery of an execution job.
     *
     * @param delivery the delivered job
     * @return what to do with the job
     */
    public Mono<DeliveryOutcome> handle(QueueDelivery delivery) {
        log.debug("DELIVERY_RECEIVED: executionId={}, jobId={}, deliveryCount={}",
                delivery.executionId(), delivery.jobId(), delivery.deliveryCount());

        return store.findExecution(delivery.executionId())
                .flatMap(execution -> dispatch(execution, delivery))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("DELIVERY_ORPHAN: executionId={}, jobId={}", delivery.executionId(), delivery.jobId());
                    recordStale("orphan");
                    return DeliveryOutcome.ack("execution not found");
                }))
                .onErrorResume(StoreConsistencyException.class, e -> {
                    log.warn("STORE_CONFLICT: executionId={}, jobId={}, abandoning delivery: {}",
                            delivery.executionId(), delivery.jobId(), e.getMessage());
                    if (metrics != null) {
                        metrics.recordStoreConflict("delivery");
                    }
                    return Mono.just(DeliveryOutcome.abandon(e.getMessage()));
                })
                .onErrorResume(IllegalStateException.class, e -> failFatally(delivery, e));
    }

    private Mono<DeliveryOutcome> dispatch(WorkflowExecution execution, QueueDelivery delivery) {
        if (!ownsExecution(execution, delivery)) {
            log.info("DELIVERY_STALE: executionId={}, jobId={}, outstandingJobId={}, status={}",
                    execution.id(), delivery.jobId(), execution.queueJobId(), execution.status());
            recordStale("job_mismatch");
            return Mono.just(DeliveryOutcome.ack("stale job"));
        }

        return switch (execution.status()) {
            case RUNNING -> begin(execution, delivery);
            case PENDING, RETRYING -> {
                Instant now = clock.instant();
                if (!execution.retryState().isDue(now)) {
                    Instant retryAfter = execution.retryState().retryAfter();
                    log.debug("DELIVERY_EARLY: executionId={}, jobId={}, retryAfter={}",
                            execution.id(), delivery.jobId(), retryAfter);
                    yield Mono.just(DeliveryOutcome.defer(retryAfter, "retry not due"));
                }
                yield begin(execution, delivery);
            }
            case PAUSED -> releasePausedJob(execution, delivery);
            case COMPLETED, FAILED, CANCELLED -> {
                log.info("DELIVERY_NOOP: executionId={}, jobId={}, status={}",
                        execution.id(), delivery.jobId(), execution.status());
                recordStale("terminal");
                yield Mono.just(DeliveryOutcome.ack("terminal"));
            }
        };
    }

    /**
     * A delivery owns the execution when it carries the persisted outstanding job. A PENDING
     * execution that has not been assigned a job yet accepts any delivery.
     */
    private static boolean ownsExecution(WorkflowExecution execution, QueueDelivery delivery) {
        if (execution.queueJobId() == null) {
            return execution.status() == ExecutionStatus.PENDING;
        }
        return execution.queueJobId().equals(delivery.jobId());
    }

    // ==================== Start ====================

    private Mono<DeliveryOutcome> begin(WorkflowExecution execution, QueueDelivery delivery) {
        if (execution.plan() != null) {
            return start(execution, execution.plan(), delivery);
        }
        return store.findWorkflow(execution.workflowId())
                .flatMap(workflow -> start(execution, workflow.toPlan(), delivery))
                .switchIfEmpty(Mono.defer(() -> failWithoutWorkflow(execution)));
    }

    private Mono<DeliveryOutcome> start(WorkflowExecution execution, ExecutionPlan plan, QueueDelivery delivery) {
        boolean firstStart = execution.startedAt() == null;
        ExecutionStatus previous = execution.status();

        return store.compareAndSet(execution.start(plan, delivery.jobId(), clock.instant()))
                .flatMap(running -> {
                    if (firstStart) {
                        log.info("EXECUTION_START: executionId={}, workflowId={}, totalSteps={}, jobId={}",
                                running.id(), running.workflowId(), running.totalSteps(), delivery.jobId());
                        if (metrics != null) {
                            metrics.recordExecutionStarted(running.workflowId());
                        }
                        return appendLog(running, null, LogLevel.INFO, "Execution started",
                                data("totalSteps", running.totalSteps()))
                                .then(runSteps(running, delivery));
                    }
                    log.info("EXECUTION_CONTINUE: executionId={}, from={}, currentStep={}, attempt={}, jobId={}",
                            running.id(), previous, running.currentStep(),
                            running.retryState().attemptCount() + 1, delivery.jobId());
                    if (metrics != null && previous != ExecutionStatus.RUNNING) {
                        metrics.recordExecutionContinued(running.workflowId());
                    }
                    return runSteps(running, delivery);
                });
    }

    private Mono<DeliveryOutcome> failWithoutWorkflow(WorkflowExecution execution) {
        String message = "Workflow not found: " + execution.workflowId();
        return store.compareAndSet(execution.fail(message, clock.instant()))
                .flatMap(failed -> {
                    log.error("EXECUTION_FAILED: executionId={}, error={}", failed.id(), message);
                    recordFinished(failed);
                    return appendLog(failed, null, LogLevel.ERROR, message, Map.of())
                            .thenReturn(DeliveryOutcome.ack("workflow missing"));
                });
    }

    // ==================== Step loop ====================

    private Mono<DeliveryOutcome> runSteps(WorkflowExecution execution, QueueDelivery delivery) {
        return Mono.defer(() -> {
            if (!execution.hasRemainingSteps()) {
                return complete(execution);
            }

            WorkflowStep step = execution.currentPlanStep();
            ExecutionContext context = ExecutionContext.from(execution);
            int attempt = context.attempt();
            Instant startedAt = clock.instant();

            boolean shouldRun;
            try {
                shouldRun = conditionEvaluator.evaluate(step.conditions(), context);
            } catch (ConditionEvaluationException e) {
                StepError error = StepError.nonRetryable(StepErrorType.VALIDATION_ERROR,
                        "Condition evaluation failed: " + e.getMessage());
                return commitStepResult(execution, step,
                        StepResult.failed(step, attempt, error, startedAt, clock.instant()), delivery);
            }

            if (!shouldRun) {
                log.info("STEP_SKIPPED: executionId={}, step={}, stepOrder={}",
                        execution.id(), step.name(), step.stepOrder());
                return commitStepResult(execution, step, StepResult.skipped(step, attempt, startedAt), delivery);
            }

            Duration timeout = step.effectiveTimeout(defaultStepTimeout);
            log.info("STEP_START: executionId={}, step={}, stepOrder={}, attempt={}, timeout={}",
                    execution.id(), step.name(), step.stepOrder(), attempt, timeout);

            return appendLog(execution, step, LogLevel.INFO, "Starting step " + step.name(),
                    data("attempt", attempt, "action", step.action()))
                    .then(stepRunner.run(step, context, timeout))
                    .map(outcome -> toStepResult(step, attempt, outcome, startedAt))
                    .flatMap(result -> commitStepResult(execution, step, result, delivery));
        });
    }

    private StepResult toStepResult(WorkflowStep step, int attempt, StepOutcome outcome, Instant startedAt) {
        Instant finishedAt = clock.instant();
        if (outcome instanceof StepOutcome.Succeeded succeeded) {
            return StepResult.succeeded(step, attempt, succeeded.output(), startedAt, finishedAt);
        }
        if (outcome instanceof StepOutcome.Failed failed) {
            return StepResult.failed(step, attempt, failed.error(), startedAt, finishedAt);
        }
        throw new IllegalStateException("Unknown step outcome: " + outcome);
    }

    // ==================== Committing step results ====================

    private Mono<DeliveryOutcome> commitStepResult(WorkflowExecution execution, WorkflowStep step,
                                                   StepResult result, QueueDelivery delivery) {
        Instant now = clock.instant();
        WorkflowExecution updated = applyStepResult(execution, step, result, now);

        return store.compareAndSet(updated)
                .map(Optional::of)
                .onErrorResume(StoreConsistencyException.class, e -> Mono.just(Optional.empty()))
                .flatMap(committed -> committed.isPresent()
                        ? afterStepCommitted(committed.get(), step, result, delivery)
                        : reconcile(execution, step, result, delivery));
    }

    /**
     * Applies a step result to a RUNNING execution: advance on success or skip, retry or
     * fail on failure.
     */
    private WorkflowExecution applyStepResult(WorkflowExecution execution, WorkflowStep step,
                                              StepResult result, Instant now) {
        if (result.status() != StepResultStatus.FAILED) {
            return advance(execution, result, now);
        }
        WorkflowExecution failed = execution.recordStepFailed(result, now);
        RetryDecision decision = decideRetry(failed, step, result.error(), now);
        if (decision instanceof RetryDecision.Retry retry) {
            return failed.scheduleRetry(retry.after(), queue.newJobId(), now);
        }
        return failed.fail(failureMessage(step, result, (RetryDecision.Exhausted) decision), now);
    }

    private static WorkflowExecution advance(WorkflowExecution execution, StepResult result, Instant now) {
        return result.status() == StepResultStatus.SKIPPED
                ? execution.recordStepSkipped(result, now)
                : execution.recordStepSucceeded(result, now);
    }

    private RetryDecision decideRetry(WorkflowExecution failed, WorkflowStep step, StepError error, Instant now) {
        RetryState state = failed.retryState();
        RetryState effective = state.withMaxAttempts(step.effectiveMaxAttempts(state.maxAttempts()));
        return retryPolicy.decide(effective, error, step.retryConfig(), now);
    }

    private Mono<DeliveryOutcome> afterStepCommitted(WorkflowExecution committed, WorkflowStep step,
                                                     StepResult result, QueueDelivery delivery) {
        recordStep(committed, step, result);

        return switch (committed.status()) {
            case RUNNING -> logStepResult(committed, step, result)
                    .then(continueAfterCommit(committed, delivery));
            case RETRYING -> {
                Instant retryAfter = committed.retryState().retryAfter();
                log.info("EXECUTION_RETRY_SCHEDULED: executionId={}, step={}, attempt={}/{}, retryAfter={}, jobId={}",
                        committed.id(), step.name(), result.attempt(),
                        step.effectiveMaxAttempts(committed.retryState().maxAttempts()), retryAfter,
                        committed.queueJobId());
                if (metrics != null) {
                    metrics.recordStepRetry(committed.workflowId(), step.name(), result.attempt());
                    metrics.recordExecutionSuspended(committed.workflowId(), ExecutionStatus.RETRYING);
                }
                yield logStepResult(committed, step, result)
                        .then(appendLog(committed, step, LogLevel.INFO, "Retry scheduled",
                                data("retryAfter", retryAfter.toString(), "nextAttempt", result.attempt() + 1)))
                        .then(queue.enqueueDelayed(committed.queueJobId(), committed.id(), retryAfter))
                        .thenReturn(DeliveryOutcome.ack("retry scheduled"));
            }
            case FAILED -> {
                log.warn("EXECUTION_FAILED: executionId={}, step={}, error={}",
                        committed.id(), step.name(), committed.error());
                recordFinished(committed);
                yield logStepResult(committed, step, result)
                        .then(appendLog(committed, step, LogLevel.ERROR, committed.error(),
                                data("failedSteps", committed.failedSteps())))
                        .thenReturn(DeliveryOutcome.ack("failed"));
            }
            case PENDING, PAUSED, COMPLETED, CANCELLED -> throw new IllegalStateException(
                    "Unexpected status " + committed.status() + " after step commit of execution " + committed.id());
        };
    }

    /**
     * Re-reads the execution before the next step. Anything other than the state just
     * committed means a control action got in between.
     */
    private Mono<DeliveryOutcome> continueAfterCommit(WorkflowExecution committed, QueueDelivery delivery) {
        return store.findExecution(committed.id())
                .flatMap(current -> {
                    if (current.version() == committed.version()) {
                        return runSteps(current, delivery);
                    }
                    log.info("EXECUTION_INTERRUPTED: executionId={}, status={}, currentStep={}",
                            current.id(), current.status(), current.currentStep());
                    if (current.status() == ExecutionStatus.RUNNING && ownsExecution(current, delivery)) {
                        return runSteps(current, delivery);
                    }
                    if (metrics != null && current.status() == ExecutionStatus.PAUSED) {
                        metrics.recordExecutionSuspended(current.workflowId(), ExecutionStatus.PAUSED);
                    }
                    return dispatch(current, delivery);
                })
                .switchIfEmpty(Mono.error(() -> new StoreConsistencyException(committed.id(), committed.version())));
    }

    /**
     * Handles a lost compare-and-swap after a step ran. A pause that arrived while the step
     * was in flight keeps the step's result; a cancel discards it.
     */
    private Mono<DeliveryOutcome> reconcile(WorkflowExecution base, WorkflowStep step,
                                            StepResult result, QueueDelivery delivery) {
        log.warn("STORE_CONFLICT: executionId={}, step={}, expectedVersion={}",
                base.id(), step.name(), base.version());
        if (metrics != null) {
            metrics.recordStoreConflict("step_result");
        }

        return store.findExecution(base.id())
                .switchIfEmpty(Mono.error(() -> new StoreConsistencyException(base.id(), base.version())))
                .flatMap(current -> {
                    if (current.status() == ExecutionStatus.CANCELLED) {
                        log.info("STEP_RESULT_DISCARDED: executionId={}, step={}, status={}",
                                current.id(), step.name(), result.status());
                        return appendLog(current, step, LogLevel.WARNING,
                                "Result of step " + step.name() + " discarded: execution was cancelled",
                                data("attempt", result.attempt(), "stepStatus", result.status().name()))
                                .thenReturn(DeliveryOutcome.ack("cancelled during step"));
                    }
                    if (current.status() == ExecutionStatus.PAUSED
                            && ownsExecution(current, delivery)
                            && Objects.equals(current.currentStep(), base.currentStep())
                            && current.retryState().attemptCount() == base.retryState().attemptCount()) {
                        return commitWhilePaused(current, step, result);
                    }
                    return Mono.error(new StoreConsistencyException(base.id(), base.version()));
                });
    }

    private Mono<DeliveryOutcome> commitWhilePaused(WorkflowExecution paused, WorkflowStep step, StepResult result) {
        Instant now = clock.instant();
        WorkflowExecution updated;
        if (result.status() != StepResultStatus.FAILED) {
            updated = advance(paused, result, now).releaseJob(now);
        } else {
            WorkflowExecution failed = paused.recordStepFailed(result, now);
            RetryDecision decision = decideRetry(failed, step, result.error(), now);
            updated = decision instanceof RetryDecision.Retry retry
                    ? failed.retryNotBefore(retry.after(), now).releaseJob(now)
                    : failed.fail(failureMessage(step, result, (RetryDecision.Exhausted) decision), now);
        }

        return store.compareAndSet(updated)
                .flatMap(committed -> {
                    log.info("STEP_COMMITTED_WHILE_PAUSED: executionId={}, step={}, stepStatus={}, status={}",
                            committed.id(), step.name(), result.status(), committed.status());
                    recordStep(committed, step, result);
                    if (committed.status().isTerminal()) {
                        recordFinished(committed);
                    } else if (metrics != null) {
                        metrics.recordExecutionSuspended(committed.workflowId(), ExecutionStatus.PAUSED);
                    }
                    return logStepResult(committed, step, result)
                            .thenReturn(DeliveryOutcome.ack("paused during step"));
                });
    }

    // ==================== Completion and release ====================

    private Mono<DeliveryOutcome> complete(WorkflowExecution execution) {
        Instant now = clock.instant();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("success", true);
        summary.put("totalSteps", execution.totalSteps());
        summary.put("completedSteps", execution.completedSteps());
        summary.put("skippedSteps", execution.totalSteps() - execution.completedSteps() - execution.failedSteps());
        summary.put("totalDuration", execution.startedAt() != null
                ? Duration.between(execution.startedAt(), now).toMillis() : 0L);
        summary.put("outputs", ExecutionContext.from(execution).stepOutputs());

        return store.compareAndSet(execution.complete(summary, now))
                .flatMap(completed -> {
                    log.info("EXECUTION_COMPLETED: executionId={}, workflowId={}, completedSteps={}, totalSteps={}, executionTime={}ms",
                            completed.id(), completed.workflowId(), completed.completedSteps(),
                            completed.totalSteps(), completed.executionTime());
                    recordFinished(completed);
                    return appendLog(completed, null, LogLevel.INFO, "Execution completed",
                            data("completedSteps", completed.completedSteps(),
                                    "executionTime", completed.executionTime()))
                            .thenReturn(DeliveryOutcome.ack("completed"));
                });
    }

    /**
     * A delivery for a PAUSED execution means its worker can exit: drop the job reference
     * so resume can hand out a new one.
     */
    private Mono<DeliveryOutcome> releasePausedJob(WorkflowExecution execution, QueueDelivery delivery) {
        return store.compareAndSet(execution.releaseJob(clock.instant()))
                .map(released -> {
                    log.info("DELIVERY_PAUSED: executionId={}, jobId={}, job released",
                            released.id(), delivery.jobId());
                    return DeliveryOutcome.ack("paused");
                });
    }

    /**
     * Invariant violations are fatal: the execution is failed instead of being retried.
     */
    private Mono<DeliveryOutcome> failFatally(QueueDelivery delivery, IllegalStateException error) {
        log.error("EXECUTION_INVARIANT_VIOLATION: executionId={}, jobId={}",
                delivery.executionId(), delivery.jobId(), error);
        String message = "Internal error: " + error.getMessage();
        return store.findExecution(delivery.executionId())
                .filter(execution -> !execution.status().isTerminal())
                .flatMap(execution -> store.compareAndSet(execution.fail(message, clock.instant())))
                .flatMap(failed -> {
                    recordFinished(failed);
                    return appendLog(failed, null, LogLevel.ERROR, message, Map.of());
                })
                .onErrorResume(e -> {
                    log.error("Failed to mark execution {} as failed after invariant violation",
                            delivery.executionId(), e);
                    return Mono.empty();
                })
                .thenReturn(DeliveryOutcome.ack("invariant violation"));
    }

    // ==================== Logging helpers ====================

    private Mono<Void> logStepResult(WorkflowExecution execution, WorkflowStep step, StepResult result) {
        long durationMs = result.duration().toMillis();
        return switch (result.status()) {
            case SUCCEEDED -> {
                log.info("STEP_COMPLETE: executionId={}, step={}, attempt={}, durationMs={}",
                        execution.id(), step.name(), result.attempt(), durationMs);
                yield appendLog(execution, step, LogLevel.INFO, "Step " + step.name() + " completed",
                        data("attempt", result.attempt(), "durationMs", durationMs));
            }
            case SKIPPED -> appendLog(execution, step, LogLevel.INFO,
                    "Step " + step.name() + " skipped: condition not met", Map.of());
            case FAILED -> {
                StepError error = result.error();
                log.warn("STEP_FAILED: executionId={}, step={}, attempt={}, type={}, retryable={}, error={}",
                        execution.id(), step.name(), result.attempt(), error.type(), error.retryable(),
                        error.message());
                yield appendLog(execution, step, LogLevel.WARNING,
                        "Step " + step.name() + " failed: " + error.message(),
                        data("attempt", result.attempt(), "errorType", error.type().name(),
                                "retryable", error.retryable(), "statusCode", error.statusCode(),
                                "durationMs", durationMs));
            }
        };
    }

    private Mono<Void> appendLog(WorkflowExecution execution, WorkflowStep step, LogLevel level,
                                 String message, Map<String, Object> data) {
        return store.appendLog(ExecutionLog.builder()
                        .executionId(execution.id())
                        .stepOrder(step != null ? step.stepOrder() : null)
                        .stepName(step != null ? step.name() : null)
                        .level(level)
                        .message(message)
                        .data(data)
                        .timestamp(clock.instant())
                        .build())
                .then();
    }

    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return data;
    }

    private static String failureMessage(WorkflowStep step, StepResult result, RetryDecision.Exhausted exhausted) {
        return "Step " + step.stepOrder() + " (" + step.name() + ") failed: " + result.error().message()
                + " [" + exhausted.reason() + "]";
    }

    // ==================== Metrics helpers ====================

    private void recordStep(WorkflowExecution execution, WorkflowStep step, StepResult result) {
        if (metrics != null) {
            metrics.recordStepCompleted(execution.workflowId(), step.name(), result.status(), result.duration());
        }
    }

    private void recordFinished(WorkflowExecution execution) {
        if (metrics != null) {
            Duration duration = execution.executionTime() != null
                    ? Duration.ofMillis(execution.executionTime()) : Duration.ZERO;
            metrics.recordExecutionFinished(execution.workflowId(), execution.status(), duration);
        }
    }

    private void recordStale(String reason) {
        if (metrics != null) {
            metrics.recordStaleDelivery(reason);
        }
    }
}
