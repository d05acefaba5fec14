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

package org.fireflyframework.apiflow.control;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.exception.ExecutionConflictException;
import org.fireflyframework.apiflow.exception.ExecutionNotFoundException;
import org.fireflyframework.apiflow.exception.InvalidExecutionStateException;
import org.fireflyframework.apiflow.exception.StoreConsistencyException;
import org.fireflyframework.apiflow.metrics.ExecutionMetrics;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionProgress;
import org.fireflyframework.apiflow.model.LogLevel;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.store.ExecutionStore;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * User control over executions: pause, resume, cancel and read-only queries.
 * <p>
 * Every action re-reads the execution, validates the transition and writes it with a
 * compare-and-swap. When the write loses against a worker the action is re-validated
 * on fresh state, up to {@code maxUpdateAttempts} times. Actions on terminal executions
 * fail with {@link ExecutionConflictException}; other disallowed actions with
 * {@link InvalidExecutionStateException}.
 * <p>
 * Pause and cancel never wait for an in-flight step: a worker notices the change at its
 * next state re-check.
 */
@Slf4j
public class ExecutionControlService {

    private final ExecutionStore store;
    private final ExecutionQueue queue;
    @Nullable
    private final ExecutionMetrics metrics;
    private final int maxUpdateAttempts;
    private final Clock clock;

    public ExecutionControlService(ExecutionStore store,
                                   ExecutionQueue queue,
                                   @Nullable ExecutionMetrics metrics,
                                   int maxUpdateAttempts,
                                   Clock clock) {
        this.store = store;
        this.queue = queue;
        this.metrics = metrics;
        this.maxUpdateAttempts = maxUpdateAttempts;
        this.clock = clock;
    }

    /**
     * Pauses a PENDING, RUNNING or RETRYING execution. The outstanding job id is kept
     * until the worker holding it exits; a job still waiting in the queue is cancelled.
     *
     * @param executionId the execution
     * @param actorId who paused it
     * @return the paused execution
     */
    public Mono<WorkflowExecution> pause(String executionId, String actorId) {
        return update(executionId, "pause", execution -> {
            requireNotTerminal(execution, "pause");
            if (!execution.status().canPause()) {
                throw new InvalidExecutionStateException(execution.id(), execution.status(), "pause");
            }
            return execution.pause(actorId, clock.instant());
        })
                .flatMap(paused -> cancelQueuedJob(paused.queueJobId(), paused.id())
                        .then(appendLog(paused, LogLevel.INFO, "Execution paused", actorId))
                        .thenReturn(paused))
                .doOnSuccess(paused -> log.info("EXECUTION_PAUSED: executionId={}, pausedBy={}, currentStep={}",
                        executionId, actorId, paused.currentStep()));
    }

    /**
     * Resumes a PAUSED execution from its current step under a new job. A retry that is not
     * due yet is enqueued for its retry time.
     *
     * @param executionId the execution
     * @param actorId who resumed it
     * @return the execution, now PENDING
     */
    public Mono<WorkflowExecution> resume(String executionId, String actorId) {
        return update(executionId, "resume", execution -> {
            requireNotTerminal(execution, "resume");
            if (!execution.status().canResume()) {
                throw new InvalidExecutionStateException(execution.id(), execution.status(), "resume");
            }
            return execution.resume(actorId, queue.newJobId(), clock.instant());
        })
                .flatMap(resumed -> appendLog(resumed, LogLevel.INFO, "Execution resumed", actorId)
                        .then(enqueueResumed(resumed))
                        .thenReturn(resumed))
                .doOnSuccess(resumed -> log.info("EXECUTION_RESUMED: executionId={}, resumedBy={}, currentStep={}, jobId={}",
                        executionId, actorId, resumed.currentStep(), resumed.queueJobId()));
    }

    private Mono<String> enqueueResumed(WorkflowExecution resumed) {
        Instant retryAfter = resumed.retryState().retryAfter();
        if (retryAfter != null && retryAfter.isAfter(clock.instant())) {
            return queue.enqueueDelayed(resumed.queueJobId(), resumed.id(), retryAfter);
        }
        return queue.enqueue(resumed.queueJobId(), resumed.id());
    }

    /**
     * Cancels a non-terminal execution. A worker running a step discards the result.
     *
     * @param executionId the execution
     * @param actorId who cancelled it
     * @return the cancelled execution
     */
    public Mono<WorkflowExecution> cancel(String executionId, String actorId) {
        AtomicReference<String> previousJob = new AtomicReference<>();
        return update(executionId, "cancel", execution -> {
            requireNotTerminal(execution, "cancel");
            previousJob.set(execution.queueJobId());
            return execution.cancel(actorId, clock.instant());
        })
                .flatMap(cancelled -> cancelQueuedJob(previousJob.get(), cancelled.id())
                        .then(appendLog(cancelled, LogLevel.WARNING, "Execution cancelled", actorId))
                        .thenReturn(cancelled))
                .doOnSuccess(cancelled -> {
                    log.info("EXECUTION_CANCELLED: executionId={}, cancelledBy={}, completedSteps={}",
                            executionId, actorId, cancelled.completedSteps());
                    if (metrics != null) {
                        metrics.recordExecutionFinished(cancelled.workflowId(), cancelled.status(),
                                cancelled.executionTime() != null
                                        ? Duration.ofMillis(cancelled.executionTime()) : Duration.ZERO);
                    }
                });
    }

    /**
     * Gets the last committed state of an execution.
     *
     * @param executionId the execution
     * @return the execution, or {@link ExecutionNotFoundException}
     */
    public Mono<WorkflowExecution> getStatus(String executionId) {
        return store.findExecution(executionId)
                .switchIfEmpty(Mono.error(() -> new ExecutionNotFoundException(executionId)));
    }

    public Mono<ExecutionProgress> getProgress(String executionId) {
        return getStatus(executionId)
                .map(execution -> execution.progress(clock.instant()));
    }

    /**
     * Gets the execution's log in write order.
     */
    public Flux<ExecutionLog> getLogs(String executionId) {
        return getStatus(executionId)
                .flatMapMany(execution -> store.findLogs(execution.id()));
    }

    // ==================== Helpers ====================

    private Mono<WorkflowExecution> update(String executionId, String action,
                                           UnaryOperator<WorkflowExecution> transition) {
        return Mono.defer(() -> getStatus(executionId)
                        .map(transition)
                        .flatMap(store::compareAndSet))
                .retryWhen(Retry.max(Math.max(0, maxUpdateAttempts - 1))
                        .filter(StoreConsistencyException.class::isInstance)
                        .doBeforeRetry(signal -> {
                            log.debug("Control action {} on execution {} lost a concurrent update, retrying (attempt {})",
                                    action, executionId, signal.totalRetries() + 2);
                            if (metrics != null) {
                                metrics.recordStoreConflict("control_" + action);
                            }
                        })
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnSuccess(updated -> recordAction(action, true))
                .doOnError(InvalidExecutionStateException.class, e -> {
                    log.info("Rejected {} of execution {}: {}", action, executionId, e.getMessage());
                    recordAction(action, false);
                });
    }

    private static void requireNotTerminal(WorkflowExecution execution, String action) {
        if (execution.status().isTerminal()) {
            throw new ExecutionConflictException(execution.id(), execution.status(), action);
        }
    }

    /**
     * Removes a job that has not been delivered yet. Failures are logged: a job that
     * is delivered anyway is dropped by the coordinator.
     */
    private Mono<Void> cancelQueuedJob(String jobId, String executionId) {
        if (jobId == null) {
            return Mono.empty();
        }
        return queue.cancel(jobId)
                .doOnNext(removed -> log.debug("QUEUE_JOB_CANCEL: executionId={}, jobId={}, removed={}",
                        executionId, jobId, removed))
                .onErrorResume(e -> {
                    log.warn("Could not cancel job {} of execution {}: {}", jobId, executionId, e.getMessage());
                    return Mono.just(false);
                })
                .then();
    }

    private Mono<Void> appendLog(WorkflowExecution execution, LogLevel level, String message, String actorId) {
        Map<String, Object> data = new HashMap<>();
        if (actorId != null) {
            data.put("actorId", actorId);
        }
        if (execution.currentStep() != null) {
            data.put("currentStep", execution.currentStep());
        }
        return store.appendLog(ExecutionLog.builder()
                        .executionId(execution.id())
                        .level(level)
                        .message(actorId != null ? message + " by " + actorId : message)
                        .data(data)
                        .timestamp(clock.instant())
                        .build())
                .then();
    }

    private void recordAction(String action, boolean success) {
        if (metrics != null) {
            metrics.recordControlAction(action, success);
        }
    }
}
