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

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.apiflow.MutableClock;
import org.fireflyframework.apiflow.TestWorkflows;
import org.fireflyframework.apiflow.condition.ConditionEvaluator;
import org.fireflyframework.apiflow.condition.ConditionOperator;
import org.fireflyframework.apiflow.condition.ExpressionCondition;
import org.fireflyframework.apiflow.condition.FieldCondition;
import org.fireflyframework.apiflow.control.ExecutionControlService;
import org.fireflyframework.apiflow.metrics.ExecutionMetrics;
import org.fireflyframework.apiflow.model.ExecutionContext;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.LogLevel;
import org.fireflyframework.apiflow.model.StepError;
import org.fireflyframework.apiflow.model.StepErrorType;
import org.fireflyframework.apiflow.model.StepResult;
import org.fireflyframework.apiflow.model.StepResultStatus;
import org.fireflyframework.apiflow.model.StepRetryConfig;
import org.fireflyframework.apiflow.model.Workflow;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.model.WorkflowStatus;
import org.fireflyframework.apiflow.model.WorkflowStep;
import org.fireflyframework.apiflow.queue.InMemoryExecutionQueue;
import org.fireflyframework.apiflow.queue.QueueDelivery;
import org.fireflyframework.apiflow.queue.QueueStats;
import org.fireflyframework.apiflow.retry.BackoffSettings;
import org.fireflyframework.apiflow.retry.RetryBackoffPolicy;
import org.fireflyframework.apiflow.runner.StepOutcome;
import org.fireflyframework.apiflow.runner.StepRunner;
import org.fireflyframework.apiflow.store.InMemoryExecutionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExecutionCoordinator} against the in-memory store and queue,
 * with a scripted step runner.
 */
class ExecutionCoordinatorTest {

    private static final String EXECUTION_ID = "exec-1";
    private static final String FIRST_JOB = "job-1";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private MutableClock clock;
    private HookedStore store;
    private InMemoryExecutionQueue queue;
    private ScriptedStepRunner runner;
    private SimpleMeterRegistry meterRegistry;
    private ExecutionMetrics metrics;
    private ExecutionControlService controlService;
    private ExecutionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new HookedStore();
        queue = InMemoryExecutionQueue.builder().clock(clock).build();
        runner = new ScriptedStepRunner();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ExecutionMetrics(meterRegistry);
        controlService = new ExecutionControlService(store, queue, metrics, 3, clock);

        // zero jitter: 5s, 10s, 20s ...
        RetryBackoffPolicy retryPolicy = new RetryBackoffPolicy(
                new BackoffSettings(Duration.ofSeconds(5), Duration.ofMinutes(5), 2.0, 0.2), () -> 0.5);

        coordinator = new ExecutionCoordinator(store, runner, new ConditionEvaluator(), retryPolicy,
                queue, metrics, DEFAULT_TIMEOUT, clock);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private WorkflowExecution submit(Workflow workflow, int maxAttempts, Map<String, Object> parameters) {
        store.saveWorkflow(workflow).block();
        WorkflowExecution pending = WorkflowExecution.pending(EXECUTION_ID, workflow, "user-1", parameters,
                maxAttempts, FIRST_JOB, queue.getQueueName(), clock.instant());
        WorkflowExecution created = store.createExecution(pending).block();
        queue.enqueue(FIRST_JOB, EXECUTION_ID).block();
        return created;
    }

    private WorkflowExecution submit(Workflow workflow) {
        return submit(workflow, 3, Map.of());
    }

    private DeliveryOutcome deliver(String jobId) {
        return coordinator.handle(new QueueDelivery(jobId, EXECUTION_ID, queue.getQueueName(), 1, clock.instant()))
                .block();
    }

    private WorkflowExecution current() {
        return store.findExecution(EXECUTION_ID).block();
    }

    private List<ExecutionLog> logs() {
        return store.findLogs(EXECUTION_ID).collectList().block();
    }

    private static StepOutcome ok(Object output) {
        return new StepOutcome.Succeeded(output, 200);
    }

    private static StepOutcome http503() {
        return new StepOutcome.Failed(new StepError(StepErrorType.HTTP_ERROR, "HTTP 503", true, 503));
    }

    private double counter(String name, String... tags) {
        return meterRegistry.get(ExecutionMetrics.METRIC_PREFIX + name).tags(tags).counter().count();
    }

    // ========================================================================
    // Happy path
    // ========================================================================

    @Test
    @DisplayName("runs all steps in order and completes with a summary")
    void completesAllSteps() {
        submit(TestWorkflows.activeWithSteps(3));
        runner.script(1, Mono.just(ok(Map.of("id", "ord-9"))));

        DeliveryOutcome outcome = deliver(FIRST_JOB);

        assertThat(outcome.action()).isEqualTo(DeliveryOutcome.Action.ACK);
        WorkflowExecution completed = current();
        assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(completed.completedSteps()).isEqualTo(3);
        assertThat(completed.failedSteps()).isZero();
        assertThat(completed.currentStep()).isNull();
        assertThat(completed.queueJobId()).isNull();
        assertThat(completed.startedAt()).isEqualTo(clock.instant());
        assertThat(completed.stepResults()).extracting(StepResult::stepOrder).containsExactly(1, 2, 3);
        assertThat(runner.calls).containsExactly("1#1", "2#1", "3#1");

        @SuppressWarnings("unchecked")
        Map<String, Object> summary = (Map<String, Object>) completed.result();
        assertThat(summary).containsEntry("success", true)
                .containsEntry("totalSteps", 3)
                .containsEntry("completedSteps", 3)
                .containsEntry("skippedSteps", 0);
        Map<Integer, Object> outputs = (Map<Integer, Object>) summary.get("outputs");
        assertThat(outputs).containsEntry(1, Map.of("id", "ord-9"));

        assertThat(logs()).extracting(ExecutionLog::message)
                .startsWith("Execution started")
                .endsWith("Execution completed");
        assertThat(counter("executions.finished", "status", "completed")).isEqualTo(1.0);
        assertThat(metrics.getActiveExecutions()).isZero();
    }

    @Test
    @DisplayName("passes earlier step outputs to later steps and uses the step timeout")
    void passesContextAndTimeout() {
        submit(TestWorkflows.active(TestWorkflows.step(1), TestWorkflows.step(2).withTimeoutSeconds(5)),
                3, Map.of("customerId", 42));
        runner.script(1, Mono.just(ok(Map.of("id", "ord-9"))));

        deliver(FIRST_JOB);

        ExecutionContext secondContext = runner.contexts.get(1);
        assertThat(secondContext.lookup("step.1.id")).isEqualTo("ord-9");
        assertThat(secondContext.lookup("param.customerId")).isEqualTo(42);
        assertThat(runner.timeouts).containsExactly(DEFAULT_TIMEOUT, Duration.ofSeconds(5));
    }

    // ========================================================================
    // Retries
    // ========================================================================

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("step failing twice then succeeding completes with two failed attempts recorded")
        void retriesUntilSuccess() {
            submit(TestWorkflows.activeWithSteps(3));
            runner.script(2, Mono.just(http503()), Mono.just(http503()));
            Instant t0 = clock.instant();

            DeliveryOutcome first = deliver(FIRST_JOB);

            assertThat(first.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            WorkflowExecution retrying = current();
            assertThat(retrying.status()).isEqualTo(ExecutionStatus.RETRYING);
            assertThat(retrying.currentStep()).isEqualTo(1);
            assertThat(retrying.failedSteps()).isEqualTo(1);
            assertThat(retrying.retryState().attemptCount()).isEqualTo(1);
            assertThat(retrying.retryState().retryAfter()).isEqualTo(t0.plusSeconds(5));
            assertThat(retrying.queueJobId()).isNotEqualTo(FIRST_JOB);
            assertThat(queue.getStats().block()).isEqualTo(new QueueStats(1, 1, 0));

            clock.advance(Duration.ofSeconds(5));
            deliver(retrying.queueJobId());

            WorkflowExecution retryingAgain = current();
            assertThat(retryingAgain.status()).isEqualTo(ExecutionStatus.RETRYING);
            assertThat(retryingAgain.retryState().attemptCount()).isEqualTo(2);
            assertThat(retryingAgain.retryState().retryAfter()).isEqualTo(clock.instant().plusSeconds(10));
            assertThat(retryingAgain.failedSteps()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(10));
            DeliveryOutcome last = deliver(retryingAgain.queueJobId());

            assertThat(last.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            WorkflowExecution completed = current();
            assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(completed.completedSteps()).isEqualTo(3);
            assertThat(completed.failedSteps()).isZero();
            assertThat(completed.resultsForStep(2)).extracting(StepResult::status)
                    .containsExactly(StepResultStatus.FAILED, StepResultStatus.FAILED, StepResultStatus.SUCCEEDED);
            assertThat(completed.resultsForStep(2)).extracting(StepResult::attempt).containsExactly(1, 2, 3);
            assertThat(runner.calls).containsExactly("1#1", "2#1", "2#2", "2#3", "3#1");
            assertThat(counter("steps.retries", "step.name", "step-2")).isEqualTo(2.0);
            assertThat(metrics.getActiveExecutions()).isZero();
        }

        @Test
        @DisplayName("exhausting attempts fails the execution")
        void failsWhenAttemptsExhausted() {
            submit(TestWorkflows.activeWithSteps(2));
            runner.script(1, Mono.just(http503()), Mono.just(http503()), Mono.just(http503()));

            deliver(FIRST_JOB);
            clock.advance(Duration.ofSeconds(5));
            deliver(current().queueJobId());
            clock.advance(Duration.ofSeconds(10));
            DeliveryOutcome outcome = deliver(current().queueJobId());

            assertThat(outcome.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            WorkflowExecution failed = current();
            assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(failed.error()).contains("HTTP 503").contains("attempts exhausted (3/3)");
            assertThat(failed.result()).isNull();
            assertThat(failed.failedSteps()).isEqualTo(1);
            assertThat(failed.completedSteps()).isZero();
            assertThat(failed.currentStep()).isNull();
            assertThat(failed.queueJobId()).isNull();
            assertThat(failed.resultsForStep(1)).hasSize(3);
            assertThat(runner.calls).containsExactly("1#1", "1#2", "1#3");
            List<ExecutionLog> logs = logs();
            assertThat(logs.get(logs.size() - 1).level()).isEqualTo(LogLevel.ERROR);
        }

        @Test
        @DisplayName("non-retryable error fails on the first attempt")
        void failsImmediatelyOnPermanentError() {
            submit(TestWorkflows.activeWithSteps(2));
            runner.script(1, Mono.just(new StepOutcome.Failed(
                    new StepError(StepErrorType.HTTP_ERROR, "HTTP 404", false, 404))));

            deliver(FIRST_JOB);

            WorkflowExecution failed = current();
            assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(failed.error()).contains("non-retryable");
            assertThat(runner.calls).containsExactly("1#1");
            assertThat(queue.getStats().block().delayed()).isZero();
        }

        @Test
        @DisplayName("step retry override caps attempts below the execution default")
        void honoursStepRetryOverride() {
            submit(TestWorkflows.active(TestWorkflows.step(1).withRetryConfig(StepRetryConfig.maxAttempts(1))));
            runner.script(1, Mono.just(http503()));

            deliver(FIRST_JOB);

            WorkflowExecution failed = current();
            assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(failed.error()).contains("(1/1)");
            assertThat(failed.retryState().maxAttempts()).isEqualTo(3);
        }

        @Test
        @DisplayName("timeout schedules a retry strictly in the future")
        void timeoutSchedulesRetry() {
            submit(TestWorkflows.activeWithSteps(1));
            runner.script(1, Mono.just(new StepOutcome.Failed(
                    new StepError(StepErrorType.TIMEOUT, "Step timed out after 30000ms", true, null))));

            deliver(FIRST_JOB);

            WorkflowExecution retrying = current();
            assertThat(retrying.status()).isEqualTo(ExecutionStatus.RETRYING);
            assertThat(retrying.retryState().retryAfter()).isAfter(clock.instant());
            assertThat(retrying.stepResults().get(0).error().type()).isEqualTo(StepErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("retry delivered before it is due is deferred until retryAfter")
        void defersEarlyRetryDelivery() {
            submit(TestWorkflows.activeWithSteps(1));
            runner.script(1, Mono.just(http503()));
            deliver(FIRST_JOB);
            WorkflowExecution retrying = current();

            DeliveryOutcome early = deliver(retrying.queueJobId());

            assertThat(early.action()).isEqualTo(DeliveryOutcome.Action.DEFER);
            assertThat(early.redeliverAfter()).isEqualTo(retrying.retryState().retryAfter());
            assertThat(current().version()).isEqualTo(retrying.version());
            assertThat(runner.calls).containsExactly("1#1");
        }

        @Test
        @DisplayName("plan captured at start is kept when the workflow changes")
        void keepsPlanSnapshot() {
            submit(TestWorkflows.activeWithSteps(2));
            runner.script(2, Mono.just(http503()));
            deliver(FIRST_JOB);

            store.saveWorkflow(TestWorkflows.activeWithSteps(5)).block();
            clock.advance(Duration.ofSeconds(5));
            deliver(current().queueJobId());

            WorkflowExecution completed = current();
            assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(completed.totalSteps()).isEqualTo(2);
            assertThat(runner.calls).containsExactly("1#1", "2#1", "2#2");
        }
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("step whose condition is false is skipped and not counted")
        void skipsStep() {
            WorkflowStep conditional = TestWorkflows.step(2)
                    .withConditions(FieldCondition.of("param.express", ConditionOperator.EQUALS, true));
            submit(TestWorkflows.active(TestWorkflows.step(1), conditional, TestWorkflows.step(3)));

            deliver(FIRST_JOB);

            WorkflowExecution completed = current();
            assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(completed.completedSteps()).isEqualTo(2);
            assertThat(completed.failedSteps()).isZero();
            assertThat(completed.resultsForStep(2)).extracting(StepResult::status)
                    .containsExactly(StepResultStatus.SKIPPED);
            assertThat(runner.calls).containsExactly("1#1", "3#1");
            assertThat((Map<String, Object>) completed.result()).containsEntry("skippedSteps", 1);
        }

        @Test
        @DisplayName("malformed condition fails the execution without retrying")
        void failsOnMalformedCondition() {
            WorkflowStep broken = TestWorkflows.step(1).withConditions(new ExpressionCondition("#params[ >"));
            submit(TestWorkflows.active(broken));

            deliver(FIRST_JOB);

            WorkflowExecution failed = current();
            assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(failed.stepResults().get(0).error().type()).isEqualTo(StepErrorType.VALIDATION_ERROR);
            assertThat(runner.calls).isEmpty();
        }
    }

    // ========================================================================
    // Stale and duplicate deliveries
    // ========================================================================

    @Nested
    @DisplayName("Stale deliveries")
    class StaleDeliveries {

        @Test
        @DisplayName("delivery for a completed execution changes nothing")
        void terminalDeliveryIsNoop() {
            submit(TestWorkflows.activeWithSteps(1));
            deliver(FIRST_JOB);
            WorkflowExecution completed = current();

            DeliveryOutcome duplicate = deliver(FIRST_JOB);

            assertThat(duplicate.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            assertThat(current().version()).isEqualTo(completed.version());
            assertThat(runner.calls).hasSize(1);
            assertThat(counter("deliveries.stale", "reason", "job_mismatch")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("delivery of a superseded job is dropped")
        void supersededJobIsDropped() {
            submit(TestWorkflows.activeWithSteps(1));
            runner.script(1, Mono.just(http503()));
            deliver(FIRST_JOB);
            WorkflowExecution retrying = current();
            clock.advance(Duration.ofMinutes(1));

            DeliveryOutcome stale = deliver(FIRST_JOB);

            assertThat(stale.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            assertThat(stale.reason()).isEqualTo("stale job");
            assertThat(current().version()).isEqualTo(retrying.version());
            assertThat(runner.calls).containsExactly("1#1");
        }

        @Test
        @DisplayName("delivery for an unknown execution is acknowledged")
        void orphanDelivery() {
            DeliveryOutcome outcome = deliver("job-x");

            assertThat(outcome.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            assertThat(outcome.reason()).isEqualTo("execution not found");
        }

        @Test
        @DisplayName("execution whose workflow is gone fails")
        void missingWorkflowFails() {
            Workflow gone = new Workflow("wf-gone", "owner", "Gone", null, WorkflowStatus.ACTIVE,
                    List.of(TestWorkflows.step(1)), null, null);
            store.createExecution(WorkflowExecution.pending(EXECUTION_ID, gone, "user-1", Map.of(), 3,
                    FIRST_JOB, queue.getQueueName(), clock.instant())).block();

            deliver(FIRST_JOB);

            WorkflowExecution failed = current();
            assertThat(failed.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(failed.error()).isEqualTo("Workflow not found: wf-gone");
        }
    }

    // ========================================================================
    // Pause and cancel
    // ========================================================================

    @Nested
    @DisplayName("Pause and cancel")
    class PauseAndCancel {

        @Test
        @DisplayName("pause during a step keeps its result and resume continues at the next step")
        void pauseDuringStepThenResume() {
            submit(TestWorkflows.activeWithSteps(3));
            runner.script(1, controlService.pause(EXECUTION_ID, "ops").thenReturn(ok(Map.of("id", 1))));

            DeliveryOutcome outcome = deliver(FIRST_JOB);

            assertThat(outcome.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            WorkflowExecution paused = current();
            assertThat(paused.status()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(paused.currentStep()).isEqualTo(1);
            assertThat(paused.completedSteps()).isEqualTo(1);
            assertThat(paused.queueJobId()).isNull();
            assertThat(paused.pausedBy()).isEqualTo("ops");

            WorkflowExecution resumed = controlService.resume(EXECUTION_ID, "ops").block();
            deliver(resumed.queueJobId());

            WorkflowExecution completed = current();
            assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(completed.completedSteps()).isEqualTo(3);
            assertThat(runner.calls).containsExactly("1#1", "2#1", "3#1");
            assertThat(metrics.getActiveExecutions()).isZero();
        }

        @Test
        @DisplayName("pause between steps stops the worker before the next step")
        void pauseBetweenSteps() {
            submit(TestWorkflows.activeWithSteps(3));
            store.onLog(entry -> entry.message().equals("Step step-1 completed"),
                    () -> controlService.pause(EXECUTION_ID, "ops").block());

            DeliveryOutcome outcome = deliver(FIRST_JOB);

            assertThat(outcome.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            WorkflowExecution paused = current();
            assertThat(paused.status()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(paused.currentStep()).isEqualTo(1);
            assertThat(paused.queueJobId()).isNull();
            assertThat(runner.calls).containsExactly("1#1");
            assertThat(metrics.getActiveExecutions()).isZero();
        }

        @Test
        @DisplayName("pause before the first delivery releases the job and resume starts from step one")
        void pauseWhilePending() {
            submit(TestWorkflows.activeWithSteps(2));
            controlService.pause(EXECUTION_ID, "ops").block();

            DeliveryOutcome released = deliver(FIRST_JOB);

            assertThat(released.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            assertThat(current().queueJobId()).isNull();
            assertThat(runner.calls).isEmpty();

            WorkflowExecution resumed = controlService.resume(EXECUTION_ID, "ops").block();
            deliver(resumed.queueJobId());

            assertThat(current().status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(runner.calls).containsExactly("1#1", "2#1");
        }

        @Test
        @DisplayName("cancel during a step discards its result")
        void cancelDuringStep() {
            submit(TestWorkflows.activeWithSteps(2));
            runner.script(1, controlService.cancel(EXECUTION_ID, "ops").thenReturn(ok(Map.of())));

            DeliveryOutcome outcome = deliver(FIRST_JOB);

            assertThat(outcome.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            WorkflowExecution cancelled = current();
            assertThat(cancelled.status()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(cancelled.stepResults()).isEmpty();
            assertThat(cancelled.completedSteps()).isZero();
            assertThat(cancelled.cancelledBy()).isEqualTo("ops");
            assertThat(logs()).anyMatch(entry -> entry.level() == LogLevel.WARNING
                    && entry.message().contains("discarded"));
            assertThat(runner.calls).containsExactly("1#1");
        }

        @Test
        @DisplayName("paused while retrying, then cancelled: the retry job is dropped")
        void pausedWhileRetryingThenCancelled() {
            submit(TestWorkflows.activeWithSteps(2));
            runner.script(1, Mono.just(http503()));
            deliver(FIRST_JOB);
            String retryJob = current().queueJobId();

            controlService.pause(EXECUTION_ID, "ops").block();
            assertThat(queue.getStats().block().delayed()).isZero();

            clock.advance(Duration.ofSeconds(5));
            DeliveryOutcome released = deliver(retryJob);
            assertThat(released.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            assertThat(current().queueJobId()).isNull();

            controlService.cancel(EXECUTION_ID, "ops").block();
            WorkflowExecution cancelled = current();

            DeliveryOutcome duplicate = deliver(retryJob);

            assertThat(duplicate.action()).isEqualTo(DeliveryOutcome.Action.ACK);
            assertThat(current().status()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(current().version()).isEqualTo(cancelled.version());
            assertThat(runner.calls).containsExactly("1#1");
        }

        @Test
        @DisplayName("failed step committed while paused keeps the execution paused")
        void failureDuringPauseStaysPaused() {
            submit(TestWorkflows.activeWithSteps(2));
            runner.script(1, controlService.pause(EXECUTION_ID, "ops").thenReturn(http503()));

            deliver(FIRST_JOB);

            WorkflowExecution paused = current();
            assertThat(paused.status()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(paused.retryState().attemptCount()).isEqualTo(1);
            assertThat(paused.retryState().retryAfter()).isEqualTo(clock.instant().plusSeconds(5));
            assertThat(paused.failedSteps()).isEqualTo(1);
            assertThat(paused.queueJobId()).isNull();

            runner.script(1, Mono.just(ok(Map.of())));
            WorkflowExecution resumed = controlService.resume(EXECUTION_ID, "ops").block();
            assertThat(deliver(resumed.queueJobId()).action()).isEqualTo(DeliveryOutcome.Action.DEFER);

            clock.advance(Duration.ofSeconds(5));
            deliver(resumed.queueJobId());

            assertThat(current().status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(runner.calls).containsExactly("1#1", "1#2", "2#1");
        }

        @Test
        @DisplayName("resume before the retry is due keeps the backoff")
        void resumeBeforeRetryIsDueKeepsBackoff() {
            submit(TestWorkflows.activeWithSteps(2));
            runner.script(1, Mono.just(http503()));
            deliver(FIRST_JOB);
            Instant retryAfter = current().retryState().retryAfter();
            assertThat(retryAfter).isEqualTo(clock.instant().plusSeconds(5));

            controlService.pause(EXECUTION_ID, "ops").block();
            clock.advance(Duration.ofSeconds(1));
            WorkflowExecution resumed = controlService.resume(EXECUTION_ID, "ops").block();

            assertThat(resumed.status()).isEqualTo(ExecutionStatus.PENDING);
            assertThat(resumed.retryState().retryAfter()).isEqualTo(retryAfter);
            assertThat(queue.getStats().block().delayed()).isEqualTo(1);

            DeliveryOutcome early = deliver(resumed.queueJobId());

            assertThat(early.action()).isEqualTo(DeliveryOutcome.Action.DEFER);
            assertThat(early.redeliverAfter()).isEqualTo(retryAfter);
            assertThat(current().status()).isEqualTo(ExecutionStatus.PENDING);
            assertThat(runner.calls).containsExactly("1#1");

            clock.advance(Duration.ofSeconds(4));
            deliver(resumed.queueJobId());

            assertThat(current().status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(runner.calls).containsExactly("1#1", "1#2", "2#1");
        }
    }

    // ========================================================================
    // Test doubles
    // ========================================================================

    /**
     * Runs scripted outcomes per step order; unscripted attempts succeed.
     */
    private static final class ScriptedStepRunner implements StepRunner {

        private final Map<Integer, Deque<Mono<StepOutcome>>> scripts = new HashMap<>();
        private final List<String> calls = new ArrayList<>();
        private final List<ExecutionContext> contexts = new ArrayList<>();
        private final List<Duration> timeouts = new ArrayList<>();

        @SafeVarargs
        final void script(int stepOrder, Mono<StepOutcome>... outcomes) {
            Deque<Mono<StepOutcome>> queued = scripts.computeIfAbsent(stepOrder, order -> new ArrayDeque<>());
            queued.addAll(List.of(outcomes));
        }

        @Override
        public Mono<StepOutcome> run(WorkflowStep step, ExecutionContext context, Duration timeout) {
            calls.add(step.stepOrder() + "#" + context.attempt());
            contexts.add(context);
            timeouts.add(timeout);
            Deque<Mono<StepOutcome>> queued = scripts.get(step.stepOrder());
            if (queued == null || queued.isEmpty()) {
                return Mono.just(ok(Map.of("step", step.stepOrder())));
            }
            return queued.poll();
        }
    }

    /**
     * Store that can run an action right after a matching log entry is written.
     */
    private static final class HookedStore extends InMemoryExecutionStore {

        private Predicate<ExecutionLog> trigger;
        private Runnable action;

        void onLog(Predicate<ExecutionLog> trigger, Runnable action) {
            this.trigger = trigger;
            this.action = action;
        }

        @Override
        public Mono<ExecutionLog> appendLog(ExecutionLog entry) {
            return super.appendLog(entry).doOnNext(stored -> {
                if (trigger != null && trigger.test(stored)) {
                    Runnable pending = action;
                    trigger = null;
                    pending.run();
                }
            });
        }
    }
}
