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

package org.fireflyframework.apiflow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.StepResultStatus;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics of the execution engine.
 * All metrics are prefixed with {@code firefly.apiflow.}.
 */
@Slf4j
public class ExecutionMetrics {

    public static final String METRIC_PREFIX = "firefly.apiflow.";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeExecutions = new AtomicInteger();

    public ExecutionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(METRIC_PREFIX + "executions.active", activeExecutions, AtomicInteger::get)
                .description("Executions currently being driven by a worker")
                .register(meterRegistry);
        log.info("ExecutionMetrics initialized");
    }

    // ==================== Execution Metrics ====================

    public void recordExecutionStarted(String workflowId) {
        counter("executions.started", "workflow.id", normalizeTag(workflowId)).increment();
        activeExecutions.incrementAndGet();
        log.debug("METRIC: executions.started workflowId={}", workflowId);
    }

    /**
     * Records a worker picking up an execution again after a retry delay or a resume.
     */
    public void recordExecutionContinued(String workflowId) {
        counter("executions.continued", "workflow.id", normalizeTag(workflowId)).increment();
        activeExecutions.incrementAndGet();
    }

    /**
     * Records an execution reaching a terminal status.
     */
    public void recordExecutionFinished(String workflowId, ExecutionStatus status, Duration duration) {
        String statusTag = status.name().toLowerCase();
        counter("executions.finished",
                "workflow.id", normalizeTag(workflowId),
                "status", statusTag)
                .increment();
        timer("executions.duration",
                "workflow.id", normalizeTag(workflowId),
                "status", statusTag)
                .record(duration != null ? duration : Duration.ZERO);
        activeExecutions.updateAndGet(current -> Math.max(0, current - 1));
        log.debug("METRIC: executions.finished workflowId={}, status={}", workflowId, status);
    }

    /**
     * Records a worker leaving an execution that is not terminal (paused or waiting for a retry).
     */
    public void recordExecutionSuspended(String workflowId, ExecutionStatus status) {
        counter("executions.suspended",
                "workflow.id", normalizeTag(workflowId),
                "status", status.name().toLowerCase())
                .increment();
        activeExecutions.updateAndGet(current -> Math.max(0, current - 1));
    }

    // ==================== Step Metrics ====================

    public void recordStepCompleted(String workflowId, String stepName, StepResultStatus status, Duration duration) {
        String statusTag = status.name().toLowerCase();
        counter("steps.completed",
                "workflow.id", normalizeTag(workflowId),
                "step.name", normalizeTag(stepName),
                "status", statusTag)
                .increment();
        timer("steps.duration",
                "workflow.id", normalizeTag(workflowId),
                "step.name", normalizeTag(stepName),
                "status", statusTag)
                .record(duration);
        log.debug("METRIC: steps.completed workflowId={}, step={}, status={}, durationMs={}",
                workflowId, stepName, status, duration.toMillis());
    }

    public void recordStepRetry(String workflowId, String stepName, int attempt) {
        counter("steps.retries",
                "workflow.id", normalizeTag(workflowId),
                "step.name", normalizeTag(stepName))
                .increment();
        log.debug("METRIC: steps.retry workflowId={}, step={}, attempt={}", workflowId, stepName, attempt);
    }

    // ==================== Coordination Metrics ====================

    public void recordStaleDelivery(String reason) {
        counter("deliveries.stale", "reason", normalizeTag(reason)).increment();
    }

    public void recordStoreConflict(String operation) {
        counter("store.conflicts", "operation", normalizeTag(operation)).increment();
    }

    public void recordControlAction(String action, boolean success) {
        counter("control.actions",
                "action", normalizeTag(action),
                "result", success ? "success" : "rejected")
                .increment();
    }

    public void recordRecovered(int count) {
        counter("recovery.requeued").increment(count);
    }

    public int getActiveExecutions() {
        return activeExecutions.get();
    }

    // ==================== Helper Methods ====================

    private Counter counter(String name, String... tags) {
        return Counter.builder(METRIC_PREFIX + name)
                .tags(tags)
                .register(meterRegistry);
    }

    private Timer timer(String name, String... tags) {
        return Timer.builder(METRIC_PREFIX + name)
                .tags(tags)
                .register(meterRegistry);
    }

    private static String normalizeTag(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
