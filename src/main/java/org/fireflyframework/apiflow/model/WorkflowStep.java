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

import org.fireflyframework.apiflow.condition.StepCondition;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * A single API call within a {@link Workflow}.
 *
 * @param id the step identifier
 * @param workflowId the owning workflow
 * @param stepOrder position in the workflow, unique and strictly increasing
 * @param name display name
 * @param description optional description
 * @param action the call to make, formatted as {@code "METHOD /path"}
 * @param connectionRef reference handed to the credential resolver
 * @param parameters request parameters, may contain {@code {{...}}} placeholders
 * @param conditions optional predicate, the step is skipped when it evaluates to false
 * @param retryConfig optional override of the retry defaults
 * @param timeoutSeconds optional timeout, the engine default applies when null
 * @param nonIdempotent true when repeating the call after a timeout is unsafe
 * @param active inactive steps are left out of new executions
 */
public record WorkflowStep(
        String id,
        String workflowId,
        int stepOrder,
        String name,
        String description,
        String action,
        String connectionRef,
        Map<String, Object> parameters,
        StepCondition conditions,
        StepRetryConfig retryConfig,
        Integer timeoutSeconds,
        boolean nonIdempotent,
        boolean active
) {

    public WorkflowStep {
        Objects.requireNonNull(action, "action cannot be null");
        if (name == null) {
            name = "step-" + stepOrder;
        }
        if (parameters == null) {
            parameters = Map.of();
        }
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }
    }

    /**
     * Creates an active step with no conditions or overrides.
     */
    public static WorkflowStep of(int stepOrder, String name, String action, String connectionRef,
                                  Map<String, Object> parameters) {
        return new WorkflowStep(null, null, stepOrder, name, null, action, connectionRef,
                parameters, null, null, null, false, true);
    }

    public WorkflowStep withConditions(StepCondition condition) {
        return new WorkflowStep(id, workflowId, stepOrder, name, description, action, connectionRef,
                parameters, condition, retryConfig, timeoutSeconds, nonIdempotent, active);
    }

    public WorkflowStep withRetryConfig(StepRetryConfig config) {
        return new WorkflowStep(id, workflowId, stepOrder, name, description, action, connectionRef,
                parameters, conditions, config, timeoutSeconds, nonIdempotent, active);
    }

    public WorkflowStep withTimeoutSeconds(Integer seconds) {
        return new WorkflowStep(id, workflowId, stepOrder, name, description, action, connectionRef,
                parameters, conditions, retryConfig, seconds, nonIdempotent, active);
    }

    public WorkflowStep withNonIdempotent(boolean value) {
        return new WorkflowStep(id, workflowId, stepOrder, name, description, action, connectionRef,
                parameters, conditions, retryConfig, timeoutSeconds, value, active);
    }

    public WorkflowStep withActive(boolean value) {
        return new WorkflowStep(id, workflowId, stepOrder, name, description, action, connectionRef,
                parameters, conditions, retryConfig, timeoutSeconds, nonIdempotent, value);
    }

    public WorkflowStep withOwner(String stepId, String owningWorkflowId) {
        return new WorkflowStep(stepId, owningWorkflowId, stepOrder, name, description, action, connectionRef,
                parameters, conditions, retryConfig, timeoutSeconds, nonIdempotent, active);
    }

    /**
     * Gets the timeout to enforce for this step.
     *
     * @param defaultTimeout the engine-wide default
     * @return the step timeout
     */
    public Duration effectiveTimeout(Duration defaultTimeout) {
        return timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : defaultTimeout;
    }

    /**
     * Gets the number of attempts allowed for this step.
     *
     * @param executionMaxAttempts the execution-level default
     * @return the step override if present, otherwise the default
     */
    public int effectiveMaxAttempts(int executionMaxAttempts) {
        if (retryConfig != null && retryConfig.maxAttempts() != null) {
            return retryConfig.maxAttempts();
        }
        return executionMaxAttempts;
    }
}
