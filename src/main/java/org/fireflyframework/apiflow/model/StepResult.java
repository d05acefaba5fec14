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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Record of a single step attempt, appended to {@link WorkflowExecution#stepResults()}.
 * <p>
 * {@code error} is present if and only if the status is FAILED.
 */
public record StepResult(
        int stepOrder,
        String stepName,
        int attempt,
        StepResultStatus status,
        Object output,
        StepError error,
        Instant startedAt,
        Instant finishedAt
) {

    public StepResult {
        Objects.requireNonNull(status, "status cannot be null");
        if (status == StepResultStatus.FAILED && error == null) {
            throw new IllegalArgumentException("FAILED step result requires an error");
        }
        if (status != StepResultStatus.FAILED && error != null) {
            throw new IllegalArgumentException(status + " step result cannot carry an error");
        }
    }

    public static StepResult succeeded(WorkflowStep step, int attempt, Object output,
                                       Instant startedAt, Instant finishedAt) {
        return new StepResult(step.stepOrder(), step.name(), attempt, StepResultStatus.SUCCEEDED,
                output, null, startedAt, finishedAt);
    }

    public static StepResult failed(WorkflowStep step, int attempt, StepError error,
                                    Instant startedAt, Instant finishedAt) {
        return new StepResult(step.stepOrder(), step.name(), attempt, StepResultStatus.FAILED,
                null, error, startedAt, finishedAt);
    }

    public static StepResult skipped(WorkflowStep step, int attempt, Instant at) {
        return new StepResult(step.stepOrder(), step.name(), attempt, StepResultStatus.SKIPPED,
                null, null, at, at);
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
